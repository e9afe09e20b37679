package com.diffdash.extractor.signal;

import com.google.gson.annotations.SerializedName;

public enum SignalType {
    @SerializedName("log")       LOG,
    @SerializedName("counter")   COUNTER,
    @SerializedName("gauge")     GAUGE,
    @SerializedName("histogram") HISTOGRAM,
    @SerializedName("summary")   SUMMARY;

    /** Lower-case name as it appears in reports and metadata. */
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }

    public boolean isMetric() {
        return this != LOG;
    }
}
