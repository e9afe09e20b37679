package com.diffdash.extractor.signal;

import com.google.gson.annotations.SerializedName;

/**
 * A metric-shaped call whose name argument is not a literal, so it cannot become a {@link Signal}.
 * Reported separately to show where static coverage is incomplete.
 */
public record DynamicMetricCall(
    @SerializedName("receiver")       String receiver,
    @SerializedName("type")           SignalType metricType,
    @SerializedName("defining_class") String definingClass,
    @SerializedName("file")           String file,
    @SerializedName("line")           int line
) {}
