package com.diffdash.extractor.signal;

import com.google.gson.annotations.SerializedName;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One detected observability call site.
 *
 * Metadata keys: {@code level}, {@code interpolated}, {@code line} for logs;
 * {@code metric_type}, {@code line} for metrics.
 */
public record Signal(
    @SerializedName("type")              SignalType type,
    @SerializedName("name")              String name,
    @SerializedName("source_file")       String sourceFile,
    @SerializedName("defining_class")    String definingClass,
    @SerializedName("inheritance_depth") int inheritanceDepth,
    @SerializedName("metadata")          Map<String, Object> metadata
) {

    public static final String TOP_LEVEL = "(top-level)";

    public Signal {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Signal log(String name, String sourceFile, String definingClass, int inheritanceDepth,
                             String level, boolean interpolated, int line) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("level", level);
        metadata.put("interpolated", interpolated);
        metadata.put("line", line);
        return new Signal(SignalType.LOG, name, sourceFile, definingClass, inheritanceDepth, metadata);
    }

    public static Signal metric(SignalType type, String name, String sourceFile, String definingClass,
                                int inheritanceDepth, int line) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("metric_type", type.wireName());
        metadata.put("line", line);
        return new Signal(type, name, sourceFile, definingClass, inheritanceDepth, metadata);
    }

    public boolean isLog()    { return type == SignalType.LOG; }
    public boolean isMetric() { return type.isMetric(); }

    public String level() {
        Object level = metadata.get("level");
        return level != null ? level.toString() : null;
    }

    public boolean isInterpolated() {
        return Boolean.TRUE.equals(metadata.get("interpolated"));
    }

    public int line() {
        Object line = metadata.get("line");
        return line instanceof Number ? ((Number) line).intValue() : 0;
    }

    /** Identity used for deduplication: (type, name, source_file, defining_class). */
    public List<Object> dedupKey() {
        return Arrays.asList(type, name, sourceFile, definingClass);
    }
}
