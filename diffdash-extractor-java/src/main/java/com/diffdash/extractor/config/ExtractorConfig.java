package com.diffdash.extractor.config;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deserialized form of the optional diffdash.json configuration file.
 * Every field may be omitted; the getters supply the defaults.
 */
public class ExtractorConfig {

    static final List<String> DEFAULT_METRIC_RECEIVERS =
        List.of("Prometheus", "StatsD", "Statsd", "Hesiod", "Datadog", "DogStatsD");
    static final List<String> DEFAULT_LOG_NAMESPACES = List.of("Rails");
    static final List<String> DEFAULT_LOGGING_TRAITS =
        List.of("Loggy::ClassLogger", "Loggy::InstanceLogger");

    /** Constants treated as metric clients, replacing the defaults when present. */
    @SerializedName("metric_receivers")
    private List<String> metricReceivers;

    /** Constants whose {@code logger} method is a log receiver. */
    @SerializedName("log_namespaces")
    private List<String> logNamespaces;

    /** Modules that turn a bare {@code log(...)} into a structured log call. */
    @SerializedName("logging_traits")
    private List<String> loggingTraits;

    /** Extra repo-relative files scanned for metric constant definitions. */
    @SerializedName("metric_definition_paths")
    private List<String> metricDefinitionPaths;

    @SerializedName("exclude_interpolated_logs")
    private Boolean excludeInterpolatedLogs;

    public Set<String> getMetricReceivers() { return orDefault(metricReceivers, DEFAULT_METRIC_RECEIVERS); }
    public Set<String> getLogNamespaces()   { return orDefault(logNamespaces, DEFAULT_LOG_NAMESPACES); }
    public Set<String> getLoggingTraits()   { return orDefault(loggingTraits, DEFAULT_LOGGING_TRAITS); }

    public List<String> getMetricDefinitionPaths() {
        return metricDefinitionPaths != null ? metricDefinitionPaths : Collections.emptyList();
    }

    public boolean isExcludeInterpolatedLogs() {
        return excludeInterpolatedLogs != null && excludeInterpolatedLogs;
    }

    public void setExcludeInterpolatedLogs(boolean excludeInterpolatedLogs) {
        this.excludeInterpolatedLogs = excludeInterpolatedLogs;
    }

    private static Set<String> orDefault(List<String> configured, List<String> defaults) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(configured != null ? configured : defaults));
    }
}
