package com.diffdash.extractor.static_analysis;

import com.diffdash.extractor.config.ExtractorConfig;

import java.util.Set;

/**
 * Allow-lists consulted while matching call sites.
 *
 * @param metricReceivers constants treated as metric clients ({@code StatsD.increment})
 * @param logNamespaces   constants whose {@code .logger} is a log receiver ({@code Rails.logger.info})
 * @param loggingTraits   modules that make a bare {@code log(...)} a structured log call
 */
public record DetectionRules(
    Set<String> metricReceivers,
    Set<String> logNamespaces,
    Set<String> loggingTraits
) {

    public DetectionRules {
        metricReceivers = Set.copyOf(metricReceivers);
        logNamespaces = Set.copyOf(logNamespaces);
        loggingTraits = Set.copyOf(loggingTraits);
    }

    public static DetectionRules defaults() {
        return from(new ExtractorConfig());
    }

    public static DetectionRules from(ExtractorConfig config) {
        return new DetectionRules(config.getMetricReceivers(), config.getLogNamespaces(), config.getLoggingTraits());
    }

    public boolean isMetricReceiver(String constant) {
        return constant != null && metricReceivers.contains(constant);
    }

    public boolean isLogNamespace(String constant) {
        return constant != null && logNamespaces.contains(constant);
    }

    public boolean isLoggingTrait(String module) {
        return module != null && loggingTraits.contains(module);
    }
}
