package com.diffdash.extractor.static_analysis;

/**
 * An action call on a constant that is not a metric client, e.g. {@code Metrics::RequestTotal.increment}.
 * Becomes a signal only if the constant was registered in a metric definitions file.
 *
 * @param namespace lexical namespace of the call site, empty at top level
 */
public record MetricConstantReference(
    String constantPath,
    String method,
    String definingClass,
    String namespace,
    int line
) {}
