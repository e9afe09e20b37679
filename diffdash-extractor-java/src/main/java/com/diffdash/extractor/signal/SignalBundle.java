package com.diffdash.extractor.signal;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Collected signals split by kind, ready for reporting.
 */
public record SignalBundle(
    List<Signal> logs,
    List<Signal> metrics,
    List<DynamicMetricCall> dynamicMetricCalls
) {

    public SignalBundle {
        logs = List.copyOf(logs);
        metrics = List.copyOf(metrics);
        dynamicMetricCalls = List.copyOf(dynamicMetricCalls);
    }

    public static SignalBundle of(List<Signal> signals, List<DynamicMetricCall> dynamicMetricCalls) {
        return new SignalBundle(
            signals.stream().filter(Signal::isLog).collect(Collectors.toList()),
            signals.stream().filter(Signal::isMetric).collect(Collectors.toList()),
            dynamicMetricCalls
        );
    }

    /** Logs whose message embeds runtime values cannot be matched as a stable event; drop them. */
    public SignalBundle withoutInterpolatedLogs() {
        List<Signal> literalLogs = logs.stream()
            .filter(log -> !log.isInterpolated())
            .collect(Collectors.toList());
        return new SignalBundle(literalLogs, metrics, dynamicMetricCalls);
    }

    public int size() {
        return logs.size() + metrics.size();
    }
}
