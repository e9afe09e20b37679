package com.diffdash.extractor.static_analysis;

import com.diffdash.extractor.signal.DynamicMetricCall;
import com.diffdash.extractor.signal.Signal;

import java.util.List;

/**
 * Output of one collection run: deduplicated signals in discovery order plus the
 * metric calls that could not be named statically.
 */
public record CollectionResult(
    List<Signal> signals,
    List<DynamicMetricCall> dynamicMetricCalls
) {

    public CollectionResult {
        signals = List.copyOf(signals);
        dynamicMetricCalls = List.copyOf(dynamicMetricCalls);
    }
}
