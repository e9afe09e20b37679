package com.diffdash.extractor.static_analysis;

import com.diffdash.extractor.signal.DynamicMetricCall;
import com.diffdash.extractor.signal.Signal;

import java.util.List;

/**
 * Everything one visit of one file produced.
 */
public record FileAnalysis(
    String file,
    int inheritanceDepth,
    FileStructure structure,
    List<Signal> signals,
    List<DynamicMetricCall> dynamicMetricCalls,
    List<MetricConstantReference> constantReferences
) {

    public FileAnalysis {
        signals = List.copyOf(signals);
        dynamicMetricCalls = List.copyOf(dynamicMetricCalls);
        constantReferences = List.copyOf(constantReferences);
    }

    /** Result for a file that could not be read or parsed. */
    public static FileAnalysis empty(String file, int inheritanceDepth) {
        return new FileAnalysis(file, inheritanceDepth, FileStructure.EMPTY, List.of(), List.of(), List.of());
    }
}
