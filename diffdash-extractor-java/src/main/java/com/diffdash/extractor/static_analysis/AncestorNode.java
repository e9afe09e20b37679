package com.diffdash.extractor.static_analysis;

import java.nio.file.Path;

/**
 * A parent class or included/prepended module resolved to a file,
 * {@code depth} hops away from the changed file. {@code analysis} is that file visited at {@code depth}.
 */
public record AncestorNode(String name, Path file, int depth, Kind kind, FileAnalysis analysis) {

    public enum Kind { CLASS, MODULE }
}
