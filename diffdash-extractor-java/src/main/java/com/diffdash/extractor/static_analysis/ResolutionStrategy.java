package com.diffdash.extractor.static_analysis;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One way of mapping a class or module name to the file that defines it.
 */
public interface ResolutionStrategy {

    /**
     * @param name        constant as referenced, e.g. {@code Payments::Gateway}
     * @param currentFile file containing the reference
     */
    Optional<Path> resolve(String name, Path currentFile);
}
