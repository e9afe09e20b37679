package com.diffdash.extractor.static_analysis;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the non-test Ruby files under a top-level directory of the repository ({@code app}, {@code lib}).
 * Listings are computed once per directory and sorted.
 */
public class RubySourceIndex {

    private final Path repoRoot;
    private final Map<String, List<Path>> filesByDir = new HashMap<>();

    public RubySourceIndex(Path repoRoot) {
        this.repoRoot = repoRoot.toAbsolutePath().normalize();
    }

    public List<Path> sourceFiles(String topLevelDir) {
        return filesByDir.computeIfAbsent(topLevelDir, this::collectSourceFiles);
    }

    /**
     * Spec/test code never defines production ancestors: any path with a {@code spec} or {@code test}
     * directory below the repository root, or a {@code _spec.rb}/{@code _test.rb} file.
     */
    public boolean isTestPath(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path inRepo = absolute.startsWith(repoRoot) ? repoRoot.relativize(absolute) : absolute;
        String fileName = inRepo.getFileName() != null ? inRepo.getFileName().toString() : "";
        if (fileName.endsWith("_spec.rb") || fileName.endsWith("_test.rb")) return true;
        for (int i = 0; i < inRepo.getNameCount() - 1; i++) {
            String dir = inRepo.getName(i).toString();
            if ("spec".equals(dir) || "test".equals(dir)) return true;
        }
        return false;
    }

    private List<Path> collectSourceFiles(String topLevelDir) {
        Path root = repoRoot.resolve(topLevelDir);
        if (!Files.isDirectory(root)) return Collections.emptyList();
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                .filter(p -> p.toString().endsWith(".rb"))
                .filter(Files::isRegularFile)
                .filter(p -> !isTestPath(p))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            System.err.println("[diffdash] Warning: could not walk source tree " + root + ": " + e.getMessage());
            return Collections.emptyList();
        }
    }
}
