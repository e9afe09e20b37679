package com.diffdash.extractor.static_analysis;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Rails-style autoload convention: {@code Payments::GatewayClient} lives in {@code payments/gateway_client.rb}.
 * Probes next to the referencing file, its parent directory and its {@code concerns/} directory,
 * then anywhere under {@code app/} and {@code lib/}.
 */
public class ConventionResolutionStrategy implements ResolutionStrategy {

    private final RubySourceIndex index;

    public ConventionResolutionStrategy(RubySourceIndex index) {
        this.index = index;
    }

    @Override
    public Optional<Path> resolve(String name, Path currentFile) {
        Path relative = Path.of(toRelativePath(name) + ".rb");
        Path currentDir = currentFile.toAbsolutePath().normalize().getParent();

        if (currentDir != null) {
            List<Path> nearby = List.of(
                currentDir.resolve(relative),
                currentDir.resolve("..").resolve(relative).normalize(),
                currentDir.resolve("concerns").resolve(relative)
            );
            for (Path candidate : nearby) {
                if (Files.isRegularFile(candidate) && !index.isTestPath(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }

        for (String topLevelDir : List.of("app", "lib")) {
            for (Path candidate : index.sourceFiles(topLevelDir)) {
                if (candidate.endsWith(relative)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    /** {@code Admin::HTTPClient} becomes {@code admin/http_client}. */
    static String toRelativePath(String name) {
        return name
            .replace("::", "/")
            .replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2")
            .replaceAll("([a-z\\d])([A-Z])", "$1_$2")
            .toLowerCase(java.util.Locale.ROOT);
    }
}
