package com.diffdash.extractor.static_analysis;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Fallback for names that do not follow the file naming convention:
 * searches {@code app/} and {@code lib/} for a line opening {@code class <Name>}, then {@code module <Name>}.
 */
public class TextSearchResolutionStrategy implements ResolutionStrategy {

    private final RubySourceIndex index;

    public TextSearchResolutionStrategy(RubySourceIndex index) {
        this.index = index;
    }

    @Override
    public Optional<Path> resolve(String name, Path currentFile) {
        for (String keyword : List.of("class", "module")) {
            Pattern definition = Pattern.compile(
                "^\\s*" + keyword + "\\s+" + Pattern.quote(name) + "\\b", Pattern.MULTILINE);
            for (String topLevelDir : List.of("app", "lib")) {
                for (Path file : index.sourceFiles(topLevelDir)) {
                    if (defines(file, definition)) {
                        return Optional.of(file);
                    }
                }
            }
        }
        return Optional.empty();
    }

    private boolean defines(Path file, Pattern definition) {
        try {
            return definition.matcher(Files.readString(file, StandardCharsets.UTF_8)).find();
        } catch (IOException e) {
            System.err.println("[diffdash] Warning: could not search " + file + ": " + e.getMessage());
            return false;
        }
    }
}
