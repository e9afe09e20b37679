package com.diffdash.extractor.static_analysis;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Parse + visit for a single file. Syntax errors and unreadable files degrade to an
 * empty {@link FileAnalysis} with a warning on stderr; they never abort the run.
 */
public class SourceAnalyzer {

    private final RubySourceParser parser;
    private final DetectionRules rules;

    public SourceAnalyzer(RubySourceParser parser, DetectionRules rules) {
        this.parser = parser;
        this.rules = rules;
    }

    public FileAnalysis analyze(String source, String filePath, int inheritanceDepth) {
        Optional<RubyNode> root = parser.parse(source, filePath);
        if (root.isEmpty()) {
            System.err.println("[diffdash] Warning: syntax error in " + filePath + ", skipping");
            return FileAnalysis.empty(filePath, inheritanceDepth);
        }
        SignalVisitor visitor = new SignalVisitor(filePath, inheritanceDepth, rules);
        visitor.visit(root.get());
        return visitor.toAnalysis();
    }

    public FileAnalysis analyzeFile(Path file, int inheritanceDepth) {
        String filePath = file.toString();
        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            return analyze(source, filePath, inheritanceDepth);
        } catch (IOException e) {
            System.err.println("[diffdash] Warning: could not read " + filePath + ": " + e.getMessage());
            return FileAnalysis.empty(filePath, inheritanceDepth);
        }
    }
}
