package com.diffdash.extractor.static_analysis;

import com.diffdash.extractor.config.ExtractorConfig;
import com.diffdash.extractor.signal.DynamicMetricCall;
import com.diffdash.extractor.signal.Signal;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Orchestrates one extraction run over a set of changed files.
 * Each changed file is analyzed at depth 0, then every ancestor it reaches is analyzed at its own depth.
 * Metric constants are resolved against definitions found in the well-known locations and in the changed files.
 */
public class SignalCollector {

    static final List<String> METRIC_DEFINITION_PATHS = List.of(
        "app/services/metrics.rb",
        "app/lib/metrics.rb",
        "app/models/metrics.rb",
        "lib/metrics.rb",
        "config/initializers/metrics.rb"
    );

    private final Path repoRoot;
    private final ExtractorConfig config;
    private final DetectionRules rules;

    public SignalCollector(Path repoRoot) {
        this(repoRoot, new ExtractorConfig());
    }

    public SignalCollector(Path repoRoot, ExtractorConfig config) {
        this.repoRoot = repoRoot.toAbsolutePath().normalize();
        this.config = config;
        this.rules = DetectionRules.from(config);
    }

    public CollectionResult collect(List<Path> files) {
        // ancestors come back absolute; changed files must match them for deduplication
        List<Path> changedFiles = new ArrayList<>();
        for (Path file : files) {
            changedFiles.add(file.toAbsolutePath().normalize());
        }

        RubySourceParser parser = new RubySourceParser();
        SourceAnalyzer analyzer = new SourceAnalyzer(parser, rules);

        // 1. Metric constant definitions
        MetricConstantResolver constants = new MetricConstantResolver(parser, rules);
        for (Path definitions : metricDefinitionFiles(changedFiles)) {
            constants.scanFile(definitions);
        }
        System.err.println("[diffdash] Registered " + constants.constantMap().size() + " metric constant(s)");

        // 2. Changed files and their ancestors
        AncestorResolver ancestors = AncestorResolver.forRepository(repoRoot, analyzer);
        List<Signal> signals = new ArrayList<>();
        List<DynamicMetricCall> dynamicCalls = new ArrayList<>();

        for (Path file : changedFiles) {
            if (!Files.isRegularFile(file)) {
                System.err.println("[diffdash] Warning: skipping missing file " + file);
                continue;
            }
            FileAnalysis analysis = analyzer.analyzeFile(file, 0);
            fold(analysis, constants, signals, dynamicCalls);

            for (AncestorNode ancestor : ancestors.collectAncestors(analysis.structure(), file)) {
                fold(ancestor.analysis(), constants, signals, dynamicCalls);
            }
        }

        // 3. Deduplicate
        List<Signal> unique = deduplicate(signals);
        List<DynamicMetricCall> uniqueDynamic = new ArrayList<>(new LinkedHashSet<>(dynamicCalls));
        System.err.println("[diffdash] Collected " + unique.size() + " signal(s), "
            + uniqueDynamic.size() + " dynamic metric call(s) from " + changedFiles.size() + " file(s)");
        return new CollectionResult(unique, uniqueDynamic);
    }

    private List<Path> metricDefinitionFiles(List<Path> changedFiles) {
        Set<Path> files = new LinkedHashSet<>();
        for (String relative : METRIC_DEFINITION_PATHS) {
            files.add(repoRoot.resolve(relative));
        }
        for (String relative : config.getMetricDefinitionPaths()) {
            files.add(repoRoot.resolve(relative).normalize());
        }
        files.addAll(changedFiles);
        return new ArrayList<>(files);
    }

    private void fold(FileAnalysis analysis, MetricConstantResolver constants,
                      List<Signal> signals, List<DynamicMetricCall> dynamicCalls) {
        signals.addAll(analysis.signals());
        for (MetricConstantReference reference : analysis.constantReferences()) {
            Optional<MetricConstantResolver.MetricConstantEntry> entry =
                constants.resolve(reference.constantPath(), reference.namespace());
            entry.ifPresent(e -> signals.add(Signal.metric(e.type(), e.name(), analysis.file(),
                reference.definingClass(), analysis.inheritanceDepth(), reference.line())));
        }
        dynamicCalls.addAll(analysis.dynamicMetricCalls());
    }

    static List<Signal> deduplicate(List<Signal> signals) {
        Set<List<Object>> seen = new HashSet<>();
        List<Signal> unique = new ArrayList<>();
        for (Signal signal : signals) {
            if (seen.add(signal.dedupKey())) {
                unique.add(signal);
            }
        }
        return unique;
    }
}
