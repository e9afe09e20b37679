package com.diffdash.extractor.static_analysis;

import com.diffdash.extractor.signal.SignalType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves metric constants to the metric they register.
 *
 * Scanning {@code module Metrics; RequestTotal = Hesiod.register_counter("request_total"); end}
 * registers {@code Metrics::RequestTotal -> request_total (counter)}, so that
 * {@code Metrics::RequestTotal.increment} elsewhere can be reported by name.
 */
public class MetricConstantResolver {

    public record MetricConstantEntry(String name, SignalType type) {}

    private final RubySourceParser parser;
    private final DetectionRules rules;
    private final Map<String, MetricConstantEntry> constants = new LinkedHashMap<>();

    public MetricConstantResolver(RubySourceParser parser, DetectionRules rules) {
        this.parser = parser;
        this.rules = rules;
    }

    /** Scan one source text; unparseable sources register nothing. */
    public void scan(String source, String filePath) {
        parser.parse(source, filePath).ifPresent(root -> scanNode(root, List.of()));
    }

    /** Scan a file if it exists; unreadable files are skipped with a warning. */
    public void scanFile(Path file) {
        if (!Files.isRegularFile(file)) return;
        try {
            scan(Files.readString(file, StandardCharsets.UTF_8), file.toString());
        } catch (IOException e) {
            System.err.println("[diffdash] Warning: could not read metric definitions " + file + ": " + e.getMessage());
        }
    }

    public Optional<MetricConstantEntry> resolve(String constantName) {
        if (constantName == null) return Optional.empty();
        return Optional.ofNullable(constants.get(constantName));
    }

    /**
     * Resolve as written first, then relative to each enclosing namespace, innermost first.
     * {@code RequestTotal} inside {@code Metrics::Worker} tries {@code RequestTotal},
     * {@code Metrics::Worker::RequestTotal}, {@code Metrics::RequestTotal}.
     */
    public Optional<MetricConstantEntry> resolve(String constantName, String namespace) {
        Optional<MetricConstantEntry> direct = resolve(constantName);
        if (direct.isPresent() || constantName == null || namespace == null || namespace.isEmpty()) {
            return direct;
        }
        String prefix = namespace;
        while (!prefix.isEmpty()) {
            MetricConstantEntry entry = constants.get(prefix + "::" + constantName);
            if (entry != null) return Optional.of(entry);
            int cut = prefix.lastIndexOf("::");
            prefix = cut < 0 ? "" : prefix.substring(0, cut);
        }
        return Optional.empty();
    }

    public Map<String, MetricConstantEntry> constantMap() {
        return Collections.unmodifiableMap(constants);
    }

    private void scanNode(RubyNode node, List<String> namespace) {
        switch (node.kind()) {
            case MODULE, CLASS -> {
                List<String> nested = new ArrayList<>(namespace);
                String name = node.child(0).constPath();
                if (name != null) nested.add(name);
                List<RubyNode> children = node.children();
                for (int i = 1; i < children.size(); i++) {
                    scanNode(children.get(i), nested);
                }
            }
            case CASGN -> register(node, namespace);
            default -> node.children().forEach(child -> scanNode(child, namespace));
        }
    }

    private void register(RubyNode assignment, List<String> namespace) {
        RubyNode value = assignment.child(1);
        if (!value.is(NodeKind.CALL) || !SignalVisitor.isFactoryMethod(value.text())) return;
        if (!rules.isMetricReceiver(value.receiver().constPath())) return;

        String metricName = SignalVisitor.literalName(value.argument(0));
        if (metricName == null) return;

        List<String> parts = new ArrayList<>(namespace);
        String explicitScope = assignment.child(0).constPath();
        if (explicitScope != null) parts.add(explicitScope);
        parts.add(assignment.text());

        constants.put(String.join("::", parts), new MetricConstantEntry(metricName, SignalVisitor.typeOf(value.text())));
    }
}
