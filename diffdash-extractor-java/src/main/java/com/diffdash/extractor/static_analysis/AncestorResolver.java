package com.diffdash.extractor.static_analysis;

import com.diffdash.extractor.static_analysis.FileStructure.ClassStructure;
import com.diffdash.extractor.static_analysis.FileStructure.ModuleRelation;
import com.diffdash.extractor.static_analysis.FileStructure.RelationKind;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the parent classes and mixed-in modules of a file, resolving each to the file that defines it.
 *
 * Resolution is memoized per instance and keyed by the name as written, so two different constants
 * spelled the same way in different namespaces share one answer.
 */
public class AncestorResolver {

    public static final int MAX_DEPTH = 5;

    private final SourceAnalyzer analyzer;
    private final List<ResolutionStrategy> strategies;
    private final Map<String, Optional<Path>> cache = new HashMap<>();

    public AncestorResolver(SourceAnalyzer analyzer, List<ResolutionStrategy> strategies) {
        this.analyzer = analyzer;
        this.strategies = List.copyOf(strategies);
    }

    /** Convention lookup first, repository text search second. */
    public static AncestorResolver forRepository(Path repoRoot, SourceAnalyzer analyzer) {
        RubySourceIndex index = new RubySourceIndex(repoRoot);
        return new AncestorResolver(analyzer, List.of(
            new ConventionResolutionStrategy(index),
            new TextSearchResolutionStrategy(index)
        ));
    }

    public Optional<Path> resolve(String name, Path currentFile) {
        if (name == null || name.isEmpty()) return Optional.empty();
        Optional<Path> cached = cache.get(name);
        if (cached != null) return cached;

        Optional<Path> resolved = Optional.empty();
        for (ResolutionStrategy strategy : strategies) {
            resolved = strategy.resolve(name, currentFile);
            if (resolved.isPresent()) break;
        }
        cache.put(name, resolved);
        return resolved;
    }

    /** Ancestors of everything declared in {@code structure}, starting from a changed file at depth 0. */
    public List<AncestorNode> collectAncestors(FileStructure structure, Path currentFile) {
        List<AncestorNode> result = new ArrayList<>();
        collectAncestors(structure, currentFile, 0, new HashSet<>(), result);
        return result;
    }

    /**
     * Depth-first walk: parents, then includes, then prepends. {@code visited} is shared across the
     * whole walk so cycles terminate and each name is reported once.
     */
    public void collectAncestors(FileStructure structure, Path currentFile, int depth,
                                 Set<String> visited, List<AncestorNode> result) {
        if (depth >= MAX_DEPTH) return;

        for (ClassStructure cls : structure.classes()) {
            walk(cls.parentName(), AncestorNode.Kind.CLASS, currentFile, depth, visited, result);
        }
        for (ModuleRelation include : structure.relations(RelationKind.INCLUDE)) {
            walk(include.moduleName(), AncestorNode.Kind.MODULE, currentFile, depth, visited, result);
        }
        for (ModuleRelation prepend : structure.relations(RelationKind.PREPEND)) {
            walk(prepend.moduleName(), AncestorNode.Kind.MODULE, currentFile, depth, visited, result);
        }
    }

    private void walk(String name, AncestorNode.Kind kind, Path currentFile, int depth,
                      Set<String> visited, List<AncestorNode> result) {
        if (name == null || visited.contains(name)) return;

        Optional<Path> file = resolve(name, currentFile);
        if (file.isEmpty() || !Files.isRegularFile(file.get())) return;

        visited.add(name);
        int ancestorDepth = depth + 1;
        FileAnalysis analysis = analyzer.analyzeFile(file.get(), ancestorDepth);
        result.add(new AncestorNode(name, file.get(), ancestorDepth, kind, analysis));

        collectAncestors(analysis.structure(), file.get(), ancestorDepth, visited, result);
    }
}
