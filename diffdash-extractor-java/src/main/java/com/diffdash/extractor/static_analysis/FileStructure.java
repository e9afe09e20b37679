package com.diffdash.extractor.static_analysis;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Structural facts extracted from one file: class and module definitions
 * and the include/prepend/extend relations declared inside them.
 */
public record FileStructure(
    List<ClassStructure> classes,
    List<ModuleStructure> modules,
    List<ModuleRelation> relations
) {

    public static final FileStructure EMPTY = new FileStructure(List.of(), List.of(), List.of());

    public FileStructure {
        classes = List.copyOf(classes);
        modules = List.copyOf(modules);
        relations = List.copyOf(relations);
    }

    public List<ModuleRelation> relations(RelationKind kind) {
        return relations.stream()
            .filter(r -> r.kind() == kind)
            .collect(Collectors.toList());
    }

    /** {@code parentName} is null when the class has no explicit superclass. */
    public record ClassStructure(String qualifiedName, String parentName, String file) {}

    public record ModuleStructure(String qualifiedName, String file) {}

    public record ModuleRelation(String moduleName, String includingClass, RelationKind kind, String file) {}

    public enum RelationKind {
        INCLUDE, PREPEND, EXTEND;

        static RelationKind fromMethod(String method) {
            return switch (method) {
                case "include" -> INCLUDE;
                case "prepend" -> PREPEND;
                case "extend"  -> EXTEND;
                default -> null;
            };
        }
    }
}
