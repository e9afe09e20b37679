package com.diffdash.extractor.static_analysis;

import java.util.List;

/**
 * One node of the simplified Ruby AST: a kind, its source text (meaning depends on kind),
 * its 1-based start line and ordered children. Child positions per kind are listed on {@link NodeKind}.
 */
public record RubyNode(
    NodeKind kind,
    String text,
    int line,
    List<RubyNode> children
) {

    /** Placeholder for an absent child (no receiver, no superclass, no scope). */
    public static final RubyNode NIL = new RubyNode(NodeKind.NIL, "", 0, List.of());

    public RubyNode {
        children = List.copyOf(children);
    }

    public boolean is(NodeKind k) { return kind == k; }

    public boolean isNil() { return kind == NodeKind.NIL; }

    public RubyNode child(int index) {
        return index < children.size() ? children.get(index) : NIL;
    }

    /** CALL only: the receiver, or {@link #NIL} for a receiverless call. */
    public RubyNode receiver() { return child(0); }

    /** CALL only: positional and keyword arguments in source order. */
    public List<RubyNode> arguments() {
        return children.size() > 1 ? children.subList(1, children.size()) : List.of();
    }

    public RubyNode argument(int index) {
        List<RubyNode> args = arguments();
        return index < args.size() ? args.get(index) : NIL;
    }

    /**
     * Renders a CONST chain as a qualified name ({@code Metrics::RequestTotal}).
     * Returns null for any other kind.
     */
    public String constPath() {
        if (kind != NodeKind.CONST) return null;
        RubyNode scope = child(0);
        if (scope.is(NodeKind.CONST)) {
            return scope.constPath() + "::" + text;
        }
        return text;
    }
}
