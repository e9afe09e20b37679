package com.diffdash.extractor.static_analysis;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterRuby;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Wrapper around the tree-sitter Ruby grammar.
 * Parses one source text into a {@link RubyNode} tree. A tree containing error nodes is
 * reported as {@code Optional.empty()}; printing diagnostics is left to the caller.
 *
 * Not thread-safe: the underlying TSParser is reused between calls.
 */
public class RubySourceParser {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final TSParser parser;

    public RubySourceParser() {
        this.parser = new TSParser();
        this.parser.setLanguage(new TreeSitterRuby());
    }

    /**
     * Parse {@code source}. {@code path} is informational only.
     *
     * @return the root node (kind BEGIN), or empty when the source has syntax errors
     */
    public Optional<RubyNode> parse(String source, String path) {
        if (source.startsWith(BYTE_ORDER_MARK)) {
            source = source.substring(1);
        }
        TSTree tree = parser.parseString(null, source);
        if (tree == null) return Optional.empty();

        TSNode root = tree.getRootNode();
        if (root == null || root.isNull() || root.hasError()) {
            return Optional.empty();
        }
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        return Optional.of(new Converter(bytes).convert(root));
    }

    /** Maps tree-sitter nodes onto the closed {@link NodeKind} model. */
    private static final class Converter {

        private final byte[] source;

        Converter(byte[] source) {
            this.source = source;
        }

        RubyNode convert(TSNode node) {
            int line = node.getStartPoint().getRow() + 1;
            switch (node.getType()) {
                case "program", "body_statement", "parenthesized_statements", "block_body" -> {
                    return new RubyNode(NodeKind.BEGIN, "", line, namedChildren(node));
                }
                case "class" -> {
                    return convertClass(node, line);
                }
                case "module" -> {
                    TSNode name = field(node, "name");
                    List<RubyNode> children = new ArrayList<>();
                    children.add(name != null ? convert(name) : RubyNode.NIL);
                    children.addAll(namedChildrenExcept(node, name, null));
                    return new RubyNode(NodeKind.MODULE, "", line, children);
                }
                case "call" -> {
                    return convertCall(node, line);
                }
                case "constant" -> {
                    return new RubyNode(NodeKind.CONST, text(node), line, List.of(RubyNode.NIL));
                }
                case "scope_resolution" -> {
                    TSNode scope = field(node, "scope");
                    TSNode name = field(node, "name");
                    String simpleName = name != null ? text(name) : text(node);
                    return new RubyNode(NodeKind.CONST, simpleName, line,
                        List.of(scope != null ? convert(scope) : RubyNode.NIL));
                }
                case "assignment" -> {
                    return convertAssignment(node, line);
                }
                case "string" -> {
                    return convertString(node, line);
                }
                case "simple_symbol", "hash_key_symbol" -> {
                    String symbol = text(node);
                    return new RubyNode(NodeKind.SYM, symbol.startsWith(":") ? symbol.substring(1) : symbol,
                        line, List.of());
                }
                case "delimited_symbol" -> {
                    RubyNode content = convertString(node, line);
                    if (content.is(NodeKind.STR)) {
                        return new RubyNode(NodeKind.SYM, content.text(), line, List.of());
                    }
                    return new RubyNode(NodeKind.OTHER, "delimited_symbol", line, content.children());
                }
                case "integer" -> {
                    return new RubyNode(NodeKind.INT, text(node), line, List.of());
                }
                case "identifier" -> {
                    return new RubyNode(NodeKind.IDENT, text(node), line, List.of());
                }
                case "instance_variable" -> {
                    return new RubyNode(NodeKind.IVAR, text(node), line, List.of());
                }
                case "class_variable" -> {
                    return new RubyNode(NodeKind.CVAR, text(node), line, List.of());
                }
                case "global_variable" -> {
                    return new RubyNode(NodeKind.GVAR, text(node), line, List.of());
                }
                case "self" -> {
                    return new RubyNode(NodeKind.SELF, "self", line, List.of());
                }
                default -> {
                    return new RubyNode(NodeKind.OTHER, node.getType(), line, namedChildren(node));
                }
            }
        }

        private RubyNode convertClass(TSNode node, int line) {
            TSNode name = field(node, "name");
            TSNode superclass = field(node, "superclass");

            RubyNode parent = RubyNode.NIL;
            if (superclass != null && superclass.getNamedChildCount() > 0) {
                // superclass node wraps the expression after '<'
                parent = convert(superclass.getNamedChild(0));
            }

            List<RubyNode> children = new ArrayList<>();
            children.add(name != null ? convert(name) : RubyNode.NIL);
            children.add(parent);
            children.addAll(namedChildrenExcept(node, name, superclass));
            return new RubyNode(NodeKind.CLASS, "", line, children);
        }

        private RubyNode convertCall(TSNode node, int line) {
            TSNode receiver = field(node, "receiver");
            TSNode method = field(node, "method");
            TSNode arguments = field(node, "arguments");
            TSNode block = field(node, "block");

            List<RubyNode> children = new ArrayList<>();
            children.add(receiver != null ? convert(receiver) : RubyNode.NIL);
            if (arguments != null) {
                children.addAll(namedChildren(arguments));
            }
            RubyNode call = new RubyNode(NodeKind.CALL, method != null ? text(method) : "call", line, children);

            if (block == null) return call;
            List<RubyNode> blockChildren = new ArrayList<>();
            blockChildren.add(call);
            blockChildren.addAll(namedChildren(block));
            return new RubyNode(NodeKind.BLOCK, "", line, blockChildren);
        }

        private RubyNode convertAssignment(TSNode node, int line) {
            TSNode left = field(node, "left");
            TSNode right = field(node, "right");
            RubyNode value = right != null ? convert(right) : RubyNode.NIL;

            if (left != null && ("constant".equals(left.getType()) || "scope_resolution".equals(left.getType()))) {
                RubyNode target = convert(left);
                return new RubyNode(NodeKind.CASGN, target.text(), line, List.of(target.child(0), value));
            }
            List<RubyNode> children = new ArrayList<>();
            if (left != null) children.add(convert(left));
            children.add(value);
            return new RubyNode(NodeKind.OTHER, "assignment", line, children);
        }

        /**
         * A string without interpolation becomes STR with its literal value;
         * otherwise DSTR holding STR fragments and interpolation nodes in order.
         */
        private RubyNode convertString(TSNode node, int line) {
            List<RubyNode> parts = new ArrayList<>();
            StringBuilder literal = new StringBuilder();
            boolean interpolated = false;

            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode part = node.getNamedChild(i);
                int partLine = part.getStartPoint().getRow() + 1;
                switch (part.getType()) {
                    case "string_content" -> {
                        literal.append(text(part));
                        parts.add(new RubyNode(NodeKind.STR, text(part), partLine, List.of()));
                    }
                    case "escape_sequence" -> {
                        String escaped = unescape(text(part));
                        literal.append(escaped);
                        parts.add(new RubyNode(NodeKind.STR, escaped, partLine, List.of()));
                    }
                    case "interpolation" -> {
                        interpolated = true;
                        parts.add(new RubyNode(NodeKind.OTHER, "interpolation", partLine, namedChildren(part)));
                    }
                    default -> parts.add(convert(part));
                }
            }

            if (interpolated) {
                return new RubyNode(NodeKind.DSTR, "", line, parts);
            }
            return new RubyNode(NodeKind.STR, literal.toString(), line, List.of());
        }

        private List<RubyNode> namedChildren(TSNode node) {
            return namedChildrenExcept(node, null, null);
        }

        private List<RubyNode> namedChildrenExcept(TSNode node, TSNode first, TSNode second) {
            List<RubyNode> result = new ArrayList<>();
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                if (child == null || child.isNull()) continue;
                if ("comment".equals(child.getType())) continue;
                if (sameNode(child, first) || sameNode(child, second)) continue;
                result.add(convert(child));
            }
            return result;
        }

        private String text(TSNode node) {
            int start = node.getStartByte();
            int end = Math.min(node.getEndByte(), source.length);
            if (start >= end) return "";
            return new String(source, start, end - start, StandardCharsets.UTF_8);
        }

        private static TSNode field(TSNode node, String name) {
            TSNode child = node.getChildByFieldName(name);
            return child == null || child.isNull() ? null : child;
        }

        private static boolean sameNode(TSNode a, TSNode b) {
            return b != null
                && a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
        }

        private static String unescape(String sequence) {
            if (sequence.length() < 2) return sequence;
            return switch (sequence.charAt(1)) {
                case 'n' -> "\n";
                case 't' -> "\t";
                case 'r' -> "\r";
                case 's' -> " ";
                case '0' -> "\0";
                default -> sequence.substring(1);
            };
        }
    }
}
