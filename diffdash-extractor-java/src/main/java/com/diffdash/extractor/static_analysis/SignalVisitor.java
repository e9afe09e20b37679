package com.diffdash.extractor.static_analysis;

import com.diffdash.extractor.signal.DynamicMetricCall;
import com.diffdash.extractor.signal.Signal;
import com.diffdash.extractor.signal.SignalType;
import com.diffdash.extractor.static_analysis.FileStructure.ClassStructure;
import com.diffdash.extractor.static_analysis.FileStructure.ModuleRelation;
import com.diffdash.extractor.static_analysis.FileStructure.ModuleStructure;
import com.diffdash.extractor.static_analysis.FileStructure.RelationKind;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Single depth-first pass over one file's AST.
 * Collects class/module structure, mixin relations, log and metric signals,
 * dynamic metric calls and constant metric references.
 *
 * One instance per file; call {@link #visit(RubyNode)} once with the root.
 */
public class SignalVisitor {

    static final Set<String> LOG_LEVELS = Set.of("debug", "info", "warn", "error", "fatal", "unknown");
    static final Set<String> GENERIC_LOG_METHODS = Set.of("add", "log");
    static final List<String> SEVERITY_BY_NUMBER = List.of("debug", "info", "warn", "error", "fatal", "unknown");

    static final Set<String> FACTORY_METHODS = Set.of("counter", "gauge", "histogram", "summary");
    static final Set<String> ACTION_METHODS =
        Set.of("increment", "incr", "decrement", "decr", "set", "observe", "time", "timing", "emit");

    private static final Map<String, SignalType> TYPE_BY_METHOD = Map.ofEntries(
        Map.entry("counter", SignalType.COUNTER),
        Map.entry("increment", SignalType.COUNTER),
        Map.entry("incr", SignalType.COUNTER),
        Map.entry("gauge", SignalType.GAUGE),
        Map.entry("set", SignalType.GAUGE),
        Map.entry("histogram", SignalType.HISTOGRAM),
        Map.entry("observe", SignalType.HISTOGRAM),
        Map.entry("timing", SignalType.HISTOGRAM),
        Map.entry("time", SignalType.HISTOGRAM),
        Map.entry("summary", SignalType.SUMMARY)
    );

    private static final int MAX_EVENT_NAME_LENGTH = 50;

    private final String filePath;
    private final int inheritanceDepth;
    private final DetectionRules rules;

    private final List<ClassStructure> classes = new ArrayList<>();
    private final List<ModuleStructure> modules = new ArrayList<>();
    private final List<ModuleRelation> relations = new ArrayList<>();
    private final List<Signal> signals = new ArrayList<>();
    private final List<DynamicMetricCall> dynamicMetricCalls = new ArrayList<>();
    private final List<MetricConstantReference> constantReferences = new ArrayList<>();

    // One frame per class/module body; a frame may itself be qualified ("Admin::UsersController")
    private final Deque<Scope> scopes = new ArrayDeque<>();

    public SignalVisitor(String filePath, int inheritanceDepth, DetectionRules rules) {
        this.filePath = filePath;
        this.inheritanceDepth = inheritanceDepth;
        this.rules = rules;
    }

    public FileStructure getStructure() { return new FileStructure(classes, modules, relations); }
    public List<Signal> getSignals() { return signals; }
    public List<DynamicMetricCall> getDynamicMetricCalls() { return dynamicMetricCalls; }
    public List<MetricConstantReference> getConstantReferences() { return constantReferences; }

    public FileAnalysis toAnalysis() {
        return new FileAnalysis(filePath, inheritanceDepth, getStructure(), signals, dynamicMetricCalls,
            constantReferences);
    }

    public void visit(RubyNode node) {
        switch (node.kind()) {
            case CLASS -> visitClass(node);
            case MODULE -> visitModule(node);
            case CALL -> visitCall(node);
            default -> visitChildren(node, 0);
        }
    }

    private void visitChildren(RubyNode node, int from) {
        List<RubyNode> children = node.children();
        for (int i = from; i < children.size(); i++) {
            visit(children.get(i));
        }
    }

    // --- Structure ---

    private void visitClass(RubyNode node) {
        String name = nameOf(node.child(0));
        String parent = node.child(1).constPath();
        String qualified = qualify(name);

        classes.add(new ClassStructure(qualified, parent, filePath));

        if (parent == null) {
            // superclass given as an expression (Struct.new(...)) may still hold call sites
            visit(node.child(1));
        }
        enterScope(qualified, node, 2);
    }

    private void visitModule(RubyNode node) {
        String qualified = qualify(nameOf(node.child(0)));
        modules.add(new ModuleStructure(qualified, filePath));
        enterScope(qualified, node, 1);
    }

    private void enterScope(String qualified, RubyNode node, int bodyFrom) {
        scopes.push(new Scope(qualified, declaresLoggingTrait(node, bodyFrom)));
        try {
            visitChildren(node, bodyFrom);
        } finally {
            scopes.pop();
        }
    }

    /** True when the body directly includes, prepends or extends a structured logging trait. */
    private boolean declaresLoggingTrait(RubyNode node, int bodyFrom) {
        List<RubyNode> children = node.children();
        for (int i = bodyFrom; i < children.size(); i++) {
            RubyNode child = children.get(i);
            List<RubyNode> statements = child.is(NodeKind.BEGIN) ? child.children() : List.of(child);
            for (RubyNode statement : statements) {
                if (!isMixinCall(statement)) continue;
                for (RubyNode arg : statement.arguments()) {
                    if (rules.isLoggingTrait(arg.constPath())) return true;
                }
            }
        }
        return false;
    }

    private static boolean isMixinCall(RubyNode node) {
        return node.is(NodeKind.CALL)
            && node.receiver().isNil()
            && RelationKind.fromMethod(node.text()) != null;
    }

    private String qualify(String name) {
        Scope current = scopes.peek();
        return current == null ? name : current.qualifiedName + "::" + name;
    }

    private String currentNamespace() {
        Scope current = scopes.peek();
        return current == null ? "" : current.qualifiedName;
    }

    private String definingClass() {
        Scope current = scopes.peek();
        return current == null ? Signal.TOP_LEVEL : current.qualifiedName;
    }

    private static String nameOf(RubyNode nameNode) {
        String path = nameNode.constPath();
        return path != null ? path : "(anonymous)";
    }

    // --- Calls ---

    private void visitCall(RubyNode node) {
        String method = node.text();
        RubyNode receiver = node.receiver();

        LogShape log = matchLogCall(receiver, method, node.arguments());
        if (log != null) {
            recordLog(node, log);
        } else if (!matchMetricCall(node, receiver, method)) {
            if (receiver.isNil() && RelationKind.fromMethod(method) != null) {
                recordRelations(RelationKind.fromMethod(method), node.arguments());
            } else if (receiver.is(NodeKind.CONST) && ACTION_METHODS.contains(method)) {
                constantReferences.add(new MetricConstantReference(
                    receiver.constPath(), method, definingClass(), currentNamespace(), node.line()));
            }
        }

        // detections nest: Rails.logger.info(StatsD.increment("x")) yields both
        visitChildren(node, 0);
    }

    private void recordRelations(RelationKind kind, List<RubyNode> args) {
        for (RubyNode arg : args) {
            String module = arg.constPath();
            if (module == null) continue;
            relations.add(new ModuleRelation(module, currentNamespace().isEmpty() ? null : currentNamespace(),
                kind, filePath));
        }
    }

    // --- Logs ---

    /** Severity plus the argument holding the message. */
    private record LogShape(String level, RubyNode message) {}

    private LogShape matchLogCall(RubyNode receiver, String method, List<RubyNode> args) {
        if (!receiver.isNil() && isLogReceiver(receiver)) {
            if (LOG_LEVELS.contains(method)) {
                return new LogShape(method, args.isEmpty() ? RubyNode.NIL : args.get(0));
            }
            if (GENERIC_LOG_METHODS.contains(method) && !args.isEmpty()) {
                String severity = severityOf(args.get(0));
                if (severity != null) {
                    return new LogShape(severity, args.size() > 1 ? args.get(1) : RubyNode.NIL);
                }
            }
            return null;
        }

        if (receiver.isNil() && "log".equals(method) && loggingTraitActive()) {
            if (!args.isEmpty() && args.get(0).is(NodeKind.SYM) && LOG_LEVELS.contains(args.get(0).text())) {
                return new LogShape(args.get(0).text(), args.size() > 1 ? args.get(1) : RubyNode.NIL);
            }
            return new LogShape("info", args.isEmpty() ? RubyNode.NIL : args.get(0));
        }
        return null;
    }

    private boolean loggingTraitActive() {
        Scope current = scopes.peek();
        return current != null && current.loggingTrait;
    }

    private boolean isLogReceiver(RubyNode receiver) {
        switch (receiver.kind()) {
            case CALL -> {
                if (!"logger".equals(receiver.text())) return false;
                RubyNode owner = receiver.receiver();
                // Foo.logger only counts for allow-listed namespaces
                return !owner.is(NodeKind.CONST) || rules.isLogNamespace(owner.constPath());
            }
            case IDENT, IVAR, CVAR, GVAR -> {
                return receiver.text().toLowerCase(Locale.ROOT).contains("logger");
            }
            case CONST -> {
                String name = receiver.text();
                return "LOG".equals(name) || name.toUpperCase(Locale.ROOT).contains("LOGGER");
            }
            default -> {
                return false;
            }
        }
    }

    /** Maps :warn, 2 or Logger::WARN to "warn"; null when the argument is not a severity. */
    static String severityOf(RubyNode arg) {
        switch (arg.kind()) {
            case SYM -> {
                return LOG_LEVELS.contains(arg.text()) ? arg.text() : null;
            }
            case INT -> {
                String digits = arg.text().replace("_", "");
                if (!digits.matches("\\d")) return null;
                int level = Integer.parseInt(digits);
                return level < SEVERITY_BY_NUMBER.size() ? SEVERITY_BY_NUMBER.get(level) : null;
            }
            case CONST -> {
                String level = arg.text().toLowerCase(Locale.ROOT);
                return LOG_LEVELS.contains(level) ? level : null;
            }
            default -> {
                return null;
            }
        }
    }

    private void recordLog(RubyNode node, LogShape log) {
        String definingClass = definingClass();
        String name = eventNameOf(log.message());
        if (name == null) {
            name = fallbackEventName(definingClass, log.level(), node.line());
        }
        signals.add(Signal.log(name, filePath, definingClass, inheritanceDepth, log.level(),
            log.message().is(NodeKind.DSTR), node.line()));
    }

    static String eventNameOf(RubyNode message) {
        switch (message.kind()) {
            case STR -> {
                return slug(message.text());
            }
            case SYM -> {
                return message.text().isEmpty() ? null : message.text();
            }
            case DSTR -> {
                StringBuilder literal = new StringBuilder();
                for (RubyNode part : message.children()) {
                    if (part.is(NodeKind.STR)) literal.append(part.text());
                }
                return slug(literal.toString());
            }
            default -> {
                return null;
            }
        }
    }

    /** Lower-case, non-alphanumeric runs to one underscore, trimmed, at most 50 chars. */
    static String slug(String message) {
        if (message == null || message.isEmpty()) return null;
        String sanitized = message.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "_")
            .replaceAll("^_|_$", "");
        if (sanitized.length() > MAX_EVENT_NAME_LENGTH) {
            sanitized = sanitized.substring(0, MAX_EVENT_NAME_LENGTH);
        }
        return sanitized.isEmpty() ? null : sanitized;
    }

    static String fallbackEventName(String definingClass, String level, int line) {
        String components = definingClass + ":" + level + ":" + line;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(components.getBytes(StandardCharsets.UTF_8));
            return "log_" + HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // --- Metrics ---

    /**
     * Direct shape {@code StatsD.increment("x")} or chained shape {@code Prometheus.counter(:x).increment}.
     * Returns true when the call was classified, whether or not its name was literal.
     */
    private boolean matchMetricCall(RubyNode node, RubyNode receiver, String method) {
        if (!ACTION_METHODS.contains(method)) return false;

        if (receiver.is(NodeKind.CONST) && rules.isMetricReceiver(receiver.constPath())) {
            recordMetric(node, receiver.constPath(), typeOf(method), node.argument(0));
            return true;
        }

        if (receiver.is(NodeKind.CALL) && isFactoryMethod(receiver.text())) {
            RubyNode client = receiver.receiver();
            if (client.is(NodeKind.CONST) && rules.isMetricReceiver(client.constPath())) {
                recordMetric(node, client.constPath(), typeOf(receiver.text()), receiver.argument(0));
                return true;
            }
        }
        return false;
    }

    private void recordMetric(RubyNode node, String client, SignalType type, RubyNode nameArg) {
        String name = literalName(nameArg);
        if (name != null) {
            signals.add(Signal.metric(type, name, filePath, definingClass(), inheritanceDepth, node.line()));
        } else {
            dynamicMetricCalls.add(new DynamicMetricCall(client, type, definingClass(), filePath, node.line()));
        }
    }

    static boolean isFactoryMethod(String method) {
        return FACTORY_METHODS.contains(method) || method.startsWith("register_");
    }

    /** Literal string or symbol value; null for anything computed. */
    static String literalName(RubyNode arg) {
        if (arg.is(NodeKind.STR) || arg.is(NodeKind.SYM)) {
            return arg.text();
        }
        return null;
    }

    static SignalType typeOf(String method) {
        String base = method.startsWith("register_") ? method.substring("register_".length()) : method;
        return TYPE_BY_METHOD.getOrDefault(base, SignalType.COUNTER);
    }

    private static final class Scope {
        final String qualifiedName;
        final boolean loggingTrait;

        Scope(String qualifiedName, boolean loggingTrait) {
            this.qualifiedName = qualifiedName;
            this.loggingTrait = loggingTrait;
        }
    }
}
