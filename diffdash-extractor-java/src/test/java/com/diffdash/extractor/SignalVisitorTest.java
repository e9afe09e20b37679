package com.diffdash.extractor;

import com.diffdash.extractor.signal.DynamicMetricCall;
import com.diffdash.extractor.signal.Signal;
import com.diffdash.extractor.signal.SignalType;
import com.diffdash.extractor.static_analysis.DetectionRules;
import com.diffdash.extractor.static_analysis.FileAnalysis;
import com.diffdash.extractor.static_analysis.FileStructure;
import com.diffdash.extractor.static_analysis.FileStructure.RelationKind;
import com.diffdash.extractor.static_analysis.MetricConstantReference;
import com.diffdash.extractor.static_analysis.RubySourceParser;
import com.diffdash.extractor.static_analysis.SourceAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Detection rules applied to single source snippets.
 */
class SignalVisitorTest {

    private final SourceAnalyzer analyzer = new SourceAnalyzer(new RubySourceParser(), DetectionRules.defaults());

    private FileAnalysis analyze(String source) {
        return analyzer.analyze(source, "app/models/sample.rb", 0);
    }

    private Signal onlySignal(String source) {
        List<Signal> signals = analyze(source).signals();
        assertEquals(1, signals.size(), "Expected exactly one signal, got: " + signals);
        return signals.get(0);
    }

    // --- Logs ---

    @Test
    void loggerInfoInsideMethod() {
        Signal log = onlySignal("""
            class Foo
              def bar
                logger.info "payment_processed"
              end
            end
            """);
        assertEquals(SignalType.LOG, log.type());
        assertEquals("payment_processed", log.name());
        assertEquals("info", log.level());
        assertEquals("Foo", log.definingClass());
        assertFalse(log.isInterpolated());
        assertEquals("app/models/sample.rb", log.sourceFile());
        assertEquals(0, log.inheritanceDepth());
        assertEquals(3, log.line());
    }

    @Test
    void interpolatedMessageKeepsLiteralFragments() {
        Signal log = onlySignal("logger.info(\"Order #{id} shipped\")\n");
        assertEquals("order_shipped", log.name());
        assertTrue(log.isInterpolated());
    }

    @Test
    void literalMessageIsSlugged() {
        Signal log = onlySignal("Rails.logger.warn(\"Payment FAILED: retrying...\")\n");
        assertEquals("payment_failed_retrying", log.name());
        assertEquals("warn", log.level());
    }

    @Test
    void longMessageIsTruncatedToFiftyCharacters() {
        Signal log = onlySignal("logger.error(\"" + "a".repeat(80) + "\")\n");
        assertEquals(50, log.name().length());
    }

    @Test
    void symbolMessageIsUsedVerbatim() {
        Signal log = onlySignal("logger.debug(:checkout_started)\n");
        assertEquals("checkout_started", log.name());
        assertFalse(log.isInterpolated());
    }

    @Test
    void namespaceLoggerRequiresAllowListedConstant() {
        assertEquals(1, analyze("Rails.logger.info(\"ok\")\n").signals().size());
        assertTrue(analyze("Sidekiq.logger.info(\"ok\")\n").signals().isEmpty());
    }

    @Test
    void variablesNamedLoggerAreReceivers() {
        assertEquals(1, analyze("@audit_logger.info(\"audited\")\n").signals().size());
        assertEquals(1, analyze("request_logger = build\nrequest_logger.error(\"boom\")\n").signals().size());
        assertTrue(analyze("printer.info(\"nope\")\n").signals().isEmpty());
    }

    @Test
    void genericAddTakesSeverityFromArgument() {
        Signal bySymbol = onlySignal("logger.add(:warn, \"disk almost full\")\n");
        assertEquals("warn", bySymbol.level());
        assertEquals("disk_almost_full", bySymbol.name());

        assertEquals("error", onlySignal("logger.add(3, \"failed\")\n").level());
        assertEquals("fatal", onlySignal("logger.log(Logger::FATAL, \"dead\")\n").level());
    }

    @Test
    void genericAddWithoutSeverityIsIgnored() {
        assertTrue(analyze("logger.add(\"no severity\")\n").signals().isEmpty());
        assertTrue(analyze("logger.add(9, \"out of range\")\n").signals().isEmpty());
    }

    @Test
    void logWithoutMessageGetsStableFallbackName() {
        Signal first = onlySignal("class Job\n  def run\n    logger.info\n  end\nend\n");
        Signal second = onlySignal("class Job\n  def run\n    logger.info\n  end\nend\n");
        assertTrue(first.name().matches("log_[0-9a-f]{8}"), first.name());
        assertEquals(first.name(), second.name());
    }

    @Test
    void bareLogCallNeedsLoggingTrait() {
        String withTrait = """
            class Worker
              include Loggy::InstanceLogger

              def perform
                log(:warn, "queue_backed_up")
                log("job_done")
              end
            end
            """;
        List<Signal> signals = analyze(withTrait).signals();
        assertEquals(2, signals.size());
        assertEquals("queue_backed_up", signals.get(0).name());
        assertEquals("warn", signals.get(0).level());
        assertEquals("job_done", signals.get(1).name());
        assertEquals("info", signals.get(1).level());

        String withoutTrait = """
            class Worker
              def perform
                log("job_done")
              end
            end
            """;
        assertTrue(analyze(withoutTrait).signals().isEmpty());
    }

    @Test
    void extendedTraitAlsoEnablesBareLog() {
        String source = """
            class Reporter
              extend Loggy::ClassLogger
              log("report_built")
            end
            """;
        assertEquals("report_built", onlySignal(source).name());
    }

    // --- Metrics ---

    @Test
    void chainedFactoryCallAtTopLevel() {
        Signal metric = onlySignal("Prometheus.counter(:requests_total).increment\n");
        assertEquals(SignalType.COUNTER, metric.type());
        assertEquals("requests_total", metric.name());
        assertEquals(Signal.TOP_LEVEL, metric.definingClass());
        assertEquals("counter", metric.metadata().get("metric_type"));
    }

    @Test
    void chainedFactoryCallWithVariableIsDynamic() {
        FileAnalysis analysis = analyze("Prometheus.histogram(name).observe(1.5)\n");
        assertTrue(analysis.signals().isEmpty());
        assertEquals(1, analysis.dynamicMetricCalls().size());
        assertEquals(SignalType.HISTOGRAM, analysis.dynamicMetricCalls().get(0).metricType());
    }

    @Test
    void directCallWithVariableIsDynamic() {
        FileAnalysis analysis = analyze("StatsD.increment(dynamic_var)\n");
        assertTrue(analysis.signals().isEmpty());

        List<DynamicMetricCall> dynamic = analysis.dynamicMetricCalls();
        assertEquals(1, dynamic.size());
        assertEquals("StatsD", dynamic.get(0).receiver());
        assertEquals(SignalType.COUNTER, dynamic.get(0).metricType());
        assertEquals(1, dynamic.get(0).line());
    }

    @Test
    void directCallTypesFollowActionMethod() {
        assertEquals(SignalType.GAUGE, onlySignal("StatsD.set(\"queue_depth\", 4)\n").type());
        assertEquals(SignalType.HISTOGRAM, onlySignal("Statsd.timing(\"db.query\", 12)\n").type());
        assertEquals(SignalType.HISTOGRAM, onlySignal("Datadog.observe(\"latency\", 3)\n").type());
        assertEquals(SignalType.COUNTER, onlySignal("DogStatsD.decrement(\"slots\")\n").type());
    }

    @Test
    void directFactoryCallIsNotAMetric() {
        FileAnalysis analysis = analyze("Datadog.gauge(\"memory\", 512)\nHesiod.register_counter(\"x\")\n");
        assertTrue(analysis.signals().isEmpty());
        assertTrue(analysis.dynamicMetricCalls().isEmpty());
    }

    @Test
    void unknownReceiverIsIgnored() {
        FileAnalysis analysis = analyze("Counter.increment(\"x\")\ncache.set(\"k\", 1)\n");
        assertTrue(analysis.signals().isEmpty());
        assertTrue(analysis.dynamicMetricCalls().isEmpty());
    }

    @Test
    void emitIsAnAction() {
        Signal metric = onlySignal("Hesiod.emit(\"order_created\")\n");
        assertEquals("order_created", metric.name());
        assertEquals(SignalType.COUNTER, metric.type());
    }

    @Test
    void nestedDetectionsAreBothReported() {
        List<Signal> signals = analyze("Rails.logger.info(StatsD.increment(\"inner\"))\n").signals();
        assertEquals(2, signals.size());
        assertTrue(signals.stream().anyMatch(s -> s.isLog()));
        assertTrue(signals.stream().anyMatch(s -> s.name().equals("inner") && s.isMetric()));
    }

    @Test
    void sourceWithoutReceiversProducesNothing() {
        FileAnalysis analysis = analyze("""
            class Calculator
              def add(a, b)
                puts "adding"
                a + b
              end
            end
            """);
        assertTrue(analysis.signals().isEmpty());
        assertTrue(analysis.dynamicMetricCalls().isEmpty());
    }

    // --- Structure ---

    @Test
    void namespacesFoldIntoQualifiedNames() {
        String source = """
            module Billing
              class Admin::Invoice < ApplicationRecord
                def save
                  StatsD.increment("invoice_saved")
                end
              end
            end
            """;
        FileAnalysis analysis = analyze(source);
        FileStructure structure = analysis.structure();

        assertEquals(1, structure.modules().size());
        assertEquals("Billing", structure.modules().get(0).qualifiedName());
        assertEquals(1, structure.classes().size());
        assertEquals("Billing::Admin::Invoice", structure.classes().get(0).qualifiedName());
        assertEquals("ApplicationRecord", structure.classes().get(0).parentName());
        assertEquals("Billing::Admin::Invoice", analysis.signals().get(0).definingClass());
    }

    @Test
    void mixinRelationsOnePerArgument() {
        String source = """
            class Order
              include Trackable, Auditable
              prepend Cached
              extend Finders
            end
            """;
        FileStructure structure = analyze(source).structure();
        assertEquals(4, structure.relations().size());
        assertEquals(List.of("Trackable", "Auditable"),
            structure.relations(RelationKind.INCLUDE).stream().map(r -> r.moduleName()).toList());
        assertEquals("Cached", structure.relations(RelationKind.PREPEND).get(0).moduleName());
        assertEquals("Finders", structure.relations(RelationKind.EXTEND).get(0).moduleName());
        assertEquals("Order", structure.relations().get(0).includingClass());
    }

    @Test
    void actionOnUnknownConstantBecomesReference() {
        String source = """
            module Metrics
              class Worker
                def run
                  RequestTotal.increment
                  Metrics::Errors.increment(labels: {})
                end
              end
            end
            """;
        List<MetricConstantReference> references = analyze(source).constantReferences();
        assertEquals(2, references.size());
        assertEquals("RequestTotal", references.get(0).constantPath());
        assertEquals("Metrics::Worker", references.get(0).namespace());
        assertEquals("Metrics::Errors", references.get(1).constantPath());
        assertEquals(Set.of("increment"), Set.of(references.get(1).method()));
    }

    @Test
    void byteOrderMarkedSourceIsAnalyzed() {
        Signal metric = onlySignal("\uFEFFStatsD.increment(\"x\")\n");
        assertEquals("x", metric.name());
        assertEquals(1, metric.line());
    }

    @Test
    void syntaxErrorYieldsEmptyAnalysis() {
        FileAnalysis analysis = analyze("class Broken\n  def x(\nend\n");
        assertTrue(analysis.signals().isEmpty());
        assertTrue(analysis.structure().classes().isEmpty());
    }
}
