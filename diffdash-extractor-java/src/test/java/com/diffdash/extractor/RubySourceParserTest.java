package com.diffdash.extractor;

import com.diffdash.extractor.static_analysis.NodeKind;
import com.diffdash.extractor.static_analysis.RubyNode;
import com.diffdash.extractor.static_analysis.RubySourceParser;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RubySourceParserTest {

    private final RubySourceParser parser = new RubySourceParser();

    private RubyNode parse(String source) {
        Optional<RubyNode> root = parser.parse(source, "test.rb");
        assertTrue(root.isPresent(), "Expected source to parse: " + source);
        return root.get();
    }

    @Test
    void classWithSuperclass() {
        RubyNode root = parse("class Child < Parent\nend\n");
        assertEquals(NodeKind.BEGIN, root.kind());

        RubyNode cls = root.child(0);
        assertEquals(NodeKind.CLASS, cls.kind());
        assertEquals("Child", cls.child(0).constPath());
        assertEquals("Parent", cls.child(1).constPath());
        assertEquals(1, cls.line());
    }

    @Test
    void classWithoutSuperclassHasNilParent() {
        RubyNode cls = parse("class Foo\nend\n").child(0);
        assertTrue(cls.child(1).isNil());
    }

    @Test
    void scopedNamesRenderAsQualifiedPaths() {
        RubyNode cls = parse("class Admin::UsersController < Base::Controller\nend\n").child(0);
        assertEquals("Admin::UsersController", cls.child(0).constPath());
        assertEquals("Base::Controller", cls.child(1).constPath());
    }

    @Test
    void moduleNameIsFirstChild() {
        RubyNode mod = parse("module Payments\n  X = 1\nend\n").child(0);
        assertEquals(NodeKind.MODULE, mod.kind());
        assertEquals("Payments", mod.child(0).constPath());
    }

    @Test
    void callExposesReceiverMethodAndArguments() {
        RubyNode call = parse("StatsD.increment(\"orders\", 1)\n").child(0);
        assertEquals(NodeKind.CALL, call.kind());
        assertEquals("increment", call.text());
        assertEquals("StatsD", call.receiver().constPath());
        assertEquals(2, call.arguments().size());
        assertEquals(NodeKind.STR, call.argument(0).kind());
        assertEquals("orders", call.argument(0).text());
        assertEquals(NodeKind.INT, call.argument(1).kind());
    }

    @Test
    void receiverlessCallHasNilReceiver() {
        RubyNode call = parse("include Trackable, Auditable\n").child(0);
        assertEquals(NodeKind.CALL, call.kind());
        assertTrue(call.receiver().isNil());
        assertEquals(2, call.arguments().size());
        assertEquals("Auditable", call.argument(1).constPath());
    }

    @Test
    void symbolArgumentDropsColon() {
        RubyNode call = parse("Prometheus.counter(:requests_total)\n").child(0);
        assertEquals(NodeKind.SYM, call.argument(0).kind());
        assertEquals("requests_total", call.argument(0).text());
    }

    @Test
    void interpolatedStringBecomesDstr() {
        RubyNode call = parse("logger.info(\"Order #{id} shipped\")\n").child(0);
        RubyNode message = call.argument(0);
        assertEquals(NodeKind.DSTR, message.kind());
        assertEquals(NodeKind.STR, message.child(0).kind());
        assertEquals("Order ", message.child(0).text());
    }

    @Test
    void constantAssignmentBecomesCasgn() {
        RubyNode assignment = parse("RequestTotal = Hesiod.register_counter(\"request_total\")\n").child(0);
        assertEquals(NodeKind.CASGN, assignment.kind());
        assertEquals("RequestTotal", assignment.text());
        assertEquals(NodeKind.CALL, assignment.child(1).kind());
        assertEquals("register_counter", assignment.child(1).text());
    }

    @Test
    void linesAreOneBased() {
        RubyNode root = parse("# comment\n\nStatsD.increment(\"a\")\n");
        assertEquals(3, root.child(0).line());
    }

    @Test
    void syntaxErrorYieldsEmpty() {
        assertTrue(parser.parse("class Foo\n  def bar(\nend\n", "broken.rb").isEmpty());
    }

    @Test
    void leadingByteOrderMarkIsIgnored() {
        RubyNode root = parse("\uFEFFclass Order < ApplicationRecord\nend\n");
        RubyNode cls = root.child(0);
        assertEquals(NodeKind.CLASS, cls.kind());
        assertEquals("Order", cls.child(0).constPath());
        assertEquals(1, cls.line());
    }

    @Test
    void emptySourceParses() {
        RubyNode root = parse("");
        assertEquals(NodeKind.BEGIN, root.kind());
        assertTrue(root.children().isEmpty());
    }
}
