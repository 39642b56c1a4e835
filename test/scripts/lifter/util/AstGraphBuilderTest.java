/*
 * Copyright (c) 2025, Trail of Bits, Inc.
 *
 * This source code is licensed in accordance with the terms specified in
 * the LICENSE file found in the root directory of this source tree.
 */

package util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;

import ast.AstAssign;
import ast.AstExpr;
import ast.AstInstrSequence;
import ast.AstInterface;
import ast.AstLval;

import domain.ReachingDefinition;

import java.util.List;

public class AstGraphBuilderTest {
    AstInterface astree;
    AstLval lhs;
    AstExpr rhs;
    AstAssign assign;
    AstInstrSequence seq;

    @BeforeEach
    public void setUp() {
        astree = new AstInterface();
        lhs = astree.mkVariableLval("R0");
        rhs = astree.mkBinaryOp("plus", astree.mkVariableExpr("R1"), astree.mkIntegerConstant(4));
        assign = astree.mkAssign(lhs, rhs, "0x1000", "041081e2", List.of());
        seq = astree.mkInstrSequence(List.of(assign));
    }

    @Test
    public void testNodesAndEdges() {
        AstGraph graph = AstGraphBuilder.build("main", seq, astree);

        String instr = "instr:" + assign.getInstrId();
        assertTrue(graph.hasNode("stmt:" + seq.getStmtId()));
        assertTrue(graph.hasNode(instr));
        assertTrue(graph.hasNode("lval:" + lhs.getLvalId()));
        assertTrue(graph.hasNode("lhost:var:R0"));
        assertTrue(graph.hasNode("lhost:var:R1"));
        assertFalse(graph.hasNode("no-offset"));
        assertTrue(graph.hasNode("expr:" + rhs.getExprId()));
        assertTrue(graph.hasNode("int:4"));

        assertTrue(graph.getNode(instr).getLabel().endsWith("\\n0x1000:041081e2"));
        assertTrue(graph.getEdges().stream().anyMatch(e ->
            e.getSource().equals(instr)
                && e.getTarget().equals("lval:" + lhs.getLvalId())
                && "lhs".equals(e.getLabel())));
        assertTrue(graph.getEdges().stream().anyMatch(e ->
            e.getSource().equals(instr)
                && e.getTarget().equals("expr:" + rhs.getExprId())
                && "rhs".equals(e.getLabel())));
    }

    @Test
    public void testProvenanceInLabels() {
        AstExpr high = astree.mkVariableExpr("total");
        astree.addExprMapping(high, rhs);
        astree.addExprReachingDefs(high, List.of(new ReachingDefinition("R1", List.of("0xffc"))));

        AstGraph graph = AstGraphBuilder.build("main", high, astree);
        String label = graph.getNode("expr:" + high.getExprId()).getLabel();

        assertTrue(label.contains("\\nmapped:" + rhs.getExprId()));
        assertTrue(label.contains("\\nrdefs:[R1: [0xffc]]"));
    }

    @Test
    public void testSharedNodesAreAddedOnce() {
        AstExpr twice = astree.mkBinaryOp("plus", astree.mkIntegerConstant(4), astree.mkIntegerConstant(4));

        AstGraph graph = AstGraphBuilder.build("consts", twice, astree);

        assertEquals(1, graph.getNodes().stream().filter(n -> n.getName().equals("int:4")).count());
        assertEquals(2, graph.getEdges().stream().filter(e -> e.getTarget().equals("int:4")).count());
    }

    @Test
    public void testDotOutput() {
        String dot = AstGraphBuilder.build("main", seq, astree).toDot();

        assertTrue(dot.startsWith("digraph \"main\" {\n"));
        assertTrue(dot.contains("node [shape=rect, style=filled]"));
        assertTrue(dot.contains("\"instr:" + assign.getInstrId() + "\" -> \"lval:" + lhs.getLvalId() + "\" [label=\"lhs\"]"));
        assertTrue(dot.contains("fillcolor="));
        assertTrue(dot.endsWith("}\n"));
    }

    @Test
    public void testQuotesAreEscaped() {
        AstGraph graph = new AstGraph("g");
        graph.addNode("a", "say \"hi\"", null);
        graph.addNode("a", "ignored", null);
        graph.addEdge("a", "a");

        String dot = graph.toDot();

        assertTrue(dot.contains("\"a\" [label=\"say \\\"hi\\\"\"]"));
        assertTrue(dot.contains("\"a\" -> \"a\"\n"));
        assertEquals("say \"hi\"", graph.getNode("a").getLabel());
    }
}
