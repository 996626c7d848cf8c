package io.surfworks.equigraph.rewrite;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.equigraph.graph.Constant;
import io.surfworks.equigraph.graph.Graph;
import io.surfworks.equigraph.graph.Node;
import io.surfworks.equigraph.graph.Operator;
import io.surfworks.equigraph.graph.Value;
import io.surfworks.equigraph.graph.ValueType;

/**
 * Tests for {@link MergePass}.
 */
@DisplayName("MergePass")
class MergePassTest {

    private static final Operator ADD = Operator.of("add");
    private static final Operator NEG = Operator.of("neg");

    @Test
    @DisplayName("unifies constants and then the nodes using them")
    void mergesConstants() {
        Value x = new Value(ValueType.F32, "x");
        Value a = ADD.call(x, new Constant(ValueType.F32, 1));
        Value b = ADD.call(x, new Constant(ValueType.F32, 1));
        Graph graph = new Graph(List.of(x), List.of(a, b));

        MergePass merge = new MergePass();
        merge.optimize(graph);

        assertSame(graph.output(0), graph.output(1));
        assertEquals(2, merge.lastMergeCount());
        assertEquals(1, graph.nodes().size());
        assertDoesNotThrow(graph::checkIntegrity);
    }

    @Test
    @DisplayName("merging cascades from producers to consumers")
    void cascades() {
        Value x = new Value(ValueType.F32, "x");
        Value a = NEG.call(NEG.call(NEG.call(x)));
        Value b = NEG.call(NEG.call(NEG.call(x)));
        Graph graph = new Graph(List.of(x), List.of(a, b));

        MergePass merge = new MergePass();
        merge.optimize(graph);

        assertSame(graph.output(0), graph.output(1));
        assertEquals(3, merge.lastMergeCount());
        assertEquals(3, graph.nodes().size());
    }

    @Test
    @DisplayName("a second run changes nothing")
    void idempotent() {
        Value x = new Value(ValueType.F32, "x");
        Value a = ADD.call(NEG.call(x), x);
        Value b = ADD.call(NEG.call(x), x);
        Graph graph = new Graph(List.of(x), List.of(a, b));
        MergePass merge = new MergePass();
        merge.optimize(graph);
        List<Node> nodes = List.copyOf(graph.nodes());

        merge.optimize(graph);

        assertEquals(0, merge.lastMergeCount());
        assertEquals(nodes, List.copyOf(graph.nodes()));
    }

    @Test
    @DisplayName("keeps nodes apart when ops or inputs differ")
    void keepsDistinctNodes() {
        Value x = new Value(ValueType.F32, "x");
        Value y = new Value(ValueType.F32, "y");
        Graph graph = new Graph(List.of(x, y),
                List.of(NEG.call(x), NEG.call(y), Operator.of("abs").call(x)));

        MergePass merge = new MergePass();
        merge.optimize(graph);

        assertEquals(0, merge.lastMergeCount());
        assertNotSame(graph.output(0), graph.output(1));
        assertNotSame(graph.output(0).owner(), graph.output(2).owner());
    }

    @Test
    @DisplayName("merges every output of a multi-output node")
    void mergesMultiOutputNodes() {
        Operator split = Operator.of("split").withOutputs(2);
        Value x = new Value(ValueType.F32, "x");
        Node s1 = split.apply(x);
        Node s2 = split.apply(x);
        Graph graph = new Graph(List.of(x), List.of(s1.output(0), s2.output(1), s2.output(0)));

        new MergePass().optimize(graph);

        assertSame(s1.output(1), graph.output(1));
        assertSame(s1.output(0), graph.output(2));
        assertEquals(1, graph.nodes().size());
        assertDoesNotThrow(graph::checkIntegrity);
    }

    @Test
    @DisplayName("never merges leaves that are not constants")
    void leavesStayDistinct() {
        Value x = new Value(ValueType.F32, "x");
        Value y = new Value(ValueType.F32, "x");
        Graph graph = new Graph(List.of(x, y), List.of(x, y));

        new MergePass().optimize(graph);

        assertNotSame(graph.output(0), graph.output(1));
    }
}
