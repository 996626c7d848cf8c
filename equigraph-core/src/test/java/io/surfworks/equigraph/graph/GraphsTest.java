package io.surfworks.equigraph.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for the backward walks in {@link Graphs}.
 */
@DisplayName("Graphs")
class GraphsTest {

    private static final Operator ADD = Operator.of("add");
    private static final Operator NEG = Operator.of("neg");
    private static final Operator SPLIT = Operator.of("split").withOutputs(2);

    @Test
    @DisplayName("graphInputs lists leaves, constants included, once each")
    void graphInputs() {
        Value x = new Value(ValueType.F32, "x");
        Value y = new Value(ValueType.F32, "y");
        Constant one = new Constant(ValueType.F32, 1);
        Value out = ADD.call(ADD.call(x, one), ADD.call(x, y));

        List<Value> leaves = Graphs.graphInputs(List.of(out));

        assertEquals(3, leaves.size());
        assertTrue(leaves.containsAll(List.of(x, y, one)));
    }

    @Test
    @DisplayName("toposort puts every node after its producers")
    void toposortOrdersProducersFirst() {
        Value x = new Value(ValueType.F32, "x");
        Value a = NEG.call(x);
        Value b = NEG.call(a);
        Value out = ADD.call(b, a);

        List<Node> order = Graphs.toposort(List.of(out));

        assertEquals(List.of(a.owner(), b.owner(), out.owner()), order);
    }

    @Test
    @DisplayName("valuesBetween stops at the given inputs")
    void valuesBetweenStopsAtInputs() {
        Value x = new Value(ValueType.F32, "x");
        Value a = NEG.call(x);
        Value b = NEG.call(a);

        Set<Value> between = Graphs.valuesBetween(List.of(a), List.of(b));

        assertEquals(Set.of(a, b), between);
    }

    @Test
    @DisplayName("valuesBetween includes sibling outputs")
    void valuesBetweenIncludesSiblings() {
        Value x = new Value(ValueType.F32, "x");
        Node split = SPLIT.apply(x);
        Value out = NEG.call(split.output(0));

        Set<Value> between = Graphs.valuesBetween(List.of(x), List.of(out));

        assertTrue(between.contains(split.output(1)));
        assertTrue(between.contains(x));
        assertFalse(Graphs.ancestors(List.of(out)).contains(split.output(1)));
    }

    @Test
    @DisplayName("isAncestor follows owner edges only backwards")
    void isAncestor() {
        Value x = new Value(ValueType.F32, "x");
        Value a = NEG.call(x);

        assertTrue(Graphs.isAncestor(x, a));
        assertTrue(Graphs.isAncestor(a, a));
        assertFalse(Graphs.isAncestor(a, x));
    }
}
