package io.surfworks.equigraph.equiv;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.surfworks.equigraph.graph.Node;
import io.surfworks.equigraph.graph.Operator;
import io.surfworks.equigraph.graph.Value;
import io.surfworks.equigraph.graph.ValueType;

/**
 * Tests for {@link MergeEquivalenceChecker} on its own, without cross-validation.
 */
@DisplayName("MergeEquivalenceChecker")
class MergeEquivalenceCheckerTest {

    private static final Operator ADD = Operator.of("add");
    private static final Operator NEG = Operator.of("neg");

    private final MergeEquivalenceChecker checker = new MergeEquivalenceChecker();

    @Test
    @DisplayName("skips a substitution already cut out by an earlier one")
    void skipsDeadKeys() {
        Value x = new Value(ValueType.F32, "x");
        Value z = new Value(ValueType.F32, "z");
        Value y = new Value(ValueType.F32, "y");
        Value inner = NEG.call(x);
        Value outer = NEG.call(inner);
        Map<Value, Value> givens = new LinkedHashMap<>();
        givens.put(outer, y);
        givens.put(inner, z);

        assertTrue(checker.isSameGraph(outer, y, givens));
    }

    @Test
    @DisplayName("replacement targets may bring in their own leaves")
    void replacementLeaves() {
        Value x = new Value(ValueType.F32, "x");
        Value w = new Value(ValueType.F32, "w");
        Value target = NEG.call(w);

        assertTrue(checker.isSameGraph(ADD.call(x, x), ADD.call(target, target),
                Map.of(x, target)));
    }

    @Test
    @DisplayName("distinct leaves only meet through substitution")
    void leavesStayApart() {
        Value x = new Value(ValueType.F32, "x");
        Value y = new Value(ValueType.F32, "x");

        assertFalse(checker.isSameGraph(x, y, Map.of()));
        assertTrue(checker.isSameGraph(x, y, Map.of(x, y)));
    }

    @Test
    @DisplayName("different outputs of equal nodes are different")
    void multiOutput() {
        Operator split = Operator.of("split").withOutputs(2);
        Value x = new Value(ValueType.F32, "x");
        Node a = split.apply(x);
        Node b = split.apply(x);

        assertTrue(checker.isSameGraph(a.output(0), b.output(0), Map.of()));
        assertFalse(checker.isSameGraph(a.output(0), b.output(1), Map.of()));
    }

    @Test
    @DisplayName("a replacement of another type is malformed, not applied")
    void rejectsTypeChange() {
        Value x = new Value(ValueType.F32, "x");
        Value i = new Value(ValueType.I64, "i");
        Value negX = NEG.call(x);

        MalformedSubstitutionException e = assertThrows(MalformedSubstitutionException.class,
                () -> checker.isSameGraph(negX, NEG.call(i), Map.of(x, i)));
        assertSame(x, e.getKey());
        assertSame(x, negX.owner().input(0));
    }
}
