package io.surfworks.equigraph.equiv;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import io.surfworks.equigraph.graph.Constant;
import io.surfworks.equigraph.graph.Graphs;
import io.surfworks.equigraph.graph.Operator;
import io.surfworks.equigraph.graph.Value;
import io.surfworks.equigraph.graph.ValueType;

/**
 * Randomized agreement test for the two equivalence algorithms.
 *
 * <p>Each case builds an expression tree with distinct leaves, a mirror of it over
 * fresh leaves, and substitutions from the mirror onto the original at aligned
 * positions. Some substitutions cover a whole subtree instead of its leaves. A case
 * may then break the mirror by changing one op or by leaving one leaf unsubstituted,
 * which makes the expected answer false. {@link GraphEquivalence} throws if its two
 * checks disagree, so every case is cross-validated as well as checked for the
 * expected answer.
 *
 * <p>A second family builds DAGs from one recipe realized on both sides. Steps reuse
 * earlier steps at several positions, some leaves are shared by both sides, and
 * constants of equal signature appear on each side. Substitutions then cover own leaves,
 * constants and derived steps that may have several uses, all in one direction.
 */
@DisplayName("Cross-validation on random graphs")
class CrossValidationPropertyTest {

    private static final List<Operator> UNARY = List.of(
            Operator.of("neg"), Operator.of("exp"), Operator.of("abs"));
    private static final List<Operator> BINARY = List.of(
            Operator.of("add"), Operator.of("mul"), Operator.of("sub"));

    private enum Mutation { NONE, CHANGE_OP, DROP_LEAF }

    /** Expression shape; a null op marks a leaf. */
    private static final class Shape {
        final Operator op;
        final List<Shape> children;

        Shape(Operator op, List<Shape> children) {
            this.op = op;
            this.children = children;
        }

        boolean isLeaf() {
            return op == null;
        }
    }

    static Stream<Long> seeds() {
        return IntStream.range(0, 300).mapToObj(i -> 0x5EEDL * 31 + i);
    }

    @ParameterizedTest(name = "seed {0}")
    @MethodSource("seeds")
    @DisplayName("both checks agree with the expected answer")
    void checksAgree(long seed) {
        Random random = new Random(seed);
        Shape root = shape(random, 1 + random.nextInt(4));

        // Shapes whose counterparts are compared node by node
        List<Shape> visible = new ArrayList<>();
        List<Shape> substituted = new ArrayList<>();
        chooseSubstitutions(random, root, visible, substituted);

        Mutation mutation = Mutation.values()[random.nextInt(Mutation.values().length)];
        Shape target = pickTarget(random, visible, mutation);
        boolean expected = target == null;

        Map<Shape, Value> original = new IdentityHashMap<>();
        Map<Shape, Value> mirror = new IdentityHashMap<>();
        Value v2 = build(root, original, null, "y");
        Value v1 = build(root, mirror, mutation == Mutation.CHANGE_OP ? target : null, "x");

        Map<Value, Value> givens = new LinkedHashMap<>();
        for (Shape s : substituted) {
            givens.put(mirror.get(s), original.get(s));
        }
        for (Shape s : visible) {
            if (s.isLeaf() && !(mutation == Mutation.DROP_LEAF && s == target)) {
                givens.put(mirror.get(s), original.get(s));
            }
        }

        assertEquals(expected, new GraphEquivalence().isSameGraph(v1, v2, givens),
                () -> "mutation " + mutation);
    }

    @ParameterizedTest(name = "seed {0}")
    @MethodSource("seeds")
    @DisplayName("both checks agree on graphs with shared and reused values")
    void checksAgreeOnDags(long seed) {
        Random random = new Random(seed);
        List<Step> recipe = recipe(random, 2 + random.nextInt(10));
        int mutated = random.nextInt(3) == 0 ? random.nextInt(recipe.size()) : -1;

        List<Value> shared = List.of(new Value(ValueType.F32, "s0"), new Value(ValueType.F32, "s1"));
        List<Value> side1 = realize(recipe, shared, -1, "x");
        List<Value> side2 = realize(recipe, shared, mutated, "y");
        Value v1 = side1.get(side1.size() - 1);
        Value v2 = side2.get(side2.size() - 1);

        Set<Value> reachable = Graphs.ancestors(List.of(v1));
        boolean forward = random.nextBoolean();
        boolean allLeavesCovered = true;
        Map<Value, Value> givens = new LinkedHashMap<>();
        for (int i = 0; i < recipe.size(); i++) {
            Step step = recipe.get(i);
            if (step.kind == StepKind.SHARED_LEAF || !reachable.contains(side1.get(i))) {
                continue;
            }
            int odds = switch (step.kind) {
                case OWN_LEAF -> 4;
                case CONSTANT -> 3;
                default -> 6;
            };
            if (random.nextInt(odds) == 0) {
                allLeavesCovered &= step.kind != StepKind.OWN_LEAF;
                continue;
            }
            // Own leaves are always substituted here; constants and derived steps only sometimes
            if (step.kind == StepKind.OWN_LEAF || random.nextInt(3) == 0) {
                if (forward) {
                    givens.put(side1.get(i), side2.get(i));
                } else {
                    givens.put(side2.get(i), side1.get(i));
                }
            }
        }

        boolean same = assertDoesNotThrow(() -> new GraphEquivalence().isSameGraph(v1, v2, givens));
        if (mutated < 0 && allLeavesCovered) {
            assertTrue(same, () -> "givens " + givens);
        }
    }

    private enum StepKind { SHARED_LEAF, OWN_LEAF, CONSTANT, OP }

    /** One recipe step; inputs index earlier steps. */
    private record Step(StepKind kind, int detail, Operator op, List<Integer> inputs) {}

    private static List<Step> recipe(Random random, int ops) {
        List<Step> steps = new ArrayList<>();
        steps.add(new Step(StepKind.OWN_LEAF, 0, null, List.of()));
        int leaves = 1 + random.nextInt(4);
        for (int i = 0; i < leaves; i++) {
            switch (random.nextInt(3)) {
                case 0 -> steps.add(new Step(StepKind.SHARED_LEAF, random.nextInt(2), null, List.of()));
                case 1 -> steps.add(new Step(StepKind.OWN_LEAF, 0, null, List.of()));
                default -> steps.add(new Step(StepKind.CONSTANT, random.nextInt(3), null, List.of()));
            }
        }
        for (int i = 0; i < ops; i++) {
            // Biased towards recent steps so roots stay deep while earlier steps get reused
            int last = steps.size() - 1;
            if (random.nextBoolean()) {
                Operator op = UNARY.get(random.nextInt(UNARY.size()));
                steps.add(new Step(StepKind.OP, 0, op, List.of(last - random.nextInt(Math.min(3, last + 1)))));
            } else {
                Operator op = BINARY.get(random.nextInt(BINARY.size()));
                steps.add(new Step(StepKind.OP, 0, op, List.of(last, random.nextInt(steps.size()))));
            }
        }
        return steps;
    }

    private static List<Value> realize(List<Step> recipe, List<Value> shared, int changeOp, String prefix) {
        List<Value> values = new ArrayList<>();
        for (int i = 0; i < recipe.size(); i++) {
            Step step = recipe.get(i);
            Value value = switch (step.kind) {
                case SHARED_LEAF -> shared.get(step.detail);
                case OWN_LEAF -> new Value(ValueType.F32, prefix + i);
                case CONSTANT -> new Constant(ValueType.F32, step.detail);
                case OP -> {
                    Value[] inputs = new Value[step.inputs.size()];
                    for (int k = 0; k < inputs.length; k++) {
                        inputs[k] = values.get(step.inputs.get(k));
                    }
                    yield (i == changeOp ? otherOp(step.op) : step.op).call(inputs);
                }
            };
            values.add(value);
        }
        return values;
    }

    private static Shape shape(Random random, int depth) {
        if (depth == 0 || random.nextInt(5) == 0) {
            return new Shape(null, List.of());
        }
        if (random.nextBoolean()) {
            Operator op = UNARY.get(random.nextInt(UNARY.size()));
            return new Shape(op, List.of(shape(random, depth - 1)));
        }
        Operator op = BINARY.get(random.nextInt(BINARY.size()));
        return new Shape(op, List.of(shape(random, depth - 1), shape(random, depth - 1)));
    }

    /**
     * Walks the shape, substituting some derived subtrees whole. Everything not hidden
     * under a substituted subtree is visible.
     */
    private static void chooseSubstitutions(Random random, Shape shape, List<Shape> visible,
                                            List<Shape> substituted) {
        if (!shape.isLeaf() && random.nextInt(8) == 0) {
            substituted.add(shape);
            return;
        }
        visible.add(shape);
        for (Shape child : shape.children) {
            chooseSubstitutions(random, child, visible, substituted);
        }
    }

    private static Shape pickTarget(Random random, List<Shape> visible, Mutation mutation) {
        if (mutation == Mutation.NONE) {
            return null;
        }
        List<Shape> eligible = new ArrayList<>();
        for (Shape s : visible) {
            if (s.isLeaf() == (mutation == Mutation.DROP_LEAF)) {
                eligible.add(s);
            }
        }
        return eligible.isEmpty() ? null : eligible.get(random.nextInt(eligible.size()));
    }

    private static Value build(Shape shape, Map<Shape, Value> built, Shape changeOp, String prefix) {
        Value value;
        if (shape.isLeaf()) {
            value = new Value(ValueType.F32, prefix + built.size());
        } else {
            Value[] inputs = new Value[shape.children.size()];
            for (int i = 0; i < inputs.length; i++) {
                inputs[i] = build(shape.children.get(i), built, changeOp, prefix);
            }
            Operator op = shape == changeOp ? otherOp(shape.op) : shape.op;
            value = op.call(inputs);
        }
        built.put(shape, value);
        return value;
    }

    private static Operator otherOp(Operator op) {
        List<Operator> family = UNARY.contains(op) ? UNARY : BINARY;
        return family.get((family.indexOf(op) + 1) % family.size());
    }
}
