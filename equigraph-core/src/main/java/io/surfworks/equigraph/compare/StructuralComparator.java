package io.surfworks.equigraph.compare;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.surfworks.equigraph.graph.Constant;
import io.surfworks.equigraph.graph.Node;
import io.surfworks.equigraph.graph.Value;

/**
 * Decides whether two lists of values compute the same thing by walking both
 * graphs in parallel.
 *
 * <p>Two derived values are equal when they are the same output of nodes with equal
 * ops, the same number of inputs and outputs, and pairwise equal inputs. Two leaves
 * are equal when they are the same value or constants with the same signature.
 *
 * <p>Substitutions are read, not applied: wherever the walk meets a substitution key,
 * on either side, it continues with the key's replacement instead. A key therefore
 * never counts through its own structure or signature, however often it is used.
 * Keys are not expected to appear as replacements.
 *
 * <p>This comparator never edits the graphs and shares no code with the merge pass,
 * so the two can be used to check each other.
 *
 * <pre>{@code
 * // x + 1 versus y + 1, assuming x == y
 * boolean same = StructuralComparator.equalComputations(
 *         List.of(xPlusOne), List.of(yPlusOne), List.of(x), List.of(y));
 * }</pre>
 */
public final class StructuralComparator {

    private StructuralComparator() {} // Utility class

    /**
     * Compares two output lists without assumptions.
     *
     * @see #equalComputations(List, List, Map)
     */
    public static boolean equalComputations(List<Value> xs, List<Value> ys) {
        return equalComputations(xs, ys, Map.of());
    }

    /**
     * Compares two output lists, reading each {@code inXs[i]} as its partner
     * {@code inYs[i]}.
     *
     * @param xs outputs of the first graph
     * @param ys outputs of the second graph, aligned with {@code xs}
     * @param inXs values of the first graph assumed equal to their partner, may be null
     * @param inYs partners of {@code inXs} in the second graph, may be null
     * @return true if every {@code xs[i]} computes the same as {@code ys[i]}; false as
     *         well when the assumed lists differ in length, or a pair differs in type or
     *         gives one value two partners
     * @throws IllegalArgumentException if {@code xs} and {@code ys} differ in length
     */
    public static boolean equalComputations(List<Value> xs, List<Value> ys,
                                            List<Value> inXs, List<Value> inYs) {
        List<Value> assumedXs = inXs == null ? List.of() : inXs;
        List<Value> assumedYs = inYs == null ? List.of() : inYs;
        if (assumedXs.size() != assumedYs.size()) {
            checkSizes(xs, ys);
            return false;
        }
        Map<Value, Value> substitutions = new HashMap<>();
        for (int i = 0; i < assumedXs.size(); i++) {
            Value ax = assumedXs.get(i);
            Value ay = assumedYs.get(i);
            Value earlier = substitutions.putIfAbsent(ax, ay);
            if (!ax.type().equals(ay.type()) || (earlier != null && earlier != ay)) {
                checkSizes(xs, ys);
                return false;
            }
        }
        return equalComputations(xs, ys, substitutions);
    }

    /**
     * Compares two output lists pairwise, reading every occurrence of a key of
     * {@code substitutions} as its value.
     *
     * @param xs outputs of the first graph
     * @param ys outputs of the second graph, aligned with {@code xs}
     * @param substitutions replacement for each key, on either side
     * @return true if every {@code xs[i]} computes the same as {@code ys[i]}
     * @throws IllegalArgumentException if {@code xs} and {@code ys} differ in length
     */
    public static boolean equalComputations(List<Value> xs, List<Value> ys,
                                            Map<Value, Value> substitutions) {
        checkSizes(xs, ys);
        Comparison cmp = new Comparison(substitutions);
        for (int i = 0; i < xs.size(); i++) {
            if (!cmp.valuesEqual(xs.get(i), ys.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static void checkSizes(List<Value> xs, List<Value> ys) {
        if (xs.size() != ys.size()) {
            throw new IllegalArgumentException("Cannot compare " + xs.size()
                    + " outputs with " + ys.size() + " outputs");
        }
    }

    /**
     * Pair of values from the two graphs. Record equality delegates to value
     * identity.
     */
    private record Pair(Value x, Value y) {}

    /**
     * Substitutions and the pairs already proven equal during one comparison.
     * Pairs are always stored after resolution.
     */
    private static final class Comparison {
        final Map<Value, Value> substitutions;
        final Set<Pair> common = new HashSet<>();
        final Set<NodePair> open = new HashSet<>();

        Comparison(Map<Value, Value> substitutions) {
            this.substitutions = substitutions;
        }

        Value resolve(Value v) {
            Value to = substitutions.get(v);
            return to == null ? v : to;
        }

        boolean valuesEqual(Value x, Value y) {
            Value rx = resolve(x);
            Value ry = resolve(y);
            return switch (shallow(rx, ry)) {
                case EQUAL -> true;
                case DIFFERENT -> false;
                case PENDING -> nodesEqual(rx.owner(), ry.owner());
            };
        }

        /**
         * Settles a resolved pair without descending: PENDING means both are the
         * same output of two nodes that still need comparing.
         */
        private Verdict shallow(Value rx, Value ry) {
            if (rx == ry || common.contains(new Pair(rx, ry))) {
                return Verdict.EQUAL;
            }
            if (!rx.type().equals(ry.type())) {
                return Verdict.DIFFERENT;
            }
            if (rx.isLeaf() || ry.isLeaf()) {
                boolean constants = rx instanceof Constant cx && ry instanceof Constant cy
                        && cx.sameSignature(cy);
                return constants ? Verdict.EQUAL : Verdict.DIFFERENT;
            }
            return rx.index() == ry.index() ? Verdict.PENDING : Verdict.DIFFERENT;
        }

        /**
         * Compares two nodes. Works on an explicit stack: a pair of nodes is only
         * concluded once all of its input pairs have been concluded.
         */
        boolean nodesEqual(Node rootX, Node rootY) {
            Deque<NodePair> pending = new ArrayDeque<>();
            push(new NodePair(rootX, rootY), pending);
            while (!pending.isEmpty()) {
                NodePair top = pending.peek();
                Verdict verdict = examine(top.x(), top.y(), pending);
                if (verdict == Verdict.PENDING) {
                    continue;
                }
                pending.pop();
                open.remove(top);
                if (verdict == Verdict.DIFFERENT) {
                    // A failed pair fails every pair waiting on it, up to the root
                    open.clear();
                    return false;
                }
                for (int i = 0; i < top.x().outputs().size(); i++) {
                    common.add(new Pair(top.x().output(i), top.y().output(i)));
                }
            }
            return true;
        }

        private void push(NodePair pair, Deque<NodePair> pending) {
            pending.push(pair);
            open.add(pair);
        }

        private Verdict examine(Node nx, Node ny, Deque<NodePair> pending) {
            if (!nx.op().equals(ny.op())
                    || nx.inputs().size() != ny.inputs().size()
                    || nx.outputs().size() != ny.outputs().size()) {
                return Verdict.DIFFERENT;
            }
            for (int i = 0; i < nx.inputs().size(); i++) {
                Value dx = resolve(nx.input(i));
                Value dy = resolve(ny.input(i));
                Verdict verdict = shallow(dx, dy);
                if (verdict == Verdict.DIFFERENT) {
                    return Verdict.DIFFERENT;
                }
                if (verdict == Verdict.PENDING) {
                    NodePair next = new NodePair(dx.owner(), dy.owner());
                    if (open.contains(next)) {
                        // Substitutions that lead back into their own keys
                        return Verdict.DIFFERENT;
                    }
                    push(next, pending);
                    return Verdict.PENDING;
                }
            }
            return Verdict.EQUAL;
        }
    }

    private record NodePair(Node x, Node y) {}

    private enum Verdict { EQUAL, DIFFERENT, PENDING }
}
