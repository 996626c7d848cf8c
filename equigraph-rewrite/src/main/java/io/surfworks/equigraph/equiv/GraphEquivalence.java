package io.surfworks.equigraph.equiv;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.equigraph.compare.StructuralComparator;
import io.surfworks.equigraph.graph.GraphPrinter;
import io.surfworks.equigraph.graph.Graphs;
import io.surfworks.equigraph.graph.Value;

/**
 * Answers whether two values perform the same computation, checking itself as it goes.
 *
 * <p>"Same computation" means the same graph: {@code x * (y * z)} and
 * {@code (x * y) * z} are different even though they are numerically equal.
 * Substitutions ("givens") replace values before comparing:
 *
 * <pre>
 *   v1      v2      givens    result
 *   x + 1   x + 1   {}        true
 *   x + 1   y + 1   {}        false
 *   x + 1   y + 1   {x: y}    true
 * </pre>
 *
 * <p>Every call runs the {@link MergeEquivalenceChecker}. When the substitutions
 * allow it, the {@link StructuralComparator} runs as well and both answers must
 * agree. A disagreement throws {@link CrossValidationMismatchError}. The structural
 * check only runs when there are no substitutions, or when every substitution
 * replaces a value found only in one graph by a value found only in the other.
 * If a single substitution fails that test, the structural check is skipped for
 * the whole call.
 */
public final class GraphEquivalence {

    private static final Logger LOG = Logger.getLogger(GraphEquivalence.class.getName());

    private final MergeEquivalenceChecker mergeChecker;

    public GraphEquivalence() {
        this(new MergeEquivalenceChecker());
    }

    public GraphEquivalence(MergeEquivalenceChecker mergeChecker) {
        this.mergeChecker = Objects.requireNonNull(mergeChecker, "mergeChecker cannot be null");
    }

    /**
     * Returns true if both values perform the same computation.
     */
    public boolean isSameGraph(Value v1, Value v2) {
        return isSameGraph(v1, v2, Map.of());
    }

    /**
     * Returns true if both values perform the same computation after substitution.
     *
     * <p>Substitutions are not tied to either value: a substituted value found in
     * both graphs is replaced in both. Keys must not also appear as replacements.
     *
     * @param v1 the first value
     * @param v2 the second value
     * @param givens replace-this to replace-with, may be null
     * @return whether the values perform the same computation
     * @throws MalformedSubstitutionException if a key is not reachable from either value,
     *         or its replacement has another type
     * @throws CrossValidationMismatchError if the two checks disagree
     */
    public boolean isSameGraph(Value v1, Value v2, Map<Value, Value> givens) {
        Objects.requireNonNull(v1, "v1 cannot be null");
        Objects.requireNonNull(v2, "v2 cannot be null");
        Map<Value, Value> subs = givens == null ? Map.of() : givens;

        boolean mergeResult = mergeChecker.isSameGraph(v1, v2, subs);

        boolean crossChecked = subs.isEmpty() || cleanlySeparable(v1, v2, subs);
        if (crossChecked) {
            // The givens keep their direction: the key is what gets read as the value
            boolean structuralResult = StructuralComparator.equalComputations(
                    List.of(v1), List.of(v2), subs);
            if (structuralResult != mergeResult) {
                throw new CrossValidationMismatchError(mergeResult, structuralResult,
                        describe(v1, v2, subs));
            }
        }
        LOG.fine(() -> "isSameGraph(" + v1 + ", " + v2 + ") = " + mergeResult
                + (crossChecked ? " (cross-validated)" : " (merge only)"));
        return mergeResult;
    }

    /**
     * Returns true if every substitution replaces a value found only in the graph of
     * one compared value by a value found only in the graph of the other, in either
     * direction.
     */
    static boolean cleanlySeparable(Value v1, Value v2, Map<Value, Value> givens) {
        Set<Value> side1 = Graphs.valuesBetween(Graphs.graphInputs(List.of(v1)), List.of(v1));
        Set<Value> side2 = Graphs.valuesBetween(Graphs.graphInputs(List.of(v2)), List.of(v2));

        for (Map.Entry<Value, Value> e : givens.entrySet()) {
            Value from = e.getKey();
            Value to = e.getValue();
            boolean forward = onlyIn(from, side1, side2) && onlyIn(to, side2, side1);
            boolean backward = onlyIn(from, side2, side1) && onlyIn(to, side1, side2);
            if (!forward && !backward) {
                return false;
            }
        }
        return true;
    }

    private static boolean onlyIn(Value v, Set<Value> side, Set<Value> other) {
        return side.contains(v) && !other.contains(v);
    }

    private static String describe(Value v1, Value v2, Map<Value, Value> givens) {
        return "v1:\n" + GraphPrinter.print(v1) + "\nv2:\n" + GraphPrinter.print(v2)
                + "\ngivens: " + givens;
    }
}
