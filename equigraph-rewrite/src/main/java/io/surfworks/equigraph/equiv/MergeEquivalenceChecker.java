package io.surfworks.equigraph.equiv;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

import io.surfworks.equigraph.graph.Constant;
import io.surfworks.equigraph.graph.Graph;
import io.surfworks.equigraph.graph.GraphCopier;
import io.surfworks.equigraph.graph.Graphs;
import io.surfworks.equigraph.graph.Node;
import io.surfworks.equigraph.graph.Value;
import io.surfworks.equigraph.rewrite.GraphPass;
import io.surfworks.equigraph.rewrite.MergePass;

/**
 * Decides whether two values compute the same thing by merging their graphs.
 *
 * <p>Both values and the substitutions are deep-copied together, so shared
 * structure stays shared and the caller's graphs are never edited. The copies are
 * placed in one throwaway graph, the substitutions are applied, and the merge pass
 * collapses identical computations. The values are then equivalent when they end up
 * as the same output of the same owner node, or are the same leaf.
 */
public final class MergeEquivalenceChecker {

    private static final Logger LOG = Logger.getLogger(MergeEquivalenceChecker.class.getName());

    private final Supplier<? extends GraphPass> mergePass;

    public MergeEquivalenceChecker() {
        this(MergePass::new);
    }

    /**
     * Creates a checker with a custom merging pass.
     *
     * @param mergePass creates a fresh pass per check; the pass must leave two values
     *                  with the same owner exactly when they compute the same thing
     */
    public MergeEquivalenceChecker(Supplier<? extends GraphPass> mergePass) {
        this.mergePass = Objects.requireNonNull(mergePass, "mergePass cannot be null");
    }

    /**
     * Returns true if {@code v1} and {@code v2} compute the same thing after
     * substitution.
     *
     * @param v1 the first value
     * @param v2 the second value
     * @param givens replace-this to replace-with; keys must be computed by {@code v1}
     *               or {@code v2}
     * @return whether both values end up as the same computation
     * @throws MalformedSubstitutionException if a key is not reachable from either value,
     *         or its replacement has another type
     */
    public boolean isSameGraph(Value v1, Value v2, Map<Value, Value> givens) {
        GraphCopier copier = new GraphCopier();
        Value c1 = copier.copy(v1);
        Value c2 = copier.copy(v2);
        Map<Value, Value> copiedGivens = copier.copyGivens(givens);

        // The copies are already private; copying again would detach them from the givens.
        List<Value> roots = new ArrayList<>(List.of(c1, c2));
        roots.addAll(copiedGivens.values());
        List<Value> inputs = new ArrayList<>();
        for (Value leaf : Graphs.graphInputs(roots)) {
            if (!(leaf instanceof Constant)) {
                inputs.add(leaf);
            }
        }
        Graph graph = new Graph(inputs, List.of(c1, c2));

        for (Map.Entry<Value, Value> e : givens.entrySet()) {
            Value key = e.getKey();
            if (!graph.contains(copier.lookup(key))) {
                throw new MalformedSubstitutionException(key);
            }
            if (!key.type().equals(e.getValue().type())) {
                throw new MalformedSubstitutionException(key, "Substitution key '" + key
                        + "' of type " + key.type() + " cannot be replaced by '"
                        + e.getValue() + "' of type " + e.getValue().type());
            }
        }
        for (Map.Entry<Value, Value> e : copiedGivens.entrySet()) {
            // An earlier replacement may have cut this key out of the graph already
            if (graph.contains(e.getKey())) {
                graph.replace(e.getKey(), e.getValue());
            }
        }

        mergePass.get().optimize(graph);

        Value r1 = copiedGivens.getOrDefault(graph.output(0), graph.output(0));
        Value r2 = copiedGivens.getOrDefault(graph.output(1), graph.output(1));
        Node o1 = r1.owner();
        Node o2 = r2.owner();
        // Sibling outputs share an owner but are different computations
        boolean same = o1 == null && o2 == null ? r1 == r2 : o1 == o2 && r1.index() == r2.index();
        LOG.finer(() -> "Merge check of " + v1 + " and " + v2 + " with " + givens.size()
                + " givens: " + same);
        return same;
    }
}
