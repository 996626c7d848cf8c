package io.surfworks.equigraph.rewrite;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import io.surfworks.equigraph.graph.Constant;
import io.surfworks.equigraph.graph.Graph;
import io.surfworks.equigraph.graph.Node;
import io.surfworks.equigraph.graph.Op;
import io.surfworks.equigraph.graph.Value;

/**
 * Unifies nodes that provably compute the same result.
 *
 * <p>The pass first replaces every constant by the first tracked constant with the
 * same signature. It then visits nodes in topological order; a node whose op is equal
 * to, and whose inputs are the very same values as, an earlier node's has its outputs
 * replaced by that earlier node's outputs. Because producers are visited before their
 * consumers, merging cascades: once two subtrees' leaves coincide, the whole subtrees
 * collapse into one.
 *
 * <p>After the pass, two values compute the same thing exactly when they are the same
 * value, so "same computation" can be read off as "same owner". Leaves other than
 * constants are never rewritten. Running the pass a second time changes nothing.
 *
 * <pre>{@code
 * MergePass merge = new MergePass();
 * merge.optimize(graph);
 * boolean same = graph.output(0).owner() == graph.output(1).owner();
 * }</pre>
 */
public final class MergePass implements GraphPass {

    private static final Logger LOG = Logger.getLogger(MergePass.class.getName());

    private int lastMergeCount;

    @Override
    public String name() {
        return "merge";
    }

    @Override
    public String description() {
        return "Unifies identical constants and nodes with equal ops and identical inputs";
    }

    @Override
    public void optimize(Graph graph) {
        lastMergeCount = mergeConstants(graph) + mergeNodes(graph);
        LOG.fine(() -> "Merged " + lastMergeCount + " duplicates in " + graph);
    }

    /**
     * Returns the number of constants and nodes merged by the last {@link #optimize} call.
     */
    public int lastMergeCount() {
        return lastMergeCount;
    }

    private static int mergeConstants(Graph graph) {
        Map<Constant.Signature, Constant> canonical = new HashMap<>();
        int merged = 0;
        for (Value v : List.copyOf(graph.values())) {
            if (!(v instanceof Constant c) || !graph.contains(c)) {
                continue;
            }
            Constant first = canonical.putIfAbsent(c.signature(), c);
            if (first != null) {
                graph.replace(c, first);
                merged++;
            }
        }
        return merged;
    }

    private static int mergeNodes(Graph graph) {
        Map<NodeKey, Node> seen = new HashMap<>();
        int merged = 0;
        for (Node node : graph.toposort()) {
            if (!graph.contains(node)) {
                continue;
            }
            NodeKey key = new NodeKey(node.op(), List.copyOf(node.inputs()));
            Node earlier = seen.putIfAbsent(key, node);
            if (earlier == null || earlier == node || !sameOutputTypes(earlier, node)) {
                continue;
            }
            for (int i = 0; i < node.outputs().size(); i++) {
                Value out = node.output(i);
                // The node drops out of the graph once its last used output is replaced
                if (graph.contains(out)) {
                    graph.replace(out, earlier.output(i));
                }
            }
            merged++;
        }
        return merged;
    }

    private static boolean sameOutputTypes(Node a, Node b) {
        if (a.outputs().size() != b.outputs().size()) {
            return false;
        }
        for (int i = 0; i < a.outputs().size(); i++) {
            if (!a.output(i).type().equals(b.output(i).type())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("MergePass[lastMerges=%d]", lastMergeCount);
    }

    /**
     * Op plus the exact input values. List equality compares values by identity.
     */
    private record NodeKey(Op op, List<Value> inputs) {}
}
