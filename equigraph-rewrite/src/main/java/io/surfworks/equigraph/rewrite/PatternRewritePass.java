package io.surfworks.equigraph.rewrite;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.equigraph.graph.Graph;
import io.surfworks.equigraph.graph.Node;
import io.surfworks.equigraph.graph.Value;

/**
 * Applies {@link NodeRewriter}s until the graph stops changing.
 *
 * <p>Each sweep visits the nodes in topological order and tries the rewriters in
 * registration order; the first one that proposes a change wins for that node.
 * Sweeps repeat until one makes no change, or until {@code maxIterations} sweeps have
 * run, in which case a warning is logged and the graph is left as it is.
 *
 * <pre>{@code
 * PatternRewritePass pass = new PatternRewritePass("simplify", 32)
 *     .addRewriter(new MulByOne())
 *     .addRewriter(new AddZero());
 * pass.optimize(graph);
 * }</pre>
 */
public final class PatternRewritePass implements GraphPass {

    private static final Logger LOG = Logger.getLogger(PatternRewritePass.class.getName());

    private final String name;
    private final int maxIterations;
    private final List<NodeRewriter> rewriters = new ArrayList<>();
    private int lastRewriteCount;
    private int lastIterationCount;

    /**
     * Creates a pass with no rewriters.
     *
     * @param name the pass name
     * @param maxIterations maximum number of sweeps per run
     */
    public PatternRewritePass(String name, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.name = name;
        this.maxIterations = maxIterations;
    }

    /**
     * Adds a rewriter.
     *
     * @param rewriter the rewriter to add
     * @return this pass for chaining
     */
    public PatternRewritePass addRewriter(NodeRewriter rewriter) {
        rewriters.add(rewriter);
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void optimize(Graph graph) {
        lastRewriteCount = 0;
        lastIterationCount = 0;
        if (rewriters.isEmpty()) {
            return;
        }
        boolean changed = true;
        while (changed && lastIterationCount < maxIterations) {
            changed = sweep(graph);
            lastIterationCount++;
        }
        if (changed) {
            LOG.warning(() -> "Pass '" + name + "' stopped after " + maxIterations
                    + " sweeps without reaching a fixed point");
        }
        LOG.fine(() -> "Pass '" + name + "' applied " + lastRewriteCount + " rewrites in "
                + lastIterationCount + " sweeps");
    }

    private boolean sweep(Graph graph) {
        boolean changed = false;
        for (Node node : graph.toposort()) {
            for (NodeRewriter rewriter : rewriters) {
                if (!graph.contains(node)) {
                    break;
                }
                Optional<List<Value>> replacement = rewriter.rewrite(graph, node);
                if (replacement.isPresent() && apply(graph, node, replacement.get(), rewriter)) {
                    changed = true;
                    lastRewriteCount++;
                    break;
                }
            }
        }
        return changed;
    }

    private static boolean apply(Graph graph, Node node, List<Value> replacement, NodeRewriter rewriter) {
        if (replacement.size() != node.outputs().size()) {
            throw new IllegalStateException("Rewriter '" + rewriter.name() + "' returned "
                    + replacement.size() + " values for a node with " + node.outputs().size() + " outputs");
        }
        boolean changed = false;
        for (int i = 0; i < replacement.size(); i++) {
            Value out = node.output(i);
            Value by = replacement.get(i);
            if (by != null && by != out && graph.contains(out)) {
                graph.replace(out, by);
                changed = true;
            }
        }
        if (changed) {
            LOG.finer(() -> "Rewriter '" + rewriter.name() + "' rewrote " + node);
        }
        return changed;
    }

    /**
     * Returns the number of nodes rewritten by the last {@link #optimize} call.
     */
    public int lastRewriteCount() {
        return lastRewriteCount;
    }

    /**
     * Returns the number of sweeps performed by the last {@link #optimize} call.
     */
    public int lastIterationCount() {
        return lastIterationCount;
    }

    /**
     * Returns the registered rewriters.
     */
    public List<NodeRewriter> rewriters() {
        return List.copyOf(rewriters);
    }

    @Override
    public String toString() {
        return String.format("PatternRewritePass[%s, rewriters=%d, lastRewrites=%d]",
                name, rewriters.size(), lastRewriteCount);
    }
}
