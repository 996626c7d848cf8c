package io.surfworks.equigraph.rewrite;

import io.surfworks.equigraph.graph.Graph;

/**
 * A transformation applied to a {@link Graph} in place.
 *
 * <p>Passes are registered in a {@link io.surfworks.equigraph.rewrite.registry.PassRegistry}
 * under a name and a set of tags, selected with a query, and run by
 * {@link GraphOptimizer}.
 *
 * <p>Example implementation:
 * <pre>{@code
 * public final class DropIdentityPass implements GraphPass {
 *     @Override
 *     public String name() { return "drop_identity"; }
 *
 *     @Override
 *     public void optimize(Graph graph) {
 *         for (Node node : graph.toposort()) {
 *             if (node.op().name().equals("identity") && graph.contains(node)) {
 *                 graph.replace(node.output(0), node.input(0));
 *             }
 *         }
 *     }
 * }
 * }</pre>
 */
public interface GraphPass {

    /**
     * Returns the name of this pass, used in logging.
     */
    String name();

    /**
     * Rewrites the graph in place.
     *
     * @param graph the graph to transform
     */
    void optimize(Graph graph);

    /**
     * Returns a human-readable description of this pass.
     */
    default String description() {
        return name() + " pass";
    }
}
