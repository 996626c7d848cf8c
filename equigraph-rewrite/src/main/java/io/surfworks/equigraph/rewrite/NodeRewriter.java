package io.surfworks.equigraph.rewrite;

import java.util.List;
import java.util.Optional;

import io.surfworks.equigraph.graph.Graph;
import io.surfworks.equigraph.graph.Node;
import io.surfworks.equigraph.graph.Value;

/**
 * A local rewrite rule: looks at one node and may propose replacements for its outputs.
 *
 * <p>Rewriters are applied by {@link PatternRewritePass}, which performs the actual
 * replacement. A rewriter must not edit the graph itself.
 *
 * <p>Example implementation:
 * <pre>{@code
 * public final class MulByOne implements NodeRewriter {
 *     @Override
 *     public String name() { return "mul_by_one"; }
 *
 *     @Override
 *     public Optional<List<Value>> rewrite(Graph graph, Node node) {
 *         // Match: mul(x, 1) -> x
 *         if (!node.op().name().equals("mul")) return Optional.empty();
 *         if (!(node.input(1) instanceof Constant c) || !c.data().equals(1)) {
 *             return Optional.empty();
 *         }
 *         return Optional.of(List.of(node.input(0)));
 *     }
 * }
 * }</pre>
 */
public interface NodeRewriter {

    /**
     * Returns the name of this rule, used in logging.
     */
    String name();

    /**
     * Attempts to rewrite a node.
     *
     * <p>The graph is provided for def-use queries such as
     * {@link Graph#clients(Value)}.
     *
     * @param graph the graph containing the node
     * @param node the node to look at
     * @return one replacement per node output, or empty if the rule does not apply
     */
    Optional<List<Value>> rewrite(Graph graph, Node node);
}
