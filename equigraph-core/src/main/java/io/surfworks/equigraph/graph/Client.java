package io.surfworks.equigraph.graph;

import java.util.Objects;

/**
 * One use of a value inside a {@link Graph}.
 *
 * <p>A use is either an input slot of a node or one of the graph's designated
 * outputs. The output marker is terminal: there is no node behind it to traverse.
 */
public sealed interface Client permits Client.NodeInput, Client.GraphOutput {

    /**
     * Position of the use: the node input index, or the graph output index.
     */
    int index();

    static Client input(Node node, int index) {
        return new NodeInput(node, index);
    }

    static Client output(int index) {
        return new GraphOutput(index);
    }

    /**
     * The value is input number {@code index} of {@code node}.
     */
    record NodeInput(Node node, int index) implements Client {
        public NodeInput {
            Objects.requireNonNull(node, "node cannot be null");
        }
    }

    /**
     * The value is output number {@code index} of the graph.
     */
    record GraphOutput(int index) implements Client {}
}
