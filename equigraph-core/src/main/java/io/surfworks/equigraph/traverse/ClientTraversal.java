package io.surfworks.equigraph.traverse;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import io.surfworks.equigraph.graph.Client;
import io.surfworks.equigraph.graph.Graph;
import io.surfworks.equigraph.graph.Node;
import io.surfworks.equigraph.graph.Value;

/**
 * Enumerates the nodes reached by following client edges an exact number of steps
 * downstream.
 *
 * <p>For every output of the start node, a depth greater than zero follows each node
 * client of that output one level deeper; graph-output uses are terminal and are
 * skipped. At depth zero the owner of the output is produced, which is the node
 * itself, once per output. A node with two outputs is therefore produced twice at
 * depth zero.
 *
 * <p>Results are lazy and the traversal can be abandoned at any point. Each call to
 * {@link Iterable#iterator()} starts over. The traversal terminates because graphs
 * are acyclic.
 *
 * <pre>{@code
 * // x -> a -> b -> c
 * for (Node n : ClientTraversal.clientsAtDepth(graph, a, 2)) {
 *     // n == c
 * }
 * }</pre>
 */
public final class ClientTraversal {

    private ClientTraversal() {} // Utility class

    /**
     * Returns the nodes exactly {@code depth} client steps downstream of {@code node}.
     *
     * @param graph the graph whose client index is followed
     * @param node the start node
     * @param depth number of steps, zero or more
     * @return a restartable, lazily evaluated sequence of nodes
     * @throws IllegalArgumentException if depth is negative
     */
    public static Iterable<Node> clientsAtDepth(Graph graph, Node node, int depth) {
        Objects.requireNonNull(graph, "graph cannot be null");
        Objects.requireNonNull(node, "node cannot be null");
        if (depth < 0) {
            throw new IllegalArgumentException("Depth must be non-negative: " + depth);
        }
        return () -> new ClientIterator(graph, node, depth);
    }

    /**
     * Stream form of {@link #clientsAtDepth(Graph, Node, int)}.
     */
    public static Stream<Node> stream(Graph graph, Node node, int depth) {
        return StreamSupport.stream(clientsAtDepth(graph, node, depth).spliterator(), false);
    }

    /**
     * One pending visit: the node, its remaining depth, and how far through its
     * outputs and their clients the walk has progressed.
     */
    private static final class Frame {
        final Node node;
        final int depth;
        int output;
        List<Client> clients;
        int client;

        Frame(Node node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }

    private static final class ClientIterator implements Iterator<Node> {

        private final Graph graph;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private Node next;

        ClientIterator(Graph graph, Node start, int depth) {
            this.graph = graph;
            stack.push(new Frame(start, depth));
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Node next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Node result = next;
            next = null;
            return result;
        }

        private Node advance() {
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<Value> outputs = frame.node.outputs();
                if (frame.output >= outputs.size()) {
                    stack.pop();
                    continue;
                }
                Value out = outputs.get(frame.output);

                if (frame.depth == 0) {
                    frame.output++;
                    return out.owner();
                }

                if (frame.clients == null) {
                    frame.clients = graph.clients(out);
                    frame.client = 0;
                }
                if (frame.client >= frame.clients.size()) {
                    frame.clients = null;
                    frame.output++;
                    continue;
                }
                Client use = frame.clients.get(frame.client++);
                if (use instanceof Client.NodeInput in) {
                    stack.push(new Frame(in.node(), frame.depth - 1));
                }
            }
            return null;
        }
    }
}
