package io.surfworks.equigraph.graph;

/**
 * Exception thrown when a graph is built or edited in a way that breaks its
 * invariants.
 */
public class GraphException extends RuntimeException {

    public GraphException(String message) {
        super(message);
    }

    public GraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
