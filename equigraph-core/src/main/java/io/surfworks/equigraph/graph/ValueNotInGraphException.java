package io.surfworks.equigraph.graph;

/**
 * Thrown when an edit names a value that the graph does not track.
 */
public class ValueNotInGraphException extends GraphException {

    private final transient Value value;

    public ValueNotInGraphException(Value value) {
        super("Value '" + value + "' is not part of the graph");
        this.value = value;
    }

    public Value getValue() {
        return value;
    }
}
