package io.surfworks.equigraph.graph;

/**
 * Thrown when a leaf reached from the graph outputs is neither a declared input nor
 * a {@link Constant}.
 */
public class MissingInputException extends GraphException {

    private final transient Value value;

    public MissingInputException(Value value) {
        super("Leaf '" + value + "' of type " + value.type() + " is not a graph input");
        this.value = value;
    }

    public Value getValue() {
        return value;
    }
}
