package io.surfworks.equigraph.equiv;

import io.surfworks.equigraph.graph.GraphException;
import io.surfworks.equigraph.graph.Value;

/**
 * Thrown when a substitution names a value that neither compared graph computes, or
 * would replace a value by one of another type.
 */
public class MalformedSubstitutionException extends GraphException {

    private final transient Value key;

    public MalformedSubstitutionException(Value key) {
        super("Substitution key '" + key + "' is not reachable from either compared value");
        this.key = key;
    }

    public MalformedSubstitutionException(Value key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * Returns the offending key, as passed by the caller.
     */
    public Value getKey() {
        return key;
    }
}
