package io.surfworks.equigraph.graph;

import java.util.Objects;

/**
 * A leaf value carrying a fixed datum.
 *
 * <p>The datum is opaque: it is never evaluated, only compared with
 * {@link Object#equals}. Two constants with equal types and data have the same
 * signature; the merge pass unifies them and structural comparison treats them
 * as equal. Constants are never graph inputs.
 */
public final class Constant extends Value {

    private final Object data;

    public Constant(ValueType type, Object data) {
        this(type, data, null);
    }

    public Constant(ValueType type, Object data, String name) {
        super(type, name);
        this.data = Objects.requireNonNull(data, "data cannot be null");
    }

    public Object data() {
        return data;
    }

    /**
     * Returns true if the other constant has the same type and an equal datum.
     */
    public boolean sameSignature(Constant other) {
        return type().equals(other.type()) && data.equals(other.data);
    }

    /**
     * Returns a key that is equal for constants with the same signature.
     */
    public Signature signature() {
        return new Signature(type(), data);
    }

    @Override
    public String toString() {
        return name() != null ? name() : String.valueOf(data);
    }

    /**
     * Hashable form of a constant's type and datum.
     */
    public record Signature(ValueType type, Object data) {}
}
