package io.surfworks.equigraph.graph;

import java.util.Objects;

/**
 * A typed data slot in a computation graph.
 *
 * <p>A Value is either a <em>leaf</em> (a graph input or a {@link Constant}, with no
 * owner) or <em>derived</em>, in which case it is output number {@link #index()} of
 * exactly one owning {@link Node}.
 *
 * <p>Values are compared by reference identity only. Two Values holding the same
 * computation are distinct until a rewrite (such as merging) makes them the same
 * object. {@link Object#equals} and {@link Object#hashCode} are not overridden, so
 * Values key ordinary hash maps by identity.
 */
public class Value {

    private final ValueType type;
    private final String name;
    private final Node owner;
    private final int index;

    /**
     * Creates a leaf value.
     *
     * @param type the value type
     * @param name a debug name, may be null
     */
    public Value(ValueType type, String name) {
        this(type, name, null, -1);
    }

    Value(ValueType type, String name, Node owner, int index) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.name = name;
        this.owner = owner;
        this.index = index;
    }

    public ValueType type() {
        return type;
    }

    /**
     * Returns the debug name, or null if the value is anonymous.
     */
    public String name() {
        return name;
    }

    /**
     * Returns the node producing this value, or null for a leaf.
     */
    public Node owner() {
        return owner;
    }

    /**
     * Returns the position of this value among its owner's outputs, or -1 for a leaf.
     */
    public int index() {
        return index;
    }

    public boolean isLeaf() {
        return owner == null;
    }

    @Override
    public String toString() {
        if (name != null) {
            return name;
        }
        if (owner != null) {
            return owner.op().name() + "." + index;
        }
        return "<" + type + ">";
    }
}
