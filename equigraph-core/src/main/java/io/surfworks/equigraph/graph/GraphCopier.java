package io.surfworks.equigraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep-copies values and nodes while preserving sharing.
 *
 * <p>A copier remembers every object it has copied, keyed by identity. Copying
 * several objects through the same copier therefore yields one combined copy: a
 * value reachable from two of the copied roots maps to a single copied value. No
 * copied node or value is reference-equal to an original.
 *
 * <p>Example:
 * <pre>{@code
 * GraphCopier copier = new GraphCopier();
 * Value a = copier.copy(var1);
 * Value b = copier.copy(var2);                 // shares copies with a
 * Map<Value, Value> g = copier.copyGivens(givens);  // keys and targets too
 * }</pre>
 *
 * <p>A copier is single-use state for one copy operation and is not thread-safe.
 */
public final class GraphCopier {

    private final Map<Value, Value> values = new IdentityHashMap<>();
    private final Map<Node, Node> nodes = new IdentityHashMap<>();

    /**
     * Copies a value together with everything it depends on.
     *
     * @param value the value to copy
     * @return the copy
     */
    public Value copy(Value value) {
        Value done = values.get(value);
        if (done != null) {
            return done;
        }
        if (value.isLeaf()) {
            Value leaf = copyLeaf(value);
            values.put(value, leaf);
            return leaf;
        }
        return copy(value.owner()).output(value.index());
    }

    /**
     * Copies a node together with everything it depends on.
     *
     * @param node the node to copy
     * @return the copy
     */
    public Node copy(Node node) {
        Node done = nodes.get(node);
        if (done != null) {
            return done;
        }
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(node);
        while (!pending.isEmpty()) {
            Node current = pending.peek();
            if (nodes.containsKey(current)) {
                pending.pop();
                continue;
            }
            boolean ready = true;
            for (Value in : current.inputs()) {
                Node producer = in.owner();
                if (producer != null && !nodes.containsKey(producer)) {
                    pending.push(producer);
                    ready = false;
                }
            }
            if (ready) {
                pending.pop();
                copyReadyNode(current);
            }
        }
        return nodes.get(node);
    }

    /**
     * Copies each value, preserving order.
     */
    public List<Value> copyAll(Collection<Value> originals) {
        List<Value> copies = new ArrayList<>(originals.size());
        for (Value v : originals) {
            copies.add(copy(v));
        }
        return copies;
    }

    /**
     * Copies a substitution mapping, keys and targets alike, preserving entry order.
     */
    public Map<Value, Value> copyGivens(Map<Value, Value> givens) {
        Map<Value, Value> copies = new LinkedHashMap<>();
        for (Map.Entry<Value, Value> e : givens.entrySet()) {
            copies.put(copy(e.getKey()), copy(e.getValue()));
        }
        return copies;
    }

    /**
     * Returns the copy of an original value, or null if it has not been copied.
     */
    public Value lookup(Value original) {
        return values.get(original);
    }

    /**
     * Returns the number of values copied so far.
     */
    public int copiedValueCount() {
        return values.size();
    }

    private void copyReadyNode(Node original) {
        List<Value> inputs = new ArrayList<>(original.inputs().size());
        for (Value in : original.inputs()) {
            inputs.add(copy(in));
        }
        List<ValueType> types = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (Value out : original.outputs()) {
            types.add(out.type());
            names.add(out.name());
        }
        Node copy = new Node(original.op(), inputs, types, names);
        nodes.put(original, copy);
        for (int i = 0; i < original.outputs().size(); i++) {
            values.put(original.output(i), copy.output(i));
        }
    }

    private static Value copyLeaf(Value leaf) {
        if (leaf instanceof Constant c) {
            return new Constant(c.type(), c.data(), c.name());
        }
        return new Value(leaf.type(), leaf.name());
    }
}
