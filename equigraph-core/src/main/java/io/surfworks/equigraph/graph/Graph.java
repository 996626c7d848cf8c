package io.surfworks.equigraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * A mutable computation graph over designated inputs and outputs.
 *
 * <p>Besides the inputs and outputs, a Graph tracks every node and value on a path
 * from the inputs to the outputs and keeps a client index: for each tracked value,
 * the ordered list of its uses ({@link Client.NodeInput} for node input slots,
 * {@link Client.GraphOutput} for designated outputs).
 *
 * <p>Edits go through {@link #replace(Value, Value)}, which rewires the uses of a
 * value and updates the index in the same call. A node that loses its last use is
 * not modified; it simply stops being tracked, together with any upstream values
 * that only it used. The index therefore always matches the graph reachable from
 * the outputs ({@link #checkIntegrity()} verifies this).
 *
 * <p>Example:
 * <pre>{@code
 * Value x = new Value(ValueType.F32, "x");
 * Value y = new Value(ValueType.F32, "y");
 * Value sum = Operator.of("add").call(x, new Constant(ValueType.F32, 1));
 *
 * Graph graph = new Graph(List.of(x, y), List.of(sum));
 * graph.replace(x, y);                  // sum is now add(y, 1)
 * List<Client> uses = graph.clients(y); // [NodeInput[add, 0]]
 * }</pre>
 *
 * <p>Graphs are not thread-safe.
 */
public final class Graph {

    private static final Logger LOG = Logger.getLogger(Graph.class.getName());

    private final List<Value> inputs;
    private final Set<Value> inputSet;
    private final List<Value> outputs;
    private final Set<Node> nodes = new LinkedHashSet<>();
    private final Set<Value> values = new LinkedHashSet<>();
    private final Map<Value, List<Client>> clients = new HashMap<>();

    /**
     * Builds a graph over the given values without copying them.
     *
     * @param inputs the graph inputs; leaves that are not constants
     * @param outputs the graph outputs
     * @throws IllegalArgumentException if an input is not a plain leaf or is repeated
     * @throws MissingInputException if an output depends on an undeclared leaf
     */
    public Graph(List<Value> inputs, List<Value> outputs) {
        this.inputs = new ArrayList<>(inputs.size());
        this.inputSet = new HashSet<>();
        for (Value in : inputs) {
            Objects.requireNonNull(in, "graph inputs cannot contain null");
            if (!in.isLeaf()) {
                throw new IllegalArgumentException("Graph input '" + in + "' has an owner");
            }
            if (in instanceof Constant) {
                throw new IllegalArgumentException("Constant '" + in + "' cannot be a graph input");
            }
            if (!inputSet.add(in)) {
                throw new IllegalArgumentException("Graph input '" + in + "' is repeated");
            }
            this.inputs.add(in);
            values.add(in);
            clients.put(in, new ArrayList<>());
        }
        this.outputs = new ArrayList<>(outputs.size());
        for (int i = 0; i < outputs.size(); i++) {
            Value out = Objects.requireNonNull(outputs.get(i), "graph outputs cannot contain null");
            importValue(out);
            this.outputs.add(out);
            clients.get(out).add(Client.output(i));
        }
    }

    /**
     * Builds a graph whose inputs are the non-constant leaves of the outputs.
     *
     * @param outputs the graph outputs
     * @param clone whether to deep-copy the outputs first
     * @return the new graph
     */
    public static Graph fromOutputs(List<Value> outputs, boolean clone) {
        List<Value> outs = outputs;
        if (clone) {
            outs = new GraphCopier().copyAll(outputs);
        }
        List<Value> ins = new ArrayList<>();
        for (Value leaf : Graphs.graphInputs(outs)) {
            if (!(leaf instanceof Constant)) {
                ins.add(leaf);
            }
        }
        return new Graph(ins, outs);
    }

    // ==================== Queries ====================

    public List<Value> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<Value> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    public Value output(int index) {
        return outputs.get(index);
    }

    /**
     * Returns the tracked nodes, in the order they were imported.
     */
    public Set<Node> nodes() {
        return Collections.unmodifiableSet(nodes);
    }

    /**
     * Returns the tracked values, in the order they were imported.
     */
    public Set<Value> values() {
        return Collections.unmodifiableSet(values);
    }

    public boolean contains(Value value) {
        return values.contains(value);
    }

    public boolean contains(Node node) {
        return nodes.contains(node);
    }

    /**
     * Returns the uses of a value, in the order they were recorded.
     *
     * @param value the value to look up
     * @return the clients, empty if the value is unused or not tracked
     */
    public List<Client> clients(Value value) {
        List<Client> uses = clients.get(value);
        return uses == null ? List.of() : List.copyOf(uses);
    }

    /**
     * Returns the tracked nodes ordered so that every node follows its producers.
     */
    public List<Node> toposort() {
        return Graphs.toposort(outputs);
    }

    // ==================== Edits ====================

    /**
     * Replaces every use of {@code oldValue} by {@code newValue}.
     *
     * <p>Node inputs and designated outputs are rewired alike. Nodes and values that
     * {@code newValue} depends on are imported if the graph does not track them yet.
     * Replacing a value that has no uses changes nothing.
     *
     * @param oldValue a value tracked by this graph
     * @param newValue the replacement, of the same type
     * @throws ValueNotInGraphException if {@code oldValue} is not tracked
     * @throws IllegalArgumentException if the types differ or the edit would create a cycle
     * @throws MissingInputException if {@code newValue} depends on an undeclared leaf
     */
    public void replace(Value oldValue, Value newValue) {
        Objects.requireNonNull(oldValue, "oldValue cannot be null");
        Objects.requireNonNull(newValue, "newValue cannot be null");
        if (!values.contains(oldValue)) {
            throw new ValueNotInGraphException(oldValue);
        }
        if (oldValue == newValue) {
            return;
        }
        if (!oldValue.type().equals(newValue.type())) {
            throw new IllegalArgumentException("Cannot replace '" + oldValue + "' of type "
                    + oldValue.type() + " by '" + newValue + "' of type " + newValue.type());
        }
        if (Graphs.isAncestor(oldValue, newValue)) {
            throw new IllegalArgumentException("Replacing '" + oldValue + "' by '" + newValue
                    + "' would make the value its own ancestor");
        }
        List<Client> uses = List.copyOf(clients.get(oldValue));
        if (uses.isEmpty()) {
            // Importing newValue here would track nodes no output reaches
            return;
        }
        importValue(newValue);
        for (Client use : uses) {
            rewire(use, oldValue, newValue);
        }
        LOG.fine(() -> "Replaced " + oldValue + " by " + newValue + " at " + uses.size() + " uses");
    }

    /**
     * Applies each replacement in map order.
     *
     * @param replacements old value to new value
     */
    public void replaceAll(Map<Value, Value> replacements) {
        for (Map.Entry<Value, Value> e : replacements.entrySet()) {
            replace(e.getKey(), e.getValue());
        }
    }

    /**
     * Returns a deep copy of this graph sharing no node or value with it.
     */
    public Graph clone() {
        GraphCopier copier = new GraphCopier();
        List<Value> ins = copier.copyAll(inputs);
        List<Value> outs = copier.copyAll(outputs);
        return new Graph(ins, outs);
    }

    /**
     * Verifies that the tracked sets and the client index match the graph recomputed
     * from the outputs.
     *
     * @throws GraphException describing the first inconsistency found
     */
    public void checkIntegrity() {
        List<Node> expectedNodes = Graphs.toposort(outputs);
        if (!new HashSet<>(expectedNodes).equals(nodes)) {
            throw new GraphException("Tracked nodes " + nodes.size()
                    + " differ from the " + expectedNodes.size() + " nodes reachable from the outputs");
        }

        Map<Value, Set<Client>> expected = new LinkedHashMap<>();
        for (Value in : inputs) {
            expected.put(in, new HashSet<>());
        }
        for (Node node : expectedNodes) {
            for (int i = 0; i < node.inputs().size(); i++) {
                Value in = node.input(i);
                if (in.isLeaf() && !(in instanceof Constant) && !inputSet.contains(in)) {
                    throw new MissingInputException(in);
                }
                expected.computeIfAbsent(in, k -> new HashSet<>()).add(Client.input(node, i));
            }
            for (Value out : node.outputs()) {
                expected.computeIfAbsent(out, k -> new HashSet<>());
            }
        }
        for (int i = 0; i < outputs.size(); i++) {
            expected.computeIfAbsent(outputs.get(i), k -> new HashSet<>()).add(Client.output(i));
        }

        if (!expected.keySet().equals(values)) {
            throw new GraphException("Tracked values " + values.size()
                    + " differ from the " + expected.size() + " values reachable from the outputs");
        }
        for (Map.Entry<Value, Set<Client>> e : expected.entrySet()) {
            List<Client> actual = clients.get(e.getKey());
            if (actual == null || actual.size() != e.getValue().size()
                    || !e.getValue().equals(new HashSet<>(actual))) {
                throw new GraphException("Clients of '" + e.getKey() + "' are " + actual
                        + ", expected " + e.getValue());
            }
        }
    }

    @Override
    public String toString() {
        return String.format("Graph[inputs=%d, outputs=%d, nodes=%d]",
                inputs.size(), outputs.size(), nodes.size());
    }

    // ==================== Index maintenance ====================

    private void rewire(Client use, Value oldValue, Value newValue) {
        if (use instanceof Client.NodeInput in) {
            in.node().setInput(in.index(), newValue);
        } else {
            outputs.set(use.index(), newValue);
        }
        clients.get(newValue).add(use);
        removeClient(oldValue, use);
    }

    /**
     * Tracks {@code value} and every untracked node and leaf it depends on.
     * Validates all untracked leaves before changing anything.
     */
    private void importValue(Value value) {
        if (values.contains(value)) {
            return;
        }
        List<Value> newLeaves = new ArrayList<>();
        Set<Value> seen = new HashSet<>();
        Deque<Value> pending = new ArrayDeque<>();
        pending.push(value);
        while (!pending.isEmpty()) {
            Value v = pending.pop();
            if (values.contains(v) || !seen.add(v)) {
                continue;
            }
            if (v.isLeaf()) {
                if (!(v instanceof Constant)) {
                    throw new MissingInputException(v);
                }
                newLeaves.add(v);
            } else {
                for (Value in : v.owner().inputs()) {
                    pending.push(in);
                }
            }
        }

        for (Value leaf : newLeaves) {
            values.add(leaf);
            clients.put(leaf, new ArrayList<>());
        }
        for (Node node : Graphs.toposort(List.of(value))) {
            if (nodes.contains(node)) {
                continue;
            }
            nodes.add(node);
            for (Value out : node.outputs()) {
                values.add(out);
                clients.put(out, new ArrayList<>());
            }
            for (int i = 0; i < node.inputs().size(); i++) {
                clients.get(node.input(i)).add(Client.input(node, i));
            }
        }
    }

    /**
     * Drops one use of {@code value}. Values left without uses stop being tracked,
     * and so does any node whose outputs are all unused, transitively.
     */
    private void removeClient(Value value, Client use) {
        Deque<Value> pending = new ArrayDeque<>();
        clients.get(value).remove(use);
        pending.push(value);
        while (!pending.isEmpty()) {
            Value v = pending.pop();
            List<Client> uses = clients.get(v);
            if (uses == null || !uses.isEmpty() || inputSet.contains(v)) {
                continue;
            }
            Node owner = v.owner();
            if (owner == null) {
                values.remove(v);
                clients.remove(v);
                continue;
            }
            if (!nodes.contains(owner) || !allUnused(owner)) {
                continue;
            }
            nodes.remove(owner);
            for (Value out : owner.outputs()) {
                values.remove(out);
                clients.remove(out);
            }
            for (int i = 0; i < owner.inputs().size(); i++) {
                Value in = owner.input(i);
                clients.get(in).remove(Client.input(owner, i));
                pending.push(in);
            }
            LOG.finer(() -> "Dropped unused node " + owner);
        }
    }

    private boolean allUnused(Node node) {
        for (Value out : node.outputs()) {
            List<Client> uses = clients.get(out);
            if (uses != null && !uses.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
