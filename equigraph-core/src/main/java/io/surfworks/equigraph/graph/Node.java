package io.surfworks.equigraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An application of an {@link Op} to an ordered list of input values.
 *
 * <p>A node owns its outputs: each output value reports this node as its
 * {@link Value#owner()}. The output list is fixed at construction. The input list is
 * mutable, but only through {@link Graph} edits, which keep the graph's client index
 * in step with the change.
 *
 * <p>Nodes are compared by reference identity.
 */
public final class Node {

    private final Op op;
    private final List<Value> inputs;
    private final List<Value> outputs;

    /**
     * Creates a node with anonymous outputs of the given types.
     *
     * @param op the operation
     * @param inputs the inputs, in order
     * @param outputTypes one type per output
     */
    public Node(Op op, List<Value> inputs, List<ValueType> outputTypes) {
        this(op, inputs, outputTypes, Collections.nCopies(outputTypes.size(), null));
    }

    /**
     * Creates a node whose outputs carry the given debug names.
     *
     * @param op the operation
     * @param inputs the inputs, in order
     * @param outputTypes one type per output
     * @param outputNames one name per output, entries may be null
     */
    public Node(Op op, List<Value> inputs, List<ValueType> outputTypes, List<String> outputNames) {
        this.op = Objects.requireNonNull(op, "op cannot be null");
        if (outputTypes.isEmpty()) {
            throw new IllegalArgumentException("Node for op '" + op.name() + "' must have outputs");
        }
        if (outputNames.size() != outputTypes.size()) {
            throw new IllegalArgumentException("Expected " + outputTypes.size()
                    + " output names, got " + outputNames.size());
        }
        for (Value input : inputs) {
            Objects.requireNonNull(input, "node inputs cannot contain null");
        }
        this.inputs = new ArrayList<>(inputs);
        List<Value> outs = new ArrayList<>(outputTypes.size());
        for (int i = 0; i < outputTypes.size(); i++) {
            outs.add(new Value(outputTypes.get(i), outputNames.get(i), this, i));
        }
        this.outputs = Collections.unmodifiableList(outs);
    }

    public Op op() {
        return op;
    }

    /**
     * Returns a read-only view of the current inputs.
     */
    public List<Value> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public Value input(int index) {
        return inputs.get(index);
    }

    public List<Value> outputs() {
        return outputs;
    }

    public Value output(int index) {
        return outputs.get(index);
    }

    void setInput(int index, Value value) {
        inputs.set(index, value);
    }

    @Override
    public String toString() {
        return op + inputs.toString();
    }
}
