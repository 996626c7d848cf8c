package io.surfworks.equigraph.graph;

import java.util.Arrays;
import java.util.List;

/**
 * An operation that can be applied to values to produce a {@link Node}.
 *
 * <p>Ops carry no numeric semantics here; they only need to identify what a node
 * computes. Two nodes compute the same thing when their ops are {@code equals} and
 * their inputs are the same values, so implementations must define value equality.
 *
 * <p>Example:
 * <pre>{@code
 * Op add = Operator.of("add");
 * Value x = new Value(ValueType.F32, "x");
 * Value y = new Value(ValueType.F32, "y");
 * Value sum = add.call(x, y);
 * }</pre>
 */
public interface Op {

    /**
     * Returns the operation name used in printing and logging.
     */
    String name();

    /**
     * Returns the types of the outputs produced when this op is applied to the given
     * inputs.
     *
     * @param inputs the node inputs
     * @return one type per output, never empty
     * @throws IllegalArgumentException if the op cannot be applied to these inputs
     */
    List<ValueType> outputTypes(List<Value> inputs);

    /**
     * Applies this op, creating a new node.
     *
     * @param inputs the inputs, in order
     * @return the new node
     */
    default Node apply(Value... inputs) {
        return apply(Arrays.asList(inputs));
    }

    /**
     * Applies this op, creating a new node.
     *
     * @param inputs the inputs, in order
     * @return the new node
     */
    default Node apply(List<Value> inputs) {
        return new Node(this, inputs, outputTypes(inputs));
    }

    /**
     * Applies this op and returns its single output.
     *
     * @param inputs the inputs, in order
     * @return the output value
     * @throws IllegalStateException if the op has more than one output
     */
    default Value call(Value... inputs) {
        Node node = apply(inputs);
        if (node.outputs().size() != 1) {
            throw new IllegalStateException(
                    "Op '" + name() + "' has " + node.outputs().size() + " outputs, use apply()");
        }
        return node.outputs().get(0);
    }
}
