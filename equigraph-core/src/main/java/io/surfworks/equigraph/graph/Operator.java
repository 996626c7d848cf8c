package io.surfworks.equigraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * General-purpose {@link Op} identified by name, output count and attributes.
 *
 * <p>Output types default to the type of the first input, which fits element-wise
 * operations. Ops with no inputs, or whose result type differs from their inputs,
 * declare a fixed {@code resultType}.
 *
 * <pre>{@code
 * Operator add = Operator.of("add");
 * Operator split = new Operator("split", 2, Map.of("axis", 0), null);
 * Operator cast = Operator.of("cast").withResultType(ValueType.I64);
 * }</pre>
 *
 * @param name operation name
 * @param outputCount number of outputs each application produces
 * @param attributes static configuration, compared as part of op equality
 * @param resultType fixed output type, or null to use the first input's type
 */
public record Operator(
        String name,
        int outputCount,
        Map<String, Object> attributes,
        ValueType resultType
) implements Op {

    public Operator {
        Objects.requireNonNull(name, "name cannot be null");
        if (outputCount < 1) {
            throw new IllegalArgumentException("outputCount must be positive: " + outputCount);
        }
        // Sorted so that printing is stable; equality is map equality either way
        attributes = Collections.unmodifiableMap(new TreeMap<>(attributes));
    }

    public static Operator of(String name) {
        return new Operator(name, 1, Map.of(), null);
    }

    public Operator withAttribute(String key, Object value) {
        TreeMap<String, Object> copy = new TreeMap<>(attributes);
        copy.put(key, value);
        return new Operator(name, outputCount, copy, resultType);
    }

    public Operator withOutputs(int count) {
        return new Operator(name, count, attributes, resultType);
    }

    public Operator withResultType(ValueType type) {
        return new Operator(name, outputCount, attributes, type);
    }

    @Override
    public List<ValueType> outputTypes(List<Value> inputs) {
        ValueType type = resultType;
        if (type == null) {
            if (inputs.isEmpty()) {
                throw new IllegalArgumentException(
                        "Op '" + name + "' has no inputs and no declared result type");
            }
            type = inputs.get(0).type();
        }
        List<ValueType> types = new ArrayList<>(outputCount);
        for (int i = 0; i < outputCount; i++) {
            types.add(type);
        }
        return types;
    }

    @Override
    public String toString() {
        if (attributes.isEmpty()) {
            return name;
        }
        return name + attributes;
    }
}
