package io.surfworks.equigraph.graph;

import java.util.List;
import java.util.Objects;

/**
 * Describes what a {@link Value} holds: an element type and a static shape.
 *
 * <p>Unlike Values, types are compared by content. A scalar has an empty shape.
 *
 * @param dtype element type name (e.g., "f32", "i64")
 * @param shape static dimensions, empty for scalars
 */
public record ValueType(String dtype, List<Integer> shape) {

    public static final ValueType F32 = scalar("f32");
    public static final ValueType F64 = scalar("f64");
    public static final ValueType I64 = scalar("i64");

    public ValueType {
        Objects.requireNonNull(dtype, "dtype cannot be null");
        shape = List.copyOf(shape);
        for (int d : shape) {
            if (d < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + shape);
            }
        }
    }

    public static ValueType scalar(String dtype) {
        return new ValueType(dtype, List.of());
    }

    public static ValueType tensor(String dtype, int... dims) {
        Integer[] boxed = new Integer[dims.length];
        for (int i = 0; i < dims.length; i++) {
            boxed[i] = dims[i];
        }
        return new ValueType(dtype, List.of(boxed));
    }

    public int rank() {
        return shape.size();
    }

    public boolean isScalar() {
        return shape.isEmpty();
    }

    @Override
    public String toString() {
        if (shape.isEmpty()) {
            return dtype;
        }
        StringBuilder sb = new StringBuilder("tensor<");
        for (int d : shape) {
            sb.append(d).append('x');
        }
        return sb.append(dtype).append('>').toString();
    }
}
