package io.surfworks.equigraph.graph;

import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders graphs as text, one line per node, for logs and failure messages.
 *
 * <pre>
 * graph(x, y) {
 *   %0 = add(x, 1)
 *   %1 = mul(%0, y)
 *   return %1
 * }
 * </pre>
 *
 * <p>Named values print under their name; anonymous ones get {@code %n} labels in
 * topological order. The format is for people, not for parsing.
 */
public final class GraphPrinter {

    private GraphPrinter() {} // Utility class

    public static String print(Graph graph) {
        return print(graph.inputs(), graph.outputs());
    }

    /**
     * Prints the computation of the given outputs, without needing a graph.
     */
    public static String print(Value... outputs) {
        List<Value> outs = List.of(outputs);
        List<Value> leaves = Graphs.graphInputs(outs).stream()
                .filter(v -> !(v instanceof Constant))
                .toList();
        return print(leaves, outs);
    }

    private static String print(Collection<Value> inputs, List<Value> outputs) {
        Labels labels = new Labels();
        StringBuilder sb = new StringBuilder("graph(");
        String sep = "";
        for (Value in : inputs) {
            sb.append(sep).append(labels.of(in));
            sep = ", ";
        }
        sb.append(") {\n");

        for (Node node : Graphs.toposort(outputs)) {
            sb.append("  ");
            sep = "";
            for (Value out : node.outputs()) {
                sb.append(sep).append(labels.of(out));
                sep = ", ";
            }
            sb.append(" = ").append(node.op()).append('(');
            sep = "";
            for (Value in : node.inputs()) {
                sb.append(sep).append(labels.of(in));
                sep = ", ";
            }
            sb.append(")\n");
        }

        sb.append("  return ");
        sep = "";
        for (Value out : outputs) {
            sb.append(sep).append(labels.of(out));
            sep = ", ";
        }
        return sb.append("\n}").toString();
    }

    private static final class Labels {
        private final Map<Value, String> names = new IdentityHashMap<>();
        private int anonymous;

        String of(Value value) {
            return names.computeIfAbsent(value, v -> {
                if (v.name() != null || v instanceof Constant) {
                    return v.toString();
                }
                return (v.isLeaf() ? "%in" : "%") + anonymous++;
            });
        }
    }
}
