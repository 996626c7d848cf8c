package io.surfworks.equigraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Backward walks over values and nodes that do not need a {@link Graph}.
 *
 * <p>All walks follow owner edges from outputs towards leaves and are iterative, so
 * long chains do not exhaust the stack. Results are in deterministic discovery
 * order.
 */
public final class Graphs {

    private Graphs() {} // Utility class

    /**
     * Returns every leaf reachable from the outputs, constants included.
     *
     * @param outputs the values to start from
     * @return the leaves, in discovery order
     */
    public static List<Value> graphInputs(Collection<Value> outputs) {
        List<Value> leaves = new ArrayList<>();
        for (Value v : ancestors(outputs)) {
            if (v.isLeaf()) {
                leaves.add(v);
            }
        }
        return leaves;
    }

    /**
     * Returns the outputs and every value they depend on.
     *
     * @param outputs the values to start from
     * @return the reachable values, in discovery order
     */
    public static Set<Value> ancestors(Collection<Value> outputs) {
        return walk(outputs, Set.of(), false);
    }

    /**
     * Returns every value on a path from {@code inputs} to {@code outputs}.
     *
     * <p>The walk stops at the given inputs and includes the sibling outputs of every
     * node it passes through, so a multi-output node contributes all of its outputs.
     *
     * @param inputs values at which the backward walk stops
     * @param outputs values to start from
     * @return the values between, in discovery order
     */
    public static Set<Value> valuesBetween(Collection<Value> inputs, Collection<Value> outputs) {
        Set<Value> stop = new HashSet<>(inputs);
        return walk(outputs, stop, true);
    }

    /**
     * Returns true if {@code candidate} is {@code of} or one of its ancestors.
     */
    public static boolean isAncestor(Value candidate, Value of) {
        return ancestors(List.of(of)).contains(candidate);
    }

    /**
     * Returns the nodes reachable from the outputs, each after all of its producers.
     *
     * @param outputs the values to start from
     * @return nodes in topological order
     */
    public static List<Node> toposort(Collection<Value> outputs) {
        List<Node> order = new ArrayList<>();
        Set<Node> visited = new HashSet<>();
        Deque<PendingNode> stack = new ArrayDeque<>();
        for (Value out : outputs) {
            Node root = out.owner();
            if (root == null || !visited.add(root)) {
                continue;
            }
            stack.push(new PendingNode(root));
            while (!stack.isEmpty()) {
                PendingNode frame = stack.peek();
                if (frame.nextInput < frame.node.inputs().size()) {
                    Node producer = frame.node.input(frame.nextInput++).owner();
                    if (producer != null && visited.add(producer)) {
                        stack.push(new PendingNode(producer));
                    }
                } else {
                    stack.pop();
                    order.add(frame.node);
                }
            }
        }
        return order;
    }

    private static Set<Value> walk(Collection<Value> start, Set<Value> stop, boolean siblings) {
        Set<Value> seen = new LinkedHashSet<>();
        Deque<Value> pending = new ArrayDeque<>();
        for (Value v : start) {
            if (seen.add(v)) {
                pending.add(v);
            }
        }
        while (!pending.isEmpty()) {
            Value v = pending.poll();
            Node owner = v.owner();
            if (owner == null || stop.contains(v)) {
                continue;
            }
            for (Value in : owner.inputs()) {
                if (seen.add(in)) {
                    pending.add(in);
                }
            }
            if (siblings) {
                for (Value out : owner.outputs()) {
                    seen.add(out);
                }
            }
        }
        return seen;
    }

    private static final class PendingNode {
        final Node node;
        int nextInput;

        PendingNode(Node node) {
            this.node = node;
        }
    }
}
