package io.surfworks.equigraph.rewrite;

import java.util.List;
import java.util.logging.Logger;

import io.surfworks.equigraph.graph.Graph;

/**
 * Runs a fixed list of passes one after another.
 */
public final class SequencePass implements GraphPass {

    private static final Logger LOG = Logger.getLogger(SequencePass.class.getName());

    private final String name;
    private final List<GraphPass> passes;

    public SequencePass(String name, List<GraphPass> passes) {
        this.name = name;
        this.passes = List.copyOf(passes);
    }

    @Override
    public String name() {
        return name;
    }

    public List<GraphPass> passes() {
        return passes;
    }

    @Override
    public void optimize(Graph graph) {
        for (GraphPass pass : passes) {
            LOG.fine(() -> "Running " + pass.name() + " on " + graph);
            pass.optimize(graph);
        }
    }

    @Override
    public String toString() {
        return String.format("SequencePass[%s, passes=%s]",
                name, passes.stream().map(GraphPass::name).toList());
    }
}
