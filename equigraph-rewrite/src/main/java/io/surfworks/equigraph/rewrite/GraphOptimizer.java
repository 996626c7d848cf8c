package io.surfworks.equigraph.rewrite;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import io.surfworks.equigraph.config.EquigraphConfig;
import io.surfworks.equigraph.graph.Graph;
import io.surfworks.equigraph.graph.Value;
import io.surfworks.equigraph.rewrite.registry.PassQuery;
import io.surfworks.equigraph.rewrite.registry.PassRegistry;

/**
 * Runs a selection of registered passes, plus an optional extra pass, over a graph.
 *
 * <p>A graph is optimized in place and returned. A bare value is first wrapped in a
 * single-output graph (deep-copied if requested) and the graph's output is returned,
 * which may be a different value than the one passed in.
 *
 * <pre>{@code
 * GraphOptimizer optimizer = new GraphOptimizer(PassRegistry.withStandardPasses());
 *
 * Value simplified = optimizer.optimize(expr, PassQuery.including("canonicalize"), null, true);
 * Graph same = optimizer.optimize(graph, PassQuery.including("merge"), extraPass);
 * }</pre>
 */
public final class GraphOptimizer {

    private static final Logger LOG = Logger.getLogger(GraphOptimizer.class.getName());

    private final PassRegistry registry;
    private final EquigraphConfig config;

    public GraphOptimizer(PassRegistry registry) {
        this(registry, EquigraphConfig.defaults());
    }

    public GraphOptimizer(PassRegistry registry, EquigraphConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * Returns the query used when the caller does not give one.
     */
    public PassQuery defaultQuery() {
        return PassQuery.including(config.defaultInclude().toArray(new String[0]));
    }

    /**
     * Creates an empty rewrite pass bounded by the configured sweep limit.
     *
     * @param name the pass name
     * @return the new pass
     */
    public PatternRewritePass newRewritePass(String name) {
        return new PatternRewritePass(name, config.maxRewriteIterations());
    }

    /**
     * Optimizes a graph in place with the default query.
     */
    public Graph optimize(Graph graph) {
        return optimize(graph, defaultQuery(), null);
    }

    /**
     * Optimizes a graph in place.
     *
     * @param graph the graph to rewrite
     * @param query selects the registered passes to run
     * @param customPass an extra pass run after the selected ones, may be null
     * @return the same graph
     * @throws io.surfworks.equigraph.rewrite.registry.UnregisteredPassException if the
     *         query names an unknown tag
     */
    public Graph optimize(Graph graph, PassQuery query, GraphPass customPass) {
        Objects.requireNonNull(graph, "graph cannot be null");
        SequencePass pipeline = registry.query(query);
        LOG.fine(() -> "Optimizing " + graph + " with " + pipeline
                + (customPass != null ? " then " + customPass.name() : ""));

        for (GraphPass pass : pipeline.passes()) {
            run(pass, graph);
        }
        if (customPass != null) {
            run(customPass, graph);
        }
        return graph;
    }

    /**
     * Optimizes the computation of a single value with the default query.
     */
    public Value optimize(Value value) {
        return optimize(value, defaultQuery(), null, false);
    }

    /**
     * Optimizes the computation of a single value.
     *
     * @param value the value to optimize
     * @param query selects the registered passes to run
     * @param customPass an extra pass run after the selected ones, may be null
     * @param clone whether to deep-copy the value's graph first, leaving the caller's
     *              nodes untouched
     * @return the output of the optimized graph
     */
    public Value optimize(Value value, PassQuery query, GraphPass customPass, boolean clone) {
        Graph graph = Graph.fromOutputs(List.of(value), clone);
        return optimize(graph, query, customPass).output(0);
    }

    private void run(GraphPass pass, Graph graph) {
        pass.optimize(graph);
        if (config.checkIntegrity()) {
            graph.checkIntegrity();
        }
    }

    @Override
    public String toString() {
        return String.format("GraphOptimizer[registry=%s, defaultInclude=%s]",
                registry, config.defaultInclude());
    }
}
