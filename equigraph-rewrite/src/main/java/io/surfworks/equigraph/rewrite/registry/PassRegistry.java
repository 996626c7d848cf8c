package io.surfworks.equigraph.rewrite.registry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

import io.surfworks.equigraph.rewrite.GraphPass;
import io.surfworks.equigraph.rewrite.MergePass;
import io.surfworks.equigraph.rewrite.SequencePass;

/**
 * Registry of graph passes, each with a position and a set of tags.
 *
 * <p>A {@link PassQuery} resolves to the matching passes, ordered by position and
 * then by name, composed into one {@link SequencePass}. Names are case-insensitive
 * and every pass is implicitly tagged with its own name.
 *
 * <p>Registries are plain objects handed to whoever needs them; there is no global
 * instance. Not thread-safe: populate a registry before sharing it.
 *
 * <pre>{@code
 * PassRegistry registry = PassRegistry.withStandardPasses();
 * registry.register("simplify", simplifyPass, 10, "canonicalize");
 * GraphPass pipeline = registry.query(PassQuery.including("canonicalize"));
 * }</pre>
 */
public final class PassRegistry {

    private static final Logger LOG = Logger.getLogger(PassRegistry.class.getName());

    private final Map<String, Registration> registrations = new LinkedHashMap<>();

    /**
     * Creates a registry holding the standard passes.
     *
     * <p>Includes: {@code merge} at position 0, tagged {@code canonicalize},
     * {@code fast_run} and {@code merge}.
     *
     * @return a registry with the standard passes
     */
    public static PassRegistry withStandardPasses() {
        PassRegistry registry = new PassRegistry();
        registry.register("merge", new MergePass(), 0, "canonicalize", "fast_run");
        return registry;
    }

    /**
     * Registers a pass.
     *
     * @param name unique pass name
     * @param pass the pass
     * @param position ordering key; lower positions run first
     * @param tags tags the pass can be selected by
     * @return this registry for chaining
     * @throws IllegalArgumentException if the name is already registered
     */
    public PassRegistry register(String name, GraphPass pass, double position, String... tags) {
        String key = name.toLowerCase();
        if (registrations.containsKey(key)) {
            throw new IllegalArgumentException("Pass '" + name + "' is already registered");
        }
        Set<String> allTags = new LinkedHashSet<>();
        allTags.add(key);
        for (String tag : tags) {
            allTags.add(tag.toLowerCase());
        }
        registrations.put(key, new Registration(key, pass, position, Set.copyOf(allTags)));
        return this;
    }

    /**
     * Removes a pass.
     *
     * @param name pass name
     */
    public void unregister(String name) {
        registrations.remove(name.toLowerCase());
    }

    public boolean isRegistered(String name) {
        return registrations.containsKey(name.toLowerCase());
    }

    /**
     * Returns the registered pass names, in registration order.
     */
    public List<String> names() {
        return List.copyOf(registrations.keySet());
    }

    /**
     * Returns every tag carried by some pass, pass names included.
     */
    public Set<String> tags() {
        Set<String> all = new TreeSet<>();
        for (Registration r : registrations.values()) {
            all.addAll(r.tags());
        }
        return all;
    }

    /**
     * Resolves a query into one pass that runs every selected pass in order.
     *
     * @param query the selection
     * @return the composed pass, possibly running nothing
     * @throws UnregisteredPassException if an included or required tag is unknown
     */
    public SequencePass query(PassQuery query) {
        Set<String> known = tags();
        Set<String> unknown = new TreeSet<>();
        for (String tag : query.include()) {
            if (!known.contains(tag)) {
                unknown.add(tag);
            }
        }
        for (String tag : query.require()) {
            if (!known.contains(tag)) {
                unknown.add(tag);
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnregisteredPassException(unknown, names());
        }

        List<Registration> selected = new ArrayList<>();
        for (Registration r : registrations.values()) {
            if (query.matches(r.tags(), r.position())) {
                selected.add(r);
            }
        }
        selected.sort(Comparator.comparingDouble(Registration::position)
                .thenComparing(Registration::name));

        List<GraphPass> passes = selected.stream().map(Registration::pass).toList();
        LOG.fine(() -> "Query " + query.include() + " selected "
                + selected.stream().map(Registration::name).toList());
        return new SequencePass(String.join("+", new TreeSet<>(query.include())), passes);
    }

    @Override
    public String toString() {
        return String.format("PassRegistry[passes=%s]", registrations.keySet());
    }

    private record Registration(String name, GraphPass pass, double position, Set<String> tags) {}
}
