package io.surfworks.equigraph.rewrite.registry;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Selects passes from a {@link PassRegistry} by tag.
 *
 * <p>A pass is selected when it carries at least one {@code include} tag, every
 * {@code require} tag, no {@code exclude} tag, and its position is at most
 * {@code positionCutoff}. Every pass is implicitly tagged with its own name, so a
 * single pass can be included by name.
 *
 * <pre>{@code
 * PassQuery query = PassQuery.including("canonicalize")
 *     .excluding("expensive")
 *     .withPositionCutoff(50);
 * }</pre>
 *
 * @param include tags of which a pass must carry at least one
 * @param require tags a pass must all carry
 * @param exclude tags a pass must not carry
 * @param positionCutoff highest position selected
 */
public record PassQuery(
        Set<String> include,
        Set<String> require,
        Set<String> exclude,
        double positionCutoff
) {

    public PassQuery {
        include = normalize(include);
        require = normalize(require);
        exclude = normalize(exclude);
        if (Double.isNaN(positionCutoff)) {
            throw new IllegalArgumentException("positionCutoff cannot be NaN");
        }
    }

    public static PassQuery including(String... tags) {
        return new PassQuery(new LinkedHashSet<>(Arrays.asList(tags)), Set.of(), Set.of(),
                Double.POSITIVE_INFINITY);
    }

    public PassQuery requiring(String... tags) {
        Set<String> more = new LinkedHashSet<>(require);
        more.addAll(Arrays.asList(tags));
        return new PassQuery(include, more, exclude, positionCutoff);
    }

    public PassQuery excluding(String... tags) {
        Set<String> more = new LinkedHashSet<>(exclude);
        more.addAll(Arrays.asList(tags));
        return new PassQuery(include, require, more, positionCutoff);
    }

    public PassQuery withPositionCutoff(double cutoff) {
        return new PassQuery(include, require, exclude, cutoff);
    }

    /**
     * Returns true if a pass with these tags and position is selected.
     */
    public boolean matches(Set<String> tags, double position) {
        if (position > positionCutoff) {
            return false;
        }
        if (!tags.containsAll(require)) {
            return false;
        }
        for (String tag : exclude) {
            if (tags.contains(tag)) {
                return false;
            }
        }
        for (String tag : include) {
            if (tags.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> normalize(Set<String> tags) {
        Set<String> out = new LinkedHashSet<>();
        for (String tag : tags) {
            out.add(tag.toLowerCase());
        }
        return Set.copyOf(out);
    }
}
