package io.surfworks.equigraph.rewrite.registry;

import java.util.List;
import java.util.Set;

/**
 * Thrown when a query names a tag that no registered pass carries.
 */
public class UnregisteredPassException extends IllegalArgumentException {

    private final Set<String> unknown;

    public UnregisteredPassException(Set<String> unknown, List<String> available) {
        super("No registered pass is named or tagged " + unknown + ". Available: " + available);
        this.unknown = Set.copyOf(unknown);
    }

    /**
     * Returns the names that did not match any pass.
     */
    public Set<String> getUnknown() {
        return unknown;
    }
}
