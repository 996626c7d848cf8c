package io.surfworks.equigraph.equiv;

/**
 * Raised when the merge-based and structural equivalence checks disagree.
 *
 * <p>The two algorithms are expected to always agree, so a disagreement means one of
 * them is wrong. This is an {@link AssertionError}: it is not meant to be caught and
 * neither answer should be trusted.
 */
public class CrossValidationMismatchError extends AssertionError {

    private final boolean mergeResult;
    private final boolean structuralResult;

    public CrossValidationMismatchError(boolean mergeResult, boolean structuralResult, String detail) {
        super("Merge-based check returned " + mergeResult + " but structural check returned "
                + structuralResult + "\n" + detail);
        this.mergeResult = mergeResult;
        this.structuralResult = structuralResult;
    }

    public boolean getMergeResult() {
        return mergeResult;
    }

    public boolean getStructuralResult() {
        return structuralResult;
    }
}
