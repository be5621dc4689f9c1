package org.difficient.api.patch;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a delta cannot be applied to a source value.
 * <p>
 * This is a checked exception: a delta applied to a value it was not computed against is
 * an expected outcome for callers that read deltas from storage or the network, not a bug.
 * No partial value is ever produced alongside it.
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * try {
 *     Config next = PatchEngine.patch(differ, current, delta);
 *     publish(next);
 * } catch (PatchException e) {
 *     log.warn("Discarding stale delta: {}", e.getMessage());
 *     requestFullSnapshot();
 * }
 * }</pre>
 *
 * @see org.difficient.core.PatchEngine
 */
public class PatchException extends Exception {

    private final List<PatchError> errors;

    /**
     * Constructs a new exception from the collected errors.
     *
     * @param errors the errors found while applying the delta (must not be empty)
     * @throws IllegalArgumentException if errors is empty
     */
    public PatchException(List<PatchError> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * Returns the errors, in the order they were found.
     *
     * @return immutable, non-empty list of errors
     */
    public List<PatchError> getErrors() {
        return errors;
    }

    /**
     * Returns whether any collected error is of the given kind.
     *
     * @param kind the kind to look for
     * @return true if at least one error has that kind
     */
    public boolean hasError(PatchError.Kind kind) {
        return errors.stream().anyMatch(e -> e.kind() == kind);
    }

    private static String describe(List<PatchError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors must not be empty");
        }
        if (errors.size() == 1) {
            return "Patch rejected: " + errors.get(0);
        }
        return "Patch rejected with " + errors.size() + " errors: "
                + errors.stream().map(PatchError::toString).collect(Collectors.joining("; "));
    }
}
