package org.difficient.core;

import org.difficient.api.delta.Delta;
import org.difficient.api.patch.PatchContext;

import java.util.Objects;

/**
 * Differ for atomic values (numbers, strings, enum constants, unit types, UUIDs, ...).
 * <p>
 * Produces {@link Delta.NoChange} when the values are equal under {@link Object#equals},
 * otherwise {@link Delta.Replace} carrying the target. Structural deltas are rejected.
 *
 * @param <T> the atomic type
 */
public final class ScalarDiffer<T> extends AbstractDiffer<T> {

    private static final ScalarDiffer<?> INSTANCE = new ScalarDiffer<>();

    private ScalarDiffer() {
        super("scalar");
    }

    /**
     * Returns the shared scalar differ.
     *
     * @param <T> the atomic type
     * @return the differ
     */
    @SuppressWarnings("unchecked")
    public static <T> ScalarDiffer<T> instance() {
        return (ScalarDiffer<T>) INSTANCE;
    }

    @Override
    protected Delta<T> diffValues(T left, T right) {
        if (Objects.equals(left, right)) {
            return Delta.noChange();
        }
        return Delta.replace(right);
    }

    @Override
    protected T applyChange(T source, Delta<T> delta, PatchContext context) {
        context.rejectKind(getName(), delta);
        return source;
    }
}
