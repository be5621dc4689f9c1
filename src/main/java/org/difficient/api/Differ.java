package org.difficient.api;

import org.difficient.api.delta.Delta;
import org.difficient.api.patch.PatchContext;

/**
 * Diff/patch capability for values of type {@code T}.
 * <p>
 * One differ exists per diffable type. Differs of composite types delegate to the differs of
 * their fields, variants and elements, bottoming out at scalar and sequence differs. They may
 * be assembled by hand (see {@link org.difficient.core.Differs}) or produced by a code
 * generator; either way they must satisfy the contract below.
 * <p>
 * <strong>Contract:</strong>
 * <ul>
 *   <li>{@code diff} is total and pure: it never throws for valid inputs and equal inputs
 *       yield equal deltas</li>
 *   <li>{@code diff(a, a)} is {@link Delta.NoChange}</li>
 *   <li>{@code apply(a, diff(a, b), ctx)} returns a value equal to {@code b} without
 *       recording errors</li>
 *   <li>only shapes of {@link Delta} are produced</li>
 *   <li>{@code apply} never throws for a foreign delta: it records the problem on the
 *       context and returns the source as a placeholder</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be immutable and thread-safe.
 * <p>
 * Callers normally go through {@link org.difficient.core.PatchEngine} instead of calling
 * {@link #apply} directly.
 *
 * @param <T> the diffed type
 */
public interface Differ<T> {

    /**
     * Computes the delta transforming {@code left} into {@code right}.
     *
     * @param left the source value
     * @param right the target value
     * @return the delta, {@link Delta.NoChange} if the values are equal
     */
    Delta<T> diff(T left, T right);

    /**
     * Applies {@code delta} to {@code source}.
     *
     * @param source the value the delta is applied to
     * @param delta the delta
     * @param context per-call error collector and path tracker
     * @return the patched value; meaningless if the context recorded errors
     */
    T apply(T source, Delta<T> delta, PatchContext context);
}
