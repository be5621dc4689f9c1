package org.difficient.core;

import org.difficient.api.Differ;
import org.difficient.api.delta.Delta;
import org.difficient.api.patch.PatchContext;
import org.difficient.api.patch.PatchError;

/**
 * Base class handling the shapes every differ shares.
 * <p>
 * {@code diff} short-circuits identical references and null on either side;
 * {@code apply} handles {@link Delta.NoChange} and {@link Delta.Replace}. Subclasses only
 * deal with their structural shapes on non-null values.
 *
 * @param <T> the diffed type
 */
public abstract class AbstractDiffer<T> implements Differ<T> {

    private final String name;

    /**
     * @param name short description used in error messages, e.g. {@code "product Person"}
     */
    protected AbstractDiffer(String name) {
        if (name == null) {
            throw new NullPointerException("name must not be null");
        }
        this.name = name;
    }

    @Override
    public final Delta<T> diff(T left, T right) {
        if (left == right) {
            return Delta.noChange();
        }
        if (left == null || right == null) {
            return Delta.replace(right);
        }
        return diffValues(left, right);
    }

    @Override
    public final T apply(T source, Delta<T> delta, PatchContext context) {
        switch (delta.kind()) {
            case NO_CHANGE:
                return unchanged(source);
            case REPLACE:
                return ((Delta.Replace<T>) delta).value();
            default:
                if (source == null) {
                    context.reject(PatchError.Kind.SHAPE_MISMATCH,
                            name + " cannot apply a " + delta.kind() + " delta to null");
                    return null;
                }
                return applyChange(source, delta, context);
        }
    }

    /**
     * Returns the short description of this differ.
     *
     * @return the name given at construction
     */
    public String getName() {
        return name;
    }

    /**
     * Computes the delta between two distinct, non-null values.
     *
     * @param left the source value
     * @param right the target value
     * @return the delta
     */
    protected abstract Delta<T> diffValues(T left, T right);

    /**
     * Applies a structural delta (anything but {@code NoChange}/{@code Replace}) to a non-null
     * source. Unsupported kinds must be rejected via {@link PatchContext#rejectKind}.
     *
     * @param source the non-null source
     * @param delta the structural delta
     * @param context the patch context
     * @return the patched value, or {@code source} if an error was recorded
     */
    protected abstract T applyChange(T source, Delta<T> delta, PatchContext context);

    /**
     * Result of applying {@link Delta.NoChange}. Collection differs override this to hand out
     * a fresh copy.
     *
     * @param source the source value
     * @return the source
     */
    protected T unchanged(T source) {
        return source;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
