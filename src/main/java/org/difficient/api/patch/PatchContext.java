package org.difficient.api.patch;

import org.difficient.api.Differ;
import org.difficient.api.delta.Delta;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-call state of one patch application: the current path and the errors found so far.
 * <p>
 * Differs never throw for a rejected delta. They call {@link #reject} and return the source
 * value as a placeholder, so that sibling fields can still be checked. The patch engine
 * discards the assembled value as soon as any error was recorded.
 * <p>
 * Nested applications go through {@link #descend} so that errors carry their location.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. A context belongs to a single
 * {@code apply} call on a single thread.
 */
public final class PatchContext {

    /** Path of the root value. */
    public static final String ROOT = "$";

    private final boolean failFast;
    private final StringBuilder path = new StringBuilder(ROOT);
    private final List<PatchError> errors = new ArrayList<>();

    /**
     * Creates a context.
     *
     * @param failFast stop descending after the first error instead of collecting all errors
     */
    public PatchContext(boolean failFast) {
        this.failFast = failFast;
    }

    /**
     * Applies a nested delta with {@code segment} appended to the current path.
     * <p>
     * When the context is aborted (fail-fast after an error) the nested delta is skipped and
     * the source is returned unchanged.
     *
     * @param segment path segment, see {@link #field} and {@link #key}
     * @param differ the differ for the nested value
     * @param source the nested source value
     * @param delta the nested delta
     * @param <F> the nested value type
     * @return the patched nested value, or {@code source} if the context is aborted
     */
    public <F> F descend(String segment, Differ<F> differ, F source, Delta<F> delta) {
        if (isAborted()) {
            return source;
        }
        int mark = path.length();
        path.append(segment);
        try {
            return differ.apply(source, delta, this);
        } finally {
            path.setLength(mark);
        }
    }

    /**
     * Records an error at the current path.
     *
     * @param kind the error category
     * @param message the detail
     */
    public void reject(PatchError.Kind kind, String message) {
        errors.add(new PatchError(kind, path.toString(), message));
    }

    /**
     * Records a {@link PatchError.Kind#SHAPE_MISMATCH} for a delta kind the differ does not accept.
     *
     * @param differName short description of the differ, used in the message
     * @param delta the rejected delta
     */
    public void rejectKind(String differName, Delta<?> delta) {
        reject(PatchError.Kind.SHAPE_MISMATCH,
                differName + " cannot apply a " + delta.kind() + " delta");
    }

    /**
     * Returns whether further nested applications are skipped.
     *
     * @return true in fail-fast mode once an error was recorded
     */
    public boolean isAborted() {
        return failFast && !errors.isEmpty();
    }

    /**
     * Returns whether any error was recorded.
     *
     * @return true if the patch must be rejected
     */
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Returns a snapshot of the recorded errors.
     *
     * @return immutable list of errors, in recording order
     */
    public List<PatchError> getErrors() {
        return List.copyOf(errors);
    }

    /**
     * Returns the current path.
     *
     * @return the path, starting with {@value #ROOT}
     */
    public String currentPath() {
        return path.toString();
    }

    /**
     * Returns the path segment of a product field.
     *
     * @param name the field identifier
     * @return {@code "." + name}
     */
    public static String field(String name) {
        return "." + name;
    }

    /**
     * Returns the path segment of a map entry.
     *
     * @param key the entry key
     * @return the key in square brackets
     */
    public static String key(Object key) {
        return "[" + key + "]";
    }
}
