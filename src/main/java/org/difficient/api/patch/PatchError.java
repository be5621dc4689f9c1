package org.difficient.api.patch;

/**
 * A single reason a delta could not be applied.
 *
 * @param kind the error category
 * @param path location within the source value, e.g. {@code $.scores[alice].points}
 * @param message human-readable detail
 */
public record PatchError(Kind kind, String path, String message) {

    /**
     * Error categories reported by the patch engine.
     */
    public enum Kind {
        /** Delta kind, field, variant tag or value inconsistent with the source. */
        SHAPE_MISMATCH,
        /** Edit script counts invalid, overrunning, or leaving source elements unconsumed. */
        SEQUENCE_OUT_OF_BOUNDS,
        /** Entry delta removes or changes a key the source does not contain. */
        MISSING_KEY,
        /** Entry delta inserts a key the source already contains. */
        UNEXPECTED_KEY
    }

    /**
     * Creates a patch error.
     *
     * @param kind the error category (must not be null)
     * @param path the location (must not be null)
     * @param message the detail (must not be null)
     * @throws NullPointerException if any argument is null
     */
    public PatchError {
        if (kind == null || path == null || message == null) {
            throw new NullPointerException("kind, path and message must not be null");
        }
    }

    @Override
    public String toString() {
        return kind + " at " + path + ": " + message;
    }
}
