package org.difficient.api.delta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One operation of a {@link Delta.SequenceEdits} script.
 * <p>
 * Operations are replayed left to right against the source list: {@link Keep} copies
 * {@code count} source elements, {@link Delete} skips {@code count} source elements and
 * {@link Insert} emits its elements without consuming the source.
 * <p>
 * Counts are not validated here so that scripts decoded from foreign input can still be
 * represented; the patch engine rejects non-positive counts.
 *
 * @param <E> the element type
 */
public sealed interface SequenceEdit<E> permits SequenceEdit.Keep, SequenceEdit.Insert, SequenceEdit.Delete {

    /**
     * Copies the next {@code count} source elements to the output.
     *
     * @param count number of elements kept
     * @param <E> the element type
     */
    record Keep<E>(int count) implements SequenceEdit<E> {}

    /**
     * Skips the next {@code count} source elements.
     *
     * @param count number of elements deleted
     * @param <E> the element type
     */
    record Delete<E>(int count) implements SequenceEdit<E> {}

    /**
     * Emits {@code elements} at the current position.
     *
     * @param elements the inserted elements, in order
     * @param <E> the element type
     */
    record Insert<E>(List<E> elements) implements SequenceEdit<E> {

        /**
         * Creates an insert operation holding an unmodifiable copy of the elements.
         * Null elements are permitted.
         *
         * @param elements the inserted elements (must not be null)
         * @throws NullPointerException if elements is null
         */
        public Insert {
            if (elements == null) {
                throw new NullPointerException("elements must not be null");
            }
            elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }
    }

    /**
     * Creates a {@link Keep} of {@code count} source elements.
     *
     * @param count number of elements copied from the source
     * @param <E> the element type
     * @return the operation
     */
    static <E> SequenceEdit<E> keep(int count) {
        return new Keep<>(count);
    }

    /**
     * Creates a {@link Delete} of {@code count} source elements.
     *
     * @param count number of source elements skipped
     * @param <E> the element type
     * @return the operation
     */
    static <E> SequenceEdit<E> delete(int count) {
        return new Delete<>(count);
    }

    /**
     * Creates an {@link Insert} of the given elements.
     *
     * @param elements elements emitted in order
     * @param <E> the element type
     * @return the operation
     */
    static <E> SequenceEdit<E> insert(List<E> elements) {
        return new Insert<>(elements);
    }
}
