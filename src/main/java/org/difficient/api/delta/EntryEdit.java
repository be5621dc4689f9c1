package org.difficient.api.delta;

/**
 * Edit of a single key within a {@link Delta.EntriesChanged} delta.
 *
 * @param <V> the value type
 */
public sealed interface EntryEdit<V> permits EntryEdit.Removed, EntryEdit.Inserted, EntryEdit.Changed {

    /**
     * The key is present in the source and absent in the target.
     *
     * @param <V> the value type
     */
    record Removed<V>() implements EntryEdit<V> {}

    /**
     * The key is absent in the source; the target maps it to {@code value}.
     *
     * @param value the inserted value
     * @param <V> the value type
     */
    record Inserted<V>(V value) implements EntryEdit<V> {}

    /**
     * The key is present on both sides with differing values.
     *
     * @param delta the value delta, never {@link Delta.NoChange}
     * @param <V> the value type
     */
    record Changed<V>(Delta<V> delta) implements EntryEdit<V> {

        /**
         * Creates a value change.
         *
         * @param delta the value delta (must not be null)
         * @throws NullPointerException if delta is null
         */
        public Changed {
            if (delta == null) {
                throw new NullPointerException("delta must not be null");
            }
        }
    }
}
