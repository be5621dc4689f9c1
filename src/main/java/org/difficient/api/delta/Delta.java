package org.difficient.api.delta;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural difference between two instances of the same type.
 * <p>
 * A delta is produced by a {@link org.difficient.api.Differ} and consumed by
 * {@link org.difficient.core.PatchEngine}. The shapes are:
 * <ul>
 *   <li>{@link NoChange}: the instances compared equal</li>
 *   <li>{@link Replace}: wholesale replacement by the target value</li>
 *   <li>{@link FieldsChanged}: per-field deltas of a product (record, tuple)</li>
 *   <li>{@link VariantChanged}: a sum type switched to another variant</li>
 *   <li>{@link SameVariant}: field deltas within the unchanged active variant</li>
 *   <li>{@link SequenceEdits}: an edit script over an ordered list</li>
 *   <li>{@link EntriesChanged}: per-key edits of an associative container</li>
 * </ul>
 * <p>
 * <strong>Ownership:</strong> every collection held by a delta is an unmodifiable copy taken
 * at construction, so a delta never aliases either input. Embedded values ({@code Replace},
 * {@code Insert} payloads) are expected to be immutable.
 * <p>
 * <strong>Thread Safety:</strong> Immutable records, safe for concurrent access.
 *
 * @param <T> the type of the diffed value
 */
public sealed interface Delta<T>
        permits Delta.NoChange, Delta.Replace, Delta.FieldsChanged, Delta.VariantChanged,
                Delta.SameVariant, Delta.SequenceEdits, Delta.EntriesChanged {

    /**
     * Discriminator of the delta shapes, used for dispatch and diagnostics.
     */
    enum Kind {
        NO_CHANGE,
        REPLACE,
        FIELDS_CHANGED,
        VARIANT_CHANGED,
        SAME_VARIANT,
        SEQUENCE_EDITS,
        ENTRIES_CHANGED
    }

    /**
     * Returns the shape of this delta.
     *
     * @return the delta kind
     */
    Kind kind();

    /**
     * Returns the shared "no change" delta.
     *
     * @param <T> the value type
     * @return a {@link NoChange} instance
     */
    @SuppressWarnings("unchecked")
    static <T> Delta<T> noChange() {
        return (Delta<T>) NoChange.INSTANCE;
    }

    /**
     * Creates a full replacement delta.
     *
     * @param value the target value (may be null)
     * @param <T> the value type
     * @return a {@link Replace} carrying {@code value}
     */
    static <T> Delta<T> replace(T value) {
        return new Replace<>(value);
    }

    /**
     * Returns whether this delta is {@link NoChange}.
     *
     * @return true if applying this delta leaves the source as is
     */
    default boolean isNoChange() {
        return kind() == Kind.NO_CHANGE;
    }

    // ========================================================================
    // Shapes
    // ========================================================================

    /**
     * The two instances compared equal.
     *
     * @param <T> the value type
     */
    record NoChange<T>() implements Delta<T> {

        private static final NoChange<?> INSTANCE = new NoChange<>();

        @Override
        public Kind kind() {
            return Kind.NO_CHANGE;
        }
    }

    /**
     * Full replacement by the target value.
     *
     * @param value the complete target value
     * @param <T> the value type
     */
    record Replace<T>(T value) implements Delta<T> {

        @Override
        public Kind kind() {
            return Kind.REPLACE;
        }
    }

    /**
     * Per-field changes of a product type.
     * <p>
     * Only changed fields are present; iteration order is the product's declared field order.
     *
     * @param fields field identifier to field delta, never empty
     * @param <T> the product type
     */
    record FieldsChanged<T>(Map<String, Delta<?>> fields) implements Delta<T> {

        /**
         * Creates a field-level delta, copying the mapping and keeping its order.
         *
         * @param fields field identifier to field delta (must not be null or empty)
         * @throws NullPointerException if fields, a key or a value is null
         * @throws IllegalArgumentException if fields is empty
         */
        public FieldsChanged {
            if (fields == null) {
                throw new NullPointerException("fields must not be null");
            }
            if (fields.isEmpty()) {
                throw new IllegalArgumentException("fields must not be empty, use NoChange instead");
            }
            Map<String, Delta<?>> copy = new LinkedHashMap<>();
            fields.forEach((name, delta) -> {
                if (name == null || delta == null) {
                    throw new NullPointerException("field names and deltas must not be null");
                }
                copy.put(name, delta);
            });
            fields = Collections.unmodifiableMap(copy);
        }

        @Override
        public Kind kind() {
            return Kind.FIELDS_CHANGED;
        }
    }

    /**
     * A sum type switched variants; carries the new tag and the complete new variant value.
     *
     * @param tag the tag of the target variant
     * @param value the target value, holding variant {@code tag}
     * @param <T> the sum type
     */
    record VariantChanged<T>(String tag, T value) implements Delta<T> {

        /**
         * Creates a variant switch delta.
         *
         * @param tag the tag of the target variant (must not be null)
         * @param value the target value
         * @throws NullPointerException if tag is null
         */
        public VariantChanged {
            if (tag == null) {
                throw new NullPointerException("tag must not be null");
            }
        }

        @Override
        public Kind kind() {
            return Kind.VARIANT_CHANGED;
        }
    }

    /**
     * Field-level change within the active variant of a sum type.
     * <p>
     * The payload is only ever interpreted against variant {@code tag}.
     *
     * @param tag the variant this delta was computed against
     * @param payload the field deltas of that variant's payload
     * @param <T> the sum type
     */
    record SameVariant<T>(String tag, FieldsChanged<? extends T> payload) implements Delta<T> {

        /**
         * Creates a same-variant delta.
         *
         * @param tag the active variant (must not be null)
         * @param payload the payload field deltas (must not be null)
         * @throws NullPointerException if tag or payload is null
         */
        public SameVariant {
            if (tag == null) {
                throw new NullPointerException("tag must not be null");
            }
            if (payload == null) {
                throw new NullPointerException("payload must not be null");
            }
        }

        @Override
        public Kind kind() {
            return Kind.SAME_VARIANT;
        }
    }

    /**
     * Edit script transforming one list into another, replayed left to right.
     *
     * @param edits the operations (copied, must not contain null)
     * @param <E> the element type
     */
    record SequenceEdits<E>(List<SequenceEdit<E>> edits) implements Delta<List<E>> {

        /**
         * Creates an edit script delta.
         *
         * @param edits the operations (must not be null)
         * @throws NullPointerException if edits or any operation is null
         */
        public SequenceEdits {
            edits = List.copyOf(edits);
        }

        @Override
        public Kind kind() {
            return Kind.SEQUENCE_EDITS;
        }
    }

    /**
     * Per-key edits of an associative container.
     *
     * @param entries key to entry edit, never empty
     * @param <K> the key type
     * @param <V> the value type
     */
    record EntriesChanged<K, V>(Map<K, EntryEdit<V>> entries) implements Delta<Map<K, V>> {

        /**
         * Creates an entry-level delta, copying the mapping and keeping its order.
         *
         * @param entries key to entry edit (must not be null or empty)
         * @throws NullPointerException if entries or an edit is null
         * @throws IllegalArgumentException if entries is empty
         */
        public EntriesChanged {
            if (entries == null) {
                throw new NullPointerException("entries must not be null");
            }
            if (entries.isEmpty()) {
                throw new IllegalArgumentException("entries must not be empty, use NoChange instead");
            }
            Map<K, EntryEdit<V>> copy = new LinkedHashMap<>();
            entries.forEach((key, edit) -> {
                if (edit == null) {
                    throw new NullPointerException("entry edit for key " + key + " must not be null");
                }
                copy.put(key, edit);
            });
            entries = Collections.unmodifiableMap(copy);
        }

        @Override
        public Kind kind() {
            return Kind.ENTRIES_CHANGED;
        }
    }
}
