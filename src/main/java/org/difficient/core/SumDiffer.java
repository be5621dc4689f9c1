package org.difficient.core;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.difficient.api.delta.Delta;
import org.difficient.api.patch.PatchContext;
import org.difficient.api.patch.PatchError;

import java.util.ArrayList;
import java.util.List;

/**
 * Differ for sum types: a sealed interface (or abstract class) whose permitted subclasses
 * play the role of enumeration variants with associated data.
 * <p>
 * Each variant is registered with a tag, its class and a {@link ProductDiffer} for its
 * payload. Two values holding different variants yield {@link Delta.VariantChanged} with the
 * complete target value; a field-level delta between different variants would not be
 * well-typed. Two values holding the same variant are diffed by that variant's product
 * differ: no change collapses to {@link Delta.NoChange}, otherwise the field deltas are
 * wrapped in {@link Delta.SameVariant}.
 * <p>
 * A {@code SameVariant} delta is only applied to a source holding the variant it was computed
 * against; anything else is a {@link PatchError.Kind#SHAPE_MISMATCH}.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * sealed interface Shape permits Circle, Square {}
 * record Circle(int radius) implements Shape {}
 * record Square(int side) implements Shape {}
 *
 * SumDiffer<Shape> differ = SumDiffer.builder(Shape.class)
 *         .variant("Circle", Circle.class, ProductDiffer.builder(Circle.class)
 *                 .scalar("radius", Circle::radius)
 *                 .build(v -> new Circle(v.get("radius"))))
 *         .variant("Square", Square.class, ProductDiffer.builder(Square.class)
 *                 .scalar("side", Square::side)
 *                 .build(v -> new Square(v.get("side"))))
 *         .build();
 * }</pre>
 * <p>
 * <strong>Thread Safety:</strong> Immutable after {@link Builder#build}, safe for concurrent use.
 *
 * @param <T> the sum type
 */
public final class SumDiffer<T> extends AbstractDiffer<T> {

    private final String typeName;
    private final List<Variant<T, ? extends T>> variants;
    private final Object2IntMap<String> indexByTag;

    private SumDiffer(String typeName, List<Variant<T, ? extends T>> variants) {
        super("sum " + typeName);
        this.typeName = typeName;
        this.variants = List.copyOf(variants);

        Object2IntOpenHashMap<String> index = new Object2IntOpenHashMap<>(variants.size());
        index.defaultReturnValue(-1);
        for (int i = 0; i < variants.size(); i++) {
            index.put(variants.get(i).tag(), i);
        }
        this.indexByTag = index;
    }

    /**
     * Starts a differ for {@code type}, named after its simple class name.
     *
     * @param type the sum type's root class or interface
     * @param <T> the sum type
     * @return a builder
     */
    public static <T> Builder<T> builder(Class<T> type) {
        return new Builder<>(type.getSimpleName());
    }

    /**
     * Returns the tag of the variant {@code value} holds.
     *
     * @param value a non-null value of the sum type
     * @return the variant tag
     * @throws IllegalArgumentException if no registered variant matches the value's class
     */
    public String tagOf(T value) {
        return variantOf(value).tag();
    }

    /**
     * Returns the registered tags in registration order.
     *
     * @return unmodifiable list of tags
     */
    public List<String> tags() {
        List<String> tags = new ArrayList<>(variants.size());
        for (Variant<T, ? extends T> variant : variants) {
            tags.add(variant.tag());
        }
        return List.copyOf(tags);
    }

    @Override
    protected Delta<T> diffValues(T left, T right) {
        Variant<T, ? extends T> leftVariant = variantOf(left);
        Variant<T, ? extends T> rightVariant = variantOf(right);
        if (leftVariant != rightVariant) {
            return new Delta.VariantChanged<>(rightVariant.tag(), right);
        }
        Delta<?> payload = leftVariant.diffPayload(left, right);
        if (payload instanceof Delta.FieldsChanged<?> fields) {
            return new Delta.SameVariant<T>(leftVariant.tag(), new Delta.FieldsChanged<T>(fields.fields()));
        }
        if (payload.isNoChange()) {
            return Delta.noChange();
        }
        // a payload differ that replaced wholesale; carry the value like a variant switch
        return new Delta.VariantChanged<>(rightVariant.tag(), right);
    }

    @Override
    protected T applyChange(T source, Delta<T> delta, PatchContext context) {
        if (delta instanceof Delta.VariantChanged<T> changed) {
            return applyVariantChanged(source, changed, context);
        }
        if (delta instanceof Delta.SameVariant<T> same) {
            return applySameVariant(source, same, context);
        }
        context.rejectKind(getName(), delta);
        return source;
    }

    private T applyVariantChanged(T source, Delta.VariantChanged<T> changed, PatchContext context) {
        int index = indexByTag.getInt(changed.tag());
        if (index < 0) {
            context.reject(PatchError.Kind.SHAPE_MISMATCH,
                    "unknown variant '" + changed.tag() + "' for " + typeName + ", declared: " + tags());
            return source;
        }
        Variant<T, ? extends T> variant = variants.get(index);
        if (changed.value() == null || !variant.type().isInstance(changed.value())) {
            context.reject(PatchError.Kind.SHAPE_MISMATCH,
                    "value carried for variant '" + changed.tag() + "' is not a "
                            + variant.type().getSimpleName());
            return source;
        }
        return changed.value();
    }

    private T applySameVariant(T source, Delta.SameVariant<T> same, PatchContext context) {
        int index = indexByTag.getInt(same.tag());
        if (index < 0) {
            context.reject(PatchError.Kind.SHAPE_MISMATCH,
                    "unknown variant '" + same.tag() + "' for " + typeName + ", declared: " + tags());
            return source;
        }
        Variant<T, ? extends T> variant = variants.get(index);
        if (!variant.type().isInstance(source)) {
            context.reject(PatchError.Kind.SHAPE_MISMATCH,
                    "delta was computed against variant '" + same.tag()
                            + "' but source holds '" + tagOrClass(source) + "'");
            return source;
        }
        return variant.applyPayload(source, same.payload(), context);
    }

    private Variant<T, ? extends T> variantOf(T value) {
        for (Variant<T, ? extends T> variant : variants) {
            if (variant.type().isInstance(value)) {
                return variant;
            }
        }
        throw new IllegalArgumentException(
                "No variant of " + typeName + " registered for " + value.getClass().getName());
    }

    private String tagOrClass(T value) {
        for (Variant<T, ? extends T> variant : variants) {
            if (variant.type().isInstance(value)) {
                return variant.tag();
            }
        }
        return value.getClass().getSimpleName();
    }

    // ========================================================================
    // Variant
    // ========================================================================

    /**
     * A registered variant: tag, class and payload differ.
     *
     * @param tag variant identifier used in deltas
     * @param type the variant class
     * @param payload differ of the variant's fields
     * @param <T> the sum type
     * @param <V> the variant class
     */
    record Variant<T, V extends T>(String tag, Class<V> type, ProductDiffer<V> payload) {

        Delta<V> diffPayload(T left, T right) {
            return payload.diff(type.cast(left), type.cast(right));
        }

        T applyPayload(T source, Delta.FieldsChanged<?> fields, PatchContext context) {
            return payload.applyFields(type.cast(source), fields.fields(), context);
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Collects the variants of a sum type.
     *
     * @param <T> the sum type
     */
    public static final class Builder<T> {

        private final String typeName;
        private final List<Variant<T, ? extends T>> variants = new ArrayList<>();

        private Builder(String typeName) {
            this.typeName = typeName;
        }

        /**
         * Registers a variant. Variants are matched in registration order, so register a
         * subclass before any of its superclasses.
         *
         * @param tag variant identifier (unique, not blank)
         * @param type the variant class
         * @param payload differ of the variant's payload; use a product without fields for
         *                unit variants
         * @param <V> the variant class
         * @return this builder
         * @throws IllegalArgumentException if tag is blank or already registered
         * @throws NullPointerException if type or payload is null
         */
        public <V extends T> Builder<T> variant(String tag, Class<V> type, ProductDiffer<V> payload) {
            if (tag == null || tag.isBlank()) {
                throw new IllegalArgumentException("variant tag must not be blank");
            }
            if (type == null) {
                throw new NullPointerException("type of variant '" + tag + "' must not be null");
            }
            if (payload == null) {
                throw new NullPointerException("payload differ of variant '" + tag + "' must not be null");
            }
            for (Variant<T, ? extends T> existing : variants) {
                if (existing.tag().equals(tag)) {
                    throw new IllegalArgumentException("Duplicate variant '" + tag + "' in " + typeName);
                }
            }
            variants.add(new Variant<>(tag, type, payload));
            return this;
        }

        /**
         * Finishes the differ.
         *
         * @return the differ
         * @throws IllegalStateException if no variant was registered
         */
        public SumDiffer<T> build() {
            if (variants.isEmpty()) {
                throw new IllegalStateException("Sum type " + typeName + " needs at least one variant");
            }
            return new SumDiffer<>(typeName, variants);
        }
    }
}
