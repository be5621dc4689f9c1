package org.difficient.core;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.difficient.api.Differ;
import org.difficient.api.delta.Delta;
import org.difficient.api.patch.PatchContext;
import org.difficient.api.patch.PatchError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Differ for product types (records, tuples, plain value classes).
 * <p>
 * Each declared field is diffed with its own differ, in declaration order. Unchanged fields
 * are omitted; if no field changed the result is {@link Delta.NoChange}, otherwise
 * {@link Delta.FieldsChanged} with the changed fields in declaration order.
 * <p>
 * Applying a {@code FieldsChanged} patches the listed fields, copies the others from the
 * source and reassembles the value through the registered constructor. Field identifiers the
 * product does not declare are rejected as {@link PatchError.Kind#SHAPE_MISMATCH}.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * record Point(String label, int x, int y) {}
 *
 * ProductDiffer<Point> differ = ProductDiffer.builder(Point.class)
 *         .scalar("label", Point::label)
 *         .scalar("x", Point::x)
 *         .scalar("y", Point::y)
 *         .build(v -> new Point(v.get("label"), v.get("x"), v.get("y")));
 * }</pre>
 * <p>
 * <strong>Thread Safety:</strong> Immutable after {@link Builder#build}, safe for concurrent use.
 *
 * @param <T> the product type
 */
public final class ProductDiffer<T> extends AbstractDiffer<T> {

    private final String typeName;
    private final List<Field<T, ?>> fields;
    private final Object2IntMap<String> indexByName;
    private final Function<FieldValues, T> constructor;

    private ProductDiffer(String typeName, List<Field<T, ?>> fields, Function<FieldValues, T> constructor) {
        super("product " + typeName);
        this.typeName = typeName;
        this.fields = List.copyOf(fields);
        this.constructor = constructor;

        Object2IntOpenHashMap<String> index = new Object2IntOpenHashMap<>(fields.size());
        index.defaultReturnValue(-1);
        for (int i = 0; i < fields.size(); i++) {
            index.put(fields.get(i).name(), i);
        }
        this.indexByName = index;
    }

    /**
     * Starts a differ for {@code type}, named after its simple class name.
     *
     * @param type the product class
     * @param <T> the product type
     * @return a builder
     */
    public static <T> Builder<T> builder(Class<T> type) {
        return new Builder<>(type.getSimpleName());
    }

    /**
     * Starts a differ for a product with the given display name.
     *
     * @param typeName name used in error messages
     * @param <T> the product type
     * @return a builder
     */
    public static <T> Builder<T> builder(String typeName) {
        return new Builder<>(typeName);
    }

    @Override
    protected Delta<T> diffValues(T left, T right) {
        Map<String, Delta<?>> changed = new LinkedHashMap<>();
        for (Field<T, ?> field : fields) {
            Delta<?> delta = field.diff(left, right);
            if (!delta.isNoChange()) {
                changed.put(field.name(), delta);
            }
        }
        if (changed.isEmpty()) {
            return Delta.noChange();
        }
        return new Delta.FieldsChanged<>(changed);
    }

    @Override
    protected T applyChange(T source, Delta<T> delta, PatchContext context) {
        if (!(delta instanceof Delta.FieldsChanged<?> fieldsChanged)) {
            context.rejectKind(getName(), delta);
            return source;
        }
        return applyFields(source, fieldsChanged.fields(), context);
    }

    /**
     * Applies field deltas to a non-null source and reassembles the product.
     * Also used by {@link SumDiffer} for the payload of a {@link Delta.SameVariant}.
     */
    T applyFields(T source, Map<String, Delta<?>> deltas, PatchContext context) {
        for (String name : deltas.keySet()) {
            if (!indexByName.containsKey(name)) {
                context.reject(PatchError.Kind.SHAPE_MISMATCH,
                        "unknown field '" + name + "' for " + typeName + ", declared: " + fieldNames());
            }
        }

        Object[] values = new Object[fields.size()];
        for (int i = 0; i < fields.size(); i++) {
            Field<T, ?> field = fields.get(i);
            Delta<?> fieldDelta = deltas.get(field.name());
            values[i] = fieldDelta == null ? field.get(source) : field.apply(source, fieldDelta, context);
        }

        if (context.hasErrors()) {
            return source;
        }
        try {
            return constructor.apply(new FieldValues(indexByName, values));
        } catch (ClassCastException | NullPointerException e) {
            // field deltas computed for another type can carry values of the wrong class
            context.reject(PatchError.Kind.SHAPE_MISMATCH, "cannot reassemble " + typeName + ": " + e.getMessage());
            return source;
        }
    }

    /**
     * Returns the product's display name.
     *
     * @return the type name
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * Returns the declared field names in declaration order.
     *
     * @return unmodifiable list of names
     */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (Field<T, ?> field : fields) {
            names.add(field.name());
        }
        return Collections.unmodifiableList(names);
    }

    // ========================================================================
    // Field
    // ========================================================================

    /**
     * A declared field: identifier, accessor and the differ of the field's type.
     *
     * @param name the field identifier used in {@link Delta.FieldsChanged}
     * @param getter reads the field from a product value
     * @param differ differ of the field type
     * @param <T> the product type
     * @param <F> the field type
     */
    record Field<T, F>(String name, Function<T, F> getter, Differ<F> differ) {

        F get(T product) {
            return getter.apply(product);
        }

        Delta<F> diff(T left, T right) {
            return differ.diff(getter.apply(left), getter.apply(right));
        }

        @SuppressWarnings("unchecked")
        F apply(T source, Delta<?> delta, PatchContext context) {
            return context.descend(PatchContext.field(name), differ, getter.apply(source), (Delta<F>) delta);
        }
    }

    // ========================================================================
    // FieldValues
    // ========================================================================

    /**
     * Field values handed to the constructor when a patched product is reassembled.
     * <p>
     * Values can be read by name or by declaration index; the type is inferred from the
     * constructor parameter they are passed to.
     */
    public static final class FieldValues {

        private final Object2IntMap<String> indexByName;
        private final Object[] values;

        FieldValues(Object2IntMap<String> indexByName, Object[] values) {
            this.indexByName = indexByName;
            this.values = values;
        }

        /**
         * Returns the value of a field by name.
         *
         * @param name the field identifier
         * @param <F> the field type
         * @return the (possibly patched) field value
         * @throws IllegalArgumentException if the product declares no such field
         */
        @SuppressWarnings("unchecked")
        public <F> F get(String name) {
            int index = indexByName.getInt(name);
            if (index < 0) {
                throw new IllegalArgumentException("Unknown field: " + name);
            }
            return (F) values[index];
        }

        /**
         * Returns the value of a field by declaration index.
         *
         * @param index zero-based declaration index
         * @param <F> the field type
         * @return the (possibly patched) field value
         * @throws IndexOutOfBoundsException if index is out of range
         */
        @SuppressWarnings("unchecked")
        public <F> F get(int index) {
            if (index < 0 || index >= values.length) {
                throw new IndexOutOfBoundsException("field index " + index + " out of range [0, " + values.length + ")");
            }
            return (F) values[index];
        }

        /**
         * Returns the number of declared fields.
         *
         * @return field count
         */
        public int size() {
            return values.length;
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Collects the declared fields of a product, in declaration order.
     *
     * @param <T> the product type
     */
    public static final class Builder<T> {

        private final String typeName;
        private final List<Field<T, ?>> fields = new ArrayList<>();

        private Builder(String typeName) {
            if (typeName == null || typeName.isBlank()) {
                throw new IllegalArgumentException("typeName must not be blank");
            }
            this.typeName = typeName;
        }

        /**
         * Declares the next field.
         *
         * @param name field identifier (unique, not blank)
         * @param getter accessor
         * @param differ differ of the field type
         * @param <F> the field type
         * @return this builder
         * @throws IllegalArgumentException if name is blank or already declared
         * @throws NullPointerException if getter or differ is null
         */
        public <F> Builder<T> field(String name, Function<T, F> getter, Differ<F> differ) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("field name must not be blank");
            }
            if (getter == null) {
                throw new NullPointerException("getter of field '" + name + "' must not be null");
            }
            if (differ == null) {
                throw new NullPointerException("differ of field '" + name + "' must not be null");
            }
            for (Field<T, ?> existing : fields) {
                if (existing.name().equals(name)) {
                    throw new IllegalArgumentException("Duplicate field '" + name + "' in " + typeName);
                }
            }
            fields.add(new Field<>(name, getter, differ));
            return this;
        }

        /**
         * Declares the next field as an atomic value.
         *
         * @param name field identifier
         * @param getter accessor
         * @param <F> the field type
         * @return this builder
         */
        public <F> Builder<T> scalar(String name, Function<T, F> getter) {
            return field(name, getter, ScalarDiffer.instance());
        }

        /**
         * Finishes the differ.
         *
         * @param constructor reassembles a product from its field values
         * @return the differ
         * @throws NullPointerException if constructor is null
         */
        public ProductDiffer<T> build(Function<FieldValues, T> constructor) {
            if (constructor == null) {
                throw new NullPointerException("constructor must not be null");
            }
            return new ProductDiffer<>(typeName, fields, constructor);
        }
    }
}
