package org.difficient.core;

import org.difficient.api.Differ;
import org.difficient.api.delta.Delta;
import org.difficient.api.patch.PatchContext;
import org.difficient.api.patch.PatchError;

import java.util.Map;
import java.util.Optional;

/**
 * Differ for {@link Optional}, treated as the sum type {@code None | Some(value)}.
 * <p>
 * Presence changes yield {@link Delta.VariantChanged} with tag {@value #NONE} or
 * {@value #SOME}. Two present values are diffed with the value differ; a change is reported
 * as {@link Delta.SameVariant} of tag {@value #SOME} whose single field is {@value #VALUE}.
 *
 * @param <T> the contained type
 */
public final class OptionalDiffer<T> extends AbstractDiffer<Optional<T>> {

    /** Tag of the empty variant. */
    public static final String NONE = "None";

    /** Tag of the present variant. */
    public static final String SOME = "Some";

    /** Field identifier of the contained value. */
    public static final String VALUE = "value";

    private final Differ<T> valueDiffer;

    /**
     * @param valueDiffer differ of the contained type
     */
    public OptionalDiffer(Differ<T> valueDiffer) {
        super("optional");
        if (valueDiffer == null) {
            throw new NullPointerException("valueDiffer must not be null");
        }
        this.valueDiffer = valueDiffer;
    }

    @Override
    protected Delta<Optional<T>> diffValues(Optional<T> left, Optional<T> right) {
        if (left.isPresent() != right.isPresent()) {
            return new Delta.VariantChanged<>(tagOf(right), right);
        }
        if (left.isEmpty()) {
            return Delta.noChange();
        }
        Delta<T> inner = valueDiffer.diff(left.get(), right.get());
        if (inner.isNoChange()) {
            return Delta.noChange();
        }
        Delta.FieldsChanged<Optional<T>> payload = new Delta.FieldsChanged<>(Map.<String, Delta<?>>of(VALUE, inner));
        return new Delta.SameVariant<>(SOME, payload);
    }

    @Override
    protected Optional<T> applyChange(Optional<T> source, Delta<Optional<T>> delta, PatchContext context) {
        if (delta instanceof Delta.VariantChanged<Optional<T>> changed) {
            Optional<T> value = changed.value();
            if (value == null || !tagOf(value).equals(changed.tag())) {
                context.reject(PatchError.Kind.SHAPE_MISMATCH,
                        "value carried for variant '" + changed.tag() + "' does not hold that variant");
                return source;
            }
            return value;
        }
        if (delta instanceof Delta.SameVariant<Optional<T>> same) {
            if (!SOME.equals(same.tag())) {
                context.reject(PatchError.Kind.SHAPE_MISMATCH,
                        "unknown variant '" + same.tag() + "' for optional, declared: [None, Some]");
                return source;
            }
            if (source.isEmpty()) {
                context.reject(PatchError.Kind.SHAPE_MISMATCH,
                        "delta was computed against variant 'Some' but source holds 'None'");
                return source;
            }
            Map<String, Delta<?>> fields = same.payload().fields();
            for (String name : fields.keySet()) {
                if (!VALUE.equals(name)) {
                    context.reject(PatchError.Kind.SHAPE_MISMATCH,
                            "unknown field '" + name + "' for optional, declared: [value]");
                }
            }
            Delta<?> inner = fields.get(VALUE);
            if (context.hasErrors() || inner == null) {
                return source;
            }
            @SuppressWarnings("unchecked")
            T patched = context.descend(PatchContext.field(VALUE), valueDiffer, source.get(), (Delta<T>) inner);
            return context.hasErrors() ? source : Optional.ofNullable(patched);
        }
        context.rejectKind(getName(), delta);
        return source;
    }

    private static String tagOf(Optional<?> value) {
        return value.isPresent() ? SOME : NONE;
    }
}
