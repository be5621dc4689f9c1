package org.difficient.core;

import org.difficient.api.Differ;
import org.difficient.api.delta.Delta;
import org.difficient.api.patch.PatchError;
import org.difficient.api.patch.PatchException;
import org.difficient.config.DiffOptions;
import org.difficient.core.SampleTypes.SimpleStruct;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.difficient.core.SampleTypes.SIMPLE_STRUCT;
import static org.difficient.core.SampleTypes.fields;

@Tag("unit")
class OptionalDifferTest {

    private final PatchEngine engine = new PatchEngine(new DiffOptions(1024, false));
    private final Differ<Optional<SimpleStruct>> differ = Differs.optional(SIMPLE_STRUCT);

    @Test
    void diff_presenceChange_isVariantChanged() throws PatchException {
        Optional<SimpleStruct> some = Optional.of(new SimpleStruct("a", 1));

        Delta<Optional<SimpleStruct>> appear = differ.diff(Optional.empty(), some);
        Delta<Optional<SimpleStruct>> vanish = differ.diff(some, Optional.empty());

        assertThat(appear).isEqualTo(new Delta.VariantChanged<>(OptionalDiffer.SOME, some));
        assertThat(vanish).isEqualTo(new Delta.VariantChanged<>(OptionalDiffer.NONE, Optional.empty()));
        assertThat(engine.apply(differ, Optional.empty(), appear)).isEqualTo(some);
        assertThat(engine.apply(differ, some, vanish)).isEmpty();
    }

    @Test
    void diff_bothPresent_wrapsInnerDelta() throws PatchException {
        Optional<SimpleStruct> before = Optional.of(new SimpleStruct("a", 1));
        Optional<SimpleStruct> after = Optional.of(new SimpleStruct("a", 2));

        Delta<Optional<SimpleStruct>> delta = differ.diff(before, after);

        Delta.FieldsChanged<Optional<SimpleStruct>> payload =
                fields(OptionalDiffer.VALUE, fields("y", Delta.replace(2)));
        assertThat(delta).isEqualTo(new Delta.SameVariant<>(OptionalDiffer.SOME, payload));
        assertThat(engine.apply(differ, before, delta)).isEqualTo(after);
    }

    @Test
    void diff_equal_isNoChange() {
        assertThat(differ.diff(Optional.empty(), Optional.empty())).isEqualTo(Delta.noChange());
        assertThat(differ.diff(Optional.of(new SimpleStruct("a", 1)), Optional.of(new SimpleStruct("a", 1))))
                .isEqualTo(Delta.noChange());
    }

    @Test
    void apply_someDeltaToEmpty_isShapeMismatch() {
        Delta<Optional<SimpleStruct>> delta =
                differ.diff(Optional.of(new SimpleStruct("a", 1)), Optional.of(new SimpleStruct("a", 2)));

        assertThatThrownBy(() -> engine.apply(differ, Optional.empty(), delta))
                .isInstanceOf(PatchException.class)
                .hasMessageContaining("source holds 'None'");
    }

    @Test
    void apply_tagDisagreesWithValue_isShapeMismatch() {
        Delta<Optional<SimpleStruct>> delta = new Delta.VariantChanged<>(OptionalDiffer.NONE,
                Optional.of(new SimpleStruct("a", 1)));

        assertThatThrownBy(() -> engine.apply(differ, Optional.empty(), delta))
                .isInstanceOf(PatchException.class)
                .satisfies(e -> assertThat(((PatchException) e).hasError(PatchError.Kind.SHAPE_MISMATCH)).isTrue());
    }

    @Test
    void apply_innerError_reportsValuePath() {
        Delta.FieldsChanged<Optional<SimpleStruct>> payload =
                fields(OptionalDiffer.VALUE, fields("z", Delta.replace(2)));
        Delta<Optional<SimpleStruct>> delta = new Delta.SameVariant<>(OptionalDiffer.SOME, payload);

        assertThatThrownBy(() -> engine.apply(differ, Optional.of(new SimpleStruct("a", 1)), delta))
                .isInstanceOf(PatchException.class)
                .satisfies(e -> assertThat(((PatchException) e).getErrors().get(0).path()).isEqualTo("$.value"));
    }
}
