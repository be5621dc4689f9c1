package org.difficient.api.delta;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DeltaTest {

    @Test
    void noChange_isSingleton() {
        assertThat(Delta.<String>noChange()).isSameAs(Delta.<Integer>noChange());
        assertThat(Delta.noChange().isNoChange()).isTrue();
        assertThat(Delta.replace("x").isNoChange()).isFalse();
    }

    @Test
    void fieldsChanged_keepsOrderAndCopies() {
        Map<String, Delta<?>> source = new LinkedHashMap<>();
        source.put("b", Delta.replace(1));
        source.put("a", Delta.replace(2));

        Delta.FieldsChanged<Object> delta = new Delta.FieldsChanged<>(source);
        source.put("c", Delta.replace(3));

        assertThat(delta.fields().keySet()).containsExactly("b", "a");
        assertThatThrownBy(() -> delta.fields().put("d", Delta.replace(4)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void fieldsChanged_rejectsEmpty() {
        assertThatThrownBy(() -> new Delta.FieldsChanged<>(Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("use NoChange");
    }

    @Test
    void entriesChanged_rejectsEmpty() {
        assertThatThrownBy(() -> new Delta.EntriesChanged<String, Integer>(Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void insert_copiesElementsAndAllowsNull() {
        List<String> elements = new ArrayList<>();
        elements.add("a");
        elements.add(null);

        SequenceEdit.Insert<String> insert = new SequenceEdit.Insert<>(elements);
        elements.clear();

        assertThat(insert.elements()).containsExactly("a", null);
    }

    @Test
    void kinds() {
        assertThat(Delta.noChange().kind()).isEqualTo(Delta.Kind.NO_CHANGE);
        assertThat(Delta.replace(1).kind()).isEqualTo(Delta.Kind.REPLACE);
        assertThat(new Delta.VariantChanged<>("A", 1).kind()).isEqualTo(Delta.Kind.VARIANT_CHANGED);
        assertThat(new Delta.SequenceEdits<>(List.of(SequenceEdit.<String>keep(1))).kind())
                .isEqualTo(Delta.Kind.SEQUENCE_EDITS);
    }
}
