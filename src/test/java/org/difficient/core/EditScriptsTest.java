package org.difficient.core;

import org.difficient.api.delta.SequenceEdit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property checks of {@link EditScripts} over seeded random inputs.
 */
@Tag("unit")
class EditScriptsTest {

    private static final long SEED = 0x5EED_D1FFL;
    private static final int ROUNDS = 500;

    @Test
    @DisplayName("Replaying a script reproduces the target and its cost is n + m - 2 * LCS")
    void compute_isMinimalAndReplaysToTarget() {
        Random random = new Random(SEED);
        for (int round = 0; round < ROUNDS; round++) {
            List<Integer> left = randomList(random);
            List<Integer> right = randomList(random);

            List<SequenceEdit<Integer>> script = EditScripts.compute(left, right, Objects::equals, Long.MAX_VALUE)
                    .orElseThrow();

            assertThat(replay(left, script)).as("round %d: %s -> %s", round, left, right).isEqualTo(right);
            assertThat(EditScripts.editCount(script))
                    .as("round %d: %s -> %s", round, left, right)
                    .isEqualTo(left.size() + right.size() - 2 * lcsLength(left, right));
        }
    }

    @Test
    @DisplayName("Scripts are canonical: merged keeps, Delete before Insert, no empty operations")
    void compute_isCanonical() {
        Random random = new Random(SEED + 1);
        for (int round = 0; round < ROUNDS; round++) {
            List<Integer> left = randomList(random);
            List<Integer> right = randomList(random);

            List<SequenceEdit<Integer>> script = EditScripts.compute(left, right, Objects::equals, Long.MAX_VALUE)
                    .orElseThrow();

            for (int i = 0; i < script.size(); i++) {
                SequenceEdit<Integer> edit = script.get(i);
                if (edit instanceof SequenceEdit.Keep<Integer> keep) {
                    assertThat(keep.count()).isPositive();
                } else if (edit instanceof SequenceEdit.Delete<Integer> delete) {
                    assertThat(delete.count()).isPositive();
                } else if (edit instanceof SequenceEdit.Insert<Integer> insert) {
                    assertThat(insert.elements()).isNotEmpty();
                }
                if (i > 0) {
                    SequenceEdit<Integer> previous = script.get(i - 1);
                    assertThat(previous.getClass()).isNotEqualTo(edit.getClass());
                    assertThat(previous instanceof SequenceEdit.Insert && edit instanceof SequenceEdit.Delete)
                            .as("Insert followed by Delete in %s", script)
                            .isFalse();
                }
            }
        }
    }

    @Test
    void compute_identicalLists_isSingleKeep() {
        List<SequenceEdit<String>> script = EditScripts.compute(
                List.of("a", "b"), List.of("a", "b"), Objects::equals, 1).orElseThrow();

        assertThat(script).containsExactly(SequenceEdit.keep(2));
    }

    @Test
    void compute_overBound_isEmpty() {
        Optional<List<SequenceEdit<Integer>>> script = EditScripts.compute(
                List.of(1, 2, 3), List.of(4, 5, 6), Objects::equals, 15);

        assertThat(script).isEmpty();
    }

    @Test
    void compute_boundIgnoresCommonPrefixAndSuffix() {
        List<Integer> left = new ArrayList<>();
        List<Integer> right = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            left.add(i);
            right.add(i);
        }
        right.set(500, -1);

        Optional<List<SequenceEdit<Integer>>> script = EditScripts.compute(left, right, Objects::equals, 4);

        assertThat(script).isPresent();
        assertThat(EditScripts.editCount(script.get())).isEqualTo(2);
    }

    private static List<Integer> randomList(Random random) {
        int size = random.nextInt(13);
        List<Integer> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            list.add(random.nextInt(4));
        }
        return list;
    }

    private static List<Integer> replay(List<Integer> source, List<SequenceEdit<Integer>> script) {
        List<Integer> result = new ArrayList<>();
        int cursor = 0;
        for (SequenceEdit<Integer> edit : script) {
            if (edit instanceof SequenceEdit.Keep<Integer> keep) {
                result.addAll(source.subList(cursor, cursor + keep.count()));
                cursor += keep.count();
            } else if (edit instanceof SequenceEdit.Delete<Integer> delete) {
                cursor += delete.count();
            } else if (edit instanceof SequenceEdit.Insert<Integer> insert) {
                result.addAll(insert.elements());
            }
        }
        assertThat(cursor).isEqualTo(source.size());
        return result;
    }

    private static int lcsLength(List<Integer> a, List<Integer> b) {
        int[][] table = new int[a.size() + 1][b.size() + 1];
        for (int i = 1; i <= a.size(); i++) {
            for (int j = 1; j <= b.size(); j++) {
                table[i][j] = a.get(i - 1).equals(b.get(j - 1))
                        ? table[i - 1][j - 1] + 1
                        : Math.max(table[i - 1][j], table[i][j - 1]);
            }
        }
        return table[a.size()][b.size()];
    }
}
