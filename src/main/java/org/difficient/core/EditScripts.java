package org.difficient.core;

import org.difficient.api.delta.SequenceEdit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Computes minimal edit scripts between two lists.
 * <p>
 * <strong>Algorithm:</strong>
 * <ol>
 *   <li>Trim the common prefix and suffix (both are part of some longest common
 *       subsequence, so trimming keeps the script minimal)</li>
 *   <li>Fill the table of LCS lengths of all suffix pairs of the remaining middle parts,
 *       iteratively from the end ({@code O(n·m)} time and cells)</li>
 *   <li>Walk the table from the start: equal elements are kept, otherwise an element of the
 *       left side is deleted when that does not shorten the LCS, else an element of the
 *       right side is inserted</li>
 * </ol>
 * The number of deleted plus inserted elements is therefore minimal. The script is emitted in
 * canonical form: adjacent keeps are merged, and between two keep runs a single
 * {@code Delete} precedes a single {@code Insert}. The script consumes the whole source.
 * <p>
 * Elements are treated whole: they are matched verbatim or deleted and inserted, never
 * patched in place.
 */
final class EditScripts {

    private EditScripts() {
        // No instantiation - static utility
    }

    /**
     * Computes the canonical edit script from {@code left} to {@code right}.
     *
     * @param left the source list
     * @param right the target list
     * @param equality element equality
     * @param maxCells bound on the LCS table size
     * @param <E> the element type
     * @return the script, or empty if the table for the trimmed middle parts would exceed
     *         {@code maxCells}
     */
    static <E> Optional<List<SequenceEdit<E>>> compute(
            List<E> left, List<E> right, BiPredicate<? super E, ? super E> equality, long maxCells) {
        int n = left.size();
        int m = right.size();

        int prefix = 0;
        while (prefix < n && prefix < m && equality.test(left.get(prefix), right.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < n - prefix && suffix < m - prefix
                && equality.test(left.get(n - 1 - suffix), right.get(m - 1 - suffix))) {
            suffix++;
        }

        List<E> leftMiddle = left.subList(prefix, n - suffix);
        List<E> rightMiddle = right.subList(prefix, m - suffix);

        Compactor<E> script = new Compactor<>();
        script.keep(prefix);
        if (leftMiddle.isEmpty()) {
            script.insertAll(rightMiddle);
        } else if (rightMiddle.isEmpty()) {
            script.delete(leftMiddle.size());
        } else {
            long cells = (long) (leftMiddle.size() + 1) * (rightMiddle.size() + 1);
            if (cells > maxCells) {
                return Optional.empty();
            }
            int[][] lcs = suffixTable(leftMiddle, rightMiddle, equality);
            walk(lcs, leftMiddle, rightMiddle, equality, script);
        }
        script.keep(suffix);
        return Optional.of(script.finish());
    }

    /**
     * Rewrites a script so that every kept element is {@link Objects#equals} to its
     * counterpart in {@code right}. Pairs matched by a looser element equality are turned into
     * a deletion and an insertion of the target element, so replaying the script yields
     * {@code right} itself.
     *
     * @param left the source list the script was computed from
     * @param right the target list the script was computed for
     * @param edits a script from {@link #compute}
     * @param <E> the element type
     * @return the canonical script with exact keeps
     */
    static <E> List<SequenceEdit<E>> exactKeeps(List<E> left, List<E> right, List<SequenceEdit<E>> edits) {
        Compactor<E> script = new Compactor<>();
        int i = 0;
        int j = 0;
        for (SequenceEdit<E> edit : edits) {
            if (edit instanceof SequenceEdit.Keep<E> keep) {
                for (int k = 0; k < keep.count(); k++, i++, j++) {
                    if (Objects.equals(left.get(i), right.get(j))) {
                        script.keep(1);
                    } else {
                        script.delete(1);
                        script.insert(right.get(j));
                    }
                }
            } else if (edit instanceof SequenceEdit.Delete<E> delete) {
                script.delete(delete.count());
                i += delete.count();
            } else if (edit instanceof SequenceEdit.Insert<E> insert) {
                script.insertAll(insert.elements());
                j += insert.elements().size();
            }
        }
        return script.finish();
    }

    /**
     * Returns the total number of deleted and inserted elements of a script.
     *
     * @param edits the script
     * @return edit distance of the script
     */
    static int editCount(List<? extends SequenceEdit<?>> edits) {
        int count = 0;
        for (SequenceEdit<?> edit : edits) {
            if (edit instanceof SequenceEdit.Delete<?> delete) {
                count += delete.count();
            } else if (edit instanceof SequenceEdit.Insert<?> insert) {
                count += insert.elements().size();
            }
        }
        return count;
    }

    /**
     * {@code lcs[i][j]} is the LCS length of {@code left[i..]} and {@code right[j..]}.
     */
    private static <E> int[][] suffixTable(List<E> left, List<E> right, BiPredicate<? super E, ? super E> equality) {
        int rows = left.size();
        int cols = right.size();
        int[][] lcs = new int[rows + 1][cols + 1];
        for (int i = rows - 1; i >= 0; i--) {
            E leftElement = left.get(i);
            for (int j = cols - 1; j >= 0; j--) {
                if (equality.test(leftElement, right.get(j))) {
                    lcs[i][j] = lcs[i + 1][j + 1] + 1;
                } else {
                    lcs[i][j] = Math.max(lcs[i + 1][j], lcs[i][j + 1]);
                }
            }
        }
        return lcs;
    }

    private static <E> void walk(int[][] lcs, List<E> left, List<E> right,
                                 BiPredicate<? super E, ? super E> equality, Compactor<E> script) {
        int rows = left.size();
        int cols = right.size();
        int i = 0;
        int j = 0;
        while (i < rows && j < cols) {
            if (equality.test(left.get(i), right.get(j))) {
                script.keep(1);
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                // ties prefer deletion
                script.delete(1);
                i++;
            } else {
                script.insert(right.get(j));
                j++;
            }
        }
        script.delete(rows - i);
        script.insertAll(right.subList(j, cols));
    }

    // ========================================================================
    // Compactor
    // ========================================================================

    /**
     * Accumulates single-step operations into canonical form.
     * <p>
     * At most one of "pending keep" and "pending delete/insert" is non-empty at any time.
     */
    static final class Compactor<E> {

        private final List<SequenceEdit<E>> edits = new ArrayList<>();
        private int pendingKeep;
        private int pendingDelete;
        private final List<E> pendingInsert = new ArrayList<>();

        void keep(int count) {
            if (count <= 0) {
                return;
            }
            flushChanges();
            pendingKeep += count;
        }

        void delete(int count) {
            if (count <= 0) {
                return;
            }
            flushKeep();
            pendingDelete += count;
        }

        void insert(E element) {
            flushKeep();
            pendingInsert.add(element);
        }

        void insertAll(List<E> elements) {
            if (elements.isEmpty()) {
                return;
            }
            flushKeep();
            pendingInsert.addAll(elements);
        }

        List<SequenceEdit<E>> finish() {
            flushKeep();
            flushChanges();
            return Collections.unmodifiableList(new ArrayList<>(edits));
        }

        private void flushKeep() {
            if (pendingKeep > 0) {
                edits.add(SequenceEdit.keep(pendingKeep));
                pendingKeep = 0;
            }
        }

        private void flushChanges() {
            if (pendingDelete > 0) {
                edits.add(SequenceEdit.delete(pendingDelete));
                pendingDelete = 0;
            }
            if (!pendingInsert.isEmpty()) {
                edits.add(SequenceEdit.insert(pendingInsert));
                pendingInsert.clear();
            }
        }
    }
}
