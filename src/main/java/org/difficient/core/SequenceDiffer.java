package org.difficient.core;

import org.difficient.api.delta.Delta;
import org.difficient.api.delta.SequenceEdit;
import org.difficient.api.patch.PatchContext;
import org.difficient.api.patch.PatchError;
import org.difficient.config.DiffOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.BiPredicate;

/**
 * Differ for ordered lists, producing minimal {@link Delta.SequenceEdits} scripts.
 * <p>
 * Elements are aligned whole with the configured equality; see {@link EditScripts} for the
 * algorithm and the canonical form. An element pair aligned by that equality but not
 * {@link Object#equals} is emitted as {@code Delete} plus {@code Insert}, so a script always
 * replays to the exact target. Equal lists yield {@link Delta.NoChange}.
 * <p>
 * <strong>Cost guard:</strong> when the LCS table for the lists (after trimming their common
 * prefix and suffix) would exceed {@link DiffOptions#maxLcsCells()}, the differ emits
 * {@link Delta.Replace} with a copy of the target instead. The round trip still holds.
 * <p>
 * <strong>Patching:</strong> operations are replayed left to right. A non-positive
 * {@code Keep}/{@code Delete} count, an empty {@code Insert}, an operation running past the
 * end of the source, or a script leaving source elements unconsumed is rejected as
 * {@link PatchError.Kind#SEQUENCE_OUT_OF_BOUNDS}. Patched lists are unmodifiable.
 * <p>
 * <strong>Thread Safety:</strong> Immutable, safe for concurrent use.
 *
 * @param <E> the element type
 */
public final class SequenceDiffer<E> extends AbstractDiffer<List<E>> {

    private static final Logger LOG = LoggerFactory.getLogger(SequenceDiffer.class);

    private final BiPredicate<? super E, ? super E> equality;
    private final long maxLcsCells;

    /**
     * Creates a sequence differ.
     *
     * @param equality element equality
     * @param options options providing the LCS table bound
     * @throws NullPointerException if equality or options is null
     */
    public SequenceDiffer(BiPredicate<? super E, ? super E> equality, DiffOptions options) {
        super("sequence");
        if (equality == null) {
            throw new NullPointerException("equality must not be null");
        }
        if (options == null) {
            throw new NullPointerException("options must not be null");
        }
        this.equality = equality;
        this.maxLcsCells = options.maxLcsCells();
    }

    @Override
    protected Delta<List<E>> diffValues(List<E> left, List<E> right) {
        Optional<List<SequenceEdit<E>>> script = EditScripts.compute(left, right, equality, maxLcsCells);
        if (script.isEmpty()) {
            LOG.debug("LCS table for {}x{} elements exceeds {} cells, diffing as full replacement",
                    left.size(), right.size(), maxLcsCells);
            return Delta.replace(copyOf(right));
        }
        List<SequenceEdit<E>> edits = EditScripts.exactKeeps(left, right, script.get());
        if (edits.isEmpty() || (edits.size() == 1 && edits.get(0) instanceof SequenceEdit.Keep)) {
            return Delta.noChange();
        }
        return new Delta.SequenceEdits<>(edits);
    }

    @Override
    protected List<E> applyChange(List<E> source, Delta<List<E>> delta, PatchContext context) {
        if (!(delta instanceof Delta.SequenceEdits<?> script)) {
            context.rejectKind(getName(), delta);
            return source;
        }
        @SuppressWarnings("unchecked")
        List<SequenceEdit<E>> edits = (List<SequenceEdit<E>>) (List<?>) script.edits();

        int size = source.size();
        int cursor = 0;
        List<E> result = new ArrayList<>(size);
        for (int op = 0; op < edits.size(); op++) {
            SequenceEdit<E> edit = edits.get(op);
            if (edit instanceof SequenceEdit.Keep<E> keep) {
                if (!consumable(op, "Keep", keep.count(), cursor, size, context)) {
                    return source;
                }
                result.addAll(source.subList(cursor, cursor + keep.count()));
                cursor += keep.count();
            } else if (edit instanceof SequenceEdit.Delete<E> delete) {
                if (!consumable(op, "Delete", delete.count(), cursor, size, context)) {
                    return source;
                }
                cursor += delete.count();
            } else if (edit instanceof SequenceEdit.Insert<E> insert) {
                if (insert.elements().isEmpty()) {
                    context.reject(PatchError.Kind.SEQUENCE_OUT_OF_BOUNDS,
                            "operation #" + op + " Insert carries no elements");
                    return source;
                }
                result.addAll(insert.elements());
            }
        }
        if (cursor != size) {
            context.reject(PatchError.Kind.SEQUENCE_OUT_OF_BOUNDS,
                    "edit script consumed " + cursor + " of " + size + " source elements");
            return source;
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    protected List<E> unchanged(List<E> source) {
        return source == null ? null : copyOf(source);
    }

    private static boolean consumable(int op, String name, int count, int cursor, int size, PatchContext context) {
        if (count <= 0) {
            context.reject(PatchError.Kind.SEQUENCE_OUT_OF_BOUNDS,
                    "operation #" + op + " " + name + " has non-positive count " + count);
            return false;
        }
        if ((long) cursor + count > size) {
            context.reject(PatchError.Kind.SEQUENCE_OUT_OF_BOUNDS,
                    "operation #" + op + " " + name + "(" + count + ") runs past the end of the source: "
                            + cursor + " of " + size + " elements already consumed");
            return false;
        }
        return true;
    }

    private static <E> List<E> copyOf(List<E> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
