package org.difficient.core;

import org.difficient.api.Differ;
import org.difficient.api.delta.Delta;
import org.difficient.api.delta.EntryEdit;
import org.difficient.api.patch.PatchContext;
import org.difficient.api.patch.PatchError;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Differ for associative containers, producing per-key {@link Delta.EntriesChanged} deltas.
 * <p>
 * Keys only in the source become {@link EntryEdit.Removed}, keys only in the target become
 * {@link EntryEdit.Inserted}, and keys on both sides whose values differ become
 * {@link EntryEdit.Changed} with the value differ's delta. Removed and changed keys follow the
 * source's iteration order, inserted keys the target's. Equal maps yield
 * {@link Delta.NoChange}.
 * <p>
 * <strong>Patching:</strong> the source is copied into a fresh map from the configured
 * factory, then every entry edit is checked and applied. Removing or changing an absent key
 * is a {@link PatchError.Kind#MISSING_KEY}; inserting a present key is a
 * {@link PatchError.Kind#UNEXPECTED_KEY}. All such errors of one patch are reported together.
 * <p>
 * <strong>Thread Safety:</strong> Immutable, safe for concurrent use.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class MapDiffer<K, V> extends AbstractDiffer<Map<K, V>> {

    private final Differ<V> valueDiffer;
    private final Supplier<? extends Map<K, V>> mapFactory;

    /**
     * Creates a map differ producing {@link LinkedHashMap} results.
     *
     * @param valueDiffer differ of the value type
     */
    public MapDiffer(Differ<V> valueDiffer) {
        this(valueDiffer, LinkedHashMap::new);
    }

    /**
     * Creates a map differ.
     *
     * @param valueDiffer differ of the value type
     * @param mapFactory creates the (empty, mutable) map patched results are built in
     * @throws NullPointerException if an argument is null
     */
    public MapDiffer(Differ<V> valueDiffer, Supplier<? extends Map<K, V>> mapFactory) {
        super("map");
        if (valueDiffer == null) {
            throw new NullPointerException("valueDiffer must not be null");
        }
        if (mapFactory == null) {
            throw new NullPointerException("mapFactory must not be null");
        }
        this.valueDiffer = valueDiffer;
        this.mapFactory = mapFactory;
    }

    @Override
    protected Delta<Map<K, V>> diffValues(Map<K, V> left, Map<K, V> right) {
        Map<K, EntryEdit<V>> entries = new LinkedHashMap<>();
        for (Map.Entry<K, V> entry : left.entrySet()) {
            K key = entry.getKey();
            if (!right.containsKey(key)) {
                entries.put(key, new EntryEdit.Removed<>());
                continue;
            }
            Delta<V> delta = valueDiffer.diff(entry.getValue(), right.get(key));
            if (!delta.isNoChange()) {
                entries.put(key, new EntryEdit.Changed<>(delta));
            }
        }
        for (Map.Entry<K, V> entry : right.entrySet()) {
            if (!left.containsKey(entry.getKey())) {
                entries.put(entry.getKey(), new EntryEdit.Inserted<>(entry.getValue()));
            }
        }
        if (entries.isEmpty()) {
            return Delta.noChange();
        }
        return new Delta.EntriesChanged<>(entries);
    }

    @Override
    protected Map<K, V> applyChange(Map<K, V> source, Delta<Map<K, V>> delta, PatchContext context) {
        if (!(delta instanceof Delta.EntriesChanged<?, ?> changed)) {
            context.rejectKind(getName(), delta);
            return source;
        }
        @SuppressWarnings("unchecked")
        Map<K, EntryEdit<V>> entries = (Map<K, EntryEdit<V>>) (Map<?, ?>) changed.entries();

        Map<K, V> result = mapFactory.get();
        result.putAll(source);
        for (Map.Entry<K, EntryEdit<V>> entry : entries.entrySet()) {
            if (context.isAborted()) {
                break;
            }
            K key = entry.getKey();
            EntryEdit<V> edit = entry.getValue();
            boolean present = result.containsKey(key);
            if (edit instanceof EntryEdit.Removed<V>) {
                if (!present) {
                    context.reject(PatchError.Kind.MISSING_KEY, "cannot remove absent key " + key);
                } else {
                    result.remove(key);
                }
            } else if (edit instanceof EntryEdit.Inserted<V> inserted) {
                if (present) {
                    context.reject(PatchError.Kind.UNEXPECTED_KEY, "cannot insert present key " + key);
                } else {
                    result.put(key, inserted.value());
                }
            } else if (edit instanceof EntryEdit.Changed<V> valueChange) {
                if (!present) {
                    context.reject(PatchError.Kind.MISSING_KEY, "cannot change absent key " + key);
                } else {
                    result.put(key, context.descend(PatchContext.key(key), valueDiffer, result.get(key),
                            valueChange.delta()));
                }
            }
        }
        if (context.hasErrors()) {
            return source;
        }
        return result;
    }

    @Override
    protected Map<K, V> unchanged(Map<K, V> source) {
        if (source == null) {
            return null;
        }
        Map<K, V> copy = mapFactory.get();
        copy.putAll(source);
        return copy;
    }
}
