package org.difficient.core;

import org.difficient.api.Differ;
import org.difficient.api.delta.Delta;
import org.difficient.api.patch.PatchContext;

import java.util.function.Supplier;

/**
 * Differ resolved on first use, for recursive types whose differ refers to itself through a
 * field, variant or element.
 * <p>
 * Only tree-shaped values are supported; a cyclic object graph recurses without bound.
 *
 * @param <T> the diffed type
 */
final class LazyDiffer<T> implements Differ<T> {

    private final Supplier<? extends Differ<T>> supplier;
    private volatile Differ<T> delegate;

    LazyDiffer(Supplier<? extends Differ<T>> supplier) {
        if (supplier == null) {
            throw new NullPointerException("supplier must not be null");
        }
        this.supplier = supplier;
    }

    @Override
    public Delta<T> diff(T left, T right) {
        return delegate().diff(left, right);
    }

    @Override
    public T apply(T source, Delta<T> delta, PatchContext context) {
        return delegate().apply(source, delta, context);
    }

    private Differ<T> delegate() {
        Differ<T> result = delegate;
        if (result == null) {
            result = supplier.get();
            if (result == null) {
                throw new IllegalStateException("Lazy differ supplier returned null");
            }
            delegate = result;
        }
        return result;
    }
}
