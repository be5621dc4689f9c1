package org.difficient.core;

import org.difficient.api.Differ;
import org.difficient.api.delta.Delta;
import org.difficient.api.patch.PatchContext;
import org.difficient.api.patch.PatchError;
import org.difficient.api.patch.PatchException;
import org.difficient.config.DiffOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies deltas to source values.
 * <p>
 * Each call runs the differ's {@code apply} with a fresh {@link PatchContext} and either
 * returns the complete reconstructed value or throws {@link PatchException} with every error
 * found (or only the first, in fail-fast mode). A rejected patch never yields a partial value.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * Delta<Person> delta = differ.diff(before, after);
 * Person restored = PatchEngine.patch(differ, before, delta);   // equals(after)
 * }</pre>
 * <p>
 * <strong>Thread Safety:</strong> Stateless apart from its options; safe for concurrent use.
 *
 * @see PatchException
 */
public final class PatchEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PatchEngine.class);

    private final boolean failFast;

    /**
     * Creates an engine.
     *
     * @param options options providing the fail-fast setting
     * @throws NullPointerException if options is null
     */
    public PatchEngine(DiffOptions options) {
        if (options == null) {
            throw new NullPointerException("options must not be null");
        }
        this.failFast = options.failFast();
    }

    /**
     * Applies a delta with an engine configured from {@link DiffOptions#defaults()}.
     *
     * @param differ the differ of {@code T}
     * @param source the value the delta is applied to
     * @param delta the delta
     * @param <T> the value type
     * @return the reconstructed value
     * @throws PatchException if the delta does not fit the source
     */
    public static <T> T patch(Differ<T> differ, T source, Delta<T> delta) throws PatchException {
        return new PatchEngine(DiffOptions.defaults()).apply(differ, source, delta);
    }

    /**
     * Applies a delta.
     *
     * @param differ the differ of {@code T}
     * @param source the value the delta is applied to
     * @param delta the delta
     * @param <T> the value type
     * @return the reconstructed value
     * @throws PatchException if the delta does not fit the source
     * @throws NullPointerException if differ or delta is null
     */
    public <T> T apply(Differ<T> differ, T source, Delta<T> delta) throws PatchException {
        if (differ == null) {
            throw new NullPointerException("differ must not be null");
        }
        if (delta == null) {
            throw new NullPointerException("delta must not be null");
        }
        PatchContext context = new PatchContext(failFast);
        T result = differ.apply(source, delta, context);
        if (context.hasErrors()) {
            List<PatchError> errors = context.getErrors();
            LOG.debug("Rejected {} delta with {} error(s), first: {}", delta.kind(), errors.size(), errors.get(0));
            throw new PatchException(errors);
        }
        LOG.trace("Applied {} delta", delta.kind());
        return result;
    }

    /**
     * Returns whether this engine stops at the first error.
     *
     * @return the fail-fast setting
     */
    public boolean isFailFast() {
        return failFast;
    }
}
