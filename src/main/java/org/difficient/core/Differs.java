package org.difficient.core;

import org.difficient.api.Differ;
import org.difficient.config.DiffOptions;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Supplier;

/**
 * Static factories for the built-in differs.
 * <p>
 * Composite differs are assembled from the differs of their parts:
 * <pre>{@code
 * record Team(String name, List<String> members, Map<String, Integer> scores) {}
 *
 * Differ<Team> teams = Differs.product(Team.class)
 *         .scalar("name", Team::name)
 *         .field("members", Team::members, Differs.list())
 *         .field("scores", Team::scores, Differs.map(Differs.scalar()))
 *         .build(v -> new Team(v.get("name"), v.get("members"), v.get("scores")));
 * }</pre>
 * Sequence differs created without explicit options use {@link DiffOptions#defaults()}.
 */
public final class Differs {

    private Differs() {
        // No instantiation - static factories
    }

    /**
     * Returns the equality-based differ for atomic values.
     *
     * @param <T> the atomic type
     * @return the scalar differ
     */
    public static <T> Differ<T> scalar() {
        return ScalarDiffer.instance();
    }

    /**
     * Returns a list differ comparing elements with {@link Object#equals}.
     *
     * @param <E> the element type
     * @return the sequence differ
     */
    public static <E> Differ<List<E>> list() {
        return list(Objects::equals, DiffOptions.defaults());
    }

    /**
     * Returns a list differ comparing elements with {@link Object#equals}.
     *
     * @param options options providing the LCS table bound
     * @param <E> the element type
     * @return the sequence differ
     */
    public static <E> Differ<List<E>> list(DiffOptions options) {
        return list(Objects::equals, options);
    }

    /**
     * Returns a list differ using an element differ as equality oracle: two elements match
     * when their delta is {@code NoChange}. Matched elements are kept, others are deleted and
     * inserted whole.
     *
     * @param elementDiffer differ of the element type
     * @param <E> the element type
     * @return the sequence differ
     */
    public static <E> Differ<List<E>> list(Differ<E> elementDiffer) {
        Objects.requireNonNull(elementDiffer, "elementDiffer must not be null");
        return list((E a, E b) -> elementDiffer.diff(a, b).isNoChange(), DiffOptions.defaults());
    }

    /**
     * Returns a list differ aligning elements with a custom equality. Aligned elements that
     * are not {@link Object#equals} are still replaced, so patching reproduces the target.
     *
     * @param equality element equality
     * @param options options providing the LCS table bound
     * @param <E> the element type
     * @return the sequence differ
     */
    public static <E> Differ<List<E>> list(BiPredicate<? super E, ? super E> equality, DiffOptions options) {
        return new SequenceDiffer<>(equality, options);
    }

    /**
     * Returns a map differ producing {@link java.util.LinkedHashMap} results.
     *
     * @param valueDiffer differ of the value type
     * @param <K> the key type
     * @param <V> the value type
     * @return the map differ
     */
    public static <K, V> Differ<Map<K, V>> map(Differ<V> valueDiffer) {
        return new MapDiffer<>(valueDiffer);
    }

    /**
     * Returns a map differ building patched results with {@code mapFactory}.
     *
     * @param valueDiffer differ of the value type
     * @param mapFactory creates empty mutable maps, e.g. {@code TreeMap::new}
     * @param <K> the key type
     * @param <V> the value type
     * @return the map differ
     */
    public static <K, V> Differ<Map<K, V>> map(Differ<V> valueDiffer, Supplier<? extends Map<K, V>> mapFactory) {
        return new MapDiffer<>(valueDiffer, mapFactory);
    }

    /**
     * Returns an optional differ.
     *
     * @param valueDiffer differ of the contained type
     * @param <T> the contained type
     * @return the optional differ
     */
    public static <T> Differ<Optional<T>> optional(Differ<T> valueDiffer) {
        return new OptionalDiffer<>(valueDiffer);
    }

    /**
     * Returns a differ that resolves {@code supplier} on first use. Needed when a type's
     * differ refers to itself, e.g. a tree node holding a list of child nodes.
     *
     * @param supplier provides the actual differ
     * @param <T> the diffed type
     * @return the lazily resolved differ
     */
    public static <T> Differ<T> lazy(Supplier<? extends Differ<T>> supplier) {
        return new LazyDiffer<>(supplier);
    }

    /**
     * Starts a product differ.
     *
     * @param type the product class
     * @param <T> the product type
     * @return a builder
     */
    public static <T> ProductDiffer.Builder<T> product(Class<T> type) {
        return ProductDiffer.builder(type);
    }

    /**
     * Starts a sum differ.
     *
     * @param type the sum type's root class or interface
     * @param <T> the sum type
     * @return a builder
     */
    public static <T> SumDiffer.Builder<T> sum(Class<T> type) {
        return SumDiffer.builder(type);
    }
}
