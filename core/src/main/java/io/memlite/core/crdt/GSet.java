package io.memlite.core.crdt;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable grow-only set.
 * <p>
 * Elements can only be added; merge is set union. Used for relationship and
 * evidence fields that accumulate across replicas.
 */
public final class GSet<T> implements Mergeable<GSet<T>> {

    private static final GSet<?> EMPTY = new GSet<>(Set.of());

    private final Set<T> elements;

    private GSet(Set<T> elements) {
        this.elements = elements;
    }

    @SuppressWarnings("unchecked")
    public static <T> GSet<T> empty() { return (GSet<T>) EMPTY; }

    public static <T> GSet<T> of(Collection<? extends T> elements) {
        return new GSet<>(Set.copyOf(elements));
    }

    /** Return a set containing {@code element}; returns this instance when already present. */
    public GSet<T> add(T element) {
        Objects.requireNonNull(element, "element");
        if (elements.contains(element)) return this;
        var next = new HashSet<T>(elements);
        next.add(element);
        return new GSet<>(Set.copyOf(next));
    }

    public boolean contains(T element) { return elements.contains(element); }

    /** Read-only view of the elements. */
    public Set<T> elements() { return elements; }

    public int size() { return elements.size(); }

    public boolean isEmpty() { return elements.isEmpty(); }

    @Override
    public GSet<T> merge(GSet<T> other) {
        if (other.elements.isEmpty() || elements.containsAll(other.elements)) return this;
        if (other.elements.containsAll(elements)) return other;
        var union = new HashSet<T>(elements);
        union.addAll(other.elements);
        return new GSet<>(Set.copyOf(union));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GSet<?> g)) return false;
        return elements.equals(g.elements);
    }

    @Override public int hashCode() { return elements.hashCode(); }

    @Override public String toString() { return "GSet" + elements; }
}
