package io.memlite.core.crdt;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable observed-remove set with add-wins semantics.
 * <p>
 * State per element:
 *  - added:   every tag ever attached to the element,
 *  - removed: the subset of those tags a replica has observed and removed.
 * An element is present while it has at least one tag that is added but not removed.
 * <p>
 * Merge is the per-element union of both tag sets. A remove only covers the tags
 * it observed, so an add performed concurrently elsewhere (fresh tag) survives it.
 * Removed tags are kept so that a later merge with a stale copy cannot resurrect them.
 * <p>
 * Tag counters are minted per replica as 1 + the highest counter that replica has
 * ever used in this set, so a replica never reuses a tag.
 */
public final class ORSet<T> implements Mergeable<ORSet<T>> {

    private static final ORSet<?> EMPTY = new ORSet<>(Map.of(), Map.of());

    private final Map<T, Set<OrTag>> added;
    private final Map<T, Set<OrTag>> removed;

    private ORSet(Map<T, Set<OrTag>> added, Map<T, Set<OrTag>> removed) {
        this.added = added;
        this.removed = removed;
    }

    @SuppressWarnings("unchecked")
    public static <T> ORSet<T> empty() { return (ORSet<T>) EMPTY; }

    /**
     * Rebuild a set from its raw state (used by codecs).
     * Removed tags that were never added are dropped.
     */
    public static <T> ORSet<T> of(Map<T, ? extends Collection<OrTag>> added,
                                  Map<T, ? extends Collection<OrTag>> removed) {
        var a = new HashMap<T, Set<OrTag>>();
        added.forEach((e, tags) -> {
            if (!tags.isEmpty()) a.put(e, new HashSet<>(tags));
        });
        var r = new HashMap<T, Set<OrTag>>();
        removed.forEach((e, tags) -> {
            var known = a.get(e);
            if (known == null) return;
            var kept = new HashSet<OrTag>(tags);
            kept.retainAll(known);
            if (!kept.isEmpty()) r.put(e, kept);
        });
        return new ORSet<>(freeze(a), freeze(r));
    }

    /** Result of {@link #add(Object, String)}: the grown set and the tag it minted. */
    public record Addition<T>(ORSet<T> set, OrTag tag) {}

    /** Mint the next unused tag for {@code replicaId}. */
    public OrTag nextTag(String replicaId) {
        Objects.requireNonNull(replicaId, "replicaId");
        long max = 0;
        for (var tags : added.values()) {
            for (var t : tags) {
                if (t.replicaId().equals(replicaId) && t.counter() > max) max = t.counter();
            }
        }
        return new OrTag(replicaId, max + 1);
    }

    /** Add {@code element} under a freshly minted tag for {@code replicaId}. */
    public Addition<T> add(T element, String replicaId) {
        OrTag tag = nextTag(replicaId);
        return new Addition<>(add(element, tag), tag);
    }

    /** Add {@code element} under an explicit tag. Re-adding a known tag is a no-op. */
    public ORSet<T> add(T element, OrTag tag) {
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(tag, "tag");
        var current = added.getOrDefault(element, Set.of());
        if (current.contains(tag)) return this;

        var a = new HashMap<>(added);
        var tags = new HashSet<>(current);
        tags.add(tag);
        a.put(element, Set.copyOf(tags));
        return new ORSet<>(Map.copyOf(a), removed);
    }

    /**
     * Remove the given observed tags of {@code element}.
     * Tags that are unknown or already removed are ignored, so the call never fails.
     */
    public ORSet<T> remove(T element, Collection<OrTag> observedTags) {
        var known = added.get(element);
        if (known == null || observedTags.isEmpty()) return this;

        var gone = removed.getOrDefault(element, Set.of());
        var next = new HashSet<>(gone);
        for (var tag : observedTags) {
            if (known.contains(tag)) next.add(tag);
        }
        if (next.size() == gone.size()) return this;

        var r = new HashMap<>(removed);
        r.put(element, Set.copyOf(next));
        return new ORSet<>(added, Map.copyOf(r));
    }

    /** Remove every tag of {@code element} this replica currently observes. */
    public ORSet<T> removeAll(T element) {
        return remove(element, tagsOf(element));
    }

    /** Live (added and not removed) tags of an element. */
    public Set<OrTag> tagsOf(T element) {
        var tags = added.get(element);
        if (tags == null) return Set.of();
        var gone = removed.getOrDefault(element, Set.of());
        if (gone.isEmpty()) return tags;
        return tags.stream().filter(t -> !gone.contains(t)).collect(Collectors.toUnmodifiableSet());
    }

    public boolean contains(T element) { return !tagsOf(element).isEmpty(); }

    /** Present elements. */
    public Set<T> elements() {
        return added.keySet().stream().filter(this::contains).collect(Collectors.toUnmodifiableSet());
    }

    public int size() { return elements().size(); }

    public boolean isEmpty() { return elements().isEmpty(); }

    /** Raw added-tag state, including removed tags. */
    public Map<T, Set<OrTag>> addedTags() { return added; }

    /** Raw removed-tag state. */
    public Map<T, Set<OrTag>> removedTags() { return removed; }

    @Override
    public ORSet<T> merge(ORSet<T> other) {
        if (this.equals(other)) return this;
        return new ORSet<>(union(added, other.added), union(removed, other.removed));
    }

    private static <T> Map<T, Set<OrTag>> union(Map<T, Set<OrTag>> a, Map<T, Set<OrTag>> b) {
        var out = new HashMap<T, Set<OrTag>>();
        for (var src : List.of(a, b)) {
            src.forEach((e, tags) -> out.computeIfAbsent(e, k -> new HashSet<>()).addAll(tags));
        }
        return freeze(out);
    }

    private static <T> Map<T, Set<OrTag>> freeze(Map<T, Set<OrTag>> m) {
        var out = new HashMap<T, Set<OrTag>>(m.size() * 2);
        m.forEach((e, tags) -> out.put(e, Set.copyOf(tags)));
        return Map.copyOf(out);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ORSet<?> s)) return false;
        return added.equals(s.added) && removed.equals(s.removed);
    }

    @Override public int hashCode() { return Objects.hash(added, removed); }

    @Override public String toString() { return "ORSet" + elements(); }
}
