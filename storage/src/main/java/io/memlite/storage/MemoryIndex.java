package io.memlite.storage;

import io.memlite.core.MemoryDocument;
import io.memlite.core.MemoryType;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.stream.Collectors;

/**
 * Secondary indices over stored documents: type, tag, content hash and importance.
 * <p>
 * All structures are concurrent, so readers never block on writers. The store updates an
 * entry while holding that document's lock, which keeps the indices of one id consistent.
 * Keys are shared across ids, so every set insertion and removal runs inside the map's
 * atomic compute.
 */
final class MemoryIndex {

    /** Importance index key; ordered by importance desc, then id. */
    record Ranked(double importance, String id) {}

    private static final Comparator<Ranked> BY_IMPORTANCE_DESC =
            Comparator.comparingDouble(Ranked::importance).reversed().thenComparing(Ranked::id);

    private final Map<MemoryType, Set<String>> byType = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> byTag = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> byHash = new ConcurrentHashMap<>();
    private final NavigableSet<Ranked> byImportance = new ConcurrentSkipListSet<>(BY_IMPORTANCE_DESC);

    /** Replace the index entries of {@code previous} (may be null) with those of {@code next}. */
    void update(MemoryDocument previous, MemoryDocument next) {
        String id = next.id();
        addTo(byType, next.memoryType(), id);

        Set<String> oldTags = previous == null ? Set.of() : previous.tags();
        Set<String> newTags = next.tags();
        for (String tag : oldTags) {
            if (!newTags.contains(tag)) removeFrom(byTag, tag, id);
        }
        for (String tag : newTags) {
            addTo(byTag, tag, id);
        }

        String newHash = next.contentHash();
        if (previous != null) {
            String oldHash = previous.contentHash();
            if (!oldHash.equals(newHash)) removeFrom(byHash, oldHash, id);
            byImportance.remove(new Ranked(previous.importance(), id));
        }
        addTo(byHash, newHash, id);
        byImportance.add(new Ranked(next.importance(), id));
    }

    Set<String> idsOfType(MemoryType type) { return byType.getOrDefault(type, Set.of()); }

    Set<String> idsWithTag(String tag) { return byTag.getOrDefault(tag, Set.of()); }

    Set<String> idsWithHash(String hash) { return byHash.getOrDefault(hash, Set.of()); }

    /** Ids with importance >= min, highest first. */
    List<String> idsByImportance(double min) {
        return byImportance.stream()
                .takeWhile(r -> r.importance() >= min)
                .map(Ranked::id)
                .collect(Collectors.toList());
    }

    /** Top {@code limit} ids by importance. */
    List<String> topByImportance(int limit) {
        return byImportance.stream().limit(limit).map(Ranked::id).collect(Collectors.toList());
    }

    // Insert inside compute: a concurrent removeFrom on the same key may unmap an emptied set.
    private static <K> void addTo(Map<K, Set<String>> index, K key, String id) {
        index.compute(key, (k, ids) -> {
            if (ids == null) ids = ConcurrentHashMap.newKeySet();
            ids.add(id);
            return ids;
        });
    }

    private static void removeFrom(Map<String, Set<String>> index, String key, String id) {
        index.computeIfPresent(key, (k, ids) -> {
            ids.remove(id);
            return ids.isEmpty() ? null : ids;
        });
    }
}
