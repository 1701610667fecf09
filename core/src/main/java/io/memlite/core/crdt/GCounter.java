package io.memlite.core.crdt;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable grow-only counter: one increment-only slot per replica.
 * Value is the sum of all slots; merge takes the pointwise maximum.
 */
public final class GCounter implements Mergeable<GCounter> {

    private static final GCounter EMPTY = new GCounter(Map.of());

    private final Map<String, Long> counts;

    private GCounter(Map<String, Long> counts) {
        this.counts = counts;
    }

    public static GCounter empty() { return EMPTY; }

    /** Rebuild from raw per-replica counts; non-positive entries are dropped. */
    public static GCounter of(Map<String, Long> counts) {
        var m = new HashMap<String, Long>();
        counts.forEach((k, v) -> {
            if (k != null && v != null && v > 0) m.put(k, v);
        });
        return new GCounter(Map.copyOf(m));
    }

    /** Increment the slot of {@code replicaId} by {@code amount}; non-positive amounts are ignored. */
    public GCounter increment(String replicaId, long amount) {
        Objects.requireNonNull(replicaId, "replicaId");
        if (amount <= 0) return this;
        var m = new HashMap<>(counts);
        m.merge(replicaId, amount, Long::sum);
        return new GCounter(Map.copyOf(m));
    }

    public GCounter increment(String replicaId) { return increment(replicaId, 1L); }

    public long value() {
        long sum = 0;
        for (long v : counts.values()) sum += v;
        return sum;
    }

    public long countFor(String replicaId) { return counts.getOrDefault(replicaId, 0L); }

    /** Raw per-replica counts. */
    public Map<String, Long> counts() { return counts; }

    @Override
    public GCounter merge(GCounter other) {
        var m = new HashMap<>(counts);
        other.counts.forEach((k, v) -> m.merge(k, v, Math::max));
        return new GCounter(Map.copyOf(m));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GCounter g)) return false;
        return counts.equals(g.counts);
    }

    @Override public int hashCode() { return counts.hashCode(); }

    @Override public String toString() { return "GCounter(value=" + value() + ")"; }
}
