package io.memlite.core.crdt;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable vector clock: a mapping from replicaId -> counter.
 * <p>
 * Used by memory documents to record which replicas have mutated them and to
 * classify two snapshots as ordered or concurrent. Conflict resolution never
 * depends on it: every field carries its own CRDT merge.
 * <p>
 * Design:
 *  - Immutable: internal map is copied and wrapped as unmodifiable.
 *  - Value object: equals/hashCode based purely on contents.
 *  - Zero entries are dropped, so {A:0} equals the empty clock.
 */
public final class VectorClock implements Mergeable<VectorClock> {

    private static final VectorClock EMPTY = new VectorClock(Map.of());

    private final Map<String, Long> vv;

    /**
     * Create a new vector clock from the provided entries.
     * The input map is copied; non-positive counters are ignored.
     */
    public VectorClock(Map<String, Long> vv) {
        var copy = new TreeMap<String, Long>();
        for (var e : vv.entrySet()) {
            if (e.getKey() != null && e.getValue() != null && e.getValue() > 0) {
                copy.put(e.getKey(), e.getValue());
            }
        }
        this.vv = Collections.unmodifiableMap(copy);
    }

    /** Empty clock. */
    public static VectorClock empty() { return EMPTY; }

    /** Current entries (read-only view, sorted by replica id). */
    public Map<String, Long> entries() { return vv; }

    /** Counter for a replica, 0 when absent. */
    public long get(String replicaId) { return vv.getOrDefault(replicaId, 0L); }

    /**
     * Return a new VectorClock where {@code replicaId}'s counter is incremented by 1.
     * If the replica is not present yet, it is treated as 0 and becomes 1.
     */
    public VectorClock tick(String replicaId) {
        var m = new HashMap<>(vv);
        m.put(replicaId, m.getOrDefault(replicaId, 0L) + 1);
        return new VectorClock(m);
    }

    /** Pointwise maximum of both clocks. */
    @Override
    public VectorClock merge(VectorClock other) {
        var m = new HashMap<>(vv);
        for (var e : other.vv.entrySet()) {
            m.merge(e.getKey(), e.getValue(), Math::max);
        }
        return new VectorClock(m);
    }

    /**
     * Compare this clock (A) to another clock (B) under the standard vector-clock order.
     * <p>
     * Missing entries are treated as 0. If A >= B elementwise and A != B, A is AFTER B.
     * If A is greater somewhere and B is greater somewhere else, they are CONCURRENT.
     */
    public CausalOrder compare(VectorClock other) {
        boolean aGreater = false;
        boolean bGreater = false;

        var ids = new HashSet<String>(vv.keySet());
        ids.addAll(other.vv.keySet());

        for (var id : ids) {
            long a = get(id);
            long b = other.get(id);
            if (a > b) aGreater = true;
            if (a < b) bGreater = true;
            if (aGreater && bGreater) return CausalOrder.CONCURRENT;
        }

        if (!aGreater && !bGreater) return CausalOrder.EQUAL;
        if (aGreater) return CausalOrder.AFTER;
        return CausalOrder.BEFORE;
    }

    public boolean happenedBefore(VectorClock other) { return compare(other) == CausalOrder.BEFORE; }

    public boolean concurrentWith(VectorClock other) { return compare(other) == CausalOrder.CONCURRENT; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VectorClock vc)) return false;
        return vv.equals(vc.vv);
    }

    @Override public int hashCode() { return vv.hashCode(); }

    @Override public String toString() { return vv.toString(); }
}
