package io.memlite.core.crdt;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VectorClockTest {

    @Test
    void tick_strictly_dominates_previous_clock() {
        var before = new VectorClock(Map.of("A", 2L, "B", 1L));
        var after = before.tick("A");

        assertEquals(3L, after.get("A"));
        assertEquals(CausalOrder.AFTER, after.compare(before));
        assertEquals(CausalOrder.BEFORE, before.compare(after));
        assertEquals(after.compare(before).swap(), before.compare(after));
        assertTrue(before.happenedBefore(after));
    }

    @Test
    void tick_of_unknown_replica_starts_at_one() {
        assertEquals(1L, VectorClock.empty().tick("C").get("C"));
    }

    @Test
    void concurrency_when_neither_dominates() {
        // {A:3} vs {A:2,B:1}: each has seen something the other has not
        var aOnly = new VectorClock(Map.of("A", 3L));
        var mixed = new VectorClock(Map.of("A", 2L, "B", 1L));

        assertEquals(CausalOrder.CONCURRENT, aOnly.compare(mixed));
        assertEquals(CausalOrder.CONCURRENT, mixed.compare(aOnly));
        assertEquals(CausalOrder.CONCURRENT, CausalOrder.CONCURRENT.swap());
        assertEquals(CausalOrder.EQUAL, CausalOrder.EQUAL.swap());
        assertTrue(aOnly.concurrentWith(mixed));
    }

    @Test
    void merge_is_pointwise_max_and_dominates_both_inputs() {
        var a = new VectorClock(Map.of("A", 3L));
        var b = new VectorClock(Map.of("A", 2L, "B", 1L));
        var m = a.merge(b);

        assertEquals(new VectorClock(Map.of("A", 3L, "B", 1L)), m);
        assertNotEquals(CausalOrder.BEFORE, m.compare(a));
        assertNotEquals(CausalOrder.BEFORE, m.compare(b));
        assertEquals(CausalOrder.AFTER, m.compare(b));
        assertEquals(m, b.merge(a));
        assertEquals(m, m.merge(a));
    }

    @Test
    void zero_entries_are_ignored_for_equality() {
        assertEquals(VectorClock.empty(), new VectorClock(Map.of("A", 0L)));
        assertEquals(CausalOrder.EQUAL, VectorClock.empty().compare(new VectorClock(Map.of("A", 0L))));
    }
}
