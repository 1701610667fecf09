package io.memlite.core.crdt;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LWWRegisterTest {

    @Test
    void later_timestamp_wins_regardless_of_order() {
        var older = new LWWRegister<>("old", 10, "r1");
        var newer = new LWWRegister<>("new", 12, "r2");

        assertEquals("new", older.merge(newer).value());
        assertEquals("new", newer.merge(older).value());
    }

    @Test
    void equal_timestamps_resolve_by_writer_in_both_directions() {
        var a = new LWWRegister<>("from-a", 10, "alpha");
        var b = new LWWRegister<>("from-b", 10, "beta");

        assertEquals("from-b", a.merge(b).value());
        assertEquals("from-b", b.merge(a).value());
    }

    @Test
    void identical_stamp_falls_back_to_greater_value() {
        var x = new LWWRegister<>("x", 10, "r1");
        var y = new LWWRegister<>("y", 10, "r1");

        assertEquals(x.merge(y), y.merge(x));
        assertEquals("y", x.merge(y).value());
    }

    @Test
    void set_only_overwrites_with_a_greater_stamp() {
        var reg = LWWRegister.<String>empty().set("v1", 5, "r1");

        assertEquals("v1", reg.set("stale", 4, "r9").value());
        assertEquals("v1", reg.set("lower-writer", 5, "r0").value());
        assertEquals("v2", reg.set("v2", 6, "r0").value());
    }

    @Test
    void empty_register_loses_to_any_write() {
        var empty = LWWRegister.<String>empty();
        var reg = new LWWRegister<>("a", 0, "r1");

        assertFalse(empty.hasValue());
        assertEquals("a", empty.merge(reg).value());
        assertEquals("a", reg.merge(empty).value());
    }

    @Test
    void numeric_register_follows_the_same_ordering() {
        var r1 = LWWNumericRegister.initial(0.5).set(0.9, 10, "r1");
        var r2 = LWWNumericRegister.initial(0.5).set(0.7, 12, "r2");

        assertEquals(0.7, r1.merge(r2).value());
        assertEquals(0.7, r2.merge(r1).value());

        var tieA = new LWWNumericRegister(0.2, 7, "same");
        var tieB = new LWWNumericRegister(0.4, 7, "same");
        assertEquals(tieA.merge(tieB), tieB.merge(tieA));
        assertEquals(0.4, tieA.merge(tieB).value());
    }
}
