package io.memlite.core.crdt;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ORSetTest {

    @Test
    void add_mints_increasing_tags_per_replica() {
        var first = ORSet.<String>empty().add("x", "r1");
        var second = first.set().add("y", "r1");

        assertEquals(new OrTag("r1", 1), first.tag());
        assertEquals(new OrTag("r1", 2), second.tag());
        assertEquals(Set.of("x", "y"), second.set().elements());
    }

    @Test
    void concurrent_add_survives_remove_of_previously_observed_tags() {
        var base = ORSet.<String>empty().add("urgent", "r1").set();

        // r1 removes what it saw; r2 concurrently re-adds with a fresh tag
        var removed = base.removeAll("urgent");
        var readded = base.add("urgent", "r2").set();

        assertFalse(removed.contains("urgent"));
        assertTrue(removed.merge(readded).contains("urgent"));
        assertTrue(readded.merge(removed).contains("urgent"));
    }

    @Test
    void remove_survives_merge_with_stale_copy() {
        var base = ORSet.<String>empty().add("draft", "r1").set();
        var removed = base.removeAll("draft");

        assertFalse(removed.merge(base).contains("draft"));
        assertFalse(base.merge(removed).contains("draft"));
    }

    @Test
    void remove_ignores_unknown_tags() {
        var set = ORSet.<String>empty().add("a", "r1").set();
        var same = set.remove("a", List.of(new OrTag("zz", 9)));

        assertSame(set, same);
        assertTrue(same.contains("a"));
        assertSame(set, set.remove("missing", List.of(new OrTag("r1", 1))));
    }

    @Test
    void tag_counters_are_not_reused_after_remove() {
        var set = ORSet.<String>empty().add("a", "r1").set().removeAll("a");
        var again = set.add("a", "r1");

        assertEquals(new OrTag("r1", 2), again.tag());
        assertTrue(again.set().contains("a"));
    }

    @Test
    void merge_is_commutative_associative_and_idempotent() {
        var a = ORSet.<String>empty().add("p", "r1").set().add("q", "r1").set();
        var b = ORSet.<String>empty().add("q", "r2").set().removeAll("q");
        var c = a.removeAll("p").add("s", "r3").set();

        assertEquals(a.merge(b), b.merge(a));
        assertEquals(a.merge(b).merge(c), a.merge(b.merge(c)));
        assertEquals(a, a.merge(a));
        assertEquals(Set.of("q", "s"), a.merge(b).merge(c).elements());
    }

    @Test
    void rebuilding_from_raw_state_drops_tombstones_for_unknown_tags() {
        var tag = new OrTag("r1", 1);
        var set = ORSet.of(Map.of("a", Set.of(tag)), Map.of("a", Set.of(new OrTag("r9", 4)), "b", Set.of(tag)));

        assertTrue(set.contains("a"));
        assertTrue(set.removedTags().isEmpty());
    }

    @Test
    void tag_text_form_parses_back() {
        var tag = new OrTag("node:eu", 12);
        assertEquals("node:eu:12", tag.toString());
        assertEquals(tag, OrTag.parse(tag.toString()));
        assertThrows(IllegalArgumentException.class, () -> OrTag.parse("no-counter"));
    }
}
