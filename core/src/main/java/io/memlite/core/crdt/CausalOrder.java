package io.memlite.core.crdt;

/**
 * Partial order between two vector clocks.
 * <p>
 * Interpretation for A.compare(B):
 *  - EQUAL:      A and B have identical counters.
 *  - AFTER:      A has seen at least as many events as B for every replica,
 *                and strictly more for at least one.
 *  - BEFORE:     symmetric to AFTER.
 *  - CONCURRENT: neither dominates the other.
 */
public enum CausalOrder {
    EQUAL, BEFORE, AFTER, CONCURRENT;

    /** Return the order seen from the other side of the comparison. */
    public CausalOrder swap() {
        return switch (this) {
            case BEFORE -> AFTER;
            case AFTER -> BEFORE;
            default -> this;
        };
    }
}
