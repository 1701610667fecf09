package io.memlite.core.crdt;

/**
 * State-based CRDT capability.
 * <p>
 * {@link #merge(Object)} must be a join over a semilattice:
 *  - commutative: a.merge(b) equals b.merge(a),
 *  - associative: a.merge(b).merge(c) equals a.merge(b.merge(c)),
 *  - idempotent:  a.merge(a) equals a.
 * <p>
 * Merge is pure: neither input is modified, and it never throws for two
 * well-formed values of the same type.
 *
 * @param <T> the concrete CRDT type
 */
public interface Mergeable<T> {

    /** Return the least upper bound of this value and {@code other}. */
    T merge(T other);
}
