package io.memlite.core.crdt;

import java.util.Objects;

/**
 * Immutable last-writer-wins register holding {@code (value, timestamp, writer)}.
 * <p>
 * Ordering of two writes:
 *  1) higher timestamp wins,
 *  2) on equal timestamps the lexicographically greater writer id wins,
 *  3) on an identical (timestamp, writer) pair the greater value wins.
 * Step 3 only matters when one writer reuses a timestamp; it keeps merge
 * order independent in that case too.
 * <p>
 * An empty register has no value, timestamp 0 and writer "".
 */
public final class LWWRegister<T extends Comparable<? super T>> implements Mergeable<LWWRegister<T>> {

    private static final LWWRegister<?> EMPTY = new LWWRegister<>(null, 0L, "");

    private final T value;
    private final long timestamp;
    private final String writer;

    public LWWRegister(T value, long timestamp, String writer) {
        this.value = value;
        this.timestamp = timestamp;
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    @SuppressWarnings("unchecked")
    public static <T extends Comparable<? super T>> LWWRegister<T> empty() { return (LWWRegister<T>) EMPTY; }

    /** Return a register holding the incoming write iff it dominates the stored one. */
    public LWWRegister<T> set(T value, long timestamp, String writer) {
        var incoming = new LWWRegister<>(value, timestamp, writer);
        return incoming.dominates(this) ? incoming : this;
    }

    public T value() { return value; }

    public long timestamp() { return timestamp; }

    public String writer() { return writer; }

    public boolean hasValue() { return value != null; }

    @Override
    public LWWRegister<T> merge(LWWRegister<T> other) {
        return other.dominates(this) ? other : this;
    }

    private boolean dominates(LWWRegister<T> other) {
        if (timestamp != other.timestamp) return timestamp > other.timestamp;
        int w = writer.compareTo(other.writer);
        if (w != 0) return w > 0;
        if (value == null || other.value == null) return value != null;
        return value.compareTo(other.value) > 0;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LWWRegister<?> r)) return false;
        return timestamp == r.timestamp && writer.equals(r.writer) && Objects.equals(value, r.value);
    }

    @Override public int hashCode() { return Objects.hash(value, timestamp, writer); }

    @Override public String toString() {
        return "LWWRegister(value=" + value + ", ts=" + timestamp + ", writer=" + writer + ")";
    }
}
