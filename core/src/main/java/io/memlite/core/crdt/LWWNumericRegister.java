package io.memlite.core.crdt;

import java.util.Objects;

/**
 * Last-writer-wins register over a {@code double}, used for scores such as
 * importance and confidence. Same ordering as {@link LWWRegister}; on an identical
 * (timestamp, writer) pair the larger value wins.
 */
public final class LWWNumericRegister implements Mergeable<LWWNumericRegister> {

    private final double value;
    private final long timestamp;
    private final String writer;

    public LWWNumericRegister(double value, long timestamp, String writer) {
        this.value = value;
        this.timestamp = timestamp;
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /** Register holding {@code initial}, stamped at timestamp 0 so any real write beats it. */
    public static LWWNumericRegister initial(double initial) {
        return new LWWNumericRegister(initial, 0L, "");
    }

    public LWWNumericRegister set(double value, long timestamp, String writer) {
        var incoming = new LWWNumericRegister(value, timestamp, writer);
        return incoming.dominates(this) ? incoming : this;
    }

    public double value() { return value; }

    public long timestamp() { return timestamp; }

    public String writer() { return writer; }

    @Override
    public LWWNumericRegister merge(LWWNumericRegister other) {
        return other.dominates(this) ? other : this;
    }

    private boolean dominates(LWWNumericRegister other) {
        if (timestamp != other.timestamp) return timestamp > other.timestamp;
        int w = writer.compareTo(other.writer);
        if (w != 0) return w > 0;
        return Double.compare(value, other.value) > 0;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LWWNumericRegister r)) return false;
        return timestamp == r.timestamp && writer.equals(r.writer) && Double.compare(value, r.value) == 0;
    }

    @Override public int hashCode() { return Objects.hash(value, timestamp, writer); }

    @Override public String toString() {
        return "LWWNumericRegister(value=" + value + ", ts=" + timestamp + ", writer=" + writer + ")";
    }
}
