package io.memlite.core.crdt;

import java.util.Objects;

/**
 * Unique add-tag of an {@link ORSet}: the replica that performed the add and
 * that replica's add counter within the set.
 */
public record OrTag(String replicaId, long counter) implements Comparable<OrTag> {

    public OrTag {
        Objects.requireNonNull(replicaId, "replicaId");
    }

    /** Parse the {@code replica:counter} form produced by {@link #toString()}. */
    public static OrTag parse(String text) {
        int idx = text.lastIndexOf(':');
        if (idx <= 0 || idx == text.length() - 1) {
            throw new IllegalArgumentException("Malformed tag: " + text);
        }
        try {
            return new OrTag(text.substring(0, idx), Long.parseLong(text.substring(idx + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed tag: " + text, e);
        }
    }

    @Override
    public int compareTo(OrTag o) {
        int c = replicaId.compareTo(o.replicaId);
        return c != 0 ? c : Long.compare(counter, o.counter);
    }

    @Override
    public String toString() {
        return replicaId + ":" + counter;
    }
}
