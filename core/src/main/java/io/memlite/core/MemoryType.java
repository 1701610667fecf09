package io.memlite.core;

import java.util.Locale;

/** Kind of memory an entry represents. Fixed at creation. */
public enum MemoryType {
    EPISODIC,
    SEMANTIC,
    PROCEDURAL,
    WORKING;

    /**
     * Parse a type name case-insensitively.
     * Null or blank input yields {@link #EPISODIC}; an unknown name is a validation error.
     */
    public static MemoryType parse(String name) {
        if (name == null || name.isBlank()) return EPISODIC;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown memory type: " + name);
        }
    }

    /** Lower-case wire name. */
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
