package com.tinypy.debug;

/** Severity of a debug record, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel other) {
        return ordinal() >= other.ordinal();
    }

    /** Parses a level name case-insensitively; unknown or empty names fall back to {@code fallback}. */
    public static DebugLevel parse(String name, DebugLevel fallback) {
        if (name == null || name.isBlank()) return fallback;
        for (DebugLevel l : values()) {
            if (l.name().equalsIgnoreCase(name.trim())) return l;
        }
        return fallback;
    }
}
