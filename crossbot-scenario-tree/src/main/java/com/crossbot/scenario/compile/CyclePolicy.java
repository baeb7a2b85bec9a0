package com.crossbot.scenario.compile;

/**
 * What the tree builder does when a walk reaches an already visited cell. Either way the edge is cut,
 * so the result is always a finite forest.
 */
public enum CyclePolicy {
    /** Cut silently (logged at DEBUG). */
    SKIP,
    /** Cut and record a {@link DiagnosticKind#CYCLE} or {@link DiagnosticKind#SHARED_TARGET} diagnostic. */
    REPORT;

    public static CyclePolicy fromValue(String value, CyclePolicy defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        for (CyclePolicy p : values()) {
            if (p.name().equalsIgnoreCase(value.trim())) return p;
        }
        return defaultValue;
    }
}
