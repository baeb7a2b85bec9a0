package com.crossbot.codec.tabular;

/**
 * What the tabular export does with a path deeper than the available level columns.
 */
public enum DepthOverflowPolicy {
    /** Fail the export with {@link TabularDepthException}. */
    REJECT,
    /** Cut the path at the last level column and report the truncation. */
    TRUNCATE;

    public static DepthOverflowPolicy fromValue(String value, DepthOverflowPolicy defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        for (DepthOverflowPolicy p : values()) {
            if (p.name().equalsIgnoreCase(value.trim())) return p;
        }
        return defaultValue;
    }
}
