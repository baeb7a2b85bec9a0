package com.crossbot.scenario.compile;

/** Category of a non-fatal compile diagnostic. */
public enum DiagnosticKind {
    /** A jump, continuation or reply target did not match any node. */
    UNRESOLVED_SYMBOL,
    /** An edge points to a cell id that is not in the document. */
    MISSING_CELL,
    /** An edge leads back to an ancestor; the edge was cut. */
    CYCLE,
    /** A cell was reached a second time through another branch; it stays under its first parent. */
    SHARED_TARGET,
    /** Two nodes carry the same name; the first one keeps it. */
    DUPLICATE_NAME,
    DUPLICATE_START,
    /** Editor connection that references an unknown node, closes a cycle or adds a second parent. */
    INVALID_CONNECTION,
    /** Cell of an unsupported type was skipped during ingestion. */
    SKIPPED_CELL,
    /** Tabular export row cut at the column limit. */
    TRUNCATED_ROW
}
