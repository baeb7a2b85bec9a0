package com.crossbot.scenario;

/** Authoring format a scenario definition was imported from. */
public enum SourceFormat {
    /** Flow-chart graph document ({@code cells}). */
    GRAPH,
    /** Spreadsheet rows (Level1..Level10). */
    TABULAR,
    /** Editor document ({@code nodes} + {@code connections}). */
    EDITOR
}
