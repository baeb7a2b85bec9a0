package com.crossbot.codec.tabular;

import com.crossbot.scenario.compile.CompileDiagnostic;

import java.util.List;

/**
 * CSV text of an exported scenario plus the rows the overflow policy truncated.
 */
public final class TabularExport {

    private final String csv;
    private final int rowCount;
    private final List<CompileDiagnostic> diagnostics;

    public TabularExport(String csv, int rowCount, List<CompileDiagnostic> diagnostics) {
        this.csv = csv;
        this.rowCount = rowCount;
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public String getCsv() {
        return csv;
    }

    /** Data rows written, header excluded. */
    public int getRowCount() {
        return rowCount;
    }

    public List<CompileDiagnostic> getDiagnostics() {
        return diagnostics;
    }
}
