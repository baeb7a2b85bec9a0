package com.crossbot.service;

import java.util.List;

/**
 * Outcome of an import or recompile. A fatal error gives zero nodes, the error message and no
 * definition id; non-fatal diagnostics come with a stored definition.
 */
public final class ImportResult {

    private final int compiledNodeCount;
    private final List<String> errors;
    private final String definitionId;
    private final int version;

    public ImportResult(int compiledNodeCount, List<String> errors, String definitionId, int version) {
        this.compiledNodeCount = compiledNodeCount;
        this.errors = errors != null ? List.copyOf(errors) : List.of();
        this.definitionId = definitionId;
        this.version = version;
    }

    static ImportResult failed(String message) {
        return new ImportResult(0, List.of(message != null ? message : "Import failed"), null, 0);
    }

    public int getCompiledNodeCount() {
        return compiledNodeCount;
    }

    public List<String> getErrors() {
        return errors;
    }

    /** Null when nothing was stored. */
    public String getDefinitionId() {
        return definitionId;
    }

    public int getVersion() {
        return version;
    }

    public boolean isStored() {
        return definitionId != null;
    }

    @Override
    public String toString() {
        return "ImportResult{nodes=" + compiledNodeCount + ", errors=" + errors.size()
                + ", definitionId=" + definitionId + ", version=" + version + "}";
    }
}
