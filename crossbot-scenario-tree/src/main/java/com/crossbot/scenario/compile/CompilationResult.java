package com.crossbot.scenario.compile;

import com.crossbot.scenario.tree.CompiledScenario;

import java.util.List;

/**
 * Compiled scenario plus the non-fatal diagnostics collected on the way.
 */
public final class CompilationResult {

    private final CompiledScenario scenario;
    private final List<CompileDiagnostic> diagnostics;

    public CompilationResult(CompiledScenario scenario, List<CompileDiagnostic> diagnostics) {
        this.scenario = scenario;
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public CompiledScenario getScenario() {
        return scenario;
    }

    public List<CompileDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<String> getErrors() {
        return diagnostics.stream().map(CompileDiagnostic::getMessage).toList();
    }

    public boolean hasDiagnostic(DiagnosticKind kind) {
        return diagnostics.stream().anyMatch(d -> d.getKind() == kind);
    }
}
