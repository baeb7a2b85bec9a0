package com.crossbot.scenario.compile;

import com.crossbot.scenario.tree.CompiledScenario;

import java.util.List;

/**
 * Output of {@link TreeBuilder}: the tree with references still pending, the resolution tables and
 * the diagnostics of the walk.
 */
public final class TreeBuildResult {

    private final CompiledScenario scenario;
    private final SymbolTable symbols;
    private final List<CompileDiagnostic> diagnostics;

    public TreeBuildResult(CompiledScenario scenario, SymbolTable symbols, List<CompileDiagnostic> diagnostics) {
        this.scenario = scenario;
        this.symbols = symbols;
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public CompiledScenario getScenario() {
        return scenario;
    }

    public SymbolTable getSymbols() {
        return symbols;
    }

    public List<CompileDiagnostic> getDiagnostics() {
        return diagnostics;
    }
}
