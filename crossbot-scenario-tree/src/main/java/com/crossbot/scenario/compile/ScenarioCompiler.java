package com.crossbot.scenario.compile;

import com.crossbot.graph.GraphIngestor;
import com.crossbot.graph.IngestedGraph;
import com.crossbot.scenario.tree.CompiledScenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Graph document → compiled scenario: ingest, build the tree, resolve symbols.
 * Stateless apart from its configuration; safe to share between threads.
 */
public final class ScenarioCompiler {

    private static final Logger log = LoggerFactory.getLogger(ScenarioCompiler.class);

    private final ClassifierVocabulary vocabulary;
    private final TreeBuilder treeBuilder;
    private final SymbolResolver symbolResolver;

    public ScenarioCompiler(ClassifierVocabulary vocabulary, CyclePolicy cyclePolicy) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.treeBuilder = new TreeBuilder(new NodeClassifier(vocabulary), cyclePolicy);
        this.symbolResolver = new SymbolResolver(vocabulary.getRestartSentinel());
    }

    public static ScenarioCompiler withDefaults() {
        return new ScenarioCompiler(ClassifierVocabulary.defaults(), CyclePolicy.SKIP);
    }

    public ClassifierVocabulary getVocabulary() {
        return vocabulary;
    }

    public SymbolResolver getSymbolResolver() {
        return symbolResolver;
    }

    /**
     * Compiles a graph document.
     *
     * @throws com.crossbot.graph.ScenarioFormatException when the document is malformed
     * @throws ScenarioCompileException                   when no tree can be built
     */
    public CompilationResult compileGraph(String json) {
        IngestedGraph graph = GraphIngestor.ingest(json);
        TreeBuildResult built = treeBuilder.build(graph);
        SymbolResolver.Resolution resolution = symbolResolver.resolve(built.getScenario(), built.getSymbols());
        List<CompileDiagnostic> diagnostics = new ArrayList<>(built.getDiagnostics());
        diagnostics.addAll(resolution.getDiagnostics());
        if (log.isInfoEnabled()) {
            log.info("Compiled graph scenario | nodes={} | diagnostics={}", resolution.getScenario().size(), diagnostics.size());
        }
        return new CompilationResult(resolution.getScenario(), diagnostics);
    }

    /**
     * Resolves the pending references of a tree produced by a codec, using the names and external ids
     * the tree itself carries.
     */
    public CompilationResult link(CompiledScenario scenario, List<CompileDiagnostic> priorDiagnostics) {
        SymbolResolver.Resolution resolution = symbolResolver.resolve(scenario, SymbolTable.fromScenario(scenario));
        List<CompileDiagnostic> diagnostics = new ArrayList<>(priorDiagnostics != null ? priorDiagnostics : List.of());
        diagnostics.addAll(resolution.getDiagnostics());
        return new CompilationResult(resolution.getScenario(), diagnostics);
    }
}
