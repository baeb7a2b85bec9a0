package com.crossbot.service;

import com.crossbot.codec.editor.EditorCodec;
import com.crossbot.codec.tabular.TabularCodec;
import com.crossbot.graph.ScenarioFormatException;
import com.crossbot.runtime.ActionOutcome;
import com.crossbot.runtime.RuntimeTraversal;
import com.crossbot.runtime.ScenarioReply;
import com.crossbot.runtime.Selection;
import com.crossbot.scenario.ScenarioDefinition;
import com.crossbot.scenario.ScenarioJson;
import com.crossbot.scenario.SourceFormat;
import com.crossbot.scenario.compile.CompilationResult;
import com.crossbot.scenario.compile.ScenarioCompileException;
import com.crossbot.scenario.compile.ScenarioCompiler;
import com.crossbot.scenario.store.ScenarioStore;
import com.crossbot.scenario.tree.ScenarioAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry points of the scenario engine: import and recompile of the three authoring formats, export,
 * and runtime replies with their side effects (hand-off to a human, outbound notifications).
 * <p>
 * Compilation failures never leave a partial definition in the store: a fatal error comes back as an
 * {@link ImportResult} with zero nodes. Non-fatal diagnostics are stored with the definition.
 */
public final class ScenarioService {

    private static final Logger log = LoggerFactory.getLogger(ScenarioService.class);

    private final ScenarioStore store;
    private final ScenarioCompiler compiler;
    private final TabularCodec tabularCodec;
    private final EditorCodec editorCodec;
    private final RuntimeTraversal traversal;
    private final SessionStateSetter sessionStateSetter;
    private final NotificationTrigger notificationTrigger;
    private final ScenarioMetrics metrics;

    public ScenarioService(
            ScenarioStore store,
            ScenarioCompiler compiler,
            TabularCodec tabularCodec,
            RuntimeTraversal traversal,
            SessionStateSetter sessionStateSetter,
            NotificationTrigger notificationTrigger,
            ScenarioMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.tabularCodec = Objects.requireNonNull(tabularCodec, "tabularCodec");
        this.editorCodec = new EditorCodec(compiler);
        this.traversal = Objects.requireNonNull(traversal, "traversal");
        this.sessionStateSetter = Objects.requireNonNull(sessionStateSetter, "sessionStateSetter");
        this.notificationTrigger = Objects.requireNonNull(notificationTrigger, "notificationTrigger");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public ImportResult importGraph(String name, String json) {
        return importDefinition(name, SourceFormat.GRAPH, json);
    }

    public ImportResult importTabular(String name, String csv) {
        return importDefinition(name, SourceFormat.TABULAR, csv);
    }

    public ImportResult importEditor(String name, String json) {
        return importDefinition(name, SourceFormat.EDITOR, json);
    }

    /**
     * Replaces a stored definition with a fresh compilation of {@code payload}, keeping its id and
     * bumping its version. On a fatal error the stored definition is left as it was.
     *
     * @throws DefinitionNotFoundException when the id is unknown
     */
    public ImportResult recompile(String definitionId, SourceFormat format, String payload) {
        ScenarioDefinition current = require(definitionId);
        CompilationResult result;
        try {
            result = compile(format, payload);
        } catch (ScenarioFormatException | ScenarioCompileException e) {
            return failed(format, current.getName(), e);
        }
        ScenarioDefinition replacement = current.recompiled(null, format, payload, result.getScenario(),
                result.getDiagnostics());
        return stored(replacement, result);
    }

    public Optional<ScenarioDefinition> findDefinition(String definitionId) {
        return store.find(definitionId);
    }

    public List<String> listDefinitionIds() {
        return store.listIds();
    }

    public boolean deleteDefinition(String definitionId) {
        boolean deleted = store.delete(definitionId);
        if (deleted) log.info("ScenarioService | deleted | definitionId={}", definitionId);
        return deleted;
    }

    /**
     * @throws com.crossbot.codec.tabular.TabularDepthException when a path is too deep and the overflow
     *                                                          policy rejects it
     */
    public String exportTabular(String definitionId) {
        return tabularCodec.exportCsv(require(definitionId).getScenario());
    }

    /** Editor-imported definitions return the stored document unchanged. */
    public String exportEditor(String definitionId) {
        ScenarioDefinition definition = require(definitionId);
        if (definition.getSourceFormat() == SourceFormat.EDITOR && definition.getSourcePayload() != null) {
            return definition.getSourcePayload();
        }
        return editorCodec.exportDocument(definition.getScenario());
    }

    public String exportCompiled(String definitionId) {
        return ScenarioJson.toJsonPretty(require(definitionId).getScenario());
    }

    public ScenarioReply initialOptions(String definitionId) {
        return traversal.initialOptions(require(definitionId).getScenario());
    }

    /**
     * @throws com.crossbot.runtime.NodeNotFoundException when the selection names an unknown node
     */
    public ScenarioReply select(String definitionId, String sessionId, Selection selection) {
        ScenarioReply reply = traversal.select(require(definitionId).getScenario(), selection);
        return dispatch(definitionId, sessionId, reply);
    }

    /** Selection given as a raw token: the restart sentinel or a compiled id. */
    public ScenarioReply select(String definitionId, String sessionId, String token) {
        return select(definitionId, sessionId, Selection.parse(token, compiler.getVocabulary().getRestartSentinel()));
    }

    public ScenarioReply continueAfter(String definitionId, String sessionId, int nodeId, ActionOutcome outcome) {
        ScenarioReply reply = traversal.continueAfter(require(definitionId).getScenario(), nodeId, outcome);
        return dispatch(definitionId, sessionId, reply);
    }

    private ImportResult importDefinition(String name, SourceFormat format, String payload) {
        CompilationResult result;
        try {
            result = compile(format, payload);
        } catch (ScenarioFormatException | ScenarioCompileException e) {
            return failed(format, name, e);
        }
        ScenarioDefinition definition = new ScenarioDefinition(UUID.randomUUID().toString(), name, 1, format,
                payload, result.getScenario(), result.getDiagnostics());
        return stored(definition, result);
    }

    private CompilationResult compile(SourceFormat format, String payload) {
        return switch (format) {
            case GRAPH -> compiler.compileGraph(payload);
            case TABULAR -> {
                CompilationResult imported = tabularCodec.importCsv(payload);
                yield compiler.link(imported.getScenario(), imported.getDiagnostics());
            }
            case EDITOR -> editorCodec.importDocument(payload);
        };
    }

    private ImportResult stored(ScenarioDefinition definition, CompilationResult result) {
        store.save(definition);
        metrics.recordImport(definition.getSourceFormat(), definition.getScenario().size(), result.getDiagnostics());
        if (log.isInfoEnabled()) {
            log.info("ScenarioService | stored | definitionId={} | name={} | version={} | format={} | nodes={} | diagnostics={}",
                    definition.getId(), definition.getName(), definition.getVersion(), definition.getSourceFormat(),
                    definition.getScenario().size(), result.getDiagnostics().size());
        }
        return new ImportResult(definition.getScenario().size(), result.getErrors(), definition.getId(),
                definition.getVersion());
    }

    private ImportResult failed(SourceFormat format, String name, RuntimeException e) {
        metrics.recordImportFailure(format);
        log.warn("ScenarioService | import failed | name={} | format={} | error={}", name, format, e.getMessage());
        return ImportResult.failed(e.getMessage());
    }

    private ScenarioReply dispatch(String definitionId, String sessionId, ScenarioReply reply) {
        metrics.recordSelection(reply.getAction());
        if (reply.isHandover() && reply.getNodeId() != null) {
            sessionStateSetter.markAwaitingHuman(sessionId, definitionId, reply.getNodeId());
            metrics.recordHandover();
            log.info("ScenarioService | handover | definitionId={} | sessionId={} | nodeId={}",
                    definitionId, sessionId, reply.getNodeId());
        }
        if ((reply.getAction() == ScenarioAction.MAIL || reply.getAction() == ScenarioAction.CSV)
                && reply.getActionConfig() != null) {
            notificationTrigger.trigger(definitionId, sessionId, reply.getAction(), reply.getActionConfig());
            metrics.recordNotification(reply.getAction());
            log.info("ScenarioService | notification | definitionId={} | sessionId={} | action={}",
                    definitionId, sessionId, reply.getAction());
        }
        return reply;
    }

    private ScenarioDefinition require(String definitionId) {
        return store.find(definitionId).orElseThrow(() -> new DefinitionNotFoundException(definitionId));
    }
}
