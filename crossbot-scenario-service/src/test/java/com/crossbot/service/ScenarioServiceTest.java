package com.crossbot.service;

import com.crossbot.codec.tabular.TabularCodec;
import com.crossbot.runtime.ActionOutcome;
import com.crossbot.runtime.NodeNotFoundException;
import com.crossbot.runtime.ReplyOption;
import com.crossbot.runtime.RuntimeTraversal;
import com.crossbot.runtime.ScenarioReply;
import com.crossbot.runtime.Selection;
import com.crossbot.scenario.ScenarioDefinition;
import com.crossbot.scenario.SourceFormat;
import com.crossbot.scenario.action.ActionConfig;
import com.crossbot.scenario.action.MailConfig;
import com.crossbot.scenario.compile.ScenarioCompiler;
import com.crossbot.scenario.store.InMemoryScenarioStore;
import com.crossbot.scenario.tree.CompiledNode;
import com.crossbot.scenario.tree.ScenarioAction;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScenarioServiceTest {

    private static final String START_A_B = """
            { "cells": [
              { "id": "start", "type": "devs.Model", "nodeType": "dialogue.start", "state": { "next_node": "a" } },
              { "id": "a", "type": "devs.Model", "nodeType": "dialogue.response", "z": 0,
                "state": { "node_name": { "name": "A" }, "response_text": "text of A" } },
              { "id": "b", "type": "devs.Model", "nodeType": "dialogue.response", "z": 0,
                "state": { "node_name": { "name": "B" }, "response_text": "text of B" } },
              { "id": "l1", "type": "devs.Link", "source": { "id": "a" }, "target": { "id": "b" } }
            ] }
            """;

    private static final String HANDOVER_MENU = """
            { "cells": [
              { "id": "start", "type": "devs.Model", "nodeType": "dialogue.start", "state": { "next_node": "menu" } },
              { "id": "menu", "type": "devs.Model", "nodeType": "dialogue.response", "z": 0, "embeds": ["j1", "j2"],
                "state": { "node_name": { "name": "Menu" }, "response_text": "How can we help?" } },
              { "id": "j1", "type": "devs.Model", "nodeType": "dialogue.joint", "z": 1,
                "state": { "condition_type": "button", "condition_value": "オペレーターと話す" } },
              { "id": "j2", "type": "devs.Model", "nodeType": "dialogue.joint", "z": 2,
                "state": { "condition_type": "button", "condition_value": "FAQ" } }
            ] }
            """;

    private static final String MAIL_FLOW = """
            { "cells": [
              { "id": "start", "type": "devs.Model", "nodeType": "dialogue.start", "state": { "next_node": "mail" } },
              { "id": "mail", "type": "devs.Model", "nodeType": "system.mail",
                "state": { "to": "support@example.com", "title": "Missed chat", "content": "No operator", "next_node": "bye" } },
              { "id": "bye", "type": "devs.Model", "nodeType": "dialogue.response",
                "state": { "node_name": { "name": "Bye" }, "response_text": "We will mail you" } }
            ] }
            """;

    private static final String FAQ_CSV = """
            Level1,Level2,Level3,Level4,Level5,Level6,Level7,Level8,Level9,Level10,TransitionCount
            FAQ,Pricing,,,,,,,,,
            FAQ,Contact[handover],,,,,,,,,
            """;

    private static final String EDITOR_DOC = """
            {"nodes":[{"id":"hello","type":"message","position":{"x":100,"y":100},"data":{"label":"Hello","content":"Hi there"}}],"connections":[]}
            """;

    private InMemoryScenarioStore store;
    private SimpleMeterRegistry registry;
    private List<String> handovers;
    private List<ActionConfig> notifications;
    private ScenarioService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryScenarioStore();
        registry = new SimpleMeterRegistry();
        handovers = new ArrayList<>();
        notifications = new ArrayList<>();
        service = new ScenarioService(
                store,
                ScenarioCompiler.withDefaults(),
                TabularCodec.withDefaults(),
                RuntimeTraversal.withDefaults(),
                (sessionId, definitionId, nodeId) -> handovers.add(sessionId + "@" + nodeId),
                (definitionId, sessionId, action, config) -> notifications.add(config),
                new ScenarioMetrics(registry));
    }

    private CompiledNode nodeByExternalId(String definitionId, String externalId) {
        return service.findDefinition(definitionId).orElseThrow().getScenario().findByExternalId(externalId).orElseThrow();
    }

    @Test
    void importedGraphAnswersSelections() {
        ImportResult result = service.importGraph("a-b", START_A_B);

        assertTrue(result.isStored());
        assertEquals(2, result.getCompiledNodeCount());
        assertEquals(1, result.getVersion());
        assertTrue(result.getErrors().isEmpty());

        ScenarioReply start = service.initialOptions(result.getDefinitionId());
        assertEquals("text of A", start.getMessages().get(0).getContent());
        assertEquals(List.of(ReplyOption.button(1, "B")), start.getOptions());

        ScenarioReply b = service.select(result.getDefinitionId(), "s1", "1");
        assertEquals("text of B", b.getMessages().get(0).getContent());
        assertEquals(ReplyOption.Kind.RESTART, b.getOptions().get(0).getKind());
        assertEquals(0, service.select(result.getDefinitionId(), "s1", "START").getNodeId());
        assertEquals(2.0, registry.counter("crossbot.runtime.selections", "action", "none").count());
    }

    @Test
    void handoverReplyMarksSessionAwaitingHuman() {
        String id = service.importGraph("menu", HANDOVER_MENU).getDefinitionId();
        int operator = nodeByExternalId(id, "j1").getId();

        ScenarioReply reply = service.select(id, "s7", Selection.node(operator));

        assertTrue(reply.isHandover());
        assertEquals(List.of("s7@" + operator), handovers);
        assertTrue(notifications.isEmpty());
        assertEquals(1.0, registry.counter("crossbot.runtime.side_effects", "type", "handover").count());
    }

    @Test
    void mailNodeTriggersNotificationWithItsConfig() {
        String id = service.importGraph("mail", MAIL_FLOW).getDefinitionId();
        int mail = nodeByExternalId(id, "mail").getId();

        ScenarioReply reply = service.select(id, "s2", Selection.node(mail));

        assertEquals(ScenarioAction.MAIL, reply.getAction());
        assertEquals(1, notifications.size());
        MailConfig config = assertInstanceOf(MailConfig.class, notifications.get(0));
        assertEquals("support@example.com", config.getTo());
        assertTrue(handovers.isEmpty());

        ScenarioReply after = service.continueAfter(id, "s2", mail, ActionOutcome.SUCCEEDED);
        assertEquals("We will mail you", after.getMessages().get(0).getContent());
        assertEquals(1, notifications.size());
    }

    @Test
    void fatalErrorsStoreNothing() {
        ImportResult badGraph = service.importGraph("broken", "{not json");
        ImportResult badCsv = service.importTabular("broken", "Question,Answer\nA,B\n");
        ImportResult badEditor = service.importEditor("broken", "{\"nodes\":[{\"id\":\"a\"}],\"connections\":[]}");

        for (ImportResult r : List.of(badGraph, badCsv, badEditor)) {
            assertFalse(r.isStored());
            assertNull(r.getDefinitionId());
            assertEquals(0, r.getCompiledNodeCount());
            assertEquals(1, r.getErrors().size());
        }
        assertTrue(store.listIds().isEmpty());
        assertEquals(1.0, registry.counter("crossbot.scenario.imports", "format", "graph", "outcome", "failed").count());
    }

    @Test
    void recompileKeepsIdAndBumpsVersion() {
        ImportResult first = service.importTabular("faq", FAQ_CSV);
        assertEquals(3, first.getCompiledNodeCount());

        ImportResult second = service.recompile(first.getDefinitionId(), SourceFormat.TABULAR,
                FAQ_CSV + "FAQ,Refunds,,,,,,,,,\n");

        assertEquals(first.getDefinitionId(), second.getDefinitionId());
        assertEquals(2, second.getVersion());
        assertEquals(4, second.getCompiledNodeCount());
        assertEquals(List.of(first.getDefinitionId()), store.listIds());

        ImportResult failed = service.recompile(first.getDefinitionId(), SourceFormat.GRAPH, "[]");
        assertFalse(failed.isStored());
        ScenarioDefinition kept = service.findDefinition(first.getDefinitionId()).orElseThrow();
        assertEquals(2, kept.getVersion());
        assertEquals(SourceFormat.TABULAR, kept.getSourceFormat());
    }

    @Test
    void unknownDefinitionIsReported() {
        DefinitionNotFoundException e = assertThrows(DefinitionNotFoundException.class,
                () -> service.initialOptions("missing"));
        assertEquals("missing", e.getDefinitionId());
        assertThrows(DefinitionNotFoundException.class, () -> service.recompile("missing", SourceFormat.GRAPH, START_A_B));
        assertThrows(DefinitionNotFoundException.class, () -> service.exportTabular("missing"));
    }

    @Test
    void unknownNodeIsNotFound() {
        String id = service.importGraph("a-b", START_A_B).getDefinitionId();
        assertThrows(NodeNotFoundException.class, () -> service.select(id, "s1", Selection.node(99)));
    }

    @Test
    void editorImportExportsItsOwnDocument() {
        String id = service.importEditor("editor", EDITOR_DOC).getDefinitionId();

        assertEquals(EDITOR_DOC, service.exportEditor(id));
        assertEquals("Hi there", service.initialOptions(id).getMessages().get(0).getContent());
    }

    @Test
    void otherFormatsExportThroughTheCodecs() {
        String id = service.importGraph("a-b", START_A_B).getDefinitionId();

        String csv = service.exportTabular(id);
        assertTrue(csv.contains("\"A\",\"B\""));

        String editor = service.exportEditor(id);
        assertTrue(editor.contains("\"nodes\""));
        assertTrue(editor.contains("\"connections\""));

        String compiled = service.exportCompiled(id);
        assertTrue(compiled.contains("\"rootIds\""));
    }

    @Test
    void deleteRemovesDefinition() {
        String id = service.importGraph("a-b", START_A_B).getDefinitionId();
        assertEquals(List.of(id), service.listDefinitionIds());

        assertTrue(service.deleteDefinition(id));
        assertFalse(service.deleteDefinition(id));
        assertTrue(service.findDefinition(id).isEmpty());
    }
}
