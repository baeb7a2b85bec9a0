package com.crossbot.scenario;

import com.crossbot.scenario.action.CsvConfig;
import com.crossbot.scenario.action.HandoverConfig;
import com.crossbot.scenario.compile.CompilationResult;
import com.crossbot.scenario.compile.ScenarioCompiler;
import com.crossbot.scenario.tree.CompiledScenario;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScenarioJsonTest {

    private static final String GRAPH = """
            { "cells": [
              { "id": "s", "type": "devs.Model", "nodeType": "dialogue.start", "state": { "next_node": "h" } },
              { "id": "h", "type": "devs.Model", "nodeType": "system.rtchat", "state": { "next_node_in": "c" } },
              { "id": "c", "type": "devs.Model", "nodeType": "system.csv",
                "state": { "file_name": "out.csv", "csv_items": [ { "csv_title": "Name", "csv_type": "text" } ] } },
              { "id": "l", "type": "devs.Link", "source": { "id": "h" }, "target": { "id": "c" } }
            ] }
            """;

    @Test
    void definitionSurvivesJson() {
        CompilationResult compiled = ScenarioCompiler.withDefaults().compileGraph(GRAPH);
        ScenarioDefinition definition = new ScenarioDefinition("def-1", "Support", 1, SourceFormat.GRAPH, GRAPH,
                compiled.getScenario(), compiled.getDiagnostics());

        String json = ScenarioJson.toJson(definition);
        assertTrue(json.contains("\"kind\":\"HANDOVER\""));
        assertFalse(json.contains("\"onReject\""));

        ScenarioDefinition back = ScenarioJson.definitionFromJson(json);
        assertEquals("def-1", back.getId());
        assertEquals(SourceFormat.GRAPH, back.getSourceFormat());
        assertEquals(GRAPH, back.getSourcePayload());
        assertEquals(compiled.getScenario(), back.getScenario());
        assertInstanceOf(HandoverConfig.class, back.getScenario().findNode(0).orElseThrow().getActionConfig());
        assertInstanceOf(CsvConfig.class, back.getScenario().findNode(1).orElseThrow().getActionConfig());
    }

    @Test
    void recompiledBumpsVersionAndKeepsId() {
        ScenarioDefinition definition = new ScenarioDefinition("def-1", "Support", 1, SourceFormat.GRAPH, GRAPH,
                CompiledScenario.empty(), List.of());
        ScenarioDefinition next = definition.recompiled(null, SourceFormat.EDITOR, "{}", CompiledScenario.empty(), List.of());
        assertEquals("def-1", next.getId());
        assertEquals("Support", next.getName());
        assertEquals(2, next.getVersion());
        assertEquals(SourceFormat.EDITOR, next.getSourceFormat());
    }

    @Test
    void compiledTreeJson() {
        CompiledScenario scenario = ScenarioCompiler.withDefaults().compileGraph(GRAPH).getScenario();
        assertEquals(scenario, ScenarioJson.scenarioFromJson(ScenarioJson.toJsonPretty(scenario)));
    }
}
