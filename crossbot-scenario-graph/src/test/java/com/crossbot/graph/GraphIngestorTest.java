package com.crossbot.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphIngestorTest {

    private static final String SAMPLE = """
            {
              "cells": [
                { "id": "s", "type": "devs.Model", "nodeType": "dialogue.start", "state": { "next_node": "a" } },
                { "id": "a", "type": "devs.Model", "nodeType": "dialogue.response", "z": 3, "embeds": ["j1"],
                  "state": {
                    "node_name": { "checked": true, "name": "Welcome" },
                    "response_advance": [
                      { "response_text": "<p>Hello</p>", "response_type": "web_text",
                        "replies": [ { "id": "r1", "reply_value": "Prices", "reply_type": "button" } ] }
                    ],
                    "cv_point": { "ignored": true }
                  } },
                { "id": "j1", "type": "devs.Model", "nodeType": "dialogue.joint", "parent": "a",
                  "state": { "condition_type": "button", "condition_value": "Prices" } },
                { "id": "l1", "type": "devs.Link", "source": { "id": "a", "port": "out" }, "target": { "id": "j1" } },
                { "id": "x", "type": "basic.Rect" }
              ]
            }
            """;

    @Test
    void ingestSplitsNodesAndLinks() {
        IngestedGraph graph = GraphIngestor.ingest(SAMPLE);

        assertEquals(3, graph.getNodes().size());
        assertEquals(1, graph.getLinks().size());
        assertEquals(1, graph.getMessages().size());
        assertTrue(graph.getMessages().get(0).contains("x"));

        RawNodeCell a = graph.findNode("a").orElseThrow();
        assertEquals("dialogue.response", a.getNodeType());
        assertEquals(3, a.getZ());
        assertEquals(List.of("j1"), a.getEmbeds());
        assertEquals("Welcome", a.getState().nodeNameValue());
        assertEquals("Prices", a.getState().getResponseAdvance().get(0).getReplies().get(0).getReplyValue());

        RawLinkCell link = graph.getLinks().get(0);
        assertEquals("a", link.getSourceId());
        assertEquals("out", link.getSourcePort());
        assertEquals("j1", link.getTargetId());

        assertEquals(1, graph.startNodes().size());
        assertEquals("a", graph.startNodes().get(0).getState().getNextNode());
    }

    @Test
    void nodeWithoutStateGetsEmptyState() {
        IngestedGraph graph = GraphIngestor.ingest("""
                { "cells": [ { "id": "n", "type": "devs.Model", "nodeType": "system.mail" } ] }
                """);
        RawNodeCell n = graph.getNodes().get(0);
        assertTrue(n.getState().getResponseAdvance().isEmpty());
        assertEquals(0, n.getZ());
        assertFalse(n.isStart());
    }

    @Test
    void invalidJsonIsFormatError() {
        assertThrows(ScenarioFormatException.class, () -> GraphIngestor.ingest("{ not json"));
    }

    @Test
    void missingCellsIsFormatError() {
        ScenarioFormatException e = assertThrows(ScenarioFormatException.class,
                () -> GraphIngestor.ingest("{ \"nodes\": [] }"));
        assertTrue(e.getMessage().contains("cells"));
    }

    @Test
    void cellWithoutIdIsFormatError() {
        assertThrows(ScenarioFormatException.class,
                () -> GraphIngestor.ingest("{ \"cells\": [ { \"type\": \"devs.Model\", \"nodeType\": \"dialogue.start\" } ] }"));
    }

    @Test
    void nodeWithoutNodeTypeIsFormatError() {
        assertThrows(ScenarioFormatException.class,
                () -> GraphIngestor.ingest("{ \"cells\": [ { \"id\": \"a\", \"type\": \"devs.Model\" } ] }"));
    }

    @Test
    void linkWithoutTargetIsFormatError() {
        assertThrows(ScenarioFormatException.class,
                () -> GraphIngestor.ingest("{ \"cells\": [ { \"id\": \"l\", \"type\": \"devs.Link\", \"source\": { \"id\": \"a\" } } ] }"));
    }

    @Test
    void duplicateIdIsFormatError() {
        assertThrows(ScenarioFormatException.class, () -> GraphIngestor.ingest("""
                { "cells": [
                  { "id": "a", "type": "devs.Model", "nodeType": "dialogue.response" },
                  { "id": "a", "type": "devs.Model", "nodeType": "dialogue.response" }
                ] }
                """));
    }

    @Test
    void linkResolverKeepsDocumentOrderAndDropsRepeats() {
        Map<String, List<String>> map = LinkResolver.resolve(List.of(
                new RawLinkCell("1", "a", null, "c", null),
                new RawLinkCell("2", "a", null, "b", null),
                new RawLinkCell("3", "a", null, "c", null),
                new RawLinkCell("4", "b", null, "d", null)));

        assertEquals(List.of("c", "b"), map.get("a"));
        assertEquals(List.of("d"), map.get("b"));
        assertTrue(LinkResolver.resolve(List.of()).isEmpty());
    }
}
