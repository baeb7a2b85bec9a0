package com.crossbot.graph;

import com.crossbot.graph.state.RawNodeState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses a flow-chart graph document ({@code {"cells": [...]}}) into node cells and link cells.
 * Does not interpret node semantics. Structural problems throw {@link ScenarioFormatException};
 * cells of an unknown {@code type} are skipped, and a node whose {@code state} does not map keeps an empty state;
 * both are reported in {@link IngestedGraph#getMessages()}.
 */
public final class GraphIngestor {

    private static final Logger log = LoggerFactory.getLogger(GraphIngestor.class);

    public static final String CELL_NODE = "devs.Model";
    public static final String CELL_LINK = "devs.Link";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private GraphIngestor() {
    }

    /**
     * Parses the document.
     *
     * @param json graph document text
     * @return node and link cells in document order
     * @throws ScenarioFormatException when the JSON is invalid, the cells array is missing, or a cell lacks required fields
     */
    public static IngestedGraph ingest(String json) {
        if (json == null || json.isBlank()) {
            throw new ScenarioFormatException("Graph document is empty");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ScenarioFormatException("Invalid JSON format: " + e.getOriginalMessage(), e);
        }
        JsonNode cells = root != null ? root.get("cells") : null;
        if (cells == null || !cells.isArray()) {
            throw new ScenarioFormatException("Invalid graph format: cells array not found");
        }

        List<RawNodeCell> nodes = new ArrayList<>();
        List<RawLinkCell> links = new ArrayList<>();
        List<String> messages = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        Map<String, Integer> typeCounts = new LinkedHashMap<>();

        int index = 0;
        for (JsonNode cell : cells) {
            if (!cell.isObject()) {
                throw new ScenarioFormatException("Cell at index " + index + " is not an object");
            }
            String id = text(cell, "id");
            if (id == null) {
                throw new ScenarioFormatException("Cell at index " + index + " has no id");
            }
            if (!seenIds.add(id)) {
                throw new ScenarioFormatException("Duplicate cell id: " + id);
            }
            String type = text(cell, "type");
            if (CELL_NODE.equals(type)) {
                RawNodeCell node = toNode(id, cell, messages);
                typeCounts.merge(node.getNodeType(), 1, Integer::sum);
                nodes.add(node);
            } else if (CELL_LINK.equals(type)) {
                links.add(toLink(id, cell));
            } else {
                messages.add("Skipped cell " + id + " with unsupported type " + type);
            }
            index++;
        }

        if (log.isInfoEnabled()) {
            log.info("Graph ingested | cells={} | nodes={} | links={} | skipped={} | nodeTypes={}",
                    index, nodes.size(), links.size(), messages.size(), typeCounts);
        }
        return new IngestedGraph(nodes, links, messages);
    }

    private static RawNodeCell toNode(String id, JsonNode cell, List<String> messages) {
        String nodeType = text(cell, "nodeType");
        if (nodeType == null) {
            throw new ScenarioFormatException("Node cell " + id + " has no nodeType");
        }
        int z = cell.path("z").asInt(0);
        List<String> embeds = new ArrayList<>();
        JsonNode embedsNode = cell.get("embeds");
        if (embedsNode != null && embedsNode.isArray()) {
            for (JsonNode e : embedsNode) {
                if (e.isTextual() && !e.asText().isBlank()) embeds.add(e.asText());
            }
        }
        RawNodeState state = null;
        JsonNode stateNode = cell.get("state");
        if (stateNode != null && stateNode.isObject()) {
            try {
                state = MAPPER.treeToValue(stateNode, RawNodeState.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                // The cell is kept with an empty state and classifies to no action.
                String reason = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
                messages.add("Ignored malformed state on node cell " + id + ": " + reason);
                log.warn("Graph ingest | malformed state ignored | cellId={} | error={}", id, reason);
                state = RawNodeState.empty();
            }
        }
        return new RawNodeCell(id, nodeType, z, embeds, text(cell, "parent"), state);
    }

    private static RawLinkCell toLink(String id, JsonNode cell) {
        JsonNode source = cell.get("source");
        JsonNode target = cell.get("target");
        String sourceId = source != null ? text(source, "id") : null;
        String targetId = target != null ? text(target, "id") : null;
        if (sourceId == null || targetId == null) {
            throw new ScenarioFormatException("Link cell " + id + " is missing its source or target id");
        }
        return new RawLinkCell(id, sourceId, text(source, "port"), targetId, text(target, "port"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }
}
