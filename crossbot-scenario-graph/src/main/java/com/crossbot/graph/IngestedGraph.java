package com.crossbot.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of {@link GraphIngestor#ingest(String)}: node and link cells in document order plus
 * non-fatal validation messages (skipped cells).
 */
public final class IngestedGraph {

    private final List<RawNodeCell> nodes;
    private final List<RawLinkCell> links;
    private final List<String> messages;
    private final Map<String, RawNodeCell> nodesById;

    public IngestedGraph(List<RawNodeCell> nodes, List<RawLinkCell> links, List<String> messages) {
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.links = links != null ? List.copyOf(links) : List.of();
        this.messages = messages != null ? List.copyOf(messages) : List.of();
        Map<String, RawNodeCell> byId = new LinkedHashMap<>();
        for (RawNodeCell node : this.nodes) {
            byId.put(node.getId(), node);
        }
        this.nodesById = Collections.unmodifiableMap(byId);
    }

    public List<RawNodeCell> getNodes() {
        return nodes;
    }

    public List<RawLinkCell> getLinks() {
        return links;
    }

    public List<String> getMessages() {
        return messages;
    }

    public Optional<RawNodeCell> findNode(String id) {
        return Optional.ofNullable(id != null ? nodesById.get(id) : null);
    }

    public boolean containsNode(String id) {
        return id != null && nodesById.containsKey(id);
    }

    /** Start cells in document order (normally exactly one). */
    public List<RawNodeCell> startNodes() {
        return nodes.stream().filter(RawNodeCell::isStart).toList();
    }
}
