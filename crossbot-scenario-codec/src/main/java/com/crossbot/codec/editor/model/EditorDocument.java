package com.crossbot.codec.editor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Editor document: {@code nodes} plus {@code connections}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EditorDocument {

    private final List<EditorNode> nodes;
    private final List<EditorConnection> connections;

    @JsonCreator
    public EditorDocument(
            @JsonProperty("nodes") List<EditorNode> nodes,
            @JsonProperty("connections") List<EditorConnection> connections) {
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.connections = connections != null ? List.copyOf(connections) : List.of();
    }

    public List<EditorNode> getNodes() {
        return nodes;
    }

    public List<EditorConnection> getConnections() {
        return connections;
    }
}
