package com.crossbot.codec.editor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Display data of an editor node. {@code content} is the single-text form used by older editor
 * documents; it is read when {@code responses} is empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EditorNodeData {

    private final String label;
    private final List<EditorResponse> responses;
    private final List<EditorBranch> branches;
    private final String content;

    @JsonCreator
    public EditorNodeData(
            @JsonProperty("label") String label,
            @JsonProperty("responses") List<EditorResponse> responses,
            @JsonProperty("branches") List<EditorBranch> branches,
            @JsonProperty("content") String content) {
        this.label = label;
        this.responses = responses != null ? List.copyOf(responses) : List.of();
        this.branches = branches != null ? List.copyOf(branches) : List.of();
        this.content = content;
    }

    public String getLabel() {
        return label;
    }

    public List<EditorResponse> getResponses() {
        return responses;
    }

    public List<EditorBranch> getBranches() {
        return branches;
    }

    public String getContent() {
        return content;
    }
}
