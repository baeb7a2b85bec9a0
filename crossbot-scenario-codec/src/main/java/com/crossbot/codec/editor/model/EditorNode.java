package com.crossbot.codec.editor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of the editor document. {@code type} is one of {@code message}, {@code question},
 * {@code action}, {@code condition}, {@code end}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EditorNode {

    public static final String TYPE_MESSAGE = "message";
    public static final String TYPE_QUESTION = "question";
    public static final String TYPE_ACTION = "action";
    public static final String TYPE_CONDITION = "condition";
    public static final String TYPE_END = "end";

    private final String id;
    private final String type;
    private final EditorPosition position;
    private final EditorNodeData data;
    private final EditorSettings settings;

    @JsonCreator
    public EditorNode(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("position") EditorPosition position,
            @JsonProperty("data") EditorNodeData data,
            @JsonProperty("settings") EditorSettings settings) {
        this.id = id;
        this.type = type;
        this.position = position;
        this.data = data;
        this.settings = settings;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public EditorPosition getPosition() {
        return position;
    }

    public EditorNodeData getData() {
        return data;
    }

    public EditorSettings getSettings() {
        return settings;
    }
}
