package com.crossbot.codec.editor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directed connection between editor nodes. Connections whose {@code sourceHandle} starts with
 * {@value #REPLY_HANDLE_PREFIX} draw a jump branch and do not make the target a child.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EditorConnection {

    public static final String REPLY_HANDLE_PREFIX = "reply-";

    private final String id;
    private final String sourceId;
    private final String targetId;
    private final String sourceHandle;

    @JsonCreator
    public EditorConnection(
            @JsonProperty("id") String id,
            @JsonProperty("sourceId") String sourceId,
            @JsonProperty("targetId") String targetId,
            @JsonProperty("sourceHandle") String sourceHandle) {
        this.id = id;
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.sourceHandle = sourceHandle;
    }

    public String getId() {
        return id;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getSourceHandle() {
        return sourceHandle;
    }

    @JsonIgnore
    public boolean isJumpDrawing() {
        return sourceHandle != null && sourceHandle.startsWith(REPLY_HANDLE_PREFIX);
    }
}
