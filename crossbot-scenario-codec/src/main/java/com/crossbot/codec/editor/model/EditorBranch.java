package com.crossbot.codec.editor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reply branch of an editor node: {@code button}, {@code link} (with {@code url}) or {@code jump}
 * (with {@code targetNodeName}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EditorBranch {

    public static final String TYPE_BUTTON = "button";
    public static final String TYPE_LINK = "link";
    public static final String TYPE_JUMP = "jump";

    private final String id;
    private final String type;
    private final String label;
    private final String url;
    private final String targetNodeName;

    @JsonCreator
    public EditorBranch(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("label") String label,
            @JsonProperty("url") String url,
            @JsonProperty("targetNodeName") String targetNodeName) {
        this.id = id;
        this.type = type != null ? type : TYPE_BUTTON;
        this.label = label != null ? label : "";
        this.url = url;
        this.targetNodeName = targetNodeName;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getLabel() {
        return label;
    }

    public String getUrl() {
        return url;
    }

    public String getTargetNodeName() {
        return targetNodeName;
    }
}
