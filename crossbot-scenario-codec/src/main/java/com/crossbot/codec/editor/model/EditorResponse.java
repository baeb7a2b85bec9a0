package com.crossbot.codec.editor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One message entry: {@code text} with plain content, or {@code image} with {@code imageUrl}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EditorResponse {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_IMAGE = "image";

    private final String id;
    private final String type;
    private final String content;
    private final String imageUrl;

    @JsonCreator
    public EditorResponse(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("content") String content,
            @JsonProperty("imageUrl") String imageUrl) {
        this.id = id;
        this.type = type != null ? type : TYPE_TEXT;
        this.content = content != null ? content : "";
        this.imageUrl = imageUrl;
    }

    public static EditorResponse text(String id, String content) {
        return new EditorResponse(id, TYPE_TEXT, content, null);
    }

    public static EditorResponse image(String id, String url) {
        return new EditorResponse(id, TYPE_IMAGE, "", url);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getContent() {
        return content;
    }

    public String getImageUrl() {
        return imageUrl;
    }
}
