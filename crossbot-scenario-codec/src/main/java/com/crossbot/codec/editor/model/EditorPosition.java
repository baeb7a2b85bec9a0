package com.crossbot.codec.editor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Canvas position of an editor node. Both coordinates are required on import. */
public final class EditorPosition {

    private final Double x;
    private final Double y;

    @JsonCreator
    public EditorPosition(
            @JsonProperty("x") Double x,
            @JsonProperty("y") Double y) {
        this.x = x;
        this.y = y;
    }

    public Double getX() {
        return x;
    }

    public Double getY() {
        return y;
    }
}
