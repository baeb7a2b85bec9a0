package com.crossbot.graph.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Author-assigned node name; used as a jump target. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RawNodeName {

    private final boolean checked;
    private final String name;

    @JsonCreator
    public RawNodeName(
            @JsonProperty("checked") boolean checked,
            @JsonProperty("name") String name) {
        this.checked = checked;
        this.name = name;
    }

    public boolean isChecked() {
        return checked;
    }

    public String getName() {
        return name;
    }
}
