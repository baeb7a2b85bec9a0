package com.crossbot.graph.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Memory section of a response node: collected form fields and the memory name. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RawMemory {

    private final List<String> forms;
    private final String name;

    @JsonCreator
    public RawMemory(
            @JsonProperty("forms") List<String> forms,
            @JsonProperty("name") String name) {
        this.forms = forms != null ? forms.stream().filter(Objects::nonNull).toList() : List.of();
        this.name = name;
    }

    public List<String> getForms() {
        return forms;
    }

    public String getName() {
        return name;
    }
}
