package com.crossbot.scenario.action;

import com.crossbot.scenario.tree.ScenarioAction;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** External link opened by the client. */
public final class LinkConfig implements ActionConfig {

    private final String url;

    @JsonCreator
    public LinkConfig(@JsonProperty("url") String url) {
        this.url = url;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public ScenarioAction action() {
        return ScenarioAction.LINK;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LinkConfig && Objects.equals(url, ((LinkConfig) o).url);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(url);
    }
}
