package com.crossbot.codec.editor.model;

import com.crossbot.scenario.action.ActionConfig;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Behaviour settings of an editor node. {@code action} overrides the action implied by the node type;
 * {@code actionValue} is the link URL, jump target name or form id; {@code actionConfig} carries the
 * full configuration of mail, csv and hand-off nodes. {@code aliases} are the other names jumps may
 * target the node by.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EditorSettings {

    public static final String DEFAULT_FREE_INPUT_MODE = "default";

    private final String nodeName;
    private final String action;
    private final String actionValue;
    private final String condition;
    private final ActionConfig actionConfig;
    private final String freeInputMode;
    private final List<String> aliases;

    public EditorSettings(String nodeName, String action, String actionValue, String condition,
                          ActionConfig actionConfig, String freeInputMode) {
        this(nodeName, action, actionValue, condition, actionConfig, freeInputMode, null);
    }

    @JsonCreator
    public EditorSettings(
            @JsonProperty("nodeName") String nodeName,
            @JsonProperty("action") String action,
            @JsonProperty("actionValue") String actionValue,
            @JsonProperty("condition") String condition,
            @JsonProperty("actionConfig") ActionConfig actionConfig,
            @JsonProperty("freeInputMode") String freeInputMode,
            @JsonProperty("aliases") List<String> aliases) {
        this.nodeName = nodeName;
        this.action = action;
        this.actionValue = actionValue;
        this.condition = condition;
        this.actionConfig = actionConfig;
        this.freeInputMode = freeInputMode;
        List<String> names = aliases != null ? aliases.stream().filter(Objects::nonNull).toList() : List.of();
        this.aliases = names.isEmpty() ? null : names;
    }

    public String getNodeName() {
        return nodeName;
    }

    public String getAction() {
        return action;
    }

    public String getActionValue() {
        return actionValue;
    }

    public String getCondition() {
        return condition;
    }

    public ActionConfig getActionConfig() {
        return actionConfig;
    }

    public String getFreeInputMode() {
        return freeInputMode;
    }

    /** Null when the node has no other names. */
    public List<String> getAliases() {
        return aliases;
    }
}
