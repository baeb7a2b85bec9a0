package com.crossbot.runtime;

import com.crossbot.scenario.action.ActionConfig;
import com.crossbot.scenario.tree.ResponseBlock;
import com.crossbot.scenario.tree.ScenarioAction;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Answer to one selection: the message blocks to show, the options to offer, and the action the caller
 * must perform (with its configuration). {@code handover} tells the caller to put the session in the
 * awaiting-human state.
 */
public final class ScenarioReply {

    private static final ScenarioReply EMPTY = new ScenarioReply(null, List.of(), List.of(), ScenarioAction.NONE, null, false);

    private final Integer nodeId;
    private final List<ResponseBlock> messages;
    private final List<ReplyOption> options;
    private final ScenarioAction action;
    private final ActionConfig actionConfig;
    private final boolean handover;

    @JsonCreator
    public ScenarioReply(
            @JsonProperty("nodeId") Integer nodeId,
            @JsonProperty("messages") List<ResponseBlock> messages,
            @JsonProperty("options") List<ReplyOption> options,
            @JsonProperty("action") ScenarioAction action,
            @JsonProperty("actionConfig") ActionConfig actionConfig,
            @JsonProperty("handover") boolean handover) {
        this.nodeId = nodeId;
        this.messages = messages != null ? List.copyOf(messages) : List.of();
        this.options = options != null ? List.copyOf(options) : List.of();
        this.action = action != null ? action : ScenarioAction.NONE;
        this.actionConfig = actionConfig;
        this.handover = handover;
    }

    public static ScenarioReply empty() {
        return EMPTY;
    }

    /** Node that produced the reply; null for the multi-root welcome and the empty reply. */
    public Integer getNodeId() {
        return nodeId;
    }

    public List<ResponseBlock> getMessages() {
        return messages;
    }

    public List<ReplyOption> getOptions() {
        return options;
    }

    public ScenarioAction getAction() {
        return action;
    }

    public ActionConfig getActionConfig() {
        return actionConfig;
    }

    public boolean isHandover() {
        return handover;
    }

    @Override
    public String toString() {
        return "ScenarioReply{nodeId=" + nodeId + ", messages=" + messages.size() + ", options=" + options
                + ", action=" + action + ", handover=" + handover + "}";
    }
}
