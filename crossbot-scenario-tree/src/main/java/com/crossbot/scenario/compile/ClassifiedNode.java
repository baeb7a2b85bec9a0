package com.crossbot.scenario.compile;

import com.crossbot.scenario.action.ActionConfig;
import com.crossbot.scenario.tree.BranchCondition;
import com.crossbot.scenario.tree.ResponseBlock;
import com.crossbot.scenario.tree.ScenarioAction;

import java.util.List;

/**
 * Classifier output for one node cell: everything the tree builder needs to materialize a compiled node
 * plus the outgoing edges to follow. {@code names} lists every symbol the node answers to (node name
 * first, then memory name).
 */
public final class ClassifiedNode {

    private final String cellId;
    private final String nodeType;
    private final String triggerLabel;
    private final List<ResponseBlock> responses;
    private final ScenarioAction action;
    private final ActionConfig actionConfig;
    private final BranchCondition condition;
    private final List<String> names;
    private final int order;
    private final List<String> embeddedChildIds;
    private final List<String> linkedTargetIds;

    public ClassifiedNode(String cellId, String nodeType, String triggerLabel, List<ResponseBlock> responses,
                          ScenarioAction action, ActionConfig actionConfig, BranchCondition condition,
                          List<String> names, int order, List<String> embeddedChildIds, List<String> linkedTargetIds) {
        this.cellId = cellId;
        this.nodeType = nodeType;
        this.triggerLabel = triggerLabel;
        this.responses = responses != null ? List.copyOf(responses) : List.of();
        this.action = action != null ? action : ScenarioAction.NONE;
        this.actionConfig = actionConfig;
        this.condition = condition != null ? condition : BranchCondition.NONE;
        this.names = names != null ? List.copyOf(names) : List.of();
        this.order = order;
        this.embeddedChildIds = embeddedChildIds != null ? List.copyOf(embeddedChildIds) : List.of();
        this.linkedTargetIds = linkedTargetIds != null ? List.copyOf(linkedTargetIds) : List.of();
    }

    public String getCellId() {
        return cellId;
    }

    public String getNodeType() {
        return nodeType;
    }

    public String getTriggerLabel() {
        return triggerLabel;
    }

    public List<ResponseBlock> getResponses() {
        return responses;
    }

    public ScenarioAction getAction() {
        return action;
    }

    public ActionConfig getActionConfig() {
        return actionConfig;
    }

    public BranchCondition getCondition() {
        return condition;
    }

    public List<String> getNames() {
        return names;
    }

    /** Primary node name, or null. */
    public String getNodeName() {
        return names.isEmpty() ? null : names.get(0);
    }

    public int getOrder() {
        return order;
    }

    public List<String> getEmbeddedChildIds() {
        return embeddedChildIds;
    }

    public List<String> getLinkedTargetIds() {
        return linkedTargetIds;
    }
}
