package com.crossbot.scenario.tree;

import com.crossbot.scenario.action.ActionConfig;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Node of a compiled scenario. Identified by a dense compiled id (its index in
 * {@link CompiledScenario#getNodes()}); {@code externalId} keeps the authoring-format id for round trips.
 * Roots have level 0 and no parent. {@code aliases} are further names jumps may use besides
 * {@code nodeName}. Immutable; the runtime never changes a node.
 */
public final class CompiledNode {

    private final int id;
    private final String externalId;
    private final int level;
    private final int order;
    private final String nodeName;
    private final String triggerLabel;
    private final List<ResponseBlock> responses;
    private final ScenarioAction action;
    private final ActionConfig actionConfig;
    private final BranchCondition condition;
    private final Integer parentId;
    private final List<Integer> childIds;
    private final List<String> aliases;

    public CompiledNode(
            int id,
            String externalId,
            int level,
            int order,
            String nodeName,
            String triggerLabel,
            List<ResponseBlock> responses,
            ScenarioAction action,
            ActionConfig actionConfig,
            BranchCondition condition,
            Integer parentId,
            List<Integer> childIds) {
        this(id, externalId, level, order, nodeName, triggerLabel, responses, action, actionConfig, condition,
                parentId, childIds, List.of());
    }

    @JsonCreator
    public CompiledNode(
            @JsonProperty("id") int id,
            @JsonProperty("externalId") String externalId,
            @JsonProperty("level") int level,
            @JsonProperty("order") int order,
            @JsonProperty("nodeName") String nodeName,
            @JsonProperty("triggerLabel") String triggerLabel,
            @JsonProperty("responses") List<ResponseBlock> responses,
            @JsonProperty("action") ScenarioAction action,
            @JsonProperty("actionConfig") ActionConfig actionConfig,
            @JsonProperty("condition") BranchCondition condition,
            @JsonProperty("parentId") Integer parentId,
            @JsonProperty("childIds") List<Integer> childIds,
            @JsonProperty("aliases") List<String> aliases) {
        this.id = id;
        this.externalId = externalId;
        this.level = level;
        this.order = order;
        this.nodeName = nodeName;
        this.triggerLabel = triggerLabel != null ? triggerLabel : "";
        this.responses = responses != null ? List.copyOf(responses) : List.of();
        this.action = action != null ? action : ScenarioAction.NONE;
        this.actionConfig = actionConfig;
        this.condition = condition != null ? condition : BranchCondition.NONE;
        this.parentId = parentId;
        this.childIds = childIds != null ? List.copyOf(childIds) : List.of();
        this.aliases = aliases != null
                ? aliases.stream().filter(a -> a != null && !a.isBlank() && !a.equals(nodeName)).distinct().toList()
                : List.of();
    }

    public int getId() {
        return id;
    }

    public String getExternalId() {
        return externalId;
    }

    /** Depth in the tree; roots are 0. */
    public int getLevel() {
        return level;
    }

    /** Ordinal among siblings, as authored. */
    public int getOrder() {
        return order;
    }

    public String getNodeName() {
        return nodeName;
    }

    /** Text shown as the option that leads to this node. Never null. */
    public String getTriggerLabel() {
        return triggerLabel;
    }

    public List<ResponseBlock> getResponses() {
        return responses;
    }

    /** Never null; {@link ScenarioAction#NONE} when the node only talks. */
    public ScenarioAction getAction() {
        return action;
    }

    public ActionConfig getActionConfig() {
        return actionConfig;
    }

    public BranchCondition getCondition() {
        return condition;
    }

    public Integer getParentId() {
        return parentId;
    }

    public List<Integer> getChildIds() {
        return childIds;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getAliases() {
        return aliases;
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentId == null;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return childIds.isEmpty();
    }

    /** All reply branches of all response blocks, in order. */
    @JsonIgnore
    public List<ReplyBranch> getReplies() {
        return responses.stream().flatMap(r -> r.getReplies().stream()).toList();
    }

    public CompiledNode withActionConfig(ActionConfig newConfig) {
        return new CompiledNode(id, externalId, level, order, nodeName, triggerLabel, responses, action,
                newConfig, condition, parentId, childIds, aliases);
    }

    public CompiledNode withResponses(List<ResponseBlock> newResponses) {
        return new CompiledNode(id, externalId, level, order, nodeName, triggerLabel, newResponses, action,
                actionConfig, condition, parentId, childIds, aliases);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompiledNode)) return false;
        CompiledNode that = (CompiledNode) o;
        return id == that.id && level == that.level && order == that.order
                && Objects.equals(externalId, that.externalId) && Objects.equals(nodeName, that.nodeName)
                && triggerLabel.equals(that.triggerLabel) && responses.equals(that.responses)
                && action == that.action && Objects.equals(actionConfig, that.actionConfig)
                && condition == that.condition && Objects.equals(parentId, that.parentId)
                && childIds.equals(that.childIds) && aliases.equals(that.aliases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, externalId, level, order, nodeName, triggerLabel, responses, action,
                actionConfig, condition, parentId, childIds, aliases);
    }

    @Override
    public String toString() {
        return "CompiledNode{id=" + id + ", level=" + level + ", label=" + triggerLabel + ", action=" + action + "}";
    }
}
