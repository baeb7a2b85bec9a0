package com.crossbot.graph;

import com.crossbot.graph.state.RawNodeState;

import java.util.List;
import java.util.Objects;

/**
 * Node cell ({@code devs.Model}) as it appears in the graph document. {@code nodeType} is the
 * free-form tag (e.g. {@code dialogue.response}); interpretation happens in the classifier.
 */
public final class RawNodeCell {

    public static final String START_TYPE = "dialogue.start";

    private final String id;
    private final String nodeType;
    private final int z;
    private final List<String> embeds;
    private final String parent;
    private final RawNodeState state;

    public RawNodeCell(String id, String nodeType, int z, List<String> embeds, String parent, RawNodeState state) {
        this.id = Objects.requireNonNull(id, "id");
        this.nodeType = Objects.requireNonNull(nodeType, "nodeType");
        this.z = z;
        this.embeds = embeds != null ? List.copyOf(embeds) : List.of();
        this.parent = parent;
        this.state = state != null ? state : RawNodeState.empty();
    }

    public String getId() {
        return id;
    }

    public String getNodeType() {
        return nodeType;
    }

    /** Stacking order in the authoring canvas; used as sibling order. */
    public int getZ() {
        return z;
    }

    /** Ids of cells nested inside this one (choices drawn inside a response box). */
    public List<String> getEmbeds() {
        return embeds;
    }

    public String getParent() {
        return parent;
    }

    /** Never null; an absent state deserializes as an empty one. */
    public RawNodeState getState() {
        return state;
    }

    public boolean isStart() {
        return START_TYPE.equals(nodeType);
    }

    @Override
    public String toString() {
        return "RawNodeCell{id=" + id + ", nodeType=" + nodeType + "}";
    }
}
