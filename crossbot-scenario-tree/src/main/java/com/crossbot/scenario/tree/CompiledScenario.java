package com.crossbot.scenario.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiled decision tree: an arena of {@link CompiledNode} indexed by compiled id plus the ordered root ids.
 * The parent/child relation is a forest.
 */
public final class CompiledScenario {

    private static final CompiledScenario EMPTY = new CompiledScenario(List.of(), List.of());

    private final List<CompiledNode> nodes;
    private final List<Integer> rootIds;

    @JsonCreator
    public CompiledScenario(
            @JsonProperty("nodes") List<CompiledNode> nodes,
            @JsonProperty("rootIds") List<Integer> rootIds) {
        this.nodes = nodes != null ? List.copyOf(nodes) : List.of();
        this.rootIds = rootIds != null ? List.copyOf(rootIds) : List.of();
        for (int i = 0; i < this.nodes.size(); i++) {
            if (this.nodes.get(i).getId() != i) {
                throw new IllegalArgumentException("Node at index " + i + " has id " + this.nodes.get(i).getId());
            }
        }
    }

    public static CompiledScenario empty() {
        return EMPTY;
    }

    public List<CompiledNode> getNodes() {
        return nodes;
    }

    public List<Integer> getRootIds() {
        return rootIds;
    }

    @JsonIgnore
    public int size() {
        return nodes.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<CompiledNode> findNode(int id) {
        return id >= 0 && id < nodes.size() ? Optional.of(nodes.get(id)) : Optional.empty();
    }

    public List<CompiledNode> roots() {
        return rootIds.stream().map(nodes::get).toList();
    }

    /** Children of the node in authored order; empty for an unknown id. */
    public List<CompiledNode> children(int id) {
        return findNode(id).map(n -> n.getChildIds().stream().map(nodes::get).toList()).orElse(List.of());
    }

    /** First node (by compiled id) carrying the given node name. */
    public Optional<CompiledNode> findByName(String name) {
        if (name == null) return Optional.empty();
        return nodes.stream().filter(n -> name.equals(n.getNodeName())).findFirst();
    }

    public Optional<CompiledNode> findByExternalId(String externalId) {
        if (externalId == null) return Optional.empty();
        return nodes.stream().filter(n -> externalId.equals(n.getExternalId())).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompiledScenario)) return false;
        CompiledScenario that = (CompiledScenario) o;
        return nodes.equals(that.nodes) && rootIds.equals(that.rootIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, rootIds);
    }
}
