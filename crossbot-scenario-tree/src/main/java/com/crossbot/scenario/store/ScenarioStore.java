package com.crossbot.scenario.store;

import com.crossbot.scenario.ScenarioDefinition;
import com.crossbot.scenario.tree.CompiledNode;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of scenario definitions. Definitions are written whole; node reads are views of the
 * stored compiled tree.
 */
public interface ScenarioStore {

    /** Stores (or replaces) the definition under its id. */
    void save(ScenarioDefinition definition);

    Optional<ScenarioDefinition> find(String definitionId);

    /** Ids of all stored definitions. */
    List<String> listIds();

    /** Removes the definition; returns false when it did not exist. */
    boolean delete(String definitionId);

    default Optional<CompiledNode> findNode(String definitionId, int nodeId) {
        return find(definitionId).flatMap(d -> d.getScenario().findNode(nodeId));
    }

    /** Children of a node, or the roots when {@code parentId} is null. */
    default List<CompiledNode> findChildren(String definitionId, Integer parentId) {
        return find(definitionId)
                .map(d -> parentId == null ? d.getScenario().roots() : d.getScenario().children(parentId))
                .orElse(List.of());
    }
}
