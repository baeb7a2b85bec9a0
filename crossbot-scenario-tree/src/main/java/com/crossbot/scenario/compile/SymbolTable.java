package com.crossbot.scenario.compile;

import com.crossbot.scenario.tree.CompiledNode;
import com.crossbot.scenario.tree.CompiledScenario;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolution tables collected while building a tree: node name → compiled id (first definition wins)
 * and authoring cell id → compiled id. Cells registered as restart cells resolve to the scenario start.
 */
public final class SymbolTable {

    private final Map<String, Integer> names = new HashMap<>();
    private final Map<String, Integer> cells = new HashMap<>();
    private final Set<String> restartCells = new HashSet<>();

    /**
     * Builds the tables from an already compiled scenario (node names and external ids).
     */
    public static SymbolTable fromScenario(CompiledScenario scenario) {
        SymbolTable table = new SymbolTable();
        for (CompiledNode node : scenario.getNodes()) {
            if (node.getNodeName() != null) table.registerName(node.getNodeName(), node.getId());
            for (String alias : node.getAliases()) table.registerName(alias, node.getId());
            if (node.getExternalId() != null) table.registerCell(node.getExternalId(), node.getId());
        }
        return table;
    }

    /** Registers a name; returns false when the name was already taken (the existing mapping is kept). */
    public boolean registerName(String name, int compiledId) {
        if (name == null || name.isBlank()) return true;
        return names.putIfAbsent(name, compiledId) == null;
    }

    public void registerCell(String cellId, int compiledId) {
        if (cellId != null) cells.putIfAbsent(cellId, compiledId);
    }

    public void registerRestartCell(String cellId) {
        if (cellId != null) restartCells.add(cellId);
    }

    public Optional<Integer> lookupName(String name) {
        return Optional.ofNullable(name != null ? names.get(name) : null);
    }

    public Optional<Integer> lookupCell(String cellId) {
        return Optional.ofNullable(cellId != null ? cells.get(cellId) : null);
    }

    public boolean isRestartCell(String cellId) {
        return cellId != null && restartCells.contains(cellId);
    }

    public Map<String, Integer> getNames() {
        return Collections.unmodifiableMap(names);
    }

    public Map<String, Integer> getCells() {
        return Collections.unmodifiableMap(cells);
    }
}
