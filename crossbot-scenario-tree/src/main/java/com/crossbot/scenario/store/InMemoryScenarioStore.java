package com.crossbot.scenario.store;

import com.crossbot.scenario.ScenarioDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-process {@link ScenarioStore}. Used by default and in tests.
 */
public final class InMemoryScenarioStore implements ScenarioStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScenarioStore.class);

    private final Map<String, ScenarioDefinition> definitions = new ConcurrentHashMap<>();

    @Override
    public void save(ScenarioDefinition definition) {
        definitions.put(definition.getId(), definition);
        log.debug("Stored scenario definition id={} version={}", definition.getId(), definition.getVersion());
    }

    @Override
    public Optional<ScenarioDefinition> find(String definitionId) {
        return Optional.ofNullable(definitionId != null ? definitions.get(definitionId) : null);
    }

    @Override
    public List<String> listIds() {
        return new ArrayList<>(definitions.keySet());
    }

    @Override
    public boolean delete(String definitionId) {
        return definitionId != null && definitions.remove(definitionId) != null;
    }
}
