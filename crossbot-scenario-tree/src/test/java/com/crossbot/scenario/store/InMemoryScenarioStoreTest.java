package com.crossbot.scenario.store;

import com.crossbot.scenario.ScenarioDefinition;
import com.crossbot.scenario.SourceFormat;
import com.crossbot.scenario.tree.CompiledNode;
import com.crossbot.scenario.tree.CompiledScenario;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryScenarioStoreTest {

    private static ScenarioDefinition definition() {
        CompiledScenario scenario = new CompiledScenario(List.of(
                new CompiledNode(0, "a", 0, 0, null, "A", List.of(), null, null, null, null, List.of(1, 2)),
                new CompiledNode(1, "b", 1, 0, null, "B", List.of(), null, null, null, 0, List.of()),
                new CompiledNode(2, "c", 1, 1, null, "C", List.of(), null, null, null, 0, List.of())
        ), List.of(0));
        return new ScenarioDefinition("d1", "Demo", 1, SourceFormat.TABULAR, "", scenario, List.of());
    }

    @Test
    void saveFindAndBrowse() {
        ScenarioStore store = new InMemoryScenarioStore();
        store.save(definition());

        assertTrue(store.find("d1").isPresent());
        assertEquals(List.of("d1"), store.listIds());
        assertEquals("B", store.findNode("d1", 1).orElseThrow().getTriggerLabel());
        assertEquals(List.of("B", "C"), store.findChildren("d1", 0).stream().map(CompiledNode::getTriggerLabel).toList());
        assertEquals("A", store.findChildren("d1", null).get(0).getTriggerLabel());
        assertTrue(store.findNode("d1", 9).isEmpty());
        assertTrue(store.findChildren("missing", null).isEmpty());
    }

    @Test
    void deleteRemoves() {
        ScenarioStore store = new InMemoryScenarioStore();
        store.save(definition());
        assertTrue(store.delete("d1"));
        assertFalse(store.delete("d1"));
        assertTrue(store.find("d1").isEmpty());
    }
}
