package com.crossbot.scenario;

import com.crossbot.scenario.tree.CompiledScenario;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON serialization of scenario definitions and compiled trees. Null values are omitted.
 */
public final class ScenarioJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ScenarioJson() {
    }

    /**
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(ScenarioDefinition definition) {
        try {
            return MAPPER.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * @throws UncheckedIOException on parse failure
     */
    public static ScenarioDefinition definitionFromJson(String json) {
        try {
            return MAPPER.readValue(json, ScenarioDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(CompiledScenario scenario) {
        try {
            return MAPPER.writeValueAsString(scenario);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Pretty-printed compiled tree (for export and inspection). */
    public static String toJsonPretty(CompiledScenario scenario) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(scenario);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static CompiledScenario scenarioFromJson(String json) {
        try {
            return MAPPER.readValue(json, CompiledScenario.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
