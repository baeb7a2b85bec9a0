package com.crossbot.scenario;

import com.crossbot.scenario.compile.CompileDiagnostic;
import com.crossbot.scenario.tree.CompiledScenario;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Named, versioned container of one compiled scenario and the payload it was compiled from.
 * Immutable; a change is a full recompile that produces a new definition with a higher version.
 */
public final class ScenarioDefinition {

    private final String id;
    private final String name;
    private final int version;
    private final SourceFormat sourceFormat;
    private final String sourcePayload;
    private final CompiledScenario scenario;
    private final List<CompileDiagnostic> diagnostics;

    @JsonCreator
    public ScenarioDefinition(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("version") int version,
            @JsonProperty("sourceFormat") SourceFormat sourceFormat,
            @JsonProperty("sourcePayload") String sourcePayload,
            @JsonProperty("scenario") CompiledScenario scenario,
            @JsonProperty("diagnostics") List<CompileDiagnostic> diagnostics) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.version = version;
        this.sourceFormat = Objects.requireNonNull(sourceFormat, "sourceFormat");
        this.sourcePayload = sourcePayload;
        this.scenario = scenario != null ? scenario : CompiledScenario.empty();
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /** Starts at 1; incremented by every recompile of the same id. */
    public int getVersion() {
        return version;
    }

    public SourceFormat getSourceFormat() {
        return sourceFormat;
    }

    /** Authoring document exactly as imported. */
    public String getSourcePayload() {
        return sourcePayload;
    }

    public CompiledScenario getScenario() {
        return scenario;
    }

    public List<CompileDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** Replacement definition for a recompile: same id, next version. */
    public ScenarioDefinition recompiled(String newName, SourceFormat format, String payload,
                                         CompiledScenario compiled, List<CompileDiagnostic> newDiagnostics) {
        return new ScenarioDefinition(id, newName != null ? newName : name, version + 1, format, payload,
                compiled, newDiagnostics);
    }
}
