package com.crossbot.service;

import com.crossbot.scenario.SourceFormat;
import com.crossbot.scenario.compile.CompileDiagnostic;
import com.crossbot.scenario.tree.ScenarioAction;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Import, diagnostic and selection counters on a Micrometer registry.
 * <ul>
 *   <li>{@code crossbot.scenario.imports} (format, outcome)</li>
 *   <li>{@code crossbot.scenario.nodes} summary of compiled node counts (format)</li>
 *   <li>{@code crossbot.scenario.diagnostics} (kind)</li>
 *   <li>{@code crossbot.runtime.selections} (action)</li>
 *   <li>{@code crossbot.runtime.side_effects} (type)</li>
 * </ul>
 */
public final class ScenarioMetrics {

    private static final AtomicReference<MeterRegistry> SHARED = new AtomicReference<>();

    private final MeterRegistry registry;

    public ScenarioMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Metrics on the process-wide registry, created on first use. */
    public static ScenarioMetrics shared() {
        return new ScenarioMetrics(sharedRegistry());
    }

    private static MeterRegistry sharedRegistry() {
        MeterRegistry existing = SHARED.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (SHARED.compareAndSet(null, created)) {
            return created;
        }
        return SHARED.get();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void recordImport(SourceFormat format, int nodeCount, List<CompileDiagnostic> diagnostics) {
        String tag = tag(format);
        registry.counter("crossbot.scenario.imports", "format", tag, "outcome", "stored").increment();
        DistributionSummary.builder("crossbot.scenario.nodes")
                .tag("format", tag)
                .register(registry)
                .record(nodeCount);
        if (diagnostics == null) return;
        for (CompileDiagnostic d : diagnostics) {
            registry.counter("crossbot.scenario.diagnostics", "kind", tag(d.getKind())).increment();
        }
    }

    public void recordImportFailure(SourceFormat format) {
        registry.counter("crossbot.scenario.imports", "format", tag(format), "outcome", "failed").increment();
    }

    public void recordSelection(ScenarioAction action) {
        registry.counter("crossbot.runtime.selections", "action", tag(action)).increment();
    }

    public void recordHandover() {
        registry.counter("crossbot.runtime.side_effects", "type", "handover").increment();
    }

    public void recordNotification(ScenarioAction action) {
        registry.counter("crossbot.runtime.side_effects", "type", tag(action)).increment();
    }

    private static String tag(Enum<?> value) {
        return value != null ? value.name().toLowerCase(Locale.ROOT) : "unknown";
    }
}
