package com.crossbot.scenario.compile;

import com.crossbot.scenario.action.ActionConfig;
import com.crossbot.scenario.tree.CompiledNode;
import com.crossbot.scenario.tree.CompiledScenario;
import com.crossbot.scenario.tree.ResponseBlock;
import com.crossbot.scenario.tree.SymbolRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Second pass over a built tree: replaces every pending {@link SymbolRef} in action configurations
 * (jump targets, mail/csv continuations, hand-off outcomes) and in jump reply branches. Name references
 * go through the name table, with the restart sentinel meaning "scenario start"; cell references go
 * through the cell table. Misses are marked unresolved and reported. Returns a new scenario.
 */
public final class SymbolResolver {

    private static final Logger log = LoggerFactory.getLogger(SymbolResolver.class);

    private final String restartSentinel;

    public SymbolResolver(String restartSentinel) {
        this.restartSentinel = Objects.requireNonNull(restartSentinel, "restartSentinel");
    }

    public Resolution resolve(CompiledScenario scenario, SymbolTable symbols) {
        List<CompileDiagnostic> diagnostics = new ArrayList<>();
        List<CompiledNode> resolved = new ArrayList<>(scenario.size());
        int resolvedCount = 0;
        for (CompiledNode node : scenario.getNodes()) {
            NodeResolver mapper = new NodeResolver(node, symbols, diagnostics);
            CompiledNode out = node;
            ActionConfig config = node.getActionConfig();
            if (config != null && config.references().stream().anyMatch(SymbolRef::isPending)) {
                out = out.withActionConfig(config.mapReferences(mapper::apply));
            }
            List<ResponseBlock> blocks = new ArrayList<>(node.getResponses().size());
            boolean changed = false;
            for (ResponseBlock block : node.getResponses()) {
                ResponseBlock mapped = block.mapJumpTargets(mapper::apply);
                changed |= mapped != block;
                blocks.add(mapped);
            }
            if (changed) {
                out = out.withResponses(blocks);
            }
            resolvedCount += mapper.resolved;
            resolved.add(out);
        }
        if (log.isInfoEnabled()) {
            log.info("SymbolResolver | resolved={} | unresolved={}", resolvedCount, diagnostics.size());
        }
        return new Resolution(new CompiledScenario(resolved, scenario.getRootIds()), diagnostics);
    }

    private final class NodeResolver {
        private final CompiledNode node;
        private final SymbolTable symbols;
        private final List<CompileDiagnostic> diagnostics;
        private int resolved;

        NodeResolver(CompiledNode node, SymbolTable symbols, List<CompileDiagnostic> diagnostics) {
            this.node = node;
            this.symbols = symbols;
            this.diagnostics = diagnostics;
        }

        SymbolRef apply(SymbolRef ref) {
            if (ref == null || !ref.isPending()) return ref;
            String symbol = ref.getSymbol();
            if (ref.getScope() == SymbolRef.Scope.NODE_NAME) {
                if (restartSentinel.equals(symbol)) {
                    resolved++;
                    return ref.asRestart();
                }
                var id = symbols.lookupName(symbol);
                if (id.isPresent()) {
                    resolved++;
                    return ref.resolvedTo(id.get());
                }
            } else {
                if (symbols.isRestartCell(symbol)) {
                    resolved++;
                    return ref.asRestart();
                }
                var id = symbols.lookupCell(symbol);
                if (id.isPresent()) {
                    resolved++;
                    return ref.resolvedTo(id.get());
                }
            }
            diagnostics.add(CompileDiagnostic.of(DiagnosticKind.UNRESOLVED_SYMBOL, node.getExternalId(),
                    "Node " + node.getId() + " (" + node.getTriggerLabel() + "): unresolved "
                            + (ref.getScope() == SymbolRef.Scope.NODE_NAME ? "node name" : "cell") + " '" + symbol + "'"));
            return ref.asUnresolved();
        }
    }

    /** Resolved scenario plus one diagnostic per unresolved reference. */
    public static final class Resolution {
        private final CompiledScenario scenario;
        private final List<CompileDiagnostic> diagnostics;

        Resolution(CompiledScenario scenario, List<CompileDiagnostic> diagnostics) {
            this.scenario = scenario;
            this.diagnostics = List.copyOf(diagnostics);
        }

        public CompiledScenario getScenario() {
            return scenario;
        }

        public List<CompileDiagnostic> getDiagnostics() {
            return diagnostics;
        }
    }
}
