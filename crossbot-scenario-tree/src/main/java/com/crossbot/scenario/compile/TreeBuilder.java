package com.crossbot.scenario.compile;

import com.crossbot.graph.IngestedGraph;
import com.crossbot.graph.LinkResolver;
import com.crossbot.graph.RawNodeCell;
import com.crossbot.scenario.tree.CompiledNode;
import com.crossbot.scenario.tree.CompiledScenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an ingested graph into a compiled forest. Starting at the start cell's first real node it walks the
 * graph depth-first (explicit stack, preorder), materializing one node per visited cell. A cell that was
 * already visited is never materialized again, which cuts cycles and keeps shared targets under their first
 * parent. Start cells and ids without a node cell are passed through: their successors attach to the
 * current parent at the current level.
 */
public final class TreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    private final NodeClassifier classifier;
    private final CyclePolicy cyclePolicy;

    public TreeBuilder(NodeClassifier classifier, CyclePolicy cyclePolicy) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.cyclePolicy = cyclePolicy != null ? cyclePolicy : CyclePolicy.SKIP;
    }

    /**
     * Builds the tree.
     *
     * @throws ScenarioCompileException when there is no start cell or the start cell leads nowhere
     */
    public TreeBuildResult build(IngestedGraph graph) {
        List<RawNodeCell> starts = graph.startNodes();
        if (starts.isEmpty()) {
            throw new ScenarioCompileException("Start node not found");
        }
        List<CompileDiagnostic> diagnostics = new ArrayList<>();
        for (String message : graph.getMessages()) {
            diagnostics.add(CompileDiagnostic.of(DiagnosticKind.SKIPPED_CELL, null, message));
        }
        RawNodeCell start = starts.get(0);
        for (int i = 1; i < starts.size(); i++) {
            diagnostics.add(CompileDiagnostic.of(DiagnosticKind.DUPLICATE_START, starts.get(i).getId(),
                    "Ignored additional start node " + starts.get(i).getId()));
        }

        Map<String, List<String>> linkMap = LinkResolver.resolve(graph.getLinks());
        String rootTarget = start.getState().getNextNode();
        if (rootTarget == null) {
            List<String> out = linkMap.getOrDefault(start.getId(), List.of());
            rootTarget = out.isEmpty() ? null : out.get(0);
        }
        if (rootTarget == null) {
            throw new ScenarioCompileException("Start node " + start.getId() + " is not connected to any node");
        }
        if (!graph.containsNode(rootTarget) && !linkMap.containsKey(rootTarget)) {
            throw new ScenarioCompileException("Start node " + start.getId() + " points to missing node " + rootTarget);
        }

        SymbolTable symbols = new SymbolTable();
        for (RawNodeCell s : starts) {
            symbols.registerRestartCell(s.getId());
        }
        List<Draft> drafts = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        starts.forEach(s -> visited.add(s.getId()));

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(rootTarget, null, 0));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            String cellId = frame.cellId;
            if (!visited.add(cellId)) {
                onRevisit(frame, drafts, symbols, diagnostics);
                continue;
            }
            Optional<RawNodeCell> cell = graph.findNode(cellId);
            Optional<ClassifiedNode> classified = cell.flatMap(c -> classifier.classify(c, linkMap));
            if (classified.isEmpty()) {
                List<String> next = cell.isPresent()
                        ? passThroughTargets(cell.get(), linkMap)
                        : linkMap.getOrDefault(cellId, List.of());
                if (cell.isEmpty() && next.isEmpty()) {
                    diagnostics.add(CompileDiagnostic.of(DiagnosticKind.MISSING_CELL, cellId,
                            "Referenced cell " + cellId + " is not in the document"));
                    continue;
                }
                log.debug("TreeBuilder | pass through | cellId={} | targets={}", cellId, next);
                pushAll(stack, next, frame.parentId, frame.level);
                continue;
            }

            ClassifiedNode node = classified.get();
            Draft draft = new Draft(drafts.size(), node, frame.parentId, frame.level);
            drafts.add(draft);
            if (frame.parentId != null) {
                drafts.get(frame.parentId).childIds.add(draft.id);
            }
            symbols.registerCell(cellId, draft.id);
            for (String name : node.getNames()) {
                if (!symbols.registerName(name, draft.id)) {
                    diagnostics.add(CompileDiagnostic.of(DiagnosticKind.DUPLICATE_NAME, cellId,
                            "Node name '" + name + "' is already used; kept on node " + symbols.lookupName(name).orElse(-1)));
                }
            }

            Set<String> successors = new LinkedHashSet<>(node.getEmbeddedChildIds());
            successors.addAll(node.getLinkedTargetIds());
            pushAll(stack, new ArrayList<>(successors), draft.id, frame.level + 1);
        }

        CompiledScenario scenario = toScenario(drafts);
        if (log.isInfoEnabled()) {
            log.info("TreeBuilder | built | nodes={} | roots={} | diagnostics={}",
                    scenario.size(), scenario.getRootIds().size(), diagnostics.size());
        }
        return new TreeBuildResult(scenario, symbols, diagnostics);
    }

    private void onRevisit(Frame frame, List<Draft> drafts, SymbolTable symbols, List<CompileDiagnostic> diagnostics) {
        String cellId = frame.cellId;
        if (symbols.isRestartCell(cellId)) {
            log.debug("TreeBuilder | edge back to start cut | cellId={}", cellId);
            return;
        }
        boolean ancestor = isAncestor(cellId, frame.parentId, drafts);
        if (cyclePolicy == CyclePolicy.REPORT) {
            if (ancestor) {
                diagnostics.add(CompileDiagnostic.of(DiagnosticKind.CYCLE, cellId,
                        "Edge to ancestor " + cellId + " cut"));
            } else {
                diagnostics.add(CompileDiagnostic.of(DiagnosticKind.SHARED_TARGET, cellId,
                        "Node " + cellId + " is reachable from several parents; kept under its first parent"));
            }
        } else {
            log.debug("TreeBuilder | revisit skipped | cellId={} | cycle={}", cellId, ancestor);
        }
    }

    private static boolean isAncestor(String cellId, Integer parentId, List<Draft> drafts) {
        Integer current = parentId;
        while (current != null) {
            Draft d = drafts.get(current);
            if (d.node.getCellId().equals(cellId)) return true;
            current = d.parentId;
        }
        return false;
    }

    private static List<String> passThroughTargets(RawNodeCell cell, Map<String, List<String>> linkMap) {
        Set<String> targets = new LinkedHashSet<>(cell.getEmbeds());
        if (cell.getState().getNextNode() != null) targets.add(cell.getState().getNextNode());
        targets.addAll(linkMap.getOrDefault(cell.getId(), List.of()));
        return new ArrayList<>(targets);
    }

    private static void pushAll(Deque<Frame> stack, List<String> targets, Integer parentId, int level) {
        for (int i = targets.size() - 1; i >= 0; i--) {
            stack.push(new Frame(targets.get(i), parentId, level));
        }
    }

    private static CompiledScenario toScenario(List<Draft> drafts) {
        List<CompiledNode> nodes = new ArrayList<>(drafts.size());
        List<Integer> roots = new ArrayList<>();
        for (Draft d : drafts) {
            List<Integer> children = new ArrayList<>(d.childIds);
            children.sort(Comparator.comparingInt((Integer id) -> drafts.get(id).node.getOrder()).thenComparingInt(id -> id));
            ClassifiedNode n = d.node;
            nodes.add(new CompiledNode(d.id, n.getCellId(), d.level, n.getOrder(), n.getNodeName(),
                    n.getTriggerLabel(), n.getResponses(), n.getAction(), n.getActionConfig(), n.getCondition(),
                    d.parentId, children, n.getNames()));
            if (d.parentId == null) roots.add(d.id);
        }
        return new CompiledScenario(nodes, roots);
    }

    private static final class Frame {
        final String cellId;
        final Integer parentId;
        final int level;

        Frame(String cellId, Integer parentId, int level) {
            this.cellId = cellId;
            this.parentId = parentId;
            this.level = level;
        }
    }

    private static final class Draft {
        final int id;
        final ClassifiedNode node;
        final Integer parentId;
        final int level;
        final List<Integer> childIds = new ArrayList<>();

        Draft(int id, ClassifiedNode node, Integer parentId, int level) {
            this.id = id;
            this.node = node;
            this.parentId = parentId;
            this.level = level;
        }
    }
}
