package com.crossbot.codec.editor;

import com.crossbot.codec.editor.model.EditorBranch;
import com.crossbot.codec.editor.model.EditorConnection;
import com.crossbot.codec.editor.model.EditorDocument;
import com.crossbot.codec.editor.model.EditorNode;
import com.crossbot.codec.editor.model.EditorNodeData;
import com.crossbot.codec.editor.model.EditorPosition;
import com.crossbot.codec.editor.model.EditorResponse;
import com.crossbot.codec.editor.model.EditorSettings;
import com.crossbot.graph.ScenarioFormatException;
import com.crossbot.scenario.action.ActionConfig;
import com.crossbot.scenario.action.FormConfig;
import com.crossbot.scenario.action.HandoverConfig;
import com.crossbot.scenario.action.JumpConfig;
import com.crossbot.scenario.action.LinkConfig;
import com.crossbot.scenario.compile.CompilationResult;
import com.crossbot.scenario.compile.CompileDiagnostic;
import com.crossbot.scenario.compile.DiagnosticKind;
import com.crossbot.scenario.compile.ScenarioCompiler;
import com.crossbot.scenario.tree.BranchCondition;
import com.crossbot.scenario.tree.CompiledNode;
import com.crossbot.scenario.tree.CompiledScenario;
import com.crossbot.scenario.tree.ReplyBranch;
import com.crossbot.scenario.tree.ResponseBlock;
import com.crossbot.scenario.tree.ScenarioAction;
import com.crossbot.scenario.tree.SymbolRef;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts between a compiled scenario and the visual editor document.
 * <p>
 * Decompiling lays nodes out on a grid by level and sibling order, turns rich text into plain text
 * plus image entries and draws one connection per parent/child edge and per resolved jump branch.
 * Recompiling takes parenthood only from connections and hands jump names to the symbol resolver,
 * so names stay portable between documents.
 */
public final class EditorCodec {

    private static final Logger log = LoggerFactory.getLogger(EditorCodec.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    static final double ORIGIN = 100d;
    static final double LEVEL_SPACING = 250d;
    static final double ORDER_SPACING = 150d;

    private final ScenarioCompiler compiler;

    public EditorCodec(ScenarioCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    /**
     * Parses an editor document.
     *
     * @throws ScenarioFormatException when the text is not an editor document
     */
    public static EditorDocument parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ScenarioFormatException("Editor document is empty");
        }
        try {
            return MAPPER.readValue(json, EditorDocument.class);
        } catch (JsonProcessingException e) {
            throw new ScenarioFormatException("Editor document is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(EditorDocument document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Decompiles and serializes in one step. */
    public String exportDocument(CompiledScenario scenario) {
        return toJson(decompile(scenario));
    }

    /** Parses, validates and recompiles an editor document. */
    public CompilationResult importDocument(String json) {
        return recompile(parse(json));
    }

    public EditorDocument decompile(CompiledScenario scenario) {
        List<EditorNode> nodes = new ArrayList<>(scenario.size());
        List<EditorConnection> connections = new ArrayList<>();
        for (CompiledNode node : scenario.getNodes()) {
            nodes.add(toEditorNode(node));
            if (node.getParentId() != null) {
                CompiledNode parent = scenario.getNodes().get(node.getParentId());
                connections.add(new EditorConnection("conn-parent-" + editorId(node), editorId(parent), editorId(node), null));
            }
        }
        for (CompiledNode node : scenario.getNodes()) {
            Set<String> drawn = new HashSet<>();
            List<ReplyBranch> replies = node.getReplies();
            for (int i = 0; i < replies.size(); i++) {
                SymbolRef target = replies.get(i).getTarget();
                if (target == null || !target.isResolved()) continue;
                String targetId = editorId(scenario.getNodes().get(target.getNodeId()));
                if (!drawn.add(targetId)) continue;
                connections.add(new EditorConnection("conn-reply-" + editorId(node) + "-" + i, editorId(node), targetId,
                        EditorConnection.REPLY_HANDLE_PREFIX + i));
            }
        }
        if (log.isInfoEnabled()) {
            log.info("EditorCodec | decompiled | nodes={} | connections={}", nodes.size(), connections.size());
        }
        return new EditorDocument(nodes, connections);
    }

    /**
     * Rebuilds the tree from an editor document and resolves its references.
     *
     * @throws ScenarioFormatException when a node lacks an id, a type or a numeric position
     */
    public CompilationResult recompile(EditorDocument document) {
        List<EditorNode> nodes = document.getNodes();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            EditorNode node = nodes.get(i);
            validate(node, i);
            if (index.putIfAbsent(node.getId(), i) != null) {
                throw new ScenarioFormatException("Duplicate editor node id: " + node.getId());
            }
        }

        List<CompileDiagnostic> diagnostics = new ArrayList<>();
        Integer[] parents = new Integer[nodes.size()];
        for (EditorConnection c : document.getConnections()) {
            if (c.isJumpDrawing()) continue;
            Integer source = c.getSourceId() != null ? index.get(c.getSourceId()) : null;
            Integer target = c.getTargetId() != null ? index.get(c.getTargetId()) : null;
            if (source == null || target == null) {
                diagnostics.add(invalid(c, "references an unknown node"));
            } else if (parents[target] != null) {
                diagnostics.add(invalid(c, "gives node " + c.getTargetId() + " a second parent"));
            } else if (closesCycle(parents, source, target)) {
                diagnostics.add(invalid(c, "would close a cycle"));
            } else {
                parents[target] = source;
            }
        }

        int[] orders = new int[nodes.size()];
        for (int i = 0; i < nodes.size(); i++) {
            orders[i] = (int) Math.round((nodes.get(i).getPosition().getY() - ORIGIN) / ORDER_SPACING);
        }
        Comparator<Integer> byOrder = Comparator.comparingInt((Integer i) -> orders[i]).thenComparingInt(i -> i);
        List<List<Integer>> children = new ArrayList<>(nodes.size());
        List<Integer> roots = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) children.add(new ArrayList<>());
        for (int i = 0; i < nodes.size(); i++) {
            if (parents[i] == null) roots.add(i);
            else children.get(parents[i]).add(i);
        }
        roots.sort(byOrder);
        children.forEach(list -> list.sort(byOrder));

        List<CompiledNode> compiled = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            compiled.add(toCompiledNode(nodes.get(i), i, depth(parents, i), orders[i], parents[i], children.get(i)));
        }
        for (CompileDiagnostic d : diagnostics) {
            log.warn("EditorCodec | {} | subject={}", d.getMessage(), d.getSubject());
        }
        CompilationResult result = compiler.link(new CompiledScenario(compiled, roots), diagnostics);
        if (log.isInfoEnabled()) {
            log.info("EditorCodec | recompiled | nodes={} | roots={} | diagnostics={}",
                    compiled.size(), roots.size(), result.getDiagnostics().size());
        }
        return result;
    }

    private static void validate(EditorNode node, int position) {
        if (node == null) {
            throw new ScenarioFormatException("Editor node #" + position + " is null");
        }
        if (node.getId() == null || node.getId().isBlank()) {
            throw new ScenarioFormatException("Editor node #" + position + " has no id");
        }
        if (node.getType() == null || node.getType().isBlank()) {
            throw new ScenarioFormatException("Editor node " + node.getId() + " has no type");
        }
        EditorPosition p = node.getPosition();
        if (p == null || p.getX() == null || p.getY() == null || p.getX().isNaN() || p.getY().isNaN()) {
            throw new ScenarioFormatException("Editor node " + node.getId() + " has no numeric position");
        }
    }

    private static CompileDiagnostic invalid(EditorConnection c, String reason) {
        String subject = c.getId() != null ? c.getId() : c.getSourceId() + "->" + c.getTargetId();
        return CompileDiagnostic.of(DiagnosticKind.INVALID_CONNECTION, subject, "Connection " + subject + " " + reason);
    }

    private static boolean closesCycle(Integer[] parents, int source, int target) {
        Integer cursor = source;
        while (cursor != null) {
            if (cursor == target) return true;
            cursor = parents[cursor];
        }
        return false;
    }

    private static int depth(Integer[] parents, int node) {
        int level = 0;
        for (Integer p = parents[node]; p != null; p = parents[p]) level++;
        return level;
    }

    private static CompiledNode toCompiledNode(EditorNode node, int id, int level, int order, Integer parentId,
                                               List<Integer> childIds) {
        EditorNodeData data = node.getData() != null ? node.getData() : new EditorNodeData(null, null, null, null);
        EditorSettings settings = node.getSettings() != null
                ? node.getSettings() : new EditorSettings(null, null, null, null, null, null);

        ScenarioAction action = settings.getAction() != null && !settings.getAction().isBlank()
                ? ScenarioAction.fromValue(settings.getAction())
                : actionForType(node.getType());
        ActionConfig config = settings.getActionConfig() != null && settings.getActionConfig().action() == action
                ? settings.getActionConfig()
                : configFromValue(action, settings.getActionValue());

        return new CompiledNode(id, node.getId(), level, order, blankToNull(settings.getNodeName()), data.getLabel(),
                responseBlocks(data), action, config, BranchCondition.fromValue(settings.getCondition()), parentId, childIds,
                settings.getAliases());
    }

    private static List<ResponseBlock> responseBlocks(EditorNodeData data) {
        List<ResponseBlock> blocks = new ArrayList<>();
        for (EditorResponse r : data.getResponses()) {
            if (EditorResponse.TYPE_IMAGE.equals(r.getType())) {
                if (r.getImageUrl() != null && !r.getImageUrl().isBlank()) blocks.add(ResponseBlock.image(r.getImageUrl()));
            } else if (!r.getContent().isBlank()) {
                blocks.add(ResponseBlock.text(r.getContent()));
            }
        }
        if (blocks.isEmpty() && data.getContent() != null && !data.getContent().isBlank()) {
            blocks.add(ResponseBlock.text(data.getContent()));
        }
        if (data.getBranches().isEmpty()) return blocks;

        List<ReplyBranch> replies = new ArrayList<>();
        for (EditorBranch b : data.getBranches()) {
            replies.add(replyBranch(b));
        }
        if (blocks.isEmpty()) {
            blocks.add(ResponseBlock.text("").withReplies(replies));
        } else {
            int last = blocks.size() - 1;
            blocks.set(last, blocks.get(last).withReplies(replies));
        }
        return blocks;
    }

    private static ReplyBranch replyBranch(EditorBranch b) {
        return switch (b.getType()) {
            case EditorBranch.TYPE_JUMP -> b.getTargetNodeName() != null && !b.getTargetNodeName().isBlank()
                    ? ReplyBranch.jump(b.getId(), b.getLabel(), b.getTargetNodeName())
                    : ReplyBranch.button(b.getId(), b.getLabel());
            case EditorBranch.TYPE_LINK -> ReplyBranch.link(b.getId(), b.getLabel(), b.getUrl());
            default -> ReplyBranch.button(b.getId(), b.getLabel());
        };
    }

    private static ScenarioAction actionForType(String type) {
        return switch (type) {
            case EditorNode.TYPE_ACTION -> ScenarioAction.HANDOVER;
            case EditorNode.TYPE_CONDITION -> ScenarioAction.JUMP;
            case EditorNode.TYPE_END -> ScenarioAction.DROP_OFF;
            default -> ScenarioAction.NONE;
        };
    }

    private static ActionConfig configFromValue(ScenarioAction action, String value) {
        String v = blankToNull(value);
        return switch (action) {
            case LINK -> v != null ? new LinkConfig(v) : null;
            case JUMP -> v != null ? new JumpConfig(SymbolRef.byName(v)) : null;
            case FORM -> v != null ? new FormConfig(v, List.of()) : null;
            case HANDOVER -> new HandoverConfig(null, null);
            default -> null;
        };
    }

    private static EditorNode toEditorNode(CompiledNode node) {
        EditorPosition position = new EditorPosition(
                ORIGIN + node.getLevel() * LEVEL_SPACING,
                ORIGIN + node.getOrder() * ORDER_SPACING);
        EditorNodeData data = new EditorNodeData(node.getTriggerLabel(), editorResponses(node), editorBranches(node), null);
        EditorSettings settings = new EditorSettings(
                node.getNodeName(),
                node.getAction() != ScenarioAction.NONE ? node.getAction().toValue() : null,
                actionValue(node.getActionConfig()),
                node.getCondition() != BranchCondition.NONE ? node.getCondition().toValue() : null,
                node.getActionConfig() != null ? node.getActionConfig().mapReferences(EditorCodec::portable) : null,
                null,
                node.getAliases());
        return new EditorNode(editorId(node), typeFor(node.getAction()), position, data, settings);
    }

    private static List<EditorResponse> editorResponses(CompiledNode node) {
        List<EditorResponse> out = new ArrayList<>();
        String prefix = "r" + node.getId() + "-";
        for (ResponseBlock block : node.getResponses()) {
            if (block.getKind() == ResponseBlock.Kind.IMAGE) {
                out.add(EditorResponse.image(prefix + out.size(), block.getContent()));
                continue;
            }
            RichTextExtractor.Extracted extracted = RichTextExtractor.extract(block.getContent());
            if (!extracted.text().isEmpty()) {
                out.add(EditorResponse.text(prefix + out.size(), extracted.text()));
            }
            for (String url : new LinkedHashSet<>(extracted.imageUrls())) {
                out.add(EditorResponse.image(prefix + out.size(), url));
            }
        }
        if (out.isEmpty()) {
            out.add(EditorResponse.text(prefix + 0, ""));
        }
        return out;
    }

    private static List<EditorBranch> editorBranches(CompiledNode node) {
        List<EditorBranch> out = new ArrayList<>();
        for (ReplyBranch r : node.getReplies()) {
            switch (r.getKind()) {
                case JUMP -> out.add(new EditorBranch(r.getId(), EditorBranch.TYPE_JUMP, r.getLabel(), null,
                        r.getTarget() != null ? r.getTarget().getSymbol() : null));
                case LINK -> out.add(new EditorBranch(r.getId(), EditorBranch.TYPE_LINK, r.getLabel(), r.getUrl(), null));
                default -> out.add(new EditorBranch(r.getId(), EditorBranch.TYPE_BUTTON, r.getLabel(), null, null));
            }
        }
        return out;
    }

    private static String actionValue(ActionConfig config) {
        if (config instanceof LinkConfig link) return link.getUrl();
        if (config instanceof JumpConfig jump) return jump.getTarget().getSymbol();
        if (config instanceof FormConfig form) return form.getFormId();
        return null;
    }

    /** Resolved references revert to a pending reference on the same symbol. */
    private static SymbolRef portable(SymbolRef ref) {
        if (!ref.isResolved()) return ref;
        return ref.getScope() == SymbolRef.Scope.CELL_ID ? SymbolRef.byCellId(ref.getSymbol()) : SymbolRef.byName(ref.getSymbol());
    }

    private static String typeFor(ScenarioAction action) {
        return switch (action) {
            case HANDOVER -> EditorNode.TYPE_ACTION;
            case RESTART, JUMP -> EditorNode.TYPE_CONDITION;
            case FORM -> EditorNode.TYPE_QUESTION;
            case DROP_OFF -> EditorNode.TYPE_END;
            default -> EditorNode.TYPE_MESSAGE;
        };
    }

    private static String editorId(CompiledNode node) {
        return node.getExternalId() != null ? node.getExternalId() : String.valueOf(node.getId());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
