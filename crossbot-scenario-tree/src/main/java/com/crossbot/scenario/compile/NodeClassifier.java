package com.crossbot.scenario.compile;

import com.crossbot.graph.RawNodeCell;
import com.crossbot.graph.state.RawCsvItem;
import com.crossbot.graph.state.RawNodeState;
import com.crossbot.graph.state.RawReply;
import com.crossbot.graph.state.RawResponseAdvance;
import com.crossbot.scenario.action.ActionConfig;
import com.crossbot.scenario.action.CsvColumn;
import com.crossbot.scenario.action.CsvConfig;
import com.crossbot.scenario.action.FormConfig;
import com.crossbot.scenario.action.HandoverConfig;
import com.crossbot.scenario.action.JumpConfig;
import com.crossbot.scenario.action.LinkConfig;
import com.crossbot.scenario.action.MailConfig;
import com.crossbot.scenario.tree.BranchCondition;
import com.crossbot.scenario.tree.ReplyBranch;
import com.crossbot.scenario.tree.ResponseBlock;
import com.crossbot.scenario.tree.ScenarioAction;
import com.crossbot.scenario.tree.SymbolRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps one raw node cell to a {@link ClassifiedNode}: trigger label, response blocks with reply branches,
 * action and configuration, branch condition, names and the outgoing edges. Never throws; a node it cannot
 * interpret degrades to {@link ScenarioAction#NONE}.
 */
public final class NodeClassifier {

    private static final Logger log = LoggerFactory.getLogger(NodeClassifier.class);

    public static final String TYPE_RESPONSE = "dialogue.response";
    public static final String TYPE_JOINT = "dialogue.joint";
    public static final String TYPE_RTCHAT = "system.rtchat";
    public static final String TYPE_MAIL = "system.mail";
    public static final String TYPE_CSV = "system.csv";

    private static final String CONDITION_GO_TO = "go_to";
    private static final String CONDITION_BUTTON = "button";
    private static final String CONDITION_LINK = "link";
    private static final String CONDITION_SUBMIT_FORM = "submit_form";
    private static final String CONDITION_IN = "in";
    private static final String CONDITION_OUT = "out";
    private static final String CONDITION_ALL = "all";

    private final ClassifierVocabulary vocabulary;

    public NodeClassifier(ClassifierVocabulary vocabulary) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
    }

    public ClassifierVocabulary getVocabulary() {
        return vocabulary;
    }

    /**
     * Classifies a node cell.
     *
     * @param cell    raw node cell
     * @param linkMap source cell id → ordered target ids
     * @return the classified node, or empty for the start cell (which is never materialized)
     */
    public Optional<ClassifiedNode> classify(RawNodeCell cell, Map<String, List<String>> linkMap) {
        if (cell.isStart()) return Optional.empty();
        RawNodeState state = cell.getState();

        ScenarioAction action = ScenarioAction.NONE;
        ActionConfig config = null;
        BranchCondition condition = BranchCondition.NONE;
        List<ResponseBlock> responses = responseBlocks(state);

        switch (cell.getNodeType()) {
            case TYPE_RESPONSE -> {
                Optional<RawResponseAdvance> form = state.getResponseAdvance().stream()
                        .filter(RawResponseAdvance::isForm)
                        .findFirst();
                if (form.isPresent()) {
                    action = ScenarioAction.FORM;
                    List<String> fields = state.getMemory() != null ? state.getMemory().getForms() : List.of();
                    config = new FormConfig(form.get().getFormName(), fields);
                }
            }
            case TYPE_JOINT -> {
                String type = state.getConditionType();
                String value = state.getConditionValue();
                if (CONDITION_GO_TO.equals(type)) {
                    if (vocabulary.getRestartSentinel().equals(state.getConditionLink())
                            || vocabulary.getRestartLabel().equals(value)) {
                        action = ScenarioAction.RESTART;
                    } else if (state.getConditionLink() != null) {
                        action = ScenarioAction.JUMP;
                        config = new JumpConfig(SymbolRef.byName(state.getConditionLink()));
                    }
                } else if (CONDITION_BUTTON.equals(type)) {
                    if (vocabulary.isHandoverText(value)) {
                        action = ScenarioAction.HANDOVER;
                        config = new HandoverConfig(null, null);
                    }
                } else if (CONDITION_LINK.equals(type)) {
                    action = ScenarioAction.LINK;
                    config = new LinkConfig(state.getConditionLink() != null
                            ? state.getConditionLink() : state.getConditionLinkTarget());
                } else if (CONDITION_SUBMIT_FORM.equals(type)) {
                    condition = BranchCondition.AFTER_FORM_SUBMIT;
                } else if (CONDITION_IN.equals(type)) {
                    condition = BranchCondition.ON_SUCCESS;
                } else if (CONDITION_OUT.equals(type)) {
                    condition = BranchCondition.ON_FAILURE;
                } else if (CONDITION_ALL.equals(type)) {
                    condition = BranchCondition.UNCONDITIONAL;
                } else {
                    log.debug("Classifier | joint without known condition | cellId={} | conditionType={}", cell.getId(), type);
                }
            }
            case TYPE_RTCHAT -> {
                action = ScenarioAction.HANDOVER;
                config = new HandoverConfig(cellRef(state.getNextNodeIn()), cellRef(state.getNextNodeOut()));
            }
            case TYPE_MAIL -> {
                action = ScenarioAction.MAIL;
                config = new MailConfig(state.getTo(), state.getCc(), state.getBcc(), state.getTitle(),
                        state.getContent(), cellRef(state.getNextNode()));
            }
            case TYPE_CSV -> {
                action = ScenarioAction.CSV;
                List<CsvColumn> columns = new ArrayList<>();
                for (RawCsvItem item : state.getCsvItems()) {
                    columns.add(new CsvColumn(item.getTitle(), item.getType(), item.getValue()));
                }
                config = new CsvConfig(state.getFileName(), columns, cellRef(state.getNextNode()));
            }
            default -> log.info("Classifier | unknown node type | cellId={} | nodeType={}", cell.getId(), cell.getNodeType());
        }

        return Optional.of(new ClassifiedNode(
                cell.getId(),
                cell.getNodeType(),
                triggerLabel(cell),
                responses,
                action,
                config,
                condition,
                names(state),
                cell.getZ(),
                cell.getEmbeds(),
                linkedTargets(cell, linkMap)));
    }

    private String triggerLabel(RawNodeCell cell) {
        RawNodeState state = cell.getState();
        if (TYPE_JOINT.equals(cell.getNodeType())) {
            String value = state.getConditionValue();
            return value != null && !value.isBlank() ? value : vocabulary.getDefaultOptionLabel();
        }
        if (TYPE_RESPONSE.equals(cell.getNodeType())) {
            if (state.nodeNameValue() != null) return state.nodeNameValue();
            if (state.memoryNameValue() != null) return state.memoryNameValue();
            return vocabulary.getDefaultNodeLabel();
        }
        return state.nodeNameValue() != null ? state.nodeNameValue() : cell.getNodeType();
    }

    private static List<String> names(RawNodeState state) {
        List<String> names = new ArrayList<>(2);
        if (state.nodeNameValue() != null) names.add(state.nodeNameValue());
        String memoryName = state.memoryNameValue();
        if (memoryName != null && !names.contains(memoryName)) names.add(memoryName);
        return names;
    }

    private static List<ResponseBlock> responseBlocks(RawNodeState state) {
        List<ResponseBlock> blocks = new ArrayList<>();
        for (RawResponseAdvance adv : state.getResponseAdvance()) {
            List<ReplyBranch> replies = new ArrayList<>();
            for (RawReply reply : adv.getReplies()) {
                replies.add(replyBranch(reply));
            }
            blocks.add(new ResponseBlock(
                    adv.isForm() ? ResponseBlock.Kind.FORM : ResponseBlock.Kind.TEXT,
                    adv.getResponseText(),
                    adv.getFormName(),
                    replies));
        }
        if (blocks.isEmpty() && state.getResponseText() != null && !state.getResponseText().isBlank()) {
            blocks.add(ResponseBlock.text(state.getResponseText()));
        }
        return blocks;
    }

    private static ReplyBranch replyBranch(RawReply reply) {
        String link = reply.getReplyLink();
        String value = reply.getReplyValue();
        String label = value != null && !value.isBlank() ? value : (link != null ? link : "");
        String type = reply.getReplyType() != null ? reply.getReplyType() : CONDITION_GO_TO;
        if (CONDITION_LINK.equals(type)) {
            return ReplyBranch.link(reply.getId(), label, link != null && !link.isBlank() ? link : value);
        }
        if (CONDITION_GO_TO.equals(type) && link != null && !link.isBlank()) {
            return ReplyBranch.jump(reply.getId(), label, link);
        }
        return ReplyBranch.button(reply.getId(), label);
    }

    private static List<String> linkedTargets(RawNodeCell cell, Map<String, List<String>> linkMap) {
        List<String> targets = new ArrayList<>(linkMap.getOrDefault(cell.getId(), List.of()));
        String next = cell.getState().getNextNode();
        if (next != null && !targets.contains(next)) {
            targets.add(next);
        }
        return targets;
    }

    private static SymbolRef cellRef(String cellId) {
        return cellId != null ? SymbolRef.byCellId(cellId) : null;
    }
}
