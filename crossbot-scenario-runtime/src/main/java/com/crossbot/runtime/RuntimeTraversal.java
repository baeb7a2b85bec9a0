package com.crossbot.runtime;

import com.crossbot.scenario.action.CsvConfig;
import com.crossbot.scenario.action.HandoverConfig;
import com.crossbot.scenario.action.JumpConfig;
import com.crossbot.scenario.action.LinkConfig;
import com.crossbot.scenario.action.MailConfig;
import com.crossbot.scenario.tree.BranchCondition;
import com.crossbot.scenario.tree.CompiledNode;
import com.crossbot.scenario.tree.CompiledScenario;
import com.crossbot.scenario.tree.ReplyBranch;
import com.crossbot.scenario.tree.ResponseBlock;
import com.crossbot.scenario.tree.ScenarioAction;
import com.crossbot.scenario.tree.SymbolRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Answers a user selection from a compiled scenario. Stateless and read-only: the scenario is never
 * changed and the caller owns the session.
 */
public final class RuntimeTraversal {

    private static final Logger log = LoggerFactory.getLogger(RuntimeTraversal.class);

    private final RuntimeMessages messages;

    public RuntimeTraversal(RuntimeMessages messages) {
        this.messages = Objects.requireNonNull(messages, "messages");
    }

    public static RuntimeTraversal withDefaults() {
        return new RuntimeTraversal(RuntimeMessages.defaults());
    }

    public RuntimeMessages getMessages() {
        return messages;
    }

    /** Same as selecting the restart sentinel. */
    public ScenarioReply initialOptions(CompiledScenario scenario) {
        return restart(scenario);
    }

    /**
     * @throws NodeNotFoundException when the selection names an id the scenario does not contain
     */
    public ScenarioReply select(CompiledScenario scenario, Selection selection) {
        if (selection.isRestart()) return restart(scenario);
        CompiledNode node = require(scenario, selection.getNodeId());
        ScenarioReply reply = replyFor(scenario, node, new HashSet<>());
        if (log.isDebugEnabled()) {
            log.debug("RuntimeTraversal | selected | nodeId={} | action={} | options={}",
                    node.getId(), reply.getAction(), reply.getOptions().size());
        }
        return reply;
    }

    /**
     * Continues after the caller finished the action of {@code nodeId}. An explicit continuation wins,
     * then the first child whose condition matches the outcome, then the scenario start.
     *
     * @throws NodeNotFoundException when {@code nodeId} is not in the scenario
     */
    public ScenarioReply continueAfter(CompiledScenario scenario, int nodeId, ActionOutcome outcome) {
        CompiledNode node = require(scenario, nodeId);
        SymbolRef continuation = explicitContinuation(node, outcome);
        if (continuation != null && continuation.isResolved()) {
            return replyFor(scenario, require(scenario, continuation.getNodeId()), new HashSet<>());
        }
        if (continuation != null && continuation.isRestart()) {
            return restart(scenario);
        }
        for (CompiledNode child : scenario.children(nodeId)) {
            if (matches(child.getCondition(), outcome)) {
                return replyFor(scenario, child, new HashSet<>());
            }
        }
        log.debug("RuntimeTraversal | no continuation, restarting | nodeId={} | outcome={}", nodeId, outcome);
        return restart(scenario);
    }

    private ScenarioReply restart(CompiledScenario scenario) {
        List<CompiledNode> roots = scenario.roots();
        if (roots.isEmpty()) return ScenarioReply.empty();
        if (roots.size() == 1) {
            CompiledNode root = roots.get(0);
            return new ScenarioReply(root.getId(), root.getResponses(), childOptions(scenario, root), root.getAction(),
                    root.getActionConfig(), false);
        }
        List<ReplyOption> options = new ArrayList<>(roots.size());
        for (CompiledNode root : roots) {
            if (!root.getCondition().isOutcomeOnly()) options.add(optionFor(root));
        }
        return new ScenarioReply(null, List.of(ResponseBlock.text(messages.getWelcomeMessage())), options,
                ScenarioAction.NONE, null, false);
    }

    private ScenarioReply replyFor(CompiledScenario scenario, CompiledNode node, Set<Integer> visited) {
        switch (node.getAction()) {
            case HANDOVER -> {
                List<ResponseBlock> blocks = node.getResponses().isEmpty()
                        ? List.of(ResponseBlock.text(messages.getHandoverNotice()))
                        : node.getResponses();
                return new ScenarioReply(node.getId(), blocks, List.of(), node.getAction(), node.getActionConfig(), true);
            }
            case RESTART -> {
                return restart(scenario);
            }
            case JUMP -> {
                SymbolRef target = node.getActionConfig() instanceof JumpConfig jump ? jump.getTarget() : null;
                if (target != null && visited.add(node.getId())) {
                    if (target.isRestart()) return restart(scenario);
                    if (target.isResolved()) {
                        Optional<CompiledNode> next = scenario.findNode(target.getNodeId());
                        if (next.isPresent()) return replyFor(scenario, next.get(), visited);
                    }
                }
                log.debug("RuntimeTraversal | jump not followed | nodeId={} | target={}", node.getId(), target);
                return leaf(node);
            }
            case DROP_OFF -> {
                return new ScenarioReply(node.getId(), node.getResponses(), List.of(), node.getAction(),
                        node.getActionConfig(), false);
            }
            default -> {
                List<ReplyOption> options = childOptions(scenario, node);
                if (!options.isEmpty()) {
                    return new ScenarioReply(node.getId(), node.getResponses(), options, node.getAction(),
                            node.getActionConfig(), false);
                }
                SymbolRef continuation = explicitContinuation(node, ActionOutcome.SUCCEEDED);
                if ((node.getAction() == ScenarioAction.MAIL || node.getAction() == ScenarioAction.CSV)
                        && continuation != null && (continuation.isResolved() || continuation.isRestart())) {
                    return new ScenarioReply(node.getId(), node.getResponses(), List.of(), node.getAction(),
                            node.getActionConfig(), false);
                }
                return leaf(node);
            }
        }
    }

    private ScenarioReply leaf(CompiledNode node) {
        return new ScenarioReply(node.getId(), node.getResponses(), List.of(ReplyOption.restart(messages.getReturnLabel())),
                node.getAction(), node.getActionConfig(), false);
    }

    /** Selectable children, then reply branches that do not duplicate a child label. */
    private static List<ReplyOption> childOptions(CompiledScenario scenario, CompiledNode node) {
        List<ReplyOption> options = new ArrayList<>();
        Set<String> labels = new HashSet<>();
        for (CompiledNode child : scenario.children(node.getId())) {
            if (child.getCondition().isOutcomeOnly()) continue;
            options.add(optionFor(child));
            labels.add(child.getTriggerLabel());
        }
        for (ReplyBranch reply : node.getReplies()) {
            if (labels.contains(reply.getLabel())) continue;
            if (reply.getKind() == ReplyBranch.Kind.LINK && reply.getUrl() != null) {
                options.add(ReplyOption.link(null, reply.getLabel(), reply.getUrl()));
                labels.add(reply.getLabel());
            } else if (reply.getKind() == ReplyBranch.Kind.JUMP && reply.getTarget() != null) {
                SymbolRef target = reply.getTarget();
                if (target.isResolved()) {
                    options.add(ReplyOption.button(target.getNodeId(), reply.getLabel()));
                    labels.add(reply.getLabel());
                } else if (target.isRestart()) {
                    options.add(ReplyOption.restart(reply.getLabel()));
                    labels.add(reply.getLabel());
                }
            }
        }
        return options;
    }

    private static ReplyOption optionFor(CompiledNode node) {
        if (node.getAction() == ScenarioAction.LINK && node.getActionConfig() instanceof LinkConfig link) {
            return ReplyOption.link(node.getId(), node.getTriggerLabel(), link.getUrl());
        }
        return ReplyOption.button(node.getId(), node.getTriggerLabel());
    }

    private static SymbolRef explicitContinuation(CompiledNode node, ActionOutcome outcome) {
        if (node.getActionConfig() instanceof MailConfig mail) return mail.getContinuation();
        if (node.getActionConfig() instanceof CsvConfig csv) return csv.getContinuation();
        if (node.getActionConfig() instanceof HandoverConfig handover) {
            return switch (outcome) {
                case SUCCEEDED -> handover.getOnAccept();
                case FAILED -> handover.getOnReject();
                case COMPLETED -> null;
            };
        }
        return null;
    }

    private static boolean matches(BranchCondition condition, ActionOutcome outcome) {
        return switch (condition) {
            case UNCONDITIONAL -> true;
            case ON_SUCCESS -> outcome == ActionOutcome.SUCCEEDED;
            case ON_FAILURE -> outcome == ActionOutcome.FAILED;
            case AFTER_FORM_SUBMIT -> outcome == ActionOutcome.COMPLETED;
            case NONE -> false;
        };
    }

    private static CompiledNode require(CompiledScenario scenario, int nodeId) {
        return scenario.findNode(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }
}
