package com.crossbot.runtime;

import com.crossbot.scenario.action.ActionConfig;
import com.crossbot.scenario.action.HandoverConfig;
import com.crossbot.scenario.action.JumpConfig;
import com.crossbot.scenario.action.LinkConfig;
import com.crossbot.scenario.action.MailConfig;
import com.crossbot.scenario.compile.ScenarioCompiler;
import com.crossbot.scenario.tree.BranchCondition;
import com.crossbot.scenario.tree.CompiledNode;
import com.crossbot.scenario.tree.CompiledScenario;
import com.crossbot.scenario.tree.ReplyBranch;
import com.crossbot.scenario.tree.ResponseBlock;
import com.crossbot.scenario.tree.ScenarioAction;
import com.crossbot.scenario.tree.SymbolRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuntimeTraversalTest {

    private final RuntimeTraversal traversal = RuntimeTraversal.withDefaults();

    private static final String START_A_B = """
            { "cells": [
              { "id": "start", "type": "devs.Model", "nodeType": "dialogue.start", "state": { "next_node": "a" } },
              { "id": "a", "type": "devs.Model", "nodeType": "dialogue.response", "z": 0,
                "state": { "node_name": { "name": "A" }, "response_text": "text of A" } },
              { "id": "b", "type": "devs.Model", "nodeType": "dialogue.response", "z": 0,
                "state": { "node_name": { "name": "B" }, "response_text": "text of B" } },
              { "id": "l1", "type": "devs.Link", "source": { "id": "a" }, "target": { "id": "b" } }
            ] }
            """;

    private static final String HANDOVER_MENU = """
            { "cells": [
              { "id": "start", "type": "devs.Model", "nodeType": "dialogue.start", "state": { "next_node": "menu" } },
              { "id": "menu", "type": "devs.Model", "nodeType": "dialogue.response", "z": 0, "embeds": ["j1", "j2"],
                "state": { "node_name": { "name": "Menu" }, "response_text": "How can we help?" } },
              { "id": "j1", "type": "devs.Model", "nodeType": "dialogue.joint", "z": 1,
                "state": { "condition_type": "button", "condition_value": "オペレーターと話す" } },
              { "id": "j2", "type": "devs.Model", "nodeType": "dialogue.joint", "z": 2,
                "state": { "condition_type": "button", "condition_value": "FAQ" } }
            ] }
            """;

    private static CompiledNode node(int id, Integer parent, String label, ScenarioAction action, ActionConfig config,
                                     BranchCondition condition, List<ResponseBlock> responses, Integer... children) {
        return new CompiledNode(id, "n" + id, parent == null ? 0 : 1, id, null, label, responses, action, config,
                condition, parent, List.of(children));
    }

    private static List<ResponseBlock> text(String s) {
        return List.of(ResponseBlock.text(s));
    }

    @Test
    void selectingAOffersBOnlyAndBIsALeaf() {
        CompiledScenario scenario = ScenarioCompiler.withDefaults().compileGraph(START_A_B).getScenario();

        ScenarioReply a = traversal.select(scenario, Selection.node(0));
        assertEquals("text of A", a.getMessages().get(0).getContent());
        assertEquals(List.of(ReplyOption.button(1, "B")), a.getOptions());

        ScenarioReply b = traversal.select(scenario, Selection.node(1));
        assertEquals("text of B", b.getMessages().get(0).getContent());
        assertEquals(1, b.getOptions().size());
        assertEquals(ReplyOption.Kind.RESTART, b.getOptions().get(0).getKind());
        assertEquals(RuntimeMessages.DEFAULT_RETURN_LABEL, b.getOptions().get(0).getLabel());
        assertFalse(b.isHandover());
    }

    @Test
    void singleRootRestartShowsRootAndItsChildren() {
        CompiledScenario scenario = ScenarioCompiler.withDefaults().compileGraph(START_A_B).getScenario();

        ScenarioReply reply = traversal.initialOptions(scenario);

        assertEquals(0, reply.getNodeId());
        assertEquals("text of A", reply.getMessages().get(0).getContent());
        assertEquals(List.of(ReplyOption.button(1, "B")), reply.getOptions());
    }

    @Test
    void handoverKeywordButtonSignalsHandoverWithoutOptions() {
        CompiledScenario scenario = ScenarioCompiler.withDefaults().compileGraph(HANDOVER_MENU).getScenario();
        CompiledNode operator = scenario.children(0).get(0);
        assertEquals(ScenarioAction.HANDOVER, operator.getAction());

        ScenarioReply reply = traversal.select(scenario, Selection.node(operator.getId()));

        assertTrue(reply.isHandover());
        assertTrue(reply.getOptions().isEmpty());
        assertEquals(ScenarioAction.HANDOVER, reply.getAction());
        assertEquals(RuntimeMessages.DEFAULT_HANDOVER_NOTICE, reply.getMessages().get(0).getContent());
    }

    @Test
    void severalRootsGetTheWelcomeMessage() {
        CompiledScenario scenario = new CompiledScenario(List.of(
                node(0, null, "Orders", ScenarioAction.NONE, null, null, text("orders")),
                node(1, null, "Manual", ScenarioAction.LINK, new LinkConfig("https://example.com"), null, List.of())
        ), List.of(0, 1));

        ScenarioReply reply = traversal.select(scenario, Selection.restart());

        assertNull(reply.getNodeId());
        assertEquals(RuntimeMessages.DEFAULT_WELCOME, reply.getMessages().get(0).getContent());
        assertEquals(ReplyOption.button(0, "Orders"), reply.getOptions().get(0));
        assertEquals(ReplyOption.link(1, "Manual", "https://example.com"), reply.getOptions().get(1));
    }

    @Test
    void emptyScenarioGivesEmptyReply() {
        ScenarioReply reply = traversal.initialOptions(CompiledScenario.empty());
        assertTrue(reply.getMessages().isEmpty());
        assertTrue(reply.getOptions().isEmpty());
    }

    @Test
    void unknownNodeIsNotFound() {
        CompiledScenario scenario = ScenarioCompiler.withDefaults().compileGraph(START_A_B).getScenario();
        NodeNotFoundException e = assertThrows(NodeNotFoundException.class, () -> traversal.select(scenario, Selection.node(42)));
        assertEquals(42, e.getNodeId());
    }

    @Test
    void outcomeOnlyChildrenAreNotOffered() {
        CompiledScenario scenario = new CompiledScenario(List.of(
                node(0, null, "Operator", ScenarioAction.NONE, null, null, text("menu"), 1, 2, 3),
                node(1, 0, "Accepted", ScenarioAction.NONE, null, BranchCondition.ON_SUCCESS, text("ok")),
                node(2, 0, "Declined", ScenarioAction.NONE, null, BranchCondition.ON_FAILURE, text("sorry")),
                node(3, 0, "Anything", ScenarioAction.NONE, null, BranchCondition.UNCONDITIONAL, text("any"))
        ), List.of(0));

        ScenarioReply reply = traversal.select(scenario, Selection.node(0));

        assertEquals(List.of(ReplyOption.button(3, "Anything")), reply.getOptions());
    }

    @Test
    void jumpFollowsResolvedTargetAndGuardsLoops() {
        CompiledScenario scenario = new CompiledScenario(List.of(
                node(0, null, "Go", ScenarioAction.JUMP, new JumpConfig(SymbolRef.byName("T").resolvedTo(1)), null, List.of()),
                node(1, null, "Target", ScenarioAction.NONE, null, null, text("target text")),
                node(2, null, "Home", ScenarioAction.JUMP, new JumpConfig(SymbolRef.byName("START").asRestart()), null, List.of()),
                node(3, null, "Lost", ScenarioAction.JUMP, new JumpConfig(SymbolRef.byName("x").asUnresolved()), null, text("lost")),
                node(4, null, "Loop", ScenarioAction.JUMP, new JumpConfig(SymbolRef.byName("L").resolvedTo(4)), null, text("loop"))
        ), List.of(0, 1, 2, 3, 4));

        ScenarioReply followed = traversal.select(scenario, Selection.node(0));
        assertEquals(1, followed.getNodeId());
        assertEquals("target text", followed.getMessages().get(0).getContent());

        assertEquals(RuntimeMessages.DEFAULT_WELCOME, traversal.select(scenario, Selection.node(2)).getMessages().get(0).getContent());

        ScenarioReply lost = traversal.select(scenario, Selection.node(3));
        assertEquals(3, lost.getNodeId());
        assertEquals(ReplyOption.Kind.RESTART, lost.getOptions().get(0).getKind());

        ScenarioReply loop = traversal.select(scenario, Selection.node(4));
        assertEquals(4, loop.getNodeId());
        assertEquals("loop", loop.getMessages().get(0).getContent());
    }

    @Test
    void dropOffEndsWithoutOptions() {
        CompiledScenario scenario = new CompiledScenario(List.of(
                node(0, null, "Bye", ScenarioAction.DROP_OFF, null, null, text("see you"))), List.of(0));

        ScenarioReply reply = traversal.select(scenario, Selection.node(0));

        assertEquals(ScenarioAction.DROP_OFF, reply.getAction());
        assertTrue(reply.getOptions().isEmpty());
    }

    @Test
    void unmatchedReplyBranchesBecomeOptions() {
        ResponseBlock block = ResponseBlock.text("choose").withReplies(List.of(
                ReplyBranch.button("r0", "Child"),
                new ReplyBranch("r1", "Elsewhere", ReplyBranch.Kind.JUMP, null, SymbolRef.byName("E").resolvedTo(2)),
                ReplyBranch.link("r2", "Website", "https://example.com")));
        CompiledScenario scenario = new CompiledScenario(List.of(
                node(0, null, "Menu", ScenarioAction.NONE, null, null, List.of(block), 1),
                node(1, 0, "Child", ScenarioAction.NONE, null, null, text("child")),
                node(2, null, "Else", ScenarioAction.NONE, null, null, text("else"))
        ), List.of(0, 2));

        List<ReplyOption> options = traversal.select(scenario, Selection.node(0)).getOptions();

        assertEquals(List.of(
                ReplyOption.button(1, "Child"),
                ReplyOption.button(2, "Elsewhere"),
                ReplyOption.link(null, "Website", "https://example.com")), options);
    }

    @Test
    void mailWithContinuationLeavesContinuingToCaller() {
        CompiledScenario scenario = new CompiledScenario(List.of(
                node(0, null, "Send", ScenarioAction.MAIL,
                        new MailConfig("ops@example.com", null, null, "s", "b", SymbolRef.byCellId("n1").resolvedTo(1)),
                        null, text("sending")),
                node(1, null, "Thanks", ScenarioAction.NONE, null, null, text("thanks"))
        ), List.of(0, 1));

        ScenarioReply reply = traversal.select(scenario, Selection.node(0));
        assertEquals(ScenarioAction.MAIL, reply.getAction());
        assertTrue(reply.getOptions().isEmpty());

        ScenarioReply next = traversal.continueAfter(scenario, 0, ActionOutcome.SUCCEEDED);
        assertEquals(1, next.getNodeId());
    }

    @Test
    void continueAfterHandoverUsesOutcome() {
        CompiledScenario scenario = new CompiledScenario(List.of(
                node(0, null, "Operator", ScenarioAction.HANDOVER,
                        new HandoverConfig(SymbolRef.byCellId("n1").resolvedTo(1), null), null, List.of(), 1, 2),
                node(1, 0, "Connected", ScenarioAction.NONE, null, BranchCondition.ON_SUCCESS, text("connected")),
                node(2, 0, "Busy", ScenarioAction.NONE, null, BranchCondition.ON_FAILURE, text("busy"))
        ), List.of(0));

        assertEquals(1, traversal.continueAfter(scenario, 0, ActionOutcome.SUCCEEDED).getNodeId());
        assertEquals(2, traversal.continueAfter(scenario, 0, ActionOutcome.FAILED).getNodeId());
        assertEquals(0, traversal.continueAfter(scenario, 0, ActionOutcome.COMPLETED).getNodeId());
        assertThrows(NodeNotFoundException.class, () -> traversal.continueAfter(scenario, 9, ActionOutcome.FAILED));
    }

    @Test
    void continueAfterFormSubmitPicksMatchingChild() {
        CompiledScenario scenario = new CompiledScenario(List.of(
                node(0, null, "Form", ScenarioAction.FORM, null, null, text("fill in"), 1),
                node(1, 0, "Submitted", ScenarioAction.NONE, null, BranchCondition.AFTER_FORM_SUBMIT, text("thanks"))
        ), List.of(0));

        assertEquals(1, traversal.continueAfter(scenario, 0, ActionOutcome.COMPLETED).getNodeId());
    }

    @Test
    void selectionParsesSentinelAndIds() {
        assertTrue(Selection.parse("START", "START").isRestart());
        assertTrue(Selection.parse(null, "START").isRestart());
        assertEquals(7, Selection.parse(" 7 ", "START").getNodeId());
        assertThrows(IllegalArgumentException.class, () -> Selection.parse("seven", "START"));
    }
}
