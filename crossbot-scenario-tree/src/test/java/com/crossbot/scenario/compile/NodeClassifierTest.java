package com.crossbot.scenario.compile;

import com.crossbot.graph.GraphIngestor;
import com.crossbot.graph.IngestedGraph;
import com.crossbot.graph.LinkResolver;
import com.crossbot.graph.RawNodeCell;
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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeClassifierTest {

    private final NodeClassifier classifier = new NodeClassifier(ClassifierVocabulary.defaults());

    private ClassifiedNode classifyOnly(String cellJson) {
        IngestedGraph graph = GraphIngestor.ingest("{ \"cells\": [" + cellJson + "] }");
        RawNodeCell cell = graph.getNodes().get(0);
        return classifier.classify(cell, LinkResolver.resolve(graph.getLinks())).orElseThrow();
    }

    @Test
    void startCellIsNotMaterialized() {
        IngestedGraph graph = GraphIngestor.ingest("""
                { "cells": [ { "id": "s", "type": "devs.Model", "nodeType": "dialogue.start", "state": { "next_node": "a" } } ] }
                """);
        assertTrue(classifier.classify(graph.getNodes().get(0), Map.of()).isEmpty());
    }

    @Test
    void responseNodeWithRepliesAndName() {
        ClassifiedNode node = classifyOnly("""
                { "id": "a", "type": "devs.Model", "nodeType": "dialogue.response", "z": 2,
                  "state": {
                    "node_name": { "checked": true, "name": "Menu" },
                    "memory": { "name": "menu_memory" },
                    "response_advance": [
                      { "response_text": "<p>Choose</p>", "response_type": "web_text",
                        "replies": [
                          { "id": "r1", "reply_value": "Prices", "reply_type": "button" },
                          { "id": "r2", "reply_value": "Docs", "reply_link": "https://example.com", "reply_type": "link" },
                          { "id": "r3", "reply_value": "Back", "reply_link": "Intro", "reply_type": "go_to" }
                        ] }
                    ]
                  } }
                """);

        assertEquals("Menu", node.getTriggerLabel());
        assertEquals(List.of("Menu", "menu_memory"), node.getNames());
        assertEquals(2, node.getOrder());
        assertEquals(ScenarioAction.NONE, node.getAction());
        assertEquals(1, node.getResponses().size());
        ResponseBlock block = node.getResponses().get(0);
        assertEquals(ResponseBlock.Kind.TEXT, block.getKind());
        assertEquals("<p>Choose</p>", block.getContent());

        List<ReplyBranch> replies = block.getReplies();
        assertEquals(ReplyBranch.Kind.BUTTON, replies.get(0).getKind());
        assertEquals("Prices", replies.get(0).getLabel());
        assertEquals(ReplyBranch.Kind.LINK, replies.get(1).getKind());
        assertEquals("https://example.com", replies.get(1).getUrl());
        assertEquals(ReplyBranch.Kind.JUMP, replies.get(2).getKind());
        assertEquals(SymbolRef.byName("Intro"), replies.get(2).getTarget());
    }

    @Test
    void responseLabelFallsBackToMemoryNameThenDefault() {
        assertEquals("memo", classifyOnly("""
                { "id": "a", "type": "devs.Model", "nodeType": "dialogue.response", "state": { "memory": { "name": "memo" } } }
                """).getTriggerLabel());
        assertEquals(ClassifierVocabulary.DEFAULT_NODE_LABEL, classifyOnly("""
                { "id": "a", "type": "devs.Model", "nodeType": "dialogue.response" }
                """).getTriggerLabel());
    }

    @Test
    void formBlockMakesFormAction() {
        ClassifiedNode node = classifyOnly("""
                { "id": "f", "type": "devs.Model", "nodeType": "dialogue.response",
                  "state": {
                    "memory": { "forms": ["name", "email"] },
                    "response_advance": [
                      { "response_text": "Intro", "response_type": "web_text" },
                      { "response_text": "Please fill in", "response_type": "web_form", "form_name": "contact" }
                    ]
                  } }
                """);
        assertEquals(ScenarioAction.FORM, node.getAction());
        FormConfig config = assertInstanceOf(FormConfig.class, node.getActionConfig());
        assertEquals("contact", config.getFormId());
        assertEquals(List.of("name", "email"), config.getFields());
        assertEquals(ResponseBlock.Kind.FORM, node.getResponses().get(1).getKind());
    }

    @Test
    void jointGoToStartIsRestart() {
        ClassifiedNode byLink = classifyOnly("""
                { "id": "j", "type": "devs.Model", "nodeType": "dialogue.joint",
                  "state": { "condition_type": "go_to", "condition_link": "START", "condition_value": "Back" } }
                """);
        assertEquals(ScenarioAction.RESTART, byLink.getAction());
        assertEquals("Back", byLink.getTriggerLabel());

        ClassifiedNode byLabel = classifyOnly("""
                { "id": "j", "type": "devs.Model", "nodeType": "dialogue.joint",
                  "state": { "condition_type": "go_to", "condition_value": "はじめに戻る" } }
                """);
        assertEquals(ScenarioAction.RESTART, byLabel.getAction());
    }

    @Test
    void jointGoToNameIsPendingJump() {
        ClassifiedNode node = classifyOnly("""
                { "id": "j", "type": "devs.Model", "nodeType": "dialogue.joint",
                  "state": { "condition_type": "go_to", "condition_link": "Pricing", "condition_value": "See prices" } }
                """);
        assertEquals(ScenarioAction.JUMP, node.getAction());
        JumpConfig config = assertInstanceOf(JumpConfig.class, node.getActionConfig());
        assertEquals(SymbolRef.byName("Pricing"), config.getTarget());
    }

    @Test
    void buttonWithOperatorKeywordIsHandover() {
        ClassifiedNode node = classifyOnly("""
                { "id": "j", "type": "devs.Model", "nodeType": "dialogue.joint",
                  "state": { "condition_type": "button", "condition_value": "オペレーターに相談する" } }
                """);
        assertEquals(ScenarioAction.HANDOVER, node.getAction());
        assertInstanceOf(HandoverConfig.class, node.getActionConfig());

        ClassifiedNode plain = classifyOnly("""
                { "id": "j", "type": "devs.Model", "nodeType": "dialogue.joint",
                  "state": { "condition_type": "button", "condition_value": "Prices" } }
                """);
        assertEquals(ScenarioAction.NONE, plain.getAction());
    }

    @Test
    void jointLinkUsesConditionLinkOrTarget() {
        ClassifiedNode node = classifyOnly("""
                { "id": "j", "type": "devs.Model", "nodeType": "dialogue.joint",
                  "state": { "condition_type": "link", "condition_value": "Docs", "condition_link_target": "https://docs" } }
                """);
        assertEquals(ScenarioAction.LINK, node.getAction());
        assertEquals("https://docs", ((LinkConfig) node.getActionConfig()).getUrl());
    }

    @Test
    void outcomeJointsCarryConditionsOnly() {
        assertEquals(BranchCondition.ON_SUCCESS, classifyOnly(joint("in")).getCondition());
        assertEquals(BranchCondition.ON_FAILURE, classifyOnly(joint("out")).getCondition());
        assertEquals(BranchCondition.UNCONDITIONAL, classifyOnly(joint("all")).getCondition());
        ClassifiedNode submit = classifyOnly(joint("submit_form"));
        assertEquals(BranchCondition.AFTER_FORM_SUBMIT, submit.getCondition());
        assertEquals(ScenarioAction.NONE, submit.getAction());
    }

    private static String joint(String conditionType) {
        return "{ \"id\": \"j\", \"type\": \"devs.Model\", \"nodeType\": \"dialogue.joint\", "
                + "\"state\": { \"condition_type\": \"" + conditionType + "\" } }";
    }

    @Test
    void systemNodesCarryPendingCellReferences() {
        ClassifiedNode rtchat = classifyOnly("""
                { "id": "h", "type": "devs.Model", "nodeType": "system.rtchat",
                  "state": { "next_node_in": "ok", "next_node_out": "ng" } }
                """);
        HandoverConfig handover = (HandoverConfig) rtchat.getActionConfig();
        assertEquals(SymbolRef.byCellId("ok"), handover.getOnAccept());
        assertEquals(SymbolRef.byCellId("ng"), handover.getOnReject());
        assertEquals("system.rtchat", rtchat.getTriggerLabel());

        ClassifiedNode mail = classifyOnly("""
                { "id": "m", "type": "devs.Model", "nodeType": "system.mail",
                  "state": { "to": "a@example.com", "cc": "b@example.com", "title": "Inquiry", "content": "Body", "next_node": "after" } }
                """);
        MailConfig mailConfig = (MailConfig) mail.getActionConfig();
        assertEquals("a@example.com", mailConfig.getTo());
        assertEquals("Inquiry", mailConfig.getSubject());
        assertNull(mailConfig.getBcc());
        assertEquals(SymbolRef.byCellId("after"), mailConfig.getContinuation());
        assertEquals(List.of("after"), mail.getLinkedTargetIds());

        ClassifiedNode csv = classifyOnly("""
                { "id": "c", "type": "devs.Model", "nodeType": "system.csv",
                  "state": { "file_name": "answers.csv",
                             "csv_items": [ { "csv_title": "Name", "csv_type": "text", "csv_value": "-" } ] } }
                """);
        CsvConfig csvConfig = (CsvConfig) csv.getActionConfig();
        assertEquals("answers.csv", csvConfig.getFileName());
        assertEquals("Name", csvConfig.getColumns().get(0).getLabel());
        assertEquals("-", csvConfig.getColumns().get(0).getDefaultValue());
        assertNull(csvConfig.getContinuation());
    }

    @Test
    void unknownTypeDegradesToNoAction() {
        ClassifiedNode node = classifyOnly("""
                { "id": "u", "type": "devs.Model", "nodeType": "system.unknown", "state": { "response_text": "hi" } }
                """);
        assertEquals(ScenarioAction.NONE, node.getAction());
        assertEquals("system.unknown", node.getTriggerLabel());
        assertEquals("hi", node.getResponses().get(0).getContent());
    }

    @Test
    void linkedTargetsIncludeNextNodeOnce() {
        IngestedGraph graph = GraphIngestor.ingest("""
                { "cells": [
                  { "id": "a", "type": "devs.Model", "nodeType": "dialogue.response", "embeds": ["e"], "state": { "next_node": "b" } },
                  { "id": "l1", "type": "devs.Link", "source": { "id": "a" }, "target": { "id": "b" } },
                  { "id": "l2", "type": "devs.Link", "source": { "id": "a" }, "target": { "id": "c" } }
                ] }
                """);
        ClassifiedNode node = classifier.classify(graph.getNodes().get(0), LinkResolver.resolve(graph.getLinks())).orElseThrow();
        assertEquals(List.of("b", "c"), node.getLinkedTargetIds());
        assertEquals(List.of("e"), node.getEmbeddedChildIds());
    }
}
