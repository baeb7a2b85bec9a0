package com.crossbot.graph.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Free-form {@code state} object of a node cell. Which fields are meaningful depends on the node type:
 * <ul>
 *   <li>{@code dialogue.start} – next_node</li>
 *   <li>{@code dialogue.response} – response_text, response_advance, memory, node_name</li>
 *   <li>{@code dialogue.joint} – condition_type, condition_value, condition_link, condition_link_target</li>
 *   <li>{@code system.rtchat} – next_node_in, next_node_out</li>
 *   <li>{@code system.mail} – to, cc, bcc, title, content, next_node</li>
 *   <li>{@code system.csv} – file_name, csv_items, next_node</li>
 * </ul>
 * Unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RawNodeState {

    private static final RawNodeState EMPTY = new RawNodeState(null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null, null, null);

    private final String nextNode;
    private final String responseText;
    private final List<RawResponseAdvance> responseAdvance;
    private final RawMemory memory;
    private final RawNodeName nodeName;
    private final String conditionType;
    private final String conditionValue;
    private final String conditionLink;
    private final String conditionLinkTarget;
    private final String nextNodeIn;
    private final String nextNodeOut;
    private final String to;
    private final String cc;
    private final String bcc;
    private final String title;
    private final String content;
    private final String fileName;
    private final List<RawCsvItem> csvItems;

    @JsonCreator
    public RawNodeState(
            @JsonProperty("next_node") String nextNode,
            @JsonProperty("response_text") String responseText,
            @JsonProperty("response_advance") List<RawResponseAdvance> responseAdvance,
            @JsonProperty("memory") RawMemory memory,
            @JsonProperty("node_name") RawNodeName nodeName,
            @JsonProperty("condition_type") String conditionType,
            @JsonProperty("condition_value") String conditionValue,
            @JsonProperty("condition_link") String conditionLink,
            @JsonProperty("condition_link_target") String conditionLinkTarget,
            @JsonProperty("next_node_in") String nextNodeIn,
            @JsonProperty("next_node_out") String nextNodeOut,
            @JsonProperty("to") String to,
            @JsonProperty("cc") String cc,
            @JsonProperty("bcc") String bcc,
            @JsonProperty("title") String title,
            @JsonProperty("content") String content,
            @JsonProperty("file_name") String fileName,
            @JsonProperty("csv_items") List<RawCsvItem> csvItems) {
        this.nextNode = blankToNull(nextNode);
        this.responseText = responseText;
        this.responseAdvance = responseAdvance != null ? responseAdvance.stream().filter(Objects::nonNull).toList() : List.of();
        this.memory = memory;
        this.nodeName = nodeName;
        this.conditionType = conditionType;
        this.conditionValue = conditionValue;
        this.conditionLink = blankToNull(conditionLink);
        this.conditionLinkTarget = blankToNull(conditionLinkTarget);
        this.nextNodeIn = blankToNull(nextNodeIn);
        this.nextNodeOut = blankToNull(nextNodeOut);
        this.to = to;
        this.cc = cc;
        this.bcc = bcc;
        this.title = title;
        this.content = content;
        this.fileName = fileName;
        this.csvItems = csvItems != null ? csvItems.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public static RawNodeState empty() {
        return EMPTY;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    public String getNextNode() {
        return nextNode;
    }

    public String getResponseText() {
        return responseText;
    }

    public List<RawResponseAdvance> getResponseAdvance() {
        return responseAdvance;
    }

    public RawMemory getMemory() {
        return memory;
    }

    public RawNodeName getNodeName() {
        return nodeName;
    }

    /** {@code node_name.name}, or null. */
    public String nodeNameValue() {
        return nodeName != null ? blankToNull(nodeName.getName()) : null;
    }

    /** {@code memory.name}, or null. */
    public String memoryNameValue() {
        return memory != null ? blankToNull(memory.getName()) : null;
    }

    public String getConditionType() {
        return conditionType;
    }

    public String getConditionValue() {
        return conditionValue;
    }

    public String getConditionLink() {
        return conditionLink;
    }

    public String getConditionLinkTarget() {
        return conditionLinkTarget;
    }

    public String getNextNodeIn() {
        return nextNodeIn;
    }

    public String getNextNodeOut() {
        return nextNodeOut;
    }

    public String getTo() {
        return to;
    }

    public String getCc() {
        return cc;
    }

    public String getBcc() {
        return bcc;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public String getFileName() {
        return fileName;
    }

    public List<RawCsvItem> getCsvItems() {
        return csvItems;
    }
}
