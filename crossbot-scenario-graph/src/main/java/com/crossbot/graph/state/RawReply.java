package com.crossbot.graph.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One reply button inside a response block. {@code reply_type} is {@code go_to}, {@code button} or {@code link}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RawReply {

    private final String id;
    private final String replyLink;
    private final String replyValue;
    private final String replyType;

    @JsonCreator
    public RawReply(
            @JsonProperty("id") String id,
            @JsonProperty("reply_link") String replyLink,
            @JsonProperty("reply_value") String replyValue,
            @JsonProperty("reply_type") String replyType) {
        this.id = id;
        this.replyLink = replyLink;
        this.replyValue = replyValue;
        this.replyType = replyType;
    }

    public String getId() {
        return id;
    }

    /** URL for link replies, target node name for go_to replies. */
    public String getReplyLink() {
        return replyLink;
    }

    public String getReplyValue() {
        return replyValue;
    }

    public String getReplyType() {
        return replyType;
    }
}
