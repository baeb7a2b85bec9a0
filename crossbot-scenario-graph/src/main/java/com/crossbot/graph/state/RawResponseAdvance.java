package com.crossbot.graph.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One block of a response node: rich text ({@code web_text}) or a form prompt ({@code web_form}) plus replies.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RawResponseAdvance {

    public static final String TYPE_TEXT = "web_text";
    public static final String TYPE_FORM = "web_form";

    private final String responseText;
    private final String responseType;
    private final String formName;
    private final List<RawReply> replies;

    @JsonCreator
    public RawResponseAdvance(
            @JsonProperty("response_text") String responseText,
            @JsonProperty("response_type") String responseType,
            @JsonProperty("form_name") String formName,
            @JsonProperty("replies") List<RawReply> replies) {
        this.responseText = responseText;
        this.responseType = responseType;
        this.formName = formName;
        this.replies = replies != null ? replies.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public String getResponseText() {
        return responseText;
    }

    public String getResponseType() {
        return responseType;
    }

    public boolean isForm() {
        return TYPE_FORM.equals(responseType);
    }

    public String getFormName() {
        return formName;
    }

    public List<RawReply> getReplies() {
        return replies;
    }
}
