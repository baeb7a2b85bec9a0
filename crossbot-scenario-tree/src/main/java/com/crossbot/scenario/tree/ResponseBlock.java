package com.crossbot.scenario.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One ordered segment of a node's message. TEXT and FORM carry rich text in {@code content};
 * IMAGE carries the image URL.
 */
public final class ResponseBlock {

    public enum Kind {
        TEXT,
        IMAGE,
        FORM
    }

    private final Kind kind;
    private final String content;
    private final String formName;
    private final List<ReplyBranch> replies;

    @JsonCreator
    public ResponseBlock(
            @JsonProperty("kind") Kind kind,
            @JsonProperty("content") String content,
            @JsonProperty("formName") String formName,
            @JsonProperty("replies") List<ReplyBranch> replies) {
        this.kind = kind != null ? kind : Kind.TEXT;
        this.content = content != null ? content : "";
        this.formName = formName;
        this.replies = replies != null ? List.copyOf(replies) : List.of();
    }

    public static ResponseBlock text(String content) {
        return new ResponseBlock(Kind.TEXT, content, null, List.of());
    }

    public static ResponseBlock image(String url) {
        return new ResponseBlock(Kind.IMAGE, url, null, List.of());
    }

    public Kind getKind() {
        return kind;
    }

    public String getContent() {
        return content;
    }

    public String getFormName() {
        return formName;
    }

    public List<ReplyBranch> getReplies() {
        return replies;
    }

    public ResponseBlock withReplies(List<ReplyBranch> newReplies) {
        return new ResponseBlock(kind, content, formName, newReplies);
    }

    /** Returns a copy whose jump targets are mapped; unchanged when there are no jump replies. */
    public ResponseBlock mapJumpTargets(UnaryOperator<SymbolRef> mapper) {
        if (replies.stream().noneMatch(r -> r.getTarget() != null)) return this;
        return withReplies(replies.stream().map(r -> r.withTarget(mapper)).toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponseBlock)) return false;
        ResponseBlock that = (ResponseBlock) o;
        return kind == that.kind && content.equals(that.content) && Objects.equals(formName, that.formName)
                && replies.equals(that.replies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, content, formName, replies);
    }
}
