package com.crossbot.scenario.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Selectable continuation attached to a response block: a plain button, an external link (url)
 * or a jump to a named node (target).
 */
public final class ReplyBranch {

    public enum Kind {
        BUTTON,
        LINK,
        JUMP
    }

    private final String id;
    private final String label;
    private final Kind kind;
    private final String url;
    private final SymbolRef target;

    @JsonCreator
    public ReplyBranch(
            @JsonProperty("id") String id,
            @JsonProperty("label") String label,
            @JsonProperty("kind") Kind kind,
            @JsonProperty("url") String url,
            @JsonProperty("target") SymbolRef target) {
        this.id = id;
        this.label = label != null ? label : "";
        this.kind = kind != null ? kind : Kind.BUTTON;
        this.url = url;
        this.target = target;
    }

    public static ReplyBranch button(String id, String label) {
        return new ReplyBranch(id, label, Kind.BUTTON, null, null);
    }

    public static ReplyBranch link(String id, String label, String url) {
        return new ReplyBranch(id, label, Kind.LINK, url, null);
    }

    public static ReplyBranch jump(String id, String label, String targetName) {
        return new ReplyBranch(id, label, Kind.JUMP, null, SymbolRef.byName(targetName));
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public Kind getKind() {
        return kind;
    }

    public String getUrl() {
        return url;
    }

    /** Jump target; null unless {@link Kind#JUMP}. */
    public SymbolRef getTarget() {
        return target;
    }

    public ReplyBranch withTarget(UnaryOperator<SymbolRef> mapper) {
        if (target == null) return this;
        return new ReplyBranch(id, label, kind, url, mapper.apply(target));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReplyBranch)) return false;
        ReplyBranch that = (ReplyBranch) o;
        return Objects.equals(id, that.id) && label.equals(that.label) && kind == that.kind
                && Objects.equals(url, that.url) && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, kind, url, target);
    }
}
