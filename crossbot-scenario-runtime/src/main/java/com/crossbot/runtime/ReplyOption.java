package com.crossbot.runtime;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Option offered to the user. BUTTON options select {@code id}; LINK options open {@code url}
 * (and select {@code id} when they stand for a node); RESTART goes back to the scenario start.
 */
public final class ReplyOption {

    public enum Kind {
        BUTTON,
        LINK,
        RESTART
    }

    private final Integer id;
    private final String label;
    private final Kind kind;
    private final String url;

    @JsonCreator
    public ReplyOption(
            @JsonProperty("id") Integer id,
            @JsonProperty("label") String label,
            @JsonProperty("kind") Kind kind,
            @JsonProperty("url") String url) {
        this.id = id;
        this.label = label != null ? label : "";
        this.kind = kind != null ? kind : Kind.BUTTON;
        this.url = url;
    }

    public static ReplyOption button(int id, String label) {
        return new ReplyOption(id, label, Kind.BUTTON, null);
    }

    public static ReplyOption link(Integer id, String label, String url) {
        return new ReplyOption(id, label, Kind.LINK, url);
    }

    public static ReplyOption restart(String label) {
        return new ReplyOption(null, label, Kind.RESTART, null);
    }

    public Integer getId() {
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReplyOption)) return false;
        ReplyOption that = (ReplyOption) o;
        return Objects.equals(id, that.id) && label.equals(that.label) && kind == that.kind && Objects.equals(url, that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, kind, url);
    }

    @Override
    public String toString() {
        return "ReplyOption{" + kind + " " + label + (id != null ? " -> " + id : "") + "}";
    }
}
