package com.crossbot.scenario.compile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Non-fatal anomaly found while compiling or converting a scenario. {@code subject} is the
 * authoring id (or label) the diagnostic is about, when there is one.
 */
public final class CompileDiagnostic {

    private final DiagnosticKind kind;
    private final String subject;
    private final String message;

    @JsonCreator
    public CompileDiagnostic(
            @JsonProperty("kind") DiagnosticKind kind,
            @JsonProperty("subject") String subject,
            @JsonProperty("message") String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.subject = subject;
        this.message = message != null ? message : kind.name();
    }

    public static CompileDiagnostic of(DiagnosticKind kind, String subject, String message) {
        return new CompileDiagnostic(kind, subject, message);
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
