package com.crossbot.scenario.action;

import com.crossbot.scenario.tree.ScenarioAction;
import com.crossbot.scenario.tree.SymbolRef;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/** Outbound mail sent when the node is reached; the scenario then continues at {@code continuation}. */
public final class MailConfig implements ActionConfig {

    private final String to;
    private final String cc;
    private final String bcc;
    private final String subject;
    private final String body;
    private final SymbolRef continuation;

    @JsonCreator
    public MailConfig(
            @JsonProperty("to") String to,
            @JsonProperty("cc") String cc,
            @JsonProperty("bcc") String bcc,
            @JsonProperty("subject") String subject,
            @JsonProperty("body") String body,
            @JsonProperty("continuation") SymbolRef continuation) {
        this.to = to;
        this.cc = cc;
        this.bcc = bcc;
        this.subject = subject;
        this.body = body;
        this.continuation = continuation;
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

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    public SymbolRef getContinuation() {
        return continuation;
    }

    @Override
    public ScenarioAction action() {
        return ScenarioAction.MAIL;
    }

    @Override
    public List<SymbolRef> references() {
        return continuation != null ? List.of(continuation) : List.of();
    }

    @Override
    public ActionConfig mapReferences(UnaryOperator<SymbolRef> mapper) {
        return new MailConfig(to, cc, bcc, subject, body, ActionConfig.map(continuation, mapper));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MailConfig)) return false;
        MailConfig that = (MailConfig) o;
        return Objects.equals(to, that.to) && Objects.equals(cc, that.cc) && Objects.equals(bcc, that.bcc)
                && Objects.equals(subject, that.subject) && Objects.equals(body, that.body)
                && Objects.equals(continuation, that.continuation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(to, cc, bcc, subject, body, continuation);
    }
}
