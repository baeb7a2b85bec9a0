package com.crossbot.scenario.action;

import com.crossbot.scenario.tree.ScenarioAction;
import com.crossbot.scenario.tree.SymbolRef;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Action-specific configuration of a compiled node. One implementation per configurable
 * {@link ScenarioAction}; JSON carries the variant in {@code kind}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LinkConfig.class, name = "LINK"),
        @JsonSubTypes.Type(value = HandoverConfig.class, name = "HANDOVER"),
        @JsonSubTypes.Type(value = FormConfig.class, name = "FORM"),
        @JsonSubTypes.Type(value = JumpConfig.class, name = "JUMP"),
        @JsonSubTypes.Type(value = MailConfig.class, name = "MAIL"),
        @JsonSubTypes.Type(value = CsvConfig.class, name = "CSV")
})
public interface ActionConfig {

    /** The action this configuration belongs to. */
    ScenarioAction action();

    /** Symbolic references held by this configuration (possibly not yet resolved). */
    default List<SymbolRef> references() {
        return List.of();
    }

    /** Returns a copy with every reference replaced through {@code mapper}. */
    default ActionConfig mapReferences(UnaryOperator<SymbolRef> mapper) {
        return this;
    }

    static SymbolRef map(SymbolRef ref, UnaryOperator<SymbolRef> mapper) {
        return ref != null ? mapper.apply(ref) : null;
    }
}
