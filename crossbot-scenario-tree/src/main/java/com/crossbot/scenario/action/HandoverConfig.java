package com.crossbot.scenario.action;

import com.crossbot.scenario.tree.ScenarioAction;
import com.crossbot.scenario.tree.SymbolRef;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Hand-off to a human operator. {@code onAccept} and {@code onReject} are where the scenario continues
 * when an operator took the conversation or none was available. Both are optional.
 */
public final class HandoverConfig implements ActionConfig {

    private final SymbolRef onAccept;
    private final SymbolRef onReject;

    @JsonCreator
    public HandoverConfig(
            @JsonProperty("onAccept") SymbolRef onAccept,
            @JsonProperty("onReject") SymbolRef onReject) {
        this.onAccept = onAccept;
        this.onReject = onReject;
    }

    public SymbolRef getOnAccept() {
        return onAccept;
    }

    public SymbolRef getOnReject() {
        return onReject;
    }

    @Override
    public ScenarioAction action() {
        return ScenarioAction.HANDOVER;
    }

    @Override
    public List<SymbolRef> references() {
        List<SymbolRef> refs = new ArrayList<>(2);
        if (onAccept != null) refs.add(onAccept);
        if (onReject != null) refs.add(onReject);
        return refs;
    }

    @Override
    public ActionConfig mapReferences(UnaryOperator<SymbolRef> mapper) {
        return new HandoverConfig(ActionConfig.map(onAccept, mapper), ActionConfig.map(onReject, mapper));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof HandoverConfig)) return false;
        HandoverConfig that = (HandoverConfig) o;
        return Objects.equals(onAccept, that.onAccept) && Objects.equals(onReject, that.onReject);
    }

    @Override
    public int hashCode() {
        return Objects.hash(onAccept, onReject);
    }
}
