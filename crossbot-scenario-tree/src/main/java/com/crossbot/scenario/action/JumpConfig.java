package com.crossbot.scenario.action;

import com.crossbot.scenario.tree.ScenarioAction;
import com.crossbot.scenario.tree.SymbolRef;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/** Jump to the node carrying the target name. */
public final class JumpConfig implements ActionConfig {

    private final SymbolRef target;

    @JsonCreator
    public JumpConfig(@JsonProperty("target") SymbolRef target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    public SymbolRef getTarget() {
        return target;
    }

    @Override
    public ScenarioAction action() {
        return ScenarioAction.JUMP;
    }

    @Override
    public List<SymbolRef> references() {
        return List.of(target);
    }

    @Override
    public ActionConfig mapReferences(UnaryOperator<SymbolRef> mapper) {
        return new JumpConfig(mapper.apply(target));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JumpConfig && target.equals(((JumpConfig) o).target);
    }

    @Override
    public int hashCode() {
        return target.hashCode();
    }
}
