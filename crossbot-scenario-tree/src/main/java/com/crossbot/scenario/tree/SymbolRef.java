package com.crossbot.scenario.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Deferred reference to another node. Created {@link State#PENDING} by the classifier, either by
 * author-assigned node name or by authoring cell id, and replaced by the symbol resolver with a
 * {@link State#RESOLVED} compiled id, the {@link State#RESTART} sentinel, or {@link State#UNRESOLVED}.
 */
public final class SymbolRef {

    public enum Scope {
        NODE_NAME,
        CELL_ID
    }

    public enum State {
        PENDING,
        RESOLVED,
        RESTART,
        UNRESOLVED
    }

    private final String symbol;
    private final Scope scope;
    private final State state;
    private final Integer nodeId;

    @JsonCreator
    public SymbolRef(
            @JsonProperty("symbol") String symbol,
            @JsonProperty("scope") Scope scope,
            @JsonProperty("state") State state,
            @JsonProperty("nodeId") Integer nodeId) {
        this.symbol = symbol;
        this.scope = scope != null ? scope : Scope.NODE_NAME;
        this.state = state != null ? state : State.PENDING;
        this.nodeId = this.state == State.RESOLVED ? Objects.requireNonNull(nodeId, "nodeId") : null;
    }

    public static SymbolRef byName(String name) {
        return new SymbolRef(name, Scope.NODE_NAME, State.PENDING, null);
    }

    public static SymbolRef byCellId(String cellId) {
        return new SymbolRef(cellId, Scope.CELL_ID, State.PENDING, null);
    }

    public SymbolRef resolvedTo(int compiledId) {
        return new SymbolRef(symbol, scope, State.RESOLVED, compiledId);
    }

    public SymbolRef asRestart() {
        return new SymbolRef(symbol, scope, State.RESTART, null);
    }

    public SymbolRef asUnresolved() {
        return new SymbolRef(symbol, scope, State.UNRESOLVED, null);
    }

    /** Node name or authoring cell id, as written by the author. */
    public String getSymbol() {
        return symbol;
    }

    public Scope getScope() {
        return scope;
    }

    public State getState() {
        return state;
    }

    /** Compiled id when {@link State#RESOLVED}, otherwise null. */
    public Integer getNodeId() {
        return nodeId;
    }

    @JsonIgnore
    public boolean isPending() {
        return state == State.PENDING;
    }

    @JsonIgnore
    public boolean isResolved() {
        return state == State.RESOLVED;
    }

    @JsonIgnore
    public boolean isRestart() {
        return state == State.RESTART;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolRef)) return false;
        SymbolRef that = (SymbolRef) o;
        return Objects.equals(symbol, that.symbol) && scope == that.scope && state == that.state
                && Objects.equals(nodeId, that.nodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, scope, state, nodeId);
    }

    @Override
    public String toString() {
        return "SymbolRef{" + scope + ":" + symbol + " " + state + (nodeId != null ? " -> " + nodeId : "") + "}";
    }
}
