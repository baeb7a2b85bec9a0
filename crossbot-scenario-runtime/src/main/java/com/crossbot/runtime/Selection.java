package com.crossbot.runtime;

import java.util.Objects;

/**
 * What the user picked: a compiled node id, or the restart sentinel.
 */
public final class Selection {

    private static final Selection RESTART = new Selection(null);

    private final Integer nodeId;

    private Selection(Integer nodeId) {
        this.nodeId = nodeId;
    }

    public static Selection restart() {
        return RESTART;
    }

    public static Selection node(int nodeId) {
        return new Selection(nodeId);
    }

    /**
     * Parses a selection token: the restart sentinel, or a compiled id.
     *
     * @throws IllegalArgumentException when the token is neither
     */
    public static Selection parse(String token, String restartSentinel) {
        if (token == null || token.isBlank() || token.trim().equals(restartSentinel)) return RESTART;
        try {
            return node(Integer.parseInt(token.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid selection: " + token, e);
        }
    }

    public boolean isRestart() {
        return nodeId == null;
    }

    /** Compiled id; null for the restart sentinel. */
    public Integer getNodeId() {
        return nodeId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Selection)) return false;
        return Objects.equals(nodeId, ((Selection) o).nodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(nodeId);
    }

    @Override
    public String toString() {
        return isRestart() ? "Selection{restart}" : "Selection{" + nodeId + "}";
    }
}
