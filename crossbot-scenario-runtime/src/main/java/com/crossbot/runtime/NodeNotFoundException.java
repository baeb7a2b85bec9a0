package com.crossbot.runtime;

/**
 * Thrown when a selection names a compiled id the scenario does not contain.
 */
public final class NodeNotFoundException extends RuntimeException {

    private final int nodeId;

    public NodeNotFoundException(int nodeId) {
        super("Scenario node not found: " + nodeId);
        this.nodeId = nodeId;
    }

    public int getNodeId() {
        return nodeId;
    }
}
