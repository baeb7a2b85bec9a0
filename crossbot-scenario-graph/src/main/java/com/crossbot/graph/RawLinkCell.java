package com.crossbot.graph;

import java.util.Objects;

/**
 * Directed edge cell ({@code devs.Link}) between two node cells. Ports are kept for diagnostics only.
 */
public final class RawLinkCell {

    private final String id;
    private final String sourceId;
    private final String sourcePort;
    private final String targetId;
    private final String targetPort;

    public RawLinkCell(String id, String sourceId, String sourcePort, String targetId, String targetPort) {
        this.id = id;
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
        this.sourcePort = sourcePort;
        this.targetId = Objects.requireNonNull(targetId, "targetId");
        this.targetPort = targetPort;
    }

    public String getId() {
        return id;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getSourcePort() {
        return sourcePort;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getTargetPort() {
        return targetPort;
    }

    @Override
    public String toString() {
        return "RawLinkCell{" + sourceId + " -> " + targetId + "}";
    }
}
