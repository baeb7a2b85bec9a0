package com.crossbot.codec.tabular;

import java.util.List;

/**
 * Thrown by the tabular export when a root-to-leaf path has more cells than level columns.
 */
public final class TabularDepthException extends RuntimeException {

    private final List<String> path;

    public TabularDepthException(List<String> path, int maxDepth) {
        super("Path of depth " + path.size() + " exceeds " + maxDepth + " levels: " + String.join(" > ", path));
        this.path = List.copyOf(path);
    }

    public List<String> getPath() {
        return path;
    }
}
