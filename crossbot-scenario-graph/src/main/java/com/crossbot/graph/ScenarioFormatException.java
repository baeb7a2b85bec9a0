package com.crossbot.graph;

/**
 * Thrown when an authoring document (graph JSON, editor JSON or tabular rows) is not well-formed.
 * Aborts the import; nothing is compiled or stored.
 */
public final class ScenarioFormatException extends RuntimeException {

    public ScenarioFormatException(String message) {
        super(message);
    }

    public ScenarioFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
