package com.crossbot.scenario.compile;

/**
 * Thrown when a well-formed authoring document cannot be compiled into a tree at all
 * (no start cell, or the start cell leads nowhere). Nothing is produced.
 */
public final class ScenarioCompileException extends RuntimeException {

    public ScenarioCompileException(String message) {
        super(message);
    }
}
