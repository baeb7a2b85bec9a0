package com.crossbot.service;

/**
 * Thrown when a definition id is not in the store.
 */
public final class DefinitionNotFoundException extends RuntimeException {

    private final String definitionId;

    public DefinitionNotFoundException(String definitionId) {
        super("Scenario definition not found: " + definitionId);
        this.definitionId = definitionId;
    }

    public String getDefinitionId() {
        return definitionId;
    }
}
