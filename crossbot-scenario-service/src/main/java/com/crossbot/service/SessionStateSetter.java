package com.crossbot.service;

/**
 * Session state owned by the chat transport. Called when a reply hands the session over to a human.
 */
@FunctionalInterface
public interface SessionStateSetter {

    void markAwaitingHuman(String sessionId, String definitionId, int nodeId);
}
