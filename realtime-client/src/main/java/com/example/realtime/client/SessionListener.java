package com.example.realtime.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Observer of a {@link ClientSessionManager}. Called on the manager's threads; implementations
 * must return quickly.
 */
public interface SessionListener {

    default void onStateChanged(SessionState previous, SessionState current) {
    }

    /** The credential was rejected. The UI should ask the user to sign in again. */
    default void onAuthFailed(String reason) {
    }

    /** Retries were exhausted after a transient failure. */
    default void onGaveUp(int attempts) {
    }

    default void onEvent(String event, JsonNode payload) {
    }
}
