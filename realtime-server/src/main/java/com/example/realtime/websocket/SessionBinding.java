package com.example.realtime.websocket;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Registry entry for one live connection: the rooms it currently belongs to. Mutated only while
 * holding the binding's monitor so that joins and disconnect cleanup for the same connection are
 * ordered.
 */
public class SessionBinding {

    private final LiveConnection connection;
    private final Instant connectedAt;
    private final Set<String> rooms = new LinkedHashSet<>();
    private boolean closed;

    SessionBinding(LiveConnection connection, Instant connectedAt) {
        this.connection = connection;
        this.connectedAt = connectedAt;
    }

    public String getSessionId() {
        return connection.id();
    }

    public String getProfileId() {
        return connection.profileId();
    }

    public LiveConnection getConnection() {
        return connection;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public synchronized Set<String> getRooms() {
        return Set.copyOf(rooms);
    }

    synchronized boolean isClosed() {
        return closed;
    }

    // callers hold this binding's monitor
    boolean addRoom(String room) {
        return !closed && rooms.add(room);
    }

    boolean removeRoom(String room) {
        return rooms.remove(room);
    }

    Set<String> close() {
        closed = true;
        Set<String> held = Set.copyOf(rooms);
        rooms.clear();
        return held;
    }
}
