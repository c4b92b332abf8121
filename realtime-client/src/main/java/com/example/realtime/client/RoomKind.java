package com.example.realtime.client;

/**
 * Rooms a client can join explicitly. The own user room is joined by the server at handshake.
 */
public enum RoomKind {
    COMMUNITY("join:community", "leave:community"),
    BOOKING("join:booking", "leave:booking"),
    CONVERSATION("join:conversation", "leave:conversation");

    private final String joinEvent;
    private final String leaveEvent;

    RoomKind(String joinEvent, String leaveEvent) {
        this.joinEvent = joinEvent;
        this.leaveEvent = leaveEvent;
    }

    public String joinEvent() {
        return joinEvent;
    }

    public String leaveEvent() {
        return leaveEvent;
    }
}
