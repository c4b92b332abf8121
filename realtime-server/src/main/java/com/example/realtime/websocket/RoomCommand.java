package com.example.realtime.websocket;

import com.example.realtime.domain.RoomKind;

/**
 * Client-to-server room commands. The event payload is the bare id of the room.
 */
public enum RoomCommand {
    JOIN_COMMUNITY("join:community", RoomKind.COMMUNITY, true),
    LEAVE_COMMUNITY("leave:community", RoomKind.COMMUNITY, false),
    JOIN_BOOKING("join:booking", RoomKind.BOOKING, true),
    LEAVE_BOOKING("leave:booking", RoomKind.BOOKING, false),
    JOIN_CONVERSATION("join:conversation", RoomKind.CONVERSATION, true),
    LEAVE_CONVERSATION("leave:conversation", RoomKind.CONVERSATION, false);

    private final String event;
    private final RoomKind kind;
    private final boolean join;

    RoomCommand(String event, RoomKind kind, boolean join) {
        this.event = event;
        this.kind = kind;
        this.join = join;
    }

    public String event() {
        return event;
    }

    public RoomKind kind() {
        return kind;
    }

    public boolean isJoin() {
        return join;
    }
}
