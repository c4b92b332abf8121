package com.example.realtime.domain;

import java.util.Locale;

public enum RoomKind {
    USER,
    CONVERSATION,
    COMMUNITY,
    BOOKING;

    public String prefix() {
        return name().toLowerCase(Locale.ROOT);
    }
}
