package com.example.realtime.event;

public enum LinkState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED;

    boolean canMoveTo(LinkState next) {
        return switch (this) {
            case DISCONNECTED -> next == CONNECTING;
            case CONNECTING -> next == CONNECTED || next == DISCONNECTED;
            case CONNECTED -> next == DISCONNECTED;
        };
    }
}
