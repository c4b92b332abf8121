package com.example.realtime.websocket;

public final class RealtimeEvents {

    public static final String CONNECTED = "connected";
    public static final String ERROR = "error";
    public static final String NOTIFICATION_BADGE_UPDATE = "notification:badge_update";
    public static final String NOTIFICATION_NEW = "notification:new";
    public static final String MESSAGE_NEW = "message:new";

    public static final String ERROR_AUTH_FAILED = "auth_failed";
    public static final String ERROR_AUTH_UNAVAILABLE = "auth_unavailable";
    public static final String ERROR_PROTOCOL = "protocol_error";

    private RealtimeEvents() {
    }
}
