package com.example.realtime.domain;

import java.util.Locale;

public enum ConversationType {
    DIRECT,
    COMMUNITY,
    BOOKING;

    /**
     * Unknown or missing values route like a direct conversation.
     */
    public static ConversationType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DIRECT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return DIRECT;
        }
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
