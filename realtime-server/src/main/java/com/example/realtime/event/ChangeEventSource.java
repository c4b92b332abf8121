package com.example.realtime.event;

import com.example.realtime.service.exception.ConnectionException;

/**
 * Store that emits a notification on a named channel for every relevant committed insert.
 */
public interface ChangeEventSource {

    /**
     * Opens a new dedicated subscription link.
     *
     * @throws ConnectionException if the link cannot be established
     */
    SubscriptionLink open();

    /**
     * Whether {@code channel} can be subscribed on this source at all. Checked when a handler is
     * registered so a bad name fails fast instead of on every connect.
     */
    default boolean supportsChannel(String channel) {
        return true;
    }
}
