package com.example.realtime.event;

import com.example.realtime.service.exception.ConnectionException;
import java.time.Duration;
import java.util.List;

/**
 * A single long-lived connection used only for receiving change notifications. Not thread-safe:
 * only the owning {@link ChangeListener} touches it.
 */
public interface SubscriptionLink {

    /**
     * @throws ConnectionException if the subscribe call fails
     */
    void subscribe(String channel);

    /**
     * Waits up to {@code timeout} for notifications. Returns an empty list when none arrived.
     *
     * @throws ConnectionException when the link is broken
     */
    List<ChangeNotification> poll(Duration timeout);

    /**
     * Graceful close. May block on the remote side.
     */
    void close();

    /**
     * Drops the link without waiting for the remote side.
     */
    void forceClose();
}
