package com.example.realtime.delivery;

import com.example.realtime.config.RealtimeProperties;
import com.example.realtime.event.ChangeListener;
import com.example.realtime.service.exception.ConnectionException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Wires the delivery handlers to their channels and ties the listener link to the application
 * lifecycle. A failed first connect leaves the service running; the listener keeps retrying.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeListenerLifecycle {

    private final ChangeListener changeListener;
    private final NotificationDeliveryHandler notificationDeliveryHandler;
    private final ChatMessageDeliveryHandler chatMessageDeliveryHandler;
    private final RealtimeProperties properties;

    @PostConstruct
    public void registerHandlers() {
        RealtimeProperties.Listener listener = properties.getListener();
        changeListener.registerChannel(listener.getNotificationChannel(), notificationDeliveryHandler);
        changeListener.registerChannel(listener.getMessageChannel(), chatMessageDeliveryHandler);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!properties.getListener().isEnabled()) {
            log.warn("Change listener disabled, database events will not be delivered");
            return;
        }
        try {
            changeListener.connect();
        } catch (ConnectionException ex) {
            log.error("Change listener could not connect at startup, retry scheduled: {}", ex.getMessage());
        }
    }

    @PreDestroy
    public void stop() {
        try {
            changeListener.disconnect();
        } catch (ConnectionException ex) {
            log.warn("Graceful listener shutdown failed, forcing close: {}", ex.getMessage());
            changeListener.forceClose();
        }
    }
}
