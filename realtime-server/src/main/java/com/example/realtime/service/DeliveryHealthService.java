package com.example.realtime.service;

import com.example.realtime.dto.HealthResponse;
import com.example.realtime.event.ChangeListener;
import com.example.realtime.websocket.RoomRegistry;
import java.time.Clock;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class DeliveryHealthService {

    public static final String STATUS_HEALTHY = "healthy";
    public static final String STATUS_DEGRADED = "degraded";

    private final ChangeListener changeListener;
    private final RoomRegistry roomRegistry;
    private final Clock clock;

    @Autowired
    public DeliveryHealthService(ChangeListener changeListener, RoomRegistry roomRegistry) {
        this(changeListener, roomRegistry, Clock.systemUTC());
    }

    DeliveryHealthService(ChangeListener changeListener, RoomRegistry roomRegistry, Clock clock) {
        this.changeListener = changeListener;
        this.roomRegistry = roomRegistry;
        this.clock = clock;
    }

    public HealthResponse snapshot() {
        boolean connected = changeListener.isConnected();
        return HealthResponse.builder()
                .status(connected ? STATUS_HEALTHY : STATUS_DEGRADED)
                .listenerState(changeListener.state())
                .listenerConnected(connected)
                .reconnectPending(changeListener.isReconnectPending())
                .liveConnections(roomRegistry.connectionCount())
                .rooms(roomRegistry.roomCount())
                .eventsHandled(changeListener.handledEvents())
                .eventsDropped(changeListener.droppedEvents())
                .eventsFailed(changeListener.failedEvents())
                .timestamp(Instant.now(clock))
                .build();
    }

    @Scheduled(fixedDelayString = "${realtime.health-log-interval:PT5M}", initialDelayString = "${realtime.health-log-interval:PT5M}")
    public void logHealth() {
        HealthResponse health = snapshot();
        if (STATUS_DEGRADED.equals(health.getStatus())) {
            log.warn("Delivery degraded: listener {} (reconnect pending: {}), {} live connection(s)",
                    health.getListenerState(), health.isReconnectPending(), health.getLiveConnections());
        } else {
            log.info("Delivery healthy: {} live connection(s) in {} room(s), events handled={} dropped={} failed={}",
                    health.getLiveConnections(), health.getRooms(), health.getEventsHandled(),
                    health.getEventsDropped(), health.getEventsFailed());
        }
    }
}
