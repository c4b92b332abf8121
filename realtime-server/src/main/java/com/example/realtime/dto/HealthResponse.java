package com.example.realtime.dto;

import com.example.realtime.event.LinkState;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthResponse {
    String status;
    LinkState listenerState;
    boolean listenerConnected;
    boolean reconnectPending;
    int liveConnections;
    int rooms;
    long eventsHandled;
    long eventsDropped;
    long eventsFailed;
    Instant timestamp;
}
