package com.example.realtime.service;

import com.example.realtime.domain.Room;
import com.example.realtime.dto.HealthResponse;
import com.example.realtime.event.ChangeListener;
import com.example.realtime.event.LinkState;
import com.example.realtime.websocket.LiveConnection;
import com.example.realtime.websocket.RoomRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DeliveryHealthService Tests")
class DeliveryHealthServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ChangeListener changeListener;

    private RoomRegistry roomRegistry;
    private DeliveryHealthService healthService;

    @BeforeEach
    void setUp() {
        roomRegistry = new RoomRegistry();
        healthService = new DeliveryHealthService(changeListener, roomRegistry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should report healthy with live counters while the listener is connected")
    void shouldReportHealthy() {
        // Given
        when(changeListener.isConnected()).thenReturn(true);
        when(changeListener.state()).thenReturn(LinkState.CONNECTED);
        when(changeListener.handledEvents()).thenReturn(7L);
        LiveConnection connection = mock(LiveConnection.class);
        lenient().when(connection.id()).thenReturn("s1");
        lenient().when(connection.profileId()).thenReturn("p1");
        roomRegistry.register(connection);
        roomRegistry.join("s1", Room.user("p1"));

        // When
        HealthResponse health = healthService.snapshot();

        // Then
        assertThat(health.getStatus()).isEqualTo(DeliveryHealthService.STATUS_HEALTHY);
        assertThat(health.getLiveConnections()).isEqualTo(1);
        assertThat(health.getRooms()).isEqualTo(1);
        assertThat(health.getEventsHandled()).isEqualTo(7);
        assertThat(health.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should report degraded while the listener is down")
    void shouldReportDegraded() {
        // Given
        when(changeListener.isConnected()).thenReturn(false);
        when(changeListener.state()).thenReturn(LinkState.DISCONNECTED);
        when(changeListener.isReconnectPending()).thenReturn(true);

        // When
        HealthResponse health = healthService.snapshot();

        // Then
        assertThat(health.getStatus()).isEqualTo(DeliveryHealthService.STATUS_DEGRADED);
        assertThat(health.isReconnectPending()).isTrue();
    }
}
