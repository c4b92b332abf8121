package com.example.realtime.delivery;

import com.example.realtime.domain.Room;
import com.example.realtime.dto.MessageCreatedPayload;
import com.example.realtime.dto.NewMessagePayload;
import com.example.realtime.event.ChangeEvent;
import com.example.realtime.service.exception.MalformedPayloadException;
import com.example.realtime.websocket.LiveConnection;
import com.example.realtime.websocket.RealtimeEvents;
import com.example.realtime.websocket.RoomRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChatMessageDeliveryHandler Tests")
class ChatMessageDeliveryHandlerTest {

    private static final String CHANNEL = "message_created";

    @Mock
    private LiveConnection communityMember;

    @Mock
    private LiveConnection outsider;

    private RoomRegistry roomRegistry;
    private ChatMessageDeliveryHandler handler;

    @BeforeEach
    void setUp() {
        roomRegistry = new RoomRegistry();
        handler = new ChatMessageDeliveryHandler(roomRegistry, new ObjectMapper());
    }

    @Test
    @DisplayName("Should broadcast a community message only into the community room")
    void shouldBroadcastToCommunityRoom() {
        // Given
        when(communityMember.id()).thenReturn("s1");
        when(outsider.id()).thenReturn("s2");
        roomRegistry.register(communityMember);
        roomRegistry.register(outsider);
        roomRegistry.join("s1", Room.community("c1"));
        roomRegistry.join("s2", Room.community("c2"));

        Map<String, Object> payload = message("community");
        payload.put("community_id", "c1");

        // When
        handler.handle(new ChangeEvent(CHANNEL, payload));

        // Then
        ArgumentCaptor<Object> sent = ArgumentCaptor.forClass(Object.class);
        verify(communityMember).send(eq(RealtimeEvents.MESSAGE_NEW), sent.capture());
        NewMessagePayload message = (NewMessagePayload) sent.getValue();
        assertThat(message.getMessageId()).isEqualTo("m1");
        assertThat(message.getCommunityId()).isEqualTo("c1");
        assertThat(message.getContent()).isEqualTo("Hallo");
        verify(outsider, never()).send(anyString(), any());
    }

    @Test
    @DisplayName("Should pick the room from the conversation type")
    void shouldResolveRoomByType() {
        Map<String, Object> booking = message("booking");
        booking.put("booking_id", "b1");

        assertThat(handler.targetRoom(CHANNEL, read(booking))).isEqualTo(Room.booking("b1"));
        assertThat(handler.targetRoom(CHANNEL, read(message("direct")))).isEqualTo(Room.conversation("conv-1"));
        assertThat(handler.targetRoom(CHANNEL, read(message(null)))).isEqualTo(Room.conversation("conv-1"));
    }

    @Test
    @DisplayName("Should reject a message without a conversation id")
    void shouldRejectMissingConversation() {
        Map<String, Object> payload = message("direct");
        payload.remove("conversation_id");

        assertThatThrownBy(() -> handler.handle(new ChangeEvent(CHANNEL, payload)))
                .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    @DisplayName("Should reject a community message without a community id")
    void shouldRejectCommunityMessageWithoutCommunity() {
        assertThatThrownBy(() -> handler.handle(new ChangeEvent(CHANNEL, message("community"))))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("community_id");
    }

    @Test
    @DisplayName("Broadcasting into an empty room should not fail")
    void emptyRoomShouldBeNoOp() {
        handler.handle(new ChangeEvent(CHANNEL, message("direct")));

        assertThat(roomRegistry.roomSize(Room.conversation("conv-1"))).isZero();
    }

    private static MessageCreatedPayload read(Map<String, Object> payload) {
        return new ObjectMapper().convertValue(payload, MessageCreatedPayload.class);
    }

    private static Map<String, Object> message(String conversationType) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("message_id", "m1");
        payload.put("conversation_id", "conv-1");
        payload.put("conversation_type", conversationType);
        payload.put("sender_id", "p9");
        payload.put("content", "Hallo");
        payload.put("created_at", "2024-05-01T10:00:00Z");
        return payload;
    }
}
