package com.example.realtime.delivery;

import com.example.realtime.domain.ConversationType;
import com.example.realtime.domain.Room;
import com.example.realtime.dto.MessageCreatedPayload;
import com.example.realtime.dto.NewMessagePayload;
import com.example.realtime.event.ChangeEvent;
import com.example.realtime.event.ChangeEventHandler;
import com.example.realtime.service.exception.MalformedPayloadException;
import com.example.realtime.websocket.RealtimeEvents;
import com.example.realtime.websocket.RoomRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Broadcasts a new chat message into the room its conversation lives in. Chat has no push
 * fallback; members who are not connected see the message on their next fetch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatMessageDeliveryHandler implements ChangeEventHandler {

    private final RoomRegistry roomRegistry;
    private final ObjectMapper objectMapper;

    @Override
    public void handle(ChangeEvent event) {
        MessageCreatedPayload message;
        try {
            message = objectMapper.convertValue(event.getPayload(), MessageCreatedPayload.class);
        } catch (IllegalArgumentException ex) {
            throw new MalformedPayloadException(event.getChannel(), "Unreadable message payload", ex);
        }
        if (!StringUtils.hasText(message.getConversationId())) {
            throw new MalformedPayloadException(event.getChannel(), "Message without conversation_id");
        }

        Room room = targetRoom(event.getChannel(), message);
        int delivered = roomRegistry.broadcastToRoom(room, RealtimeEvents.MESSAGE_NEW, NewMessagePayload.builder()
                .messageId(message.getMessageId())
                .conversationId(message.getConversationId())
                .conversationType(message.getConversationType())
                .communityId(message.getCommunityId())
                .bookingId(message.getBookingId())
                .senderId(message.getSenderId())
                .content(message.getContent())
                .createdAt(message.getCreatedAt())
                .build());
        log.info("Broadcast message {} to {} ({} connection(s))", message.getMessageId(), room, delivered);
    }

    Room targetRoom(String channel, MessageCreatedPayload message) {
        ConversationType type = ConversationType.fromValue(message.getConversationType());
        switch (type) {
            case COMMUNITY:
                if (!StringUtils.hasText(message.getCommunityId())) {
                    throw new MalformedPayloadException(channel, "Community message without community_id");
                }
                return Room.community(message.getCommunityId());
            case BOOKING:
                if (!StringUtils.hasText(message.getBookingId())) {
                    throw new MalformedPayloadException(channel, "Booking message without booking_id");
                }
                return Room.booking(message.getBookingId());
            default:
                return Room.conversation(message.getConversationId());
        }
    }
}
