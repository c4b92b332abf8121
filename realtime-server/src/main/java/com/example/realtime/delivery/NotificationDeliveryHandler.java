package com.example.realtime.delivery;

import com.example.realtime.domain.NotificationTemplate;
import com.example.realtime.domain.Room;
import com.example.realtime.dto.BadgeUpdatePayload;
import com.example.realtime.dto.NewNotificationPayload;
import com.example.realtime.dto.NotificationCreatedPayload;
import com.example.realtime.event.ChangeEvent;
import com.example.realtime.event.ChangeEventHandler;
import com.example.realtime.push.PushFallbackService;
import com.example.realtime.service.exception.MalformedPayloadException;
import com.example.realtime.websocket.RealtimeEvents;
import com.example.realtime.websocket.RoomRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Delivers a freshly inserted notification either live, when the recipient has at least one
 * connection in its user room, or as a push message otherwise. Never both.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDeliveryHandler implements ChangeEventHandler {

    private final RoomRegistry roomRegistry;
    private final PushFallbackService pushFallbackService;
    private final NotificationTemplates notificationTemplates;
    private final ObjectMapper objectMapper;

    @Override
    public void handle(ChangeEvent event) {
        NotificationCreatedPayload payload = read(event);
        String profileId = payload.getProfileId();
        int badgeCount = payload.getBadgeCount() != null ? payload.getBadgeCount() : 0;
        Room userRoom = Room.user(profileId);

        if (roomRegistry.hasMembers(userRoom)) {
            roomRegistry.broadcastToRoom(userRoom, RealtimeEvents.NOTIFICATION_BADGE_UPDATE, new BadgeUpdatePayload(badgeCount));
            roomRegistry.broadcastToRoom(userRoom, RealtimeEvents.NOTIFICATION_NEW, NewNotificationPayload.builder()
                    .id(payload.getNotificationId())
                    .type(payload.getNotificationType())
                    .title(payload.getTitle())
                    .body(payload.getBody())
                    .data(payload.getDataJson())
                    .createdAt(payload.getCreatedAt())
                    .build());
            log.info("Delivered notification {} live to {}", payload.getNotificationId(), userRoom);
            return;
        }

        NotificationTemplate template = notificationTemplates.forType(payload.getNotificationType());
        pushFallbackService.dispatch(profileId, template.getTitle(), template.getBody(), routingData(payload), badgeCount);
        log.info("Profile {} offline, queued push for notification {} ({}, badge {})",
                profileId, payload.getNotificationId(), payload.getNotificationType(), badgeCount);
    }

    private NotificationCreatedPayload read(ChangeEvent event) {
        NotificationCreatedPayload payload;
        try {
            payload = objectMapper.convertValue(event.getPayload(), NotificationCreatedPayload.class);
        } catch (IllegalArgumentException ex) {
            throw new MalformedPayloadException(event.getChannel(), "Unreadable notification payload", ex);
        }
        if (!StringUtils.hasText(payload.getProfileId())) {
            throw new MalformedPayloadException(event.getChannel(), "Notification without profile_id");
        }
        return payload;
    }

    private Map<String, Object> routingData(NotificationCreatedPayload payload) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", payload.getNotificationType() != null ? payload.getNotificationType() : NotificationTemplates.FALLBACK_TYPE);
        putIfPresent(data, "notification_id", payload.getNotificationId());
        putIfPresent(data, "related_booking_id", payload.getRelatedBookingId());
        putIfPresent(data, "related_offering_id", payload.getRelatedOfferingId());
        putIfPresent(data, "related_community_id", payload.getRelatedCommunityId());
        return data;
    }

    private static void putIfPresent(Map<String, Object> data, String key, String value) {
        if (StringUtils.hasText(value)) {
            data.put(key, value);
        }
    }
}
