package com.example.realtime.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row published on the notification channel by the insert trigger on {@code notifications}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotificationCreatedPayload {

    private String notificationId;
    private String profileId;
    private String notificationType;
    private String title;
    private String body;
    private Map<String, Object> dataJson;
    private String relatedBookingId;
    private String relatedOfferingId;
    private String relatedCommunityId;
    private Integer badgeCount;
    private String createdAt;
}
