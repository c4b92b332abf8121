package com.example.realtime.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NewMessagePayload {
    String messageId;
    String conversationId;
    String conversationType;
    String communityId;
    String bookingId;
    String senderId;
    String content;
    String createdAt;
}
