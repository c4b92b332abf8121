package com.example.realtime.dto;

import com.example.realtime.domain.DeviceToken;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.Value;

@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DeviceTokenResponse {
    String id;
    String profileId;
    String token;
    String deviceType;
    String deviceName;
    Instant createdAt;
    Instant lastUsedAt;

    public static DeviceTokenResponse from(DeviceToken deviceToken) {
        return new DeviceTokenResponse(
                deviceToken.getId(),
                deviceToken.getProfileId(),
                deviceToken.getToken(),
                deviceToken.getPlatform() != null ? deviceToken.getPlatform().value() : null,
                deviceToken.getDeviceName(),
                deviceToken.getCreatedAt(),
                deviceToken.getLastUsedAt());
    }
}
