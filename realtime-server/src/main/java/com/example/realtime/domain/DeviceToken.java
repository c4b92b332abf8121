package com.example.realtime.domain;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceToken {

    private String id;
    private String profileId;
    private String token;
    private DevicePlatform platform;
    private String deviceName;
    private Instant createdAt;
    private Instant lastUsedAt;
}
