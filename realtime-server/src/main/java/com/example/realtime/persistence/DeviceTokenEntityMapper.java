package com.example.realtime.persistence;

import com.example.realtime.domain.DeviceToken;
import java.time.Instant;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class DeviceTokenEntityMapper {

    public DeviceTokenEntity toEntity(DeviceToken deviceToken) {
        DeviceTokenEntity entity = new DeviceTokenEntity();
        entity.setId(StringUtils.hasText(deviceToken.getId()) ? deviceToken.getId() : UUID.randomUUID().toString());
        entity.setProfileId(deviceToken.getProfileId());
        entity.setToken(deviceToken.getToken());
        entity.setPlatform(deviceToken.getPlatform());
        entity.setDeviceName(deviceToken.getDeviceName());
        entity.setCreatedAt(deviceToken.getCreatedAt() != null ? deviceToken.getCreatedAt() : Instant.now());
        entity.setLastUsedAt(deviceToken.getLastUsedAt());
        return entity;
    }

    public DeviceToken toDomain(DeviceTokenEntity entity) {
        if (entity == null) {
            return null;
        }
        return DeviceToken.builder()
                .id(entity.getId())
                .profileId(entity.getProfileId())
                .token(entity.getToken())
                .platform(entity.getPlatform())
                .deviceName(entity.getDeviceName())
                .createdAt(entity.getCreatedAt())
                .lastUsedAt(entity.getLastUsedAt())
                .build();
    }
}
