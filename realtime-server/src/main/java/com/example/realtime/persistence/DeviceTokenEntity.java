package com.example.realtime.persistence;

import com.example.realtime.domain.DevicePlatform;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "push_tokens",
        uniqueConstraints = @UniqueConstraint(name = "idx_push_tokens_token", columnNames = "token"),
        indexes = @Index(name = "idx_push_tokens_profile_id", columnList = "profile_id"))
public class DeviceTokenEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "profile_id", nullable = false, length = 64)
    private String profileId;

    @Column(name = "token", nullable = false, length = 512)
    private String token;

    @Convert(converter = DevicePlatformConverter.class)
    @Column(name = "device_type", length = 16)
    private DevicePlatform platform;

    @Column(name = "device_name", length = 255)
    private String deviceName;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;
}
