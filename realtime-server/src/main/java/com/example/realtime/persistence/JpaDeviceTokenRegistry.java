package com.example.realtime.persistence;

import com.example.realtime.domain.DevicePlatform;
import com.example.realtime.domain.DeviceToken;
import com.example.realtime.service.DeviceTokenRegistry;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaDeviceTokenRegistry implements DeviceTokenRegistry {

    private final DeviceTokenJpaRepository deviceTokenJpaRepository;
    private final DeviceTokenEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public List<DeviceToken> findByProfile(String profileId) {
        if (!StringUtils.hasText(profileId)) {
            return Collections.emptyList();
        }
        return deviceTokenJpaRepository.findByProfileIdOrderByCreatedAtAsc(profileId).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DeviceToken> findByToken(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        return deviceTokenJpaRepository.findByToken(token).map(mapper::toDomain);
    }

    @Override
    @Transactional
    public DeviceToken register(String profileId, String token, DevicePlatform platform, String deviceName) {
        DeviceTokenEntity entity = deviceTokenJpaRepository.findByToken(token).orElse(null);
        if (entity == null) {
            entity = mapper.toEntity(DeviceToken.builder()
                    .profileId(profileId)
                    .token(token)
                    .platform(platform)
                    .deviceName(deviceName)
                    .build());
            log.info("Registered push token {} for profile {}", entity.getId(), profileId);
        } else {
            if (!profileId.equals(entity.getProfileId())) {
                log.info("Moving push token {} from profile {} to {}", entity.getId(), entity.getProfileId(), profileId);
            }
            entity.setProfileId(profileId);
            entity.setPlatform(platform);
            entity.setDeviceName(deviceName);
        }
        return mapper.toDomain(deviceTokenJpaRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional
    public boolean delete(String token) {
        if (!StringUtils.hasText(token)) {
            return false;
        }
        return deviceTokenJpaRepository.deleteByTokenValue(token) > 0;
    }

    @Override
    @Transactional
    public int deleteAllForProfile(String profileId) {
        if (!StringUtils.hasText(profileId)) {
            return 0;
        }
        return deviceTokenJpaRepository.deleteByProfile(profileId);
    }

    @Override
    @Transactional
    public int deleteByIds(Collection<String> ids) {
        if (CollectionUtils.isEmpty(ids)) {
            return 0;
        }
        return deviceTokenJpaRepository.deleteByIdIn(ids);
    }

    @Override
    @Transactional
    public void markUsed(Collection<String> ids, Instant usedAt) {
        if (CollectionUtils.isEmpty(ids)) {
            return;
        }
        deviceTokenJpaRepository.markUsed(ids, usedAt);
    }
}
