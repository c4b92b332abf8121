package com.example.realtime.push;

import com.example.realtime.domain.DevicePlatform;
import com.example.realtime.domain.DeviceToken;
import com.example.realtime.service.DeviceTokenRegistry;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

class InMemoryDeviceTokenRegistry implements DeviceTokenRegistry {

    private final Map<String, DeviceToken> byId = new ConcurrentHashMap<>();

    DeviceToken add(String profileId, String token) {
        return register(profileId, token, DevicePlatform.IOS, null);
    }

    List<String> tokensOf(String profileId) {
        return findByProfile(profileId).stream().map(DeviceToken::getToken).toList();
    }

    @Override
    public List<DeviceToken> findByProfile(String profileId) {
        return byId.values().stream()
                .filter(token -> token.getProfileId().equals(profileId))
                .sorted((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()))
                .toList();
    }

    @Override
    public Optional<DeviceToken> findByToken(String token) {
        return byId.values().stream().filter(existing -> existing.getToken().equals(token)).findFirst();
    }

    @Override
    public DeviceToken register(String profileId, String token, DevicePlatform platform, String deviceName) {
        DeviceToken existing = findByToken(token).orElse(null);
        if (existing != null) {
            existing.setProfileId(profileId);
            existing.setPlatform(platform);
            existing.setDeviceName(deviceName);
            return existing;
        }
        DeviceToken created = DeviceToken.builder()
                .id(UUID.randomUUID().toString())
                .profileId(profileId)
                .token(token)
                .platform(platform)
                .deviceName(deviceName)
                .createdAt(Instant.now().plusNanos(byId.size()))
                .build();
        byId.put(created.getId(), created);
        return created;
    }

    @Override
    public boolean delete(String token) {
        return findByToken(token).map(existing -> byId.remove(existing.getId()) != null).orElse(false);
    }

    @Override
    public int deleteAllForProfile(String profileId) {
        List<DeviceToken> owned = findByProfile(profileId);
        owned.forEach(token -> byId.remove(token.getId()));
        return owned.size();
    }

    @Override
    public int deleteByIds(Collection<String> ids) {
        int removed = 0;
        for (String id : ids) {
            if (byId.remove(id) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public void markUsed(Collection<String> ids, Instant usedAt) {
        ids.forEach(id -> {
            DeviceToken token = byId.get(id);
            if (token != null) {
                token.setLastUsedAt(usedAt);
            }
        });
    }
}
