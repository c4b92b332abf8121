package com.example.realtime.service;

import com.example.realtime.domain.DevicePlatform;
import com.example.realtime.domain.DeviceToken;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Push addresses per recipient. A token belongs to at most one profile at a time.
 */
public interface DeviceTokenRegistry {

    List<DeviceToken> findByProfile(String profileId);

    Optional<DeviceToken> findByToken(String token);

    /**
     * Inserts the token, or moves an existing row with the same token to this profile and
     * refreshes its platform and device name.
     */
    DeviceToken register(String profileId, String token, DevicePlatform platform, String deviceName);

    boolean delete(String token);

    int deleteAllForProfile(String profileId);

    int deleteByIds(Collection<String> ids);

    void markUsed(Collection<String> ids, Instant usedAt);
}
