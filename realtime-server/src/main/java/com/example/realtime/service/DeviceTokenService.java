package com.example.realtime.service;

import com.example.realtime.domain.DevicePlatform;
import com.example.realtime.domain.DeviceToken;
import com.example.realtime.push.ExpoPushTokens;
import com.example.realtime.service.exception.ServiceException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Validation and ownership rules in front of the {@link DeviceTokenRegistry}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceTokenService {

    private final DeviceTokenRegistry deviceTokenRegistry;

    public DeviceToken register(String profileId, String token, String deviceType, String deviceName) {
        requireProfile(profileId);
        String trimmed = token != null ? token.trim() : null;
        if (!ExpoPushTokens.isExpoPushToken(trimmed)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Not a valid Expo push token", "invalid_push_token");
        }
        DevicePlatform platform = DevicePlatform.parse(deviceType)
                .orElseThrow(() -> new ServiceException(
                        HttpStatus.BAD_REQUEST, "device_type must be ios or android", "invalid_device_type"));
        String name = StringUtils.hasText(deviceName) ? deviceName.trim() : null;
        try {
            return deviceTokenRegistry.register(profileId, trimmed, platform, name);
        } catch (DataIntegrityViolationException ex) {
            // a concurrent registration inserted the same token first; the retry updates that row
            log.info("Push token for profile {} registered concurrently, retrying as update", profileId);
            return deviceTokenRegistry.register(profileId, trimmed, platform, name);
        }
    }

    /**
     * Removes one device of the caller. Tokens owned by someone else are left alone.
     */
    public void unregister(String profileId, String token) {
        requireProfile(profileId);
        Optional<DeviceToken> existing = deviceTokenRegistry.findByToken(token != null ? token.trim() : null);
        if (existing.isEmpty()) {
            log.debug("Push token for profile {} already gone", profileId);
            return;
        }
        if (!profileId.equals(existing.get().getProfileId())) {
            throw new ServiceException(HttpStatus.FORBIDDEN, "Push token belongs to another profile", "token_not_owned");
        }
        deviceTokenRegistry.delete(existing.get().getToken());
        log.info("Unregistered push token {} of profile {}", existing.get().getId(), profileId);
    }

    /**
     * Logout: forget every device of the profile.
     */
    public int unregisterAll(String callerProfileId, String profileId) {
        requireProfile(callerProfileId);
        if (!callerProfileId.equals(profileId)) {
            throw new ServiceException(HttpStatus.FORBIDDEN, "Cannot remove push tokens of another profile", "profile_mismatch");
        }
        int removed = deviceTokenRegistry.deleteAllForProfile(profileId);
        log.info("Removed {} push token(s) of profile {}", removed, profileId);
        return removed;
    }

    private void requireProfile(String profileId) {
        if (!StringUtils.hasText(profileId)) {
            throw new ServiceException(HttpStatus.UNAUTHORIZED, "Profile id header is required", "missing_profile");
        }
    }
}
