package com.example.realtime.controller;

import com.example.realtime.dto.DeletePushTokenRequest;
import com.example.realtime.dto.DeviceTokenResponse;
import com.example.realtime.dto.RegisterPushTokenRequest;
import com.example.realtime.service.DeviceTokenService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/push-tokens")
public class DeviceTokenController {

    static final String PROFILE_HEADER = "X-Profile-Id";

    private final DeviceTokenService deviceTokenService;

    public DeviceTokenController(DeviceTokenService deviceTokenService) {
        this.deviceTokenService = deviceTokenService;
    }

    @PostMapping
    public ResponseEntity<DeviceTokenResponse> register(
            @Valid @RequestBody RegisterPushTokenRequest request,
            @RequestHeader(name = PROFILE_HEADER, required = false) String profileId) {
        return ResponseEntity.ok(DeviceTokenResponse.from(deviceTokenService.register(
                profileId, request.getToken(), request.getDeviceType(), request.getDeviceName())));
    }

    @DeleteMapping
    public ResponseEntity<Void> unregister(
            @Valid @RequestBody DeletePushTokenRequest request,
            @RequestHeader(name = PROFILE_HEADER, required = false) String profileId) {
        deviceTokenService.unregister(profileId, request.getToken());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/profiles/{profileId}")
    public ResponseEntity<Map<String, Object>> unregisterAll(
            @PathVariable String profileId,
            @RequestHeader(name = PROFILE_HEADER, required = false) String callerProfileId) {
        int removed = deviceTokenService.unregisterAll(callerProfileId, profileId);
        return ResponseEntity.ok(Map.of("removed", removed));
    }
}
