package com.example.realtime.domain;

import java.util.Locale;
import java.util.Optional;

public enum DevicePlatform {
    IOS,
    ANDROID;

    public static Optional<DevicePlatform> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (DevicePlatform platform : values()) {
            if (platform.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(platform);
            }
        }
        return Optional.empty();
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
