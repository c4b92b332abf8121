package com.example.realtime.persistence;

import com.example.realtime.domain.DevicePlatform;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores the platform as the lowercase value the {@code device_type} check constraint allows.
 * Platforms this service does not send to (such as {@code web}) read back as null.
 */
@Converter
public class DevicePlatformConverter implements AttributeConverter<DevicePlatform, String> {

    @Override
    public String convertToDatabaseColumn(DevicePlatform platform) {
        return platform != null ? platform.value() : null;
    }

    @Override
    public DevicePlatform convertToEntityAttribute(String value) {
        return DevicePlatform.parse(value).orElse(null);
    }
}
