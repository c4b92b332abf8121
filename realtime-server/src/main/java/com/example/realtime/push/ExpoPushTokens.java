package com.example.realtime.push;

import java.util.regex.Pattern;

/**
 * Token formats the Expo push service accepts.
 */
public final class ExpoPushTokens {

    private static final Pattern EXPO_TOKEN = Pattern.compile("^Expo(nent)?PushToken\\[.+]$");
    private static final Pattern DEVICE_ID = Pattern.compile(
            "^[a-z\\d]{8}-[a-z\\d]{4}-[a-z\\d]{4}-[a-z\\d]{4}-[a-z\\d]{12}$", Pattern.CASE_INSENSITIVE);

    private ExpoPushTokens() {
    }

    public static boolean isExpoPushToken(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return EXPO_TOKEN.matcher(token).matches() || DEVICE_ID.matcher(token).matches();
    }
}
