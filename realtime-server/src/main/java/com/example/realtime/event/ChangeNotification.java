package com.example.realtime.event;

public record ChangeNotification(String channel, String payload) {
}
