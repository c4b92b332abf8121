package com.example.realtime.client;

import com.fasterxml.jackson.databind.JsonNode;

public interface TransportEvents {

    void onDisconnected(String reason);

    void onEvent(String event, JsonNode payload);
}
