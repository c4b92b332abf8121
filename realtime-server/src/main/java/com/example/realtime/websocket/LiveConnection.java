package com.example.realtime.websocket;

public interface LiveConnection {

    String id();

    String profileId();

    void send(String event, Object data);

    void close();
}
