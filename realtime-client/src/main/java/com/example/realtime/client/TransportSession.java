package com.example.realtime.client;

public interface TransportSession {

    String id();

    void emit(String event, String argument);

    /** Closes the connection. Must be safe to call more than once. */
    void close();
}
