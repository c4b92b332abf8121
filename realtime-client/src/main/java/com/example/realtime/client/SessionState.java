package com.example.realtime.client;

public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    // torn down while the app is in the background
    SUSPENDED
}
