package com.example.realtime.client;

import lombok.NonNull;
import lombok.Value;

@Value
public class TrackedRoom {
    @NonNull
    RoomKind kind;
    @NonNull
    String id;

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + id;
    }
}
