package com.example.realtime.client;

import lombok.NonNull;
import lombok.Value;

@Value
public class Credentials {
    @NonNull
    String token;
    @NonNull
    String profileId;

    @Override
    public String toString() {
        return "Credentials(profileId=" + profileId + ")";
    }
}
