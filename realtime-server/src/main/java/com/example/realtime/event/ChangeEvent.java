package com.example.realtime.event;

import java.util.Map;
import lombok.Value;

@Value
public class ChangeEvent {

    String channel;
    Map<String, Object> payload;
}
