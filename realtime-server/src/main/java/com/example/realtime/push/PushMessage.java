package com.example.realtime.push;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PushMessage {

    String to;
    String title;
    String body;
    Map<String, Object> data;
    String sound;
    Integer badge;
}
