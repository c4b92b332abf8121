package com.example.realtime.dto;

import lombok.Value;

@Value
public class SocketErrorPayload {
    String code;
    String message;
}
