package com.example.realtime.service.exception;

public class MalformedPayloadException extends RealtimeException {

    private final String channel;

    public MalformedPayloadException(String channel, String message) {
        super(message);
        this.channel = channel;
    }

    public MalformedPayloadException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
