package com.example.realtime.service.exception;

public class HandlerException extends RealtimeException {

    private final String channel;

    public HandlerException(String channel, Throwable cause) {
        super("Handler for channel " + channel + " failed: " + cause.getMessage(), cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
