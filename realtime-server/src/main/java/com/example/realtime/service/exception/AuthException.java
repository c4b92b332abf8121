package com.example.realtime.service.exception;

public class AuthException extends RealtimeException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
