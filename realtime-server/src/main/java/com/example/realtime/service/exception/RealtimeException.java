package com.example.realtime.service.exception;

/**
 * Base type for failures raised inside the delivery core. None of these are allowed to escape
 * a listener, handler or push boundary; each boundary logs and continues.
 */
public class RealtimeException extends RuntimeException {

    public RealtimeException(String message) {
        super(message);
    }

    public RealtimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
