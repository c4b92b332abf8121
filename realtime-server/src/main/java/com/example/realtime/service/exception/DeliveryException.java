package com.example.realtime.service.exception;

/**
 * A push provider request failed as a whole. Tokens in the affected batch are kept.
 */
public class DeliveryException extends RealtimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
