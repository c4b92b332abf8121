package com.example.realtime.service.exception;

/**
 * The subscription link or a transport link is down. Retried with backoff, never fatal.
 */
public class ConnectionException extends RealtimeException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
