package com.example.realtime.client;

/**
 * The server refused the credential. Terminal for the session manager: no retry until the
 * user signs in again.
 */
public class AuthException extends RuntimeException {

    public AuthException(String message) {
        super(message);
    }
}
