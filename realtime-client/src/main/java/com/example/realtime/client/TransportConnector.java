package com.example.realtime.client;

import java.util.concurrent.CompletableFuture;

/**
 * Opens authenticated connections. Implementations must not block the caller; the returned future
 * completes once the server confirmed the handshake, or fails with {@link AuthException} or
 * {@link ConnectionException}.
 */
public interface TransportConnector {

    CompletableFuture<TransportSession> connect(Credentials credentials, TransportEvents events);
}
