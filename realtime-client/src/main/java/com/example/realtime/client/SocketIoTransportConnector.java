package com.example.realtime.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.socket.client.IO;
import io.socket.client.Socket;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TransportConnector} on the socket.io Java client. The library's own reconnection is
 * disabled because {@link ClientSessionManager} owns retries.
 */
@Slf4j
public class SocketIoTransportConnector implements TransportConnector {

    static final String EVENT_CONNECTED = "connected";
    static final String EVENT_ERROR = "error";
    static final String ERROR_AUTH_FAILED = "auth_failed";
    static final List<String> FORWARDED_EVENTS = List.of(
            "notification:badge_update", "notification:new", "message:new");

    private final URI serverUri;
    private final ObjectMapper objectMapper;
    private final Duration connectTimeout;
    private final BiFunction<URI, IO.Options, Socket> socketFactory;

    public SocketIoTransportConnector(URI serverUri, ObjectMapper objectMapper, Duration connectTimeout) {
        this(serverUri, objectMapper, connectTimeout, IO::socket);
    }

    SocketIoTransportConnector(
            URI serverUri, ObjectMapper objectMapper, Duration connectTimeout,
            BiFunction<URI, IO.Options, Socket> socketFactory) {
        this.serverUri = serverUri;
        this.objectMapper = objectMapper;
        this.connectTimeout = connectTimeout;
        this.socketFactory = socketFactory;
    }

    @Override
    public CompletableFuture<TransportSession> connect(Credentials credentials, TransportEvents events) {
        CompletableFuture<TransportSession> handshake = new CompletableFuture<>();

        IO.Options options = new IO.Options();
        options.forceNew = true;
        options.reconnection = false;
        options.timeout = connectTimeout.toMillis();
        options.query = query(credentials);
        Socket socket = socketFactory.apply(serverUri, options);
        SocketIoSession session = new SocketIoSession(socket);

        socket.on(EVENT_CONNECTED, args -> {
            log.debug("Handshake confirmed: {}", args.length > 0 ? args[0] : null);
            handshake.complete(session);
        });
        socket.on(EVENT_ERROR, args -> {
            JsonNode error = toJson(args);
            String code = error.path("code").asText("");
            String message = error.path("message").asText("Connection rejected");
            if (ERROR_AUTH_FAILED.equals(code)) {
                handshake.completeExceptionally(new AuthException(message));
            } else {
                handshake.completeExceptionally(new ConnectionException(code + ": " + message));
            }
        });
        socket.on(Socket.EVENT_CONNECT_ERROR, args -> handshake.completeExceptionally(
                new ConnectionException("Connect error: " + (args.length > 0 ? args[0] : "unknown"))));
        socket.on(Socket.EVENT_DISCONNECT, args -> {
            String reason = args.length > 0 ? String.valueOf(args[0]) : "unknown";
            if (!handshake.completeExceptionally(new ConnectionException("Disconnected during handshake: " + reason))) {
                events.onDisconnected(reason);
            }
        });
        for (String event : FORWARDED_EVENTS) {
            socket.on(event, args -> events.onEvent(event, toJson(args)));
        }

        // a failed handshake leaves nothing open behind
        handshake.whenComplete((opened, failure) -> {
            if (failure != null) {
                session.close();
            }
        });
        socket.connect();
        return handshake;
    }

    private String query(Credentials credentials) {
        return "token=" + URLEncoder.encode(credentials.getToken(), StandardCharsets.UTF_8)
                + "&profile_id=" + URLEncoder.encode(credentials.getProfileId(), StandardCharsets.UTF_8);
    }

    JsonNode toJson(Object[] args) {
        if (args.length == 0 || args[0] == null) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(args[0].toString());
        } catch (JsonProcessingException ex) {
            log.warn("Ignoring unreadable event payload: {}", ex.getOriginalMessage());
            return NullNode.getInstance();
        }
    }

    private static final class SocketIoSession implements TransportSession {

        private final Socket socket;

        private SocketIoSession(Socket socket) {
            this.socket = socket;
        }

        @Override
        public String id() {
            return socket.id();
        }

        @Override
        public void emit(String event, String argument) {
            socket.emit(event, argument);
        }

        @Override
        public void close() {
            socket.off();
            socket.disconnect();
        }
    }
}
