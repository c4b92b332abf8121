package com.example.realtime.websocket;

import com.corundumstudio.socketio.HandshakeData;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.realtime.domain.Room;
import com.example.realtime.dto.ConnectedPayload;
import com.example.realtime.dto.SocketErrorPayload;
import com.example.realtime.service.exception.AuthException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Socket.IO edge of the transport. Credentials are verified on the auth executor so a slow
 * verifier never holds a socket event-loop thread; the connection is registered with the
 * {@link RoomRegistry} once verification succeeds.
 */
@Slf4j
@Component
public class SocketIoRealtimeGateway {

    static final String PARAM_TOKEN = "token";
    static final String PARAM_PROFILE_ID = "profile_id";
    static final String PARAM_PROFILE_ID_ALIAS = "profileId";
    static final String ATTR_PROFILE_ID = "profileId";

    private final SocketIOServer socketIOServer;
    private final HandshakeAuthenticator handshakeAuthenticator;
    private final RoomRegistry roomRegistry;
    private final Executor authExecutor;

    public SocketIoRealtimeGateway(
            SocketIOServer socketIOServer,
            HandshakeAuthenticator handshakeAuthenticator,
            RoomRegistry roomRegistry,
            @Qualifier("authExecutor") Executor authExecutor) {
        this.socketIOServer = socketIOServer;
        this.handshakeAuthenticator = handshakeAuthenticator;
        this.roomRegistry = roomRegistry;
        this.authExecutor = authExecutor;
    }

    @PostConstruct
    public void registerListeners() {
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);
        for (RoomCommand command : RoomCommand.values()) {
            socketIOServer.addEventListener(
                    command.event(), String.class, (client, roomId, ackSender) -> handleRoomCommand(client, command, roomId));
        }
    }

    void handleConnect(SocketIOClient client) {
        HandshakeData handshake = client.getHandshakeData();
        String token = handshake.getSingleUrlParam(PARAM_TOKEN);
        String claimedProfileId = handshake.getSingleUrlParam(PARAM_PROFILE_ID);
        if (!StringUtils.hasText(claimedProfileId)) {
            claimedProfileId = handshake.getSingleUrlParam(PARAM_PROFILE_ID_ALIAS);
        }

        String claimed = claimedProfileId;
        try {
            authExecutor.execute(() -> completeHandshake(client, token, claimed));
        } catch (RejectedExecutionException ex) {
            log.warn("Handshake queue full, rejecting connection {}", client.getSessionId());
            reject(client, RealtimeEvents.ERROR_AUTH_UNAVAILABLE, "Server busy");
        }
    }

    void completeHandshake(SocketIOClient client, String token, String claimedProfileId) {
        String profileId;
        try {
            profileId = handshakeAuthenticator.authenticate(token, claimedProfileId);
        } catch (AuthException ex) {
            log.info("Rejected connection {}: {}", client.getSessionId(), ex.getMessage());
            reject(client, RealtimeEvents.ERROR_AUTH_FAILED, ex.getMessage());
            return;
        } catch (RuntimeException ex) {
            log.error("Could not verify credentials for connection {}", client.getSessionId(), ex);
            reject(client, RealtimeEvents.ERROR_AUTH_UNAVAILABLE, "Authentication failed");
            return;
        }

        client.set(ATTR_PROFILE_ID, profileId);
        LiveConnection connection = new SocketIoLiveConnection(client, profileId);
        roomRegistry.register(connection);
        roomRegistry.join(connection.id(), Room.user(profileId));

        // the socket may have dropped while the credential was being verified
        if (!client.isChannelOpen()) {
            roomRegistry.unregister(connection.id());
            log.info("Connection {} closed during handshake", connection.id());
            return;
        }

        client.sendEvent(RealtimeEvents.CONNECTED,
                new ConnectedPayload(connection.id(), profileId, System.currentTimeMillis()));
        log.info("Client {} connected as profile {}, joined {}", connection.id(), profileId, Room.user(profileId));
    }

    void handleDisconnect(SocketIOClient client) {
        String connectionId = client.getSessionId().toString();
        Set<String> rooms = roomRegistry.unregister(connectionId);
        if (!rooms.isEmpty()) {
            log.info("Client {} disconnected, left {} room(s)", connectionId, rooms.size());
        }
    }

    void handleRoomCommand(SocketIOClient client, RoomCommand command, String roomId) {
        String connectionId = client.getSessionId().toString();
        String profileId = client.get(ATTR_PROFILE_ID);
        if (profileId == null || !roomRegistry.isRegistered(connectionId)) {
            log.warn("Room command {} from unauthenticated connection {}", command.event(), connectionId);
            client.disconnect();
            return;
        }
        if (!StringUtils.hasText(roomId)) {
            log.warn("Closing connection {}: {} without a room id", connectionId, command.event());
            reject(client, RealtimeEvents.ERROR_PROTOCOL, command.event() + " requires a room id");
            return;
        }

        Room room = Room.of(command.kind(), roomId);
        boolean changed = command.isJoin()
                ? roomRegistry.join(connectionId, room)
                : roomRegistry.leave(connectionId, room);
        if (changed) {
            log.info("Profile {} {} room {}", profileId, command.isJoin() ? "joined" : "left", room);
        } else {
            log.debug("Profile {} {} on {} was a no-op", profileId, command.event(), room);
        }
    }

    private void reject(SocketIOClient client, String code, String message) {
        client.sendEvent(RealtimeEvents.ERROR, new SocketErrorPayload(code, message));
        client.disconnect();
    }

    @PreDestroy
    public void shutdown() {
        for (RoomCommand command : RoomCommand.values()) {
            socketIOServer.removeAllListeners(command.event());
        }
        int closed = roomRegistry.closeAll().size();
        log.info("Closed {} live connection(s)", closed);
    }
}
