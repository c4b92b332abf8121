package com.example.realtime.websocket;

import com.corundumstudio.socketio.SocketIOClient;

class SocketIoLiveConnection implements LiveConnection {

    private final SocketIOClient client;
    private final String profileId;

    SocketIoLiveConnection(SocketIOClient client, String profileId) {
        this.client = client;
        this.profileId = profileId;
    }

    @Override
    public String id() {
        return client.getSessionId().toString();
    }

    @Override
    public String profileId() {
        return profileId;
    }

    @Override
    public void send(String event, Object data) {
        client.sendEvent(event, data);
    }

    @Override
    public void close() {
        client.disconnect();
    }
}
