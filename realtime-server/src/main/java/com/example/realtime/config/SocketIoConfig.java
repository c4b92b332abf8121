package com.example.realtime.config;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.annotation.Bean;

@Slf4j
@org.springframework.context.annotation.Configuration
public class SocketIoConfig implements DisposableBean {

    private SocketIOServer server;

    @Bean
    public SocketIOServer socketIOServer(RealtimeProperties properties) {
        RealtimeProperties.SocketIo socketIo = properties.getSocketio();
        Configuration configuration = new Configuration();
        configuration.setHostname(socketIo.getHost());
        configuration.setPort(socketIo.getPort());
        configuration.setAllowCustomRequests(true);
        configuration.setOrigin(socketIo.getOrigin());
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setPingInterval((int) socketIo.getPingInterval().toMillis());
        configuration.setPingTimeout((int) socketIo.getPingTimeout().toMillis());
        configuration.setJsonSupport(new SocketIoJsonSupport());

        server = new SocketIOServer(configuration);
        server.start();
        log.info("Socket.IO server listening on {}:{}", socketIo.getHost(), socketIo.getPort());
        return server;
    }

    @PreDestroy
    @Override
    public void destroy() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("Socket.IO server stopped");
        }
    }
}
