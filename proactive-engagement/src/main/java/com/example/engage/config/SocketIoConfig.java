package com.example.engage.config;

import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Embedded Socket.IO server carrying proactive pushes. Listens on its own port next to the HTTP API.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "engage.socketio", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SocketIoConfig {

    @Bean(destroyMethod = "stop")
    public SocketIOServer socketIOServer(EngageProperties engageProperties, ObjectMapper objectMapper) {
        EngageProperties.SocketIo settings = engageProperties.getSocketio();

        com.corundumstudio.socketio.Configuration configuration = new com.corundumstudio.socketio.Configuration();
        configuration.setHostname(settings.getHost());
        configuration.setPort(settings.getPort());
        configuration.setOrigin(settings.getOrigin());
        configuration.setPingInterval((int) settings.getPingInterval().toMillis());
        configuration.setPingTimeout((int) settings.getPingTimeout().toMillis());
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setJsonSupport(new SocketIoJsonSupport(objectMapper));

        SocketIOServer server = new SocketIOServer(configuration);
        server.start();
        log.info("Socket.IO server listening on {}:{}", settings.getHost(), settings.getPort());
        return server;
    }
}
