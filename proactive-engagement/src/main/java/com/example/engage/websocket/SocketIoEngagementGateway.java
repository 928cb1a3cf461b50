package com.example.engage.websocket;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.engage.config.EngageProperties;
import com.example.engage.dto.SocketHandshakeResponse;
import com.example.engage.service.ConnectionHandle;
import com.example.engage.service.ConnectionRegistry;
import com.example.engage.service.PresenceService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Binds Socket.IO connections to the {@link ConnectionRegistry}: a connection registers its
 * user on connect and unregisters itself on disconnect.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "engage.socketio", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class SocketIoEngagementGateway {

    private static final String SYSTEM_EVENT = "system:event";
    private static final String ERROR_EVENT = "system:error";
    private static final String PING_EVENT = "ping";
    private static final String PONG_EVENT = "pong";

    private static final String PARAM_USER_ID = "userId";
    private static final String PARAM_TOKEN = "token";
    private static final String ATTR_USER_ID = "userId";
    private static final String ATTR_HANDLE = "handle";

    private final SocketIOServer socketIOServer;
    private final ConnectionRegistry connectionRegistry;
    private final PresenceService presenceService;
    private final EngageProperties engageProperties;
    private final ObjectMapper objectMapper;

    @PostConstruct
    public void registerListeners() {
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);
        socketIOServer.addEventListener(PING_EVENT, Object.class, this::handlePing);
    }

    void handleConnect(SocketIOClient client) {
        try {
            String userId = resolveUserId(
                    client.getHandshakeData().getSingleUrlParam(PARAM_USER_ID),
                    client.getHandshakeData().getSingleUrlParam(PARAM_TOKEN));
            if (!StringUtils.hasText(userId)) {
                throw new IllegalArgumentException("userId or token is required");
            }

            ConnectionHandle handle = new SocketIoConnectionHandle(
                    client,
                    engageProperties.getDelivery().isRequireAck(),
                    engageProperties.getDelivery().getSendTimeout());
            client.set(ATTR_USER_ID, userId);
            client.set(ATTR_HANDLE, handle);
            connectionRegistry.register(userId, handle);
            presenceService.markPresent(userId);

            client.sendEvent(SYSTEM_EVENT, SocketHandshakeResponse.builder()
                    .userId(userId)
                    .connectionId(handle.id())
                    .connectedAt(Instant.now())
                    .build());
            log.info("Client {} connected for user {} ({} live connections)",
                    client.getSessionId(), userId, connectionRegistry.connectionCount());
        } catch (Exception e) {
            log.warn("Rejected connection {}: {}", client.getSessionId(), e.getMessage());
            client.sendEvent(ERROR_EVENT, Map.of("message", String.valueOf(e.getMessage())));
            client.disconnect();
        }
    }

    void handleDisconnect(SocketIOClient client) {
        String userId = client.get(ATTR_USER_ID);
        ConnectionHandle handle = client.get(ATTR_HANDLE);
        if (userId == null || handle == null) {
            return;
        }
        if (connectionRegistry.unregister(userId, handle)) {
            presenceService.markAbsent(userId);
        }
        log.info("Client {} disconnected for user {} ({} live connections)",
                client.getSessionId(), userId, connectionRegistry.connectionCount());
    }

    private void handlePing(SocketIOClient client, Object payload, AckRequest ackRequest) {
        String userId = client.get(ATTR_USER_ID);
        if (userId != null) {
            presenceService.markPresent(userId);
        }
        client.sendEvent(PONG_EVENT, Map.of("timestamp", Instant.now().toEpochMilli()));
    }

    /**
     * Explicit {@code userId} wins. Otherwise a JWT-shaped token yields its {@code userId},
     * {@code sub} or {@code id} claim (signature is not checked), and an opaque token of the
     * form {@code <userId>-<suffix>} yields its prefix.
     */
    String resolveUserId(String userIdParam, String token) {
        if (StringUtils.hasText(userIdParam)) {
            return userIdParam.trim();
        }
        if (!StringUtils.hasText(token)) {
            return null;
        }
        String[] segments = token.split("\\.");
        if (segments.length == 3) {
            return claimFromJwt(segments[1]);
        }
        String prefix = token.split("-")[0];
        return StringUtils.hasText(prefix) ? prefix : null;
    }

    private String claimFromJwt(String payloadSegment) {
        try {
            byte[] json = Base64.getUrlDecoder().decode(payloadSegment);
            JsonNode claims = objectMapper.readTree(new String(json, StandardCharsets.UTF_8));
            for (String claim : new String[] {"userId", "sub", "id"}) {
                JsonNode value = claims.get(claim);
                if (value != null && !value.isNull() && StringUtils.hasText(value.asText())) {
                    return value.asText();
                }
            }
            return null;
        } catch (Exception ex) {
            throw new IllegalArgumentException("Malformed token", ex);
        }
    }

    @PreDestroy
    public void shutdown() {
        socketIOServer.removeAllListeners(PING_EVENT);
    }
}
