package com.example.engage.websocket;

import com.corundumstudio.socketio.AckCallback;
import com.corundumstudio.socketio.SocketIOClient;
import com.example.engage.service.ConnectionHandle;
import com.example.engage.service.exception.DeliveryException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ConnectionHandle} over a netty-socketio client. With acknowledgements enabled the
 * send completes only when the client acks the event.
 */
public class SocketIoConnectionHandle implements ConnectionHandle {

    private final SocketIOClient client;
    private final boolean requireAck;
    private final Duration ackTimeout;

    public SocketIoConnectionHandle(SocketIOClient client, boolean requireAck, Duration ackTimeout) {
        this.client = client;
        this.requireAck = requireAck;
        this.ackTimeout = ackTimeout;
    }

    @Override
    public String id() {
        return client.getSessionId().toString();
    }

    @Override
    public boolean isOpen() {
        return client.isChannelOpen();
    }

    @Override
    public CompletableFuture<Void> send(String event, Object payload) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (!client.isChannelOpen()) {
            result.completeExceptionally(new DeliveryException("Connection " + id() + " is closed"));
            return result;
        }
        try {
            if (requireAck) {
                int timeoutSeconds = (int) Math.max(ackTimeout.toSeconds(), 1);
                client.sendEvent(event, new AckCallback<>(Object.class, timeoutSeconds) {
                    @Override
                    public void onSuccess(Object ack) {
                        result.complete(null);
                    }

                    @Override
                    public void onTimeout() {
                        result.completeExceptionally(new DeliveryException("No acknowledgement for " + event));
                    }
                }, payload);
            } else {
                client.sendEvent(event, payload);
                result.complete(null);
            }
        } catch (RuntimeException ex) {
            result.completeExceptionally(new DeliveryException("Push of " + event + " failed", ex));
        }
        return result;
    }
}
