package com.example.engage.service;

import java.util.concurrent.CompletableFuture;

/**
 * A live push channel to one user.
 */
public interface ConnectionHandle {

    String id();

    boolean isOpen();

    /**
     * Pushes an event. The returned future completes once the transport accepted (or the client
     * acknowledged) the event and completes exceptionally with a
     * {@link com.example.engage.service.exception.DeliveryException} on failure.
     */
    CompletableFuture<Void> send(String event, Object payload);
}
