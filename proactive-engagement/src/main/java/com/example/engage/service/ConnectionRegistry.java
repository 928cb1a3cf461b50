package com.example.engage.service;

import java.util.Optional;

/**
 * Maps user ids to their live connection. At most one handle per user; the latest registration wins.
 */
public interface ConnectionRegistry {

    /**
     * Registers a handle, returning the handle it replaced, if any.
     */
    Optional<ConnectionHandle> register(String userId, ConnectionHandle handle);

    void unregister(String userId);

    /**
     * Removes the mapping only while it still points at {@code handle}.
     */
    boolean unregister(String userId, ConnectionHandle handle);

    boolean isConnected(String userId);

    /**
     * Pushes an event to the user's live connection. Never throws.
     */
    SendResult send(String userId, String event, Object payload);

    int connectionCount();
}
