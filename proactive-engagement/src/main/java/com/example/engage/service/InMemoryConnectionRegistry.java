package com.example.engage.service;

import com.example.engage.config.EngageProperties;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
public class InMemoryConnectionRegistry implements ConnectionRegistry {

    private final Map<String, ConnectionHandle> connections = new ConcurrentHashMap<>();
    private final EngageProperties engageProperties;

    public InMemoryConnectionRegistry(EngageProperties engageProperties) {
        this.engageProperties = engageProperties;
    }

    @Override
    public Optional<ConnectionHandle> register(String userId, ConnectionHandle handle) {
        if (!StringUtils.hasText(userId) || handle == null) {
            throw new IllegalArgumentException("userId and handle are required");
        }
        ConnectionHandle previous = connections.put(userId, handle);
        if (previous != null && previous != handle) {
            log.info("User {} connected again; connection {} replaces {}", userId, handle.id(), previous.id());
            return Optional.of(previous);
        }
        return Optional.empty();
    }

    @Override
    public void unregister(String userId) {
        if (userId != null) {
            connections.remove(userId);
        }
    }

    @Override
    public boolean unregister(String userId, ConnectionHandle handle) {
        if (userId == null || handle == null) {
            return false;
        }
        boolean removed = connections.remove(userId, handle);
        if (!removed) {
            log.debug("Ignoring close of superseded connection {} for user {}", handle.id(), userId);
        }
        return removed;
    }

    @Override
    public boolean isConnected(String userId) {
        if (userId == null) {
            return false;
        }
        ConnectionHandle handle = connections.get(userId);
        return handle != null && handle.isOpen();
    }

    @Override
    public SendResult send(String userId, String event, Object payload) {
        ConnectionHandle handle = userId != null ? connections.get(userId) : null;
        if (handle == null || !handle.isOpen()) {
            return SendResult.notConnected();
        }
        Duration timeout = engageProperties.getDelivery().getSendTimeout();
        try {
            handle.send(event, payload).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return SendResult.delivered();
        } catch (TimeoutException ex) {
            log.warn("Push of {} to user {} timed out after {}", event, userId, timeout);
            return SendResult.failed("send timed out after " + timeout);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("Push of {} to user {} failed: {}", event, userId, cause.getMessage());
            return SendResult.failed(describe(cause));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return SendResult.failed("interrupted");
        } catch (RuntimeException ex) {
            log.warn("Push of {} to user {} failed: {}", event, userId, ex.getMessage());
            return SendResult.failed(describe(ex));
        }
    }

    @Override
    public int connectionCount() {
        return connections.size();
    }

    private String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
