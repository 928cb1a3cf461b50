package com.example.engage.service.exception;

/**
 * Transient failure while pushing a message over a live connection. Handled by the
 * delivery retry policy and never rendered to HTTP callers.
 */
public class DeliveryException extends RuntimeException {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
