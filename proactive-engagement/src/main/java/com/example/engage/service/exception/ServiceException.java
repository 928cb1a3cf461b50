package com.example.engage.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Base for failures that map onto an HTTP status and a stable machine-readable code.
 */
public abstract class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    protected ServiceException(HttpStatus status, String message, String errorCode) {
        this(status, message, errorCode, null);
    }

    protected ServiceException(HttpStatus status, String message, String errorCode, Throwable cause) {
        // stack traces only matter for server-side failures
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isServerError() {
        return status.is5xxServerError();
    }
}
