package com.example.engage.service.exception;

import org.springframework.http.HttpStatus;

public class PersistenceFailureException extends ServiceException {

    public PersistenceFailureException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, "persistence_error");
    }

    public PersistenceFailureException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, "persistence_error", cause);
    }
}
