package com.example.engage.service.exception;

import org.springframework.http.HttpStatus;

public class ConflictException extends ServiceException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, message, "conflict");
    }

    public ConflictException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, message, "conflict", cause);
    }
}
