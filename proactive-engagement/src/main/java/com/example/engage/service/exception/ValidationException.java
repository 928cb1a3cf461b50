package com.example.engage.service.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends ServiceException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, message, "validation_error");
    }

    public ValidationException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, message, "validation_error", cause);
    }
}
