package com.example.engage.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when a caller acts on a row owned by another user. Rendered as 404 so the
 * existence of other users' rows is not revealed.
 */
public class OwnershipException extends ServiceException {

    public OwnershipException(String message) {
        super(HttpStatus.NOT_FOUND, message, "not_found");
    }
}
