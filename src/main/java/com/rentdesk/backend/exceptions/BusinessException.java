package com.rentdesk.backend.exceptions;

/**
 * Request was well formed but breaks a business rule (HTTP 422).
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
