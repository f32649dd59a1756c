package com.rentdesk.backend.exceptions;

public class PaymentLinkException extends RuntimeException {

    public PaymentLinkException(String message) {
        super(message);
    }

    public PaymentLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
