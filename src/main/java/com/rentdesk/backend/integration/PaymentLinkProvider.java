package com.rentdesk.backend.integration;

import java.math.BigDecimal;

import com.rentdesk.backend.exceptions.PaymentLinkException;

/**
 * Issues the payment-request token attached to a rent obligation.
 */
public interface PaymentLinkProvider {

    /**
     * @throws PaymentLinkException when no link could be produced
     */
    String generateLink(String email, String name, BigDecimal amount, String memo);
}
