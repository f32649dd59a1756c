package com.rentdesk.backend.integration;

import com.rentdesk.backend.entities.RentPayment;
import com.rentdesk.backend.entities.Tenant;
import com.rentdesk.backend.entities.Unit;
import com.rentdesk.backend.enums.NotificationChannel;
import com.rentdesk.backend.exceptions.NotificationDeliveryException;

/**
 * Outbound channel for rent messages.
 */
public interface NotificationDispatcher {

    /**
     * Sends one message about {@code payment} to {@code tenant}.
     *
     * @return the provider's delivery id
     * @throws NotificationDeliveryException when the message could not be handed to the provider
     */
    String notify(Tenant tenant, RentPayment payment, Unit unit, String propertyAddress, NotificationContext context);

    NotificationChannel channel();
}
