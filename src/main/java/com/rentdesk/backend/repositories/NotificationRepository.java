package com.rentdesk.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.rentdesk.backend.entities.Notification;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    List<Notification> findByPaymentIdOrderByCreatedAtDesc(UUID paymentId);

    Optional<Notification> findFirstByMessageIdOrderByCreatedAtDesc(String messageId);
}
