package com.rentdesk.backend.dto.rent;

import com.rentdesk.backend.enums.NotificationChannel;
import com.rentdesk.backend.enums.NotificationStatus;
import com.rentdesk.backend.enums.NotificationType;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class NotificationResponseDTO {

    private String id;
    private String paymentId;
    private NotificationType type;
    private NotificationChannel channel;
    private NotificationStatus status;
    private String messageId;
    private String errorMessage;
    private LocalDateTime sentAt;
    private LocalDateTime createdAt;
}
