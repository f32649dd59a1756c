package com.rentdesk.backend.controllers;

import com.rentdesk.backend.config.WhatsAppProperties;
import com.rentdesk.backend.dto.ApiResponse;
import com.rentdesk.backend.exceptions.BadRequestException;
import com.rentdesk.backend.integration.DeliveryStatusUpdate;
import com.rentdesk.backend.integration.WhatsAppWebhookPayload;
import com.rentdesk.backend.services.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Subscription handshake and delivery receipts from the WhatsApp Cloud API.
 */
@Slf4j
@RestController
@RequestMapping("/api/whatsapp/webhook")
@RequiredArgsConstructor
public class WhatsAppWebhookController {

    private static final String SUBSCRIBE = "subscribe";

    private final WhatsAppProperties whatsAppProperties;
    private final NotificationService notificationService;

    @GetMapping(produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> verify(
            @RequestParam(name = "hub.mode", required = false) String mode,
            @RequestParam(name = "hub.verify_token", required = false) String token,
            @RequestParam(name = "hub.challenge", required = false) String challenge
    ) {
        if (mode == null || token == null) {
            return ResponseEntity.badRequest().build();
        }
        if (SUBSCRIBE.equals(mode) && whatsAppProperties.hasVerifyToken() && matches(token)) {
            log.info("[WhatsAppWebhook] subscription verified");
            return ResponseEntity.ok(challenge);
        }
        log.warn("[WhatsAppWebhook] verification rejected for mode={}", mode);
        return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Integer>> receive(@RequestBody WhatsAppWebhookPayload payload) {
        if (!payload.isBusinessAccount()) {
            throw new BadRequestException("Not a WhatsApp Business Account webhook");
        }
        int updated = 0;
        for (DeliveryStatusUpdate update : payload.statusUpdates()) {
            if (notificationService.applyDeliveryStatus(update)) {
                updated++;
            }
        }
        return ResponseEntity.ok(ApiResponse.success(updated, "Webhook processed"));
    }

    private boolean matches(String token) {
        return MessageDigest.isEqual(
                token.getBytes(StandardCharsets.UTF_8),
                whatsAppProperties.verifyToken().getBytes(StandardCharsets.UTF_8));
    }
}
