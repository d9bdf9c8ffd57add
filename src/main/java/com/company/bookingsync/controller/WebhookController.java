package com.company.bookingsync.controller;

import com.company.bookingsync.dto.request.CalendlyWebhookRequest;
import com.company.bookingsync.remote.calendly.CalendlyWebhookVerifier;
import com.company.bookingsync.service.webhook.CalendlyWebhookService;
import com.company.bookingsync.service.webhook.WebhookResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Provider push notifications. Authenticated by signature, not by JWT.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
@Tag(name = "Webhooks", description = "Booking notifications pushed by providers")
@RequiredArgsConstructor
public class WebhookController {

    private final CalendlyWebhookVerifier verifier;
    private final CalendlyWebhookService webhookService;
    private final ObjectMapper objectMapper;

    @PostMapping("/calendly")
    @Operation(summary = "Receive a Calendly invitee.created / invitee.canceled delivery")
    @ApiResponse(responseCode = "200", description = "Stored, or accepted and ignored")
    @ApiResponse(responseCode = "400", description = "Body is not a Calendly delivery")
    @ApiResponse(responseCode = "401", description = "Signature missing or invalid")
    public ResponseEntity<Map<String, Object>> receiveCalendly(
            @RequestHeader(name = CalendlyWebhookVerifier.SIGNATURE_HEADER, required = false) String signature,
            @RequestBody String rawBody) {

        // Verify against the exact bytes received, before parsing
        verifier.verify(signature, rawBody);

        CalendlyWebhookRequest request;
        try {
            request = objectMapper.readValue(rawBody, CalendlyWebhookRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed webhook body");
        }

        WebhookResult result = webhookService.handle(request);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("event", result.getEvent());
        response.put("processed", result.getProcessed());
        response.put("failed", result.getFailed());
        response.put("tenants", result.getTenantsMatched());
        if (result.isIgnored()) {
            response.put("ignored", result.getIgnoredReason());
        }
        return ResponseEntity.ok(response);
    }
}
