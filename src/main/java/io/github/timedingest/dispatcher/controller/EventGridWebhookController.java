package io.github.timedingest.dispatcher.controller;

import io.github.timedingest.dispatcher.audit.Log;
import io.github.timedingest.dispatcher.domain.event.BlobCreatedNotification;
import io.github.timedingest.dispatcher.domain.event.EventGridEvent;
import io.github.timedingest.dispatcher.domain.model.DispatchOutcome;
import io.github.timedingest.dispatcher.service.IngestDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event Grid webhook subscription endpoint. Callers authenticate with the shared key, passed as the {@code code}
 * query parameter of the subscription URL or as the {@code aeg-sas-key} header. A 503 makes Event Grid redeliver
 * the batch.
 */
@Slf4j
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventGridWebhookController {

    private final IngestDispatcher dispatcher;

    @Value("${app.webhook.key:}")
    private String webhookKey;

    @PostMapping
    public ResponseEntity<Map<String, Object>> receive(@RequestBody List<EventGridEvent> events,
                                                       @RequestParam(name = "code", required = false) String code,
                                                       @RequestHeader(name = "aeg-sas-key", required = false) String sasKey) {
        if (!isAuthorized(code) && !isAuthorized(sasKey)) {
            Log.warn(log, "WEBHOOK_UNAUTHORIZED", "Rejected a batch of {} events without a valid webhook key",
                    events.size());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Invalid webhook key"));
        }

        if (events.size() == 1 && events.get(0).isSubscriptionValidation()) {
            EventGridEvent validation = events.get(0);
            log.info("Answering Event Grid subscription validation for {}", validation.topic());
            return ResponseEntity.ok(Map.of("validationResponse", String.valueOf(validation.validationCode())));
        }

        List<Map<String, String>> results = new ArrayList<>(events.size());
        boolean failed = false;

        for (EventGridEvent event : events) {
            BlobCreatedNotification notification = event.toNotification();
            MDC.put("event.id", String.valueOf(event.id()));
            MDC.put("blob.url", notification.objectUrl());
            try {
                Log.event(log, "BLOB_EVENT_RECEIVED", "Received {} event {} for {}",
                        event.eventType(), event.id(), event.subject());

                DispatchOutcome outcome = dispatcher.dispatch(notification);
                failed |= outcome.isFailed();
                results.add(toResult(event, outcome));
            } finally {
                MDC.clear();
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("results", results);
        if (failed) {
            body.put("error", "At least one event could not be dispatched");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        return ResponseEntity.ok(body);
    }

    // an unconfigured key rejects every caller
    private boolean isAuthorized(String presented) {
        if (webhookKey == null || webhookKey.isBlank() || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(webhookKey.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, String> toResult(EventGridEvent event, DispatchOutcome outcome) {
        Map<String, String> result = new LinkedHashMap<>();
        result.put("id", event.id());
        result.put("status", outcome.status().name());
        if (outcome.reason() != null) {
            result.put("reason", outcome.reason().code());
        }
        if (outcome.error() != null) {
            result.put("error", outcome.error().getMessage());
        }
        return result;
    }
}
