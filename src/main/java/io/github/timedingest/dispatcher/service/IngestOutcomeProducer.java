package io.github.timedingest.dispatcher.service;

import io.github.timedingest.dispatcher.domain.event.BlobCreatedNotification;
import io.github.timedingest.dispatcher.domain.event.IngestOutcomeEvent;
import io.github.timedingest.dispatcher.domain.event.IngestOutcomePayload;
import io.github.timedingest.dispatcher.domain.model.DispatchOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Publishes dispatch outcomes for downstream auditing. Publishing failures never change an outcome.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestOutcomeProducer {

    private final RabbitTemplate rabbitTemplate;

    @Value("${app.rabbitmq.outcomes.enabled:false}")
    private boolean enabled;

    @Value("${app.rabbitmq.outcomes.exchange}")
    private String exchange;

    @Value("${app.rabbitmq.outcomes.routing-key}")
    private String routingKey;

    public void publish(BlobCreatedNotification notification, DispatchOutcome outcome) {
        if (!enabled) {
            return;
        }

        IngestOutcomePayload payload = new IngestOutcomePayload(
                outcome.status().name(),
                notification.eventId(),
                outcome.objectUrl(),
                outcome.reason() != null ? outcome.reason().code() : null,
                outcome.error() != null ? outcome.error().getMessage() : null,
                outcome.submission() != null ? outcome.submission().ingestionSourceId() : null
        );

        IngestOutcomeEvent event = IngestOutcomeEvent.create("BLOB_INGEST_" + outcome.status().name(), payload);

        try {
            log.debug("Publishing outcome: Type={} Url={}", event.eventType(), outcome.objectUrl());
            rabbitTemplate.convertAndSend(exchange, routingKey, event);
        } catch (Exception e) {
            log.error("Failed to publish ingest outcome event", e);
        }
    }
}
