package io.github.timedingest.dispatcher.listener;

import io.github.timedingest.dispatcher.audit.Log;
import io.github.timedingest.dispatcher.domain.event.BlobCreatedNotification;
import io.github.timedingest.dispatcher.domain.event.EventGridEvent;
import io.github.timedingest.dispatcher.domain.exception.IngestDispatchException;
import io.github.timedingest.dispatcher.domain.model.DispatchOutcome;
import io.github.timedingest.dispatcher.service.IngestDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Consumes storage events forwarded to RabbitMQ. A failed dispatch is thrown back to the listener container, which
 * retries with backoff and dead-letters the message once the attempts are exhausted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlobEventListener {

    private final IngestDispatcher dispatcher;

    @RabbitListener(queues = "${app.rabbitmq.queue.ingestion}")
    public void handleBlobEvent(EventGridEvent event) {
        if (event == null) {
            log.warn("Received an empty message. Ignoring.");
            return;
        }

        BlobCreatedNotification notification = event.toNotification();

        MDC.put("event.id", String.valueOf(event.id()));
        MDC.put("blob.url", notification.objectUrl());
        try {
            Log.event(log, "BLOB_EVENT_RECEIVED", "Received {} event {} for {}",
                    event.eventType(), event.id(), event.subject());

            DispatchOutcome outcome = dispatcher.dispatch(notification);
            if (outcome.isFailed()) {
                throw new IngestDispatchException("Dispatch of " + outcome.objectUrl() + " failed", outcome.error());
            }
        } finally {
            MDC.clear();
        }
    }
}
