package io.github.timedingest.dispatcher.domain.event;

import java.time.OffsetDateTime;
import java.util.UUID;

public record IngestOutcomeEvent(
        String messageId,
        OffsetDateTime timestamp,
        String triggerType,
        String eventType,
        IngestOutcomePayload payload
) {
    public static IngestOutcomeEvent create(String eventType, IngestOutcomePayload payload) {
        return new IngestOutcomeEvent(
                UUID.randomUUID().toString(),
                OffsetDateTime.now(),
                "blob_created_dispatch",
                eventType,
                payload
        );
    }
}
