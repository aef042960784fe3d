package io.github.timedingest.dispatcher.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestOutcomePayload(
        String status,
        String sourceEventId,
        String objectUrl,
        String reasonCode,
        String errorMessage,
        String ingestionSourceId
) { }
