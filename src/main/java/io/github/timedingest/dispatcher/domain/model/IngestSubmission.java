package io.github.timedingest.dispatcher.domain.model;

import java.time.OffsetDateTime;

public record IngestSubmission(
        String ingestionSourceId,
        String queue,
        OffsetDateTime enqueuedAt
) { }
