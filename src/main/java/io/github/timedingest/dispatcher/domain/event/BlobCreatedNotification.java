package io.github.timedingest.dispatcher.domain.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A storage notification as consumed by the dispatcher. {@code objectUrl} is still percent-encoded.
 */
public record BlobCreatedNotification(
        String eventId,
        String eventKind,
        String objectUrl,
        long contentLength,
        JsonNode rawPayload
) {
    public static BlobCreatedNotification of(String eventKind, String objectUrl, long contentLength) {
        return new BlobCreatedNotification(null, eventKind, objectUrl, contentLength, null);
    }
}
