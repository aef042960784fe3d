package io.github.timedingest.dispatcher.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EventGridEvent(
        String id,
        String topic,
        String subject,
        String eventType,
        OffsetDateTime eventTime,
        String dataVersion,
        JsonNode data
) {
    public static final String BLOB_CREATED = "Microsoft.Storage.BlobCreated";
    public static final String SUBSCRIPTION_VALIDATION = "Microsoft.EventGrid.SubscriptionValidationEvent";

    public boolean isSubscriptionValidation() {
        return SUBSCRIPTION_VALIDATION.equals(eventType);
    }

    public String validationCode() {
        if (data == null || !data.hasNonNull("validationCode")) {
            return null;
        }
        return data.get("validationCode").asText();
    }

    public BlobCreatedNotification toNotification() {
        String url = data != null && data.hasNonNull("url") ? data.get("url").asText() : "";
        long contentLength = data != null && data.hasNonNull("contentLength") ? data.get("contentLength").asLong() : 0L;
        return new BlobCreatedNotification(id, eventType, url, contentLength, data);
    }
}
