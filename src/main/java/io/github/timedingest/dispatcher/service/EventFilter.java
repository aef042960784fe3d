package io.github.timedingest.dispatcher.service;

import io.github.timedingest.dispatcher.audit.Log;
import io.github.timedingest.dispatcher.config.IngestProperties;
import io.github.timedingest.dispatcher.domain.event.BlobCreatedNotification;
import io.github.timedingest.dispatcher.domain.event.EventGridEvent;
import io.github.timedingest.dispatcher.domain.exception.IngestConfigurationException;
import io.github.timedingest.dispatcher.domain.model.FilterDecision;
import io.github.timedingest.dispatcher.domain.model.ParsedTimestamp;
import io.github.timedingest.dispatcher.domain.model.RejectReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Decides whether a notification warrants ingestion. Guards run in order and the first rejection wins:
 * event kind, source host, blacklist, staleness, empty payload.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventFilter {

    private final TimeExtractor timeExtractor;
    private final IngestProperties properties;

    public FilterDecision evaluate(BlobCreatedNotification notification) {
        String eventKind = notification.eventKind();
        if (!EventGridEvent.BLOB_CREATED.equals(eventKind)) {
            Log.warn(log, "BLOB_EVENT_UNSUPPORTED", "The event type {} is not supported", eventKind);
            return FilterDecision.reject(RejectReason.UNSUPPORTED_EVENT_KIND, notification.objectUrl());
        }

        if (!isAllowedHost(notification.objectUrl())) {
            Log.warn(log, "BLOB_HOST_UNTRUSTED", "The blob {} is not hosted on an allowed storage account",
                    notification.objectUrl());
            return FilterDecision.reject(RejectReason.UNTRUSTED_HOST, notification.objectUrl());
        }

        IngestProperties.Filter filter = properties.getFilter();
        String url = decode(notification.objectUrl());
        log.trace("URL found: {}", url);

        String blacklist = filter.getBlacklist();
        if (blacklist != null && !blacklist.isBlank() && url.contains(blacklist)) {
            Log.event(log, "BLOB_BLACKLISTED", "Nothing to insert because {} is blacklisted ({})", url, blacklist);
            return FilterDecision.reject(RejectReason.BLACKLISTED_PATH, url);
        }

        ParsedTimestamp insertDate = timeExtractor.extract(url, filter.getDateMarker(), filter.getDatePattern());
        Instant minDate = minimumDate(filter);
        if (insertDate.isBefore(minDate)) {
            Log.warn(log, "BLOB_STALE", "The blob {} is too old (configured min: {}, actual: {})",
                    url, filter.getMinDate(), insertDate);
            return FilterDecision.reject(RejectReason.STALE_OBJECT, url);
        }

        // Blob storage raises one event at zero length on creation and a second one once the write completes.
        if (notification.contentLength() == 0) {
            Log.warn(log, "BLOB_EMPTY_EVENT", "Found an empty blob {} which has been raised by event grid", url);
            return FilterDecision.reject(RejectReason.EMPTY_OBJECT_EVENT, url);
        }

        return FilterDecision.accept(url, insertDate);
    }

    private Instant minimumDate(IngestProperties.Filter filter) {
        if (filter.getMinDate() == null || filter.getMinDatePattern() == null) {
            throw new IngestConfigurationException("Minimum date and its pattern must both be configured");
        }
        try {
            return TimeExtractor.parseInstant(filter.getMinDate(), filter.getMinDatePattern());
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw new IngestConfigurationException("Minimum date '" + filter.getMinDate()
                    + "' does not match pattern '" + filter.getMinDatePattern() + "'", e);
        }
    }

    private boolean isAllowedHost(String objectUrl) {
        List<String> allowedHosts = properties.getSource().getAllowedHosts();
        if (allowedHosts == null || allowedHosts.isEmpty()) {
            return true;
        }
        if (objectUrl == null) {
            return false;
        }
        String host;
        try {
            host = new URI(objectUrl).getHost();
        } catch (URISyntaxException e) {
            return false;
        }
        return host != null && allowedHosts.stream().anyMatch(allowed -> allowed.trim().equalsIgnoreCase(host));
    }

    static String decode(String objectUrl) {
        if (objectUrl == null) {
            return "";
        }
        try {
            return URLDecoder.decode(objectUrl, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed percent-encoding in {}, using it undecoded", objectUrl);
            return objectUrl;
        }
    }
}
