package io.github.timedingest.dispatcher.service;

import io.github.timedingest.dispatcher.audit.Log;
import io.github.timedingest.dispatcher.domain.event.BlobCreatedNotification;
import io.github.timedingest.dispatcher.domain.exception.IngestConfigurationException;
import io.github.timedingest.dispatcher.domain.model.DispatchOutcome;
import io.github.timedingest.dispatcher.domain.model.FilterDecision;
import io.github.timedingest.dispatcher.domain.model.IngestCommand;
import io.github.timedingest.dispatcher.domain.model.IngestSubmission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for one notification. Never throws; the calling boundary turns FAILED into its own failure signal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestDispatcher {

    private final IngestClientInitializer clientInitializer;
    private final EventFilter eventFilter;
    private final IngestCommandBuilder commandBuilder;
    private final IngestOutcomeProducer outcomeProducer;

    public DispatchOutcome dispatch(BlobCreatedNotification notification) {
        DispatchOutcome outcome = run(notification);
        outcomeProducer.publish(notification, outcome);
        return outcome;
    }

    private DispatchOutcome run(BlobCreatedNotification notification) {
        Optional<IngestTransport> transport = clientInitializer.ensureReady();
        if (transport.isEmpty()) {
            Log.error(log, "BLOB_INGEST_FAILED", "Could not initialize, cancel request for {}", notification.objectUrl());
            return DispatchOutcome.failed(notification.objectUrl(),
                    new IngestConfigurationException("Ingest client is not ready"));
        }

        String url = notification.objectUrl();
        try {
            FilterDecision decision = eventFilter.evaluate(notification);
            url = decision.decodedUrl();
            if (decision.rejected()) {
                return DispatchOutcome.skipped(url, decision.reason());
            }

            IngestCommand command = commandBuilder.build(decision.timestamp(), url, notification.contentLength());
            IngestSubmission submission = transport.get().submit(command);

            Log.event(log, "BLOB_INGEST_SUBMITTED", "Triggered insertion of blob {} (size: {}, insert date: {})",
                    url, notification.contentLength(), decision.timestamp());
            return DispatchOutcome.submitted(url, submission);
        } catch (RuntimeException e) {
            Log.error(log, "BLOB_INGEST_FAILED", "Error while trying to insert blob {} because of message: {}",
                    url, e.getMessage(), e);
            return DispatchOutcome.failed(url, e);
        }
    }
}
