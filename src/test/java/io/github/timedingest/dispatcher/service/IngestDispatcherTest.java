package io.github.timedingest.dispatcher.service;

import io.github.timedingest.dispatcher.config.IngestProperties;
import io.github.timedingest.dispatcher.domain.event.BlobCreatedNotification;
import io.github.timedingest.dispatcher.domain.event.EventGridEvent;
import io.github.timedingest.dispatcher.domain.exception.IngestConfigurationException;
import io.github.timedingest.dispatcher.domain.exception.IngestSubmissionException;
import io.github.timedingest.dispatcher.domain.model.DispatchOutcome;
import io.github.timedingest.dispatcher.domain.model.IngestCommand;
import io.github.timedingest.dispatcher.domain.model.IngestSubmission;
import io.github.timedingest.dispatcher.domain.model.MappingKind;
import io.github.timedingest.dispatcher.domain.model.RejectReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class IngestDispatcherTest {

    private static final String FRESH_URL = "https://acct.blob.core.windows.net/landing/date=2023-06-01/part-0.json";

    private IngestProperties properties;
    private RecordingTransport transport;
    private IngestCommandBuilder commandBuilder;
    private IngestOutcomeProducer outcomeProducer;
    private IngestDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        properties = TestProperties.valid();
        transport = new RecordingTransport();
        commandBuilder = spy(new IngestCommandBuilder(properties));
        outcomeProducer = mock(IngestOutcomeProducer.class);
        dispatcher = new IngestDispatcher(
                new IngestClientInitializer(properties, settings -> transport),
                new EventFilter(new TimeExtractor(), properties),
                commandBuilder,
                outcomeProducer);
    }

    @Test
    void blacklistedPathIsSkipped() {
        DispatchOutcome outcome = dispatcher.dispatch(blobCreated(
                "https://acct.blob.core.windows.net/c/azuretmpfolder/data/2023-06-01_001.json", 512));

        assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.SKIPPED);
        assertThat(outcome.reason()).isEqualTo(RejectReason.BLACKLISTED_PATH);
        assertThat(transport.commands).isEmpty();
    }

    @Test
    void freshObjectIsSubmitted() {
        DispatchOutcome outcome = dispatcher.dispatch(blobCreated(FRESH_URL, 1024));

        assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.SUBMITTED);
        assertThat(outcome.submission().ingestionSourceId()).isEqualTo("source-1");
        assertThat(transport.commands).hasSize(1);

        IngestCommand command = transport.commands.get(0);
        assertThat(command.getMappingKind()).isEqualTo(MappingKind.JSON);
        assertThat(command.getMappingReference()).isEqualTo("BlobMapping");
        assertThat(command.getTags()).containsExactly("2023-06-01T00:00:00Z");
        assertThat(command.getSourceSizeBytes()).isEqualTo(1024);
        assertThat(command.getSourceUrl()).isEqualTo(FRESH_URL + "?sv=2022-11-02&sig=abc");
    }

    @Test
    void objectOlderThanMinimumDateIsSkipped() {
        properties.getFilter().setMinDate("2024-01-01");

        DispatchOutcome outcome = dispatcher.dispatch(blobCreated(FRESH_URL, 1024));

        assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.SKIPPED);
        assertThat(outcome.reason()).isEqualTo(RejectReason.STALE_OBJECT);
        assertThat(transport.commands).isEmpty();
    }

    @Test
    void unknownMappingKindIsSubmittedWithJsonMapping() {
        properties.getKusto().setMappingKind("xml");

        DispatchOutcome outcome = dispatcher.dispatch(blobCreated(FRESH_URL, 1024));

        assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.SUBMITTED);
        assertThat(transport.commands.get(0).getMappingKind()).isEqualTo(MappingKind.JSON);
        assertThat(transport.commands.get(0).getMappingReference()).isEqualTo("BlobMapping");
    }

    @Test
    void emptyObjectEventIsSkipped() {
        DispatchOutcome outcome = dispatcher.dispatch(blobCreated(FRESH_URL, 0));

        assertThat(outcome.status()).isEqualTo(DispatchOutcome.Status.SKIPPED);
        assertThat(outcome.reason()).isEqualTo(RejectReason.EMPTY_OBJECT_EVENT);
    }

    @Test
    void otherEventKindsNeverReachTheBuilder() {
        DispatchOutcome outcome = dispatcher.dispatch(
                BlobCreatedNotification.of("Microsoft.Storage.BlobDeleted", FRESH_URL, 1024));

        assertThat(outcome.reason()).isEqualTo(RejectReason.UNSUPPORTED_EVENT_KIND);
        verify(commandBuilder, never()).build(any(), any(), anyLong());
        assertThat(transport.commands).isEmpty();
    }

    @Test
    void missingClientConfigurationFails() {
        properties.getKusto().setEndpoint("");

        DispatchOutcome outcome = dispatcher.dispatch(blobCreated(FRESH_URL, 1024));

        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.error()).isInstanceOf(IngestConfigurationException.class);
        assertThat(transport.commands).isEmpty();
    }

    @Test
    void submissionErrorIsReportedAsFailure() {
        transport.failure = new IngestSubmissionException("queue unavailable");

        DispatchOutcome outcome = dispatcher.dispatch(blobCreated(FRESH_URL, 1024));

        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.error()).isSameAs(transport.failure);
        assertThat(outcome.objectUrl()).isEqualTo(FRESH_URL);
    }

    @Test
    void configurationErrorDuringBuildIsReportedAsFailure() {
        properties.getKusto().setDatabase(null);

        DispatchOutcome outcome = dispatcher.dispatch(blobCreated(FRESH_URL, 1024));

        assertThat(outcome.isFailed()).isTrue();
        assertThat(outcome.error()).isInstanceOf(IngestConfigurationException.class);
    }

    @Test
    void everyOutcomeIsPublished() {
        DispatchOutcome outcome = dispatcher.dispatch(blobCreated(FRESH_URL, 0));

        verify(outcomeProducer).publish(any(BlobCreatedNotification.class), eq(outcome));
    }

    private static BlobCreatedNotification blobCreated(String url, long contentLength) {
        return BlobCreatedNotification.of(EventGridEvent.BLOB_CREATED, url, contentLength);
    }

    static class RecordingTransport implements IngestTransport {
        final List<IngestCommand> commands = new CopyOnWriteArrayList<>();
        volatile RuntimeException failure;

        @Override
        public IngestSubmission submit(IngestCommand command) {
            if (failure != null) {
                throw failure;
            }
            commands.add(command);
            return new IngestSubmission("source-" + commands.size(), "queue", OffsetDateTime.now());
        }
    }
}
