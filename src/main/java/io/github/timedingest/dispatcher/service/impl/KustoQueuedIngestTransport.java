package io.github.timedingest.dispatcher.service.impl;

import com.microsoft.azure.kusto.ingest.IngestClient;
import com.microsoft.azure.kusto.ingest.IngestionMapping;
import com.microsoft.azure.kusto.ingest.IngestionProperties;
import com.microsoft.azure.kusto.ingest.source.BlobSourceInfo;
import io.github.timedingest.dispatcher.domain.exception.IngestSubmissionException;
import io.github.timedingest.dispatcher.domain.model.IngestCommand;
import io.github.timedingest.dispatcher.domain.model.IngestSubmission;
import io.github.timedingest.dispatcher.domain.model.MappingKind;
import io.github.timedingest.dispatcher.service.IngestTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.UUID;

/**
 * Queued ingestion through the Kusto ingest client. The call returns once the request is enqueued.
 */
@Slf4j
public class KustoQueuedIngestTransport implements IngestTransport {

    private final IngestClient ingestClient;

    public KustoQueuedIngestTransport(IngestClient ingestClient) {
        this.ingestClient = ingestClient;
    }

    @Override
    public IngestSubmission submit(IngestCommand command) {
        IngestionProperties properties = toIngestionProperties(command);
        UUID sourceId = UUID.randomUUID();
        BlobSourceInfo blob = new BlobSourceInfo(command.getSourceUrl(), command.getSourceSizeBytes(), sourceId);

        if (command.isDeleteSourceOnSuccess()) {
            log.warn("Source deletion is not supported by the queued ingest client, {} is kept", stripQuery(command.getSourceUrl()));
        }

        try {
            ingestClient.ingestFromBlob(blob, properties);
        } catch (Exception e) {
            throw new IngestSubmissionException("Could not enqueue the ingestion of "
                    + stripQuery(command.getSourceUrl()) + ": " + e.getMessage(), e);
        }

        log.debug("Enqueued ingestion {} for {}.{}", sourceId, command.getDatabase(), command.getTable());
        return new IngestSubmission(sourceId.toString(), command.getDatabase() + "." + command.getTable(),
                OffsetDateTime.now());
    }

    static IngestionProperties toIngestionProperties(IngestCommand command) {
        IngestionProperties properties = new IngestionProperties(command.getDatabase(), command.getTable());
        properties.setDataFormat(dataFormat(command.getMappingKind()));
        if (command.getMappingReference() != null && !command.getMappingReference().isBlank()) {
            properties.setIngestionMapping(command.getMappingReference(), mappingKind(command.getMappingKind()));
        }
        properties.setAdditionalTags(new ArrayList<>(command.getTags()));
        properties.setAdditionalProperties(new HashMap<>(command.getAdditionalProperties()));
        return properties;
    }

    private static IngestionProperties.DataFormat dataFormat(MappingKind kind) {
        return switch (kind) {
            case CSV -> IngestionProperties.DataFormat.CSV;
            case AVRO -> IngestionProperties.DataFormat.AVRO;
            case JSON -> IngestionProperties.DataFormat.JSON;
        };
    }

    private static IngestionMapping.IngestionMappingKind mappingKind(MappingKind kind) {
        return switch (kind) {
            case CSV -> IngestionMapping.IngestionMappingKind.CSV;
            case AVRO -> IngestionMapping.IngestionMappingKind.AVRO;
            case JSON -> IngestionMapping.IngestionMappingKind.JSON;
        };
    }

    private static String stripQuery(String url) {
        int query = url.indexOf('?');
        return query < 0 ? url : url.substring(0, query);
    }
}
