package io.github.timedingest.dispatcher.service;

import io.github.timedingest.dispatcher.config.IngestProperties;
import io.github.timedingest.dispatcher.domain.exception.IngestConfigurationException;
import io.github.timedingest.dispatcher.domain.model.IngestCommand;
import io.github.timedingest.dispatcher.domain.model.MappingKind;
import io.github.timedingest.dispatcher.domain.model.ParsedTimestamp;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class IngestCommandBuilder {

    public static final String CREATION_DATE_KEY = "creationTime";

    private final IngestProperties properties;

    public IngestCommand build(ParsedTimestamp insertDate, String objectUrl, long contentLength) {
        IngestProperties.Kusto kusto = properties.getKusto();
        IngestProperties.Source source = properties.getSource();

        if (isBlank(kusto.getDatabase()) || isBlank(kusto.getTable())) {
            throw new IngestConfigurationException("Target database and table must be configured (database: "
                    + kusto.getDatabase() + ", table: " + kusto.getTable() + ")");
        }

        if (!MappingKind.isKnown(kusto.getMappingKind())) {
            log.warn("Unknown mapping kind '{}', falling back to {}", kusto.getMappingKind(), MappingKind.JSON);
        }
        MappingKind mappingKind = MappingKind.resolve(kusto.getMappingKind());

        String accessToken = source.getAccessToken() == null ? "" : source.getAccessToken();
        String creationDate = insertDate.toString();

        log.trace("INGEST URL:{} SIZE:{} INSERTDATE:{}", objectUrl, contentLength, creationDate);

        return IngestCommand.builder()
                .database(kusto.getDatabase())
                .table(kusto.getTable())
                .mappingKind(mappingKind)
                .mappingReference(kusto.getMappingReference())
                .additionalProperty(CREATION_DATE_KEY, creationDate)
                .tag(creationDate)
                .sourceSizeBytes(contentLength)
                .deleteSourceOnSuccess(source.isDeleteAfterInsert())
                .sourceUrl(objectUrl + accessToken)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
