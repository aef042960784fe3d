package io.github.timedingest.dispatcher.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class IngestCommand {
    String database;
    String table;
    MappingKind mappingKind;
    String mappingReference;
    String sourceUrl;
    long sourceSizeBytes;
    boolean deleteSourceOnSuccess;
    @Singular
    List<String> tags;
    @Singular
    Map<String, String> additionalProperties;
}
