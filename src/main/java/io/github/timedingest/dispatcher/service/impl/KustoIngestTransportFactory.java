package io.github.timedingest.dispatcher.service.impl;

import com.microsoft.azure.kusto.data.auth.ConnectionStringBuilder;
import com.microsoft.azure.kusto.ingest.IngestClientFactory;
import com.microsoft.azure.kusto.ingest.QueuedIngestClient;
import io.github.timedingest.dispatcher.service.IngestTransport;
import io.github.timedingest.dispatcher.service.IngestTransportFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;

@Slf4j
@Component
public class KustoIngestTransportFactory implements IngestTransportFactory {

    @Override
    public IngestTransport create(ConnectionSettings settings) {
        if (!isHttpUrl(settings.endpoint())) {
            log.warn("Ingest endpoint {} is not an absolute http(s) url", settings.endpoint());
            return null;
        }

        ConnectionStringBuilder connection = ConnectionStringBuilder.createWithAadApplicationCredentials(
                settings.endpoint(), settings.clientId(), settings.clientSecret(), settings.tenantId());

        try {
            QueuedIngestClient client = IngestClientFactory.createClient(connection);
            return new KustoQueuedIngestTransport(client);
        } catch (URISyntaxException e) {
            log.warn("Ingest client could not be created for {}: {}", settings.endpoint(), e.getMessage());
            return null;
        }
    }

    static boolean isHttpUrl(String endpoint) {
        try {
            URI uri = new URI(endpoint);
            return uri.isAbsolute() && uri.getHost() != null
                    && ("https".equalsIgnoreCase(uri.getScheme()) || "http".equalsIgnoreCase(uri.getScheme()));
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
