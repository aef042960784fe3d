package io.github.timedingest.dispatcher.service;

import io.github.timedingest.dispatcher.audit.Log;
import io.github.timedingest.dispatcher.config.IngestProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Builds the store connection lazily and at most once. Failures are not sticky, the next call tries again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestClientInitializer {

    enum State {
        UNINITIALIZED, READY
    }

    private final IngestProperties properties;
    private final IngestTransportFactory transportFactory;

    private final Object lock = new Object();
    private State state = State.UNINITIALIZED;
    private IngestTransport transport;

    public Optional<IngestTransport> ensureReady() {
        synchronized (lock) {
            if (state == State.READY) {
                return Optional.of(transport);
            }

            IngestProperties.Kusto kusto = properties.getKusto();
            if (isBlank(kusto.getEndpoint()) || isBlank(kusto.getClientId())
                    || isBlank(kusto.getClientSecret()) || isBlank(kusto.getTenantId())) {
                Log.error(log, "INGEST_CLIENT_CONFIG_MISSING",
                        "Could not initialize the ingest client because the connection parameters are incomplete "
                                + "(url: {}, clientId: {}, tenant: {})",
                        kusto.getEndpoint(), kusto.getClientId(), kusto.getTenantId());
                return Optional.empty();
            }

            IngestTransportFactory.ConnectionSettings settings = new IngestTransportFactory.ConnectionSettings(
                    kusto.getEndpoint().trim(),
                    kusto.getClientId().trim(),
                    kusto.getClientSecret(),
                    kusto.getTenantId().trim());

            IngestTransport created;
            try {
                created = transportFactory.create(settings);
            } catch (RuntimeException e) {
                Log.error(log, "INGEST_CLIENT_INIT_FAILED", "Ingest client construction failed for {}", settings, e);
                return Optional.empty();
            }

            if (created == null) {
                Log.warn(log, "INGEST_CLIENT_INIT_FAILED", "Ingest client not initialized for {}", settings);
                return Optional.empty();
            }

            transport = created;
            state = State.READY;
            Log.event(log, "INGEST_CLIENT_READY", "Ingest client initialized for {}", settings.endpoint());
            return Optional.of(transport);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
