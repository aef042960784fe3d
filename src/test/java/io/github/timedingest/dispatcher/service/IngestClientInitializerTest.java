package io.github.timedingest.dispatcher.service;

import io.github.timedingest.dispatcher.config.IngestProperties;
import io.github.timedingest.dispatcher.domain.model.IngestSubmission;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class IngestClientInitializerTest {

    private IngestProperties properties;
    private CountingFactory factory;
    private IngestClientInitializer initializer;

    @BeforeEach
    void setUp() {
        properties = TestProperties.valid();
        factory = new CountingFactory();
        initializer = new IngestClientInitializer(properties, factory);
    }

    @Test
    void constructsClientAtMostOnce() {
        Optional<IngestTransport> first = initializer.ensureReady();
        Optional<IngestTransport> second = initializer.ensureReady();

        assertThat(first).isPresent();
        assertThat(second).containsSame(first.get());
        assertThat(factory.calls.get()).isEqualTo(1);
    }

    @Test
    void passesTrimmedSettingsToFactory() {
        properties.getKusto().setClientId("  client-id ");

        initializer.ensureReady();

        assertThat(factory.lastSettings.clientId()).isEqualTo("client-id");
        assertThat(factory.lastSettings.endpoint()).isEqualTo("https://ingest-testcluster.westeurope.kusto.windows.net");
        assertThat(factory.lastSettings.toString()).doesNotContain("client-secret");
    }

    @Test
    void missingConfigurationIsNotReadyAndRetriedLater() {
        properties.getKusto().setClientSecret(" ");

        assertThat(initializer.ensureReady()).isEmpty();
        assertThat(factory.calls.get()).isZero();

        properties.getKusto().setClientSecret("client-secret");

        assertThat(initializer.ensureReady()).isPresent();
        assertThat(factory.calls.get()).isEqualTo(1);
    }

    @Test
    void eachRequiredSettingIsChecked() {
        properties.getKusto().setEndpoint(null);
        assertThat(initializer.ensureReady()).isEmpty();

        properties = TestProperties.valid();
        properties.getKusto().setTenantId("");
        assertThat(new IngestClientInitializer(properties, factory).ensureReady()).isEmpty();

        properties = TestProperties.valid();
        properties.getKusto().setClientId(null);
        assertThat(new IngestClientInitializer(properties, factory).ensureReady()).isEmpty();

        assertThat(factory.calls.get()).isZero();
    }

    @Test
    void factoryReturningNothingIsRetriedOnNextCall() {
        factory.results.add(null);

        assertThat(initializer.ensureReady()).isEmpty();
        assertThat(factory.calls.get()).isEqualTo(1);

        assertThat(initializer.ensureReady()).isPresent();
        assertThat(factory.calls.get()).isEqualTo(2);
    }

    @Test
    void factoryFailureIsRetriedOnNextCall() {
        factory.failNext = true;

        assertThat(initializer.ensureReady()).isEmpty();
        assertThat(initializer.ensureReady()).isPresent();
        assertThat(factory.calls.get()).isEqualTo(2);
    }

    @Test
    void concurrentFirstCallsBuildOneClient() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<IngestTransport>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Optional<IngestTransport>> call = () -> {
                    start.await();
                    return initializer.ensureReady();
                };
                futures.add(pool.submit(call));
            }
            start.countDown();

            IngestTransport expected = null;
            for (Future<Optional<IngestTransport>> future : futures) {
                IngestTransport transport = future.get(10, TimeUnit.SECONDS).orElseThrow();
                if (expected == null) {
                    expected = transport;
                }
                assertThat(transport).isSameAs(expected);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(factory.calls.get()).isEqualTo(1);
    }

    static class CountingFactory implements IngestTransportFactory {
        final AtomicInteger calls = new AtomicInteger();
        final List<IngestTransport> results = new ArrayList<>();
        volatile boolean failNext;
        volatile ConnectionSettings lastSettings;

        @Override
        public IngestTransport create(ConnectionSettings settings) {
            calls.incrementAndGet();
            lastSettings = settings;
            if (failNext) {
                failNext = false;
                throw new IllegalStateException("connection refused");
            }
            if (!results.isEmpty()) {
                return results.remove(0);
            }
            return command -> new IngestSubmission("id", "queue", OffsetDateTime.now());
        }
    }
}
