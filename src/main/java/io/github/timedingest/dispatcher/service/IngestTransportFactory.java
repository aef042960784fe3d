package io.github.timedingest.dispatcher.service;

public interface IngestTransportFactory {

    record ConnectionSettings(String endpoint, String clientId, String clientSecret, String tenantId) {
        @Override
        public String toString() {
            return "ConnectionSettings[endpoint=" + endpoint + ", clientId=" + clientId + ", tenantId=" + tenantId + "]";
        }
    }

    /**
     * @return a usable transport, or {@code null} if none can be built from these settings
     */
    IngestTransport create(ConnectionSettings settings);
}
