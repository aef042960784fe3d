package io.github.timedingest.dispatcher.domain.exception;

public class IngestConfigurationException extends RuntimeException {

    public IngestConfigurationException(String message) {
        super(message);
    }

    public IngestConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
