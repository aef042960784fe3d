package io.github.timedingest.dispatcher.domain.exception;

public class IngestDispatchException extends RuntimeException {

    public IngestDispatchException(String message) {
        super(message);
    }

    public IngestDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
