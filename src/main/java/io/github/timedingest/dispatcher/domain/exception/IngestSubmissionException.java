package io.github.timedingest.dispatcher.domain.exception;

public class IngestSubmissionException extends RuntimeException {

    public IngestSubmissionException(String message) {
        super(message);
    }

    public IngestSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
