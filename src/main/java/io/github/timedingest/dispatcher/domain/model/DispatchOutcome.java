package io.github.timedingest.dispatcher.domain.model;

public record DispatchOutcome(
        Status status,
        String objectUrl,
        RejectReason reason,
        IngestSubmission submission,
        Throwable error
) {
    public enum Status {
        SKIPPED, SUBMITTED, FAILED
    }

    public static DispatchOutcome skipped(String objectUrl, RejectReason reason) {
        return new DispatchOutcome(Status.SKIPPED, objectUrl, reason, null, null);
    }

    public static DispatchOutcome submitted(String objectUrl, IngestSubmission submission) {
        return new DispatchOutcome(Status.SUBMITTED, objectUrl, null, submission, null);
    }

    public static DispatchOutcome failed(String objectUrl, Throwable error) {
        return new DispatchOutcome(Status.FAILED, objectUrl, null, null, error);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
