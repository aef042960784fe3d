package io.github.timedingest.dispatcher.domain.model;

public record FilterDecision(
        boolean accepted,
        RejectReason reason,
        String decodedUrl,
        ParsedTimestamp timestamp
) {
    public static FilterDecision accept(String decodedUrl, ParsedTimestamp timestamp) {
        return new FilterDecision(true, null, decodedUrl, timestamp);
    }

    public static FilterDecision reject(RejectReason reason, String decodedUrl) {
        return new FilterDecision(false, reason, decodedUrl, null);
    }

    public boolean rejected() {
        return !accepted;
    }
}
