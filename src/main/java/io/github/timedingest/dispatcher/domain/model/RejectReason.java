package io.github.timedingest.dispatcher.domain.model;

public enum RejectReason {
    UNSUPPORTED_EVENT_KIND("unsupported-event-kind"),
    UNTRUSTED_HOST("untrusted-host"),
    BLACKLISTED_PATH("blacklisted-path"),
    STALE_OBJECT("stale-object"),
    EMPTY_OBJECT_EVENT("empty-object-event");

    private final String code;

    RejectReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
