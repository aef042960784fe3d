package io.github.timedingest.dispatcher.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A point in time taken from an object path. {@link #UNPARSED} stands for "could not be extracted" and sorts
 * before every other value, so it always reads as maximally stale.
 */
public record ParsedTimestamp(Instant value) implements Comparable<ParsedTimestamp> {

    public static final ParsedTimestamp UNPARSED = new ParsedTimestamp(Instant.MIN);

    public ParsedTimestamp {
        Objects.requireNonNull(value, "value");
    }

    public static ParsedTimestamp of(Instant value) {
        return new ParsedTimestamp(value);
    }

    public boolean isUnparsed() {
        return Instant.MIN.equals(value);
    }

    public boolean isBefore(Instant other) {
        return value.isBefore(other);
    }

    @Override
    public int compareTo(ParsedTimestamp other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
