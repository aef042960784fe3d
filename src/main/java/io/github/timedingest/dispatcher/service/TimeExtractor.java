package io.github.timedingest.dispatcher.service;

import io.github.timedingest.dispatcher.audit.Log;
import io.github.timedingest.dispatcher.domain.model.ParsedTimestamp;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

/**
 * Reads the timestamp encoded in an object path, e.g. {@code .../date=2023-06-01/part-0.json}.
 *
 * <p>The first occurrence of the marker wins. Deployed path conventions must not contain the marker text before
 * the real date segment.
 */
@Slf4j
@Service
public class TimeExtractor {

    public ParsedTimestamp extract(String objectUrl, String marker, String pattern) {
        if (pattern == null || pattern.isBlank()) {
            Log.warn(log, "TIMESTAMP_PARSE_FAILED", "No date pattern configured, cannot read a date from {}", objectUrl);
            return ParsedTimestamp.UNPARSED;
        }
        if (objectUrl == null || objectUrl.isBlank() || marker == null || marker.isEmpty()) {
            Log.warn(log, "TIMESTAMP_PARSE_FAILED", "The url {} does not contain the {} marker.", objectUrl, marker);
            return ParsedTimestamp.UNPARSED;
        }

        int markerIndex = objectUrl.indexOf(marker);
        if (markerIndex < 0) {
            Log.warn(log, "TIMESTAMP_PARSE_FAILED", "The url {} does not contain the {} marker.", objectUrl, marker);
            return ParsedTimestamp.UNPARSED;
        }

        int start = markerIndex + marker.length();
        int end = start + pattern.length();
        if (end > objectUrl.length()) {
            Log.warn(log, "TIMESTAMP_PARSE_FAILED", "The url {} ends before a {} date could follow the marker.",
                    objectUrl, pattern);
            return ParsedTimestamp.UNPARSED;
        }

        String dateString = objectUrl.substring(start, end);
        try {
            return ParsedTimestamp.of(parseInstant(dateString, pattern));
        } catch (DateTimeParseException | IllegalArgumentException e) {
            Log.warn(log, "TIMESTAMP_PARSE_FAILED", "The {} could not be parsed using the {}: {}",
                    dateString, pattern, e.getMessage());
            return ParsedTimestamp.UNPARSED;
        }
    }

    /**
     * Parses {@code text} strictly against {@code pattern}. Values without zone information are read as UTC.
     */
    public static Instant parseInstant(String text, String pattern) {
        // yyyy and yyyy-MM resolve to the first day of the period
        DateTimeFormatter formatter = new DateTimeFormatterBuilder()
                .appendPattern(toStrictPattern(pattern))
                .parseDefaulting(ChronoField.MONTH_OF_YEAR, 1)
                .parseDefaulting(ChronoField.DAY_OF_MONTH, 1)
                .toFormatter(Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);

        TemporalAccessor parsed = formatter.parseBest(text.strip(),
                ZonedDateTime::from, LocalDateTime::from, LocalDate::from);

        if (parsed instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (parsed instanceof LocalDateTime dateTime) {
            return dateTime.toInstant(ZoneOffset.UTC);
        }
        return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    // Strict resolution needs proleptic years (u); year-of-era (y) would also require an era field.
    private static String toStrictPattern(String pattern) {
        StringBuilder result = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (char c : pattern.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            result.append(!quoted && c == 'y' ? 'u' : c);
        }
        return result.toString();
    }
}
