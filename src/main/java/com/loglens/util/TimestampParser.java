package com.loglens.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Lenient timestamp parsing shared by the detectors and the report builder.
 * 
 * Accepts ISO-8601 instants and offset date-times, local date-times with a
 * 'T' or space separator (read as UTC), slash-separated dates and numeric
 * epoch values in seconds or milliseconds.
 */
public final class TimestampParser {
    
    private static final Logger log = LoggerFactory.getLogger(TimestampParser.class);
    
    /** Canonical form used when a timestamp takes part in a record id. */
    public static final DateTimeFormatter NORMALIZED =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);
    
    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
        localFormat("yyyy-MM-dd'T'HH:mm:ss"),
        localFormat("yyyy-MM-dd HH:mm:ss"),
        localFormat("yyyy/MM/dd HH:mm:ss"),
        localFormat("yyyy-MM-dd'T'HH:mm"),
        localFormat("yyyy-MM-dd HH:mm")
    );
    
    private static final long EPOCH_MILLIS_CUTOFF = 100_000_000_000L;
    
    private TimestampParser() {
    }
    
    private static DateTimeFormatter localFormat(String pattern) {
        return new DateTimeFormatterBuilder()
            .appendPattern(pattern)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter();
    }
    
    /**
     * Parses a raw timestamp value.
     *
     * @param raw the raw value, may be null
     * @return the instant, or empty when the value cannot be parsed
     */
    public static Optional<Instant> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        
        if (isNumeric(value)) {
            return parseEpoch(value);
        }
        
        Optional<Instant> parsed = attempt(value, () -> Instant.parse(value));
        if (parsed.isEmpty()) {
            parsed = attempt(value, () -> OffsetDateTime.parse(value).toInstant());
        }
        for (int i = 0; parsed.isEmpty() && i < LOCAL_FORMATS.size(); i++) {
            DateTimeFormatter format = LOCAL_FORMATS.get(i);
            parsed = attempt(value, () -> LocalDateTime.parse(value, format).toInstant(ZoneOffset.UTC));
        }
        if (parsed.isPresent()) {
            return parsed;
        }
        
        log.trace("Unparseable timestamp: {}", value);
        return Optional.empty();
    }
    
    private static Optional<Instant> attempt(String value, Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            log.trace("Layout mismatch for '{}': {}", value, e.getMessage());
            return Optional.empty();
        }
    }
    
    public static boolean isParseable(String raw) {
        return parse(raw).isPresent();
    }
    
    /**
     * Canonical string for record identity: {@code yyyy-MM-dd HH:mm:ss.SSS} in
     * UTC when parseable, the trimmed raw value otherwise, empty for null.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return parse(raw)
            .map(NORMALIZED::format)
            .orElse(raw.trim());
    }
    
    private static boolean isNumeric(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!Character.isDigit(c) && c != '.') {
                return false;
            }
        }
        return true;
    }
    
    private static Optional<Instant> parseEpoch(String value) {
        try {
            double number = Double.parseDouble(value);
            long asLong = (long) number;
            if (asLong >= EPOCH_MILLIS_CUTOFF) {
                return Optional.of(Instant.ofEpochMilli(asLong));
            }
            return Optional.of(Instant.ofEpochMilli((long) (number * 1000)));
        } catch (NumberFormatException e) {
            log.trace("Unparseable epoch timestamp: {}", value);
            return Optional.empty();
        }
    }
}
