package com.mouse.surebet.utils;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Parses the timestamp strings found in the feed. Values without an offset are UTC.
 */
@Slf4j
public final class FeedTimestamps {

    private FeedTimestamps() {
    }

    /**
     * @return the instant, or null when the value is blank or unparsable
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim().replace(' ', 'T');
        try {
            if (text.endsWith("Z") || text.endsWith("z")) {
                return Instant.parse(text.toUpperCase());
            }
            if (hasOffset(text)) {
                return OffsetDateTime.parse(text).toInstant();
            }
            if (!text.contains("T")) {
                text = text + "T00:00:00";
            }
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Unparsable feed timestamp '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private static boolean hasOffset(String text) {
        int t = text.indexOf('T');
        if (t < 0) {
            return false;
        }
        String time = text.substring(t);
        return time.contains("+") || time.lastIndexOf('-') > 0;
    }
}
