package com.gsesentinel.core;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses telemetry timestamps. ISO-8601 date-times with an offset are taken
 * as given; local date-times without one are read as UTC.
 *
 * @since 1.0.0
 */
public final class Timestamps {

    private Timestamps() {
    }

    /**
     * @param value ISO-8601 timestamp
     * @return the instant it denotes
     * @throws TelemetryValidationException with reason BAD_TIMESTAMP if the
     *                                      value is missing or unparseable
     */
    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new TelemetryValidationException(TelemetryValidationException.Reason.BAD_TIMESTAMP,
                    "Timestamp is missing");
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value.trim(),
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new TelemetryValidationException(TelemetryValidationException.Reason.BAD_TIMESTAMP,
                    "Unparseable timestamp '" + value + "'", e);
        }
    }
}
