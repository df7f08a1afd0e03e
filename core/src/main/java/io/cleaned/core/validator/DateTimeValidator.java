package io.cleaned.core.validator;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Validates local date-times. Accepts {@link LocalDateTime}, {@link LocalDate} (start of day),
 * ISO strings holding either a date-time or a bare date, and numbers as Unix epoch seconds (UTC
 * wall-clock time).
 */
public final class DateTimeValidator extends TemporalValidator<LocalDateTime, DateTimeValidator> {

    DateTimeValidator() {
        this(Bounds.none());
    }

    private DateTimeValidator(Bounds<LocalDateTime> bounds) {
        super(bounds, "an ISO-8601 date-time");
    }

    @Override
    DateTimeValidator withBounds(Bounds<LocalDateTime> bounds) {
        return new DateTimeValidator(bounds);
    }

    @Override
    Optional<LocalDateTime> fromObject(Object raw) {
        if (raw instanceof LocalDateTime) {
            return Optional.of((LocalDateTime) raw);
        }
        if (raw instanceof LocalDate) {
            return Optional.of(((LocalDate) raw).atStartOfDay());
        }
        return fromEpochSeconds(raw);
    }

    @Override
    LocalDateTime parse(String text) {
        try {
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            if (text.indexOf('T') >= 0) {
                throw e;
            }
            return LocalDate.parse(text).atStartOfDay();
        }
    }
}
