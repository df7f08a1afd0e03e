package io.cleaned.core.validator;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Validates dates. Accepts {@link LocalDate}, {@link LocalDateTime} (date part), ISO strings, and
 * numbers as Unix epoch seconds (the UTC date).
 */
public final class DateValidator extends TemporalValidator<LocalDate, DateValidator> {

    DateValidator() {
        this(Bounds.none());
    }

    private DateValidator(Bounds<LocalDate> bounds) {
        super(bounds, "an ISO-8601 date");
    }

    @Override
    DateValidator withBounds(Bounds<LocalDate> bounds) {
        return new DateValidator(bounds);
    }

    @Override
    Optional<LocalDate> fromObject(Object raw) {
        if (raw instanceof LocalDate) {
            return Optional.of((LocalDate) raw);
        }
        if (raw instanceof LocalDateTime) {
            return Optional.of(((LocalDateTime) raw).toLocalDate());
        }
        return fromEpochSeconds(raw).map(LocalDateTime::toLocalDate);
    }

    @Override
    LocalDate parse(String text) {
        return LocalDate.parse(text);
    }
}
