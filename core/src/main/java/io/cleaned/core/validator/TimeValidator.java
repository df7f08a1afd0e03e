package io.cleaned.core.validator;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;

/** Validates times of day. Accepts {@link LocalTime}, {@link LocalDateTime} (time part) and ISO strings. */
public final class TimeValidator extends TemporalValidator<LocalTime, TimeValidator> {

    TimeValidator() {
        this(Bounds.none());
    }

    private TimeValidator(Bounds<LocalTime> bounds) {
        super(bounds, "an ISO-8601 time");
    }

    @Override
    TimeValidator withBounds(Bounds<LocalTime> bounds) {
        return new TimeValidator(bounds);
    }

    @Override
    Optional<LocalTime> fromObject(Object raw) {
        if (raw instanceof LocalTime) {
            return Optional.of((LocalTime) raw);
        }
        if (raw instanceof LocalDateTime) {
            return Optional.of(((LocalDateTime) raw).toLocalTime());
        }
        return Optional.empty();
    }

    @Override
    LocalTime parse(String text) {
        return LocalTime.parse(text);
    }
}
