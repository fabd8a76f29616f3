package com.cloudcostbuddy.normalization;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Calendar date range, start inclusive and end exclusive.
 */
public record DatePeriod(LocalDate start, LocalDate end) {

    public DatePeriod {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Period start " + start + " must be before end " + end);
        }
    }

    public long days() {
        return ChronoUnit.DAYS.between(start, end);
    }

    public static boolean isValid(LocalDate start, LocalDate end) {
        return start != null && end != null && start.isBefore(end);
    }
}
