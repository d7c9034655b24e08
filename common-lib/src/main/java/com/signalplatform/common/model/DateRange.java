package com.signalplatform.common.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public record DateRange(Instant from, Instant to) {

    public DateRange {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Date range bounds must not be null");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Date range start " + from + " is after end " + to);
        }
    }

    public static DateRange lastDays(int days, Clock clock) {
        Instant now = clock.instant();
        return new DateRange(now.minus(Duration.ofDays(days)), now);
    }
}
