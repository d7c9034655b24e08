package com.signalplatform.common.calibration;

import com.signalplatform.common.model.AdaptiveThresholds;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single shared holder of the live {@link AdaptiveThresholds}.
 *
 * <p>Readers call {@link #current()} once per invocation and keep that snapshot.
 * The calibrator is the only writer; a publish replaces the whole record in one atomic
 * swap and succeeds only on top of the version it was computed from.
 */
public class ThresholdsRegistry {

    private final AtomicReference<AdaptiveThresholds> current;

    public ThresholdsRegistry(AdaptiveThresholds initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public AdaptiveThresholds current() {
        return current.get();
    }

    /**
     * @return {@code true} if {@code next} replaced {@code expected}; {@code false} when another
     *         version was published in between, leaving the registry untouched
     */
    public boolean publish(AdaptiveThresholds expected, AdaptiveThresholds next) {
        if (next.version() <= expected.version()) {
            throw new IllegalArgumentException(
                "Published version " + next.version() + " must be newer than " + expected.version());
        }
        return current.compareAndSet(expected, next);
    }
}
