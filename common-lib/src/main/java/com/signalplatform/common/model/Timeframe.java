package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * Candle timeframes the pipeline can score. Declared in ascending duration order,
 * so {@code EnumMap} iteration and {@link #compareTo} run from shortest to longest.
 */
public enum Timeframe {
    M1("1m",  Duration.ofMinutes(1)),
    M5("5m",  Duration.ofMinutes(5)),
    M15("15m", Duration.ofMinutes(15)),
    M30("30m", Duration.ofMinutes(30)),
    H1("1h",  Duration.ofHours(1)),
    H4("4h",  Duration.ofHours(4)),
    D1("1d",  Duration.ofDays(1));

    private final String label;
    private final Duration duration;

    Timeframe(String label, Duration duration) {
        this.label    = label;
        this.duration = duration;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public Duration duration() {
        return duration;
    }

    /**
     * Accepts either the short label ({@code "15m"}) or the enum name ({@code "M15"}).
     *
     * @throws IllegalArgumentException for an unknown timeframe
     */
    @JsonCreator
    public static Timeframe fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Timeframe must not be blank");
        }
        String trimmed = value.trim();
        for (Timeframe tf : values()) {
            if (tf.label.equalsIgnoreCase(trimmed) || tf.name().equalsIgnoreCase(trimmed)) {
                return tf;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + value);
    }
}
