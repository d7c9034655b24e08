package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Recent raw candles for the gate, oldest first. {@code observedAt} drives the
 * session and news-window checks so the gate never reads the wall clock.
 */
public record MicrostructureSnapshot(
    @JsonProperty("instrument") String instrument,
    @JsonProperty("instrumentClass") InstrumentClass instrumentClass,
    @JsonProperty("observedAt") Instant observedAt,
    @JsonProperty("candles") List<Candle> candles
) {
    public MicrostructureSnapshot {
        candles = candles == null ? List.of() : List.copyOf(candles);
        if (instrumentClass == null) {
            instrumentClass = InstrumentClass.infer(instrument);
        }
    }

    public Candle latest() {
        return candles.get(candles.size() - 1);
    }
}
