package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/** Price observed at signal time and again once the evaluation horizon elapsed. */
public record RealizedOutcome(
    @JsonProperty("priceAtSignal") double priceAtSignal,
    @JsonProperty("priceAtHorizon") double priceAtHorizon,
    @JsonProperty("horizon") Duration horizon
) {
    public double priceChangePercent() {
        if (priceAtSignal == 0.0) return 0.0;
        return (priceAtHorizon - priceAtSignal) / priceAtSignal * 100.0;
    }
}
