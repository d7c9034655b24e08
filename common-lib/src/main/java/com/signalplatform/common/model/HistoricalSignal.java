package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** A previously emitted signal joined with what the market actually did afterwards. */
public record HistoricalSignal(
    @JsonProperty("signalId") String signalId,
    @JsonProperty("instrument") String instrument,
    @JsonProperty("timeframe") Timeframe timeframe,
    @JsonProperty("decision") TradeDecision decision,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("outcome") RealizedOutcome outcome
) {}
