package com.signalplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A candlestick pattern detected upstream by the market-data collaborator.
 * {@code strength} is in [0, 1]; a {@link BiasDirection#NEUTRAL} direction marks
 * indecision patterns such as a doji.
 */
public record CandlestickPattern(
    @JsonProperty("name") String name,
    @JsonProperty("direction") BiasDirection direction,
    @JsonProperty("strength") double strength
) {}
