package com.signalplatform.common.model;

/**
 * One historical signal scored against its outcome. {@code actualDirection} is
 * {@link TradeDecision#NO_TRADE} when the price stayed inside the movement threshold.
 */
public record BacktestRecord(
    String signalId,
    TradeDecision decision,
    double confidence,
    TradeDecision actualDirection,
    double priceChangePercent,
    boolean correct
) {}
