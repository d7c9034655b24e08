package com.signalplatform.common.model;

import java.time.Instant;
import java.util.List;

/**
 * The only thing the pipeline emits. Immutable once built; every rejection path
 * still yields a Signal with decision NO_TRADE and the reason in {@code rationale}.
 */
public record Signal(
    String signalId,
    String traceId,
    Instant timestamp,
    String instrument,
    Timeframe timeframe,
    TradeDecision decision,
    double confidence,
    RiskLevel riskLevel,
    Double stopLoss,
    Double takeProfit,
    ConfluenceResult confluence,
    ConsensusDecision consensus,
    ValidationResult validation,
    long thresholdsVersion,
    List<String> rationale,
    Instant validUntil
) {
    public Signal {
        rationale = rationale == null ? List.of() : List.copyOf(rationale);
    }

    public boolean isNoTrade() {
        return decision == TradeDecision.NO_TRADE;
    }
}
