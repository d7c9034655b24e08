package com.signalplatform.common.model;

import java.util.List;

/**
 * One judge's answer for one pipeline invocation.
 *
 * <p>A judge that timed out, failed in transport or returned an unparseable body is
 * still represented, with {@code succeeded == false} and a {@link FailureKind}.
 * Confidence is on a 0-100 scale.
 */
public record JudgeOpinion(
    String judgeId,
    TradeDecision decision,
    double confidence,
    String reasoning,
    List<String> keyFactors,
    RiskLevel riskLevel,
    Double stopLoss,
    Double takeProfit,
    boolean succeeded,
    FailureKind failureKind,
    String failureReason,
    long latencyMs
) {
    public JudgeOpinion {
        keyFactors = keyFactors == null ? List.of() : List.copyOf(keyFactors);
    }

    public static JudgeOpinion success(String judgeId, TradeDecision decision, double confidence,
                                       String reasoning, List<String> keyFactors, RiskLevel riskLevel,
                                       Double stopLoss, Double takeProfit) {
        return new JudgeOpinion(judgeId, decision, confidence, reasoning, keyFactors, riskLevel,
                                stopLoss, takeProfit, true, null, null, 0L);
    }

    public static JudgeOpinion failed(String judgeId, FailureKind kind, String reason, long latencyMs) {
        return new JudgeOpinion(judgeId, TradeDecision.NO_TRADE, 0.0, null, List.of(), RiskLevel.HIGH,
                                null, null, false, kind, reason, latencyMs);
    }

    public JudgeOpinion withLatency(long latencyMs) {
        return new JudgeOpinion(judgeId, decision, confidence, reasoning, keyFactors, riskLevel,
                                stopLoss, takeProfit, succeeded, failureKind, failureReason, latencyMs);
    }
}
