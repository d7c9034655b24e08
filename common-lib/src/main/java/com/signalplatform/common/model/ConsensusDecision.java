package com.signalplatform.common.model;

import java.util.List;

public record ConsensusDecision(
    TradeDecision decision,
    double confidence,
    boolean consensusReached,
    ConsensusSource source,
    String reason,
    String winningJudgeId,
    RiskLevel riskLevel,
    Double stopLoss,
    Double takeProfit,
    List<String> keyFactors,
    String reasoning,
    List<String> participatingJudges
) {
    public ConsensusDecision {
        keyFactors          = keyFactors == null ? List.of() : List.copyOf(keyFactors);
        participatingJudges = participatingJudges == null ? List.of() : List.copyOf(participatingJudges);
    }

    public static ConsensusDecision noTrade(ConsensusSource source, double confidence,
                                            String reason, List<String> participatingJudges) {
        return new ConsensusDecision(TradeDecision.NO_TRADE, confidence, false, source, reason,
                                     null, RiskLevel.HIGH, null, null, List.of(), reason,
                                     participatingJudges);
    }

    /** A directional consensus, i.e. one the gate still has to approve. */
    public boolean isActionable() {
        return decision.isDirectional();
    }
}
