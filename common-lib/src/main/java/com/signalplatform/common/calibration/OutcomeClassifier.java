package com.signalplatform.common.calibration;

import com.signalplatform.common.model.BacktestRecord;
import com.signalplatform.common.model.HistoricalSignal;
import com.signalplatform.common.model.TradeDecision;

/**
 * Scores a historical signal against what the price did afterwards.
 *
 * <pre>
 *   move &gt; +threshold   actual BUY
 *   move &lt; -threshold   actual SELL
 *   otherwise          actual NO_TRADE (flat)
 * </pre>
 * A signal is correct when its decision equals the actual direction, so NO_TRADE is
 * correct exactly when the market stayed flat.
 */
public final class OutcomeClassifier {

    private OutcomeClassifier() {}

    public static TradeDecision actualDirection(double priceChangePercent, double minMovePercent) {
        if (priceChangePercent > minMovePercent)  return TradeDecision.BUY;
        if (priceChangePercent < -minMovePercent) return TradeDecision.SELL;
        return TradeDecision.NO_TRADE;
    }

    public static BacktestRecord classify(HistoricalSignal signal, double minMovePercent) {
        double move = signal.outcome().priceChangePercent();
        TradeDecision actual = actualDirection(move, minMovePercent);
        return new BacktestRecord(signal.signalId(), signal.decision(), signal.confidence(),
                                  actual, move, signal.decision() == actual);
    }
}
