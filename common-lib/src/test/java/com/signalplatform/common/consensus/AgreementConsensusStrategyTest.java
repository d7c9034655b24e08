package com.signalplatform.common.consensus;

import com.signalplatform.common.model.AdaptiveThresholds;
import com.signalplatform.common.model.ConsensusDecision;
import com.signalplatform.common.model.ConsensusSource;
import com.signalplatform.common.model.FailureKind;
import com.signalplatform.common.model.JudgeOpinion;
import com.signalplatform.common.model.RiskLevel;
import com.signalplatform.common.model.TradeDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgreementConsensusStrategyTest {

    private static final double EPS = 1e-9;

    private final AgreementConsensusStrategy strategy = new AgreementConsensusStrategy();

    private static AdaptiveThresholds thresholds(double minConfidence, boolean consensusRequired, double bonus) {
        return AdaptiveThresholds.initial(minConfidence, consensusRequired, bonus, Instant.EPOCH);
    }

    private static JudgeOpinion opinion(String judge, TradeDecision decision, double confidence) {
        return JudgeOpinion.success(judge, decision, confidence, judge + " reasoning",
                                    List.of(), RiskLevel.MEDIUM, null, null);
    }

    // ── agreement ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("resolve(): agreement")
    class AgreementTests {

        @Test
        @DisplayName("BUY 82 + BUY 88, threshold 70 → BUY at 85, consensus reached")
        void meanOfAgreeingJudges() {
            ConsensusDecision d = strategy.resolve(
                List.of(opinion("groq", TradeDecision.BUY, 82), opinion("together", TradeDecision.BUY, 88)),
                thresholds(70, true, 0));

            assertEquals(TradeDecision.BUY, d.decision());
            assertEquals(85.0, d.confidence(), EPS);
            assertTrue(d.consensusReached());
            assertEquals(ConsensusSource.AGREEMENT, d.source());
            assertEquals(List.of("groq", "together"), d.participatingJudges());
        }

        @Test
        @DisplayName("agreement bonus is added to the mean and capped at 95")
        void agreementBonus() {
            ConsensusDecision small = strategy.resolve(
                List.of(opinion("groq", TradeDecision.SELL, 80), opinion("together", TradeDecision.SELL, 84)),
                thresholds(70, true, 3));
            ConsensusDecision capped = strategy.resolve(
                List.of(opinion("groq", TradeDecision.SELL, 92), opinion("together", TradeDecision.SELL, 94)),
                thresholds(70, true, 5));

            assertEquals(85.0, small.confidence(), EPS);
            assertEquals(95.0, capped.confidence(), EPS);
        }

        @Test
        @DisplayName("bonus never lifts a sub-threshold mean over minConfidence")
        void bonusDoesNotPassThreshold() {
            ConsensusDecision d = strategy.resolve(
                List.of(opinion("groq", TradeDecision.BUY, 66), opinion("together", TradeDecision.BUY, 66)),
                thresholds(70, true, 5));

            assertEquals(TradeDecision.NO_TRADE, d.decision());
            assertFalse(d.consensusReached());
            assertEquals(ConsensusSource.BELOW_THRESHOLD, d.source());
            assertEquals(66.0, d.confidence(), EPS);
        }

        @Test
        @DisplayName("mean already above the bonus cap → kept, not lowered to 95")
        void bonusCapNeverLowersMean() {
            ConsensusDecision d = strategy.resolve(
                List.of(opinion("groq", TradeDecision.BUY, 98), opinion("together", TradeDecision.BUY, 99)),
                thresholds(70, true, 5));

            assertEquals(TradeDecision.BUY, d.decision());
            assertTrue(d.consensusReached());
            assertEquals(98.5, d.confidence(), EPS);
        }

        @Test
        @DisplayName("agreement below minConfidence → NO_TRADE keeping the mean")
        void belowThreshold() {
            ConsensusDecision d = strategy.resolve(
                List.of(opinion("groq", TradeDecision.BUY, 60), opinion("together", TradeDecision.BUY, 64)),
                thresholds(70, true, 0));

            assertEquals(TradeDecision.NO_TRADE, d.decision());
            assertEquals(62.0, d.confidence(), EPS);
            assertFalse(d.consensusReached());
            assertEquals(ConsensusSource.BELOW_THRESHOLD, d.source());
            assertTrue(d.reason().contains("below threshold"));
        }

        @Test
        @DisplayName("risk averaged on LOW=1..HIGH=3, levels averaged where supplied")
        void riskAndLevels() {
            JudgeOpinion a = JudgeOpinion.success("groq", TradeDecision.BUY, 80, "a",
                List.of("EMA stack", "RSI"), RiskLevel.LOW, 1.0950, 1.1100);
            JudgeOpinion b = JudgeOpinion.success("together", TradeDecision.BUY, 90, "b",
                List.of("RSI", "Volume"), RiskLevel.HIGH, null, 1.1200);

            ConsensusDecision d = strategy.resolve(List.of(a, b), thresholds(70, true, 0));

            assertEquals(RiskLevel.MEDIUM, d.riskLevel());
            assertEquals(1.0950, d.stopLoss(), EPS);
            assertEquals(1.1150, d.takeProfit(), EPS);
            assertEquals(List.of("EMA stack", "RSI", "Volume"), d.keyFactors());
            assertTrue(d.reasoning().contains("groq: a"));
        }

        @Test
        @DisplayName("combined key factors keep at most five")
        void keyFactorsCapped() {
            JudgeOpinion a = JudgeOpinion.success("groq", TradeDecision.BUY, 80, null,
                List.of("f1", "f2", "f3", "f4"), RiskLevel.LOW, null, null);
            JudgeOpinion b = JudgeOpinion.success("together", TradeDecision.BUY, 80, null,
                List.of("f3", "f5", "f6"), RiskLevel.LOW, null, null);

            ConsensusDecision d = strategy.resolve(List.of(a, b), thresholds(70, true, 0));

            assertEquals(List.of("f1", "f2", "f3", "f4", "f5"), d.keyFactors());
        }
    }

    // ── disagreement ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("resolve(): disagreement")
    class DisagreementTests {

        @Test
        @DisplayName("BUY 90 vs SELL 90 with consensus required → NO_TRADE at 0 naming the split")
        void consensusRequired() {
            ConsensusDecision d = strategy.resolve(
                List.of(opinion("groq", TradeDecision.BUY, 90), opinion("together", TradeDecision.SELL, 90)),
                thresholds(70, true, 0));

            assertEquals(TradeDecision.NO_TRADE, d.decision());
            assertEquals(0.0, d.confidence(), EPS);
            assertEquals(ConsensusSource.DISAGREEMENT, d.source());
            assertTrue(d.reason().contains("groq=BUY(90)"));
            assertTrue(d.reason().contains("together=SELL(90)"));
        }

        @Test
        @DisplayName("consensus optional → highest confidence wins")
        void highestConfidenceWins() {
            ConsensusDecision d = strategy.resolve(
                List.of(opinion("groq", TradeDecision.BUY, 75), opinion("together", TradeDecision.SELL, 88)),
                thresholds(70, false, 0));

            assertEquals(TradeDecision.SELL, d.decision());
            assertEquals(88.0, d.confidence(), EPS);
            assertEquals("together", d.winningJudgeId());
            assertEquals(ConsensusSource.HIGHEST_CONFIDENCE_WINNER, d.source());
            assertFalse(d.consensusReached());
        }

        @Test
        @DisplayName("equal confidence → earliest configured judge wins")
        void tieGoesToEarliestJudge() {
            ConsensusDecision d = strategy.resolve(
                List.of(opinion("groq", TradeDecision.BUY, 90), opinion("together", TradeDecision.SELL, 90)),
                thresholds(70, false, 0));

            assertEquals(TradeDecision.BUY, d.decision());
            assertEquals("groq", d.winningJudgeId());
        }
    }

    // ── degraded pools ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("resolve(): failed judges")
    class FailureTests {

        @Test
        @DisplayName("one judge failed → single-judge fallback with its opinion unchanged")
        void singleFallback() {
            ConsensusDecision d = strategy.resolve(
                List.of(JudgeOpinion.failed("groq", FailureKind.MALFORMED_RESPONSE, "not json", 12),
                        opinion("together", TradeDecision.BUY, 85)),
                thresholds(70, true, 0));

            assertEquals(TradeDecision.BUY, d.decision());
            assertEquals(85.0, d.confidence(), EPS);
            assertEquals(ConsensusSource.SINGLE_FALLBACK, d.source());
            assertEquals("together", d.winningJudgeId());
            assertFalse(d.consensusReached());
            assertTrue(d.reason().contains("2 configured"));
        }

        @Test
        @DisplayName("every judge failed → NO_TRADE at 0, source none")
        void noneSucceeded() {
            ConsensusDecision d = strategy.resolve(
                List.of(JudgeOpinion.failed("groq", FailureKind.TIMEOUT, "No reply within 20000ms", 20000),
                        JudgeOpinion.failed("together", FailureKind.TRANSPORT, "503", 40)),
                thresholds(70, true, 0));

            assertEquals(TradeDecision.NO_TRADE, d.decision());
            assertEquals(0.0, d.confidence(), EPS);
            assertEquals(ConsensusSource.NONE, d.source());
            assertTrue(d.reason().contains("groq=TIMEOUT"));
            assertTrue(d.participatingJudges().isEmpty());
        }

        @Test
        @DisplayName("empty opinion list → NO_TRADE, source none")
        void emptyOpinions() {
            ConsensusDecision d = strategy.resolve(List.of(), thresholds(70, true, 0));

            assertEquals(ConsensusSource.NONE, d.source());
            assertEquals(TradeDecision.NO_TRADE, d.decision());
        }
    }

    // ── statistics ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("statistics count every resolution by outcome")
    void statisticsRecorded() {
        strategy.resolve(List.of(opinion("groq", TradeDecision.BUY, 82), opinion("together", TradeDecision.BUY, 88)),
                         thresholds(70, true, 0));
        strategy.resolve(List.of(opinion("groq", TradeDecision.BUY, 90), opinion("together", TradeDecision.SELL, 90)),
                         thresholds(70, true, 0));
        strategy.resolve(List.of(JudgeOpinion.failed("groq", FailureKind.TIMEOUT, "t", 1),
                                 opinion("together", TradeDecision.SELL, 80)),
                         thresholds(70, true, 0));

        ConsensusStatistics.Snapshot s = strategy.statistics().snapshot();

        assertEquals(3, s.total());
        assertEquals(1, s.agreements());
        assertEquals(1, s.disagreements());
        assertEquals(1, s.singleFallbacks());
        assertEquals(1L, s.judgeWins().get("together"));
    }
}
