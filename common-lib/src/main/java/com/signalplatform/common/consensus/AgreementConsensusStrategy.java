package com.signalplatform.common.consensus;

import com.signalplatform.common.model.AdaptiveThresholds;
import com.signalplatform.common.model.ConsensusDecision;
import com.signalplatform.common.model.ConsensusSource;
import com.signalplatform.common.model.JudgeOpinion;
import com.signalplatform.common.model.RiskLevel;
import com.signalplatform.common.model.TradeDecision;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Default {@link ConsensusResolver}: agreement of all responding judges, with
 * conservative fallbacks.
 *
 * <h3>Rules, applied in order over succeeded opinions only</h3>
 * <ol>
 *   <li>None succeeded: NO_TRADE, confidence 0, source {@code none}.</li>
 *   <li>Exactly one succeeded: that opinion unchanged, source {@code single-fallback}.</li>
 *   <li>All succeeded opinions share a decision: mean at or above {@code minConfidence}
 *       reaches consensus, source {@code agreement}, with the agreement bonus added (never
 *       past {@value #BONUS_CAP}, never below the mean). Below: NO_TRADE keeping the mean.</li>
 *   <li>Disagreement: with {@code consensusRequired}, NO_TRADE at confidence 0 naming the
 *       split; otherwise the highest-confidence opinion, earliest judge winning ties.</li>
 * </ol>
 *
 * <p>On agreement the risk level is the rounded mean of LOW=1, MEDIUM=2, HIGH=3, and
 * stop-loss / take-profit are averaged over the judges that supplied them.
 *
 * <p>Records outcome counts in {@link ConsensusStatistics} when one is supplied.
 */
public class AgreementConsensusStrategy implements ConsensusResolver {

    static final double BONUS_CAP = 95.0;
    static final int MAX_KEY_FACTORS = 5;

    private final ConsensusStatistics statistics;

    public AgreementConsensusStrategy() {
        this(new ConsensusStatistics());
    }

    public AgreementConsensusStrategy(ConsensusStatistics statistics) {
        this.statistics = Objects.requireNonNull(statistics, "statistics");
    }

    public ConsensusStatistics statistics() {
        return statistics;
    }

    @Override
    public ConsensusDecision resolve(List<JudgeOpinion> opinions, AdaptiveThresholds thresholds) {
        List<JudgeOpinion> succeeded = opinions.stream().filter(JudgeOpinion::succeeded).toList();
        List<String> participants = succeeded.stream().map(JudgeOpinion::judgeId).toList();

        ConsensusDecision decision;
        if (succeeded.isEmpty()) {
            decision = ConsensusDecision.noTrade(ConsensusSource.NONE, 0.0,
                "No judge produced a usable opinion (" + failureSummary(opinions) + ")", participants);
        } else if (succeeded.size() == 1) {
            decision = singleFallback(succeeded.get(0), opinions.size());
        } else if (allAgree(succeeded)) {
            decision = agreement(succeeded, thresholds, participants);
        } else {
            decision = disagreement(succeeded, thresholds, participants);
        }

        statistics.record(decision);
        return decision;
    }

    // ── rules ─────────────────────────────────────────────────────────────────

    private ConsensusDecision singleFallback(JudgeOpinion only, int configured) {
        String reason = String.format(Locale.ROOT,
            "Single-judge fallback: only %s responded (%d configured)", only.judgeId(), configured);
        return new ConsensusDecision(only.decision(), only.confidence(), false,
                                     ConsensusSource.SINGLE_FALLBACK, reason, only.judgeId(),
                                     only.riskLevel(), only.stopLoss(), only.takeProfit(),
                                     only.keyFactors(), only.reasoning(), List.of(only.judgeId()));
    }

    private ConsensusDecision agreement(List<JudgeOpinion> agreeing, AdaptiveThresholds thresholds,
                                        List<String> participants) {
        TradeDecision shared = agreeing.get(0).decision();
        double mean = agreeing.stream().mapToDouble(JudgeOpinion::confidence).average().orElse(0.0);

        // the threshold applies to the judges' own mean; the bonus only rewards a passing agreement
        if (mean < thresholds.minConfidence()) {
            String reason = String.format(Locale.ROOT,
                "Judges agree on %s but confidence below threshold: %.1f < %.1f",
                shared, mean, thresholds.minConfidence());
            return ConsensusDecision.noTrade(ConsensusSource.BELOW_THRESHOLD, mean, reason, participants);
        }
        double confidence = thresholds.consensusAgreementBonus() > 0.0
            ? Math.max(mean, Math.min(mean + thresholds.consensusAgreementBonus(), BONUS_CAP))
            : mean;

        String reason = String.format(Locale.ROOT,
            "%d judges agree on %s at %.1f confidence", agreeing.size(), shared, confidence);
        return new ConsensusDecision(shared, confidence, true, ConsensusSource.AGREEMENT, reason,
                                     null, averageRisk(agreeing),
                                     average(agreeing, JudgeOpinion::stopLoss),
                                     average(agreeing, JudgeOpinion::takeProfit),
                                     combineKeyFactors(agreeing), combineReasoning(agreeing),
                                     participants);
    }

    private ConsensusDecision disagreement(List<JudgeOpinion> succeeded, AdaptiveThresholds thresholds,
                                           List<String> participants) {
        String split = succeeded.stream()
            .map(o -> o.judgeId() + "=" + o.decision() + "(" + String.format(Locale.ROOT, "%.0f", o.confidence()) + ")")
            .collect(Collectors.joining(", "));

        if (thresholds.consensusRequired()) {
            return ConsensusDecision.noTrade(ConsensusSource.DISAGREEMENT, 0.0,
                "Judges disagree: " + split, participants);
        }

        // strict '>' keeps the earliest configured judge on equal confidence
        JudgeOpinion winner = succeeded.get(0);
        for (JudgeOpinion o : succeeded) {
            if (o.confidence() > winner.confidence()) winner = o;
        }
        String reason = "Judges disagree (" + split + "); highest confidence wins: " + winner.judgeId();
        return new ConsensusDecision(winner.decision(), winner.confidence(), false,
                                     ConsensusSource.HIGHEST_CONFIDENCE_WINNER, reason, winner.judgeId(),
                                     winner.riskLevel(), winner.stopLoss(), winner.takeProfit(),
                                     winner.keyFactors(), winner.reasoning(), participants);
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private static boolean allAgree(List<JudgeOpinion> opinions) {
        TradeDecision first = opinions.get(0).decision();
        return opinions.stream().allMatch(o -> o.decision() == first);
    }

    private static RiskLevel averageRisk(List<JudgeOpinion> opinions) {
        double mean = opinions.stream()
            .mapToInt(o -> o.riskLevel() != null ? o.riskLevel().score() : RiskLevel.MEDIUM.score())
            .average()
            .orElse(RiskLevel.MEDIUM.score());
        return RiskLevel.fromScore(Math.round(mean));
    }

    private static Double average(List<JudgeOpinion> opinions, Function<JudgeOpinion, Double> field) {
        OptionalDouble mean = opinions.stream()
            .map(field)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average();
        return mean.isPresent() ? mean.getAsDouble() : null;
    }

    private static List<String> combineKeyFactors(List<JudgeOpinion> opinions) {
        Set<String> unique = new LinkedHashSet<>();
        opinions.forEach(o -> unique.addAll(o.keyFactors()));
        return unique.stream().limit(MAX_KEY_FACTORS).toList();
    }

    private static String combineReasoning(List<JudgeOpinion> opinions) {
        return opinions.stream()
            .filter(o -> o.reasoning() != null && !o.reasoning().isBlank())
            .map(o -> o.judgeId() + ": " + o.reasoning())
            .collect(Collectors.joining("\n"));
    }

    private static String failureSummary(List<JudgeOpinion> opinions) {
        if (opinions.isEmpty()) return "no judges";
        return opinions.stream()
            .map(o -> o.judgeId() + "=" + o.failureKind())
            .collect(Collectors.joining(", "));
    }
}
