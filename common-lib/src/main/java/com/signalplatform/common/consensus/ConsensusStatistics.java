package com.signalplatform.common.consensus;

import com.signalplatform.common.model.ConsensusDecision;
import com.signalplatform.common.model.ConsensusSource;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters over resolved consensus decisions. Safe for concurrent pipeline runs.
 */
public class ConsensusStatistics {

    private final AtomicLong total = new AtomicLong();
    private final Map<ConsensusSource, AtomicLong> bySource = new EnumMap<>(ConsensusSource.class);
    private final Map<String, AtomicLong> judgeWins = new ConcurrentHashMap<>();

    public ConsensusStatistics() {
        for (ConsensusSource source : ConsensusSource.values()) {
            bySource.put(source, new AtomicLong());
        }
    }

    void record(ConsensusDecision decision) {
        total.incrementAndGet();
        bySource.get(decision.source()).incrementAndGet();
        if (decision.winningJudgeId() != null) {
            judgeWins.computeIfAbsent(decision.winningJudgeId(), k -> new AtomicLong()).incrementAndGet();
        }
    }

    public Snapshot snapshot() {
        long totalCount   = total.get();
        long agreements   = count(ConsensusSource.AGREEMENT) + count(ConsensusSource.BELOW_THRESHOLD);
        long disagreements = count(ConsensusSource.DISAGREEMENT) + count(ConsensusSource.HIGHEST_CONFIDENCE_WINNER);
        Map<String, Long> wins = new ConcurrentHashMap<>();
        judgeWins.forEach((judge, n) -> wins.put(judge, n.get()));
        double agreementRate = totalCount == 0 ? 0.0 : agreements * 100.0 / totalCount;
        return new Snapshot(totalCount, agreements, disagreements,
                            count(ConsensusSource.SINGLE_FALLBACK), count(ConsensusSource.NONE),
                            Map.copyOf(wins), agreementRate);
    }

    private long count(ConsensusSource source) {
        return bySource.get(source).get();
    }

    /**
     * Point-in-time copy of the counters.
     *
     * @param agreements    runs where every responding judge agreed, above or below threshold
     * @param agreementRate agreements as a percentage of all runs
     */
    public record Snapshot(
        long total,
        long agreements,
        long disagreements,
        long singleFallbacks,
        long noOpinion,
        Map<String, Long> judgeWins,
        double agreementRate
    ) {}
}
