package com.signalplatform.common.gate;

import com.signalplatform.common.model.ValidationResult;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Running pass/fail counters for the gate. Thread-safe. */
public class GateStatistics {

    static final String INSUFFICIENT_DATA = "insufficientData";

    private final AtomicLong total  = new AtomicLong();
    private final AtomicLong passed = new AtomicLong();
    private final Map<String, AtomicLong> failuresByFilter = new ConcurrentHashMap<>();

    void record(ValidationResult result) {
        total.incrementAndGet();
        if (result.overallValid()) {
            passed.incrementAndGet();
            return;
        }
        if (result.filters().isEmpty()) {
            failuresByFilter.computeIfAbsent(INSUFFICIENT_DATA, k -> new AtomicLong()).incrementAndGet();
            return;
        }
        result.failedFilters().forEach(name ->
            failuresByFilter.computeIfAbsent(name, k -> new AtomicLong()).incrementAndGet());
    }

    public Snapshot snapshot() {
        long totalCount  = total.get();
        long passedCount = passed.get();
        Map<String, Long> failures = new ConcurrentHashMap<>();
        failuresByFilter.forEach((name, n) -> failures.put(name, n.get()));
        double passRate = totalCount == 0 ? 0.0 : passedCount * 100.0 / totalCount;
        return new Snapshot(totalCount, passedCount, Map.copyOf(failures), passRate);
    }

    public record Snapshot(long total, long passed, Map<String, Long> failuresByFilter, double passRate) {}
}
