package com.signalplatform.common.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Everything the judges see for one invocation. Built once and rendered to a single
 * prompt so every judge receives identical input.
 */
public record AnalysisContext(
    String instrument,
    Timeframe timeframe,
    int analysisWindow,
    Map<Timeframe, IndicatorSnapshot> snapshots,
    ConfluenceResult confluence,
    Instant createdAt
) {
    public AnalysisContext {
        snapshots = snapshots == null || snapshots.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(snapshots));
    }

    /** Snapshot of the requested timeframe, or the shortest analyzed one if it was skipped. */
    public IndicatorSnapshot primarySnapshot() {
        IndicatorSnapshot primary = snapshots.get(timeframe);
        if (primary != null) return primary;
        return snapshots.values().stream().findFirst().orElse(null);
    }
}
