package com.signalplatform.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate verdict of the pre-trade gate. {@code filters} keeps the evaluation order.
 */
public record ValidationResult(
    boolean overallValid,
    Map<String, FilterResult> filters,
    double aggregateScore,
    List<String> warnings,
    String reason
) {
    public ValidationResult {
        filters  = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /** Rejection produced before any filter ran (too few candles, snapshot unavailable). */
    public static ValidationResult rejected(String reason) {
        return new ValidationResult(false, Map.of(), 0.0, List.of(), reason);
    }

    public List<String> failedFilters() {
        return filters.values().stream()
            .filter(f -> !f.valid())
            .map(FilterResult::filterName)
            .toList();
    }
}
