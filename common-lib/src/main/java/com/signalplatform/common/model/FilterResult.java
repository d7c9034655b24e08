package com.signalplatform.common.model;

import java.util.Map;

/**
 * Verdict of a single pre-trade filter. Score is in [0, 1]; {@code critical} filters veto
 * the trade on failure, advisory ones only lower the aggregate score.
 */
public record FilterResult(
    String filterName,
    boolean critical,
    boolean valid,
    double score,
    String reason,
    Map<String, Object> details
) {
    public FilterResult {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static FilterResult pass(String filterName, boolean critical, double score,
                                    String reason, Map<String, Object> details) {
        return new FilterResult(filterName, critical, true, score, reason, details);
    }

    public static FilterResult fail(String filterName, boolean critical, double score,
                                    String reason, Map<String, Object> details) {
        return new FilterResult(filterName, critical, false, score, reason, details);
    }

    public static FilterResult disabled(String filterName, boolean critical) {
        return new FilterResult(filterName, critical, true, 1.0, filterName + " check disabled", Map.of());
    }
}
