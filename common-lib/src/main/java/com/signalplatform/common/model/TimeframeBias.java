package com.signalplatform.common.model;

import java.util.List;

/**
 * Directional lean of a single timeframe, with the raw point totals behind it.
 */
public record TimeframeBias(
    Timeframe timeframe,
    BiasDirection direction,
    double strength,
    double weight,
    double bullishPoints,
    double bearishPoints,
    double neutralPoints,
    List<String> factors
) {
    public TimeframeBias {
        factors = factors == null ? List.of() : List.copyOf(factors);
    }
}
