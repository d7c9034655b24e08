package com.signalplatform.common.gate;

import com.signalplatform.common.model.FilterResult;
import com.signalplatform.common.model.MicrostructureSnapshot;
import com.signalplatform.common.model.ValidationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Last line of defence before a directional signal is emitted.
 *
 * <p>Runs the five filters in a fixed order (spread, volatility, liquidity, session,
 * price action). A trade passes only when every critical filter passes AND the mean
 * score across all filters reaches {@code minAggregateScore}. Disabled filters count
 * as a pass with score 1.0. Advisory failures surface as warnings.
 *
 * <p>No logging and no I/O; the caller logs the verdict.
 */
public class PreTradeGate {

    private final GateSettings settings;
    private final List<FilterSlot> filters;
    private final GateStatistics statistics = new GateStatistics();

    public PreTradeGate(GateSettings settings) {
        this.settings = settings;
        this.filters = List.of(
            new FilterSlot(new SpreadFilter(settings.spread()),           settings.spread().enabled()),
            new FilterSlot(new VolatilityFilter(settings.volatility()),   settings.volatility().enabled()),
            new FilterSlot(new LiquidityFilter(settings.liquidity()),     settings.liquidity().enabled()),
            new FilterSlot(new SessionFilter(settings.session()),         settings.session().enabled()),
            new FilterSlot(new PriceActionFilter(settings.priceAction()), settings.priceAction().enabled())
        );
    }

    public GateStatistics statistics() {
        return statistics;
    }

    /**
     * @return the gate's verdict; never {@code null}. Too few candles yields an invalid
     *         result without running any filter.
     */
    public ValidationResult validate(MicrostructureSnapshot snapshot) {
        if (snapshot.candles().size() < settings.minCandles()) {
            String reason = String.format(Locale.ROOT, "Insufficient market data: %d candles, %d required",
                                          snapshot.candles().size(), settings.minCandles());
            ValidationResult rejected = ValidationResult.rejected(reason);
            statistics.record(rejected);
            return rejected;
        }

        Map<String, FilterResult> results = new LinkedHashMap<>();
        for (FilterSlot slot : filters) {
            PreTradeFilter filter = slot.filter();
            FilterResult result = slot.enabled()
                ? filter.evaluate(snapshot)
                : FilterResult.disabled(filter.name(), filter.critical());
            results.put(filter.name(), result);
        }

        boolean criticalPassed = results.values().stream()
            .filter(FilterResult::critical)
            .allMatch(FilterResult::valid);
        double aggregate = results.values().stream()
            .mapToDouble(FilterResult::score)
            .average()
            .orElse(0.0);
        boolean overall = criticalPassed && aggregate >= settings.minAggregateScore();

        List<String> warnings = results.values().stream()
            .filter(r -> !r.critical() && !r.valid())
            .map(r -> r.filterName() + ": " + r.reason())
            .toList();

        String reason = overall ? "All pre-trade checks passed" : rejectionReason(results, aggregate);
        ValidationResult validation = new ValidationResult(overall, results, aggregate, warnings, reason);
        statistics.record(validation);
        return validation;
    }

    private String rejectionReason(Map<String, FilterResult> results, double aggregate) {
        List<String> parts = new ArrayList<>();
        results.values().stream()
            .filter(r -> r.critical() && !r.valid())
            .forEach(r -> parts.add(r.filterName() + ": " + r.reason()));
        if (aggregate < settings.minAggregateScore()) {
            parts.add(String.format(Locale.ROOT, "aggregate score %.2f below %.2f",
                                    aggregate, settings.minAggregateScore()));
        }
        return parts.stream().collect(Collectors.joining("; "));
    }

    private record FilterSlot(PreTradeFilter filter, boolean enabled) {}
}
