package com.signalplatform.common.gate;

import com.signalplatform.common.model.Candle;
import com.signalplatform.common.model.FilterResult;
import com.signalplatform.common.model.MicrostructureSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Critical. Mean absolute close-to-close return over the configured window must sit
 * between the floor and the ceiling. The floor is scaled down for low-volatility classes.
 */
public class VolatilityFilter implements PreTradeFilter {

    public static final String NAME = "volatility";

    private final GateSettings.Volatility settings;

    public VolatilityFilter(GateSettings.Volatility settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean critical() {
        return true;
    }

    @Override
    public FilterResult evaluate(MicrostructureSnapshot snapshot) {
        List<Candle> candles = snapshot.candles();
        int start = Math.max(1, candles.size() - settings.window());
        double sum = 0.0;
        int changes = 0;
        for (int i = start; i < candles.size(); i++) {
            double prev = candles.get(i - 1).close();
            if (prev <= 0.0) continue;
            sum += Math.abs(candles.get(i).close() - prev) / prev * 100.0;
            changes++;
        }
        if (changes == 0) {
            return FilterResult.fail(NAME, true, 0.0, "No price changes to measure volatility", Map.of());
        }

        double volatility = sum / changes;
        double floor = snapshot.instrumentClass().lowVolatility()
            ? settings.minVolatilityPercent() * settings.lowVolatilityFactor()
            : settings.minVolatilityPercent();
        double ceiling = settings.maxVolatilityPercent();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("volatilityPercent", volatility);
        details.put("floorPercent", floor);
        details.put("ceilingPercent", ceiling);

        if (volatility < floor) {
            return FilterResult.fail(NAME, true, volatility / floor,
                String.format(Locale.ROOT, "Volatility too low: %.5f%% < %.5f%%", volatility, floor), details);
        }
        if (volatility > ceiling) {
            return FilterResult.fail(NAME, true, Math.max(0.0, 1.0 - (volatility - ceiling) / ceiling),
                String.format(Locale.ROOT, "Volatility too high: %.4f%% > %.4f%%", volatility, ceiling), details);
        }
        return FilterResult.pass(NAME, true, 1.0,
            String.format(Locale.ROOT, "Volatility %.5f%% within [%.5f%%, %.4f%%]", volatility, floor, ceiling),
            details);
    }
}
