package com.signalplatform.common.gate;

import com.signalplatform.common.model.Candle;
import com.signalplatform.common.model.FilterResult;
import com.signalplatform.common.model.MicrostructureSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Critical. Current volume against the window average, plus an absolute floor.
 * Classes without a volume signal (spot FX) and feeds reporting no volume at all pass.
 */
public class LiquidityFilter implements PreTradeFilter {

    public static final String NAME = "liquidity";

    private final GateSettings.Liquidity settings;

    public LiquidityFilter(GateSettings.Liquidity settings) {
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
        if (!snapshot.instrumentClass().hasVolumeSignal()) {
            return FilterResult.pass(NAME, true, 1.0,
                "Volume not meaningful for " + snapshot.instrumentClass(), Map.of());
        }

        List<Candle> candles = snapshot.candles();
        List<Candle> window = candles.subList(Math.max(0, candles.size() - settings.window()), candles.size());
        double average = window.stream().mapToDouble(Candle::volume).average().orElse(0.0);
        double current = snapshot.latest().volume();

        if (average == 0.0 && current == 0.0) {
            return FilterResult.pass(NAME, true, 1.0, "No volume reported, liquidity check skipped", Map.of());
        }

        double ratio = average > 0.0 ? current / average : 1.0;
        boolean valid = ratio >= settings.minVolumeRatio() && current >= settings.minAbsoluteVolume();
        double score = Math.min(1.0, Math.min(ratio / settings.minVolumeRatio(),
                                              current / settings.minAbsoluteVolume()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("currentVolume", current);
        details.put("averageVolume", average);
        details.put("volumeRatio", ratio);

        String reason = String.format(Locale.ROOT,
            "Volume %.0f (%.2fx average), requires %.2fx and %.0f", current, ratio,
            settings.minVolumeRatio(), settings.minAbsoluteVolume());
        return valid
            ? FilterResult.pass(NAME, true, 1.0, reason, details)
            : FilterResult.fail(NAME, true, score, reason, details);
    }
}
