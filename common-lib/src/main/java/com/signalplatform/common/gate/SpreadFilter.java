package com.signalplatform.common.gate;

import com.signalplatform.common.model.Candle;
import com.signalplatform.common.model.FilterResult;
import com.signalplatform.common.model.InstrumentClass;
import com.signalplatform.common.model.MicrostructureSnapshot;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Critical. Uses the latest candle's high-low range relative to close as the spread proxy;
 * FX pairs must also stay within the pip ceiling.
 */
public class SpreadFilter implements PreTradeFilter {

    public static final String NAME = "spread";

    private final GateSettings.Spread settings;

    public SpreadFilter(GateSettings.Spread settings) {
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
        Candle latest = snapshot.latest();
        if (latest.close() <= 0.0) {
            return FilterResult.fail(NAME, true, 0.0, "Invalid close price " + latest.close(), Map.of());
        }
        double range = latest.high() - latest.low();
        double spreadPercent = range / latest.close() * 100.0;
        boolean valid = spreadPercent <= settings.maxSpreadPercent();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("spreadPercent", spreadPercent);
        details.put("maxSpreadPercent", settings.maxSpreadPercent());

        String reason;
        if (snapshot.instrumentClass() == InstrumentClass.FOREX) {
            double pips = range / InstrumentClass.pipSize(snapshot.instrument());
            details.put("spreadPips", pips);
            valid = valid && pips <= settings.maxSpreadPips();
            reason = String.format(Locale.ROOT, "Spread %.4f%% (%.1f pips), limit %.4f%% / %.1f pips",
                                   spreadPercent, pips, settings.maxSpreadPercent(), settings.maxSpreadPips());
        } else {
            reason = String.format(Locale.ROOT, "Spread %.4f%%, limit %.4f%%",
                                   spreadPercent, settings.maxSpreadPercent());
        }

        double score = valid ? 1.0 : Math.max(0.0, 1.0 - spreadPercent / settings.maxSpreadPercent());
        return valid
            ? FilterResult.pass(NAME, true, score, reason, details)
            : FilterResult.fail(NAME, true, score, reason, details);
    }
}
