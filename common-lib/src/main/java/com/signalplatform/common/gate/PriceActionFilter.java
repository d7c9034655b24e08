package com.signalplatform.common.gate;

import com.signalplatform.common.model.Candle;
import com.signalplatform.common.model.FilterResult;
import com.signalplatform.common.model.MicrostructureSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Advisory. Rejects gapped opens and doji-sized bodies on the latest candle.
 */
public class PriceActionFilter implements PreTradeFilter {

    public static final String NAME = "priceAction";

    private final GateSettings.PriceAction settings;

    public PriceActionFilter(GateSettings.PriceAction settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean critical() {
        return false;
    }

    @Override
    public FilterResult evaluate(MicrostructureSnapshot snapshot) {
        List<Candle> candles = snapshot.candles();
        if (candles.size() < 2) {
            return FilterResult.pass(NAME, false, 1.0, "No previous candle to compare", Map.of());
        }
        Candle latest   = candles.get(candles.size() - 1);
        Candle previous = candles.get(candles.size() - 2);

        double gapPercent  = previous.close() > 0.0
            ? Math.abs(latest.open() - previous.close()) / previous.close() * 100.0
            : 0.0;
        double bodyPercent = latest.open() > 0.0
            ? Math.abs(latest.close() - latest.open()) / latest.open() * 100.0
            : 0.0;
        double minBody = snapshot.instrumentClass().lowVolatility()
            ? settings.minCandleBodyPercent() * settings.lowVolatilityFactor()
            : settings.minCandleBodyPercent();

        boolean gapOk  = gapPercent <= settings.maxGapPercent();
        boolean bodyOk = bodyPercent >= minBody;
        double gapScore  = gapOk ? 1.0 : Math.max(0.0, 1.0 - (gapPercent - settings.maxGapPercent()) / settings.maxGapPercent());
        double bodyScore = bodyOk ? 1.0 : bodyPercent / minBody;

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("gapPercent", gapPercent);
        details.put("bodyPercent", bodyPercent);
        details.put("minBodyPercent", minBody);

        String reason = String.format(Locale.ROOT, "Gap %.4f%% (max %.4f%%), body %.5f%% (min %.5f%%)",
                                      gapPercent, settings.maxGapPercent(), bodyPercent, minBody);
        double score = Math.min(gapScore, bodyScore);
        return gapOk && bodyOk
            ? FilterResult.pass(NAME, false, score, reason, details)
            : FilterResult.fail(NAME, false, score, reason, details);
    }
}
