package com.signalplatform.orchestrator.judge;

import com.signalplatform.common.model.AnalysisContext;
import com.signalplatform.common.model.CandlestickPattern;
import com.signalplatform.common.model.ConfluenceResult;
import com.signalplatform.common.model.IndicatorSnapshot;
import com.signalplatform.common.model.Timeframe;
import com.signalplatform.common.model.TimeframeBias;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders an {@link AnalysisContext} into the single prompt every judge receives.
 * Output is deterministic for a given context.
 */
@Component
public class AnalysisPromptBuilder {

    public String render(AnalysisContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are analysing ").append(context.instrument())
          .append(" for a trade on the ").append(context.timeframe().label()).append(" timeframe")
          .append(" (analysis window ").append(context.analysisWindow()).append(" candles).\n\n");

        IndicatorSnapshot primary = context.primarySnapshot();
        if (primary != null) {
            sb.append("CURRENT MARKET DATA:\n")
              .append("- Current Price: ").append(num(primary.currentPrice(), 5)).append('\n')
              .append("- Price Change: ").append(num(primary.priceChangePercent(), 3)).append("%\n\n");
        }

        sb.append("TECHNICAL INDICATORS BY TIMEFRAME:\n");
        for (Map.Entry<Timeframe, IndicatorSnapshot> entry : context.snapshots().entrySet()) {
            appendSnapshot(sb, entry.getKey(), entry.getValue());
        }

        appendConfluence(sb, context.confluence());

        sb.append("\nTASK: Recommend a trade for the NEXT ").append(context.timeframe().label())
          .append(" candle.\n\n")
          .append("RESPONSE FORMAT (JSON only):\n")
          .append("{\n")
          .append("  \"decision\": \"BUY\" | \"SELL\" | \"NO_TRADE\",\n")
          .append("  \"confidence\": 0-100,\n")
          .append("  \"reasoning\": \"explanation of the decision\",\n")
          .append("  \"keyFactors\": [\"factor1\", \"factor2\", \"factor3\"],\n")
          .append("  \"riskLevel\": \"LOW\" | \"MEDIUM\" | \"HIGH\",\n")
          .append("  \"stopLossLevel\": number,\n")
          .append("  \"takeProfitLevel\": number\n")
          .append("}\n\n")
          .append("Recommend NO_TRADE whenever the evidence is mixed.");
        return sb.toString();
    }

    private void appendSnapshot(StringBuilder sb, Timeframe timeframe, IndicatorSnapshot s) {
        sb.append("[").append(timeframe.label()).append("]\n");
        if (s.rsi() != null) {
            sb.append("- RSI: ").append(num(s.rsi(), 2)).append('\n');
        }
        if (s.macd() != null) {
            sb.append("- MACD: ").append(num(s.macd().macd(), 5))
              .append(" signal ").append(num(s.macd().signal(), 5))
              .append(" histogram ").append(num(s.macd().histogram(), 5)).append('\n');
        }
        if (s.ema() != null) {
            sb.append("- EMA fast/mid/slow: ").append(num(s.ema().fast(), 5)).append(" / ")
              .append(num(s.ema().mid(), 5)).append(" / ").append(num(s.ema().slow(), 5)).append('\n');
        }
        if (s.bollinger() != null) {
            sb.append("- Bollinger upper/middle/lower: ").append(num(s.bollinger().upper(), 5)).append(" / ")
              .append(num(s.bollinger().middle(), 5)).append(" / ").append(num(s.bollinger().lower(), 5))
              .append('\n');
        }
        if (s.stochastic() != null) {
            sb.append("- Stochastic %K/%D: ").append(num(s.stochastic().k(), 2)).append(" / ")
              .append(num(s.stochastic().d(), 2)).append('\n');
        }
        if (s.atr() != null) {
            sb.append("- ATR: ").append(num(s.atr(), 5)).append('\n');
        }
        if (s.volume() != null) {
            sb.append("- Volume: ").append(num(s.volume().current(), 0))
              .append(" (avg ").append(num(s.volume().average(), 0))
              .append(", ").append(s.volume().trend()).append(")\n");
        }
        if (!s.patterns().isEmpty()) {
            sb.append("- Patterns: ").append(s.patterns().stream()
                .map(AnalysisPromptBuilder::pattern)
                .collect(Collectors.joining(", "))).append('\n');
        }
    }

    private void appendConfluence(StringBuilder sb, ConfluenceResult confluence) {
        if (confluence == null) return;
        sb.append("\nMULTI-TIMEFRAME CONFLUENCE:\n")
          .append("- Direction: ").append(confluence.direction())
          .append(" (confidence ").append(num(confluence.confidence() * 100.0, 1)).append("%)\n")
          .append("- ").append(confluence.explanation()).append('\n');
        for (TimeframeBias bias : confluence.biases()) {
            sb.append("- ").append(bias.timeframe().label()).append(": ").append(bias.direction())
              .append(" strength ").append(num(bias.strength(), 2)).append('\n');
        }
    }

    private static String pattern(CandlestickPattern p) {
        return p.name() + " " + p.direction() + " " + num(p.strength(), 2);
    }

    private static String num(double value, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "f", value);
    }
}
