package com.signalplatform.orchestrator;

import com.signalplatform.common.model.Candle;
import com.signalplatform.common.model.IndicatorSnapshot;
import com.signalplatform.common.model.MicrostructureSnapshot;
import com.signalplatform.common.model.Timeframe;
import com.signalplatform.common.model.VolumeTrend;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Market data fixtures shared by the orchestrator tests. */
public final class Fixtures {

    /** Tuesday 10:10 UTC: London session, outside the news window. */
    public static final Instant LONDON_MORNING = Instant.parse("2024-03-12T10:10:00Z");

    private Fixtures() {}

    public static IndicatorSnapshot bullishSnapshot(String instrument, Timeframe tf) {
        return new IndicatorSnapshot(instrument, tf, LONDON_MORNING, 100, 1.15, 0.5,
            65.0,
            new IndicatorSnapshot.Macd(0.6, 0.1, 0.5, 0.3),
            new IndicatorSnapshot.Ema(1.2, 1.1, 1.0),
            new IndicatorSnapshot.Bollinger(1.2, 1.1, 1.0),
            new IndicatorSnapshot.Stochastic(70, 65), 0.01,
            new IndicatorSnapshot.VolumeProfile(2000, 1500, VolumeTrend.INCREASING),
            List.of());
    }

    public static IndicatorSnapshot bearishSnapshot(String instrument, Timeframe tf) {
        return new IndicatorSnapshot(instrument, tf, LONDON_MORNING, 100, 1.05, -0.5,
            35.0,
            new IndicatorSnapshot.Macd(-0.6, -0.1, -0.5, -0.3),
            new IndicatorSnapshot.Ema(1.0, 1.1, 1.2),
            new IndicatorSnapshot.Bollinger(1.2, 1.1, 1.0),
            null, 0.01,
            new IndicatorSnapshot.VolumeProfile(2000, 1500, VolumeTrend.INCREASING),
            List.of());
    }

    /** Ten calm EUR/USD candles, each opening at the prior close. */
    public static MicrostructureSnapshot calmMicrostructure(String instrument) {
        List<Candle> candles = new ArrayList<>();
        double previous = 1.1003;
        for (int i = 0; i < 10; i++) {
            double close = i % 2 == 0 ? 1.1000 : 1.1003;
            candles.add(new Candle(LONDON_MORNING.minus(Duration.ofMinutes(10 - i)), previous,
                                   Math.max(previous, close) + 0.00005, Math.min(previous, close) - 0.00005,
                                   close, 0.0));
            previous = close;
        }
        return new MicrostructureSnapshot(instrument, null, LONDON_MORNING, candles);
    }

    /** Calm candles whose latest bar spans roughly 0.3% of price. */
    public static MicrostructureSnapshot wideSpreadMicrostructure(String instrument) {
        MicrostructureSnapshot calm = calmMicrostructure(instrument);
        List<Candle> candles = new ArrayList<>(calm.candles());
        Candle last = candles.remove(candles.size() - 1);
        candles.add(new Candle(last.timestamp(), last.open(), last.close() + 0.0017, last.close() - 0.0016,
                               last.close(), 0.0));
        return new MicrostructureSnapshot(instrument, null, LONDON_MORNING, candles);
    }

    public static String judgeReply(String decision, int confidence) {
        return """
            ```json
            {
              "decision": "%s",
              "confidence": %d,
              "reasoning": "Trend and momentum aligned",
              "keyFactors": ["EMA stack", "MACD rising"],
              "riskLevel": "MEDIUM",
              "stopLossLevel": 1.0950,
              "takeProfitLevel": 1.1100
            }
            ```
            """.formatted(decision, confidence);
    }
}
