package com.signalplatform.common.confluence;

import com.signalplatform.common.model.Timeframe;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TimeframeSetTest {

    @Test
    @DisplayName("defaults: six timeframes, 4h and 1d higher")
    void defaults() {
        TimeframeSet set = TimeframeSet.defaults();

        assertEquals(6, set.timeframes().size());
        assertEquals(List.of(Timeframe.H4, Timeframe.D1), set.higherTimeframes());
        assertEquals(0.15, set.weightOf(Timeframe.M15), 1e-9);
    }

    @Test
    @DisplayName("weights not summing to 1 → rejected")
    void weightsMustSumToOne() {
        Map<Timeframe, Double> weights = new EnumMap<>(Timeframe.class);
        weights.put(Timeframe.M5, 0.5);
        weights.put(Timeframe.H1, 0.4);

        assertThrows(IllegalArgumentException.class, () -> new TimeframeSet(weights, List.of()));
    }

    @Test
    @DisplayName("higher timeframe outside the weights → rejected")
    void higherMustBeConfigured() {
        Map<Timeframe, Double> weights = new EnumMap<>(Timeframe.class);
        weights.put(Timeframe.M5, 0.5);
        weights.put(Timeframe.H1, 0.5);

        assertThrows(IllegalArgumentException.class, () -> new TimeframeSet(weights, List.of(Timeframe.D1)));
    }

    @Test
    @DisplayName("of(): picks the longest timeframes as higher")
    void ofPicksLongest() {
        Map<Timeframe, Double> weights = new EnumMap<>(Timeframe.class);
        weights.put(Timeframe.M15, 0.25);
        weights.put(Timeframe.H1, 0.25);
        weights.put(Timeframe.H4, 0.25);
        weights.put(Timeframe.D1, 0.25);

        TimeframeSet set = TimeframeSet.of(weights, 2);

        assertEquals(List.of(Timeframe.H4, Timeframe.D1), set.higherTimeframes());
    }
}
