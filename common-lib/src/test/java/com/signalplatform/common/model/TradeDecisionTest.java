package com.signalplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class TradeDecisionTest {

    @Test
    @DisplayName("directional synonyms in any case → BUY / SELL")
    void synonyms() {
        assertEquals(TradeDecision.BUY, TradeDecision.fromText(" long "));
        assertEquals(TradeDecision.BUY, TradeDecision.fromText("Bullish"));
        assertEquals(TradeDecision.SELL, TradeDecision.fromText("put"));
        assertEquals(TradeDecision.NO_TRADE, TradeDecision.fromText("no trade"));
        assertEquals(TradeDecision.NO_TRADE, TradeDecision.fromText(null));
    }

    @Test
    @DisplayName("Turkish default locale → dotted 'i' still maps \"bullish\" to BUY")
    void localeIndependent() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(TradeDecision.BUY, TradeDecision.fromText("bullish"));
            assertEquals(TradeDecision.SELL, TradeDecision.fromText("bearish"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
