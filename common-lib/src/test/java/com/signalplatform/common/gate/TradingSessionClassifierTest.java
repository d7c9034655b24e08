package com.signalplatform.common.gate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TradingSessionClassifierTest {

    private static Set<TradingSession> at(String iso) {
        return TradingSessionClassifier.activeSessions(Instant.parse(iso));
    }

    @Test
    @DisplayName("Asian session wraps midnight")
    void asianWrapsMidnight() {
        assertEquals(EnumSet.of(TradingSession.ASIAN), at("2024-03-12T23:30:00Z"));
        assertEquals(EnumSet.of(TradingSession.ASIAN), at("2024-03-12T03:00:00Z"));
    }

    @Test
    @DisplayName("London/Asian overlap at 07:00, London/New York overlap at 13:00")
    void overlaps() {
        assertEquals(EnumSet.of(TradingSession.ASIAN, TradingSession.LONDON), at("2024-03-12T07:15:00Z"));
        assertEquals(EnumSet.of(TradingSession.LONDON, TradingSession.NEW_YORK), at("2024-03-12T13:00:00Z"));
    }

    @Test
    @DisplayName("21:00-23:00 UTC → no session open")
    void gapAfterNewYork() {
        assertTrue(at("2024-03-12T21:00:00Z").isEmpty());
        assertTrue(at("2024-03-12T22:59:00Z").isEmpty());
    }

    @Test
    @DisplayName("news window covers the first buffer minutes of 12:00-16:00 UTC hours")
    void newsWindow() {
        assertTrue(TradingSessionClassifier.isNewsWindow(Instant.parse("2024-03-12T12:00:00Z"), 30));
        assertTrue(TradingSessionClassifier.isNewsWindow(Instant.parse("2024-03-12T15:29:00Z"), 30));
        assertFalse(TradingSessionClassifier.isNewsWindow(Instant.parse("2024-03-12T14:30:00Z"), 30));
        assertFalse(TradingSessionClassifier.isNewsWindow(Instant.parse("2024-03-12T11:10:00Z"), 30));
    }

    @Test
    @DisplayName("fromText accepts config spellings")
    void fromText() {
        assertEquals(TradingSession.NEW_YORK, TradingSession.fromText("newyork"));
        assertEquals(TradingSession.NEW_YORK, TradingSession.fromText("new-york"));
        assertEquals(TradingSession.LONDON, TradingSession.fromText(" London "));
        assertThrows(IllegalArgumentException.class, () -> TradingSession.fromText("sydney"));
    }

    @Test
    @DisplayName("16:xx UTC → outside the news window, matching the end of the London/New York overlap")
    void newsWindowEndsAtSixteen() {
        assertTrue(TradingSessionClassifier.isNewsWindow(Instant.parse("2024-03-12T15:10:00Z"), 30));
        assertFalse(TradingSessionClassifier.isNewsWindow(Instant.parse("2024-03-12T16:10:00Z"), 30));
        assertFalse(TradingSessionClassifier.isNewsWindow(Instant.parse("2024-03-12T16:00:00Z"), 30));
    }

    @Test
    @DisplayName("session names parse the same under a Turkish default locale")
    void sessionNamesLocaleIndependent() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(TradingSession.ASIAN, TradingSession.fromText("asian"));
            assertEquals(TradingSession.NEW_YORK, TradingSession.fromText("new-york"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
