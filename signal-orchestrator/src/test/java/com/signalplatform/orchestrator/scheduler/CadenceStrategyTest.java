package com.signalplatform.orchestrator.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CadenceStrategyTest {

    // ── weekend boundary ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("isWeekend()")
    class WeekendTests {

        @Test
        @DisplayName("Friday before 21:00 UTC → trading week")
        void fridayEvening() {
            assertFalse(CadenceStrategy.isWeekend(Instant.parse("2024-03-15T20:59:00Z")));
        }

        @Test
        @DisplayName("Friday from 21:00 UTC → weekend")
        void fridayClose() {
            assertTrue(CadenceStrategy.isWeekend(Instant.parse("2024-03-15T21:00:00Z")));
        }

        @Test
        @DisplayName("Saturday → weekend all day")
        void saturday() {
            assertTrue(CadenceStrategy.isWeekend(Instant.parse("2024-03-16T12:00:00Z")));
        }

        @Test
        @DisplayName("Sunday from 21:00 UTC → trading week reopens")
        void sundayOpen() {
            assertTrue(CadenceStrategy.isWeekend(Instant.parse("2024-03-17T20:59:00Z")));
            assertFalse(CadenceStrategy.isWeekend(Instant.parse("2024-03-17T21:00:00Z")));
        }
    }

    // ── interval ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("resolve()")
    class ResolveTests {

        @Test
        @DisplayName("London session open → active interval")
        void activeSession() {
            assertEquals(CadenceStrategy.ACTIVE_INTERVAL, CadenceStrategy.resolve(Instant.parse("2024-03-12T10:10:00Z")));
        }

        @Test
        @DisplayName("weekday gap between New York close and Asian open → off-session interval")
        void weekdayGap() {
            assertEquals(CadenceStrategy.OFF_SESSION_INTERVAL, CadenceStrategy.resolve(Instant.parse("2024-03-12T22:30:00Z")));
        }

        @Test
        @DisplayName("Saturday during London hours → off-session interval")
        void weekendOverridesSessions() {
            assertEquals(CadenceStrategy.OFF_SESSION_INTERVAL, CadenceStrategy.resolve(Instant.parse("2024-03-16T10:00:00Z")));
        }
    }
}
