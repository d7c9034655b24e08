package com.signalplatform.orchestrator.controller;

import com.signalplatform.common.calibration.ThresholdsRegistry;
import com.signalplatform.common.exception.CalibrationException;
import com.signalplatform.common.model.AdaptiveThresholds;
import com.signalplatform.common.model.CalibrationStatus;
import com.signalplatform.common.model.DateRange;
import com.signalplatform.common.model.PerformanceMetrics;
import com.signalplatform.orchestrator.Fixtures;
import com.signalplatform.orchestrator.calibration.AdaptiveCalibrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.mockito.Mockito.*;

class CalibrationControllerTest {

    private static final Instant NOW = Fixtures.LONDON_MORNING;

    private AdaptiveCalibrator calibrator;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        calibrator = mock(AdaptiveCalibrator.class);
        ThresholdsRegistry registry = new ThresholdsRegistry(AdaptiveThresholds.initial(70, true, 0, NOW));
        client = WebTestClient.bindToController(new CalibrationController(calibrator, registry)).build();
    }

    private static PerformanceMetrics metrics(CalibrationStatus status) {
        return new PerformanceMetrics(NOW.minus(Duration.ofDays(7)), NOW, 25, 21, 84.0, 84.0, 80.0,
                                      Map.of(), status, 2L, NOW);
    }

    @Test
    @DisplayName("GET /thresholds → live thresholds")
    void thresholds() {
        client.get().uri("/api/v1/thresholds")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.version").isEqualTo(1)
            .jsonPath("$.minConfidence").isEqualTo(70.0)
            .jsonPath("$.consensusRequired").isEqualTo(true);
    }

    // ── run ───────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("POST /calibration/run")
    class RunTests {

        @Test
        @DisplayName("no range → default cycle")
        void defaultCycle() {
            when(calibrator.runDefaultCycle()).thenReturn(Mono.just(metrics(CalibrationStatus.ADJUSTED)));

            client.post().uri("/api/v1/calibration/run")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ADJUSTED")
                .jsonPath("$.thresholdsVersion").isEqualTo(2);
        }

        @Test
        @DisplayName("explicit range → cycle over that range")
        void explicitRange() {
            DateRange range = new DateRange(Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-05T00:00:00Z"));
            when(calibrator.runCalibrationCycle(range)).thenReturn(Mono.just(metrics(CalibrationStatus.UNCHANGED)));

            client.post().uri("/api/v1/calibration/run?from=2024-03-01T00:00:00Z&to=2024-03-05T00:00:00Z")
                .exchange()
                .expectStatus().isOk();

            verify(calibrator).runCalibrationCycle(range);
            verify(calibrator, never()).runDefaultCycle();
        }

        @Test
        @DisplayName("inverted range → 400")
        void invertedRange() {
            client.post().uri("/api/v1/calibration/run?from=2024-03-05T00:00:00Z&to=2024-03-01T00:00:00Z")
                .exchange()
                .expectStatus().isBadRequest();

            verifyNoInteractions(calibrator);
        }

        @Test
        @DisplayName("cycle already running → 409")
        void busy() {
            when(calibrator.runDefaultCycle())
                .thenReturn(Mono.error(new CalibrationException("Calibration cycle already in progress")));

            client.post().uri("/api/v1/calibration/run")
                .exchange()
                .expectStatus().isEqualTo(409);
        }
    }

    // ── metrics ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("GET /calibration/metrics")
    class MetricsTests {

        @Test
        @DisplayName("no completed cycle yet → 204")
        void noMetrics() {
            when(calibrator.latestMetrics()).thenReturn(null);

            client.get().uri("/api/v1/calibration/metrics")
                .exchange()
                .expectStatus().isNoContent();
        }

        @Test
        @DisplayName("completed cycle → latest metrics")
        void latestMetrics() {
            when(calibrator.latestMetrics()).thenReturn(metrics(CalibrationStatus.ADJUSTED));

            client.get().uri("/api/v1/calibration/metrics")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.accuracy").isEqualTo(84.0)
                .jsonPath("$.totalSignals").isEqualTo(25);
        }
    }
}
