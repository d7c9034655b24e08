package com.signalplatform.orchestrator.controller;

import com.signalplatform.common.calibration.ThresholdsRegistry;
import com.signalplatform.common.exception.CalibrationException;
import com.signalplatform.common.model.AdaptiveThresholds;
import com.signalplatform.common.model.DateRange;
import com.signalplatform.common.model.PerformanceMetrics;
import com.signalplatform.orchestrator.calibration.AdaptiveCalibrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1")
public class CalibrationController {

    private static final Logger log = LoggerFactory.getLogger(CalibrationController.class);

    private final AdaptiveCalibrator calibrator;
    private final ThresholdsRegistry thresholdsRegistry;

    public CalibrationController(AdaptiveCalibrator calibrator, ThresholdsRegistry thresholdsRegistry) {
        this.calibrator         = calibrator;
        this.thresholdsRegistry = thresholdsRegistry;
    }

    @GetMapping("/thresholds")
    public ResponseEntity<AdaptiveThresholds> thresholds() {
        return ResponseEntity.ok(thresholdsRegistry.current());
    }

    /**
     * Runs one cycle over {@code [from, to]}, or over the default lookback when either bound
     * is missing. 409 while another cycle is running, 400 on an inverted range.
     */
    @PostMapping("/calibration/run")
    public Mono<ResponseEntity<PerformanceMetrics>> run(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        Mono<PerformanceMetrics> cycle;
        if (from != null && to != null) {
            if (from.isAfter(to)) {
                return Mono.just(ResponseEntity.badRequest().build());
            }
            cycle = calibrator.runCalibrationCycle(new DateRange(from, to));
        } else {
            cycle = calibrator.runDefaultCycle();
        }
        return cycle
            .map(ResponseEntity::ok)
            .onErrorResume(CalibrationException.class, e -> {
                log.warn("[CalibrationController] Calibration rejected. reason={}", e.getMessage());
                return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).build());
            });
    }

    @GetMapping("/calibration/metrics")
    public ResponseEntity<PerformanceMetrics> metrics() {
        PerformanceMetrics latest = calibrator.latestMetrics();
        return latest == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(latest);
    }
}
