package com.signalplatform.orchestrator.calibration;

import com.signalplatform.common.calibration.CalibrationSettings;
import com.signalplatform.common.calibration.OutcomeClassifier;
import com.signalplatform.common.calibration.PerformanceCalculator;
import com.signalplatform.common.calibration.ThresholdAdjuster;
import com.signalplatform.common.calibration.ThresholdsRegistry;
import com.signalplatform.common.exception.CalibrationException;
import com.signalplatform.common.model.AdaptiveThresholds;
import com.signalplatform.common.model.BacktestRecord;
import com.signalplatform.common.model.CalibrationStatus;
import com.signalplatform.common.model.DateRange;
import com.signalplatform.common.model.PerformanceMetrics;
import com.signalplatform.common.provider.SignalHistoryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Closes the feedback loop: scores past signals against realized outcomes and moves the
 * live {@link AdaptiveThresholds} accordingly.
 *
 * <p>One cycle at a time. A failed cycle is logged, reported with
 * {@link CalibrationStatus#FAILED}, and leaves the published thresholds untouched.
 * The latest successful metrics are kept for reporting and for the pipeline's
 * performance filter.
 */
@Service
public class AdaptiveCalibrator {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveCalibrator.class);

    private final SignalHistoryProvider historyProvider;
    private final ThresholdsRegistry thresholdsRegistry;
    private final CalibrationSettings settings;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<PerformanceMetrics> latestMetrics = new AtomicReference<>();

    public AdaptiveCalibrator(SignalHistoryProvider historyProvider, ThresholdsRegistry thresholdsRegistry,
                              CalibrationSettings settings, Clock clock) {
        this.historyProvider    = historyProvider;
        this.thresholdsRegistry = thresholdsRegistry;
        this.settings           = settings;
        this.clock              = clock;
        settings.requireWithinBounds(thresholdsRegistry.current());
    }

    /** Cycle over the last {@code lookbackDays}. */
    public Mono<PerformanceMetrics> runDefaultCycle() {
        return Mono.defer(() -> runCalibrationCycle(DateRange.lastDays(settings.lookbackDays(), clock)));
    }

    /**
     * @return the cycle's metrics; errors with {@link CalibrationException} when another
     *         cycle is already running and with {@link IllegalArgumentException} for a null range
     */
    public Mono<PerformanceMetrics> runCalibrationCycle(DateRange range) {
        return Mono.defer(() -> {
            if (range == null) {
                return Mono.error(new IllegalArgumentException("Calibration range is required"));
            }
            if (!running.compareAndSet(false, true)) {
                return Mono.error(new CalibrationException("Calibration cycle already in progress"));
            }
            try {
                return cycle(range).doFinally(signal -> running.set(false));
            } catch (RuntimeException e) {
                // assembly failed before doFinally was attached
                running.set(false);
                return Mono.error(e);
            }
        });
    }

    public PerformanceMetrics latestMetrics() {
        return latestMetrics.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    // ── cycle steps ───────────────────────────────────────────────────────────

    private Mono<PerformanceMetrics> cycle(DateRange range) {
        AdaptiveThresholds before = thresholdsRegistry.current();
        log.info("[Calibrator] Cycle started. from={} to={} thresholdsVersion={}",
                 range.from(), range.to(), before.version());

        return Flux.defer(() -> historyProvider.getHistoricalSignalsAndOutcomes(range))
            .filter(h -> h.outcome() != null && h.decision() != null)
            .map(h -> OutcomeClassifier.classify(h, settings.minMovePercent()))
            .collectList()
            .map(records -> apply(records, range, before))
            .doOnNext(this::remember)
            .onErrorResume(e -> {
                long version = thresholdsRegistry.current().version();
                log.error("[Calibrator] Cycle failed, thresholds unchanged. version={} reason={}",
                          version, e.getMessage());
                return Mono.just(PerformanceMetrics.failed(range, version, clock.instant()));
            });
    }

    private PerformanceMetrics apply(List<BacktestRecord> records, DateRange range, AdaptiveThresholds before) {
        PerformanceMetrics metrics = PerformanceCalculator.calculate(records, range, clock.instant());
        ThresholdAdjuster.Adjustment adjustment =
            ThresholdAdjuster.adjust(metrics, before, settings, clock.instant());

        if (adjustment.status() == CalibrationStatus.ADJUSTED) {
            AdaptiveThresholds next = adjustment.thresholds();
            if (!thresholdsRegistry.publish(before, next)) {
                throw new CalibrationException("Thresholds changed during cycle; version "
                                               + before.version() + " is stale");
            }
            log.info("[Calibrator] Thresholds published. version={}->{} minConfidence={}->{} "
                     + "consensusRequired={} agreementBonus={} accuracy={} samples={}",
                     before.version(), next.version(), before.minConfidence(), next.minConfidence(),
                     next.consensusRequired(), next.consensusAgreementBonus(),
                     metrics.accuracy(), metrics.totalSignals());
        } else {
            log.info("[Calibrator] Thresholds kept. status={} version={} accuracy={} samples={}",
                     adjustment.status(), before.version(), metrics.accuracy(), metrics.totalSignals());
        }
        return metrics.withOutcome(adjustment.status(), thresholdsRegistry.current().version());
    }

    private void remember(PerformanceMetrics metrics) {
        if (metrics.status() == CalibrationStatus.ADJUSTED || metrics.status() == CalibrationStatus.UNCHANGED) {
            latestMetrics.set(metrics);
        }
        historyProvider.recordMetrics(metrics);
    }
}
