package com.signalplatform.orchestrator.scheduler;

import com.signalplatform.orchestrator.calibration.AdaptiveCalibrator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Runs one calibration cycle per day at a fixed UTC time. The next run is scheduled only
 * after the current one completes, so cycles never overlap.
 */
@Component
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class CalibrationScheduler {

    private static final Logger log = LoggerFactory.getLogger(CalibrationScheduler.class);

    private final AdaptiveCalibrator calibrator;
    private final Clock clock;

    private volatile Disposable pending;
    private volatile boolean stopped;

    @Value("${calibration.schedule.time-utc:02:00}")
    private String timeUtc;

    public CalibrationScheduler(AdaptiveCalibrator calibrator, Clock clock) {
        this.calibrator = calibrator;
        this.clock      = clock;
    }

    @PostConstruct
    public void start() {
        LocalTime at = LocalTime.parse(timeUtc);
        Duration delay = delayUntil(at, clock.instant());
        log.info("[CalibrationScheduler] Started. timeUtc={} firstRunInMinutes={}", at, delay.toMinutes());
        scheduleNext(at, delay);
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable current = pending;
        if (current != null) current.dispose();
    }

    /** Time from {@code now} to the next occurrence of {@code at} (UTC); a full day when exactly on it. */
    static Duration delayUntil(LocalTime at, Instant now) {
        ZonedDateTime utcNow = now.atZone(ZoneOffset.UTC);
        ZonedDateTime next = utcNow.toLocalDate().atTime(at).atZone(ZoneOffset.UTC);
        if (!next.isAfter(utcNow)) {
            next = next.plusDays(1);
        }
        return Duration.between(utcNow, next);
    }

    private void scheduleNext(LocalTime at, Duration delay) {
        if (stopped) return;
        pending = Mono.delay(delay)
            .then(Mono.defer(calibrator::runDefaultCycle))
            .subscribe(
                metrics -> {
                    log.info("[CalibrationScheduler] Cycle done. status={} accuracy={} samples={} thresholdsVersion={}",
                             metrics.status(), metrics.accuracy(), metrics.totalSignals(), metrics.thresholdsVersion());
                    scheduleNext(at, delayUntil(at, clock.instant()));
                },
                err -> {
                    log.error("[CalibrationScheduler] Cycle did not run. reason={}", err.getMessage());
                    scheduleNext(at, delayUntil(at, clock.instant()));
                }
            );
    }
}
