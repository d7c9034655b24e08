package com.signalplatform.orchestrator.scheduler;

import com.signalplatform.common.model.Timeframe;
import com.signalplatform.orchestrator.pipeline.SignalDecisionPipeline;
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
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodic signal trigger. Each configured (instrument, timeframe) pair runs its own loop:
 * <pre>
 *   delay(interval) → generateSignal → resolve next interval → repeat
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} whose terminal {@code subscribe} schedules the
 * next one, so nothing nests and no thread blocks during the wait. The loop never stops
 * on its own: a failed cycle reschedules at {@link CadenceStrategy#FALLBACK_INTERVAL}.
 */
@Component
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SignalScheduler {

    private static final Logger log = LoggerFactory.getLogger(SignalScheduler.class);

    private final SignalDecisionPipeline pipeline;
    private final Clock clock;

    private final Map<String, Disposable> loops = new ConcurrentHashMap<>();
    private volatile boolean stopped;

    @Value("${scheduler.instruments:EURUSD,GBPUSD,USDJPY}")
    private String instrumentsConfig;

    @Value("${scheduler.timeframes:15m}")
    private String timeframesConfig;

    @Value("${scheduler.initial-delay:PT30S}")
    private Duration initialDelay;

    public SignalScheduler(SignalDecisionPipeline pipeline, Clock clock) {
        this.pipeline = pipeline;
        this.clock    = clock;
    }

    @PostConstruct
    public void start() {
        List<String> instruments = split(instrumentsConfig);
        List<Timeframe> timeframes = split(timeframesConfig).stream().map(Timeframe::fromLabel).toList();
        log.info("[SignalScheduler] Started. instruments={} timeframes={}", instruments, timeframes);

        for (String instrument : instruments) {
            for (Timeframe timeframe : timeframes) {
                scheduleNextCycle(instrument, timeframe, initialDelay);
            }
        }
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        loops.values().forEach(Disposable::dispose);
        loops.clear();
        log.info("[SignalScheduler] Stopped.");
    }

    // ── loop ──────────────────────────────────────────────────────────────────

    private void scheduleNextCycle(String instrument, Timeframe timeframe, Duration delay) {
        if (stopped) return;
        String key = instrument + "/" + timeframe.label();
        Disposable cycle = Mono.delay(delay)
            .then(Mono.defer(() -> pipeline.generateSignal(instrument, timeframe, 0)))
            .subscribe(
                signal -> {
                    Duration next = CadenceStrategy.resolve(clock.instant());
                    log.info("[SignalScheduler] Cycle done. instrument={} timeframe={} decision={} nextIntervalSeconds={}",
                             instrument, timeframe.label(), signal.decision(), next.toSeconds());
                    scheduleNextCycle(instrument, timeframe, next);
                },
                err -> {
                    log.error("[SignalScheduler] Cycle failed, rescheduling with fallback interval. instrument={} timeframe={}",
                              instrument, timeframe.label(), err);
                    scheduleNextCycle(instrument, timeframe, CadenceStrategy.FALLBACK_INTERVAL);
                }
            );
        loops.put(key, cycle);
    }

    private static List<String> split(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
