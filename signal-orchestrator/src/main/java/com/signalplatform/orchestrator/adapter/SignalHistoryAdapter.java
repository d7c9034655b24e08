package com.signalplatform.orchestrator.adapter;

import com.signalplatform.common.model.DateRange;
import com.signalplatform.common.model.HistoricalSignal;
import com.signalplatform.common.model.PerformanceMetrics;
import com.signalplatform.common.model.Signal;
import com.signalplatform.common.provider.SignalHistoryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

/**
 * history-service client. Reads propagate errors so the calibrator can decide to keep
 * the previous thresholds; writes are fire-and-forget.
 */
@Component
public class SignalHistoryAdapter implements SignalHistoryProvider {

    private static final Logger log = LoggerFactory.getLogger(SignalHistoryAdapter.class);

    private final WebClient historyClient;

    public SignalHistoryAdapter(WebClient historyClient) {
        this.historyClient = historyClient;
    }

    @Override
    public Flux<HistoricalSignal> getHistoricalSignalsAndOutcomes(DateRange range) {
        return historyClient.get()
            .uri(uri -> uri.path("/api/v1/history/signals/outcomes")
                .queryParam("from", range.from().toString())
                .queryParam("to", range.to().toString())
                .build())
            .retrieve()
            .bodyToFlux(HistoricalSignal.class);
    }

    @Override
    public void record(Signal signal) {
        historyClient.post()
            .uri("/api/v1/history/signals")
            .header("X-Trace-Id", signal.traceId())
            .bodyValue(signal)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Signal recorded. signalId={} traceId={} status={}",
                                signal.signalId(), signal.traceId(), r.getStatusCode()),
                err -> log.warn("Signal history save failed (non-critical). signalId={} traceId={} reason={}",
                                signal.signalId(), signal.traceId(), err.getMessage())
            );
    }

    @Override
    public void recordMetrics(PerformanceMetrics metrics) {
        historyClient.post()
            .uri("/api/v1/history/calibration")
            .bodyValue(metrics)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Calibration metrics recorded. status={} accuracy={}",
                                metrics.status(), metrics.accuracy()),
                err -> log.warn("Calibration metrics save failed (non-critical). reason={}", err.getMessage())
            );
    }
}
