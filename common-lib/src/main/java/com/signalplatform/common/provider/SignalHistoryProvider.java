package com.signalplatform.common.provider;

import com.signalplatform.common.model.DateRange;
import com.signalplatform.common.model.HistoricalSignal;
import com.signalplatform.common.model.PerformanceMetrics;
import com.signalplatform.common.model.Signal;
import reactor.core.publisher.Flux;

/**
 * Persistence boundary for emitted signals and their realized outcomes.
 *
 * <p>Reads feed the calibrator. The two {@code record} methods are fire-and-forget:
 * implementations must not block and must not propagate failures to the caller.
 */
public interface SignalHistoryProvider {

    Flux<HistoricalSignal> getHistoricalSignalsAndOutcomes(DateRange range);

    void record(Signal signal);

    void recordMetrics(PerformanceMetrics metrics);
}
