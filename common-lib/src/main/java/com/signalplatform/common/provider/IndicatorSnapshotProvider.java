package com.signalplatform.common.provider;

import com.signalplatform.common.model.IndicatorSnapshot;
import com.signalplatform.common.model.Timeframe;
import reactor.core.publisher.Mono;

/**
 * Source of precomputed indicator snapshots. Implementations must be non-blocking;
 * an error or empty result means "this timeframe is unavailable" to the pipeline.
 */
public interface IndicatorSnapshotProvider {

    Mono<IndicatorSnapshot> getIndicatorSnapshot(String instrument, Timeframe timeframe, int analysisWindow);
}
