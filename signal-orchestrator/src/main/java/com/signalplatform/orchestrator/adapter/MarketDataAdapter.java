package com.signalplatform.orchestrator.adapter;

import com.signalplatform.common.model.IndicatorSnapshot;
import com.signalplatform.common.model.MicrostructureSnapshot;
import com.signalplatform.common.model.Timeframe;
import com.signalplatform.common.provider.IndicatorSnapshotProvider;
import com.signalplatform.common.provider.MicrostructureProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Reads indicator and microstructure snapshots from market-data-service.
 *
 * <p>Any failure is logged and mapped to an empty Mono. The pipeline reads "empty" as
 * "unavailable": the timeframe is skipped, or the gate rejects the trade.
 */
@Component
public class MarketDataAdapter implements IndicatorSnapshotProvider, MicrostructureProvider {

    private static final Logger log = LoggerFactory.getLogger(MarketDataAdapter.class);

    private final WebClient marketDataClient;

    public MarketDataAdapter(WebClient marketDataClient) {
        this.marketDataClient = marketDataClient;
    }

    @Override
    public Mono<IndicatorSnapshot> getIndicatorSnapshot(String instrument, Timeframe timeframe, int analysisWindow) {
        return marketDataClient.get()
            .uri(uri -> uri.path("/api/v1/indicators/{instrument}")
                .queryParam("timeframe", timeframe.label())
                .queryParam("window", analysisWindow)
                .build(instrument))
            .retrieve()
            .bodyToMono(IndicatorSnapshot.class)
            .doOnNext(s -> log.debug("Indicator snapshot fetched. instrument={} timeframe={} candles={}",
                                     instrument, timeframe.label(), s.candleCount()))
            .onErrorResume(e -> {
                log.warn("Indicator snapshot unavailable, timeframe skipped. instrument={} timeframe={} reason={}",
                         instrument, timeframe.label(), e.getMessage());
                return Mono.empty();
            });
    }

    @Override
    public Mono<MicrostructureSnapshot> getMicrostructureSnapshot(String instrument) {
        return marketDataClient.get()
            .uri("/api/v1/microstructure/{instrument}", instrument)
            .retrieve()
            .bodyToMono(MicrostructureSnapshot.class)
            .doOnNext(s -> log.debug("Microstructure fetched. instrument={} candles={}",
                                     instrument, s.candles().size()))
            .onErrorResume(e -> {
                log.warn("Microstructure unavailable. instrument={} reason={}", instrument, e.getMessage());
                return Mono.empty();
            });
    }
}
