package com.signalplatform.orchestrator.pipeline;

import com.signalplatform.common.calibration.PerformanceFilter;
import com.signalplatform.common.calibration.ThresholdsRegistry;
import com.signalplatform.common.confluence.ConfluenceAggregator;
import com.signalplatform.common.consensus.ConsensusResolver;
import com.signalplatform.common.exception.InsufficientDataException;
import com.signalplatform.common.gate.PreTradeGate;
import com.signalplatform.common.model.AdaptiveThresholds;
import com.signalplatform.common.model.AnalysisContext;
import com.signalplatform.common.model.ConfluenceResult;
import com.signalplatform.common.model.ConsensusDecision;
import com.signalplatform.common.model.IndicatorSnapshot;
import com.signalplatform.common.model.RiskLevel;
import com.signalplatform.common.model.Signal;
import com.signalplatform.common.model.Timeframe;
import com.signalplatform.common.model.TradeDecision;
import com.signalplatform.common.model.ValidationResult;
import com.signalplatform.common.provider.IndicatorSnapshotProvider;
import com.signalplatform.common.provider.MicrostructureProvider;
import com.signalplatform.common.provider.SignalHistoryProvider;
import com.signalplatform.common.publisher.SignalEventPublisher;
import com.signalplatform.common.trace.TraceContextUtil;
import com.signalplatform.orchestrator.calibration.AdaptiveCalibrator;
import com.signalplatform.orchestrator.judge.JudgePool;
import com.signalplatform.orchestrator.logger.DecisionFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Produces one {@link Signal} per request by running, strictly in order:
 * <pre>
 *   thresholds snapshot
 *     → indicator snapshots (per configured timeframe, unavailable ones skipped)
 *     → confluence          (insufficient confluence short-circuits to NO_TRADE)
 *     → judge pool          (concurrent, per-judge timeout)
 *     → consensus
 *     → performance filter  (recent back-test accuracy)
 *     → pre-trade gate      (always evaluated once judges ran, recorded for audit)
 *     → signal
 * </pre>
 *
 * <p><strong>Never errors.</strong> Every rejection, insufficient-data condition or
 * unexpected failure becomes a NO_TRADE signal whose rationale says why.
 *
 * <p><strong>Single flight.</strong> Requests for an (instrument, timeframe) already in
 * flight join the running invocation instead of starting another one.
 *
 * <p>The thresholds snapshot is taken once at the start; a calibration publishing
 * mid-invocation affects only later invocations.
 */
@Service
public class SignalDecisionPipeline {

    private static final Logger log = LoggerFactory.getLogger(SignalDecisionPipeline.class);

    private final IndicatorSnapshotProvider snapshotProvider;
    private final MicrostructureProvider microstructureProvider;
    private final ConfluenceAggregator confluenceAggregator;
    private final JudgePool judgePool;
    private final ConsensusResolver consensusResolver;
    private final PreTradeGate preTradeGate;
    private final ThresholdsRegistry thresholdsRegistry;
    private final AdaptiveCalibrator calibrator;
    private final SignalEventPublisher eventPublisher;
    private final SignalHistoryProvider historyProvider;
    private final DecisionFlowLogger decisionFlowLogger;
    private final PipelineSettings settings;
    private final Clock clock;

    private final SingleFlightGuard<SignalKey, Signal> singleFlight = new SingleFlightGuard<>();

    public SignalDecisionPipeline(IndicatorSnapshotProvider snapshotProvider,
                                  MicrostructureProvider microstructureProvider,
                                  ConfluenceAggregator confluenceAggregator,
                                  JudgePool judgePool,
                                  ConsensusResolver consensusResolver,
                                  PreTradeGate preTradeGate,
                                  ThresholdsRegistry thresholdsRegistry,
                                  AdaptiveCalibrator calibrator,
                                  SignalEventPublisher eventPublisher,
                                  SignalHistoryProvider historyProvider,
                                  DecisionFlowLogger decisionFlowLogger,
                                  PipelineSettings settings,
                                  Clock clock) {
        this.snapshotProvider       = snapshotProvider;
        this.microstructureProvider = microstructureProvider;
        this.confluenceAggregator   = confluenceAggregator;
        this.judgePool              = judgePool;
        this.consensusResolver      = consensusResolver;
        this.preTradeGate           = preTradeGate;
        this.thresholdsRegistry     = thresholdsRegistry;
        this.calibrator             = calibrator;
        this.eventPublisher         = eventPublisher;
        this.historyProvider        = historyProvider;
        this.decisionFlowLogger     = decisionFlowLogger;
        this.settings               = settings;
        this.clock                  = clock;
    }

    /**
     * @param analysisWindow candles the indicator collaborator should compute over;
     *                       non-positive values fall back to the configured default
     * @return a signal, never an error
     */
    public Mono<Signal> generateSignal(String instrument, Timeframe timeframe, int analysisWindow) {
        int window = analysisWindow > 0 ? analysisWindow : settings.defaultAnalysisWindow();
        return singleFlight.execute(new SignalKey(instrument, timeframe), () -> {
            String traceId = TraceContextUtil.newTraceId();
            return TraceContextUtil.withTraceId(run(instrument, timeframe, window, traceId), traceId);
        });
    }

    public boolean isInFlight(String instrument, Timeframe timeframe) {
        return singleFlight.isInFlight(new SignalKey(instrument, timeframe));
    }

    // ── pipeline ──────────────────────────────────────────────────────────────

    private Mono<Signal> run(String instrument, Timeframe timeframe, int window, String traceId) {
        AdaptiveThresholds thresholds = thresholdsRegistry.current();
        Instant startedAt = clock.instant();
        decisionFlowLogger.logWithTraceId(DecisionFlowLogger.TRIGGER_RECEIVED, traceId, instrument);

        Invocation inv = new Invocation(instrument, timeframe, window, traceId, thresholds, startedAt);

        return fetchSnapshots(instrument, window)
            .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.SNAPSHOTS_FETCHED))
            .flatMap(snapshots -> decide(inv, snapshots))
            .onErrorResume(InsufficientDataException.class, e -> {
                log.info("[Pipeline] Insufficient data. instrument={} timeframe={} reason={} traceId={}",
                         instrument, timeframe.label(), e.getMessage(), traceId);
                return Mono.just(noTrade(inv, null, null, null, List.of(e.getMessage())));
            })
            .onErrorResume(e -> {
                log.error("[Pipeline] Unexpected failure, emitting NO_TRADE. instrument={} timeframe={} traceId={}",
                          instrument, timeframe.label(), traceId, e);
                return Mono.just(noTrade(inv, null, null, null, List.of("Pipeline error: " + e.getMessage())));
            })
            .doOnNext(this::dispatch);
    }

    private Mono<Map<Timeframe, IndicatorSnapshot>> fetchSnapshots(String instrument, int window) {
        return Flux.fromIterable(confluenceAggregator.timeframes().timeframes())
            .flatMap(tf -> snapshotProvider.getIndicatorSnapshot(instrument, tf, window)
                .map(snapshot -> Map.entry(tf, snapshot))
                .onErrorResume(e -> {
                    log.warn("[Pipeline] Snapshot fetch failed, timeframe skipped. instrument={} timeframe={} reason={}",
                             instrument, tf.label(), e.getMessage());
                    return Mono.empty();
                }))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private Mono<Signal> decide(Invocation inv, Map<Timeframe, IndicatorSnapshot> snapshots) {
        ConfluenceResult confluence = confluenceAggregator.evaluate(snapshots);
        decisionFlowLogger.logConfluence(confluence, inv.traceId());

        if (!confluence.sufficient()) {
            return Mono.just(noTrade(inv, confluence, null, null, List.of(confluence.explanation())));
        }

        AnalysisContext context = new AnalysisContext(inv.instrument(), inv.timeframe(), inv.window(),
                                                      snapshots, confluence, inv.startedAt());
        return judgePool.consult(context)
            .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.JUDGES_COMPLETED))
            .map(opinions -> consensusResolver.resolve(opinions, inv.thresholds()))
            .doOnNext(consensus -> decisionFlowLogger.logConsensus(consensus, inv.thresholds().version(), inv.traceId()))
            .flatMap(consensus -> validate(inv)
                .map(validation -> assemble(inv, confluence, consensus, validation)));
    }

    private Mono<ValidationResult> validate(Invocation inv) {
        return microstructureProvider.getMicrostructureSnapshot(inv.instrument())
            .map(preTradeGate::validate)
            .onErrorResume(e -> {
                log.warn("[Pipeline] Microstructure fetch failed. instrument={} reason={} traceId={}",
                         inv.instrument(), e.getMessage(), inv.traceId());
                return Mono.empty();
            })
            .defaultIfEmpty(ValidationResult.rejected("Microstructure unavailable"))
            .doOnNext(validation -> decisionFlowLogger.logGate(validation, inv.instrument(), inv.traceId()));
    }

    private Signal assemble(Invocation inv, ConfluenceResult confluence, ConsensusDecision consensus,
                            ValidationResult validation) {
        List<String> rationale = new ArrayList<>();
        rationale.add(confluence.explanation());
        rationale.add(consensus.reason());

        if (!consensus.isActionable()) {
            addGateLines(rationale, validation);
            return buildSignal(inv, TradeDecision.NO_TRADE, consensus.confidence(), RiskLevel.HIGH,
                               null, null, confluence, consensus, validation, rationale);
        }

        if (settings.performanceFilterEnabled()) {
            Optional<String> filtered = PerformanceFilter.check(calibrator.latestMetrics(),
                                                                consensus.decision(), consensus.confidence());
            if (filtered.isPresent()) {
                rationale.add(filtered.get());
                addGateLines(rationale, validation);
                return noTrade(inv, confluence, consensus, validation, rationale);
            }
        }

        if (!validation.overallValid()) {
            rationale.add("Rejected by pre-trade gate: " + validation.reason());
            rationale.addAll(validation.warnings());
            return noTrade(inv, confluence, consensus, validation, rationale);
        }

        addGateLines(rationale, validation);
        return buildSignal(inv, consensus.decision(), consensus.confidence(), consensus.riskLevel(),
                           consensus.stopLoss(), consensus.takeProfit(),
                           confluence, consensus, validation, rationale);
    }

    // ── signal construction ───────────────────────────────────────────────────

    private Signal noTrade(Invocation inv, ConfluenceResult confluence, ConsensusDecision consensus,
                           ValidationResult validation, List<String> rationale) {
        return buildSignal(inv, TradeDecision.NO_TRADE, 0.0, RiskLevel.HIGH, null, null,
                           confluence, consensus, validation, rationale);
    }

    private Signal buildSignal(Invocation inv, TradeDecision decision, double confidence, RiskLevel risk,
                               Double stopLoss, Double takeProfit, ConfluenceResult confluence,
                               ConsensusDecision consensus, ValidationResult validation, List<String> rationale) {
        Instant now = clock.instant();
        return new Signal(UUID.randomUUID().toString(), inv.traceId(), now, inv.instrument(), inv.timeframe(),
                          decision, confidence, risk, stopLoss, takeProfit, confluence, consensus, validation,
                          inv.thresholds().version(), rationale, now.plus(settings.signalValidity()));
    }

    private static void addGateLines(List<String> rationale, ValidationResult validation) {
        rationale.add("Pre-trade gate: " + validation.reason());
        rationale.addAll(validation.warnings());
    }

    private void dispatch(Signal signal) {
        decisionFlowLogger.logSignal(signal);
        historyProvider.record(signal);
        if (!signal.isNoTrade()) {
            eventPublisher.publish(signal);
        }
    }

    private record SignalKey(String instrument, Timeframe timeframe) {}

    private record Invocation(String instrument, Timeframe timeframe, int window, String traceId,
                              AdaptiveThresholds thresholds, Instant startedAt) {}

    /**
     * @param signalValidity           how long an emitted signal stays actionable
     * @param defaultAnalysisWindow    candles requested when the caller gives none
     * @param performanceFilterEnabled suppress signals while recent accuracy is poor
     */
    public record PipelineSettings(Duration signalValidity, int defaultAnalysisWindow,
                                   boolean performanceFilterEnabled) {}
}
