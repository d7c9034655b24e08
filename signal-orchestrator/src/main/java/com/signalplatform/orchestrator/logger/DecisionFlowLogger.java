package com.signalplatform.orchestrator.logger;

import com.signalplatform.common.model.ConfluenceResult;
import com.signalplatform.common.model.ConsensusDecision;
import com.signalplatform.common.model.Signal;
import com.signalplatform.common.model.ValidationResult;
import com.signalplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.Consumer;

/**
 * Stage-by-stage log trail of one signal decision. Side effects only; never alters
 * the pipeline.
 *
 * <p>Stages in order:
 * <ol>
 *   <li>{@link #TRIGGER_RECEIVED}: scheduler or API asked for a signal</li>
 *   <li>{@link #SNAPSHOTS_FETCHED}: indicator snapshots collected</li>
 *   <li>{@link #CONFLUENCE_SCORED}: per-timeframe biases aggregated</li>
 *   <li>{@link #JUDGES_COMPLETED}: every judge answered, failed or timed out</li>
 *   <li>{@link #CONSENSUS_RESOLVED}: opinions reduced to one decision</li>
 *   <li>{@link #GATE_EVALUATED}: pre-trade filters ran</li>
 *   <li>{@link #SIGNAL_EMITTED}: signal built and dispatched</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.SNAPSHOTS_FETCHED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String TRIGGER_RECEIVED   = "TRIGGER_RECEIVED";
    public static final String SNAPSHOTS_FETCHED  = "SNAPSHOTS_FETCHED";
    public static final String CONFLUENCE_SCORED  = "CONFLUENCE_SCORED";
    public static final String JUDGES_COMPLETED   = "JUDGES_COMPLETED";
    public static final String CONSENSUS_RESOLVED = "CONSENSUS_RESOLVED";
    public static final String GATE_EVALUATED     = "GATE_EVALUATED";
    public static final String SIGNAL_EMITTED     = "SIGNAL_EMITTED";

    /**
     * {@code doOnEach} consumer logging {@code stageName} on every onNext. Reads the traceId
     * from the Reactor Context, not from MDC.
     */
    public <T> Consumer<reactor.core.publisher.Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId, String instrument) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} instrument={} traceId={}", stageName, instrument, traceId)
        );
    }

    public void logConfluence(ConfluenceResult confluence, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} direction={} confidence={} agreeing={}/{} sufficient={} traceId={}",
                     CONFLUENCE_SCORED, confluence.direction(), pct(confluence.confidence() * 100.0),
                     confluence.agreeingTimeframes(), confluence.analyzedTimeframes(),
                     confluence.sufficient(), traceId)
        );
    }

    public void logConsensus(ConsensusDecision consensus, long thresholdsVersion, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} decision={} confidence={} source={} reached={} thresholdsVersion={} traceId={}",
                     CONSENSUS_RESOLVED, consensus.decision(), pct(consensus.confidence()),
                     consensus.source().label(), consensus.consensusReached(), thresholdsVersion, traceId)
        );
    }

    public void logGate(ValidationResult validation, String instrument, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} instrument={} valid={} score={} failed={} warnings={} traceId={}",
                     GATE_EVALUATED, instrument, validation.overallValid(),
                     String.format(Locale.ROOT, "%.2f", validation.aggregateScore()),
                     validation.failedFilters(), validation.warnings().size(), traceId)
        );
    }

    public void logSignal(Signal signal) {
        TraceContextUtil.withMdc(signal.traceId(), () ->
            log.info("[DecisionFlow] stage={} signalId={} instrument={} timeframe={} decision={} confidence={} traceId={}",
                     SIGNAL_EMITTED, signal.signalId(), signal.instrument(), signal.timeframe().label(),
                     signal.decision(), pct(signal.confidence()), signal.traceId())
        );
    }

    private static String pct(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
