package com.signalplatform.orchestrator.judge;

import com.signalplatform.common.exception.JudgeException;
import com.signalplatform.common.model.AnalysisContext;
import com.signalplatform.common.model.FailureKind;
import com.signalplatform.common.model.JudgeOpinion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Fans one analysis context out to every configured judge concurrently.
 *
 * <p>Contract:
 * <ul>
 *   <li>The context is rendered once; every judge receives the identical prompt.</li>
 *   <li>Each call is bounded by the same timeout. A judge that overruns is cancelled and
 *       recorded as {@link FailureKind#TIMEOUT}; the others are unaffected.</li>
 *   <li>Failures become failed {@link JudgeOpinion}s. The returned Mono never errors.</li>
 *   <li>Opinions come back in configured judge order, regardless of completion order.</li>
 *   <li>No retries.</li>
 * </ul>
 */
public class JudgePool {

    private static final Logger log = LoggerFactory.getLogger(JudgePool.class);

    private final List<Judge> judges;
    private final AnalysisPromptBuilder promptBuilder;
    private final JudgeResponseParser parser;
    private final Duration timeout;

    public JudgePool(List<Judge> judges, AnalysisPromptBuilder promptBuilder,
                     JudgeResponseParser parser, Duration timeout) {
        if (judges == null || judges.isEmpty()) {
            throw new IllegalStateException("At least one judge must be configured");
        }
        Set<String> ids = new HashSet<>();
        for (Judge judge : judges) {
            if (judge.id() == null || judge.id().isBlank()) {
                throw new IllegalStateException("Judge id must not be blank");
            }
            if (!ids.add(judge.id())) {
                throw new IllegalStateException("Duplicate judge id: " + judge.id());
            }
        }
        this.judges        = List.copyOf(judges);
        this.promptBuilder = promptBuilder;
        this.parser        = parser;
        this.timeout       = timeout;
    }

    public List<String> judgeIds() {
        return judges.stream().map(Judge::id).toList();
    }

    public Mono<List<JudgeOpinion>> consult(AnalysisContext context) {
        return Mono.fromCallable(() -> promptBuilder.render(context))
            .flatMap(prompt -> Flux.fromIterable(judges)
                .flatMapSequential(judge -> invoke(judge, prompt, context.instrument()))
                .collectList())
            .doOnNext(opinions -> log.info("[JudgePool] Judges completed. instrument={} succeeded={}/{}",
                context.instrument(), opinions.stream().filter(JudgeOpinion::succeeded).count(), opinions.size()));
    }

    private Mono<JudgeOpinion> invoke(Judge judge, String prompt, String instrument) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return Mono.defer(() -> judge.evaluate(prompt))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .map(text -> parser.parse(judge.id(), text).withLatency(elapsedMs(start)))
                .switchIfEmpty(Mono.error(new JudgeException(judge.id(), FailureKind.TRANSPORT, "Empty reply")))
                .doOnSuccess(o -> log.info("[JudgePool] judge={} decision={} confidence={} latencyMs={} instrument={}",
                                           judge.id(), o.decision(), o.confidence(), o.latencyMs(), instrument))
                .onErrorResume(e -> {
                    FailureKind kind = classify(e);
                    long latency = elapsedMs(start);
                    log.warn("[JudgePool] judge={} failed. kind={} latencyMs={} instrument={} reason={}",
                             judge.id(), kind, latency, instrument, e.getMessage());
                    return Mono.just(JudgeOpinion.failed(judge.id(), kind, describe(e, kind), latency));
                });
        });
    }

    static FailureKind classify(Throwable e) {
        if (e instanceof TimeoutException) return FailureKind.TIMEOUT;
        if (e instanceof JudgeException je) return je.getFailureKind();
        return FailureKind.TRANSPORT;
    }

    private String describe(Throwable e, FailureKind kind) {
        if (kind == FailureKind.TIMEOUT) return "No reply within " + timeout.toMillis() + "ms";
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
