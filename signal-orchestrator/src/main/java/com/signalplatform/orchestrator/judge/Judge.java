package com.signalplatform.orchestrator.judge;

import reactor.core.publisher.Mono;

/**
 * One independent AI model consulted by the {@link JudgePool}.
 *
 * <p>Implementations return the model's raw reply text. Timeouts, parsing and failure
 * classification belong to the pool, so a judge only has to be non-blocking and to
 * signal transport problems as errors.
 */
public interface Judge {

    /** Stable identifier, unique within the pool. */
    String id();

    Mono<String> evaluate(String prompt);
}
