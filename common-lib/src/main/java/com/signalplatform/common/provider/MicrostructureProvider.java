package com.signalplatform.common.provider;

import com.signalplatform.common.model.MicrostructureSnapshot;
import reactor.core.publisher.Mono;

public interface MicrostructureProvider {

    /** Recent raw candles for the gate; errors are treated as a failed gate, never as a pass. */
    Mono<MicrostructureSnapshot> getMicrostructureSnapshot(String instrument);
}
