package com.signalplatform.common.publisher;

import com.signalplatform.common.model.Signal;

/**
 * Publishes emitted {@link Signal}s to downstream consumers.
 *
 * <p>Current implementation: {@code RestSignalEventPublisher}, a fire-and-forget POST to
 * notification-service. Implementations MUST be non-blocking; no {@code .block()}.
 */
public interface SignalEventPublisher {

    void publish(Signal signal);
}
