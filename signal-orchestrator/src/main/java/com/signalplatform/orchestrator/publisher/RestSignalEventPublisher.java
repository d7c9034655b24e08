package com.signalplatform.orchestrator.publisher;

import com.signalplatform.common.model.Signal;
import com.signalplatform.common.publisher.SignalEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST implementation of {@link SignalEventPublisher}: POSTs the signal to
 * notification-service and never waits for the result.
 */
@Component
public class RestSignalEventPublisher implements SignalEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestSignalEventPublisher.class);

    private final WebClient notificationClient;

    public RestSignalEventPublisher(WebClient notificationClient) {
        this.notificationClient = notificationClient;
    }

    @Override
    public void publish(Signal signal) {
        notificationClient.post()
            .uri("/api/v1/notify/signal")
            .header("X-Trace-Id", signal.traceId())
            .bodyValue(signal)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Signal event published. traceId={} decision={} status={}",
                                signal.traceId(), signal.decision(), r.getStatusCode()),
                err -> log.warn("Signal event publish failed (non-critical). traceId={} reason={}",
                                signal.traceId(), err.getMessage())
            );
    }
}
