package com.signalplatform.orchestrator.pipeline;

import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * At most one in-flight execution per key. A caller arriving while the key is busy
 * subscribes to the running execution and receives the same result; no second run starts.
 * The key is released when the execution terminates.
 */
public class SingleFlightGuard<K, V> {

    private final Map<K, Mono<V>> inFlight = new ConcurrentHashMap<>();

    public Mono<V> execute(K key, Supplier<Mono<V>> work) {
        return Mono.defer(() -> inFlight.computeIfAbsent(key, k -> {
            AtomicReference<Mono<V>> self = new AtomicReference<>();
            Mono<V> shared = Mono.defer(work)
                .doFinally(signal -> inFlight.remove(k, self.get()))
                .cache();
            self.set(shared);
            return shared;
        }));
    }

    public boolean isInFlight(K key) {
        return inFlight.containsKey(key);
    }
}
