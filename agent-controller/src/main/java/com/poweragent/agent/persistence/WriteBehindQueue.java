package com.poweragent.agent.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Serialises store writes in submission order without making the caller wait.
 *
 * <p>Each submitted write runs after the previous one completes. A failed write is logged
 * and skipped; it never stops the queue.
 */
public class WriteBehindQueue {

    private static final Logger log = LoggerFactory.getLogger(WriteBehindQueue.class);

    private final Sinks.Many<Supplier<Mono<Void>>> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable subscription;

    public WriteBehindQueue() {
        this.subscription = sink.asFlux()
            .concatMap(write -> Mono.defer(write)
                .onErrorResume(e -> {
                    log.warn("[Store] Write-behind operation failed (non-fatal)", e);
                    return Mono.empty();
                }))
            .subscribe();
    }

    public void submit(Supplier<Mono<Void>> write) {
        sink.emitNext(write, Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1)));
    }

    /**
     * Blocks until every write submitted before this call has finished, or the timeout
     * passes. Only for startup and shutdown.
     */
    public void flush(Duration timeout) {
        Sinks.Empty<Void> done = Sinks.empty();
        submit(() -> Mono.fromRunnable(done::tryEmitEmpty));
        try {
            done.asMono().block(timeout);
        } catch (IllegalStateException e) {
            log.warn("[Store] Write-behind flush timed out after {}ms", timeout.toMillis());
        }
    }

    public void close() {
        subscription.dispose();
    }
}
