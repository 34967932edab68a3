package com.contextfusion.engine.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Applies session store writes one at a time, in submission order.
 *
 * <p>{@link DownloadSessionManager} submits while holding its transition lock, so the store sees
 * writes in the same order the in-memory transitions happened: an insert always lands before the
 * update that ends the same session. A failed write is reported to its submitter only; the queue
 * keeps draining.
 */
class SessionWriteQueue {

    private static final Logger log = LoggerFactory.getLogger(SessionWriteQueue.class);

    private final Sinks.Many<Mono<Void>> pending = Sinks.many().unicast().onBackpressureBuffer();

    SessionWriteQueue() {
        pending.asFlux()
            .concatMap(write -> write)
            .subscribe(ignored -> {}, e -> log.error("[Session] write queue stopped", e));
    }

    /**
     * Queues {@code write}; the returned {@link Mono} replays its outcome once it has run.
     * {@code write} must be cold: it is subscribed when its turn comes.
     */
    synchronized <T> Mono<T> submit(Mono<T> write) {
        Sinks.One<T> outcome = Sinks.one();
        Mono<Void> task = write
            .doOnSuccess(value -> {
                if (value == null) {
                    outcome.tryEmitEmpty();
                } else {
                    outcome.tryEmitValue(value);
                }
            })
            .doOnError(outcome::tryEmitError)
            .onErrorResume(e -> Mono.empty())
            .then();

        Sinks.EmitResult emitted = pending.tryEmitNext(task);
        if (emitted.isFailure()) {
            return Mono.error(new IllegalStateException("Session write rejected: " + emitted));
        }
        return outcome.asMono();
    }
}
