package com.contextfusion.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Identity of one observed file while it moves through burst tracking, detection and session
 * recording.
 *
 * <p>The scope rides in the Reactor Context keyed by its own class, so any operator of the
 * pipeline can recover which file it is working on. MDC receives {@code observationId} and
 * {@code fileName} only while a log statement runs inside {@link #logging}.
 */
public record ObservationScope(String observationId, String fileName, Instant observedAt) {

    public static final String OBSERVATION_ID_MDC = "observationId";
    public static final String FILE_NAME_MDC      = "fileName";

    private static final ObservationScope DETACHED = new ObservationScope("unknown", null, null);

    public ObservationScope {
        Objects.requireNonNull(observationId, "observationId");
    }

    /**
     * Opens the scope of a newly observed file. A missing or blank {@code requestedId} is
     * replaced by a random UUID.
     */
    public static ObservationScope open(String requestedId, String fileName, Instant observedAt) {
        String id = requestedId == null || requestedId.isBlank() ? UUID.randomUUID().toString() : requestedId.trim();
        return new ObservationScope(id, fileName, observedAt);
    }

    /** Scope stored in {@code ctx}; a detached scope with id {@code "unknown"} when there is none. */
    public static ObservationScope from(ContextView ctx) {
        return ctx.getOrDefault(ObservationScope.class, DETACHED);
    }

    public boolean isDetached() {
        return fileName == null && observedAt == null && "unknown".equals(observationId);
    }

    /** Stores this scope in the Context of {@code pipeline}; apply at the end of assembly. */
    public <T> Mono<T> attachTo(Mono<T> pipeline) {
        return pipeline.contextWrite(ctx -> ctx.put(ObservationScope.class, this));
    }

    /** Time since the file was observed; zero for a detached scope or a future timestamp. */
    public Duration lag(Instant now) {
        if (observedAt == null || now.isBefore(observedAt)) {
            return Duration.ZERO;
        }
        return Duration.between(observedAt, now);
    }

    /** Runs {@code logAction} with this observation's keys in MDC, removing them afterwards. */
    public void logging(Runnable logAction) {
        try (MDC.MDCCloseable id = MDC.putCloseable(OBSERVATION_ID_MDC, observationId)) {
            if (fileName == null) {
                logAction.run();
                return;
            }
            try (MDC.MDCCloseable file = MDC.putCloseable(FILE_NAME_MDC, fileName)) {
                logAction.run();
            }
        }
    }
}
