package com.contextfusion.engine.service;

import com.contextfusion.common.exception.ContextFusionException;
import com.contextfusion.common.model.ContextSignal;
import com.contextfusion.common.trace.ObservationScope;
import com.contextfusion.engine.burst.DownloadBurstDetector;
import com.contextfusion.engine.dto.FileObservationRequest;
import com.contextfusion.engine.dto.ObservationOutcome;
import com.contextfusion.engine.fusion.ContextFusionEngine;
import com.contextfusion.engine.logger.DetectionFlowLogger;
import com.contextfusion.engine.session.DownloadSessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Runs one observed file through the burst detector, the fusion engine and the session manager,
 * in that order.
 *
 * <p>The burst check happens before the file is recorded, so the first file of a burst reports
 * {@code burst=false}. Unsorted files are never added to a session.
 */
@Service
public class ObservationService {

    private static final Logger log = LoggerFactory.getLogger(ObservationService.class);

    private final DownloadBurstDetector burstDetector;
    private final ContextFusionEngine fusionEngine;
    private final DownloadSessionManager sessionManager;
    private final DetectionFlowLogger flowLogger;
    private final Clock clock;

    public ObservationService(DownloadBurstDetector burstDetector,
                              ContextFusionEngine fusionEngine,
                              DownloadSessionManager sessionManager,
                              DetectionFlowLogger flowLogger,
                              Clock clock) {
        this.burstDetector  = burstDetector;
        this.fusionEngine   = fusionEngine;
        this.sessionManager = sessionManager;
        this.flowLogger     = flowLogger;
        this.clock          = clock;
    }

    /**
     * Observes {@code request.fileName()}. A blank {@code requestedObservationId} gets a generated
     * id, which the outcome reports back.
     */
    public Mono<ObservationOutcome> observe(FileObservationRequest request, String requestedObservationId) {
        return Mono.defer(() -> {
            Instant observedAt = request.observedAt() != null ? request.observedAt() : clock.instant();
            ObservationScope scope = ObservationScope.open(requestedObservationId, request.fileName(), observedAt);
            return scope.attachTo(run(request, scope)
                .doOnError(e -> scope.logging(() ->
                    log.error("Observation failed. file={} observationId={}", scope.fileName(), scope.observationId(), e))));
        });
    }

    private Mono<ObservationOutcome> run(FileObservationRequest request, ObservationScope scope) {
        String fileName = scope.fileName();
        Instant observedAt = scope.observedAt();
        flowLogger.stage(DetectionFlowLogger.OBSERVATION_RECEIVED, scope);

        boolean burst = burstDetector.isBurst(fileName, observedAt);
        burstDetector.record(fileName, observedAt);
        int burstFiles = burstDetector.currentCount();
        flowLogger.stage(DetectionFlowLogger.BURST_RECORDED, scope);

        return fusionEngine.detectWithDetails(fileName, observedAt)
            .doOnEach(flowLogger.stage(DetectionFlowLogger.CONTEXT_DETECTED))
            .flatMap(result -> {
                if (ContextSignal.UNSORTED.equals(result.detectedContext())) {
                    return Mono.just(ObservationOutcome.of(scope, result, burst, burstFiles, null));
                }
                long size = request.fileSize() == null ? 0L : request.fileSize();
                return sessionManager.addFile(fileName, result.detectedContext(), request.filePath(), size,
                                              result.overallConfidence())
                    .doOnEach(flowLogger.stage(DetectionFlowLogger.SESSION_UPDATED))
                    .map(session -> ObservationOutcome.of(scope, result, burst, burstFiles, session.getId()))
                    .onErrorMap(e -> !(e instanceof ContextFusionException),
                                e -> new ContextFusionException("Session",
                                    "Failed to record " + fileName + " in session for " + result.detectedContext(), e));
            })
            .doOnNext(outcome -> scope.logging(() ->
                log.debug("[Observation] done context={} lagMs={}",
                          outcome.detectedContext(), scope.lag(clock.instant()).toMillis())));
    }
}
