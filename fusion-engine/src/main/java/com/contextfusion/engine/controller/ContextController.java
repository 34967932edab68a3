package com.contextfusion.engine.controller;

import com.contextfusion.common.exception.ContextFusionException;
import com.contextfusion.common.model.DetectionResult;
import com.contextfusion.engine.burst.BurstStatus;
import com.contextfusion.engine.burst.DownloadBurstDetector;
import com.contextfusion.engine.dto.FeedbackRequest;
import com.contextfusion.engine.dto.FileObservationRequest;
import com.contextfusion.engine.dto.ObservationOutcome;
import com.contextfusion.engine.dto.SessionStatistics;
import com.contextfusion.engine.dto.WindowSnapshotRequest;
import com.contextfusion.engine.fusion.ContextFusionEngine;
import com.contextfusion.engine.fusion.FusionStatistics;
import com.contextfusion.engine.provider.ReportedWindowState;
import com.contextfusion.engine.scheduler.MaintenanceScheduler;
import com.contextfusion.engine.service.ObservationService;
import com.contextfusion.engine.session.DownloadSession;
import com.contextfusion.engine.session.DownloadSessionManager;
import com.contextfusion.engine.session.GroupActivity;
import com.contextfusion.engine.session.SessionFile;
import com.contextfusion.engine.window.BackgroundWindowTracker;
import com.contextfusion.engine.window.WindowCandidate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/context")
public class ContextController {

    private static final int MAX_SESSION_PAGE = 1000;

    private final ObservationService observationService;
    private final ContextFusionEngine fusionEngine;
    private final DownloadBurstDetector burstDetector;
    private final BackgroundWindowTracker windowTracker;
    private final DownloadSessionManager sessionManager;
    private final ReportedWindowState windowState;
    private final MaintenanceScheduler maintenanceScheduler;

    public ContextController(ObservationService observationService,
                             ContextFusionEngine fusionEngine,
                             DownloadBurstDetector burstDetector,
                             BackgroundWindowTracker windowTracker,
                             DownloadSessionManager sessionManager,
                             ReportedWindowState windowState,
                             MaintenanceScheduler maintenanceScheduler) {
        this.observationService   = observationService;
        this.fusionEngine         = fusionEngine;
        this.burstDetector        = burstDetector;
        this.windowTracker        = windowTracker;
        this.sessionManager       = sessionManager;
        this.windowState          = windowState;
        this.maintenanceScheduler = maintenanceScheduler;
    }

    @PostMapping("/observations")
    public Mono<ResponseEntity<ObservationOutcome>> observe(
            @RequestBody FileObservationRequest request,
            @RequestHeader(value = "X-Observation-Id", required = false) String observationIdHeader) {
        if (request.fileName() == null || request.fileName().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "fileName must not be blank"));
        }
        if (request.fileSize() != null && request.fileSize() < 0) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "fileSize must not be negative"));
        }
        return observationService.observe(request, observationIdHeader).map(ResponseEntity::ok);
    }

    /**
     * Replaces the window snapshot served to the foreground and enumeration ports. Without
     * auto-scan the tracker is refreshed immediately.
     */
    @PostMapping("/windows")
    public ResponseEntity<List<WindowCandidate>> reportWindows(@RequestBody WindowSnapshotRequest request) {
        windowState.update(request.foregroundTitle(), request.foregroundProcess(), request.windows());
        if (!maintenanceScheduler.isAutoScan()) {
            windowTracker.scan();
        }
        return ResponseEntity.ok(windowTracker.all());
    }

    @PostMapping("/feedback")
    public Mono<ResponseEntity<Void>> feedback(@RequestBody FeedbackRequest request) {
        if (request.fileName() == null || request.fileName().isBlank()
                || request.detectedContext() == null || request.detectedContext().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "fileName and detectedContext must not be blank"));
        }
        return fusionEngine.recordFeedback(request.fileName(), request.detectedContext(),
                                           request.actualContext(), request.wasCorrect())
            .thenReturn(ResponseEntity.accepted().<Void>build());
    }

    @GetMapping("/statistics")
    public ResponseEntity<FusionStatistics> statistics() {
        return ResponseEntity.ok(fusionEngine.statistics());
    }

    @DeleteMapping("/statistics")
    public ResponseEntity<Void> resetStatistics() {
        fusionEngine.resetStatistics();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/last-result")
    public ResponseEntity<DetectionResult> lastResult() {
        return fusionEngine.lastResult()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/burst")
    public ResponseEntity<BurstStatus> burst() {
        return ResponseEntity.ok(burstDetector.status());
    }

    @GetMapping("/windows")
    public ResponseEntity<List<WindowCandidate>> windows() {
        return ResponseEntity.ok(windowTracker.all());
    }

    @GetMapping("/sessions/active")
    public Mono<ResponseEntity<DownloadSession>> activeSession() {
        return sessionManager.active()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.noContent().build());
    }

    @GetMapping("/sessions")
    public Flux<DownloadSession> sessions(
            @RequestParam(value = "limit", defaultValue = "10") int limit,
            @RequestParam(value = "includeActive", defaultValue = "true") boolean includeActive) {
        if (limit < 1 || limit > MAX_SESSION_PAGE) {
            return Flux.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "limit must be between 1 and " + MAX_SESSION_PAGE));
        }
        return sessionManager.recent(limit, includeActive);
    }

    @GetMapping("/sessions/statistics")
    public Mono<SessionStatistics> sessionStatistics() {
        return Mono.zip(sessionManager.totalSessions(),
                        sessionManager.averageFilesPerSession(),
                        sessionManager.mostActiveGroup().defaultIfEmpty(new GroupActivity(null, 0)))
            .map(t -> new SessionStatistics(t.getT1(), t.getT2(), t.getT3().groupName(),
                                            t.getT3().sessionCount(), sessionManager.defaultTimeout()));
    }

    @GetMapping("/sessions/{id}/files")
    public Flux<SessionFile> sessionFiles(@PathVariable("id") String id) {
        return sessionManager.files(id);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(ContextFusionException.class)
    public ResponseEntity<Map<String, String>> handleFusionFailure(ContextFusionException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(Map.of("component", e.getComponent(), "error", e.getMessage()));
    }
}
