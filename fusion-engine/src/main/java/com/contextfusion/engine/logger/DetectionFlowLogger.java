package com.contextfusion.engine.logger;

import com.contextfusion.common.trace.ObservationScope;
import com.contextfusion.engine.burst.BurstListener;
import com.contextfusion.engine.burst.BurstStatus;
import com.contextfusion.engine.session.DownloadSession;
import com.contextfusion.engine.session.SessionListener;
import com.contextfusion.engine.window.WindowCandidate;
import com.contextfusion.engine.window.WindowTrackerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability for the observation pipeline and the component events behind it.
 *
 * <p>Pipeline stages (in order):
 * <ol>
 *   <li>{@link #OBSERVATION_RECEIVED} file accepted by the REST surface</li>
 *   <li>{@link #BURST_RECORDED} burst detector updated</li>
 *   <li>{@link #CONTEXT_DETECTED} fusion engine returned a result</li>
 *   <li>{@link #SESSION_UPDATED} file recorded in the active session</li>
 * </ol>
 *
 * <p>Also registered as burst, window and session listener so lifecycle events show up in the
 * same log stream. Contains no business logic.
 */
@Component
public class DetectionFlowLogger implements BurstListener, WindowTrackerListener, SessionListener {

    private static final Logger log = LoggerFactory.getLogger(DetectionFlowLogger.class);

    public static final String OBSERVATION_RECEIVED = "OBSERVATION_RECEIVED";
    public static final String BURST_RECORDED       = "BURST_RECORDED";
    public static final String CONTEXT_DETECTED     = "CONTEXT_DETECTED";
    public static final String SESSION_UPDATED      = "SESSION_UPDATED";

    /**
     * Returns a {@code doOnEach} consumer logging {@code stageName} on {@code onNext}, for the
     * {@link ObservationScope} found in the Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            stage(stageName, ObservationScope.from(signal.getContextView()));
        };
    }

    public void stage(String stageName, ObservationScope scope) {
        scope.logging(() ->
            log.info("[DetectionFlow] stage={} observationId={} file={}",
                     stageName, scope.observationId(), scope.fileName())
        );
    }

    // ── component events ──────────────────────────────────────────────────

    @Override
    public void onBurstStarted(BurstStatus status) {
        log.info("[DetectionFlow] event=BURST_STARTED files={} start={}", status.fileCount(), status.burstStartTime());
    }

    @Override
    public void onBurstEnded(BurstStatus status) {
        log.info("[DetectionFlow] event=BURST_ENDED files={} durationSeconds={}", status.fileCount(), status.durationSeconds());
    }

    @Override
    public void onWindowDetected(WindowCandidate window) {
        log.debug("[DetectionFlow] event=WINDOW_DETECTED id={} group={}", window.id(), window.extractedGroupName());
    }

    @Override
    public void onWindowActivated(WindowCandidate window) {
        log.info("[DetectionFlow] event=WINDOW_ACTIVATED id={} group={}", window.id(), window.extractedGroupName());
    }

    @Override
    public void onWindowRemoved(WindowCandidate window) {
        log.debug("[DetectionFlow] event=WINDOW_REMOVED id={} group={}", window.id(), window.extractedGroupName());
    }

    @Override
    public void onSessionStarted(DownloadSession session) {
        log.info("[DetectionFlow] event=SESSION_STARTED session={} group={}", session.getId(), session.getGroupName());
    }

    @Override
    public void onSessionEnded(DownloadSession session) {
        log.info("[DetectionFlow] event=SESSION_ENDED session={} group={} files={}",
                 session.getId(), session.getGroupName(), session.getFileCount());
    }

    @Override
    public void onSessionTimedOut(DownloadSession session) {
        log.info("[DetectionFlow] event=SESSION_TIMED_OUT session={} group={}", session.getId(), session.getGroupName());
    }
}
