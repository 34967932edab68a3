package com.contextfusion.engine.scheduler;

import com.contextfusion.engine.session.DownloadSessionManager;
import com.contextfusion.engine.window.BackgroundWindowTracker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Periodic upkeep of the fusion components.
 *
 * <p>Three independent loops, each a fresh {@link Mono} per cycle that reschedules itself when
 * it terminates:
 * <pre>
 *   window scan    every scanIntervalMs          (only with autoScan)
 *   session sweep  every sweepIntervalSeconds    end idle sessions
 *   window expiry  every expirySweepSeconds      drop windows unseen for expirySeconds
 * </pre>
 * A failing cycle is logged and the loop continues with the same interval.
 */
@Component
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final BackgroundWindowTracker windowTracker;
    private final DownloadSessionManager sessionManager;

    @Value("${maintenance.enabled:true}")
    private boolean enabled;

    @Value("${window.auto-scan:true}")
    private boolean autoScan;

    @Value("${window.scan-interval-ms:2000}")
    private long scanIntervalMs;

    @Value("${window.expiry-seconds:300}")
    private int windowExpirySeconds;

    @Value("${window.expiry-sweep-seconds:60}")
    private int windowExpirySweepSeconds;

    @Value("${session.sweep-interval-seconds:5}")
    private int sweepIntervalSeconds;

    private volatile boolean running;

    public MaintenanceScheduler(BackgroundWindowTracker windowTracker, DownloadSessionManager sessionManager) {
        this.windowTracker  = windowTracker;
        this.sessionManager = sessionManager;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        windowTracker.start();
        sessionManager.initialize().subscribe();
        if (!enabled) {
            log.info("Maintenance loops disabled.");
            return;
        }
        running = true;
        log.info("Maintenance loops started. autoScan={} scanIntervalMs={} sweepIntervalSeconds={} windowExpirySeconds={}",
                 autoScan, scanIntervalMs, sweepIntervalSeconds, windowExpirySeconds);

        if (autoScan) {
            scheduleNext("window-scan", Duration.ofMillis(scanIntervalMs),
                () -> Mono.fromRunnable(windowTracker::scan));
        }
        scheduleNext("session-sweep", Duration.ofSeconds(sweepIntervalSeconds),
            () -> sessionManager.sweepTimedOut()
                .doOnNext(ended -> {
                    if (ended > 0) log.info("Session sweep ended={}", ended);
                }));
        scheduleNext("window-expiry", Duration.ofSeconds(windowExpirySweepSeconds),
            () -> Mono.fromRunnable(() -> windowTracker.evictExpired(windowExpirySeconds)));
    }

    @PreDestroy
    public void stop() {
        running = false;
        windowTracker.stop();
    }

    public boolean isAutoScan() {
        return autoScan;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Runs {@code cycle} after {@code interval}, then reschedules itself regardless of outcome.
     */
    private void scheduleNext(String loop, Duration interval, Supplier<Mono<?>> cycle) {
        if (!running) {
            log.info("Maintenance loop stopped. loop={}", loop);
            return;
        }
        Mono.delay(interval)
            .then(Mono.defer(cycle))
            .subscribe(
                ignored -> {},
                err -> {
                    log.error("Maintenance cycle failed. loop={}, rescheduling", loop, err);
                    scheduleNext(loop, interval, cycle);
                },
                () -> scheduleNext(loop, interval, cycle)
            );
    }
}
