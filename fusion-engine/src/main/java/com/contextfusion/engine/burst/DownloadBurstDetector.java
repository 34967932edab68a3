package com.contextfusion.engine.burst;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

/**
 * Detects rapid sequences of downloads that likely originate from the same source.
 *
 * <p>Events are kept in a time-ordered deque. On every {@link #record}:
 * <pre>
 *   evict events older than burstThreshold (relative to the new event)
 *   → force-end a burst that has spanned more than maxBurstDuration
 *   → append the event
 *   → count ≥ minimumFiles ? start/continue : end
 * </pre>
 * Listeners are notified after the lock is released.
 */
public class DownloadBurstDetector {

    private static final Logger log = LoggerFactory.getLogger(DownloadBurstDetector.class);

    public static final int DEFAULT_BURST_THRESHOLD_SECONDS     = 5;
    public static final int DEFAULT_MINIMUM_FILES_FOR_BURST     = 2;
    public static final int DEFAULT_MAX_BURST_DURATION_SECONDS  = 60;

    private record BurstEvent(String fileName, Instant time) {}

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<BurstEvent> events = new ArrayDeque<>();
    private final List<BurstListener> listeners = new CopyOnWriteArrayList<>();

    private volatile int burstThresholdSeconds   = DEFAULT_BURST_THRESHOLD_SECONDS;
    private volatile int minimumFilesForBurst    = DEFAULT_MINIMUM_FILES_FOR_BURST;
    private volatile int maxBurstDurationSeconds = DEFAULT_MAX_BURST_DURATION_SECONDS;

    private boolean active;
    private Instant burstStart;

    public void addListener(BurstListener listener) {
        listeners.add(listener);
    }

    /**
     * Records a completed download at {@code time} and updates the burst state.
     */
    public void record(String fileName, Instant time) {
        List<Notification> notifications = new ArrayList<>(2);
        lock.lock();
        try {
            evictBefore(time);

            if (active && Duration.between(burstStart, time).toMillis() > maxBurstDurationSeconds * 1000L) {
                BurstStatus ended = snapshot();
                events.clear();
                active = false;
                burstStart = null;
                log.info("[Burst] force-ended spanSeconds>{} files={}", maxBurstDurationSeconds, ended.fileCount());
                notifications.add(new Notification(BurstListener::onBurstEnded, ended));
            }

            events.addLast(new BurstEvent(fileName, time));

            if (events.size() >= minimumFilesForBurst) {
                if (!active) {
                    active = true;
                    burstStart = events.peekFirst().time();
                    log.info("[Burst] started files={} start={}", events.size(), burstStart);
                    notifications.add(new Notification(BurstListener::onBurstStarted, snapshot()));
                } else {
                    log.debug("[Burst] continued files={} file={}", events.size(), fileName);
                    notifications.add(new Notification(BurstListener::onBurstContinued, snapshot()));
                }
            } else if (active) {
                BurstStatus ended = snapshot();
                active = false;
                burstStart = null;
                log.info("[Burst] ended files={}", ended.fileCount());
                notifications.add(new Notification(BurstListener::onBurstEnded, ended));
            }
        } finally {
            lock.unlock();
        }
        notifications.forEach(this::fire);
    }

    /**
     * Non-mutating check: would a download at {@code time} be part of a burst?
     * True when at least {@code minimumFilesForBurst - 1} retained events lie within the
     * threshold of {@code time} and the newest of them is within the threshold too.
     */
    public boolean isBurst(String fileName, Instant time) {
        lock.lock();
        try {
            BurstEvent newest = events.peekLast();
            if (newest == null || !withinThreshold(newest.time(), time)) {
                return false;
            }
            long recent = events.stream().filter(e -> withinThreshold(e.time(), time)).count();
            return recent >= minimumFilesForBurst - 1;
        } finally {
            lock.unlock();
        }
    }

    public BurstStatus status() {
        lock.lock();
        try {
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /** Seconds left before the active burst's gap window closes; empty without an active burst. */
    public OptionalDouble remaining(Instant now) {
        lock.lock();
        try {
            if (!active || events.isEmpty()) {
                return OptionalDouble.empty();
            }
            Instant closesAt = events.peekLast().time().plusSeconds(burstThresholdSeconds);
            double seconds = Duration.between(now, closesAt).toMillis() / 1000.0;
            return OptionalDouble.of(Math.max(0.0, seconds));
        } finally {
            lock.unlock();
        }
    }

    public int currentCount() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        BurstStatus ended = null;
        lock.lock();
        try {
            if (active) {
                ended = snapshot();
            }
            events.clear();
            active = false;
            burstStart = null;
        } finally {
            lock.unlock();
        }
        log.info("[Burst] reset");
        if (ended != null) {
            fire(new Notification(BurstListener::onBurstEnded, ended));
        }
    }

    // ── configuration ─────────────────────────────────────────────────────

    public int getBurstThresholdSeconds() {
        return burstThresholdSeconds;
    }

    public void setBurstThresholdSeconds(int seconds) {
        if (seconds < 1 || seconds > 60) {
            log.warn("[Burst] rejected burstThresholdSeconds={} allowed=1..60 keeping={}", seconds, burstThresholdSeconds);
            return;
        }
        burstThresholdSeconds = seconds;
    }

    public int getMinimumFilesForBurst() {
        return minimumFilesForBurst;
    }

    public void setMinimumFilesForBurst(int files) {
        if (files < 2 || files > 100) {
            log.warn("[Burst] rejected minimumFilesForBurst={} allowed=2..100 keeping={}", files, minimumFilesForBurst);
            return;
        }
        minimumFilesForBurst = files;
    }

    public int getMaxBurstDurationSeconds() {
        return maxBurstDurationSeconds;
    }

    public void setMaxBurstDurationSeconds(int seconds) {
        if (seconds < 5 || seconds > 3600) {
            log.warn("[Burst] rejected maxBurstDurationSeconds={} allowed=5..3600 keeping={}", seconds, maxBurstDurationSeconds);
            return;
        }
        maxBurstDurationSeconds = seconds;
    }

    // ── internals (caller holds the lock) ─────────────────────────────────

    private void evictBefore(Instant time) {
        while (!events.isEmpty() && !withinThreshold(events.peekFirst().time(), time)) {
            events.pollFirst();
        }
    }

    private boolean withinThreshold(Instant eventTime, Instant reference) {
        return Duration.between(eventTime, reference).toMillis() <= burstThresholdSeconds * 1000L;
    }

    private BurstStatus snapshot() {
        List<String> names = new ArrayList<>(events.size());
        events.forEach(e -> names.add(e.fileName()));
        BurstEvent first = events.peekFirst();
        BurstEvent last  = events.peekLast();
        return new BurstStatus(active, events.size(), burstStart,
                               first == null ? null : first.time(),
                               last == null ? null : last.time(),
                               names);
    }

    private record Notification(BiConsumer<BurstListener, BurstStatus> callback, BurstStatus status) {}

    private void fire(Notification notification) {
        for (BurstListener listener : listeners) {
            try {
                notification.callback().accept(listener, notification.status());
            } catch (RuntimeException e) {
                log.warn("[Burst] listener failed listener={}", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
