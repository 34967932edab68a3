package com.contextfusion.engine.window;

import com.contextfusion.common.model.ContextSignal;
import com.contextfusion.common.model.WindowInfo;
import com.contextfusion.common.text.GroupNameExtractor;
import com.contextfusion.engine.provider.WindowEnumerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;

/**
 * Bounded cache of recently seen source-application windows.
 *
 * <p>Each {@link #scan()} merges the enumerator's current list into the cache: known windows
 * are refreshed, new ones inserted, and the entry with the oldest {@code lastSeen} is evicted
 * while the cache exceeds {@code maxTrackedWindows}. Focused windows carry confidence
 * {@value #FOCUSED_CONFIDENCE}, the rest {@value #UNFOCUSED_CONFIDENCE}.
 *
 * <p>The tracker does not schedule itself; {@code MaintenanceScheduler} drives periodic scans.
 * {@link #start()} and {@link #stop()} only toggle whether the tracker feeds the Background signal.
 */
public class BackgroundWindowTracker {

    private static final Logger log = LoggerFactory.getLogger(BackgroundWindowTracker.class);

    public static final double FOCUSED_CONFIDENCE   = 1.0;
    public static final double UNFOCUSED_CONFIDENCE = 0.7;
    public static final int    DEFAULT_MAX_TRACKED_WINDOWS = 20;
    public static final int    DEFAULT_RECENT_SECONDS      = 60;

    private static final class TrackedWindow {
        final String id;
        final Instant firstSeen;
        String title;
        String processName;
        boolean active;
        Instant lastSeen;
        double confidenceScore;
        int seenCount;
        String groupName;

        TrackedWindow(String id, Instant firstSeen) {
            this.id = id;
            this.firstSeen = firstSeen;
        }

        WindowCandidate snapshot() {
            return new WindowCandidate(id, title, processName, active, firstSeen, lastSeen,
                                       confidenceScore, seenCount, groupName);
        }
    }

    private final WindowEnumerator enumerator;
    private final Clock clock;
    private final String applicationName;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, TrackedWindow> windows = new LinkedHashMap<>();
    private final List<WindowTrackerListener> listeners = new CopyOnWriteArrayList<>();

    private volatile boolean monitoring;
    private volatile int maxTrackedWindows = DEFAULT_MAX_TRACKED_WINDOWS;

    public BackgroundWindowTracker(WindowEnumerator enumerator, Clock clock, String applicationName) {
        this.enumerator      = Objects.requireNonNull(enumerator, "enumerator");
        this.clock           = Objects.requireNonNull(clock, "clock");
        this.applicationName = Objects.requireNonNull(applicationName, "applicationName");
    }

    public void addListener(WindowTrackerListener listener) {
        listeners.add(listener);
    }

    public void start() {
        if (!monitoring) {
            monitoring = true;
            log.info("[Window] monitoring started maxTracked={}", maxTrackedWindows);
        }
    }

    public void stop() {
        if (monitoring) {
            monitoring = false;
            log.info("[Window] monitoring stopped tracked={}", trackedCount());
        }
    }

    public boolean isMonitoring() {
        return monitoring;
    }

    /**
     * Pulls the current window list and merges it into the cache. Enumeration failures are
     * logged and leave the cache untouched.
     */
    public void scan() {
        List<WindowInfo> current;
        try {
            current = enumerator.currentWindows();
        } catch (RuntimeException e) {
            log.error("[Window] enumeration failed", e);
            return;
        }
        if (current == null) {
            return;
        }

        Instant now = clock.instant();
        List<Event> events = new ArrayList<>();
        lock.lock();
        try {
            for (WindowInfo info : current) {
                if (info == null || info.id() == null) continue;
                TrackedWindow tracked = windows.get(info.id());
                if (tracked != null) {
                    boolean wasActive = tracked.active;
                    refresh(tracked, info, now);
                    tracked.seenCount++;
                    if (!wasActive && tracked.active) {
                        events.add(new Event(WindowTrackerListener::onWindowActivated, tracked.snapshot()));
                    }
                } else {
                    tracked = new TrackedWindow(info.id(), now);
                    refresh(tracked, info, now);
                    tracked.seenCount = 1;
                    windows.put(info.id(), tracked);
                    events.add(new Event(WindowTrackerListener::onWindowDetected, tracked.snapshot()));
                }
            }
            while (windows.size() > maxTrackedWindows) {
                TrackedWindow oldest = windows.values().stream()
                    .min(Comparator.comparing(w -> w.lastSeen))
                    .orElseThrow();
                windows.remove(oldest.id);
                events.add(new Event(WindowTrackerListener::onWindowRemoved, oldest.snapshot()));
            }
        } finally {
            lock.unlock();
        }
        log.debug("[Window] scan windows={} tracked={} events={}", current.size(), trackedCount(), events.size());
        events.forEach(this::fire);
    }

    /** All tracked windows, most recently seen first. */
    public List<WindowCandidate> all() {
        lock.lock();
        try {
            return windows.values().stream()
                .sorted(Comparator.comparing((TrackedWindow w) -> w.lastSeen).reversed())
                .map(TrackedWindow::snapshot)
                .toList();
        } finally {
            lock.unlock();
        }
    }

    public Optional<WindowCandidate> mostRecent() {
        return all().stream().findFirst();
    }

    public List<WindowCandidate> recent(int withinSeconds) {
        Instant cutoff = clock.instant().minusSeconds(withinSeconds);
        return all().stream().filter(w -> !w.lastSeen().isBefore(cutoff)).toList();
    }

    public Optional<WindowCandidate> byId(String id) {
        lock.lock();
        try {
            TrackedWindow tracked = windows.get(id);
            return tracked == null ? Optional.empty() : Optional.of(tracked.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public Optional<GroupCandidate> bestRecentGroupName() {
        return bestRecentGroupName(DEFAULT_RECENT_SECONDS);
    }

    /**
     * Highest-confidence named window seen within {@code withinSeconds}, ties broken by the most
     * recent {@code lastSeen}. Names come from the last scan's titles; windows without one never
     * qualify.
     */
    public Optional<GroupCandidate> bestRecentGroupName(int withinSeconds) {
        return recent(withinSeconds).stream()
            .filter(w -> hasName(w.extractedGroupName()))
            .max(Comparator.comparingDouble(WindowCandidate::confidenceScore)
                           .thenComparing(WindowCandidate::lastSeen))
            .map(w -> new GroupCandidate(w.extractedGroupName(), w.confidenceScore(), w.lastSeen()));
    }

    /**
     * Removes every window not seen for {@code timeoutSeconds}.
     *
     * @return number of windows removed
     */
    public int evictExpired(int timeoutSeconds) {
        Instant cutoff = clock.instant().minusSeconds(timeoutSeconds);
        List<WindowCandidate> removed = new ArrayList<>();
        lock.lock();
        try {
            windows.values().removeIf(w -> {
                if (w.lastSeen.isBefore(cutoff)) {
                    removed.add(w.snapshot());
                    return true;
                }
                return false;
            });
        } finally {
            lock.unlock();
        }
        if (!removed.isEmpty()) {
            log.info("[Window] evicted expired={} timeoutSeconds={}", removed.size(), timeoutSeconds);
        }
        removed.forEach(w -> fire(new Event(WindowTrackerListener::onWindowRemoved, w)));
        return removed.size();
    }

    public int trackedCount() {
        lock.lock();
        try {
            return windows.size();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxTrackedWindows() {
        return maxTrackedWindows;
    }

    public void setMaxTrackedWindows(int max) {
        if (max < 1 || max > 500) {
            log.warn("[Window] rejected maxTrackedWindows={} allowed=1..500 keeping={}", max, maxTrackedWindows);
            return;
        }
        maxTrackedWindows = max;
    }

    // ── internals ─────────────────────────────────────────────────────────

    private void refresh(TrackedWindow tracked, WindowInfo info, Instant now) {
        tracked.title           = info.title();
        tracked.processName     = info.processName();
        tracked.active          = info.activeFocus();
        tracked.lastSeen        = now;
        tracked.confidenceScore = info.activeFocus() ? FOCUSED_CONFIDENCE : UNFOCUSED_CONFIDENCE;
        tracked.groupName       = GroupNameExtractor.extract(info.title(), applicationName);
    }

    private static boolean hasName(String name) {
        return name != null && !name.isBlank() && !ContextSignal.UNSORTED.equals(name);
    }

    private record Event(BiConsumer<WindowTrackerListener, WindowCandidate> callback, WindowCandidate window) {}

    private void fire(Event event) {
        for (WindowTrackerListener listener : listeners) {
            try {
                event.callback().accept(listener, event.window());
            } catch (RuntimeException e) {
                log.warn("[Window] listener failed listener={}", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
