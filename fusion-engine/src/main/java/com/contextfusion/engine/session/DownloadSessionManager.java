package com.contextfusion.engine.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns the single active download session.
 *
 * <p>The current-session pointer lives in memory and every transition (routing to a group, ending
 * the previous session, appending a file) is computed under one lock, which keeps "at most one
 * active session" true for concurrent callers. The transition's writes are queued for the
 * {@link SessionStore} before the lock is released, so the store applies them in transition
 * order. Callers only ever receive copies.
 *
 * <p>Store failures on reads degrade to empty/zero with an error log; failures on writes
 * propagate to the caller of {@link #start} and {@link #addFile}.
 */
public class DownloadSessionManager {

    private static final Logger log = LoggerFactory.getLogger(DownloadSessionManager.class);

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final int MIN_TIMEOUT_SECONDS     = 5;
    public static final int MAX_TIMEOUT_SECONDS     = 300;

    private final SessionStore store;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private final SessionWriteQueue writes = new SessionWriteQueue();

    private record Transition(DownloadSession ended, boolean created, DownloadSession session, SessionFile file) {}

    // guarded by lock
    private DownloadSession current;
    private final Set<String> currentFiles = new HashSet<>();
    private volatile int defaultTimeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

    public DownloadSessionManager(SessionStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    /**
     * Adopts the most recently started active session left in the store and closes any other
     * active rows.
     */
    public Mono<Void> initialize() {
        return store.findActive()
            .collectList()
            .flatMap(active -> {
                if (active.isEmpty()) {
                    log.info("[Session] initialized activeSession=none");
                    return Mono.<Void>empty();
                }
                DownloadSession adopted = active.get(0);
                Mono<Void> loadFiles = store.findFiles(adopted.getId())
                    .collectList()
                    .doOnNext(files -> {
                        lock.lock();
                        try {
                            current = adopted.copy();
                            currentFiles.clear();
                            files.forEach(f -> currentFiles.add(f.getFileName()));
                        } finally {
                            lock.unlock();
                        }
                        log.info("[Session] initialized adopted={} group={} files={}",
                                 adopted.getId(), adopted.getGroupName(), adopted.getFileCount());
                    })
                    .then();
                LocalDateTime now = now();
                Mono<Void> closeExtras = Flux.fromIterable(active.subList(1, active.size()))
                    .flatMap(extra -> {
                        extra.setActive(false);
                        extra.setEndTime(now);
                        log.warn("[Session] closing extra active session={} group={}", extra.getId(), extra.getGroupName());
                        return writes.submit(store.update(extra));
                    })
                    .then();
                return loadFiles.then(closeExtras);
            })
            .onErrorResume(e -> {
                log.error("[Session] initialization failed, starting without an active session", e);
                return Mono.empty();
            });
    }

    // ── lifecycle ─────────────────────────────────────────────────────────

    public Mono<DownloadSession> start(String groupName) {
        return start(groupName, null, null, 1.0);
    }

    /**
     * Starts a session for {@code groupName}. An active session for the same group is reused
     * (its last activity refreshed); an active session for another group is ended first.
     */
    public Mono<DownloadSession> start(String groupName, String windowTitle, String processName, double confidence) {
        return apply(groupName, windowTitle, processName, confidence, null, null, 0L);
    }

    public Mono<DownloadSession> addFile(String fileName, String groupName, String filePath, long fileSize) {
        return addFile(fileName, groupName, filePath, fileSize, 1.0);
    }

    /**
     * Adds {@code fileName} to the active session when it belongs to {@code groupName};
     * otherwise ends that session and starts one for {@code groupName}. Routing and the append
     * are one transition, so a concurrent call for another group cannot strand the file.
     * Duplicate names are ignored.
     *
     * @param confidence score given to a session started by this call
     */
    public Mono<DownloadSession> addFile(String fileName, String groupName, String filePath,
                                         long fileSize, double confidence) {
        Objects.requireNonNull(fileName, "fileName");
        return apply(groupName, null, null, confidence, fileName, filePath, fileSize);
    }

    public Mono<Void> endCurrent() {
        return Mono.defer(() -> {
            DownloadSession ended;
            Mono<DownloadSession> write;
            lock.lock();
            try {
                ended = closeCurrentLocked(now());
                write = ended == null ? Mono.empty() : writes.submit(store.update(ended));
            } finally {
                lock.unlock();
            }
            return write.doOnSuccess(s -> announceEnded(ended)).then();
        });
    }

    /**
     * Ends the session with {@code sessionId}, whether it is the in-memory current session or a
     * stale active row in the store.
     */
    public Mono<Void> end(String sessionId) {
        return Mono.defer(() -> {
            DownloadSession ended = null;
            Mono<DownloadSession> write = null;
            lock.lock();
            try {
                if (current != null && current.getId().equals(sessionId)) {
                    ended = closeCurrentLocked(now());
                    write = writes.submit(store.update(ended));
                }
            } finally {
                lock.unlock();
            }
            if (write != null) {
                DownloadSession closed = ended;
                return write.doOnSuccess(s -> announceEnded(closed)).then();
            }
            return store.findById(sessionId)
                .filter(DownloadSession::isActive)
                .flatMap(stale -> {
                    stale.setActive(false);
                    stale.setEndTime(now());
                    return writes.submit(store.update(stale)).doOnSuccess(s -> announceEnded(stale));
                })
                .then();
        });
    }

    /**
     * Ends the active session if it has been idle longer than its timeout.
     *
     * @return number of sessions ended
     */
    public Mono<Integer> sweepTimedOut() {
        return Mono.defer(() -> {
            LocalDateTime now = now();
            DownloadSession timedOut = null;
            Mono<DownloadSession> write = null;
            lock.lock();
            try {
                if (current != null && current.hasTimedOut(now)) {
                    timedOut = closeCurrentLocked(now);
                    write = writes.submit(store.update(timedOut));
                }
            } finally {
                lock.unlock();
            }
            if (write == null) {
                return Mono.just(0);
            }
            DownloadSession s = timedOut;
            log.info("[Session] timed out session={} group={} files={}", s.getId(), s.getGroupName(), s.getFileCount());
            fire(l -> l.onSessionTimedOut(s));
            return write.doOnSuccess(ignored -> announceEnded(s)).thenReturn(1);
        });
    }

    // ── queries ───────────────────────────────────────────────────────────

    /** Copy of the active session, if any. */
    public Optional<DownloadSession> current() {
        lock.lock();
        try {
            return current == null ? Optional.empty() : Optional.of(current.copy());
        } finally {
            lock.unlock();
        }
    }

    public Mono<DownloadSession> active() {
        return Mono.fromSupplier(() -> current().orElse(null));
    }

    public boolean isActive() {
        return current().isPresent();
    }

    public Optional<String> currentGroupName() {
        return current().map(DownloadSession::getGroupName);
    }

    /** Seconds before the active session times out; empty without an active session. */
    public OptionalDouble timeoutRemaining() {
        Optional<DownloadSession> session = current();
        if (session.isEmpty()) {
            return OptionalDouble.empty();
        }
        double idle = Duration.between(session.get().getLastActivity(), now()).toMillis() / 1000.0;
        return OptionalDouble.of(Math.max(0.0, session.get().getTimeoutSeconds() - idle));
    }

    public Flux<DownloadSession> recent(int limit, boolean includeActive) {
        return store.findRecent(limit, includeActive)
            .onErrorResume(e -> {
                log.error("[Session] failed to read recent sessions limit={}", limit, e);
                return Flux.empty();
            });
    }

    public Mono<DownloadSession> byId(String id) {
        return store.findById(id)
            .onErrorResume(e -> {
                log.error("[Session] failed to read session id={}", id, e);
                return Mono.empty();
            });
    }

    public Flux<SessionFile> files(String sessionId) {
        return store.findFiles(sessionId)
            .onErrorResume(e -> {
                log.error("[Session] failed to read files session={}", sessionId, e);
                return Flux.empty();
            });
    }

    public Mono<Long> totalSessions() {
        return store.countAll()
            .onErrorResume(e -> {
                log.error("[Session] failed to count sessions", e);
                return Mono.just(0L);
            });
    }

    public Mono<Double> averageFilesPerSession() {
        return store.averageFileCount()
            .onErrorResume(e -> {
                log.error("[Session] failed to compute average files per session", e);
                return Mono.just(0.0);
            });
    }

    public Mono<GroupActivity> mostActiveGroup() {
        return store.mostActiveGroup()
            .onErrorResume(e -> {
                log.error("[Session] failed to compute most active group", e);
                return Mono.empty();
            });
    }

    // ── configuration ─────────────────────────────────────────────────────

    public int defaultTimeout() {
        return defaultTimeoutSeconds;
    }

    public void setDefaultTimeout(int seconds) {
        if (seconds < MIN_TIMEOUT_SECONDS || seconds > MAX_TIMEOUT_SECONDS) {
            log.warn("[Session] rejected timeoutSeconds={} allowed={}..{} keeping={}",
                     seconds, MIN_TIMEOUT_SECONDS, MAX_TIMEOUT_SECONDS, defaultTimeoutSeconds);
            return;
        }
        defaultTimeoutSeconds = seconds;
    }

    // ── internals ─────────────────────────────────────────────────────────

    /**
     * One session transition, computed under the lock: route to {@code groupName} (reuse or
     * switch), then optionally append {@code fileName}. Writes are queued before the lock is
     * released; listeners fire once they succeeded.
     */
    private Mono<DownloadSession> apply(String groupName, String windowTitle, String processName, double confidence,
                                        String fileName, String filePath, long fileSize) {
        Objects.requireNonNull(groupName, "groupName");
        return Mono.defer(() -> {
            LocalDateTime now = now();
            Transition transition;
            Mono<DownloadSession> write;
            lock.lock();
            try {
                transition = transitionLocked(groupName, windowTitle, processName, confidence,
                                              fileName, filePath, fileSize, now);
                write = writes.submit(persist(transition));
            } finally {
                lock.unlock();
            }
            return write
                .doOnSuccess(s -> announce(transition, fileName))
                .doOnError(e -> {
                    if (transition.created()) {
                        rollback(transition.session().getId());
                    }
                    log.error("[Session] failed to record transition group={} file={}", groupName, fileName, e);
                });
        });
    }

    /** Caller holds the lock. */
    private Transition transitionLocked(String groupName, String windowTitle, String processName, double confidence,
                                        String fileName, String filePath, long fileSize, LocalDateTime now) {
        DownloadSession ended = null;
        boolean created = false;
        if (current == null || !current.getGroupName().equals(groupName)) {
            ended = closeCurrentLocked(now);
            current = newSession(groupName, windowTitle, processName, confidence, now);
            created = true;
        }
        SessionFile file = null;
        if (fileName != null && currentFiles.add(fileName)) {
            current.setFileCount(current.getFileCount() + 1);
            file = SessionFile.of(current.getId(), fileName, filePath, fileSize, now);
        }
        current.setLastActivity(now);
        return new Transition(ended, created, current.copy(), file);
    }

    /** Store writes of one transition; the session row precedes its file row. */
    private Mono<DownloadSession> persist(Transition t) {
        Mono<Void> endPrevious = t.ended() == null ? Mono.empty() : store.update(t.ended()).then();
        Mono<DownloadSession> saveSession = t.created() ? store.insert(t.session()) : store.update(t.session());
        Mono<Void> recordFile = t.file() == null ? Mono.empty() : store.addFile(t.file()).then();
        return endPrevious.then(saveSession).then(recordFile).thenReturn(t.session());
    }

    private void announce(Transition t, String fileName) {
        DownloadSession s = t.session();
        announceEnded(t.ended());
        if (t.created()) {
            log.info("[Session] started session={} group={} timeoutSeconds={} confidence={}",
                     s.getId(), s.getGroupName(), s.getTimeoutSeconds(), s.getConfidenceScore());
            fire(l -> l.onSessionStarted(s));
        } else if (fileName == null) {
            log.debug("[Session] reused session={} group={}", s.getId(), s.getGroupName());
        }
        if (t.file() != null) {
            log.debug("[Session] file added session={} file={} files={}", s.getId(), fileName, s.getFileCount());
            fire(l -> l.onFileAdded(s, fileName));
        } else if (fileName != null) {
            log.debug("[Session] duplicate file ignored session={} file={}", s.getId(), fileName);
        }
    }

    private void announceEnded(DownloadSession ended) {
        if (ended == null) {
            return;
        }
        log.info("[Session] ended session={} group={} files={}", ended.getId(), ended.getGroupName(), ended.getFileCount());
        fire(l -> l.onSessionEnded(ended));
    }

    private DownloadSession newSession(String groupName, String windowTitle, String processName,
                                       double confidence, LocalDateTime now) {
        DownloadSession session = new DownloadSession();
        session.setId(UUID.randomUUID().toString());
        session.setGroupName(groupName);
        session.setStartTime(now);
        session.setLastActivity(now);
        session.setTimeoutSeconds(defaultTimeoutSeconds);
        session.setConfidenceScore(Math.max(0.0, Math.min(1.0, confidence)));
        session.setFileCount(0);
        session.setActive(true);
        session.setWindowTitle(windowTitle);
        session.setProcessName(processName);
        return session;
    }

    /** Caller holds the lock. Returns a copy of the closed session, or {@code null}. */
    private DownloadSession closeCurrentLocked(LocalDateTime now) {
        if (current == null) {
            return null;
        }
        current.setActive(false);
        current.setEndTime(now);
        DownloadSession closed = current.copy();
        current = null;
        currentFiles.clear();
        return closed;
    }

    private void rollback(String sessionId) {
        lock.lock();
        try {
            if (current != null && current.getId().equals(sessionId)) {
                current = null;
                currentFiles.clear();
            }
        } finally {
            lock.unlock();
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private void fire(Consumer<SessionListener> callback) {
        for (SessionListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.warn("[Session] listener failed listener={}", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
