package com.contextfusion.engine.session;

import com.contextfusion.engine.support.InMemorySessionStore;
import com.contextfusion.engine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DownloadSessionManagerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private InMemorySessionStore store;
    private DownloadSessionManager manager;
    private final List<String> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemorySessionStore();
        manager = new DownloadSessionManager(store, clock);
        manager.addListener(new SessionListener() {
            @Override
            public void onSessionStarted(DownloadSession session) {
                events.add("started:" + session.getGroupName());
            }

            @Override
            public void onSessionEnded(DownloadSession session) {
                events.add("ended:" + session.getGroupName());
            }

            @Override
            public void onFileAdded(DownloadSession session, String fileName) {
                events.add("file:" + fileName);
            }

            @Override
            public void onSessionTimedOut(DownloadSession session) {
                events.add("timedOut:" + session.getGroupName());
            }
        });
    }

    // ── start() ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("start()")
    class StartTests {

        @Test
        @DisplayName("creates an active session with the default timeout")
        void creates() {
            DownloadSession session = manager.start("A").block();

            assertNotNull(session);
            assertTrue(session.isActive());
            assertEquals("A", session.getGroupName());
            assertEquals(30, session.getTimeoutSeconds());
            assertEquals(1.0, session.getConfidenceScore());
            assertTrue(store.stored(session.getId()).isActive());
            assertEquals(List.of("started:A"), events);
        }

        @Test
        @DisplayName("same group reuses the active session and refreshes lastActivity")
        void reusesSameGroup() {
            DownloadSession first = manager.start("A").block();
            clock.advanceSeconds(10);
            DownloadSession second = manager.start("A").block();

            assertEquals(first.getId(), second.getId());
            assertEquals(LocalDateTime.ofInstant(T0.plusSeconds(10), ZoneOffset.UTC), second.getLastActivity());
            assertEquals(List.of("started:A"), events);
        }

        @Test
        @DisplayName("different group ends the active session first, keeping one active")
        void switchesGroup() {
            DownloadSession a = manager.start("A").block();
            DownloadSession b = manager.start("B").block();

            assertNotEquals(a.getId(), b.getId());
            DownloadSession storedA = store.stored(a.getId());
            assertFalse(storedA.isActive());
            assertNotNull(storedA.getEndTime());
            assertEquals("B", manager.currentGroupName().orElseThrow());
            assertEquals(List.of("started:A", "ended:A", "started:B"), events);

            StepVerifier.create(store.findActive().count()).expectNext(1L).verifyComplete();
        }

        @Test
        @DisplayName("write failure propagates and leaves no active session")
        void writeFailure() {
            store.failWrites(true);

            StepVerifier.create(manager.start("A"))
                .expectError(IllegalStateException.class)
                .verify();

            assertFalse(manager.isActive());
        }
    }

    // ── addFile() ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("addFile()")
    class AddFileTests {

        @Test
        @DisplayName("starts a session when none is active and records the file")
        void startsWhenIdle() {
            DownloadSession session = manager.addFile("a.pdf", "A", "/dl/a.pdf", 100L, 0.8).block();

            assertEquals(1, session.getFileCount());
            assertEquals(0.8, session.getConfidenceScore(), 1e-9);
            assertEquals(1, store.storedFiles().size());
            assertEquals(session.getId(), store.storedFiles().get(0).getSessionId());
            assertEquals(List.of("started:A", "file:a.pdf"), events);
        }

        @Test
        @DisplayName("duplicate file names are ignored")
        void duplicatesIgnored() {
            manager.addFile("a.pdf", "A", null, 0L).block();
            DownloadSession session = manager.addFile("a.pdf", "A", null, 0L).block();

            assertEquals(1, session.getFileCount());
            assertEquals(1, store.storedFiles().size());
        }

        @Test
        @DisplayName("file for another group switches the session")
        void otherGroupSwitches() {
            DownloadSession a = manager.addFile("a.pdf", "A", null, 0L).block();
            DownloadSession b = manager.addFile("b.pdf", "B", null, 0L).block();

            assertNotEquals(a.getId(), b.getId());
            assertEquals(1, b.getFileCount());
            assertFalse(store.stored(a.getId()).isActive());
        }

        @Test
        @DisplayName("returned sessions are copies")
        void returnsCopies() {
            DownloadSession session = manager.addFile("a.pdf", "A", null, 0L).block();
            session.setGroupName("mutated");

            assertEquals("A", manager.current().orElseThrow().getGroupName());
        }
    }

    // ── timeouts ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("timeouts")
    class TimeoutTests {

        @Test
        @DisplayName("sweep ends a session idle longer than its timeout")
        void sweepEndsIdle() {
            manager.start("A").block();
            clock.advanceSeconds(31);

            StepVerifier.create(manager.sweepTimedOut()).expectNext(1).verifyComplete();

            assertFalse(manager.isActive());
            assertEquals(List.of("started:A", "timedOut:A", "ended:A"), events);
        }

        @Test
        @DisplayName("sweep leaves a fresh session alone")
        void sweepKeepsFresh() {
            manager.start("A").block();
            clock.advanceSeconds(30);

            StepVerifier.create(manager.sweepTimedOut()).expectNext(0).verifyComplete();
            assertTrue(manager.isActive());
        }

        @Test
        @DisplayName("timeoutRemaining counts down from the session timeout")
        void remaining() {
            assertTrue(manager.timeoutRemaining().isEmpty());
            manager.start("A").block();
            clock.advanceSeconds(12);

            assertEquals(18.0, manager.timeoutRemaining().getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("invalid default timeout is rejected and the previous value kept")
        void invalidTimeout() {
            manager.setDefaultTimeout(4);
            manager.setDefaultTimeout(301);
            assertEquals(30, manager.defaultTimeout());

            manager.setDefaultTimeout(60);
            assertEquals(60, manager.start("A").block().getTimeoutSeconds());
        }
    }

    // ── end / initialize / history ────────────────────────────────────────

    @Nested
    @DisplayName("end, initialize and history")
    class LifecycleTests {

        @Test
        @DisplayName("end(id) closes the current session")
        void endById() {
            DownloadSession session = manager.start("A").block();

            manager.end(session.getId()).block();

            assertFalse(manager.isActive());
            assertFalse(store.stored(session.getId()).isActive());
        }

        @Test
        @DisplayName("endCurrent without an active session does nothing")
        void endCurrentIdle() {
            StepVerifier.create(manager.endCurrent()).verifyComplete();

            manager.start("A").block();
            manager.endCurrent().block();

            assertFalse(manager.isActive());
            assertEquals(List.of("started:A", "ended:A"), events);
        }

        @Test
        @DisplayName("initialize adopts the newest active row and closes the others")
        void initializeAdopts() {
            store.put(stale("old", "A", T0.minusSeconds(60)));
            store.put(stale("new", "B", T0.minusSeconds(10)));

            manager.initialize().block();

            assertEquals("new", manager.current().orElseThrow().getId());
            assertFalse(store.stored("old").isActive());
        }

        @Test
        @DisplayName("initialize degrades to no session when the store cannot be read")
        void initializeFailure() {
            store.failReads(true);

            StepVerifier.create(manager.initialize()).verifyComplete();
            assertFalse(manager.isActive());
        }

        @Test
        @DisplayName("history and statistics come from the store; read failures degrade")
        void history() {
            manager.addFile("a.pdf", "A", null, 0L).block();
            manager.addFile("b.pdf", "A", null, 0L).block();
            clock.advanceSeconds(1);
            manager.addFile("c.pdf", "B", null, 0L).block();

            StepVerifier.create(manager.totalSessions()).expectNext(2L).verifyComplete();
            StepVerifier.create(manager.averageFilesPerSession()).expectNext(1.5).verifyComplete();
            StepVerifier.create(manager.recent(10, false).map(DownloadSession::getGroupName))
                .expectNext("A")
                .verifyComplete();

            store.failReads(true);
            StepVerifier.create(manager.recent(10, true)).verifyComplete();
            StepVerifier.create(manager.totalSessions()).expectNext(0L).verifyComplete();
        }

        private DownloadSession stale(String id, String group, Instant started) {
            DownloadSession session = new DownloadSession();
            session.setId(id);
            session.setGroupName(group);
            session.setStartTime(LocalDateTime.ofInstant(started, ZoneOffset.UTC));
            session.setLastActivity(LocalDateTime.ofInstant(started, ZoneOffset.UTC));
            session.setTimeoutSeconds(30);
            session.setConfidenceScore(1.0);
            session.setActive(true);
            return session;
        }
    }

    // ── concurrent observations ───────────────────────────────────────────

    @Nested
    @DisplayName("concurrent files for different groups")
    class ConcurrencyTests {

        private SlowInsertSessionStore slowStore;
        private DownloadSessionManager slowManager;

        @BeforeEach
        void setUp() {
            slowStore = new SlowInsertSessionStore(Duration.ofMillis(200));
            slowManager = new DownloadSessionManager(slowStore, clock);
        }

        @Test
        @DisplayName("a group switch while the first insert is still pending records both files")
        void switchDuringPendingInsert() {
            Mono<DownloadSession> first = slowManager.addFile("a.pdf", "A", null, 0L);
            Mono<DownloadSession> second = slowManager.addFile("b.pdf", "B", null, 0L);

            List<DownloadSession> sessions = Flux.merge(first, second)
                .collectList()
                .block(Duration.ofSeconds(5));

            Map<String, DownloadSession> byGroup = sessions.stream()
                .collect(Collectors.toMap(DownloadSession::getGroupName, s -> s));
            DownloadSession storedA = slowStore.stored(byGroup.get("A").getId());
            DownloadSession storedB = slowStore.stored(byGroup.get("B").getId());

            assertFalse(storedA.isActive());
            assertEquals(1, storedA.getFileCount());
            assertTrue(storedB.isActive());
            assertEquals(1, storedB.getFileCount());
            assertEquals(2, slowStore.storedFiles().size());
            assertEquals("B", slowManager.currentGroupName().orElseThrow());
        }

        @Test
        @DisplayName("parallel callers never fail and leave exactly one active session")
        void parallelCallers() {
            List<DownloadSession> sessions = Flux.range(0, 8)
                .flatMap(i -> slowManager.addFile("f" + i + ".pdf", i % 2 == 0 ? "A" : "B", null, 0L)
                                         .subscribeOn(Schedulers.parallel()))
                .collectList()
                .block(Duration.ofSeconds(10));

            assertEquals(8, sessions.size());
            assertEquals(8, slowStore.storedFiles().size());
            StepVerifier.create(slowStore.findActive().map(DownloadSession::getGroupName))
                .expectNext(slowManager.currentGroupName().orElseThrow())
                .verifyComplete();
        }
    }

    /** Store that delays inserts and, like a database, rejects writes for rows it does not hold. */
    static class SlowInsertSessionStore extends InMemorySessionStore {

        private final Duration insertDelay;

        SlowInsertSessionStore(Duration insertDelay) {
            this.insertDelay = insertDelay;
        }

        @Override
        public Mono<DownloadSession> insert(DownloadSession session) {
            return super.insert(session).delaySubscription(insertDelay);
        }

        @Override
        public Mono<DownloadSession> update(DownloadSession session) {
            return Mono.defer(() -> stored(session.getId()) == null
                ? Mono.error(new IllegalStateException("no row for session " + session.getId()))
                : super.update(session));
        }

        @Override
        public Mono<SessionFile> addFile(SessionFile file) {
            return Mono.defer(() -> stored(file.getSessionId()) == null
                ? Mono.error(new IllegalStateException("no row for session " + file.getSessionId()))
                : super.addFile(file));
        }
    }
}

