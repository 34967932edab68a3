package com.contextfusion.engine.service;

import com.contextfusion.common.exception.ContextFusionException;
import com.contextfusion.common.model.ContextSignal;
import com.contextfusion.common.voting.WeightedContextVotingStrategy;
import com.contextfusion.engine.burst.DownloadBurstDetector;
import com.contextfusion.engine.dto.FileObservationRequest;
import com.contextfusion.engine.dto.ObservationOutcome;
import com.contextfusion.engine.fusion.ContextFusionEngine;
import com.contextfusion.engine.logger.DetectionFlowLogger;
import com.contextfusion.engine.provider.ReportedWindowState;
import com.contextfusion.engine.session.DownloadSessionManager;
import com.contextfusion.engine.support.FakePatternStore;
import com.contextfusion.engine.support.InMemorySessionStore;
import com.contextfusion.engine.support.MutableClock;
import com.contextfusion.engine.window.BackgroundWindowTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObservationServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private ReportedWindowState windows;
    private InMemorySessionStore sessionStore;
    private DownloadSessionManager sessions;
    private DownloadBurstDetector burstDetector;
    private ObservationService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        windows = new ReportedWindowState("Telegram");
        sessionStore = new InMemorySessionStore();
        sessions = new DownloadSessionManager(sessionStore, clock);
        burstDetector = new DownloadBurstDetector();
        ContextFusionEngine engine = new ContextFusionEngine(
            windows, new BackgroundWindowTracker(windows, clock, "Telegram"), sessions,
            new FakePatternStore(), new WeightedContextVotingStrategy(), clock, "Telegram");
        service = new ObservationService(burstDetector, engine, sessions, new DetectionFlowLogger(), clock);
    }

    private FileObservationRequest request(String fileName, Instant at) {
        return new FileObservationRequest(fileName, at, "/downloads/" + fileName, 1024L);
    }

    @Test
    @DisplayName("first file is detected and recorded; the second one within the threshold is a burst")
    void burstAndSession() {
        windows.update("Physics – Telegram", "Telegram", List.of());

        ObservationOutcome first = service.observe(request("a.pdf", T0), "obs-1").block();
        ObservationOutcome second = service.observe(request("b.pdf", T0.plusSeconds(2)), "obs-2").block();

        assertEquals("obs-1", first.observationId());
        assertEquals("Physics", first.detectedContext());
        assertFalse(first.burst());
        assertEquals(1, first.burstFileCount());
        assertNotNull(first.sessionId());

        assertTrue(second.burst());
        assertEquals(2, second.burstFileCount());
        assertEquals(first.sessionId(), second.sessionId());
        assertEquals(2, sessionStore.stored(first.sessionId()).getFileCount());
    }

    @Test
    @DisplayName("Unsorted files are not added to a session")
    void unsortedNotRecorded() {
        ObservationOutcome outcome = service.observe(request("mystery.bin", T0), "obs-1").block();

        assertEquals(ContextSignal.UNSORTED, outcome.detectedContext());
        assertNull(outcome.sessionId());
        assertFalse(sessions.isActive());
        assertTrue(sessionStore.storedFiles().isEmpty());
    }

    @Test
    @DisplayName("batch survives switching to another application")
    void batchSurvivesAppSwitch() {
        windows.update("Physics – Telegram", "Telegram", List.of());
        ObservationOutcome first = service.observe(request("a.pdf", T0), "obs-1").block();

        windows.update("Inbox - Outlook", "outlook", List.of());
        ObservationOutcome second = service.observe(request("b.pdf", T0.plusSeconds(3)), "obs-2").block();

        assertEquals("Physics", second.detectedContext());
        assertTrue(second.boostApplied());
        assertEquals(first.sessionId(), second.sessionId());
    }

    @Test
    @DisplayName("missing observedAt falls back to the clock")
    void defaultsObservedAt() {
        ObservationOutcome outcome = service.observe(request("a.pdf", null), "obs-1").block();

        assertEquals(T0, burstDetector.status().lastFileTime());
        assertEquals(T0, outcome.observedAt());
    }

    @Test
    @DisplayName("outcome carries the observation scope: generated id, file name and observedAt")
    void outcomeCarriesScope() {
        windows.update("Physics – Telegram", "Telegram", List.of());

        ObservationOutcome generated = service.observe(request("a.pdf", T0.plusSeconds(1)), " ").block();
        ObservationOutcome other = service.observe(request("b.pdf", T0.plusSeconds(2)), null).block();

        assertFalse(generated.observationId().isBlank());
        assertNotEquals(generated.observationId(), other.observationId());
        assertEquals("a.pdf", generated.fileName());
        assertEquals(T0.plusSeconds(1), generated.observedAt());
    }

    @Test
    @DisplayName("session write failure surfaces as ContextFusionException")
    void sessionFailure() {
        windows.update("Physics – Telegram", "Telegram", List.of());
        sessionStore.failWrites(true);

        StepVerifier.create(service.observe(request("a.pdf", T0), "obs-1"))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(ContextFusionException.class, e);
                assertEquals("Session", ((ContextFusionException) e).getComponent());
            })
            .verify();
    }
}
