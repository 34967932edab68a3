package com.contextfusion.engine.burst;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class DownloadBurstDetectorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private DownloadBurstDetector detector;
    private final List<String> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        detector = new DownloadBurstDetector();
        detector.addListener(new BurstListener() {
            @Override
            public void onBurstStarted(BurstStatus status) {
                events.add("started:" + status.fileCount());
            }

            @Override
            public void onBurstContinued(BurstStatus status) {
                events.add("continued:" + status.fileCount());
            }

            @Override
            public void onBurstEnded(BurstStatus status) {
                events.add("ended:" + status.fileCount());
            }
        });
    }

    // ── record() ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("record()")
    class RecordTests {

        @Test
        @DisplayName("two downloads 2s apart → active burst with two files")
        void twoDownloadsTwoSecondsApart() {
            detector.record("a.pdf", T0);
            detector.record("b.pdf", T0.plusSeconds(2));

            BurstStatus status = detector.status();
            assertTrue(status.active());
            assertEquals(2, status.fileCount());
            assertEquals(T0, status.burstStartTime());
            assertEquals(List.of("a.pdf", "b.pdf"), status.fileNames());
            assertEquals(List.of("started:2"), events);
        }

        @Test
        @DisplayName("a single download is not a burst")
        void singleDownload() {
            detector.record("a.pdf", T0);

            assertFalse(detector.status().active());
            assertEquals(1, detector.currentCount());
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("third close download continues the burst")
        void continues() {
            detector.record("a.pdf", T0);
            detector.record("b.pdf", T0.plusSeconds(1));
            detector.record("c.pdf", T0.plusSeconds(2));

            assertEquals(List.of("started:2", "continued:3"), events);
            assertEquals(3, detector.status().fileCount());
        }

        @Test
        @DisplayName("gap longer than the threshold evicts old events and ends the burst")
        void gapEndsBurst() {
            detector.record("a.pdf", T0);
            detector.record("b.pdf", T0.plusSeconds(2));
            detector.record("c.pdf", T0.plusSeconds(20));

            BurstStatus status = detector.status();
            assertFalse(status.active());
            assertEquals(1, status.fileCount());
            assertEquals(List.of("c.pdf"), status.fileNames());
            assertEquals("ended:1", events.get(events.size() - 1));
        }

        @Test
        @DisplayName("burst spanning more than the max duration is force-ended and restarted")
        void forceEndedBySpan() {
            detector.setMaxBurstDurationSeconds(10);
            for (int i = 0; i <= 12; i += 2) {
                detector.record("f" + i, T0.plusSeconds(i));
            }
            // t=12 is 12s after the burst started at t=0: force-end clears everything, the new file stands alone
            BurstStatus status = detector.status();
            assertFalse(status.active());
            assertEquals(1, status.fileCount());
            assertEquals(List.of("f12"), status.fileNames());
            assertEquals("ended:2", events.get(events.size() - 1));
        }

        @Test
        @DisplayName("retained events never lie further than the threshold from the newest event")
        void retentionWindow() {
            for (int i = 0; i < 10; i++) {
                detector.record("f" + i, T0.plusSeconds(i * 3L));
            }
            BurstStatus status = detector.status();
            long spread = status.lastFileTime().getEpochSecond() - status.firstFileTime().getEpochSecond();
            assertTrue(spread <= detector.getBurstThresholdSeconds());
        }
    }

    // ── queries ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("queries")
    class QueryTests {

        @Test
        @DisplayName("isBurst() is true right after one download and does not mutate state")
        void isBurstNonMutating() {
            detector.record("a.pdf", T0);

            assertTrue(detector.isBurst("b.pdf", T0.plusSeconds(3)));
            assertFalse(detector.isBurst("b.pdf", T0.plusSeconds(30)));
            assertEquals(1, detector.currentCount());
        }

        @Test
        @DisplayName("isBurst() is false with no history")
        void isBurstEmpty() {
            assertFalse(detector.isBurst("a.pdf", T0));
        }

        @Test
        @DisplayName("status() is idempotent")
        void statusIdempotent() {
            detector.record("a.pdf", T0);
            detector.record("b.pdf", T0.plusSeconds(1));

            assertEquals(detector.status(), detector.status());
        }

        @Test
        @DisplayName("remaining() counts down the gap window and is never negative")
        void remaining() {
            assertEquals(OptionalDouble.empty(), detector.remaining(T0));

            detector.record("a.pdf", T0);
            detector.record("b.pdf", T0.plusSeconds(1));

            assertEquals(3.0, detector.remaining(T0.plusSeconds(3)).getAsDouble(), 1e-9);
            assertEquals(0.0, detector.remaining(T0.plusSeconds(60)).getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("reset() clears events and ends an active burst")
        void reset() {
            detector.record("a.pdf", T0);
            detector.record("b.pdf", T0.plusSeconds(1));

            detector.reset();

            assertEquals(0, detector.currentCount());
            assertFalse(detector.status().active());
            assertEquals("ended:2", events.get(events.size() - 1));
        }

        @Test
        @DisplayName("status confidence follows count and spacing")
        void statusConfidence() {
            detector.record("a.pdf", T0);
            detector.record("b.pdf", T0.plusSeconds(1));

            BurstStatus status = detector.status();
            assertEquals(1.0, status.durationSeconds(), 1e-9);
            assertEquals(1.0, status.averageIntervalSeconds(), 1e-9);
            assertEquals(0.6, status.confidence(), 1e-9);
        }
    }

    // ── configuration ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("out-of-range values are rejected and the previous value kept")
        void invalidRetained() {
            detector.setBurstThresholdSeconds(0);
            detector.setBurstThresholdSeconds(61);
            detector.setMinimumFilesForBurst(1);
            detector.setMaxBurstDurationSeconds(4);

            assertEquals(5, detector.getBurstThresholdSeconds());
            assertEquals(2, detector.getMinimumFilesForBurst());
            assertEquals(60, detector.getMaxBurstDurationSeconds());
        }

        @Test
        @DisplayName("higher minimum file count delays the burst")
        void higherMinimum() {
            detector.setMinimumFilesForBurst(3);
            detector.record("a", T0);
            detector.record("b", T0.plusSeconds(1));
            assertFalse(detector.status().active());
            detector.record("c", T0.plusSeconds(2));
            assertTrue(detector.status().active());
        }
    }
}
