package com.contextfusion.engine.fusion;

import com.contextfusion.common.boost.BoostDecision;
import com.contextfusion.common.boost.BoostSettings;
import com.contextfusion.common.boost.SessionPriorityBoost;
import com.contextfusion.common.confidence.SignalConfidenceCalculator;
import com.contextfusion.common.model.ContextSignal;
import com.contextfusion.common.model.DetectionResult;
import com.contextfusion.common.model.FilePattern;
import com.contextfusion.common.model.SignalSource;
import com.contextfusion.common.text.GroupNameExtractor;
import com.contextfusion.common.trace.ObservationScope;
import com.contextfusion.common.voting.ContextVotingStrategy;
import com.contextfusion.common.voting.VoteOutcome;
import com.contextfusion.engine.pattern.PatternStore;
import com.contextfusion.engine.provider.ForegroundWindowProvider;
import com.contextfusion.engine.session.DownloadSession;
import com.contextfusion.engine.session.DownloadSessionManager;
import com.contextfusion.engine.window.BackgroundWindowTracker;
import com.contextfusion.engine.window.GroupCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Multi-source context detector with session consistency.
 *
 * <h3>Pipeline per observation</h3>
 * <pre>
 *   collect FOREGROUND, BACKGROUND, SESSION, PATTERN  (each optional, each bounded by signalTimeoutMs)
 *   → keep valid signals with confidence ≥ minimumConfidenceThreshold
 *   → Session Priority Boost
 *   → weighted vote
 *   → overall confidence (agreement bonus, disagreement penalty)
 * </pre>
 *
 * <p>Detection never errors to the caller: an unavailable source is dropped, and an unexpected
 * failure yields an {@code "Unsorted"} result.
 */
public class ContextFusionEngine {

    private static final Logger log = LoggerFactory.getLogger(ContextFusionEngine.class);

    public static final double DEFAULT_FOREGROUND_WEIGHT = 0.5;
    public static final double DEFAULT_BACKGROUND_WEIGHT = 0.3;
    public static final double DEFAULT_SESSION_WEIGHT    = 0.4;
    public static final double DEFAULT_PATTERN_WEIGHT    = 0.2;
    public static final double DEFAULT_MIN_CONFIDENCE    = 0.3;
    public static final int    DEFAULT_MAX_SIGNAL_AGE_SECONDS = 30;
    public static final long   DEFAULT_SIGNAL_TIMEOUT_MS      = 250;

    private final ForegroundWindowProvider foregroundProvider;
    private final BackgroundWindowTracker windowTracker;
    private final DownloadSessionManager sessionManager;
    private final PatternStore patternStore;
    private final ContextVotingStrategy votingStrategy;
    private final Clock clock;
    private final String applicationName;

    private final Map<SignalSource, Double> weights = new EnumMap<>(SignalSource.class);
    private volatile double minimumConfidenceThreshold = DEFAULT_MIN_CONFIDENCE;
    private volatile int maxSignalAgeSeconds = DEFAULT_MAX_SIGNAL_AGE_SECONDS;
    private volatile long signalTimeoutMs = DEFAULT_SIGNAL_TIMEOUT_MS;
    private volatile BoostSettings boostSettings = BoostSettings.defaults();

    // guarded by this
    private long totalDetections;
    private long consensusDetections;
    private double totalDetectionTimeMs;
    private long sessionBoostCount;
    private DetectionResult lastResult;

    public ContextFusionEngine(ForegroundWindowProvider foregroundProvider,
                               BackgroundWindowTracker windowTracker,
                               DownloadSessionManager sessionManager,
                               PatternStore patternStore,
                               ContextVotingStrategy votingStrategy,
                               Clock clock,
                               String applicationName) {
        this.foregroundProvider = Objects.requireNonNull(foregroundProvider, "foregroundProvider");
        this.windowTracker      = Objects.requireNonNull(windowTracker, "windowTracker");
        this.sessionManager     = Objects.requireNonNull(sessionManager, "sessionManager");
        this.patternStore       = Objects.requireNonNull(patternStore, "patternStore");
        this.votingStrategy     = Objects.requireNonNull(votingStrategy, "votingStrategy");
        this.clock              = Objects.requireNonNull(clock, "clock");
        this.applicationName    = Objects.requireNonNull(applicationName, "applicationName");

        weights.put(SignalSource.FOREGROUND, DEFAULT_FOREGROUND_WEIGHT);
        weights.put(SignalSource.BACKGROUND, DEFAULT_BACKGROUND_WEIGHT);
        weights.put(SignalSource.SESSION,    DEFAULT_SESSION_WEIGHT);
        weights.put(SignalSource.PATTERN,    DEFAULT_PATTERN_WEIGHT);
    }

    // ── detection ─────────────────────────────────────────────────────────

    public Mono<String> detect(String fileName, Instant observedAt) {
        return detectWithDetails(fileName, observedAt).map(DetectionResult::detectedContext);
    }

    public Mono<DetectionResult> detectWithDetails(String fileName, Instant observedAt) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return collectAllSignals(fileName, observedAt)
                .map(this::fuse)
                .onErrorResume(e -> {
                    log.error("[Fusion] detection failed file={}", fileName, e);
                    return Mono.just(DetectionResult.unsorted(List.of(), 0.0));
                })
                .map(result -> result.withDuration((System.nanoTime() - started) / 1_000_000.0))
                .doOnNext(this::recordStatistics)
                .doOnEach(signal -> {
                    if (!signal.isOnNext()) return;
                    DetectionResult result = signal.get();
                    ObservationScope scope = ObservationScope.from(signal.getContextView());
                    scope.logging(() ->
                        log.info("[Fusion] file={} context={} confidence={} score={} validSignals={} boost={} durationMs={} observationId={}",
                                 fileName, result.detectedContext(),
                                 String.format(Locale.ROOT, "%.2f", result.overallConfidence()),
                                 String.format(Locale.ROOT, "%.3f", result.winningScore()),
                                 result.validSignalCount(), result.boostApplied(),
                                 String.format(Locale.ROOT, "%.2f", result.detectionDurationMs()),
                                 scope.observationId()));
                });
        });
    }

    /**
     * Collects one optional signal per source, in {@link SignalSource} order, without filtering.
     */
    public Mono<List<ContextSignal>> collectAllSignals(String fileName, Instant observedAt) {
        return Mono.zip(
                bounded(SignalSource.FOREGROUND, Mono.fromCallable(() -> foregroundSignal(observedAt))),
                bounded(SignalSource.BACKGROUND, Mono.fromCallable(() -> backgroundSignal(observedAt))),
                bounded(SignalSource.SESSION,    Mono.fromCallable(() -> sessionSignal(observedAt))),
                bounded(SignalSource.PATTERN,    patternSignal(fileName, observedAt)))
            .map(tuple -> {
                List<ContextSignal> signals = new ArrayList<>(4);
                tuple.getT1().ifPresent(signals::add);
                tuple.getT2().ifPresent(signals::add);
                tuple.getT3().ifPresent(signals::add);
                tuple.getT4().ifPresent(signals::add);
                return signals;
            });
    }

    /**
     * Stores what the user's correction (or confirmation) teaches about this file's extension.
     * Failures are logged and never propagated.
     */
    public Mono<Void> recordFeedback(String fileName, String detectedContext, String actualContext, boolean wasCorrect) {
        return Mono.defer(() -> {
            String groupName = wasCorrect || actualContext == null || actualContext.isBlank()
                ? detectedContext
                : actualContext;
            FilePattern pattern = FilePattern.learned(extensionOf(fileName), groupName, wasCorrect, LocalDateTime.now(clock));
            return patternStore.savePattern(pattern);
        })
            .doOnSuccess(saved -> log.info("[Fusion] feedback recorded file={} group={} correct={} confidence={}",
                                           fileName, saved == null ? null : saved.groupName(), wasCorrect,
                                           saved == null ? null : saved.confidenceScore()))
            .onErrorResume(e -> {
                log.error("[Fusion] failed to record feedback file={}", fileName, e);
                return Mono.empty();
            })
            .then();
    }

    // ── statistics ────────────────────────────────────────────────────────

    public synchronized FusionStatistics statistics() {
        double average = totalDetections == 0 ? 0.0 : totalDetectionTimeMs / totalDetections;
        return new FusionStatistics(totalDetections, consensusDetections, average, sessionBoostCount);
    }

    public synchronized Optional<DetectionResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    public synchronized void resetStatistics() {
        totalDetections = 0;
        consensusDetections = 0;
        totalDetectionTimeMs = 0;
        sessionBoostCount = 0;
        lastResult = null;
        log.info("[Fusion] statistics reset");
    }

    private synchronized void recordStatistics(DetectionResult result) {
        totalDetections++;
        if (result.hasConsensus()) consensusDetections++;
        if (result.boostApplied()) sessionBoostCount++;
        totalDetectionTimeMs += result.detectionDurationMs();
        lastResult = result;
    }

    // ── fusion ────────────────────────────────────────────────────────────

    DetectionResult fuse(List<ContextSignal> collected) {
        double floor = minimumConfidenceThreshold;
        List<ContextSignal> valid = collected.stream()
            .filter(s -> s.isValid() && s.confidence() >= floor)
            .toList();
        if (valid.isEmpty()) {
            log.debug("[Fusion] no valid signals collected={}", collected.size());
            return DetectionResult.unsorted(collected, 0.0);
        }

        BoostDecision boost = SessionPriorityBoost.evaluate(valid, boostSettings);
        if (boost.applied()) {
            log.info("[Fusion] session boost applied reason=\"{}\"", boost.reason());
        } else {
            log.debug("[Fusion] session boost skipped case={}", boost.boostCase());
        }

        VoteOutcome vote = votingStrategy.vote(boost.signals());
        double confidence = SignalConfidenceCalculator.overallConfidence(boost.signals(), vote.winner());
        int agreeing = (int) boost.signals().stream()
            .filter(s -> vote.winner().equals(s.detectedContext()))
            .count();

        return new DetectionResult(vote.winner(), confidence, replaceReweighted(collected, boost.signals()),
                                   vote.breakdown(), vote.winningScore(), 0.0, boost.applied(), boost.reason(),
                                   agreeing);
    }

    /** Collected signals in order, with each boosted/dampened copy in place of its original. */
    private static List<ContextSignal> replaceReweighted(List<ContextSignal> collected, List<ContextSignal> voted) {
        Map<SignalSource, ContextSignal> bySource = new EnumMap<>(SignalSource.class);
        voted.forEach(s -> bySource.put(s.source(), s));
        return collected.stream().map(s -> bySource.getOrDefault(s.source(), s)).toList();
    }

    // ── signal collectors ─────────────────────────────────────────────────

    private Mono<Optional<ContextSignal>> bounded(SignalSource source, Mono<Optional<ContextSignal>> collector) {
        return collector
            .defaultIfEmpty(Optional.empty())
            .timeout(Duration.ofMillis(signalTimeoutMs))
            .onErrorResume(e -> {
                log.debug("[Fusion] signal unavailable source={} reason={}", source, e.toString());
                return Mono.just(Optional.empty());
            });
    }

    private Optional<ContextSignal> foregroundSignal(Instant observedAt) {
        String title = foregroundProvider.activeTitle();
        String process = foregroundProvider.activeProcessName();
        if (!GroupNameExtractor.isSourceWindow(title, process, applicationName)) {
            return Optional.empty();
        }
        String name = GroupNameExtractor.extract(title, applicationName);
        if (ContextSignal.UNSORTED.equals(name)) {
            return Optional.empty();
        }
        return Optional.of(ContextSignal.of(SignalSource.FOREGROUND, name, weight(SignalSource.FOREGROUND),
            SignalConfidenceCalculator.FOREGROUND_CONFIDENCE, observedAt, "Window: " + title));
    }

    private Optional<ContextSignal> backgroundSignal(Instant observedAt) {
        if (!windowTracker.isMonitoring()) {
            return Optional.empty();
        }
        Optional<GroupCandidate> candidate = windowTracker.bestRecentGroupName();
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        GroupCandidate best = candidate.get();
        Duration age = Duration.between(best.lastSeen(), observedAt);
        double confidence = SignalConfidenceCalculator.backgroundConfidence(best.confidence(), age, maxSignalAgeSeconds);
        if (confidence < minimumConfidenceThreshold) {
            log.debug("[Fusion] background filtered group={} confidence={}", best.name(), confidence);
            return Optional.empty();
        }
        return Optional.of(ContextSignal.of(SignalSource.BACKGROUND, best.name(), weight(SignalSource.BACKGROUND),
            confidence, best.lastSeen(), String.format(Locale.ROOT, "Age: %.1fs", age.toMillis() / 1000.0)));
    }

    private Optional<ContextSignal> sessionSignal(Instant observedAt) {
        Optional<DownloadSession> active = sessionManager.current();
        if (active.isEmpty()) {
            return Optional.empty();
        }
        DownloadSession session = active.get();
        Duration idle = Duration.between(session.getLastActivity(), LocalDateTime.ofInstant(observedAt, clock.getZone()));
        double confidence = SignalConfidenceCalculator.sessionConfidence(
            session.getConfidenceScore(), idle, session.getTimeoutSeconds());
        if (confidence < minimumConfidenceThreshold) {
            log.debug("[Fusion] session filtered session={} confidence={}", session.getId(), confidence);
            return Optional.empty();
        }
        return Optional.of(ContextSignal.of(SignalSource.SESSION, session.getGroupName(), weight(SignalSource.SESSION),
            confidence, observedAt, "Session " + session.getId() + ", files: " + session.getFileCount()));
    }

    private Mono<Optional<ContextSignal>> patternSignal(String fileName, Instant observedAt) {
        LocalDateTime localTime = LocalDateTime.ofInstant(observedAt, clock.getZone());
        return patternStore.bestPattern(fileName, extensionOf(fileName), localTime)
            .filter(p -> p.confidenceScore() >= minimumConfidenceThreshold)
            .map(p -> Optional.of(ContextSignal.of(SignalSource.PATTERN, p.groupName(), weight(SignalSource.PATTERN),
                SignalConfidenceCalculator.patternConfidence(p.confidenceScore(), p.timesSeen()),
                observedAt, "Pattern: " + p.description())));
    }

    static String extensionOf(String fileName) {
        if (fileName == null) return "";
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 || dot == fileName.length() - 1 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    // ── configuration ─────────────────────────────────────────────────────

    public synchronized double weight(SignalSource source) {
        return weights.get(source);
    }

    public synchronized Map<SignalSource, Double> weights() {
        return Map.copyOf(weights);
    }

    public void setForegroundWeight(double weight) { setWeight(SignalSource.FOREGROUND, weight); }

    public void setBackgroundWeight(double weight) { setWeight(SignalSource.BACKGROUND, weight); }

    public void setSessionWeight(double weight)    { setWeight(SignalSource.SESSION, weight); }

    public void setPatternWeight(double weight)    { setWeight(SignalSource.PATTERN, weight); }

    public synchronized void setWeight(SignalSource source, double weight) {
        if (!inRange(weight, 0.0, 1.0)) {
            log.warn("[Fusion] rejected weight source={} value={} allowed=0..1 keeping={}", source, weight, weights.get(source));
            return;
        }
        weights.put(source, weight);
    }

    public double getMinimumConfidenceThreshold() {
        return minimumConfidenceThreshold;
    }

    public void setMinimumConfidenceThreshold(double threshold) {
        if (!inRange(threshold, 0.0, 1.0)) {
            log.warn("[Fusion] rejected minimumConfidenceThreshold={} allowed=0..1 keeping={}", threshold, minimumConfidenceThreshold);
            return;
        }
        minimumConfidenceThreshold = threshold;
    }

    public int getMaxSignalAgeSeconds() {
        return maxSignalAgeSeconds;
    }

    public void setMaxSignalAgeSeconds(int seconds) {
        if (seconds < 1 || seconds > 3600) {
            log.warn("[Fusion] rejected maxSignalAgeSeconds={} allowed=1..3600 keeping={}", seconds, maxSignalAgeSeconds);
            return;
        }
        maxSignalAgeSeconds = seconds;
    }

    public long getSignalTimeoutMs() {
        return signalTimeoutMs;
    }

    public void setSignalTimeoutMs(long millis) {
        if (millis < 10 || millis > 10_000) {
            log.warn("[Fusion] rejected signalTimeoutMs={} allowed=10..10000 keeping={}", millis, signalTimeoutMs);
            return;
        }
        signalTimeoutMs = millis;
    }

    public BoostSettings getBoostSettings() {
        return boostSettings;
    }

    public void setSessionBoostEnabled(boolean enabled) {
        boostSettings = boostSettings.withEnabled(enabled);
    }

    public void setBoostMultiplier(double multiplier) {
        if (!inRange(multiplier, 1.0, 10.0)) {
            log.warn("[Fusion] rejected boostMultiplier={} allowed=1..10 keeping={}", multiplier, boostSettings.multiplier());
            return;
        }
        boostSettings = boostSettings.withMultiplier(multiplier);
    }

    public void setDampeningFactor(double factor) {
        if (!(factor > 0.0 && factor <= 1.0)) {
            log.warn("[Fusion] rejected dampeningFactor={} allowed=(0,1] keeping={}", factor, boostSettings.dampeningFactor());
            return;
        }
        boostSettings = boostSettings.withDampeningFactor(factor);
    }

    public void setWeakThreshold(double threshold) {
        if (!inRange(threshold, 0.0, 1.0)) {
            log.warn("[Fusion] rejected weakThreshold={} allowed=0..1 keeping={}", threshold, boostSettings.weakThreshold());
            return;
        }
        boostSettings = boostSettings.withWeakThreshold(threshold);
    }

    private static boolean inRange(double value, double min, double max) {
        return !Double.isNaN(value) && value >= min && value <= max;
    }
}
