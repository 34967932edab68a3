package com.contextfusion.engine.config;

import com.contextfusion.common.voting.ContextVotingStrategy;
import com.contextfusion.common.voting.WeightedContextVotingStrategy;
import com.contextfusion.engine.burst.DownloadBurstDetector;
import com.contextfusion.engine.fusion.ContextFusionEngine;
import com.contextfusion.engine.logger.DetectionFlowLogger;
import com.contextfusion.engine.pattern.PatternStore;
import com.contextfusion.engine.provider.ReportedWindowState;
import com.contextfusion.engine.session.DownloadSessionManager;
import com.contextfusion.engine.session.SessionStore;
import com.contextfusion.engine.window.BackgroundWindowTracker;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the fusion components from {@code application.yml}. Every tunable goes through the
 * component's validating setter, so an out-of-range value is logged and the default kept.
 */
@Configuration
public class FusionEngineConfig {

    @Value("${fusion.application-name:Telegram}")
    private String applicationName;

    @Value("${fusion.weights.foreground:0.5}")
    private double foregroundWeight;

    @Value("${fusion.weights.background:0.3}")
    private double backgroundWeight;

    @Value("${fusion.weights.session:0.4}")
    private double sessionWeight;

    @Value("${fusion.weights.pattern:0.2}")
    private double patternWeight;

    @Value("${fusion.minimum-confidence-threshold:0.3}")
    private double minimumConfidenceThreshold;

    @Value("${fusion.max-signal-age-seconds:30}")
    private int maxSignalAgeSeconds;

    @Value("${fusion.signal-timeout-ms:250}")
    private long signalTimeoutMs;

    @Value("${fusion.boost.enabled:true}")
    private boolean boostEnabled;

    @Value("${fusion.boost.multiplier:2.0}")
    private double boostMultiplier;

    @Value("${fusion.boost.dampening-factor:0.5}")
    private double dampeningFactor;

    @Value("${fusion.boost.weak-threshold:0.3}")
    private double weakThreshold;

    @Value("${burst.threshold-seconds:5}")
    private int burstThresholdSeconds;

    @Value("${burst.minimum-files:2}")
    private int minimumFilesForBurst;

    @Value("${burst.max-duration-seconds:60}")
    private int maxBurstDurationSeconds;

    @Value("${window.max-tracked:20}")
    private int maxTrackedWindows;

    @Value("${session.timeout-seconds:30}")
    private int sessionTimeoutSeconds;

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ContextVotingStrategy contextVotingStrategy() {
        return new WeightedContextVotingStrategy();
    }

    @Bean
    public ReportedWindowState reportedWindowState() {
        return new ReportedWindowState(applicationName);
    }

    @Bean
    public DownloadBurstDetector downloadBurstDetector(DetectionFlowLogger flowLogger) {
        DownloadBurstDetector detector = new DownloadBurstDetector();
        detector.setBurstThresholdSeconds(burstThresholdSeconds);
        detector.setMinimumFilesForBurst(minimumFilesForBurst);
        detector.setMaxBurstDurationSeconds(maxBurstDurationSeconds);
        detector.addListener(flowLogger);
        return detector;
    }

    @Bean
    public BackgroundWindowTracker backgroundWindowTracker(ReportedWindowState windowState, Clock clock,
                                                           DetectionFlowLogger flowLogger) {
        BackgroundWindowTracker tracker = new BackgroundWindowTracker(windowState, clock, applicationName);
        tracker.setMaxTrackedWindows(maxTrackedWindows);
        tracker.addListener(flowLogger);
        return tracker;
    }

    @Bean
    public DownloadSessionManager downloadSessionManager(SessionStore sessionStore, Clock clock,
                                                         DetectionFlowLogger flowLogger) {
        DownloadSessionManager manager = new DownloadSessionManager(sessionStore, clock);
        manager.setDefaultTimeout(sessionTimeoutSeconds);
        manager.addListener(flowLogger);
        return manager;
    }

    @Bean
    public ContextFusionEngine contextFusionEngine(ReportedWindowState windowState,
                                                   BackgroundWindowTracker windowTracker,
                                                   DownloadSessionManager sessionManager,
                                                   PatternStore patternStore,
                                                   ContextVotingStrategy votingStrategy,
                                                   Clock clock) {
        ContextFusionEngine engine = new ContextFusionEngine(windowState, windowTracker, sessionManager,
                                                             patternStore, votingStrategy, clock, applicationName);
        engine.setForegroundWeight(foregroundWeight);
        engine.setBackgroundWeight(backgroundWeight);
        engine.setSessionWeight(sessionWeight);
        engine.setPatternWeight(patternWeight);
        engine.setMinimumConfidenceThreshold(minimumConfidenceThreshold);
        engine.setMaxSignalAgeSeconds(maxSignalAgeSeconds);
        engine.setSignalTimeoutMs(signalTimeoutMs);
        engine.setSessionBoostEnabled(boostEnabled);
        engine.setBoostMultiplier(boostMultiplier);
        engine.setDampeningFactor(dampeningFactor);
        engine.setWeakThreshold(weakThreshold);
        return engine;
    }
}
