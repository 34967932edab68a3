package com.contextfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of one multi-source detection.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code detectedContext}:    winning context, or {@link ContextSignal#UNSORTED}</li>
 *   <li>{@code overallConfidence}:  agreement-adjusted confidence in [0.0, 1.0]</li>
 *   <li>{@code signals}:            every collected signal in collection order (boosted copies
 *                                     replace their originals)</li>
 *   <li>{@code signalBreakdown}:    voting power contributed per source</li>
 *   <li>{@code winningScore}:       total voting power of the winning context</li>
 *   <li>{@code detectionDurationMs}: wall time spent in detection</li>
 *   <li>{@code boostApplied}/{@code boostReason}: Session Priority Boost outcome</li>
 *   <li>{@code agreeingSignals}:    voted signals that carry the winning context; signals
 *                                     dropped below the confidence floor are not counted</li>
 * </ul>
 */
public record DetectionResult(
    @JsonProperty("detectedContext")     String detectedContext,
    @JsonProperty("overallConfidence")   double overallConfidence,
    @JsonProperty("signals")             List<ContextSignal> signals,
    @JsonProperty("signalBreakdown")     Map<SignalSource, Double> signalBreakdown,
    @JsonProperty("winningScore")        double winningScore,
    @JsonProperty("detectionDurationMs") double detectionDurationMs,
    @JsonProperty("boostApplied")        boolean boostApplied,
    @JsonProperty("boostReason")         String boostReason,
    @JsonProperty("agreeingSignals")     int agreeingSignals
) {

    public DetectionResult {
        signals = signals == null ? List.of() : List.copyOf(signals);
        signalBreakdown = signalBreakdown == null ? Map.of() : Map.copyOf(signalBreakdown);
    }

    public static DetectionResult unsorted(List<ContextSignal> signals, double detectionDurationMs) {
        return new DetectionResult(ContextSignal.UNSORTED, 0.0, signals, Map.of(), 0.0,
                                   detectionDurationMs, false, null, 0);
    }

    public DetectionResult withDuration(double durationMs) {
        return new DetectionResult(detectedContext, overallConfidence, signals, signalBreakdown,
                                   winningScore, durationMs, boostApplied, boostReason, agreeingSignals);
    }

    /** True when more than one voted signal carries the winning context. */
    @JsonProperty("hasConsensus")
    public boolean hasConsensus() {
        return agreeingSignals > 1;
    }

    @JsonProperty("validSignalCount")
    public long validSignalCount() {
        return signals.stream().filter(ContextSignal::isValid).count();
    }

    @Override
    public String toString() {
        return String.format("Detected: '%s' (confidence: %.2f, score: %.2f, signals: %d, consensus: %s)%s",
            detectedContext, overallConfidence, winningScore, validSignalCount(),
            hasConsensus() ? "Yes" : "No", boostApplied ? " [SESSION BOOSTED]" : "");
    }
}
