package com.contextfusion.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One source's proposed classification for a single observation.
 *
 * <p>Signals are created per detection call and discarded afterwards. The only transformation
 * applied after collection is the Session Priority Boost, which produces re-weighted copies via
 * {@link #boosted(double)} and {@link #dampened(double)}; {@code originalWeight} always keeps the
 * collected weight.
 *
 * <p>A signal is <em>valid</em> when it names a real context (not blank, not {@value #UNSORTED})
 * and carries positive weight and confidence.
 */
public record ContextSignal(
    @JsonProperty("source")          SignalSource source,
    @JsonProperty("detectedContext") String detectedContext,
    @JsonProperty("weight")          double weight,
    @JsonProperty("originalWeight")  double originalWeight,
    @JsonProperty("confidence")      double confidence,
    @JsonProperty("timestamp")       Instant timestamp,
    @JsonProperty("wasBoosted")      boolean wasBoosted,
    @JsonProperty("metadata")        String metadata
) {

    /** Sentinel context meaning "no classification". */
    public static final String UNSORTED = "Unsorted";

    public static ContextSignal of(SignalSource source, String detectedContext, double weight,
                                   double confidence, Instant timestamp, String metadata) {
        return new ContextSignal(source, detectedContext, weight, weight, confidence, timestamp, false, metadata);
    }

    @JsonProperty("votingPower")
    public double votingPower() {
        return weight * confidence;
    }

    @JsonIgnore
    public boolean isValid() {
        return detectedContext != null
            && !detectedContext.isBlank()
            && !UNSORTED.equals(detectedContext)
            && weight > 0
            && confidence > 0;
    }

    /** Copy with weight multiplied by {@code multiplier}, flagged as boosted. */
    public ContextSignal boosted(double multiplier) {
        return new ContextSignal(source, detectedContext, weight * multiplier, originalWeight,
                                 confidence, timestamp, true, metadata);
    }

    /** Copy with weight multiplied by {@code factor}; the boost flag is left untouched. */
    public ContextSignal dampened(double factor) {
        return new ContextSignal(source, detectedContext, weight * factor, originalWeight,
                                 confidence, timestamp, wasBoosted, metadata);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s (weight: %.2f, confidence: %.2f, power: %.2f)%s",
            source, detectedContext, weight, confidence, votingPower(), wasBoosted ? " [BOOSTED]" : "");
    }
}
