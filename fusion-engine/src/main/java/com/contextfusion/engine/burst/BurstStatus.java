package com.contextfusion.engine.burst;

import com.contextfusion.common.confidence.SignalConfidenceCalculator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time snapshot of the burst detector.
 *
 * @param burstStartTime set only while a burst is active
 * @param firstFileTime  oldest retained event, {@code null} when nothing is retained
 * @param lastFileTime   newest retained event, {@code null} when nothing is retained
 */
public record BurstStatus(
    @JsonProperty("active")         boolean active,
    @JsonProperty("fileCount")      int fileCount,
    @JsonProperty("burstStartTime") Instant burstStartTime,
    @JsonProperty("firstFileTime")  Instant firstFileTime,
    @JsonProperty("lastFileTime")   Instant lastFileTime,
    @JsonProperty("fileNames")      List<String> fileNames
) {

    public BurstStatus {
        fileNames = fileNames == null ? List.of() : List.copyOf(fileNames);
    }

    public static BurstStatus idle() {
        return new BurstStatus(false, 0, null, null, null, List.of());
    }

    @JsonProperty("durationSeconds")
    public double durationSeconds() {
        Instant start = burstStartTime != null ? burstStartTime : firstFileTime;
        if (start == null || lastFileTime == null) return 0.0;
        return Math.max(0.0, Duration.between(start, lastFileTime).toMillis() / 1000.0);
    }

    @JsonProperty("averageIntervalSeconds")
    public double averageIntervalSeconds() {
        return fileCount < 2 ? 0.0 : durationSeconds() / (fileCount - 1);
    }

    @JsonProperty("confidence")
    public double confidence() {
        return SignalConfidenceCalculator.burstConfidence(fileCount, averageIntervalSeconds());
    }
}
