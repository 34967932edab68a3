package com.contextfusion.engine.fusion;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Running counters of {@link ContextFusionEngine}.
 */
public record FusionStatistics(
    @JsonProperty("totalDetections")        long totalDetections,
    @JsonProperty("consensusDetections")    long consensusDetections,
    @JsonProperty("averageDetectionTimeMs") double averageDetectionTimeMs,
    @JsonProperty("sessionBoostCount")      long sessionBoostCount
) {

    public static FusionStatistics empty() {
        return new FusionStatistics(0, 0, 0.0, 0);
    }

    @JsonProperty("consensusRate")
    public double consensusRate() {
        return totalDetections == 0 ? 0.0 : (double) consensusDetections / totalDetections;
    }
}
