package com.contextfusion.engine.window;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Snapshot of one tracked source-application window.
 */
public record WindowCandidate(
    @JsonProperty("id")                 String id,
    @JsonProperty("title")              String title,
    @JsonProperty("processName")        String processName,
    @JsonProperty("active")             boolean active,
    @JsonProperty("firstSeen")          Instant firstSeen,
    @JsonProperty("lastSeen")           Instant lastSeen,
    @JsonProperty("confidenceScore")    double confidenceScore,
    @JsonProperty("seenCount")          int seenCount,
    @JsonProperty("extractedGroupName") String extractedGroupName
) {}
