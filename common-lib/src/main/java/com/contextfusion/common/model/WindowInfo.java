package com.contextfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One visible top-level window of the source application as reported by a window enumerator.
 * Pure model, no logic.
 */
public record WindowInfo(
    @JsonProperty("id")          String id,
    @JsonProperty("title")       String title,
    @JsonProperty("processName") String processName,
    @JsonProperty("activeFocus") boolean activeFocus
) {}
