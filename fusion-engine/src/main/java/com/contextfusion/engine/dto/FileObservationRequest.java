package com.contextfusion.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A newly observed file. {@code observedAt} defaults to the server clock when absent.
 */
public record FileObservationRequest(
    @JsonProperty("fileName")   String fileName,
    @JsonProperty("observedAt") Instant observedAt,
    @JsonProperty("filePath")   String filePath,
    @JsonProperty("fileSize")   Long fileSize
) {}
