package com.contextfusion.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FeedbackRequest(
    @JsonProperty("fileName")        String fileName,
    @JsonProperty("detectedContext") String detectedContext,
    @JsonProperty("actualContext")   String actualContext,
    @JsonProperty("wasCorrect")      boolean wasCorrect
) {}
