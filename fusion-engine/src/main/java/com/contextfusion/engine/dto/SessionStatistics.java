package com.contextfusion.engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SessionStatistics(
    @JsonProperty("totalSessions")          long totalSessions,
    @JsonProperty("averageFilesPerSession") double averageFilesPerSession,
    @JsonProperty("mostActiveGroup")        String mostActiveGroup,
    @JsonProperty("mostActiveGroupSessions") long mostActiveGroupSessions,
    @JsonProperty("defaultTimeoutSeconds")  int defaultTimeoutSeconds
) {}
