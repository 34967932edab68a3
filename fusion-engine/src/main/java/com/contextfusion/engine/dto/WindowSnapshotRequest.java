package com.contextfusion.engine.dto;

import com.contextfusion.common.model.WindowInfo;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record WindowSnapshotRequest(
    @JsonProperty("foregroundTitle")   String foregroundTitle,
    @JsonProperty("foregroundProcess") String foregroundProcess,
    @JsonProperty("windows")           List<WindowInfo> windows
) {}
