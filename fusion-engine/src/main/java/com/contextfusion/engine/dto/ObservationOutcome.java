package com.contextfusion.engine.dto;

import com.contextfusion.common.model.DetectionResult;
import com.contextfusion.common.model.SignalSource;
import com.contextfusion.common.trace.ObservationScope;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * What the service concluded about one observed file.
 *
 * @param observedAt     when the file was observed; the request's timestamp or the server clock
 * @param burst          true when the file arrived as part of a download burst
 * @param burstFileCount files retained by the burst detector after recording this one
 * @param sessionId      session the file was recorded in; {@code null} for Unsorted files
 */
public record ObservationOutcome(
    @JsonProperty("observationId")   String observationId,
    @JsonProperty("fileName")        String fileName,
    @JsonProperty("observedAt")      Instant observedAt,
    @JsonProperty("detectedContext") String detectedContext,
    @JsonProperty("confidence")      double confidence,
    @JsonProperty("burst")           boolean burst,
    @JsonProperty("burstFileCount")  int burstFileCount,
    @JsonProperty("sessionId")       String sessionId,
    @JsonProperty("boostApplied")    boolean boostApplied,
    @JsonProperty("boostReason")     String boostReason,
    @JsonProperty("signalBreakdown") Map<SignalSource, Double> signalBreakdown
) {

    public static ObservationOutcome of(ObservationScope scope, DetectionResult result,
                                        boolean burst, int burstFileCount, String sessionId) {
        return new ObservationOutcome(scope.observationId(), scope.fileName(), scope.observedAt(),
                                      result.detectedContext(), result.overallConfidence(),
                                      burst, burstFileCount, sessionId, result.boostApplied(), result.boostReason(),
                                      result.signalBreakdown());
    }
}
