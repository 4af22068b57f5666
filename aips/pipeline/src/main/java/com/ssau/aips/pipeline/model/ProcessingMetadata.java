package com.ssau.aips.pipeline.model;

import java.time.Instant;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ProcessingMetadata {

    String sessionId;
    double captureTimestamp;
    Instant processedAt;
    boolean frameSkipped;
    double motionScore;
    double preprocessingMs;
    double detectionMs;
    double behaviorMs;
    double scoringMs;
    double totalMs;
    boolean preprocessingApplied;
    boolean roiApplied;
    @Builder.Default
    Map<Modality, String> degradedModalities = Map.of();

    public boolean isDegraded(Modality modality) {
        return degradedModalities.containsKey(modality);
    }

    public boolean isDegraded() {
        return !degradedModalities.isEmpty();
    }
}
