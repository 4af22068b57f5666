package com.ssau.aips.pipeline.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PipelineResult {

    GazeResult gaze;
    ObjectSignal objects;
    BehaviorSnapshot behavior;
    RiskAssessment risk;
    ProcessingMetadata metadata;

    public PipelineResult asSkipped(double motionScore) {
        return toBuilder()
            .metadata(metadata.toBuilder()
                .frameSkipped(true)
                .motionScore(motionScore)
                .build())
            .build();
    }

    public boolean isFrameSkipped() {
        return metadata.isFrameSkipped();
    }
}
