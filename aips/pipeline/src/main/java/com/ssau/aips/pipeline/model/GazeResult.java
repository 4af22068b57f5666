package com.ssau.aips.pipeline.model;

import lombok.Value;

@Value
public class GazeResult {

    PoseEstimate pose;
    boolean deviation;
    double deviationDuration;
    DeviationPhase phase;

    public static GazeResult noFace(DeviationPhase phase, double deviationDuration) {
        return new GazeResult(PoseEstimate.noFace(), false, deviationDuration, phase);
    }
}
