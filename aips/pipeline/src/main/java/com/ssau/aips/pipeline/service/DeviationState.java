package com.ssau.aips.pipeline.service;

import lombok.Getter;

import com.ssau.aips.pipeline.model.DeviationPhase;

@Getter
public class DeviationState {

    private DeviationPhase phase = DeviationPhase.NORMAL;
    private double durationAccumulated;
    private double lastFrameAt = Double.NaN;

    double advanceClock(double timestamp) {
        double dt = Double.isNaN(lastFrameAt) ? 0.0 : Math.max(0.0, timestamp - lastFrameAt);
        lastFrameAt = timestamp;
        return dt;
    }

    void accrue(double dt) {
        phase = DeviationPhase.DEVIATING;
        durationAccumulated += dt;
    }

    void decay(double factor) {
        phase = DeviationPhase.NORMAL;
        durationAccumulated *= factor;
    }
}
