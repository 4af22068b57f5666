package com.ssau.aips.pipeline.service;

import lombok.extern.slf4j.Slf4j;

import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.model.DeviationPhase;
import com.ssau.aips.pipeline.model.GazeResult;
import com.ssau.aips.pipeline.model.PoseEstimate;

@Slf4j
public class DeviationTracker {

    public GazeResult advance(DeviationState state, PoseEstimate pose, double timestamp, PipelineConfig config) {
        double dt = state.advanceClock(timestamp);

        if (!pose.isFaceDetected()) {
            // a gap, not a normal frame: neither accrue nor decay
            return GazeResult.noFace(state.getPhase(), state.getDurationAccumulated());
        }

        boolean deviating = HeadPoseEstimator.isDeviating(pose, config);
        DeviationPhase before = state.getPhase();
        if (deviating) {
            state.accrue(dt);
        } else {
            state.decay(config.getDecayFactor());
        }
        if (before != state.getPhase()) {
            log.debug("Deviation phase {} -> {} (yaw={}, pitch={}, accumulated={}s)", before, state.getPhase(),
                pose.getYaw(), pose.getPitch(), state.getDurationAccumulated());
        }
        return new GazeResult(pose, deviating, state.getDurationAccumulated(), state.getPhase());
    }
}
