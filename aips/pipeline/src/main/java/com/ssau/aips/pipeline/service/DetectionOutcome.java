package com.ssau.aips.pipeline.service;

import java.util.Map;

import com.ssau.aips.pipeline.model.Modality;
import com.ssau.aips.pipeline.model.ObjectSignal;
import com.ssau.aips.pipeline.model.PoseEstimate;

public record DetectionOutcome(PoseEstimate pose, ObjectSignal objects, Map<Modality, String> degraded) {

    public DetectionOutcome {
        degraded = Map.copyOf(degraded);
    }

    public boolean isDegraded(Modality modality) {
        return degraded.containsKey(modality);
    }
}
