package com.ssau.aips.pipeline.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PoseEstimate {

    private static final PoseEstimate NO_FACE = PoseEstimate.builder().build();

    double yaw;
    double pitch;
    double roll;
    int landmarksCount;
    double confidence;
    boolean faceDetected;

    public static PoseEstimate noFace() {
        return NO_FACE;
    }
}
