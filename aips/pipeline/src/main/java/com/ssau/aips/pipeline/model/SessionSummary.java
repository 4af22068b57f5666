package com.ssau.aips.pipeline.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SessionSummary {

    String sessionId;
    long framesReceived;
    long framesProcessed;
    long framesSkipped;
    long framesDegraded;
    double skipRatio;
    double avgProcessingMs;
    BehaviorSnapshot behavior;
}
