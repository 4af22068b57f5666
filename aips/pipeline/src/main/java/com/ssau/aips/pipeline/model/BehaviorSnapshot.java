package com.ssau.aips.pipeline.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BehaviorSnapshot {

    int repeatedDeviations;
    int repeatedObjects;
    double avgPersonCount;
    double patternScore;
    int windowFrames;
    @Builder.Default
    List<String> findings = List.of();

    public static BehaviorSnapshot empty() {
        return BehaviorSnapshot.builder().build();
    }
}
