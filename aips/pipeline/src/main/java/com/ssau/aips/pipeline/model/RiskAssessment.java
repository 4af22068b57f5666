package com.ssau.aips.pipeline.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RiskAssessment {

    private static final RiskAssessment NONE = RiskAssessment.builder()
        .riskScore(0)
        .violations(List.of())
        .alertLevel(AlertLevel.NONE)
        .recommendations(List.of())
        .details(Map.of())
        .categories(Set.of())
        .build();

    int riskScore;
    List<String> violations;
    AlertLevel alertLevel;
    List<String> recommendations;
    Map<String, Integer> details;
    Set<ViolationCategory> categories;

    public static RiskAssessment none() {
        return NONE;
    }
}
