package com.ssau.aips.pipeline.model;

public enum ViolationCategory {
    GAZE,
    SUSTAINED_GAZE,
    FORBIDDEN_ITEM,
    MULTIPLE_PERSONS,
    BEHAVIOR_PATTERN
}
