package com.ssau.aips.pipeline.model;

public enum Modality {
    POSE,
    OBJECTS
}
