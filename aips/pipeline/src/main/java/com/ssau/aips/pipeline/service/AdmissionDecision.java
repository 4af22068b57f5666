package com.ssau.aips.pipeline.service;

public record AdmissionDecision(boolean admit, double motionScore, Reason reason) {

    public enum Reason {
        FIRST_FRAME,
        SAMPLING_DISABLED,
        MOTION,
        RATE_FLOOR,
        SKIPPED
    }
}
