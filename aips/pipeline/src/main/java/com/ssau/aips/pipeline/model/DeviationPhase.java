package com.ssau.aips.pipeline.model;

public enum DeviationPhase {
    NORMAL,
    DEVIATING
}
