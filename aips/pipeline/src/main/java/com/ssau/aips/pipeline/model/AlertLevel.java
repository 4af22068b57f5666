package com.ssau.aips.pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
