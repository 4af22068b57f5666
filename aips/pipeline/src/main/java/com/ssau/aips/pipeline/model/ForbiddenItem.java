package com.ssau.aips.pipeline.model;

public record ForbiddenItem(String label, double confidence, BoundingBox bbox) {
}
