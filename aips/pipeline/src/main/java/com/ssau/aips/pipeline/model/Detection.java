package com.ssau.aips.pipeline.model;

// NMS already applied by the detector
public record Detection(int classId, String className, double confidence, BoundingBox bbox) {
}
