package com.ssau.aips.pipeline.model;

public record Point2(double x, double y) {
}
