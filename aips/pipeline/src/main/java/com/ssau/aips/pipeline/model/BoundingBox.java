package com.ssau.aips.pipeline.model;

public record BoundingBox(double x1, double y1, double x2, double y2) {

    public BoundingBox translate(double dx, double dy) {
        return new BoundingBox(x1 + dx, y1 + dy, x2 + dx, y2 + dy);
    }

    public double width() {
        return x2 - x1;
    }

    public double height() {
        return y2 - y1;
    }
}
