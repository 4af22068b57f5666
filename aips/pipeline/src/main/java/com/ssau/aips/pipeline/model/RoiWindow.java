package com.ssau.aips.pipeline.model;

import lombok.Value;

@Value
public class RoiWindow {

    int fullWidth;
    int fullHeight;
    int offsetX;
    int offsetY;
    int width;
    int height;

    public static RoiWindow full(int width, int height) {
        return new RoiWindow(width, height, 0, 0, width, height);
    }

    public static RoiWindow topFraction(int width, int height, double ratio) {
        int roiHeight = Math.max(1, Math.min(height, (int) (height * ratio)));
        return new RoiWindow(width, height, 0, 0, width, roiHeight);
    }

    public boolean isCropped() {
        return width != fullWidth || height != fullHeight;
    }

    public double heightRatio() {
        return (double) height / fullHeight;
    }

    public Point2 toFullFramePixels(Point2 normalized) {
        return new Point2(offsetX + normalized.x() * width, offsetY + normalized.y() * height);
    }

    public BoundingBox toFullFrame(BoundingBox box) {
        if (offsetX == 0 && offsetY == 0) {
            return box;
        }
        return box.translate(offsetX, offsetY);
    }
}
