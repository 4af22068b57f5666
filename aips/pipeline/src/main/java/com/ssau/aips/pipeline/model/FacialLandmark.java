package com.ssau.aips.pipeline.model;

// canonical face model in millimetres, camera axes, nose tip at the origin; left/right as in the image
public enum FacialLandmark {
    NOSE_TIP(0.0, 0.0, 0.0),
    CHIN(0.0, 63.6, 12.5),
    LEFT_EYE_OUTER(-43.3, -32.7, 26.0),
    RIGHT_EYE_OUTER(43.3, -32.7, 26.0),
    LEFT_MOUTH_CORNER(-28.9, 28.9, 24.1),
    RIGHT_MOUTH_CORNER(28.9, 28.9, 24.1);

    private final double modelX;
    private final double modelY;
    private final double modelZ;

    FacialLandmark(double modelX, double modelY, double modelZ) {
        this.modelX = modelX;
        this.modelY = modelY;
        this.modelZ = modelZ;
    }

    public double modelX() {
        return modelX;
    }

    public double modelY() {
        return modelY;
    }

    public double modelZ() {
        return modelZ;
    }
}
