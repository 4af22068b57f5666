package com.ssau.aips.pipeline.service;

/**
 * Head orientation in degrees under a fixed convention.
 * <p>
 * Axes are the camera's: X to the image right, Y down, Z into the scene. A
 * rotation is composed as {@code R = Ry(yaw) * Rx(pitch) * Rz(roll)}, so
 * <ul>
 *   <li>positive yaw turns the face toward the image's left edge,</li>
 *   <li>positive pitch tilts the face down,</li>
 *   <li>positive roll tilts the face clockwise as seen in the image.</li>
 * </ul>
 * The identity rotation is a face looking straight into the camera.
 */
public record EulerAngles(double yaw, double pitch, double roll) {

    private static final double GIMBAL_EPSILON = 1e-6;

    public static EulerAngles fromRotationMatrix(double[][] r) {
        double cosPitch = Math.hypot(r[1][0], r[1][1]);
        double pitch = Math.atan2(-r[1][2], cosPitch);
        double yaw;
        double roll;
        if (cosPitch > GIMBAL_EPSILON) {
            yaw = Math.atan2(r[0][2], r[2][2]);
            roll = Math.atan2(r[1][0], r[1][1]);
        } else {
            // pitch at +-90: yaw and roll share an axis, fold it all into yaw
            yaw = Math.atan2(-r[2][0], r[0][0]);
            roll = 0.0;
        }
        return new EulerAngles(Math.toDegrees(yaw), Math.toDegrees(pitch), Math.toDegrees(roll));
    }

    public double[][] toRotationMatrix() {
        double a = Math.toRadians(yaw);
        double b = Math.toRadians(pitch);
        double c = Math.toRadians(roll);
        double ca = Math.cos(a), sa = Math.sin(a);
        double cb = Math.cos(b), sb = Math.sin(b);
        double cc = Math.cos(c), sc = Math.sin(c);
        return new double[][] {
            {ca * cc + sa * sb * sc, -ca * sc + sa * sb * cc, sa * cb},
            {cb * sc, cb * cc, -sb},
            {-sa * cc + ca * sb * sc, sa * sc + ca * sb * cc, ca * cb}
        };
    }
}
