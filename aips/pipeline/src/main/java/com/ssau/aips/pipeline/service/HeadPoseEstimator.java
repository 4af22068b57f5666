package com.ssau.aips.pipeline.service;

import org.bytedeco.javacpp.Loader;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.global.opencv_calib3d;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;

import lombok.extern.slf4j.Slf4j;

import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.model.FaceLandmarks;
import com.ssau.aips.pipeline.model.FacialLandmark;
import com.ssau.aips.pipeline.model.Point2;
import com.ssau.aips.pipeline.model.PoseEstimate;
import com.ssau.aips.pipeline.model.RoiWindow;

// pinhole camera: focal = frame width, principal point at the centre, no distortion
@Slf4j
public class HeadPoseEstimator {

    private static final FacialLandmark[] LANDMARKS = FacialLandmark.values();

    public HeadPoseEstimator() {
        // natives must not load on a detection worker: a timeout interrupts the load for good
        Loader.load(opencv_calib3d.class);
    }

    public PoseEstimate estimate(FaceLandmarks landmarks, RoiWindow roi) {
        if (landmarks == null) {
            return PoseEstimate.noFace();
        }
        if (!landmarks.isComplete()) {
            log.debug("Only {} of {} pose landmarks present, treating as no face",
                landmarks.getPoints().size(), LANDMARKS.length);
            return PoseEstimate.noFace();
        }

        double[][] rotation = solveRotation(landmarks, roi);
        if (rotation == null) {
            return PoseEstimate.builder()
                .faceDetected(true)
                .landmarksCount(landmarks.getTotalLandmarks())
                .build();
        }

        EulerAngles angles = EulerAngles.fromRotationMatrix(rotation);
        return PoseEstimate.builder()
            .yaw(angles.yaw())
            .pitch(angles.pitch())
            .roll(angles.roll())
            .landmarksCount(landmarks.getTotalLandmarks())
            .confidence(landmarks.getConfidence())
            .faceDetected(true)
            .build();
    }

    public static boolean isDeviating(PoseEstimate pose, PipelineConfig config) {
        return pose.isFaceDetected()
            && (Math.abs(pose.getYaw()) > config.getYawThreshold()
                || Math.abs(pose.getPitch()) > config.getPitchThreshold());
    }

    private double[][] solveRotation(FaceLandmarks landmarks, RoiWindow roi) {
        Mat objectPoints = new Mat(LANDMARKS.length, 3, opencv_core.CV_64F);
        Mat imagePoints = new Mat(LANDMARKS.length, 2, opencv_core.CV_64F);
        Mat cameraMatrix = new Mat(3, 3, opencv_core.CV_64F);
        Mat distCoeffs = new Mat(4, 1, opencv_core.CV_64F);
        Mat rvec = new Mat();
        Mat tvec = new Mat();
        Mat rmat = new Mat();
        try {
            try (DoubleIndexer model = objectPoints.createIndexer();
                 DoubleIndexer image = imagePoints.createIndexer()) {
                for (int i = 0; i < LANDMARKS.length; i++) {
                    FacialLandmark landmark = LANDMARKS[i];
                    Point2 pixel = roi.toFullFramePixels(landmarks.get(landmark));
                    model.put(i, 0, landmark.modelX());
                    model.put(i, 1, landmark.modelY());
                    model.put(i, 2, landmark.modelZ());
                    image.put(i, 0, pixel.x());
                    image.put(i, 1, pixel.y());
                }
            }

            double focal = roi.getFullWidth();
            try (DoubleIndexer k = cameraMatrix.createIndexer();
                 DoubleIndexer dist = distCoeffs.createIndexer()) {
                for (int i = 0; i < 3; i++) {
                    for (int j = 0; j < 3; j++) {
                        k.put(i, j, 0.0);
                    }
                }
                k.put(0, 0, focal);
                k.put(1, 1, focal);
                k.put(0, 2, roi.getFullWidth() / 2.0);
                k.put(1, 2, roi.getFullHeight() / 2.0);
                k.put(2, 2, 1.0);
                for (int i = 0; i < 4; i++) {
                    dist.put(i, 0, 0.0);
                }
            }

            boolean solved = opencv_calib3d.solvePnP(objectPoints, imagePoints, cameraMatrix, distCoeffs,
                rvec, tvec, false, opencv_calib3d.SOLVEPNP_ITERATIVE);
            if (!solved) {
                log.debug("solvePnP did not converge");
                return null;
            }

            opencv_calib3d.Rodrigues(rvec, rmat);
            double[][] rotation = new double[3][3];
            try (DoubleIndexer r = rmat.createIndexer()) {
                for (int i = 0; i < 3; i++) {
                    for (int j = 0; j < 3; j++) {
                        rotation[i][j] = r.get(i, j);
                    }
                }
            }
            return rotation;
        } catch (RuntimeException e) {
            log.debug("Head pose solve failed: {}", e.getMessage());
            return null;

        } finally {
            objectPoints.release();
            imagePoints.release();
            cameraMatrix.release();
            distCoeffs.release();
            rvec.release();
            tvec.release();
            rmat.release();
        }
    }
}
