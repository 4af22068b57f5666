package com.ssau.aips.pipeline.imaging;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_imgproc.CLAHE;

// every method returns a new Mat owned by the caller
public final class OpenCvFilters {

    private OpenCvFilters() {}

    public static Mat blurredGray(Mat bgr, int kernelSize) {
        Mat gray = new Mat();
        opencv_imgproc.cvtColor(bgr, gray, opencv_imgproc.COLOR_BGR2GRAY);
        opencv_imgproc.GaussianBlur(gray, gray, new Size(kernelSize, kernelSize), 0);
        return gray;
    }

    public static double meanAbsoluteDifference(Mat a, Mat b) {
        Mat delta = new Mat();
        try {
            opencv_core.absdiff(a, b, delta);
            return opencv_core.mean(delta).get(0);
        } finally {
            delta.release();
        }
    }

    public static Mat equalizeLuminance(Mat bgr, double clipLimit, int tileGrid) {
        Mat lab = new Mat();
        MatVector channels = new MatVector();
        Mat equalized = new Mat();
        Mat out = new Mat();
        CLAHE clahe = opencv_imgproc.createCLAHE(clipLimit, new Size(tileGrid, tileGrid));
        try {
            opencv_imgproc.cvtColor(bgr, lab, opencv_imgproc.COLOR_BGR2Lab);
            opencv_core.split(lab, channels);
            clahe.apply(channels.get(0), equalized);
            channels.put(0, equalized);
            opencv_core.merge(channels, lab);
            opencv_imgproc.cvtColor(lab, out, opencv_imgproc.COLOR_Lab2BGR);
            return out;
        } finally {
            clahe.close();
            equalized.release();
            channels.close();
            lab.release();
        }
    }

    public static Mat edgePreservingSmooth(Mat bgr, int diameter, double sigmaColor, double sigmaSpace) {
        Mat out = new Mat();
        opencv_imgproc.bilateralFilter(bgr, out, diameter, sigmaColor, sigmaSpace);
        return out;
    }
}
