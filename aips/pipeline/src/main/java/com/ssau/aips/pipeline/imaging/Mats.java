package com.ssau.aips.pipeline.imaging;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;

import com.ssau.aips.pipeline.model.Frame;
import com.ssau.aips.pipeline.model.RoiWindow;

public final class Mats {

    private Mats() {}

    public static Mat fromFrame(Frame frame) {
        return fromBytes(frame.getPixels(), frame.getHeight(), frame.getWidth(), opencv_core.CV_8UC3);
    }

    public static Mat fromBytes(byte[] data, int rows, int cols, int type) {
        Mat mat = new Mat(rows, cols, type);
        mat.data().put(data);
        return mat;
    }

    public static byte[] toBytes(Mat mat) {
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        try {
            byte[] data = new byte[(int) (continuous.total() * continuous.channels())];
            continuous.data().get(data);
            return data;
        } finally {
            if (continuous != mat) {
                continuous.release();
            }
        }
    }

    public static Mat crop(Mat source, RoiWindow roi) {
        if (!roi.isCropped()) {
            return source;
        }
        Mat view = new Mat(source, new Rect(roi.getOffsetX(), roi.getOffsetY(), roi.getWidth(), roi.getHeight()));
        Mat copy = view.clone();
        view.release();
        return copy;
    }
}
