package com.ssau.aips.pipeline.service;

import org.bytedeco.opencv.opencv_core.Mat;

import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.imaging.Mats;
import com.ssau.aips.pipeline.imaging.OpenCvFilters;
import com.ssau.aips.pipeline.model.Frame;
import com.ssau.aips.pipeline.model.ProcessedFrame;
import com.ssau.aips.pipeline.model.RoiWindow;

public class Preprocessor {

    public ProcessedFrame apply(Frame frame, PipelineConfig config) {
        RoiWindow roi = config.isEnableRoi()
            ? RoiWindow.topFraction(frame.getWidth(), frame.getHeight(), config.getRoiRatio())
            : RoiWindow.full(frame.getWidth(), frame.getHeight());

        boolean normalize = config.isEnablePreprocessing() && config.isEnableLightingNormalization();
        boolean denoise = config.isEnablePreprocessing() && config.isEnableDenoise();

        if (!roi.isCropped() && !normalize && !denoise) {
            return new ProcessedFrame(frame.getPixels(), roi, frame.getCaptureTimestamp(), false, false);
        }

        Mat source = Mats.fromFrame(frame);
        Mat current = Mats.crop(source, roi);
        try {
            if (normalize) {
                current = replace(current, source,
                    OpenCvFilters.equalizeLuminance(current, config.getClaheClipLimit(), config.getClaheTileGrid()));
            }
            if (denoise) {
                current = replace(current, source,
                    OpenCvFilters.edgePreservingSmooth(current, config.getBilateralDiameter(),
                        config.getBilateralSigmaColor(), config.getBilateralSigmaSpace()));
            }
            return new ProcessedFrame(Mats.toBytes(current), roi, frame.getCaptureTimestamp(), normalize, denoise);
        } finally {
            if (current != source) {
                current.release();
            }
            source.release();
        }
    }

    private static Mat replace(Mat previous, Mat source, Mat next) {
        if (previous != source) {
            previous.release();
        }
        return next;
    }
}
