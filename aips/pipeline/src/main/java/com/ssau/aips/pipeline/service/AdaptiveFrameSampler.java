package com.ssau.aips.pipeline.service;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;

import lombok.extern.slf4j.Slf4j;

import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.imaging.Mats;
import com.ssau.aips.pipeline.imaging.OpenCvFilters;
import com.ssau.aips.pipeline.model.Frame;

@Slf4j
public class AdaptiveFrameSampler {

    // absorbs rounding in timestamp subtraction (0.3 - 0.2 < 0.1)
    private static final double INTERVAL_EPSILON = 1e-9;

    public AdmissionDecision decide(Frame frame, SamplerState state, PipelineConfig config) {
        state.countSeen();
        double now = frame.getCaptureTimestamp();

        Mat bgr = Mats.fromFrame(frame);
        Mat gray = OpenCvFilters.blurredGray(bgr, config.getMotionBlurKernel());
        bgr.release();
        try {
            if (!state.hasPrevious() || !state.matchesSize(frame.getWidth(), frame.getHeight())) {
                admit(state, gray, frame, now);
                return new AdmissionDecision(true, 0.0, AdmissionDecision.Reason.FIRST_FRAME);
            }

            double motionScore = motionScore(state, gray);

            if (!config.isEnableAdaptiveSampling()) {
                admit(state, gray, frame, now);
                return new AdmissionDecision(true, motionScore, AdmissionDecision.Reason.SAMPLING_DISABLED);
            }

            double elapsed = now - state.getLastProcessedAt() + INTERVAL_EPSILON;
            AdmissionDecision.Reason reason;
            if (motionScore > config.getMotionThreshold() && elapsed >= config.minInterval()) {
                reason = AdmissionDecision.Reason.MOTION;
            } else if (elapsed >= config.maxInterval()) {
                reason = AdmissionDecision.Reason.RATE_FLOOR;
            } else {
                log.trace("Skipping frame at {} (motion={}, elapsed={})", now, motionScore, elapsed);
                return new AdmissionDecision(false, motionScore, AdmissionDecision.Reason.SKIPPED);
            }

            admit(state, gray, frame, now);
            return new AdmissionDecision(true, motionScore, reason);
        } finally {
            gray.release();
        }
    }

    private static double motionScore(SamplerState state, Mat gray) {
        Mat previous = Mats.fromBytes(state.getPreviousGray(), gray.rows(), gray.cols(), opencv_core.CV_8UC1);
        try {
            return OpenCvFilters.meanAbsoluteDifference(previous, gray);
        } finally {
            previous.release();
        }
    }

    private static void admit(SamplerState state, Mat gray, Frame frame, double now) {
        state.admit(Mats.toBytes(gray), frame.getWidth(), frame.getHeight(), now);
    }
}
