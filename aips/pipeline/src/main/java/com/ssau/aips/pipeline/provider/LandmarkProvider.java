package com.ssau.aips.pipeline.provider;

import java.util.Optional;

import com.ssau.aips.pipeline.model.FaceLandmarks;
import com.ssau.aips.pipeline.model.ProcessedFrame;

/**
 * Facial landmark extractor. Runs on a detection worker thread and may block;
 * implementations must give up promptly when the thread is interrupted, which
 * is how a timed-out or cancelled call is abandoned.
 */
@FunctionalInterface
public interface LandmarkProvider {

    /**
     * @return landmarks normalized to the given frame, or empty when no face is visible
     */
    Optional<FaceLandmarks> locate(ProcessedFrame frame) throws Exception;
}
