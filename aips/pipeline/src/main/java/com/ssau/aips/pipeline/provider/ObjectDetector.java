package com.ssau.aips.pipeline.provider;

import java.util.List;

import com.ssau.aips.pipeline.model.Detection;
import com.ssau.aips.pipeline.model.ProcessedFrame;

/**
 * Object detector returning boxes in pixel coordinates of the given frame.
 * Same threading and interruption contract as {@link LandmarkProvider}.
 */
@FunctionalInterface
public interface ObjectDetector {

    List<Detection> detect(ProcessedFrame frame) throws Exception;
}
