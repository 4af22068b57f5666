package com.ssau.aips.pipeline.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public final class FaceLandmarks {

    private final Map<FacialLandmark, Point2> points;
    private final int totalLandmarks;
    private final double confidence;

    public FaceLandmarks(Map<FacialLandmark, Point2> points, int totalLandmarks, double confidence) {
        EnumMap<FacialLandmark, Point2> copy = new EnumMap<>(FacialLandmark.class);
        copy.putAll(points);
        this.points = Collections.unmodifiableMap(copy);
        this.totalLandmarks = Math.max(totalLandmarks, copy.size());
        this.confidence = confidence;
    }

    public boolean isComplete() {
        return points.size() == FacialLandmark.values().length;
    }

    public Point2 get(FacialLandmark landmark) {
        return points.get(landmark);
    }
}
