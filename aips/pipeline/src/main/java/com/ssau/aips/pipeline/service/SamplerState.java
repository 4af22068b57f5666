package com.ssau.aips.pipeline.service;

import lombok.Getter;

@Getter
public class SamplerState {

    private byte[] previousGray;
    private int previousWidth;
    private int previousHeight;
    private double lastProcessedAt = Double.NaN;
    private long framesSeen;
    private long framesAdmitted;

    public boolean hasPrevious() {
        return previousGray != null;
    }

    boolean matchesSize(int width, int height) {
        return previousWidth == width && previousHeight == height;
    }

    void countSeen() {
        framesSeen++;
    }

    void admit(byte[] gray, int width, int height, double timestamp) {
        this.previousGray = gray;
        this.previousWidth = width;
        this.previousHeight = height;
        this.lastProcessedAt = timestamp;
        this.framesAdmitted++;
    }

    public double skipRatio() {
        return framesSeen == 0 ? 0.0 : 1.0 - (double) framesAdmitted / framesSeen;
    }
}
