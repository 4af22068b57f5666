package com.ssau.aips.pipeline.model;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(exclude = "pixels")
public final class ProcessedFrame {

    private final int width;
    private final int height;
    private final double captureTimestamp;
    private final RoiWindow roi;
    private final boolean lightingNormalized;
    private final boolean denoised;
    @Getter(lombok.AccessLevel.NONE)
    private final byte[] pixels;

    public ProcessedFrame(byte[] pixels, RoiWindow roi, double captureTimestamp,
                          boolean lightingNormalized, boolean denoised) {
        this.pixels = pixels.clone();
        this.roi = roi;
        this.width = roi.getWidth();
        this.height = roi.getHeight();
        this.captureTimestamp = captureTimestamp;
        this.lightingNormalized = lightingNormalized;
        this.denoised = denoised;
    }

    public byte[] getPixels() {
        return pixels.clone();
    }

    public boolean isPreprocessed() {
        return lightingNormalized || denoised;
    }
}
