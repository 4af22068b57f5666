package com.ssau.aips.pipeline.model;

import java.util.Arrays;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

// packed BGR, row-major; pixels are copied in and out
@Getter
@ToString(exclude = "pixels")
@EqualsAndHashCode
public final class Frame {

    public static final int CHANNELS = 3;

    // null when the transport addresses frames by session on its own
    private final String sessionId;
    private final int width;
    private final int height;
    private final double captureTimestamp;
    @Getter(lombok.AccessLevel.NONE)
    private final byte[] pixels;

    public Frame(int width, int height, byte[] pixels, double captureTimestamp) {
        this(null, width, height, pixels, captureTimestamp);
    }

    public Frame(String sessionId, int width, int height, byte[] pixels, double captureTimestamp) {
        this.sessionId = sessionId;
        this.width = width;
        this.height = height;
        this.pixels = pixels != null ? pixels.clone() : null;
        this.captureTimestamp = captureTimestamp;
    }

    public byte[] getPixels() {
        return pixels != null ? pixels.clone() : null;
    }

    public int pixelLength() {
        return pixels != null ? pixels.length : 0;
    }

    public int expectedLength() {
        return width * height * CHANNELS;
    }

    public static Frame filled(int width, int height, int value, double captureTimestamp) {
        byte[] data = new byte[width * height * CHANNELS];
        Arrays.fill(data, (byte) value);
        return new Frame(width, height, data, captureTimestamp);
    }
}
