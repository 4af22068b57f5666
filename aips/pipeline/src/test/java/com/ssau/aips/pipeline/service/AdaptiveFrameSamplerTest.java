package com.ssau.aips.pipeline.service;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.model.Frame;

class AdaptiveFrameSamplerTest {

    private final AdaptiveFrameSampler sampler = new AdaptiveFrameSampler();
    private final PipelineConfig config = PipelineConfig.defaults();

    @Test
    void testFirstFrameAlwaysAdmitted() {
        SamplerState state = new SamplerState();

        AdmissionDecision decision = sampler.decide(Frame.filled(64, 48, 100, 0.0), state, config);

        assertTrue(decision.admit());
        assertEquals(AdmissionDecision.Reason.FIRST_FRAME, decision.reason());
        assertEquals(0.0, decision.motionScore(), 1e-9);
        assertTrue(state.hasPrevious());
    }

    @Test
    void testStaticSceneSkippedUntilRateFloor() {
        SamplerState state = new SamplerState();
        sampler.decide(Frame.filled(64, 48, 100, 0.0), state, config);

        AdmissionDecision early = sampler.decide(Frame.filled(64, 48, 100, 0.2), state, config);
        AdmissionDecision floor = sampler.decide(Frame.filled(64, 48, 100, 0.5), state, config);

        assertFalse(early.admit());
        assertEquals(0.0, early.motionScore(), 1e-9);
        assertTrue(floor.admit());
        assertEquals(AdmissionDecision.Reason.RATE_FLOOR, floor.reason());
        assertEquals(0.5, state.getLastProcessedAt(), 1e-9);
    }

    @Test
    void testMotionAdmitsOnceMinIntervalPassed() {
        SamplerState state = new SamplerState();
        sampler.decide(Frame.filled(64, 48, 100, 0.0), state, config);

        AdmissionDecision tooSoon = sampler.decide(Frame.filled(64, 48, 150, 0.05), state, config);
        AdmissionDecision moved = sampler.decide(Frame.filled(64, 48, 150, 0.1), state, config);

        assertFalse(tooSoon.admit());
        assertEquals(50.0, tooSoon.motionScore(), 1e-6);
        assertTrue(moved.admit());
        assertEquals(AdmissionDecision.Reason.MOTION, moved.reason());
    }

    @Test
    void testSkipLeavesReferenceFrameUntouched() {
        SamplerState state = new SamplerState();
        sampler.decide(Frame.filled(64, 48, 100, 0.0), state, config);
        sampler.decide(Frame.filled(64, 48, 105, 0.2), state, config);

        AdmissionDecision next = sampler.decide(Frame.filled(64, 48, 105, 0.3), state, config);

        // compared against the admitted 100 frame, not the skipped 105 one
        assertEquals(5.0, next.motionScore(), 1e-6);
        assertEquals(0.0, state.getLastProcessedAt(), 1e-9);
        assertEquals(3, state.getFramesSeen());
        assertEquals(1, state.getFramesAdmitted());
    }

    @Test
    void testDisabledSamplingAdmitsEverything() {
        SamplerState state = new SamplerState();
        PipelineConfig off = config.toBuilder().enableAdaptiveSampling(false).build();

        for (int i = 0; i < 5; i++) {
            assertTrue(sampler.decide(Frame.filled(64, 48, 100, i * 0.01), state, off).admit());
        }
        assertEquals(0.0, state.skipRatio(), 1e-9);
    }

    @Test
    void testResolutionChangeRestartsReference() {
        SamplerState state = new SamplerState();
        sampler.decide(Frame.filled(64, 48, 100, 0.0), state, config);

        AdmissionDecision decision = sampler.decide(Frame.filled(32, 24, 100, 0.01), state, config);

        assertTrue(decision.admit());
        assertEquals(AdmissionDecision.Reason.FIRST_FRAME, decision.reason());
    }
}
