package com.ssau.aips.pipeline.session;

import java.util.concurrent.locks.ReentrantLock;

import lombok.Getter;
import lombok.Setter;

import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.model.PipelineResult;
import com.ssau.aips.pipeline.service.BehaviorWindowState;
import com.ssau.aips.pipeline.service.DetectionCoordinator;
import com.ssau.aips.pipeline.service.DeviationState;
import com.ssau.aips.pipeline.service.SamplerState;

// mutable fields are guarded by lock(), except closed and inFlight
@Getter
public class SessionState {

    private final String sessionId;
    private final PipelineConfig config;
    @Getter(lombok.AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    private final SamplerState sampler = new SamplerState();
    private final DeviationState deviation = new DeviationState();
    private final BehaviorWindowState window = new BehaviorWindowState();

    @Setter
    private PipelineResult lastResult;
    @Setter
    private volatile DetectionCoordinator.FanOut inFlight;
    private volatile boolean closed;

    private long framesReceived;
    private long framesProcessed;
    private long framesSkipped;
    private long framesDegraded;
    private double totalProcessingMs;

    public SessionState(String sessionId, PipelineConfig config) {
        this.sessionId = sessionId;
        this.config = config;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public void close() {
        closed = true;
        DetectionCoordinator.FanOut running = inFlight;
        if (running != null) {
            running.cancel();
        }
    }

    public void countReceived() {
        framesReceived++;
    }

    public void countSkipped() {
        framesSkipped++;
    }

    public void countProcessed(double totalMs, boolean degraded) {
        framesProcessed++;
        totalProcessingMs += totalMs;
        if (degraded) {
            framesDegraded++;
        }
    }

    public double avgProcessingMs() {
        return framesProcessed == 0 ? 0.0 : totalProcessingMs / framesProcessed;
    }
}
