package com.ssau.aips.pipeline;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.exception.FrameCancelledException;
import com.ssau.aips.pipeline.exception.FrameProcessingException;
import com.ssau.aips.pipeline.exception.FrameRejectedException;
import com.ssau.aips.pipeline.exception.ProctoringException;
import com.ssau.aips.pipeline.exception.UnknownSessionException;
import com.ssau.aips.pipeline.model.BehaviorRecord;
import com.ssau.aips.pipeline.model.BehaviorSnapshot;
import com.ssau.aips.pipeline.model.DeviationPhase;
import com.ssau.aips.pipeline.model.ForbiddenItem;
import com.ssau.aips.pipeline.model.Frame;
import com.ssau.aips.pipeline.model.GazeResult;
import com.ssau.aips.pipeline.model.ObjectSignal;
import com.ssau.aips.pipeline.model.PipelineResult;
import com.ssau.aips.pipeline.model.ProcessedFrame;
import com.ssau.aips.pipeline.model.ProcessingMetadata;
import com.ssau.aips.pipeline.model.RiskAssessment;
import com.ssau.aips.pipeline.model.SessionSummary;
import com.ssau.aips.pipeline.provider.LandmarkProvider;
import com.ssau.aips.pipeline.provider.ObjectDetector;
import com.ssau.aips.pipeline.service.AdaptiveFrameSampler;
import com.ssau.aips.pipeline.service.AdmissionDecision;
import com.ssau.aips.pipeline.service.BehaviorWindow;
import com.ssau.aips.pipeline.service.DetectionCoordinator;
import com.ssau.aips.pipeline.service.DetectionOutcome;
import com.ssau.aips.pipeline.service.DeviationTracker;
import com.ssau.aips.pipeline.service.Preprocessor;
import com.ssau.aips.pipeline.service.RiskScorer;
import com.ssau.aips.pipeline.session.SessionRegistry;
import com.ssau.aips.pipeline.session.SessionState;
import com.ssau.aips.pipeline.utils.ConfigLoader;

@Slf4j
public class PipelineOrchestrator implements Closeable {

    private final PipelineConfig defaults;
    private final SessionRegistry sessions = new SessionRegistry();
    private final AdaptiveFrameSampler sampler = new AdaptiveFrameSampler();
    private final Preprocessor preprocessor = new Preprocessor();
    private final DetectionCoordinator coordinator;
    private final DeviationTracker deviationTracker = new DeviationTracker();
    private final BehaviorWindow behaviorWindow = new BehaviorWindow();
    private final RiskScorer riskScorer = new RiskScorer();

    public PipelineOrchestrator(LandmarkProvider landmarkProvider, ObjectDetector objectDetector) {
        this(landmarkProvider, objectDetector, PipelineConfig.defaults());
    }

    public PipelineOrchestrator(LandmarkProvider landmarkProvider, ObjectDetector objectDetector,
                                PipelineConfig defaults) {
        this(new DetectionCoordinator(landmarkProvider, objectDetector), defaults);
    }

    public PipelineOrchestrator(DetectionCoordinator coordinator, PipelineConfig defaults) {
        this.coordinator = coordinator;
        this.defaults = defaults.validate();
    }

    public static PipelineOrchestrator create(LandmarkProvider landmarkProvider,
                                              ObjectDetector objectDetector) throws IOException {
        return new PipelineOrchestrator(landmarkProvider, objectDetector, ConfigLoader.loadDefault());
    }

    public PipelineConfig getDefaults() {
        return defaults;
    }

    public void startSession(String sessionId) {
        startSession(sessionId, defaults);
    }

    public void startSession(String sessionId, PipelineConfig config) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id must not be blank");
        }
        sessions.open(sessionId, config.validate());
        log.info("Session {} started (window={}, sampling={}, roi={})", sessionId,
            config.getWindowSize(), config.isEnableAdaptiveSampling(), config.isEnableRoi());
    }

    public void endSession(String sessionId) {
        SessionState session = sessions.remove(sessionId);
        session.close();
        log.info("Session {} ended: received={}, processed={}, skipped={}", sessionId,
            session.getFramesReceived(), session.getFramesProcessed(), session.getFramesSkipped());
    }

    public boolean isActive(String sessionId) {
        return sessions.isActive(sessionId);
    }

    public SessionSummary sessionSummary(String sessionId) {
        SessionState session = sessions.require(sessionId);
        ReentrantLock lock = session.lock();
        lock.lock();
        try {
            long received = session.getFramesReceived();
            return SessionSummary.builder()
                .sessionId(sessionId)
                .framesReceived(received)
                .framesProcessed(session.getFramesProcessed())
                .framesSkipped(session.getFramesSkipped())
                .framesDegraded(session.getFramesDegraded())
                .skipRatio(received == 0 ? 0.0 : (double) session.getFramesSkipped() / received)
                .avgProcessingMs(session.avgProcessingMs())
                .behavior(behaviorWindow.snapshot(session.getWindow(), session.getConfig().getWindowSize()))
                .build();
        } finally {
            lock.unlock();
        }
    }

    public PipelineResult process(String sessionId, Frame frame) {
        return process(sessionId, frame, null);
    }

    public PipelineResult process(String sessionId, Frame frame, PipelineConfig config) {
        rejectMalformed(sessionId, frame);
        SessionState session = sessions.require(sessionId);
        PipelineConfig effective = config != null ? config.validate() : session.getConfig();

        ReentrantLock lock = session.lock();
        lock.lock();
        try {
            if (session.isClosed()) {
                throw new UnknownSessionException(sessionId);
            }
            session.countReceived();
            return runPipeline(session, frame, effective);
        } catch (ProctoringException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Frame at {} failed for session {}", frame.getCaptureTimestamp(), sessionId, e);
            throw new FrameProcessingException(sessionId, "Frame processing failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private PipelineResult runPipeline(SessionState session, Frame frame, PipelineConfig config) {
        String sessionId = session.getSessionId();
        long start = System.nanoTime();

        AdmissionDecision decision = sampler.decide(frame, session.getSampler(), config);
        if (!decision.admit()) {
            session.countSkipped();
            PipelineResult last = session.getLastResult();
            if (last == null) {
                last = idleResult(sessionId, frame);
            }
            return last.asSkipped(decision.motionScore());
        }

        long t0 = System.nanoTime();
        ProcessedFrame processed = preprocessor.apply(frame, config);
        double preprocessingMs = millisSince(t0);

        long t1 = System.nanoTime();
        DetectionOutcome outcome = detect(session, processed, config);
        double detectionMs = millisSince(t1);
        if (!outcome.degraded().isEmpty()) {
            log.warn("Session {} frame at {} degraded: {}", sessionId, frame.getCaptureTimestamp(),
                outcome.degraded());
        }

        long t2 = System.nanoTime();
        GazeResult gaze = deviationTracker.advance(session.getDeviation(), outcome.pose(),
            frame.getCaptureTimestamp(), config);
        ObjectSignal objects = outcome.objects();
        List<String> labels = objects.getForbiddenItems().stream()
            .map(ForbiddenItem::label)
            .collect(Collectors.toList());
        BehaviorRecord record = new BehaviorRecord(frame.getCaptureTimestamp(), gaze.isDeviation(), labels,
            objects.getPersonCount());
        BehaviorSnapshot behavior = behaviorWindow.update(session.getWindow(), record, config.getWindowSize());
        double behaviorMs = millisSince(t2);

        long t3 = System.nanoTime();
        RiskAssessment risk = riskScorer.score(gaze, objects, behavior, config.getScoring());
        double scoringMs = millisSince(t3);

        double totalMs = millisSince(start);
        ProcessingMetadata metadata = ProcessingMetadata.builder()
            .sessionId(sessionId)
            .captureTimestamp(frame.getCaptureTimestamp())
            .processedAt(Instant.now())
            .frameSkipped(false)
            .motionScore(decision.motionScore())
            .preprocessingMs(preprocessingMs)
            .detectionMs(detectionMs)
            .behaviorMs(behaviorMs)
            .scoringMs(scoringMs)
            .totalMs(totalMs)
            .preprocessingApplied(processed.isPreprocessed())
            .roiApplied(processed.getRoi().isCropped())
            .degradedModalities(outcome.degraded())
            .build();

        PipelineResult result = PipelineResult.builder()
            .gaze(gaze)
            .objects(objects)
            .behavior(behavior)
            .risk(risk)
            .metadata(metadata)
            .build();
        session.setLastResult(result);
        session.countProcessed(totalMs, metadata.isDegraded());

        log.debug("Session {} frame at {} admitted ({}): score={}, alert={}, total={}ms", sessionId,
            frame.getCaptureTimestamp(), decision.reason(), risk.getRiskScore(), risk.getAlertLevel(),
            String.format("%.1f", totalMs));
        return result;
    }

    private DetectionOutcome detect(SessionState session, ProcessedFrame processed, PipelineConfig config) {
        DetectionCoordinator.FanOut fanOut = coordinator.start(processed, config);
        session.setInFlight(fanOut);
        try {
            // endSession may have run before inFlight was published
            if (session.isClosed()) {
                fanOut.cancel();
            }
            DetectionOutcome outcome = fanOut.await(Duration.ofMillis(config.getTimeoutMs()));
            if (session.isClosed()) {
                throw new FrameCancelledException(session.getSessionId());
            }
            return outcome;
        } catch (CancellationException e) {
            throw new FrameCancelledException(session.getSessionId());
        } finally {
            session.setInFlight(null);
        }
    }

    private static PipelineResult idleResult(String sessionId, Frame frame) {
        return PipelineResult.builder()
            .gaze(GazeResult.noFace(DeviationPhase.NORMAL, 0.0))
            .objects(ObjectSignal.empty())
            .behavior(BehaviorSnapshot.empty())
            .risk(RiskAssessment.none())
            .metadata(ProcessingMetadata.builder()
                .sessionId(sessionId)
                .captureTimestamp(frame.getCaptureTimestamp())
                .processedAt(Instant.now())
                .build())
            .build();
    }

    private static void rejectMalformed(String sessionId, Frame frame) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new FrameRejectedException(sessionId, "blank session id");
        }
        if (frame == null) {
            throw new FrameRejectedException(sessionId, "missing frame");
        }
        if (frame.getSessionId() != null && !frame.getSessionId().equals(sessionId)) {
            throw new FrameRejectedException(sessionId, "frame belongs to session " + frame.getSessionId());
        }
        if (frame.getWidth() <= 0 || frame.getHeight() <= 0) {
            throw new FrameRejectedException(sessionId,
                "non-positive dimensions " + frame.getWidth() + "x" + frame.getHeight());
        }
        if (frame.pixelLength() == 0) {
            throw new FrameRejectedException(sessionId, "empty pixel buffer");
        }
        long expected = (long) frame.getWidth() * frame.getHeight() * Frame.CHANNELS;
        if (frame.pixelLength() != expected) {
            throw new FrameRejectedException(sessionId,
                "pixel buffer holds " + frame.pixelLength() + " bytes, expected " + expected);
        }
        if (!Double.isFinite(frame.getCaptureTimestamp())) {
            throw new FrameRejectedException(sessionId, "non-finite capture timestamp");
        }
    }

    private static double millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    @Override
    public void close() {
        sessions.clear();
        coordinator.close();
    }
}
