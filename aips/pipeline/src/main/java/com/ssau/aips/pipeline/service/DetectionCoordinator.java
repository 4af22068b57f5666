package com.ssau.aips.pipeline.service;

import java.io.Closeable;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;

import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.model.Detection;
import com.ssau.aips.pipeline.model.FaceLandmarks;
import com.ssau.aips.pipeline.model.Modality;
import com.ssau.aips.pipeline.model.ObjectSignal;
import com.ssau.aips.pipeline.model.PoseEstimate;
import com.ssau.aips.pipeline.model.ProcessedFrame;
import com.ssau.aips.pipeline.provider.LandmarkProvider;
import com.ssau.aips.pipeline.provider.ObjectDetector;

@Slf4j
public class DetectionCoordinator implements Closeable {

    private final LandmarkProvider landmarkProvider;
    private final ObjectDetector objectDetector;
    private final HeadPoseEstimator poseEstimator;
    private final ObjectSignalFilter objectFilter;
    private final ExecutorService workers;

    public DetectionCoordinator(LandmarkProvider landmarkProvider, ObjectDetector objectDetector) {
        this(landmarkProvider, objectDetector, new HeadPoseEstimator(), new ObjectSignalFilter(),
            Executors.newCachedThreadPool(new WorkerThreadFactory()));
    }

    public DetectionCoordinator(LandmarkProvider landmarkProvider,
                                ObjectDetector objectDetector,
                                HeadPoseEstimator poseEstimator,
                                ObjectSignalFilter objectFilter,
                                ExecutorService workers) {
        this.landmarkProvider = landmarkProvider;
        this.objectDetector = objectDetector;
        this.poseEstimator = poseEstimator;
        this.objectFilter = objectFilter;
        this.workers = workers;
    }

    public FanOut start(ProcessedFrame frame, PipelineConfig config) {
        Future<PoseEstimate> pose = workers.submit(() -> {
            FaceLandmarks landmarks = landmarkProvider.locate(frame).orElse(null);
            return poseEstimator.estimate(landmarks, frame.getRoi());
        });
        Future<ObjectSignal> objects = workers.submit(() -> {
            List<Detection> detections = objectDetector.detect(frame);
            return objectFilter.filter(detections, frame.getRoi(), config);
        });
        return new FanOut(pose, objects);
    }

    public DetectionOutcome run(ProcessedFrame frame, PipelineConfig config) {
        return start(frame, config).await(Duration.ofMillis(config.getTimeoutMs()));
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    public static final class FanOut {

        private final Future<PoseEstimate> poseFuture;
        private final Future<ObjectSignal> objectFuture;
        private volatile boolean cancelled;

        private FanOut(Future<PoseEstimate> poseFuture, Future<ObjectSignal> objectFuture) {
            this.poseFuture = poseFuture;
            this.objectFuture = objectFuture;
        }

        public DetectionOutcome await(Duration timeout) {
            long deadline = System.nanoTime() + timeout.toNanos();
            Map<Modality, String> degraded = new EnumMap<>(Modality.class);
            PoseEstimate pose = collect(poseFuture, Modality.POSE, deadline, degraded, PoseEstimate.noFace());
            ObjectSignal objects = collect(objectFuture, Modality.OBJECTS, deadline, degraded, ObjectSignal.empty());
            if (cancelled) {
                throw new CancellationException("Detection cancelled");
            }
            return new DetectionOutcome(pose, objects, degraded);
        }

        public void cancel() {
            cancelled = true;
            poseFuture.cancel(true);
            objectFuture.cancel(true);
        }

        public boolean isCancelled() {
            return cancelled;
        }

        private <T> T collect(Future<T> future, Modality modality, long deadline,
                              Map<Modality, String> degraded, T fallback) {
            if (cancelled) {
                throw new CancellationException("Detection cancelled");
            }
            long remaining = Math.max(0L, deadline - System.nanoTime());
            try {
                T value = future.get(remaining, TimeUnit.NANOSECONDS);
                return value != null ? value : fallback;
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("{} detection timed out, using default", modality);
                degraded.put(modality, "timeout");
                return fallback;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("{} detection failed: {}", modality, cause.getMessage(), cause);
                degraded.put(modality, "error: " + cause.getMessage());
                return fallback;
            } catch (CancellationException e) {
                if (cancelled) {
                    throw e;
                }
                degraded.put(modality, "cancelled");
                return fallback;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancel();
                throw new CancellationException("Interrupted while awaiting detection");
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "detection-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
