package com.ssau.aips.pipeline.service;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.model.BoundingBox;
import com.ssau.aips.pipeline.model.Detection;
import com.ssau.aips.pipeline.model.FaceLandmarks;
import com.ssau.aips.pipeline.model.Frame;
import com.ssau.aips.pipeline.model.Modality;
import com.ssau.aips.pipeline.model.PoseEstimate;
import com.ssau.aips.pipeline.model.ProcessedFrame;
import com.ssau.aips.pipeline.model.RoiWindow;
import com.ssau.aips.pipeline.provider.LandmarkProvider;
import com.ssau.aips.pipeline.provider.ObjectDetector;

class DetectionCoordinatorTest {

    private static final int WIDTH = 640;
    private static final int HEIGHT = 480;
    private static final FaceLandmarks TURNED = SyntheticFaces.project(50, 0, 0, WIDTH, HEIGHT);
    private static final List<Detection> PHONE_AND_TWO_PEOPLE = List.of(
        new Detection(67, "cell phone", 0.8, new BoundingBox(1, 1, 20, 20)),
        new Detection(0, "person", 0.9, new BoundingBox(100, 100, 300, 400)),
        new Detection(0, "person", 0.7, new BoundingBox(350, 100, 500, 400)));

    private final PipelineConfig config = PipelineConfig.defaults().toBuilder().timeoutMs(200).build();
    private final ProcessedFrame frame = new ProcessedFrame(new byte[WIDTH * HEIGHT * Frame.CHANNELS],
        RoiWindow.full(WIDTH, HEIGHT), 1.0, false, false);
    private DetectionCoordinator coordinator;

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.close();
        }
    }

    private static ObjectDetector blockingDetector(CountDownLatch entered) {
        return f -> {
            entered.countDown();
            Thread.sleep(10_000);
            return List.of();
        };
    }

    @Test
    void testBothBranchesSucceed() {
        coordinator = new DetectionCoordinator(f -> Optional.of(TURNED), f -> PHONE_AND_TWO_PEOPLE);

        DetectionOutcome outcome = coordinator.run(frame, config);

        assertTrue(outcome.degraded().isEmpty());
        assertTrue(outcome.pose().isFaceDetected());
        assertEquals(50.0, outcome.pose().getYaw(), 1.5);
        assertEquals(2, outcome.objects().getPersonCount());
        assertEquals(1, outcome.objects().getForbiddenItems().size());
    }

    @Test
    void testFreshCoordinatorFindsFaceWithinDefaultTimeout() {
        coordinator = new DetectionCoordinator(f -> Optional.of(TURNED), f -> List.of());

        for (int i = 0; i < 3; i++) {
            DetectionOutcome outcome = coordinator.run(frame, PipelineConfig.defaults());

            assertTrue(outcome.degraded().isEmpty(), "run " + i + " degraded: " + outcome.degraded());
            assertTrue(outcome.pose().isFaceDetected());
            assertEquals(50.0, outcome.pose().getYaw(), 1.5);
        }
    }

    @Test
    void testObjectTimeoutKeepsPose() {
        PoseEstimate isolated = new HeadPoseEstimator().estimate(TURNED, frame.getRoi());
        CountDownLatch entered = new CountDownLatch(1);
        coordinator = new DetectionCoordinator(f -> Optional.of(TURNED), blockingDetector(entered));

        long started = System.nanoTime();
        DetectionOutcome outcome = coordinator.run(frame, config);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(isolated, outcome.pose());
        assertEquals("timeout", outcome.degraded().get(Modality.OBJECTS));
        assertFalse(outcome.isDegraded(Modality.POSE));
        assertEquals(0, outcome.objects().getPersonCount());
        assertTrue(outcome.objects().getForbiddenItems().isEmpty());
        assertTrue(elapsedMs < 2_000, "await should be bounded by the timeout, took " + elapsedMs + "ms");
    }

    @Test
    void testObjectFailureKeepsPose() {
        PoseEstimate isolated = new HeadPoseEstimator().estimate(TURNED, frame.getRoi());
        coordinator = new DetectionCoordinator(f -> Optional.of(TURNED), f -> {
            throw new IllegalStateException("model not loaded");
        });

        DetectionOutcome outcome = coordinator.run(frame, config);

        assertEquals(isolated, outcome.pose());
        assertEquals("error: model not loaded", outcome.degraded().get(Modality.OBJECTS));
    }

    @Test
    void testPoseFailureKeepsObjects() {
        LandmarkProvider broken = f -> {
            throw new RuntimeException("landmark model crashed");
        };
        coordinator = new DetectionCoordinator(broken, f -> PHONE_AND_TWO_PEOPLE);

        DetectionOutcome outcome = coordinator.run(frame, config);

        assertTrue(outcome.isDegraded(Modality.POSE));
        assertFalse(outcome.pose().isFaceDetected());
        assertEquals(2, outcome.objects().getPersonCount());
        assertFalse(outcome.isDegraded(Modality.OBJECTS));
    }

    @Test
    void testNoFaceIsNotDegraded() {
        coordinator = new DetectionCoordinator(f -> Optional.empty(), f -> List.of());

        DetectionOutcome outcome = coordinator.run(frame, config);

        assertFalse(outcome.pose().isFaceDetected());
        assertTrue(outcome.degraded().isEmpty());
    }

    @Test
    void testBothBranchesTimeOutWithinOneDeadline() {
        CountDownLatch entered = new CountDownLatch(2);
        LandmarkProvider slowFace = f -> {
            entered.countDown();
            Thread.sleep(10_000);
            return Optional.empty();
        };
        coordinator = new DetectionCoordinator(slowFace, blockingDetector(entered));

        long started = System.nanoTime();
        DetectionOutcome outcome = coordinator.start(frame, config).await(Duration.ofMillis(150));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals("timeout", outcome.degraded().get(Modality.POSE));
        assertEquals("timeout", outcome.degraded().get(Modality.OBJECTS));
        assertTrue(elapsedMs < 1_000, "both branches share one deadline, took " + elapsedMs + "ms");
    }

    @Test
    void testCancelAbortsAwait() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        coordinator = new DetectionCoordinator(f -> Optional.empty(), blockingDetector(entered));
        DetectionCoordinator.FanOut fanOut = coordinator.start(frame, config);
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        fanOut.cancel();

        assertTrue(fanOut.isCancelled());
        assertThrows(CancellationException.class, () -> fanOut.await(Duration.ofSeconds(5)));
    }
}
