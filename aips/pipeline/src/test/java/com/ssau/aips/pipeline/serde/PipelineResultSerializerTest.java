package com.ssau.aips.pipeline.serde;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import com.ssau.aips.pipeline.config.ScoringConfig;
import com.ssau.aips.pipeline.exception.FrameRejectedException;
import com.ssau.aips.pipeline.model.BehaviorSnapshot;
import com.ssau.aips.pipeline.model.BoundingBox;
import com.ssau.aips.pipeline.model.DeviationPhase;
import com.ssau.aips.pipeline.model.ForbiddenItem;
import com.ssau.aips.pipeline.model.GazeResult;
import com.ssau.aips.pipeline.model.Modality;
import com.ssau.aips.pipeline.model.ObjectSignal;
import com.ssau.aips.pipeline.model.PipelineResult;
import com.ssau.aips.pipeline.model.PoseEstimate;
import com.ssau.aips.pipeline.model.ProcessingMetadata;
import com.ssau.aips.pipeline.model.SessionSummary;
import com.ssau.aips.pipeline.service.RiskScorer;

class PipelineResultSerializerTest {

    private final PipelineResultSerializer serializer = new PipelineResultSerializer();

    private static PipelineResult sampleResult() {
        GazeResult gaze = new GazeResult(
            PoseEstimate.builder().yaw(52.5).pitch(-3).roll(1).landmarksCount(468).confidence(0.9).faceDetected(true).build(),
            true, 2.0, DeviationPhase.DEVIATING);
        ObjectSignal objects = new ObjectSignal(2,
            List.of(new ForbiddenItem("phone", 0.81, new BoundingBox(1, 2, 3, 4))), List.of());
        BehaviorSnapshot behavior = BehaviorSnapshot.builder().windowFrames(1).findings(List.of("Normal behavior")).build();
        return PipelineResult.builder()
            .gaze(gaze)
            .objects(objects)
            .behavior(behavior)
            .risk(new RiskScorer().score(gaze, objects, behavior, ScoringConfig.defaults()))
            .metadata(ProcessingMetadata.builder()
                .sessionId("exam-7")
                .captureTimestamp(12.5)
                .processedAt(Instant.parse("2024-05-01T10:15:30Z"))
                .degradedModalities(Map.of(Modality.POSE, "timeout"))
                .build())
            .build();
    }

    @Test
    void testAnalysisMessage() throws Exception {
        String json = serializer.toJson(sampleResult());
        JsonNode node = PipelineResultSerializer.mapper().readTree(json);

        assertEquals("analysis", node.get("type").asText());
        assertEquals("exam-7", node.get("session_id").asText());
        assertTrue(node.at("/gaze/deviation").asBoolean());
        assertEquals(2.0, node.at("/gaze/deviation_duration").asDouble(), 1e-9);
        assertEquals(52.5, node.at("/gaze/pose/yaw").asDouble(), 1e-9);
        assertTrue(node.at("/gaze/pose/face_detected").asBoolean());
        assertEquals(2, node.at("/objects/person_count").asInt());
        assertEquals("phone", node.at("/objects/forbidden_items/0/label").asText());
        assertEquals(90, node.at("/risk/risk_score").asInt());
        assertEquals("high", node.at("/risk/alert_level").asText());
        assertEquals("Gaze deviation detected", node.at("/risk/violations/0").asText());
        assertEquals("2024-05-01T10:15:30Z", node.at("/metadata/processed_at").asText());
        assertFalse(node.at("/metadata/frame_skipped").asBoolean());
        assertEquals("timeout", node.at("/metadata/degraded_modalities/POSE").asText());
    }

    @Test
    void testStatsMessage() throws Exception {
        SessionSummary summary = SessionSummary.builder()
            .sessionId("exam-7")
            .framesReceived(10)
            .framesProcessed(4)
            .framesSkipped(6)
            .skipRatio(0.6)
            .behavior(BehaviorSnapshot.empty())
            .build();

        JsonNode node = PipelineResultSerializer.mapper().readTree(serializer.toJson(summary));

        assertEquals("stats", node.get("type").asText());
        assertEquals(6, node.at("/data/frames_skipped").asInt());
        assertEquals(0.6, node.at("/data/skip_ratio").asDouble(), 1e-9);
    }

    @Test
    void testErrorMessage() throws Exception {
        JsonNode node = PipelineResultSerializer.mapper()
            .readTree(serializer.toJson(new FrameRejectedException("exam-7", "empty pixel buffer")));

        assertEquals("error", node.get("type").asText());
        assertEquals("FrameRejectedException", node.get("error").asText());
        assertTrue(node.get("message").asText().contains("empty pixel buffer"));
    }
}
