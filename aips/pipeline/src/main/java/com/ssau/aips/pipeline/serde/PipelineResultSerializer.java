package com.ssau.aips.pipeline.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import com.ssau.aips.pipeline.exception.ProctoringException;
import com.ssau.aips.pipeline.model.PipelineResult;
import com.ssau.aips.pipeline.model.SessionSummary;

public class PipelineResultSerializer {

    public static final String ANALYSIS = "analysis";
    public static final String STATS = "stats";
    public static final String ERROR = "error";

    private static final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    public ObjectNode toNode(PipelineResult result) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", ANALYSIS);
        node.put("session_id", result.getMetadata().getSessionId());
        node.set("gaze", objectMapper.valueToTree(result.getGaze()));
        node.set("objects", objectMapper.valueToTree(result.getObjects()));
        node.set("behavior", objectMapper.valueToTree(result.getBehavior()));
        node.set("risk", objectMapper.valueToTree(result.getRisk()));
        node.set("metadata", objectMapper.valueToTree(result.getMetadata()));
        return node;
    }

    public String toJson(PipelineResult result) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toNode(result));
    }

    public String toJson(SessionSummary summary) throws JsonProcessingException {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", STATS);
        node.put("session_id", summary.getSessionId());
        node.set("data", objectMapper.valueToTree(summary));
        return objectMapper.writeValueAsString(node);
    }

    public String toJson(ProctoringException error) throws JsonProcessingException {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", ERROR);
        node.put("session_id", error.getSessionId());
        node.put("error", error.getClass().getSimpleName());
        node.put("message", error.getMessage());
        return objectMapper.writeValueAsString(node);
    }

    static ObjectMapper mapper() {
        return objectMapper;
    }
}
