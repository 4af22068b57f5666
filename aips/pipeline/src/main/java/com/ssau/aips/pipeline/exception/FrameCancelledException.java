package com.ssau.aips.pipeline.exception;

public class FrameCancelledException extends ProctoringException {

    public FrameCancelledException(String sessionId) {
        super(sessionId, "Session " + sessionId + " ended while a frame was in flight");
    }
}
