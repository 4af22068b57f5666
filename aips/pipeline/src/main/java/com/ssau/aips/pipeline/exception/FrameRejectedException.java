package com.ssau.aips.pipeline.exception;

public class FrameRejectedException extends ProctoringException {

    public FrameRejectedException(String sessionId, String reason) {
        super(sessionId, "Frame rejected for session " + sessionId + ": " + reason);
    }
}
