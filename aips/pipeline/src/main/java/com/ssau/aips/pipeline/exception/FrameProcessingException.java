package com.ssau.aips.pipeline.exception;

public class FrameProcessingException extends ProctoringException {

    public FrameProcessingException(String sessionId, String message, Throwable cause) {
        super(sessionId, message, cause);
    }
}
