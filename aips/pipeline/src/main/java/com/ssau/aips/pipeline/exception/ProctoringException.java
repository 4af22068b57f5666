package com.ssau.aips.pipeline.exception;

public class ProctoringException extends RuntimeException {

    private final String sessionId;

    public ProctoringException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public ProctoringException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
