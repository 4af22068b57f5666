package com.ssau.aips.pipeline.exception;

public class UnknownSessionException extends ProctoringException {

    public UnknownSessionException(String sessionId) {
        super(sessionId, "No active session " + sessionId);
    }
}
