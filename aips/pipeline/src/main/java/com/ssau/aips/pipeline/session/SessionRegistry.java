package com.ssau.aips.pipeline.session;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import lombok.extern.slf4j.Slf4j;

import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.exception.UnknownSessionException;

// lookups never create state
@Slf4j
public class SessionRegistry {

    private final ConcurrentMap<String, SessionState> sessions = new ConcurrentHashMap<>();

    public SessionState open(String sessionId, PipelineConfig config) {
        SessionState state = new SessionState(sessionId, config);
        SessionState existing = sessions.putIfAbsent(sessionId, state);
        if (existing != null) {
            throw new IllegalStateException("Session already active: " + sessionId);
        }
        return state;
    }

    public SessionState require(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            throw new UnknownSessionException(sessionId);
        }
        return state;
    }

    public SessionState remove(String sessionId) {
        SessionState state = sessions.remove(sessionId);
        if (state == null) {
            throw new UnknownSessionException(sessionId);
        }
        return state;
    }

    public boolean isActive(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public Set<String> activeSessions() {
        return Set.copyOf(sessions.keySet());
    }

    public void clear() {
        sessions.forEach((id, state) -> {
            if (sessions.remove(id, state)) {
                state.close();
                log.debug("Session {} dropped on shutdown", id);
            }
        });
    }
}
