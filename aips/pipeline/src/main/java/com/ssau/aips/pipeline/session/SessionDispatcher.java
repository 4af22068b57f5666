package com.ssau.aips.pipeline.session;

import java.io.Closeable;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import lombok.extern.slf4j.Slf4j;

import com.ssau.aips.pipeline.PipelineOrchestrator;
import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.exception.UnknownSessionException;
import com.ssau.aips.pipeline.model.Frame;
import com.ssau.aips.pipeline.model.PipelineResult;

@Slf4j
public class SessionDispatcher implements Closeable {

    private final PipelineOrchestrator orchestrator;
    private final ConcurrentMap<String, ExecutorService> workers = new ConcurrentHashMap<>();

    public SessionDispatcher(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public void open(String sessionId) {
        open(sessionId, orchestrator.getDefaults());
    }

    public void open(String sessionId, PipelineConfig config) {
        orchestrator.startSession(sessionId, config);
        // a worker left behind by an endSession that bypassed this dispatcher is retired here
        workers.compute(sessionId, (id, previous) -> {
            if (previous != null) {
                log.debug("Replacing the stale worker of session {}", id);
                previous.shutdown();
            }
            return Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "session-" + id);
                t.setDaemon(true);
                return t;
            });
        });
    }

    ExecutorService worker(String sessionId) {
        return workers.get(sessionId);
    }

    public CompletableFuture<PipelineResult> submit(String sessionId, Frame frame) {
        ExecutorService worker = workers.get(sessionId);
        if (worker == null) {
            return CompletableFuture.failedFuture(new UnknownSessionException(sessionId));
        }
        try {
            return CompletableFuture.supplyAsync(() -> orchestrator.process(sessionId, frame), worker);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new UnknownSessionException(sessionId));
        }
    }

    public void close(String sessionId) {
        ExecutorService worker = workers.remove(sessionId);
        try {
            orchestrator.endSession(sessionId);
        } finally {
            if (worker != null) {
                worker.shutdown();
            }
        }
    }

    @Override
    public void close() {
        for (String sessionId : List.copyOf(workers.keySet())) {
            try {
                close(sessionId);
            } catch (UnknownSessionException e) {
                log.debug("Session {} was already ended", sessionId);
            }
        }
    }
}
