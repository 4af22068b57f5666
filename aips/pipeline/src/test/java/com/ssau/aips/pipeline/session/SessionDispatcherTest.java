package com.ssau.aips.pipeline.session;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.ssau.aips.pipeline.PipelineOrchestrator;
import com.ssau.aips.pipeline.exception.UnknownSessionException;
import com.ssau.aips.pipeline.model.Frame;
import com.ssau.aips.pipeline.model.PipelineResult;

class SessionDispatcherTest {

    private PipelineOrchestrator orchestrator;
    private SessionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        orchestrator = new PipelineOrchestrator(f -> Optional.empty(), f -> List.of());
        dispatcher = new SessionDispatcher(orchestrator);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
        orchestrator.close();
    }

    @Test
    void testFramesOfOneSessionKeepOrder() throws Exception {
        dispatcher.open("a");
        dispatcher.open("b");

        List<CompletableFuture<PipelineResult>> a = new ArrayList<>();
        List<CompletableFuture<PipelineResult>> b = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            // half a second apart, so the rate floor admits every frame
            a.add(dispatcher.submit("a", Frame.filled(32, 24, 40, i * 0.5)));
            b.add(dispatcher.submit("b", Frame.filled(32, 24, 80, i * 0.5)));
        }

        for (int i = 0; i < 6; i++) {
            PipelineResult ra = a.get(i).get(10, TimeUnit.SECONDS);
            PipelineResult rb = b.get(i).get(10, TimeUnit.SECONDS);
            assertEquals(i * 0.5, ra.getMetadata().getCaptureTimestamp(), 1e-9);
            assertEquals("a", ra.getMetadata().getSessionId());
            assertEquals("b", rb.getMetadata().getSessionId());
            assertFalse(ra.isFrameSkipped());
        }
        assertEquals(6, orchestrator.sessionSummary("a").getFramesProcessed());
        assertEquals(6, orchestrator.sessionSummary("b").getFramesProcessed());
    }

    @Test
    void testUnknownSessionFailsFuture() {
        CompletableFuture<PipelineResult> future = dispatcher.submit("nobody", Frame.filled(8, 8, 1, 0.0));

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(UnknownSessionException.class, e.getCause());
    }

    @Test
    void testClosedSessionRejectsFurtherFrames() throws Exception {
        dispatcher.open("a");
        dispatcher.submit("a", Frame.filled(16, 16, 1, 0.0)).get(10, TimeUnit.SECONDS);

        dispatcher.close("a");

        assertFalse(orchestrator.isActive("a"));
        ExecutionException e = assertThrows(ExecutionException.class,
            () -> dispatcher.submit("a", Frame.filled(16, 16, 1, 1.0)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(UnknownSessionException.class, e.getCause());
    }

    @Test
    void testReopenAfterOrchestratorEndRetiresOldWorker() throws Exception {
        dispatcher.open("a");
        ExecutorService first = dispatcher.worker("a");
        orchestrator.endSession("a");

        dispatcher.open("a");
        ExecutorService second = dispatcher.worker("a");

        assertNotSame(first, second);
        assertTrue(first.isShutdown());
        assertFalse(second.isShutdown());
        PipelineResult result = dispatcher.submit("a", Frame.filled(16, 16, 1, 0.0)).get(10, TimeUnit.SECONDS);
        assertEquals("a", result.getMetadata().getSessionId());
    }
}
