/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.wayfarer.workflow.action;

import dev.mars.wayfarer.config.WayfarerConfiguration;
import dev.mars.wayfarer.core.ActionOutcome;
import dev.mars.wayfarer.workflow.observability.WorkflowMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SimpleActionExecutorTest {

    @Mock
    private WorkflowMetrics metrics;

    private ActionHandlerRegistry registry;
    private SimpleActionExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new ActionHandlerRegistry();
        executor = new SimpleActionExecutor(registry, new WayfarerConfiguration(new Properties()), metrics);
    }

    private static ActionRequest request(String action, ActionCancellation cancellation) {
        return new ActionRequest(action, "wf-1", Map.of("Place", "Harbour"), Map.of("query", "Harbour"),
                cancellation);
    }

    @Test
    void testHandlerSeesRequest() {
        registry.register(ActionHandlers.of("fetch_places", request -> {
            assertEquals("wf-1", request.getWorkflowId());
            assertEquals("Harbour", request.getVariable("place"));
            assertEquals("Harbour", request.getParameter("query"));
            return ActionOutcome.ok(Map.of("places", "3"));
        }));

        ActionOutcome outcome = executor.execute(request("fetch_places", null));

        assertTrue(outcome.isSuccessful());
        assertEquals("3", outcome.getVariables().get("places"));
        verify(metrics).recordActionExecution(eq("fetch_places"), eq("ok"), anyDouble());
    }

    @Test
    void testUnknownActionYieldsError() {
        ActionOutcome outcome = executor.execute(request("teleport", null));

        assertTrue(outcome.isError());
        assertTrue(outcome.getMessage().orElseThrow().contains("teleport"));
        verify(metrics).recordActionExecution("teleport", "error", 0);
    }

    @Test
    void testThrowingHandlerYieldsError() {
        registry.register(ActionHandlers.of("capture_photo", request -> {
            throw new IllegalStateException("camera unavailable");
        }));

        ActionOutcome outcome = executor.execute(request("capture_photo", null));

        assertTrue(outcome.isError());
        assertEquals("camera unavailable", outcome.getMessage().orElseThrow());
    }

    @Test
    void testNullOutcomeYieldsError() {
        registry.register(ActionHandlers.of("noop", request -> null));

        assertTrue(executor.execute(request("noop", null)).isError());
    }

    @Test
    void testCancelledBeforeStart() {
        AtomicBoolean ran = new AtomicBoolean();
        registry.register(ActionHandlers.of("fetch_places", request -> {
            ran.set(true);
            return ActionOutcome.ok();
        }));
        ActionCancellation cancellation = new ActionCancellation();
        cancellation.cancel();

        ActionOutcome outcome = executor.execute(request("fetch_places", cancellation));

        assertTrue(outcome.isCancelled());
        assertFalse(ran.get());
    }

    @Test
    void testHandlerObservingCancellation() {
        ActionCancellation cancellation = new ActionCancellation();
        registry.register(ActionHandlers.of("fetch_places", request -> {
            cancellation.cancel();
            request.getCancellation().throwIfCancelled();
            return ActionOutcome.ok();
        }));

        assertTrue(executor.execute(request("fetch_places", cancellation)).isCancelled());
    }

    @Test
    void testCancellationExceptionYieldsCancelled() {
        registry.register(ActionHandlers.of("fetch_places", request -> {
            throw new CancellationException("user left");
        }));

        ActionOutcome outcome = executor.execute(request("fetch_places", null));

        assertTrue(outcome.isCancelled());
        assertEquals("user left", outcome.getMessage().orElseThrow());
    }

    @Test
    void testTimeoutCancelsAndInterruptsHandler() throws Exception {
        Properties props = new Properties();
        props.setProperty(WayfarerConfiguration.ACTION_TIMEOUT_MS, "100");
        CountDownLatch interrupted = new CountDownLatch(1);
        registry.register(ActionHandlers.of("slow", request -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return ActionOutcome.ok();
        }));
        ActionCancellation cancellation = new ActionCancellation();

        try (SimpleActionExecutor timed = new SimpleActionExecutor(registry,
                new WayfarerConfiguration(props), WorkflowMetrics.noop())) {
            ActionOutcome outcome = timed.execute(request("slow", cancellation));

            assertTrue(outcome.isError());
            assertTrue(outcome.getMessage().orElseThrow().contains("timed out"));
            assertTrue(cancellation.isCancelled());
            assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void testTimedExecutorRunsFastHandler() {
        Properties props = new Properties();
        props.setProperty(WayfarerConfiguration.ACTION_TIMEOUT_MS, "5000");
        AtomicBoolean workerThread = new AtomicBoolean();
        registry.register(ActionHandlers.of("fast", request -> {
            workerThread.set(Thread.currentThread().getName().startsWith("wayfarer-action-"));
            return ActionOutcome.ok();
        }));

        try (SimpleActionExecutor timed = new SimpleActionExecutor(registry,
                new WayfarerConfiguration(props), WorkflowMetrics.noop())) {
            assertTrue(timed.execute(request("fast", null)).isSuccessful());
        }
        await().atMost(Duration.ofSeconds(2)).untilTrue(workerThread);
    }
}
