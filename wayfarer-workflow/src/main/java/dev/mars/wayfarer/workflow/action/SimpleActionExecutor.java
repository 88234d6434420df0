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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default {@link ActionExecutor}.
 * <p>
 * With no timeout configured the handler runs on the caller's thread. With a positive
 * {@code wayfarer.action.timeout.ms} it runs on a worker thread; when the deadline passes
 * the request is cancelled, the worker interrupted and an {@code error} outcome returned.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SimpleActionExecutor implements ActionExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SimpleActionExecutor.class);

    private final ActionHandlerRegistry registry;
    private final WorkflowMetrics metrics;
    private final long timeoutMs;
    private final boolean logExecutionTime;
    private final ExecutorService workers;

    public SimpleActionExecutor(ActionHandlerRegistry registry) {
        this(registry, new WayfarerConfiguration(new Properties()), WorkflowMetrics.noop());
    }

    public SimpleActionExecutor(ActionHandlerRegistry registry, WayfarerConfiguration configuration,
                                WorkflowMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "Action handler registry cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.timeoutMs = Math.max(0, configuration.getActionTimeoutMs());
        this.logExecutionTime = configuration.isActionExecutionTimeLogged();
        this.workers = timeoutMs > 0 ? Executors.newCachedThreadPool(new ActionThreadFactory()) : null;
    }

    @Override
    public ActionOutcome execute(ActionRequest request) {
        Objects.requireNonNull(request, "Action request cannot be null");
        String actionName = request.getActionName();

        Optional<ActionHandler> handler = registry.getHandler(actionName);
        if (handler.isEmpty()) {
            logger.warn("No handler registered for action '{}': workflowId={}", actionName,
                    request.getWorkflowId());
            ActionOutcome outcome = ActionOutcome.error("No handler registered for action: " + actionName);
            metrics.recordActionExecution(actionName, outcome.getStatus(), 0);
            return outcome;
        }

        if (request.isCancelled()) {
            logger.debug("Action '{}' cancelled before start: workflowId={}", actionName, request.getWorkflowId());
            return ActionOutcome.cancelled("Action cancelled before start");
        }

        long start = System.nanoTime();
        ActionOutcome outcome = timeoutMs > 0
                ? invokeWithTimeout(handler.get(), request)
                : invoke(handler.get(), request);
        double durationMs = (System.nanoTime() - start) / 1_000_000.0;

        metrics.recordActionExecution(actionName, outcome.getStatus(), durationMs);
        if (logExecutionTime) {
            logger.info("Action '{}' finished: workflowId={}, status={}, durationMs={}", actionName,
                    request.getWorkflowId(), outcome.getStatus(), String.format("%.2f", durationMs));
        }
        return outcome;
    }

    private ActionOutcome invoke(ActionHandler handler, ActionRequest request) {
        try {
            ActionOutcome outcome = handler.handle(request);
            if (request.isCancelled()) {
                return ActionOutcome.cancelled("Action cancelled");
            }
            if (outcome == null) {
                logger.warn("Handler for action '{}' returned no outcome: workflowId={}",
                        request.getActionName(), request.getWorkflowId());
                return ActionOutcome.error("Handler returned no outcome");
            }
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancelledByHandler(request, e);
        } catch (CancellationException e) {
            return cancelledByHandler(request, e);
        } catch (Exception e) {
            logger.warn("Handler for action '{}' failed: workflowId={}", request.getActionName(),
                    request.getWorkflowId(), e);
            return ActionOutcome.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private ActionOutcome invokeWithTimeout(ActionHandler handler, ActionRequest request) {
        Future<ActionOutcome> future = workers.submit(() -> invoke(handler, request));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            request.getCancellation().cancel();
            future.cancel(true);
            logger.warn("Action '{}' timed out after {} ms: workflowId={}", request.getActionName(),
                    timeoutMs, request.getWorkflowId());
            return ActionOutcome.error("Action timed out after " + timeoutMs + " ms");
        } catch (InterruptedException e) {
            request.getCancellation().cancel();
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ActionOutcome.cancelled("Interrupted while waiting for action");
        } catch (ExecutionException e) {
            // invoke() converts handler failures itself, this only covers errors thrown around it
            logger.warn("Action '{}' failed: workflowId={}", request.getActionName(), request.getWorkflowId(),
                    e.getCause());
            return ActionOutcome.error(String.valueOf(e.getCause()));
        }
    }

    private ActionOutcome cancelledByHandler(ActionRequest request, Exception e) {
        logger.debug("Action '{}' cancelled: workflowId={}, reason={}", request.getActionName(),
                request.getWorkflowId(), e.toString());
        return ActionOutcome.cancelled(e.getMessage() != null ? e.getMessage() : "Action cancelled");
    }

    @Override
    public void close() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    private static final class ActionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "wayfarer-action-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
