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


package dev.mars.wayfarer.workflow.resume;

import dev.mars.wayfarer.config.WayfarerConfiguration;
import dev.mars.wayfarer.core.WorkflowDefinition;
import dev.mars.wayfarer.core.exceptions.WayfarerException;
import dev.mars.wayfarer.keying.ResumptionKeyGenerator;
import dev.mars.wayfarer.storage.DefinitionStore;
import dev.mars.wayfarer.storage.InstanceStateStore;
import dev.mars.wayfarer.workflow.SimpleWorkflowEngine;
import dev.mars.wayfarer.workflow.WorkflowEngine;
import dev.mars.wayfarer.workflow.WorkflowState;
import dev.mars.wayfarer.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Re-enters a workflow by a stable key derived from a context string, such as the resolved
 * name of the place the user is at.
 * <p>
 * If the keyed instance was started no longer than the resumption window before the
 * observation instant, it is reused as is. Otherwise a fresh copy of the template is
 * registered under the key, stale instance state is dropped, the instance is started at its
 * first start point and seeded with any caller-supplied variables, the context
 * ({@value #CONTEXT_VARIABLE}) and the observation instant ({@value #OBSERVED_AT_VARIABLE}).
 * <p>
 * The window is measured between observation instants supplied by the caller. The instant
 * that started an instance is the one stored under {@value #OBSERVED_AT_VARIABLE}, so
 * callers cannot override that variable.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ResumptionService {

    private static final Logger logger = LoggerFactory.getLogger(ResumptionService.class);

    public static final String CONTEXT_VARIABLE = "context";
    public static final String OBSERVED_AT_VARIABLE = "observed_at";

    private final WorkflowEngine engine;
    private final DefinitionStore definitionStore;
    private final InstanceStateStore stateStore;
    private final ResumptionKeyGenerator keyGenerator;
    private final Duration window;
    private final WorkflowMetrics metrics;

    private static final int LOCK_STRIPES = 64;

    // decisions for one key are serialised; unrelated keys may share a stripe
    private final Object[] keyLocks = new Object[LOCK_STRIPES];

    public ResumptionService(SimpleWorkflowEngine engine, WayfarerConfiguration configuration) {
        this(engine, engine.getDefinitionStore(), engine.getStateStore(),
                new ResumptionKeyGenerator(configuration.getResumptionDomain(),
                        configuration.getResumptionKeyLength()),
                Duration.ofHours(configuration.getResumptionWindowHours()),
                configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : WorkflowMetrics.noop());
    }

    public ResumptionService(WorkflowEngine engine, DefinitionStore definitionStore, InstanceStateStore stateStore,
                             ResumptionKeyGenerator keyGenerator, Duration window, WorkflowMetrics metrics) {
        this.engine = Objects.requireNonNull(engine, "Workflow engine cannot be null");
        this.definitionStore = Objects.requireNonNull(definitionStore, "Definition store cannot be null");
        this.stateStore = Objects.requireNonNull(stateStore, "Instance state store cannot be null");
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "Key generator cannot be null");
        this.window = Objects.requireNonNull(window, "Resumption window cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        if (window.isNegative()) {
            throw new IllegalArgumentException("Resumption window cannot be negative: " + window);
        }
        for (int i = 0; i < LOCK_STRIPES; i++) {
            keyLocks[i] = new Object();
        }
    }

    public ResumptionDecision resumeOrStart(String context, Instant observedAt, WorkflowDefinition template)
            throws WayfarerException {
        return resumeOrStart(context, observedAt, template, Map.of());
    }

    /**
     * @throws IllegalArgumentException if the context is blank
     * @throws WayfarerException if the template cannot be registered
     */
    public ResumptionDecision resumeOrStart(String context, Instant observedAt, WorkflowDefinition template,
                                            Map<String, String> initialVariables) throws WayfarerException {
        Objects.requireNonNull(observedAt, "Observation instant cannot be null");
        Objects.requireNonNull(template, "Template definition cannot be null");
        String workflowId = keyGenerator.generateWorkflowId(context);

        synchronized (lockFor(workflowId)) {
            if (isWithinWindow(workflowId, observedAt)) {
                WorkflowState state = engine.getCurrentState(workflowId);
                logger.info("Resumed workflow: workflowId={}, node={}", workflowId, state.getNodeId());
                metrics.recordResumed(keyGenerator.getDomain());
                return new ResumptionDecision(ResumptionDecision.Outcome.RESUMED, workflowId, state);
            }

            engine.register(template.withIdentity(workflowId, template.getName()));
            stateStore.remove(workflowId);
            engine.startInstance(workflowId);

            Map<String, String> seed = new LinkedHashMap<>();
            if (initialVariables != null) {
                seed.putAll(initialVariables);
            }
            stateStore.mergeVariables(workflowId, seed);
            stateStore.setVariable(workflowId, CONTEXT_VARIABLE, context);
            stateStore.setVariable(workflowId, OBSERVED_AT_VARIABLE, observedAt.toString());

            WorkflowState state = engine.getCurrentState(workflowId);
            logger.info("Started new workflow for context: workflowId={}, template={}, node={}",
                    workflowId, template.getId(), state.getNodeId());
            metrics.recordStartedNew(keyGenerator.getDomain());
            return new ResumptionDecision(ResumptionDecision.Outcome.STARTED_NEW, workflowId, state);
        }
    }

    /**
     * An instance counts as recent when it was started no more than the window before the
     * observation. Instances started after the observation also count.
     */
    boolean isWithinWindow(String workflowId, Instant observedAt) {
        if (!definitionStore.exists(workflowId)) {
            return false;
        }
        Optional<Instant> startedAt = getStartedAt(workflowId);
        if (startedAt.isEmpty()) {
            return false;
        }
        Duration age = Duration.between(startedAt.get(), observedAt);
        return age.compareTo(window) <= 0;
    }

    /**
     * The observation instant that started the keyed instance, empty if it was not started
     * by this service or its state has been dropped.
     */
    public Optional<Instant> getStartedAt(String workflowId) {
        Optional<String> value = stateStore.getVariable(workflowId, OBSERVED_AT_VARIABLE);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(value.get()));
        } catch (DateTimeParseException e) {
            logger.warn("Ignoring unreadable start instant: workflowId={}, value={}", workflowId, value.get());
            return Optional.empty();
        }
    }

    private Object lockFor(String workflowId) {
        return keyLocks[Math.floorMod(workflowId.hashCode(), LOCK_STRIPES)];
    }

    public String workflowIdFor(String context) {
        return keyGenerator.generateWorkflowId(context);
    }

    public Duration getWindow() {
        return window;
    }
}
