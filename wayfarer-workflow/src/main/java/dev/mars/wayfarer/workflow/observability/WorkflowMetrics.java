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


package dev.mars.wayfarer.workflow.observability;

import dev.mars.wayfarer.core.ActionOutcome;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry metrics for the Wayfarer engine.
 *
 * Provides:
 * - wayfarer.advance.total (counter) - Advances that moved an instance
 * - wayfarer.advance.stalled (counter) - Advances with no matching transition
 * - wayfarer.action.executions (counter) - Action handler invocations, by status
 * - wayfarer.action.failures (counter) - Action invocations ending in error
 * - wayfarer.action.duration.ms (histogram) - Action handler duration
 * - wayfarer.resumption.resumed (counter) - Resumption requests served by an existing instance
 * - wayfarer.resumption.started (counter) - Resumption requests that started a new instance
 *
 * Recording is a no-op unless an OpenTelemetry SDK is installed globally.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "wayfarer-workflow";

    private static WorkflowMetrics instance;

    private final LongCounter advancesTotal;
    private final LongCounter advancesStalled;
    private final LongCounter actionExecutions;
    private final LongCounter actionFailures;
    private final LongCounter resumptionsResumed;
    private final LongCounter resumptionsStarted;

    private final DoubleHistogram actionDuration;

    private static final AttributeKey<String> NODE_KIND_KEY = AttributeKey.stringKey("node.kind");
    private static final AttributeKey<String> ACTION_NAME_KEY = AttributeKey.stringKey("action.name");
    private static final AttributeKey<String> ACTION_STATUS_KEY = AttributeKey.stringKey("action.status");
    private static final AttributeKey<String> KEY_DOMAIN_KEY = AttributeKey.stringKey("resumption.domain");

    public WorkflowMetrics(Meter meter) {
        advancesTotal = meter.counterBuilder("wayfarer.advance.total")
                .setDescription("Number of advances that moved an instance to a new node")
                .setUnit("1")
                .build();

        advancesStalled = meter.counterBuilder("wayfarer.advance.stalled")
                .setDescription("Number of advances with no matching transition")
                .setUnit("1")
                .build();

        actionExecutions = meter.counterBuilder("wayfarer.action.executions")
                .setDescription("Number of action handler invocations")
                .setUnit("1")
                .build();

        actionFailures = meter.counterBuilder("wayfarer.action.failures")
                .setDescription("Number of action invocations ending in error")
                .setUnit("1")
                .build();

        resumptionsResumed = meter.counterBuilder("wayfarer.resumption.resumed")
                .setDescription("Number of resumption requests served by an existing instance")
                .setUnit("1")
                .build();

        resumptionsStarted = meter.counterBuilder("wayfarer.resumption.started")
                .setDescription("Number of resumption requests that started a new instance")
                .setUnit("1")
                .build();

        actionDuration = meter.histogramBuilder("wayfarer.action.duration.ms")
                .setDescription("Action handler duration in milliseconds")
                .setUnit("ms")
                .build();

        logger.debug("WorkflowMetrics initialized");
    }

    /**
     * Get the shared instance bound to the global OpenTelemetry meter provider.
     */
    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    /**
     * Metrics that record nothing, used when metrics are disabled in configuration.
     */
    public static WorkflowMetrics noop() {
        return new WorkflowMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public void recordAdvance(String targetKind) {
        advancesTotal.add(1, Attributes.of(NODE_KIND_KEY, targetKind));
    }

    public void recordStalledAdvance(String currentKind) {
        advancesStalled.add(1, Attributes.of(NODE_KIND_KEY, currentKind));
    }

    public void recordActionExecution(String actionName, String status, double durationMs) {
        Attributes attrs = Attributes.builder()
                .put(ACTION_NAME_KEY, actionName)
                .put(ACTION_STATUS_KEY, status)
                .build();
        actionExecutions.add(1, attrs);
        actionDuration.record(durationMs, attrs);
        if (ActionOutcome.STATUS_ERROR.equalsIgnoreCase(status)) {
            actionFailures.add(1, attrs);
        }
    }

    public void recordResumed(String domain) {
        resumptionsResumed.add(1, Attributes.of(KEY_DOMAIN_KEY, domain));
    }

    public void recordStartedNew(String domain) {
        resumptionsStarted.add(1, Attributes.of(KEY_DOMAIN_KEY, domain));
    }
}
