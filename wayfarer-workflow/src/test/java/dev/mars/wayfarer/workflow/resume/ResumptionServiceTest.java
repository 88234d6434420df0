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
import dev.mars.wayfarer.core.ActionOutcome;
import dev.mars.wayfarer.core.WorkflowDefinition;
import dev.mars.wayfarer.core.WorkflowNode;
import dev.mars.wayfarer.keying.ResumptionKeyGenerator;
import dev.mars.wayfarer.storage.InMemoryDefinitionStore;
import dev.mars.wayfarer.storage.InMemoryInstanceStateStore;
import dev.mars.wayfarer.workflow.SimpleWorkflowEngine;
import dev.mars.wayfarer.workflow.action.ActionHandlerRegistry;
import dev.mars.wayfarer.workflow.action.ActionHandlers;
import dev.mars.wayfarer.workflow.action.SimpleActionExecutor;
import dev.mars.wayfarer.workflow.observability.WorkflowMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ResumptionServiceTest {

    private static final Instant T0 = Instant.parse("2025-06-01T10:00:00Z");
    private static final String PLACE = "Harbour Market, Lisbon";

    private MutableClock clock;
    private SimpleWorkflowEngine engine;
    private ResumptionService service;
    private WorkflowDefinition template;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(T0);
        ActionHandlerRegistry registry = new ActionHandlerRegistry();
        registry.register(ActionHandlers.of("fetch_places", request -> ActionOutcome.ok()));
        engine = new SimpleWorkflowEngine(new InMemoryDefinitionStore(clock), new InMemoryInstanceStateStore(clock),
                new SimpleActionExecutor(registry));
        service = new ResumptionService(engine, new WayfarerConfiguration(new Properties()));

        template = WorkflowDefinition.builder("new-location")
                .name("New location")
                .node(WorkflowNode.prompt("welcome", "Somewhere new"))
                .node(WorkflowNode.action("fetch", "Looking around", "fetch_places"))
                .node(WorkflowNode.terminal("done", "Bye"))
                .transition("welcome", "fetch")
                .transition("fetch", "done")
                .startPoint("welcome")
                .build();
    }

    @Test
    void testFirstVisitStartsNewInstance() throws Exception {
        ResumptionDecision decision = service.resumeOrStart(PLACE, T0, template, Map.of("user", "ana"));

        assertEquals(ResumptionDecision.Outcome.STARTED_NEW, decision.getOutcome());
        assertEquals(new ResumptionKeyGenerator().generateWorkflowId(PLACE), decision.getWorkflowId());
        assertEquals("welcome", decision.getState().getNodeId());

        Map<String, String> variables = engine.getVariables(decision.getWorkflowId());
        assertEquals(PLACE, variables.get(ResumptionService.CONTEXT_VARIABLE));
        assertEquals(T0.toString(), variables.get(ResumptionService.OBSERVED_AT_VARIABLE));
        assertEquals("ana", variables.get("user"));
        assertEquals("New location", engine.getDefinitionStore().get(decision.getWorkflowId()).getName());
        assertFalse(engine.workflowExists("new-location"));
    }

    @Test
    void testRevisitWithinWindowResumes() throws Exception {
        ResumptionDecision first = service.resumeOrStart(PLACE, T0, template);
        engine.advance(first.getWorkflowId(), null);

        Instant later = T0.plus(Duration.ofHours(23).plusMinutes(59));
        clock.set(later);
        ResumptionDecision second = service.resumeOrStart(PLACE, later, template, Map.of("user", "other"));

        assertTrue(second.isResumed());
        assertEquals(first.getWorkflowId(), second.getWorkflowId());
        assertEquals("fetch", second.getState().getNodeId());
        assertNull(engine.getVariables(second.getWorkflowId()).get("user"));
    }

    @Test
    void testRevisitAfterWindowStartsAgain() throws Exception {
        ResumptionDecision first = service.resumeOrStart(PLACE, T0, template);
        engine.advance(first.getWorkflowId(), null);
        engine.setVariable(first.getWorkflowId(), "stale", "yes");

        Instant later = T0.plus(Duration.ofHours(24).plusMinutes(1));
        clock.set(later);
        ResumptionDecision second = service.resumeOrStart(PLACE, later, template);

        assertEquals(ResumptionDecision.Outcome.STARTED_NEW, second.getOutcome());
        assertEquals(first.getWorkflowId(), second.getWorkflowId());
        assertEquals("welcome", second.getState().getNodeId());
        Map<String, String> variables = engine.getVariables(second.getWorkflowId());
        assertFalse(variables.containsKey("stale"));
        assertEquals(later.toString(), variables.get(ResumptionService.OBSERVED_AT_VARIABLE));
        assertEquals(later, engine.getDefinitionStore().getRegisteredAt(second.getWorkflowId()).orElseThrow());
    }

    @Test
    void testWindowIsMeasuredFromLatestStart() throws Exception {
        service.resumeOrStart(PLACE, T0, template);

        Instant restartAt = T0.plus(Duration.ofHours(30));
        clock.set(restartAt);
        service.resumeOrStart(PLACE, restartAt, template);

        Instant revisit = restartAt.plus(Duration.ofHours(10));
        assertTrue(service.resumeOrStart(PLACE, revisit, template).isResumed());
    }

    @Test
    void testWindowFollowsObservationInstantsNotStoreClock() throws Exception {
        SimpleWorkflowEngine systemClockEngine = new SimpleWorkflowEngine(new ActionHandlerRegistry());
        ResumptionService systemClockService = new ResumptionService(systemClockEngine,
                new WayfarerConfiguration(new Properties()));
        Instant start = Instant.parse("2024-01-01T00:00:00Z");

        ResumptionDecision first = systemClockService.resumeOrStart("1 Main St", start, template);
        assertEquals(start, systemClockService.getStartedAt(first.getWorkflowId()).orElseThrow());

        Instant inside = start.plus(Duration.ofHours(23).plusMinutes(59));
        assertTrue(systemClockService.resumeOrStart("1 Main St", inside, template).isResumed());

        Instant outside = start.plus(Duration.ofHours(24).plusMinutes(1));
        ResumptionDecision expired = systemClockService.resumeOrStart("1 Main St", outside, template);
        assertEquals(ResumptionDecision.Outcome.STARTED_NEW, expired.getOutcome());
        assertEquals(outside, systemClockService.getStartedAt(expired.getWorkflowId()).orElseThrow());
    }

    @Test
    void testCallerCannotOverrideStartInstant() throws Exception {
        ResumptionDecision first = service.resumeOrStart(PLACE, T0, template,
                Map.of(ResumptionService.OBSERVED_AT_VARIABLE, "2099-01-01T00:00:00Z",
                        ResumptionService.CONTEXT_VARIABLE, "elsewhere"));

        Map<String, String> variables = engine.getVariables(first.getWorkflowId());
        assertEquals(T0.toString(), variables.get(ResumptionService.OBSERVED_AT_VARIABLE));
        assertEquals(PLACE, variables.get(ResumptionService.CONTEXT_VARIABLE));
    }

    @Test
    void testDroppedStateStartsAgainInsideWindow() throws Exception {
        ResumptionDecision first = service.resumeOrStart(PLACE, T0, template);
        engine.getStateStore().remove(first.getWorkflowId());

        ResumptionDecision second = service.resumeOrStart(PLACE, T0.plusSeconds(60), template);

        assertEquals(ResumptionDecision.Outcome.STARTED_NEW, second.getOutcome());
        assertEquals(T0.plusSeconds(60), service.getStartedAt(second.getWorkflowId()).orElseThrow());
    }

    @Test
    void testEquivalentContextsResumeSameInstance() throws Exception {
        ResumptionDecision first = service.resumeOrStart(PLACE, T0, template);

        ResumptionDecision second = service.resumeOrStart("  harbour market,   LISBON", T0.plusSeconds(60), template);

        assertTrue(second.isResumed());
        assertEquals(first.getWorkflowId(), second.getWorkflowId());
    }

    @Test
    void testDifferentPlacesAreIndependent() throws Exception {
        ResumptionDecision harbour = service.resumeOrStart(PLACE, T0, template);
        ResumptionDecision castle = service.resumeOrStart("Castle of Sao Jorge", T0, template);

        assertNotEquals(harbour.getWorkflowId(), castle.getWorkflowId());
        assertFalse(castle.isResumed());
        assertEquals(harbour.getWorkflowId(), service.workflowIdFor(PLACE));
    }

    @Test
    void testBlankContextRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.resumeOrStart("  ", T0, template));
    }

    @Test
    void testCustomWindow() throws Exception {
        ResumptionService shortWindow = new ResumptionService(engine, engine.getDefinitionStore(),
                engine.getStateStore(), new ResumptionKeyGenerator("venue", 12), Duration.ofHours(1),
                WorkflowMetrics.noop());

        ResumptionDecision first = shortWindow.resumeOrStart(PLACE, T0, template);
        assertTrue(first.getWorkflowId().startsWith("venue:"));
        assertEquals(18, first.getWorkflowId().length());

        assertTrue(shortWindow.resumeOrStart(PLACE, T0.plus(Duration.ofMinutes(59)), template).isResumed());
        assertFalse(shortWindow.resumeOrStart(PLACE, T0.plus(Duration.ofMinutes(61)), template).isResumed());
    }

    @Test
    void testConcurrentFirstVisitsStartOnce() throws Exception {
        int callers = 16;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        Set<ResumptionDecision.Outcome> outcomes = ConcurrentHashMap.newKeySet();
        List<Future<?>> futures = new ArrayList<>();
        List<ResumptionDecision> started = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    ResumptionDecision decision = service.resumeOrStart(PLACE, T0, template);
                    outcomes.add(decision.getOutcome());
                    if (!decision.isResumed()) {
                        synchronized (started) {
                            started.add(decision);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, started.size());
        assertTrue(outcomes.contains(ResumptionDecision.Outcome.RESUMED));
    }
}
