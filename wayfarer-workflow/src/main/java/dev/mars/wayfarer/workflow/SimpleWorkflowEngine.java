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


package dev.mars.wayfarer.workflow;

import dev.mars.wayfarer.config.WayfarerConfiguration;
import dev.mars.wayfarer.core.ActionOutcome;
import dev.mars.wayfarer.core.NodeKind;
import dev.mars.wayfarer.core.Transition;
import dev.mars.wayfarer.core.WorkflowDefinition;
import dev.mars.wayfarer.core.WorkflowNode;
import dev.mars.wayfarer.core.exceptions.InvalidWorkflowDefinitionException;
import dev.mars.wayfarer.core.exceptions.UnknownWorkflowException;
import dev.mars.wayfarer.core.exceptions.WayfarerException;
import dev.mars.wayfarer.storage.DefinitionStore;
import dev.mars.wayfarer.storage.InMemoryDefinitionStore;
import dev.mars.wayfarer.storage.InMemoryInstanceStateStore;
import dev.mars.wayfarer.storage.InstanceStateStore;
import dev.mars.wayfarer.workflow.action.ActionCancellation;
import dev.mars.wayfarer.workflow.action.ActionExecutor;
import dev.mars.wayfarer.workflow.action.ActionHandlerRegistry;
import dev.mars.wayfarer.workflow.action.ActionRequest;
import dev.mars.wayfarer.workflow.action.SimpleActionExecutor;
import dev.mars.wayfarer.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default {@link WorkflowEngine} over a {@link DefinitionStore} and an
 * {@link InstanceStateStore}.
 * <p>
 * Entering an action node runs its handler synchronously on the calling thread (or on the
 * executor's worker when a timeout is configured). The returned variables are merged into the
 * instance together with the outcome status under {@value #STATUS_VARIABLE} and, when present,
 * its message under {@value #STATUS_MESSAGE_VARIABLE}. A cancelled action commits nothing.
 * <p>
 * An instance whose node is no longer declared after its definition was replaced is moved
 * back to the start point on the next read.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SimpleWorkflowEngine implements WorkflowEngine, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SimpleWorkflowEngine.class);

    public static final String STATUS_VARIABLE = "status";
    public static final String STATUS_MESSAGE_VARIABLE = "status_message";

    private final DefinitionStore definitionStore;
    private final InstanceStateStore stateStore;
    private final ActionExecutor actionExecutor;
    private final WorkflowDefinitionParser parser;
    private final WorkflowMetrics metrics;

    /**
     * In-memory engine with default configuration.
     */
    public SimpleWorkflowEngine(ActionHandlerRegistry registry) {
        this(new InMemoryDefinitionStore(), new InMemoryInstanceStateStore(),
                new SimpleActionExecutor(registry), new YamlWorkflowDefinitionParser(), WorkflowMetrics.noop());
    }

    public SimpleWorkflowEngine(DefinitionStore definitionStore, InstanceStateStore stateStore,
                                ActionExecutor actionExecutor) {
        this(definitionStore, stateStore, actionExecutor, new YamlWorkflowDefinitionParser(), WorkflowMetrics.noop());
    }

    public SimpleWorkflowEngine(DefinitionStore definitionStore, InstanceStateStore stateStore,
                                ActionExecutor actionExecutor, WorkflowDefinitionParser parser,
                                WorkflowMetrics metrics) {
        this.definitionStore = Objects.requireNonNull(definitionStore, "Definition store cannot be null");
        this.stateStore = Objects.requireNonNull(stateStore, "Instance state store cannot be null");
        this.actionExecutor = Objects.requireNonNull(actionExecutor, "Action executor cannot be null");
        this.parser = Objects.requireNonNull(parser, "Definition parser cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
    }

    /**
     * Engine wired from configuration: in-memory stores, a {@link SimpleActionExecutor}
     * honouring the configured timeout, and global OpenTelemetry metrics unless disabled.
     */
    public static SimpleWorkflowEngine create(ActionHandlerRegistry registry, WayfarerConfiguration configuration) {
        WorkflowMetrics metrics = configuration.isMetricsEnabled()
                ? WorkflowMetrics.getInstance()
                : WorkflowMetrics.noop();
        return new SimpleWorkflowEngine(new InMemoryDefinitionStore(), new InMemoryInstanceStateStore(),
                new SimpleActionExecutor(registry, configuration, metrics),
                new YamlWorkflowDefinitionParser(), metrics);
    }

    @Override
    public void register(WorkflowDefinition definition) throws InvalidWorkflowDefinitionException {
        definitionStore.register(definition);
    }

    @Override
    public WorkflowState importWorkflow(String yamlContent) throws WayfarerException {
        WorkflowDefinition definition = parser.parseFromString(yamlContent);
        return registerAndStart(definition);
    }

    @Override
    public WorkflowState importWorkflow(String yamlContent, String workflowId, String name) throws WayfarerException {
        requireId(workflowId);
        WorkflowDefinition definition = parser.parseFromString(yamlContent, workflowId, name);
        return registerAndStart(definition);
    }

    private WorkflowState registerAndStart(WorkflowDefinition definition) throws WayfarerException {
        definitionStore.register(definition);
        logger.info("Imported workflow: workflowId={}, name={}", definition.getId(), definition.getName());
        return startInstance(definition.getId());
    }

    @Override
    public WorkflowState startInstance(String workflowId) throws UnknownWorkflowException {
        requireId(workflowId);
        WorkflowDefinition definition = definitionStore.get(workflowId);
        String current = currentNodeOf(workflowId, definition);
        logger.info("Started workflow instance: workflowId={}, node={}", workflowId, current);
        return stateFor(workflowId, definition, current);
    }

    @Override
    public WorkflowState restartInstance(String workflowId) throws UnknownWorkflowException {
        requireId(workflowId);
        WorkflowDefinition definition = definitionStore.get(workflowId);
        String start = startNodeOf(definition);
        stateStore.setCurrentNode(workflowId, start);
        logger.info("Restarted workflow instance: workflowId={}, node={}", workflowId, start);
        return stateFor(workflowId, definition, start);
    }

    @Override
    public boolean advance(String workflowId, String choiceValue) throws UnknownWorkflowException {
        return advanceWithResult(workflowId, choiceValue, ActionCancellation.none()).isAdvanced();
    }

    @Override
    public boolean advance(String workflowId, String choiceValue, ActionCancellation cancellation)
            throws UnknownWorkflowException {
        return advanceWithResult(workflowId, choiceValue, cancellation).isAdvanced();
    }

    @Override
    public AdvanceResult advanceWithResult(String workflowId, String choiceValue) throws UnknownWorkflowException {
        return advanceWithResult(workflowId, choiceValue, ActionCancellation.none());
    }

    @Override
    public AdvanceResult advanceWithResult(String workflowId, String choiceValue, ActionCancellation cancellation)
            throws UnknownWorkflowException {
        requireId(workflowId);
        WorkflowDefinition definition = definitionStore.get(workflowId);
        String currentId = currentNodeOf(workflowId, definition);
        WorkflowNode current = definition.getNode(currentId).orElseThrow();

        Optional<Transition> transition = selectTransition(definition.getOutgoingTransitions(currentId), choiceValue);
        if (transition.isEmpty()) {
            logger.debug("No transition from node {} for choice {}: workflowId={}", currentId, choiceValue, workflowId);
            metrics.recordStalledAdvance(current.getKind().name());
            return AdvanceResult.notAdvanced(workflowId, currentId);
        }

        String targetId = transition.get().getToNodeId();
        WorkflowNode target = definition.getNode(targetId)
                .orElseThrow(() -> new IllegalStateException("Transition target " + targetId +
                        " missing from registered definition " + workflowId));

        stateStore.setCurrentNode(workflowId, targetId);
        logger.info("Advanced workflow: workflowId={}, from={}, to={}, choice={}", workflowId, currentId,
                targetId, choiceValue);
        metrics.recordAdvance(target.getKind().name());

        ActionOutcome outcome = null;
        if (target.getKind() == NodeKind.ACTION) {
            outcome = runAction(workflowId, target, cancellation);
        }
        return AdvanceResult.advanced(workflowId, currentId, targetId, outcome);
    }

    /**
     * A non-null choice only follows the transition guarded by that exact value. A null
     * choice only follows the unconditional transition.
     */
    static Optional<Transition> selectTransition(List<Transition> outgoing, String choiceValue) {
        if (choiceValue == null) {
            return outgoing.stream().filter(Transition::isUnconditional).findFirst();
        }
        return outgoing.stream().filter(t -> t.matches(choiceValue)).findFirst();
    }

    private ActionOutcome runAction(String workflowId, WorkflowNode node, ActionCancellation cancellation) {
        String actionName = node.getActionName()
                .orElseThrow(() -> new IllegalStateException("Action node without action: " + node.getId()));
        Map<String, String> variables = stateStore.getAllVariables(workflowId);
        Map<String, String> parameters = new VariableResolver(variables).resolveAll(node.getActionParameters());

        ActionRequest request = new ActionRequest(actionName, workflowId, variables, parameters, cancellation);
        ActionOutcome outcome = actionExecutor.execute(request);

        if (outcome.isCancelled()) {
            logger.info("Action cancelled, nothing committed: workflowId={}, action={}", workflowId, actionName);
            return outcome;
        }

        Map<String, String> updates = new LinkedHashMap<>();
        outcome.getVariables().forEach((key, value) -> {
            if (key == null || key.trim().isEmpty() || value == null) {
                logger.warn("Dropping invalid variable from action {}: key={}", actionName, key);
            } else {
                updates.put(key, value);
            }
        });
        updates.put(STATUS_VARIABLE, outcome.getStatus());
        outcome.getMessage().ifPresent(message -> updates.put(STATUS_MESSAGE_VARIABLE, message));
        stateStore.mergeVariables(workflowId, updates);

        logger.debug("Committed action outcome: workflowId={}, action={}, status={}, variables={}",
                workflowId, actionName, outcome.getStatus(), updates.size());
        return outcome;
    }

    @Override
    public WorkflowState getCurrentState(String workflowId) throws UnknownWorkflowException {
        requireId(workflowId);
        WorkflowDefinition definition = definitionStore.get(workflowId);
        String current = currentNodeOf(workflowId, definition);
        return stateFor(workflowId, definition, current);
    }

    @Override
    public String getCurrentNodeId(String workflowId) throws UnknownWorkflowException {
        requireId(workflowId);
        WorkflowDefinition definition = definitionStore.get(workflowId);
        return currentNodeOf(workflowId, definition);
    }

    @Override
    public boolean workflowExists(String workflowId) {
        return definitionStore.exists(workflowId);
    }

    @Override
    public boolean removeWorkflow(String workflowId) {
        boolean removedDefinition = definitionStore.remove(workflowId);
        boolean removedState = stateStore.remove(workflowId);
        return removedDefinition || removedState;
    }

    @Override
    public void setVariable(String workflowId, String key, String value) {
        stateStore.setVariable(workflowId, key, value);
    }

    @Override
    public Map<String, String> getVariables(String workflowId) {
        return stateStore.getAllVariables(workflowId);
    }

    public DefinitionStore getDefinitionStore() {
        return definitionStore;
    }

    public InstanceStateStore getStateStore() {
        return stateStore;
    }

    /**
     * Closes the action executor, stopping its worker threads if it has any.
     */
    @Override
    public void close() {
        actionExecutor.close();
    }

    /**
     * Current node of the instance, initialised to the start point on first access. A node
     * the definition does not declare is swapped for the start point.
     */
    private String currentNodeOf(String workflowId, WorkflowDefinition definition) {
        String start = startNodeOf(definition);
        String current = stateStore.getCurrentNode(workflowId, start);
        while (!definition.hasNode(current)) {
            if (stateStore.compareAndSetCurrentNode(workflowId, current, start)) {
                logger.warn("Instance was on a node its definition no longer declares, reset to start: " +
                        "workflowId={}, node={}, start={}", workflowId, current, start);
                return start;
            }
            current = stateStore.getCurrentNode(workflowId, start);
        }
        return current;
    }

    private WorkflowState stateFor(String workflowId, WorkflowDefinition definition, String nodeId) {
        WorkflowNode node = definition.getNode(nodeId)
                .orElseThrow(() -> new IllegalStateException("Workflow " + workflowId +
                        " is on undeclared node " + nodeId));
        return new WorkflowState(workflowId, node, stateStore.getAllVariables(workflowId));
    }

    private static void requireId(String workflowId) {
        if (workflowId == null || workflowId.trim().isEmpty()) {
            throw new IllegalArgumentException("Workflow ID cannot be null or empty");
        }
    }

    private static String startNodeOf(WorkflowDefinition definition) {
        return definition.getStartNodeId()
                .orElseThrow(() -> new IllegalStateException("Workflow " + definition.getId() +
                        " has no start point"));
    }
}
