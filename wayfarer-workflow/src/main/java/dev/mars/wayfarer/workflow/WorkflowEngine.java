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

import dev.mars.wayfarer.core.WorkflowDefinition;
import dev.mars.wayfarer.core.exceptions.InvalidWorkflowDefinitionException;
import dev.mars.wayfarer.core.exceptions.UnknownWorkflowException;
import dev.mars.wayfarer.core.exceptions.WayfarerException;
import dev.mars.wayfarer.workflow.action.ActionCancellation;

import java.util.Map;

/**
 * Drives conversational workflow instances through their definition graphs.
 * <p>
 * Instances are addressed by workflow id: each registered definition has at most one live
 * instance whose current node and variables live in the instance state store. All methods
 * are safe to call concurrently; concurrent advances of the same instance are resolved
 * last-writer-wins.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface WorkflowEngine {

    /**
     * Registers or replaces a definition. Existing instance state is left untouched.
     */
    void register(WorkflowDefinition definition) throws InvalidWorkflowDefinitionException;

    /**
     * Parses a YAML definition, registers it under its declared id and starts its instance.
     *
     * @return the rendering state of the start node
     */
    WorkflowState importWorkflow(String yamlContent) throws WayfarerException;

    /**
     * Same as {@link #importWorkflow(String)} but registers the definition under the given id
     * and name, ignoring those declared in the document.
     */
    WorkflowState importWorkflow(String yamlContent, String workflowId, String name) throws WayfarerException;

    /**
     * Ensures the instance exists, placing it on the first start point if it has no current node.
     */
    WorkflowState startInstance(String workflowId) throws UnknownWorkflowException;

    /**
     * Moves the instance back to the first start point. Variables are kept.
     */
    WorkflowState restartInstance(String workflowId) throws UnknownWorkflowException;

    /**
     * Follows one transition out of the current node.
     *
     * @param choiceValue the chosen value, or null to follow the unconditional transition
     * @return true if the instance moved; false when no transition matched, with no state changed
     * @throws UnknownWorkflowException if no definition is registered under the id
     * @throws IllegalArgumentException if the workflow id is null or blank
     */
    boolean advance(String workflowId, String choiceValue) throws UnknownWorkflowException;

    boolean advance(String workflowId, String choiceValue, ActionCancellation cancellation)
            throws UnknownWorkflowException;

    AdvanceResult advanceWithResult(String workflowId, String choiceValue) throws UnknownWorkflowException;

    AdvanceResult advanceWithResult(String workflowId, String choiceValue, ActionCancellation cancellation)
            throws UnknownWorkflowException;

    WorkflowState getCurrentState(String workflowId) throws UnknownWorkflowException;

    String getCurrentNodeId(String workflowId) throws UnknownWorkflowException;

    boolean workflowExists(String workflowId);

    /**
     * Removes the definition and all instance state for the id.
     *
     * @return true if anything was removed
     */
    boolean removeWorkflow(String workflowId);

    void setVariable(String workflowId, String key, String value);

    Map<String, String> getVariables(String workflowId);
}
