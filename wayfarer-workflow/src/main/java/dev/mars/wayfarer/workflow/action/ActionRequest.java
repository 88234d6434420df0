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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Everything a handler gets to see when an action node is entered: the action name, the
 * workflow id, a read-only snapshot of the instance variables (keys case-insensitive), the node's parameters with
 * templates already resolved, and the cancellation signal.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class ActionRequest {

    private final String actionName;
    private final String workflowId;
    private final Map<String, String> variables;
    private final Map<String, String> parameters;
    private final ActionCancellation cancellation;

    public ActionRequest(String actionName, String workflowId, Map<String, String> variables,
                         Map<String, String> parameters, ActionCancellation cancellation) {
        this.actionName = Objects.requireNonNull(actionName, "Action name cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        Map<String, String> snapshot = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (variables != null) {
            snapshot.putAll(variables);
        }
        this.variables = Collections.unmodifiableMap(snapshot);
        this.parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.cancellation = cancellation != null ? cancellation : ActionCancellation.none();
    }

    public String getActionName() {
        return actionName;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public Map<String, String> getVariables() {
        return variables;
    }

    /**
     * Case-insensitive variable lookup.
     */
    public String getVariable(String key) {
        return key == null ? null : variables.get(key);
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public String getParameter(String name) {
        return parameters.get(name);
    }

    public ActionCancellation getCancellation() {
        return cancellation;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    @Override
    public String toString() {
        return "ActionRequest{action='" + actionName + "', workflowId='" + workflowId +
                "', parameters=" + parameters.keySet() + '}';
    }
}
