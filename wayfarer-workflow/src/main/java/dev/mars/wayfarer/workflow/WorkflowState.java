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

import dev.mars.wayfarer.core.ChoiceOption;
import dev.mars.wayfarer.core.NodeKind;
import dev.mars.wayfarer.core.WorkflowNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Rendering payload for the node an instance currently sits on: what to display, which
 * choices to offer and the instance's variables at the time of the call.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowState {

    private final String workflowId;
    private final String nodeId;
    private final NodeKind kind;
    private final String displayText;
    private final List<ChoiceOption> choices;
    private final Map<String, String> variables;

    public WorkflowState(String workflowId, WorkflowNode node, Map<String, String> variables) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        Objects.requireNonNull(node, "Node cannot be null");
        this.nodeId = node.getId();
        this.kind = node.getKind();
        this.displayText = node.getDisplayText();
        this.choices = node.getChoices();
        Map<String, String> snapshot = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (variables != null) {
            snapshot.putAll(variables);
        }
        this.variables = Collections.unmodifiableMap(snapshot);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getDisplayText() {
        return displayText;
    }

    public List<ChoiceOption> getChoices() {
        return choices;
    }

    public Map<String, String> getVariables() {
        return variables;
    }

    public boolean isAwaitingChoice() {
        return kind == NodeKind.CHOICE;
    }

    public boolean isTerminal() {
        return kind == NodeKind.TERMINAL;
    }

    @Override
    public String toString() {
        return "WorkflowState{" +
                "workflowId='" + workflowId + '\'' +
                ", nodeId='" + nodeId + '\'' +
                ", kind=" + kind +
                ", choices=" + choices.size() +
                ", variables=" + variables.size() +
                '}';
    }
}
