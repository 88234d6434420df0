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


package dev.mars.wayfarer.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single node of a workflow graph.
 * <p>
 * An action name is present exactly when the node kind is {@link NodeKind#ACTION}. Choice
 * options are only meaningful for {@link NodeKind#CHOICE} nodes and action parameters only
 * for action nodes; parameter values may contain {@code {{variable}}} placeholders that are
 * resolved against instance variables before the handler runs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowNode {

    private final String id;
    private final NodeKind kind;
    private final String displayText;
    private final String actionName;
    private final List<ChoiceOption> choices;
    private final Map<String, String> actionParameters;

    private WorkflowNode(Builder builder) {
        if (builder.id == null || builder.id.trim().isEmpty()) {
            throw new IllegalArgumentException("Node ID cannot be null or empty");
        }
        this.id = builder.id;
        this.kind = Objects.requireNonNull(builder.kind, "Node kind cannot be null");
        this.displayText = builder.displayText != null ? builder.displayText : "";

        boolean hasAction = builder.actionName != null && !builder.actionName.trim().isEmpty();
        if (kind == NodeKind.ACTION && !hasAction) {
            throw new IllegalArgumentException("Action node '" + id + "' must name an action");
        }
        if (kind != NodeKind.ACTION && hasAction) {
            throw new IllegalArgumentException("Only action nodes may name an action, node '" + id +
                    "' is " + kind);
        }
        if (kind != NodeKind.ACTION && !builder.actionParameters.isEmpty()) {
            throw new IllegalArgumentException("Only action nodes may carry action parameters, node '" +
                    id + "' is " + kind);
        }
        if (kind != NodeKind.CHOICE && !builder.choices.isEmpty()) {
            throw new IllegalArgumentException("Only choice nodes may offer choices, node '" + id +
                    "' is " + kind);
        }

        this.actionName = hasAction ? builder.actionName : null;
        this.choices = List.copyOf(builder.choices);
        this.actionParameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.actionParameters));
    }

    public static WorkflowNode prompt(String id, String displayText) {
        return builder(id, NodeKind.PROMPT).displayText(displayText).build();
    }

    public static WorkflowNode terminal(String id, String displayText) {
        return builder(id, NodeKind.TERMINAL).displayText(displayText).build();
    }

    public static WorkflowNode action(String id, String displayText, String actionName) {
        return builder(id, NodeKind.ACTION).displayText(displayText).actionName(actionName).build();
    }

    public static WorkflowNode choice(String id, String displayText, List<ChoiceOption> choices) {
        return builder(id, NodeKind.CHOICE).displayText(displayText).choices(choices).build();
    }

    public static Builder builder(String id, NodeKind kind) {
        return new Builder(id, kind);
    }

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getDisplayText() {
        return displayText;
    }

    public Optional<String> getActionName() {
        return Optional.ofNullable(actionName);
    }

    public List<ChoiceOption> getChoices() {
        return choices;
    }

    public Map<String, String> getActionParameters() {
        return actionParameters;
    }

    public boolean isTerminal() {
        return kind == NodeKind.TERMINAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowNode that = (WorkflowNode) o;
        return id.equals(that.id) &&
               kind == that.kind &&
               displayText.equals(that.displayText) &&
               Objects.equals(actionName, that.actionName) &&
               choices.equals(that.choices) &&
               actionParameters.equals(that.actionParameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, displayText, actionName, choices, actionParameters);
    }

    @Override
    public String toString() {
        return "WorkflowNode{" +
                "id='" + id + '\'' +
                ", kind=" + kind +
                (actionName != null ? ", action='" + actionName + '\'' : "") +
                (choices.isEmpty() ? "" : ", choices=" + choices.size()) +
                '}';
    }

    public static class Builder {
        private final String id;
        private final NodeKind kind;
        private String displayText;
        private String actionName;
        private final List<ChoiceOption> choices = new ArrayList<>();
        private final Map<String, String> actionParameters = new LinkedHashMap<>();

        private Builder(String id, NodeKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder displayText(String displayText) {
            this.displayText = displayText;
            return this;
        }

        public Builder actionName(String actionName) {
            this.actionName = actionName;
            return this;
        }

        public Builder choice(String label, String value) {
            this.choices.add(new ChoiceOption(label, value));
            return this;
        }

        public Builder choices(List<ChoiceOption> choices) {
            if (choices != null) {
                this.choices.addAll(choices);
            }
            return this;
        }

        public Builder parameter(String name, String value) {
            this.actionParameters.put(Objects.requireNonNull(name, "Parameter name cannot be null"),
                    Objects.requireNonNull(value, "Parameter value cannot be null"));
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            if (parameters != null) {
                parameters.forEach(this::parameter);
            }
            return this;
        }

        public WorkflowNode build() {
            return new WorkflowNode(this);
        }
    }
}
