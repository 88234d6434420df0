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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable description of a conversational workflow graph.
 * <p>
 * Nodes are kept in declaration order, transitions in the order they were added, and the
 * first start point is the default entry node. Referential integrity (start points and
 * transition endpoints naming existing nodes) is checked by
 * {@link dev.mars.wayfarer.validation.WorkflowDefinitionValidator} when the definition is
 * registered rather than at construction, so that a loader can report every problem at once.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowDefinition {

    private final String id;
    private final String name;
    private final Map<String, WorkflowNode> nodes;
    private final List<Transition> transitions;
    private final List<String> startPoints;

    private WorkflowDefinition(String id, String name, Map<String, WorkflowNode> nodes,
                               List<Transition> transitions, List<String> startPoints) {
        this.id = Objects.requireNonNull(id, "Workflow ID cannot be null");
        this.name = name != null ? name : id;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.transitions = List.copyOf(transitions);
        this.startPoints = List.copyOf(startPoints);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Map<String, WorkflowNode> getNodes() {
        return nodes;
    }

    public Optional<WorkflowNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean hasNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    public List<Transition> getTransitions() {
        return transitions;
    }

    public List<Transition> getOutgoingTransitions(String nodeId) {
        return transitions.stream()
                .filter(t -> t.getFromNodeId().equals(nodeId))
                .collect(Collectors.toList());
    }

    public List<String> getStartPoints() {
        return startPoints;
    }

    /**
     * @return the default entry node, empty if no start point is declared
     */
    public Optional<String> getStartNodeId() {
        return startPoints.isEmpty() ? Optional.empty() : Optional.of(startPoints.get(0));
    }

    /**
     * Copy of this graph registered under another identity. Nodes, transitions and start
     * points are shared since they are immutable.
     */
    public WorkflowDefinition withIdentity(String newId, String newName) {
        return new WorkflowDefinition(newId, newName, nodes, transitions, startPoints);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return id.equals(that.id) &&
               name.equals(that.name) &&
               nodes.equals(that.nodes) &&
               transitions.equals(that.transitions) &&
               startPoints.equals(that.startPoints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, nodes, transitions, startPoints);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", nodes=" + nodes.size() +
                ", transitions=" + transitions.size() +
                ", startPoints=" + startPoints +
                '}';
    }

    public static class Builder {
        private final String id;
        private String name;
        private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
        private final List<Transition> transitions = new ArrayList<>();
        private final List<String> startPoints = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder node(WorkflowNode node) {
            Objects.requireNonNull(node, "Node cannot be null");
            if (nodes.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException("Duplicate node ID: " + node.getId());
            }
            return this;
        }

        public Builder nodes(Collection<WorkflowNode> nodes) {
            nodes.forEach(this::node);
            return this;
        }

        public Builder transition(String fromNodeId, String toNodeId) {
            return transition(Transition.unconditional(fromNodeId, toNodeId));
        }

        public Builder transition(String fromNodeId, String toNodeId, String guardValue) {
            return transition(Transition.guarded(fromNodeId, toNodeId, guardValue));
        }

        public Builder transition(Transition transition) {
            transitions.add(Objects.requireNonNull(transition, "Transition cannot be null"));
            return this;
        }

        public Builder startPoint(String nodeId) {
            startPoints.add(Objects.requireNonNull(nodeId, "Start point cannot be null"));
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(id, name, nodes, transitions, startPoints);
        }
    }
}
