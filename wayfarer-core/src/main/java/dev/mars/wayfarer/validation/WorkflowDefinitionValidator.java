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


package dev.mars.wayfarer.validation;

import dev.mars.wayfarer.core.ChoiceOption;
import dev.mars.wayfarer.core.NodeKind;
import dev.mars.wayfarer.core.Transition;
import dev.mars.wayfarer.core.WorkflowDefinition;
import dev.mars.wayfarer.core.WorkflowNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the referential and structural invariants of a {@link WorkflowDefinition}.
 *
 * <p>Errors make a definition unregistrable:
 * <ul>
 *   <li>empty id, no nodes, no start point</li>
 *   <li>start points or transition endpoints naming unknown nodes</li>
 *   <li>more than one unconditional transition, or a repeated guard value, from one node</li>
 *   <li>outgoing transitions from a terminal node</li>
 * </ul>
 *
 * <p>Warnings flag graphs that work but are probably not what the author meant: choice
 * values with no guarded transition and nodes that cannot be reached from any start point.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowDefinitionValidator {

    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();
        if (definition == null) {
            result.error(ValidationResult.ROOT_PATH, "Workflow definition cannot be null");
            return result;
        }

        if (definition.getId().trim().isEmpty()) {
            result.error("id", "Workflow ID cannot be empty");
        }
        if (definition.getNodes().isEmpty()) {
            result.error("nodes", "Workflow must declare at least one node");
        }
        if (definition.getStartPoints().isEmpty()) {
            result.error("startPoints", "Workflow must declare at least one start point");
        }

        validateStartPoints(definition, result);
        validateTransitions(definition, result);
        validateChoices(definition, result);
        validateReachability(definition, result);

        return result;
    }

    private void validateStartPoints(WorkflowDefinition definition, ValidationResult result) {
        List<String> startPoints = definition.getStartPoints();
        for (int i = 0; i < startPoints.size(); i++) {
            if (!definition.hasNode(startPoints.get(i))) {
                result.error("startPoints[" + i + "]",
                        "Start point references unknown node '" + startPoints.get(i) + "'");
            }
        }
    }

    private void validateTransitions(WorkflowDefinition definition, ValidationResult result) {
        Map<String, Integer> unconditionalCounts = new HashMap<>();
        Map<String, Set<String>> guardsBySource = new HashMap<>();

        List<Transition> transitions = definition.getTransitions();
        for (int i = 0; i < transitions.size(); i++) {
            Transition transition = transitions.get(i);
            String path = "transitions[" + i + "]";

            if (!definition.hasNode(transition.getFromNodeId())) {
                result.error(path + ".from",
                        "Transition source references unknown node '" + transition.getFromNodeId() + "'");
            }
            if (!definition.hasNode(transition.getToNodeId())) {
                result.error(path + ".to",
                        "Transition target references unknown node '" + transition.getToNodeId() + "'");
            }

            definition.getNode(transition.getFromNodeId())
                    .filter(WorkflowNode::isTerminal)
                    .ifPresent(node -> result.error(path,
                            "Terminal node '" + node.getId() + "' cannot have outgoing transitions"));

            if (transition.isUnconditional()) {
                int count = unconditionalCounts.merge(transition.getFromNodeId(), 1, Integer::sum);
                if (count == 2) {
                    result.error(path, "Node '" + transition.getFromNodeId() +
                            "' has more than one unconditional transition");
                }
            } else {
                String guard = transition.getGuardValue().orElseThrow();
                Set<String> guards = guardsBySource.computeIfAbsent(transition.getFromNodeId(),
                        k -> new HashSet<>());
                if (!guards.add(guard)) {
                    result.error(path + ".when", "Node '" + transition.getFromNodeId() +
                            "' has more than one transition guarded by '" + guard + "'");
                }
            }
        }
    }

    private void validateChoices(WorkflowDefinition definition, ValidationResult result) {
        for (WorkflowNode node : definition.getNodes().values()) {
            if (node.getKind() != NodeKind.CHOICE) {
                continue;
            }
            List<Transition> outgoing = definition.getOutgoingTransitions(node.getId());
            for (ChoiceOption choice : node.getChoices()) {
                boolean routed = outgoing.stream().anyMatch(t -> t.matches(choice.getValue()));
                if (!routed) {
                    result.warning("nodes." + node.getId() + ".choices",
                            "Choice value '" + choice.getValue() + "' has no matching transition");
                }
            }
        }
    }

    private void validateReachability(WorkflowDefinition definition, ValidationResult result) {
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        for (String start : definition.getStartPoints()) {
            if (definition.hasNode(start) && reached.add(start)) {
                pending.push(start);
            }
        }
        while (!pending.isEmpty()) {
            String current = pending.pop();
            for (Transition transition : definition.getOutgoingTransitions(current)) {
                String target = transition.getToNodeId();
                if (definition.hasNode(target) && reached.add(target)) {
                    pending.push(target);
                }
            }
        }
        for (String nodeId : definition.getNodes().keySet()) {
            if (!reached.contains(nodeId)) {
                result.warning("nodes." + nodeId, "Node '" + nodeId + "' is unreachable from any start point");
            }
        }
    }
}
