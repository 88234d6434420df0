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

import dev.mars.wayfarer.core.ActionOutcome;

import java.util.Objects;
import java.util.Optional;

/**
 * Detailed result of a single advance call.
 */
public final class AdvanceResult {

    private final String workflowId;
    private final boolean advanced;
    private final String fromNodeId;
    private final String toNodeId;
    private final ActionOutcome actionOutcome;

    private AdvanceResult(String workflowId, boolean advanced, String fromNodeId, String toNodeId,
                          ActionOutcome actionOutcome) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.advanced = advanced;
        this.fromNodeId = fromNodeId;
        this.toNodeId = toNodeId;
        this.actionOutcome = actionOutcome;
    }

    public static AdvanceResult notAdvanced(String workflowId, String currentNodeId) {
        return new AdvanceResult(workflowId, false, currentNodeId, currentNodeId, null);
    }

    public static AdvanceResult advanced(String workflowId, String fromNodeId, String toNodeId,
                                         ActionOutcome actionOutcome) {
        return new AdvanceResult(workflowId, true, fromNodeId, toNodeId, actionOutcome);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public boolean isAdvanced() {
        return advanced;
    }

    public String getFromNodeId() {
        return fromNodeId;
    }

    /**
     * @return the node the instance is on after the call; equals the source when not advanced
     */
    public String getToNodeId() {
        return toNodeId;
    }

    public Optional<ActionOutcome> getActionOutcome() {
        return Optional.ofNullable(actionOutcome);
    }

    @Override
    public String toString() {
        return "AdvanceResult{workflowId='" + workflowId + '\'' +
                ", advanced=" + advanced +
                ", from='" + fromNodeId + '\'' +
                ", to='" + toNodeId + '\'' +
                (actionOutcome != null ? ", outcome=" + actionOutcome.getStatus() : "") +
                '}';
    }
}
