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

import dev.mars.wayfarer.workflow.WorkflowState;

import java.util.Objects;

/**
 * What {@link ResumptionService#resumeOrStart} did for a context and the resulting state.
 */
public final class ResumptionDecision {

    public enum Outcome {
        /** An instance registered within the window was reused untouched. */
        RESUMED,
        /** A fresh definition copy was registered and a new instance started. */
        STARTED_NEW
    }

    private final Outcome outcome;
    private final String workflowId;
    private final WorkflowState state;

    public ResumptionDecision(Outcome outcome, String workflowId, WorkflowState state) {
        this.outcome = Objects.requireNonNull(outcome, "Outcome cannot be null");
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.state = Objects.requireNonNull(state, "State cannot be null");
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isResumed() {
        return outcome == Outcome.RESUMED;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public WorkflowState getState() {
        return state;
    }

    @Override
    public String toString() {
        return "ResumptionDecision{" + outcome + ", workflowId='" + workflowId + "', node='" +
                state.getNodeId() + "'}";
    }
}
