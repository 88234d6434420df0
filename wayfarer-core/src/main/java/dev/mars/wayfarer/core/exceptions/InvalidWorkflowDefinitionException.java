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


package dev.mars.wayfarer.core.exceptions;

import dev.mars.wayfarer.validation.ValidationResult;

/**
 * Raised when a definition with broken referential invariants is registered.
 * The full validation result is attached so callers can report every error.
 */
public class InvalidWorkflowDefinitionException extends WayfarerException {

    private final String workflowId;
    private final ValidationResult validationResult;

    public InvalidWorkflowDefinitionException(String workflowId, ValidationResult validationResult) {
        super("Invalid workflow definition '" + workflowId + "': " + validationResult.describeErrors());
        this.workflowId = workflowId;
        this.validationResult = validationResult;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
