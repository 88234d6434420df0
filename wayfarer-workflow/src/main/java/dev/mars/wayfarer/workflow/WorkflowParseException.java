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

import dev.mars.wayfarer.core.exceptions.WayfarerException;

/**
 * Exception thrown when a workflow definition document cannot be read or parsed.
 * The field path, when known, points at the offending element, e.g. {@code spec.nodes[3].kind}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowParseException extends WayfarerException {

    private final String fieldPath;

    public WorkflowParseException(String message) {
        super(message);
        this.fieldPath = null;
    }

    public WorkflowParseException(String message, Throwable cause) {
        super(message, cause);
        this.fieldPath = null;
    }

    public WorkflowParseException(String fieldPath, String message) {
        super(message);
        this.fieldPath = fieldPath;
    }

    public WorkflowParseException(String fieldPath, String message, Throwable cause) {
        super(message, cause);
        this.fieldPath = fieldPath;
    }

    public String getFieldPath() {
        return fieldPath;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        return fieldPath != null ? "[" + fieldPath + "] " + message : message;
    }
}
