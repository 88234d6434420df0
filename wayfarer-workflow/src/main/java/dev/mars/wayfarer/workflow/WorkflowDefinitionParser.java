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
import dev.mars.wayfarer.validation.ValidationResult;

import java.nio.file.Path;

public interface WorkflowDefinitionParser {

    WorkflowDefinition parse(Path file) throws WorkflowParseException;

    WorkflowDefinition parseFromString(String content) throws WorkflowParseException;

    /**
     * Parses the document but registers the result under the given id and name. The
     * document's own {@code metadata.id} becomes optional.
     */
    WorkflowDefinition parseFromString(String content, String workflowId, String name) throws WorkflowParseException;

    ValidationResult validate(WorkflowDefinition definition);
}
