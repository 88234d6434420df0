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


package dev.mars.wayfarer.storage;

import dev.mars.wayfarer.core.WorkflowDefinition;
import dev.mars.wayfarer.core.exceptions.InvalidWorkflowDefinitionException;
import dev.mars.wayfarer.core.exceptions.UnknownWorkflowException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Registry of immutable workflow definitions keyed by workflow id.
 * <p>
 * Implementations must be safe for concurrent use. Registering under an id that already
 * exists replaces the prior definition atomically: readers observe either the old or the
 * new definition in full, never a mixture.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface DefinitionStore {

    /**
     * Validates and stores the definition under its own id, replacing any previous one.
     *
     * @throws InvalidWorkflowDefinitionException if the graph breaks a referential invariant
     */
    void register(WorkflowDefinition definition) throws InvalidWorkflowDefinitionException;

    /**
     * @throws UnknownWorkflowException if no definition is registered under the id
     */
    WorkflowDefinition get(String workflowId) throws UnknownWorkflowException;

    Optional<WorkflowDefinition> find(String workflowId);

    boolean exists(String workflowId);

    /**
     * @return snapshot of the registered ids
     */
    List<String> list();

    /**
     * @return true if a definition was removed
     */
    boolean remove(String workflowId);

    /**
     * Instant of the most recent registration under the id.
     */
    Optional<Instant> getRegisteredAt(String workflowId);
}
