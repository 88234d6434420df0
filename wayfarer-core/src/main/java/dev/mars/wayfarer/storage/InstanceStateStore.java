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

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable per-instance state: the current node and a case-insensitive string variable map,
 * both keyed by workflow id.
 * <p>
 * State for an id is created implicitly on first access. Creation is atomic, so concurrent
 * first writers never lose each other's updates. Reads never throw for unknown ids. Writes
 * reject a null or blank workflow id or key with {@link IllegalArgumentException} and a null
 * value with {@link NullPointerException}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface InstanceStateStore {

    /**
     * Returns the current node, atomically initialising it to {@code defaultNodeId} when
     * the instance has none yet.
     */
    String getCurrentNode(String workflowId, String defaultNodeId);

    Optional<String> findCurrentNode(String workflowId);

    void setCurrentNode(String workflowId, String nodeId);

    /**
     * Moves the instance to {@code nodeId} only if it is still on {@code expectedNodeId}.
     *
     * @return true if the node was replaced
     */
    boolean compareAndSetCurrentNode(String workflowId, String expectedNodeId, String nodeId);

    void clearCurrentNode(String workflowId);

    Optional<String> getVariable(String workflowId, String key);

    void setVariable(String workflowId, String key, String value);

    void mergeVariables(String workflowId, Map<String, String> variables);

    /**
     * @return snapshot of all variables with case-insensitive keys, empty for an unseen id
     */
    Map<String, String> getAllVariables(String workflowId);

    /**
     * Deletes all state for the id.
     *
     * @return true if any state existed
     */
    boolean remove(String workflowId);

    boolean exists(String workflowId);

    Optional<Instant> getCreatedAt(String workflowId);

    List<String> listWorkflowIds();
}
