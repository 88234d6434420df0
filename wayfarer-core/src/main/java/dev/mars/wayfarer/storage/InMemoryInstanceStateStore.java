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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link InstanceStateStore} backed by a {@link ConcurrentHashMap} of per-instance state.
 * Every write goes through {@code computeIfAbsent} so the state for an id is created once,
 * and the state itself uses lock-free structures for the current node and variables.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryInstanceStateStore implements InstanceStateStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryInstanceStateStore.class);

    private final ConcurrentHashMap<String, InstanceState> instances = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryInstanceStateStore() {
        this(Clock.systemUTC());
    }

    public InMemoryInstanceStateStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public String getCurrentNode(String workflowId, String defaultNodeId) {
        requireId(workflowId);
        InstanceState state = stateFor(workflowId);
        String current = state.currentNode.updateAndGet(cur -> cur == null ? defaultNodeId : cur);
        logger.trace("getCurrentNode: workflowId={}, node={}", workflowId, current);
        return current;
    }

    @Override
    public Optional<String> findCurrentNode(String workflowId) {
        InstanceState state = workflowId == null ? null : instances.get(workflowId);
        return state == null ? Optional.empty() : Optional.ofNullable(state.currentNode.get());
    }

    @Override
    public void setCurrentNode(String workflowId, String nodeId) {
        requireId(workflowId);
        if (nodeId == null || nodeId.trim().isEmpty()) {
            throw new IllegalArgumentException("Node ID cannot be null or empty");
        }
        stateFor(workflowId).currentNode.set(nodeId);
        logger.debug("Current node set: workflowId={}, node={}", workflowId, nodeId);
    }

    @Override
    public boolean compareAndSetCurrentNode(String workflowId, String expectedNodeId, String nodeId) {
        requireId(workflowId);
        if (nodeId == null || nodeId.trim().isEmpty()) {
            throw new IllegalArgumentException("Node ID cannot be null or empty");
        }
        AtomicReference<String> currentNode = stateFor(workflowId).currentNode;
        // AtomicReference compares by identity, node ids compare by value
        String current = currentNode.get();
        while (Objects.equals(current, expectedNodeId)) {
            if (currentNode.compareAndSet(current, nodeId)) {
                logger.debug("Current node replaced: workflowId={}, from={}, to={}", workflowId, expectedNodeId, nodeId);
                return true;
            }
            current = currentNode.get();
        }
        return false;
    }

    @Override
    public void clearCurrentNode(String workflowId) {
        InstanceState state = workflowId == null ? null : instances.get(workflowId);
        if (state != null) {
            state.currentNode.set(null);
        }
    }

    @Override
    public Optional<String> getVariable(String workflowId, String key) {
        if (workflowId == null || key == null) {
            return Optional.empty();
        }
        InstanceState state = instances.get(workflowId);
        return state == null ? Optional.empty() : Optional.ofNullable(state.variables.get(key));
    }

    @Override
    public void setVariable(String workflowId, String key, String value) {
        requireId(workflowId);
        requireKey(key);
        Objects.requireNonNull(value, "Variable value cannot be null");
        stateFor(workflowId).variables.put(key, value);
        logger.trace("Variable set: workflowId={}, key={}", workflowId, key);
    }

    @Override
    public void mergeVariables(String workflowId, Map<String, String> variables) {
        requireId(workflowId);
        Objects.requireNonNull(variables, "Variables cannot be null");
        variables.forEach((key, value) -> {
            requireKey(key);
            Objects.requireNonNull(value, "Variable value cannot be null for key " + key);
        });
        stateFor(workflowId).variables.putAll(variables);
        logger.debug("Merged {} variables: workflowId={}", variables.size(), workflowId);
    }

    @Override
    public Map<String, String> getAllVariables(String workflowId) {
        InstanceState state = workflowId == null ? null : instances.get(workflowId);
        if (state == null) {
            return Collections.emptyMap();
        }
        Map<String, String> snapshot = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        snapshot.putAll(state.variables);
        return Collections.unmodifiableMap(snapshot);
    }

    @Override
    public boolean remove(String workflowId) {
        if (workflowId == null) {
            return false;
        }
        boolean removed = instances.remove(workflowId) != null;
        if (removed) {
            logger.info("Removed instance state: workflowId={}", workflowId);
        }
        return removed;
    }

    @Override
    public boolean exists(String workflowId) {
        return workflowId != null && instances.containsKey(workflowId);
    }

    @Override
    public Optional<Instant> getCreatedAt(String workflowId) {
        InstanceState state = workflowId == null ? null : instances.get(workflowId);
        return state == null ? Optional.empty() : Optional.of(state.createdAt);
    }

    @Override
    public List<String> listWorkflowIds() {
        return new ArrayList<>(instances.keySet());
    }

    private InstanceState stateFor(String workflowId) {
        return instances.computeIfAbsent(workflowId, id -> {
            logger.debug("Created instance state: workflowId={}", id);
            return new InstanceState(clock.instant());
        });
    }

    private static void requireId(String workflowId) {
        if (workflowId == null || workflowId.trim().isEmpty()) {
            throw new IllegalArgumentException("Workflow ID cannot be null or empty");
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalArgumentException("Variable key cannot be null or empty");
        }
    }

    private static final class InstanceState {
        private final Instant createdAt;
        private final AtomicReference<String> currentNode = new AtomicReference<>();
        // variable keys are case-insensitive
        private final ConcurrentSkipListMap<String, String> variables =
                new ConcurrentSkipListMap<>(String.CASE_INSENSITIVE_ORDER);

        private InstanceState(Instant createdAt) {
            this.createdAt = createdAt;
        }
    }
}
