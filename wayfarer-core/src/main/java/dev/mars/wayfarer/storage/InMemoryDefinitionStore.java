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
import dev.mars.wayfarer.validation.ValidationResult;
import dev.mars.wayfarer.validation.WorkflowDefinitionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link DefinitionStore} backed by a {@link ConcurrentHashMap}. Each entry pairs the
 * definition with its registration instant so both are swapped in a single write.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryDefinitionStore implements DefinitionStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDefinitionStore.class);

    private final ConcurrentHashMap<String, RegisteredDefinition> definitions = new ConcurrentHashMap<>();
    private final WorkflowDefinitionValidator validator;
    private final Clock clock;

    public InMemoryDefinitionStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDefinitionStore(Clock clock) {
        this(clock, new WorkflowDefinitionValidator());
    }

    public InMemoryDefinitionStore(Clock clock, WorkflowDefinitionValidator validator) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
    }

    @Override
    public void register(WorkflowDefinition definition) throws InvalidWorkflowDefinitionException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");

        ValidationResult result = validator.validate(definition);
        if (!result.isValid()) {
            logger.warn("Rejected workflow definition: workflowId={}, errors={}",
                    definition.getId(), result.getErrorCount());
            throw new InvalidWorkflowDefinitionException(definition.getId(), result);
        }
        if (result.hasWarnings()) {
            logger.debug("Workflow definition {} registered with warnings: {}", definition.getId(),
                    result.getWarnings());
        }

        RegisteredDefinition previous = definitions.put(definition.getId(),
                new RegisteredDefinition(definition, clock.instant()));
        logger.info("{} workflow definition: workflowId={}, nodes={}, transitions={}",
                previous == null ? "Registered" : "Replaced", definition.getId(),
                definition.getNodes().size(), definition.getTransitions().size());
    }

    @Override
    public WorkflowDefinition get(String workflowId) throws UnknownWorkflowException {
        return find(workflowId).orElseThrow(() -> new UnknownWorkflowException(workflowId));
    }

    @Override
    public Optional<WorkflowDefinition> find(String workflowId) {
        if (workflowId == null) {
            return Optional.empty();
        }
        RegisteredDefinition registered = definitions.get(workflowId);
        return registered == null ? Optional.empty() : Optional.of(registered.definition);
    }

    @Override
    public boolean exists(String workflowId) {
        return workflowId != null && definitions.containsKey(workflowId);
    }

    @Override
    public List<String> list() {
        return new ArrayList<>(definitions.keySet());
    }

    @Override
    public boolean remove(String workflowId) {
        if (workflowId == null) {
            return false;
        }
        boolean removed = definitions.remove(workflowId) != null;
        if (removed) {
            logger.info("Removed workflow definition: workflowId={}", workflowId);
        }
        return removed;
    }

    @Override
    public Optional<Instant> getRegisteredAt(String workflowId) {
        if (workflowId == null) {
            return Optional.empty();
        }
        RegisteredDefinition registered = definitions.get(workflowId);
        return registered == null ? Optional.empty() : Optional.of(registered.registeredAt);
    }

    private static final class RegisteredDefinition {
        private final WorkflowDefinition definition;
        private final Instant registeredAt;

        private RegisteredDefinition(WorkflowDefinition definition, Instant registeredAt) {
            this.definition = definition;
            this.registeredAt = registeredAt;
        }
    }
}
