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


package dev.mars.wayfarer.workflow.action;

import dev.mars.wayfarer.core.ActionOutcome;

/**
 * Runs the handler registered for a request's action name. Implementations never throw
 * for handler failures: unknown actions and failing handlers yield an {@code error}
 * outcome, cancellation yields a {@code cancelled} outcome.
 */
public interface ActionExecutor extends AutoCloseable {

    ActionOutcome execute(ActionRequest request);

    /**
     * Releases any worker threads. Executors that run handlers on the caller need nothing.
     */
    @Override
    default void close() {
    }
}
