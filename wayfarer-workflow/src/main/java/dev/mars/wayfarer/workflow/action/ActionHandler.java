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
 * A named side effect triggered when a workflow enters an action node.
 * <p>
 * Handlers may throw; the executor converts any failure into an {@code error} outcome so a
 * misbehaving handler never breaks advancement. Handlers that observe cancellation should
 * throw {@link java.util.concurrent.CancellationException} or {@link InterruptedException}.
 */
public interface ActionHandler {

    String getActionName();

    ActionOutcome handle(ActionRequest request) throws Exception;
}
