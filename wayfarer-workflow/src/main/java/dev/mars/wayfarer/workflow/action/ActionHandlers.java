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

import java.util.Objects;

/**
 * Factory helpers for building {@link ActionHandler}s from lambdas.
 */
public final class ActionHandlers {

    private ActionHandlers() {
    }

    @FunctionalInterface
    public interface ActionFunction {
        ActionOutcome apply(ActionRequest request) throws Exception;
    }

    public static ActionHandler of(String actionName, ActionFunction function) {
        if (actionName == null || actionName.trim().isEmpty()) {
            throw new IllegalArgumentException("Action name cannot be null or empty");
        }
        Objects.requireNonNull(function, "Action function cannot be null");
        return new ActionHandler() {
            @Override
            public String getActionName() {
                return actionName;
            }

            @Override
            public ActionOutcome handle(ActionRequest request) throws Exception {
                return function.apply(request);
            }

            @Override
            public String toString() {
                return "ActionHandler{" + actionName + '}';
            }
        };
    }
}
