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


package dev.mars.wayfarer.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of running an action handler. The status is free-form; {@link #STATUS_OK},
 * {@link #STATUS_ERROR} and {@link #STATUS_CANCELLED} are produced by the engine itself.
 * Variables are merged into the instance when the outcome is committed.
 */
public final class ActionOutcome {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";
    public static final String STATUS_CANCELLED = "cancelled";

    private final String status;
    private final Map<String, String> variables;
    private final String message;

    public ActionOutcome(String status, Map<String, String> variables, String message) {
        if (status == null || status.trim().isEmpty()) {
            throw new IllegalArgumentException("Outcome status cannot be null or empty");
        }
        this.status = status;
        this.variables = variables == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        this.message = message;
    }

    public static ActionOutcome ok() {
        return new ActionOutcome(STATUS_OK, null, null);
    }

    public static ActionOutcome ok(Map<String, String> variables) {
        return new ActionOutcome(STATUS_OK, variables, null);
    }

    public static ActionOutcome of(String status, Map<String, String> variables) {
        return new ActionOutcome(status, variables, null);
    }

    public static ActionOutcome error(String message) {
        return new ActionOutcome(STATUS_ERROR, null, message);
    }

    public static ActionOutcome cancelled(String message) {
        return new ActionOutcome(STATUS_CANCELLED, null, message);
    }

    public String getStatus() {
        return status;
    }

    public Map<String, String> getVariables() {
        return variables;
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    public boolean isSuccessful() {
        return STATUS_OK.equalsIgnoreCase(status);
    }

    public boolean isCancelled() {
        return STATUS_CANCELLED.equalsIgnoreCase(status);
    }

    public boolean isError() {
        return STATUS_ERROR.equalsIgnoreCase(status);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionOutcome that = (ActionOutcome) o;
        return status.equals(that.status) &&
               variables.equals(that.variables) &&
               Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, variables, message);
    }

    @Override
    public String toString() {
        return "ActionOutcome{status='" + status + '\'' +
                ", variables=" + variables.keySet() +
                (message != null ? ", message='" + message + '\'' : "") + '}';
    }
}
