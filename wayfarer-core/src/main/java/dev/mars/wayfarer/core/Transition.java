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

import java.util.Objects;
import java.util.Optional;

/**
 * Directed edge between two workflow nodes. A transition without a guard value is the
 * unconditional (default) exit of its source node.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Transition {

    private final String fromNodeId;
    private final String toNodeId;
    private final String guardValue;

    public Transition(String fromNodeId, String toNodeId) {
        this(fromNodeId, toNodeId, null);
    }

    public Transition(String fromNodeId, String toNodeId, String guardValue) {
        this.fromNodeId = Objects.requireNonNull(fromNodeId, "Source node ID cannot be null");
        this.toNodeId = Objects.requireNonNull(toNodeId, "Target node ID cannot be null");
        this.guardValue = guardValue;
    }

    public static Transition unconditional(String fromNodeId, String toNodeId) {
        return new Transition(fromNodeId, toNodeId, null);
    }

    public static Transition guarded(String fromNodeId, String toNodeId, String guardValue) {
        return new Transition(fromNodeId, toNodeId,
                Objects.requireNonNull(guardValue, "Guard value cannot be null"));
    }

    public String getFromNodeId() {
        return fromNodeId;
    }

    public String getToNodeId() {
        return toNodeId;
    }

    public Optional<String> getGuardValue() {
        return Optional.ofNullable(guardValue);
    }

    public boolean isUnconditional() {
        return guardValue == null;
    }

    public boolean matches(String choiceValue) {
        return guardValue != null && guardValue.equals(choiceValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transition that = (Transition) o;
        return fromNodeId.equals(that.fromNodeId) &&
               toNodeId.equals(that.toNodeId) &&
               Objects.equals(guardValue, that.guardValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromNodeId, toNodeId, guardValue);
    }

    @Override
    public String toString() {
        return "Transition{" + fromNodeId + " -> " + toNodeId +
               (guardValue != null ? " when '" + guardValue + "'" : "") + '}';
    }
}
