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

/**
 * A single option offered by a {@link NodeKind#CHOICE} node. The label is what the user
 * sees, the value is what gets passed back to the engine when advancing.
 */
public final class ChoiceOption {

    private final String label;
    private final String value;

    public ChoiceOption(String label, String value) {
        this.label = Objects.requireNonNull(label, "Choice label cannot be null");
        this.value = Objects.requireNonNull(value, "Choice value cannot be null");
    }

    public String getLabel() {
        return label;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChoiceOption that = (ChoiceOption) o;
        return label.equals(that.label) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, value);
    }

    @Override
    public String toString() {
        return "ChoiceOption{label='" + label + "', value='" + value + "'}";
    }
}
