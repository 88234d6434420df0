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

import java.util.Locale;

/**
 * Kinds of node that can appear in a conversational workflow graph.
 *
 * <ul>
 *   <li>{@link #PROMPT} displays text and moves on through its unconditional transition</li>
 *   <li>{@link #CHOICE} offers a set of options; advancing requires one of the choice values</li>
 *   <li>{@link #ACTION} triggers a named side-effecting handler when entered</li>
 *   <li>{@link #TERMINAL} ends the conversation, no outgoing transitions</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum NodeKind {
    PROMPT,
    CHOICE,
    ACTION,
    TERMINAL;

    /**
     * Case-insensitive lookup used by definition loaders.
     *
     * @throws IllegalArgumentException if the value names no kind
     */
    public static NodeKind fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Node kind cannot be empty");
        }
        try {
            return NodeKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node kind: " + value);
        }
    }
}
