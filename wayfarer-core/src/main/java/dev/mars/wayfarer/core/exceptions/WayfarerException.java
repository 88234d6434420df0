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


package dev.mars.wayfarer.core.exceptions;

/**
 * Base exception class for all Wayfarer-related exceptions.
 * Provides a common hierarchy for error handling throughout the engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WayfarerException extends Exception {

    public WayfarerException(String message) {
        super(message);
    }

    public WayfarerException(String message, Throwable cause) {
        super(message, cause);
    }

    public WayfarerException(Throwable cause) {
        super(cause);
    }
}
