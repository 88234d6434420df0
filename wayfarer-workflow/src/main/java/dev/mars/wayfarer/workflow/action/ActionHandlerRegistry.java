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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps action names to handlers. Names are matched case-insensitively and registration is
 * safe from any thread; a later registration under the same name replaces the earlier one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ActionHandlerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ActionHandlerRegistry.class);

    private final Map<String, ActionHandler> handlers = new ConcurrentHashMap<>();

    public void register(ActionHandler handler) {
        Objects.requireNonNull(handler, "Action handler cannot be null");
        register(handler.getActionName(), handler);
    }

    /**
     * Register a handler under an alias name.
     */
    public void register(String actionName, ActionHandler handler) {
        Objects.requireNonNull(handler, "Action handler cannot be null");
        ActionHandler previous = handlers.put(key(actionName), handler);
        if (previous != null && previous != handler) {
            logger.info("Replaced action handler: {}", actionName);
        } else {
            logger.info("Registered action handler: {}", actionName);
        }
    }

    public Optional<ActionHandler> getHandler(String actionName) {
        if (actionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(actionName.toLowerCase(Locale.ROOT)));
    }

    public boolean isRegistered(String actionName) {
        return actionName != null && handlers.containsKey(actionName.toLowerCase(Locale.ROOT));
    }

    public List<String> getRegisteredActions() {
        return new ArrayList<>(handlers.keySet());
    }

    public boolean unregister(String actionName) {
        if (actionName == null) {
            return false;
        }
        boolean removed = handlers.remove(actionName.toLowerCase(Locale.ROOT)) != null;
        if (removed) {
            logger.info("Unregistered action handler: {}", actionName);
        }
        return removed;
    }

    private static String key(String actionName) {
        if (actionName == null || actionName.trim().isEmpty()) {
            throw new IllegalArgumentException("Action name cannot be null or empty");
        }
        return actionName.toLowerCase(Locale.ROOT);
    }
}
