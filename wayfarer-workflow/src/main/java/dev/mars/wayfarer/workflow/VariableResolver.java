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


package dev.mars.wayfarer.workflow;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code {{variableName}}} references against instance variables.
 * Lookups are case-insensitive; a reference to an unset variable resolves to an empty string.
 */
public class VariableResolver {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{([^}]+)\\}\\}");

    private final Map<String, String> variables;

    public VariableResolver(Map<String, String> variables) {
        this.variables = new LinkedHashMap<>();
        if (variables != null) {
            variables.forEach((key, value) -> this.variables.put(key.toLowerCase(Locale.ROOT), value));
        }
    }

    public String resolve(String template) {
        if (template == null) {
            return null;
        }

        Matcher matcher = VARIABLE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String variableName = matcher.group(1).trim();
            String value = variables.get(variableName.toLowerCase(Locale.ROOT));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value : ""));
        }

        matcher.appendTail(result);
        return result.toString();
    }

    public Map<String, String> resolveAll(Map<String, String> templates) {
        Map<String, String> resolved = new LinkedHashMap<>();
        if (templates != null) {
            templates.forEach((key, value) -> resolved.put(key, resolve(value)));
        }
        return resolved;
    }

    public static boolean containsVariables(String template) {
        return template != null && VARIABLE_PATTERN.matcher(template).find();
    }
}
