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

import dev.mars.wayfarer.core.NodeKind;
import dev.mars.wayfarer.core.Transition;
import dev.mars.wayfarer.core.WorkflowDefinition;
import dev.mars.wayfarer.core.WorkflowNode;
import dev.mars.wayfarer.validation.ValidationResult;
import dev.mars.wayfarer.validation.WorkflowDefinitionValidator;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 * Parses YAML workflow definitions using SnakeYAML.
 *
 * <pre>
 * metadata:
 *   id: new-location
 *   name: New location
 * spec:
 *   startPoints: [welcome]
 *   nodes:
 *     - id: welcome
 *       kind: choice
 *       text: Explore nearby?
 *       choices:
 *         - { label: Yes, value: "explore" }
 *     - id: fetch
 *       kind: action
 *       action: fetch_places
 *       parameters: { query: "{{place}}" }
 *   transitions:
 *     - { from: welcome, to: fetch, when: "explore" }
 * </pre>
 *
 * Scalars are read with their string form, so quote values that YAML would otherwise
 * turn into booleans ({@code yes}, {@code no}).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private final Yaml yaml;
    private final WorkflowDefinitionValidator validator;

    public YamlWorkflowDefinitionParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.validator = new WorkflowDefinitionValidator();
    }

    @Override
    public WorkflowDefinition parse(Path file) throws WorkflowParseException {
        try {
            String content = Files.readString(file);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + file, e);
        }
    }

    @Override
    public WorkflowDefinition parseFromString(String content) throws WorkflowParseException {
        return parseDocument(load(content), null, null);
    }

    @Override
    public WorkflowDefinition parseFromString(String content, String workflowId, String name)
            throws WorkflowParseException {
        return parseDocument(load(content), workflowId, name);
    }

    @Override
    public ValidationResult validate(WorkflowDefinition definition) {
        return validator.validate(definition);
    }

    private Map<String, Object> load(String content) throws WorkflowParseException {
        if (content == null || content.trim().isEmpty()) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        try {
            Object data = yaml.load(content);
            if (!(data instanceof Map)) {
                throw new WorkflowParseException("Empty or invalid YAML content");
            }
            return asMap(data);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed", e);
        }
    }

    private WorkflowDefinition parseDocument(Map<String, Object> data, String idOverride, String nameOverride)
            throws WorkflowParseException {
        Map<String, Object> metadata = getMapValue(data, "metadata");
        String id = idOverride != null ? idOverride : getStringValue(metadata, "id");
        if (id == null || id.trim().isEmpty()) {
            throw new WorkflowParseException("metadata.id", "Workflow id is required");
        }
        String name = nameOverride != null ? nameOverride : getStringValue(metadata, "name", id);

        Map<String, Object> spec = getMapValue(data, "spec");
        if (spec == null) {
            throw new WorkflowParseException("spec", "Workflow spec is required");
        }

        WorkflowDefinition.Builder builder = WorkflowDefinition.builder(id).name(name);

        List<Object> nodes = getListValue(spec, "nodes");
        if (nodes == null || nodes.isEmpty()) {
            throw new WorkflowParseException("spec.nodes", "At least one node is required");
        }
        for (int i = 0; i < nodes.size(); i++) {
            String path = "spec.nodes[" + i + "]";
            WorkflowNode node = parseNode(requireMap(nodes.get(i), path), path);
            try {
                builder.node(node);
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(path + ".id", e.getMessage(), e);
            }
        }

        List<Object> transitions = getListValue(spec, "transitions");
        if (transitions != null) {
            for (int i = 0; i < transitions.size(); i++) {
                String path = "spec.transitions[" + i + "]";
                builder.transition(parseTransition(requireMap(transitions.get(i), path), path));
            }
        }

        List<Object> startPoints = getListValue(spec, "startPoints");
        if (startPoints == null || startPoints.isEmpty()) {
            throw new WorkflowParseException("spec.startPoints", "At least one start point is required");
        }
        for (int i = 0; i < startPoints.size(); i++) {
            Object startPoint = startPoints.get(i);
            if (startPoint == null) {
                throw new WorkflowParseException("spec.startPoints[" + i + "]", "Start point cannot be empty");
            }
            builder.startPoint(startPoint.toString());
        }

        return builder.build();
    }

    private WorkflowNode parseNode(Map<String, Object> data, String path) throws WorkflowParseException {
        String id = getStringValue(data, "id");
        if (id == null || id.trim().isEmpty()) {
            throw new WorkflowParseException(path + ".id", "Node id is required");
        }

        NodeKind kind;
        try {
            kind = NodeKind.fromString(getStringValue(data, "kind"));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".kind", e.getMessage(), e);
        }

        WorkflowNode.Builder builder = WorkflowNode.builder(id, kind)
                .displayText(getStringValue(data, "text", ""))
                .actionName(getStringValue(data, "action"));

        Map<String, Object> parameters = getMapValue(data, "parameters");
        if (parameters != null) {
            for (Map.Entry<String, Object> entry : parameters.entrySet()) {
                if (entry.getValue() == null) {
                    throw new WorkflowParseException(path + ".parameters." + entry.getKey(),
                            "Parameter value cannot be empty");
                }
                builder.parameter(entry.getKey(), entry.getValue().toString());
            }
        }

        List<Object> choices = getListValue(data, "choices");
        if (choices != null) {
            for (int i = 0; i < choices.size(); i++) {
                String choicePath = path + ".choices[" + i + "]";
                Map<String, Object> choice = requireMap(choices.get(i), choicePath);
                String value = getStringValue(choice, "value");
                if (value == null) {
                    throw new WorkflowParseException(choicePath + ".value", "Choice value is required");
                }
                builder.choice(getStringValue(choice, "label", value), value);
            }
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    private Transition parseTransition(Map<String, Object> data, String path) throws WorkflowParseException {
        String from = getStringValue(data, "from");
        if (from == null || from.trim().isEmpty()) {
            throw new WorkflowParseException(path + ".from", "Transition source is required");
        }
        String to = getStringValue(data, "to");
        if (to == null || to.trim().isEmpty()) {
            throw new WorkflowParseException(path + ".to", "Transition target is required");
        }
        return new Transition(from, to, getStringValue(data, "when"));
    }

    private Map<String, Object> requireMap(Object value, String path) throws WorkflowParseException {
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(path, "Expected a mapping");
        }
        return asMap(value);
    }

    // Utility methods for safe type conversion
    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<Object, Object>) value).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private static String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? asMap(value) : null;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> getListValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof List ? (List<Object>) value : null;
    }
}
