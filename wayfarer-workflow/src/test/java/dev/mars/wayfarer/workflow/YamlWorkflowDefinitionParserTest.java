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
import dev.mars.wayfarer.core.WorkflowDefinition;
import dev.mars.wayfarer.core.WorkflowNode;
import dev.mars.wayfarer.validation.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class YamlWorkflowDefinitionParserTest {

    private YamlWorkflowDefinitionParser parser;

    @BeforeEach
    void setUp() {
        parser = new YamlWorkflowDefinitionParser();
    }

    static String resource(String name) throws IOException {
        try (InputStream in = YamlWorkflowDefinitionParserTest.class.getResourceAsStream("/workflows/" + name)) {
            assertNotNull(in, "missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void testParseNewLocationWorkflow() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(resource("new-location.yaml"));

        assertEquals("new-location", definition.getId());
        assertEquals("New location", definition.getName());
        assertEquals(List.of("welcome"), definition.getStartPoints());
        assertEquals(6, definition.getNodes().size());
        assertEquals(7, definition.getTransitions().size());

        WorkflowNode ask = definition.getNode("ask").orElseThrow();
        assertEquals(NodeKind.CHOICE, ask.getKind());
        assertEquals("Show me", ask.getChoices().get(0).getLabel());
        assertEquals("explore", ask.getChoices().get(0).getValue());

        WorkflowNode fetch = definition.getNode("fetch").orElseThrow();
        assertEquals("fetch_places", fetch.getActionName().orElseThrow());
        assertEquals(Map.of("query", "{{context}}", "radius", "500"), fetch.getActionParameters());

        assertTrue(parser.validate(definition).isValid());
    }

    @Test
    void testParseFromFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("tour.yaml");
        Files.writeString(file, resource("new-location.yaml"));

        WorkflowDefinition definition = parser.parse(file);

        assertEquals("new-location", definition.getId());
    }

    @Test
    void testMissingFile(@TempDir Path tempDir) {
        WorkflowParseException e = assertThrows(WorkflowParseException.class,
                () -> parser.parse(tempDir.resolve("absent.yaml")));
        assertTrue(e.getMessage().contains("Failed to read"));
    }

    @Test
    void testIdentityOverride() throws Exception {
        String yaml = resource("new-location.yaml").replace("  id: new-location\n", "");

        assertThrows(WorkflowParseException.class, () -> parser.parseFromString(yaml));

        WorkflowDefinition definition = parser.parseFromString(yaml, "location:1234", "Harbour");
        assertEquals("location:1234", definition.getId());
        assertEquals("Harbour", definition.getName());
    }

    @Test
    void testDanglingTransitionParsesButFailsValidation() throws Exception {
        WorkflowDefinition definition = parser.parseFromString(resource("invalid-dangling.yaml"));

        ValidationResult result = parser.validate(definition);

        assertFalse(result.isValid());
        assertEquals("transitions[0].to", result.getErrors().get(0).getFieldPath());
    }

    @Test
    void testUnknownKindReportsFieldPath() {
        String yaml = "metadata: {id: bad}\n" +
                "spec:\n" +
                "  startPoints: [a]\n" +
                "  nodes:\n" +
                "    - {id: a, kind: prompt}\n" +
                "    - {id: b, kind: fork}\n";

        WorkflowParseException e = assertThrows(WorkflowParseException.class, () -> parser.parseFromString(yaml));

        assertEquals("spec.nodes[1].kind", e.getFieldPath());
        assertTrue(e.getMessage().contains("fork"));
    }

    @Test
    void testActionNodeWithoutActionRejected() {
        String yaml = "metadata: {id: bad}\n" +
                "spec:\n" +
                "  startPoints: [a]\n" +
                "  nodes:\n" +
                "    - {id: a, kind: action, text: Go}\n";

        WorkflowParseException e = assertThrows(WorkflowParseException.class, () -> parser.parseFromString(yaml));

        assertEquals("spec.nodes[0]", e.getFieldPath());
    }

    @Test
    void testMissingSectionsRejected() {
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString(""));
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString("- just\n- a list\n"));
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString("metadata: {id: x}\n"));
        assertThrows(WorkflowParseException.class,
                () -> parser.parseFromString("metadata: {id: x}\nspec:\n  nodes:\n    - {id: a, kind: terminal}\n"));
        assertThrows(WorkflowParseException.class, () -> parser.parseFromString("metadata: [unclosed\n"));
    }
}
