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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowNodeTest {

    @Test
    void testActionNodeRequiresActionName() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> WorkflowNode.builder("fetch", NodeKind.ACTION).build());
        assertTrue(e.getMessage().contains("fetch"));
    }

    @Test
    void testOnlyActionNodesNameActions() {
        assertThrows(IllegalArgumentException.class,
                () -> WorkflowNode.builder("hello", NodeKind.PROMPT).actionName("fetch_places").build());
        assertThrows(IllegalArgumentException.class,
                () -> WorkflowNode.builder("hello", NodeKind.PROMPT).parameter("q", "x").build());
    }

    @Test
    void testOnlyChoiceNodesOfferChoices() {
        assertThrows(IllegalArgumentException.class,
                () -> WorkflowNode.builder("done", NodeKind.TERMINAL).choice("Yes", "yes").build());
    }

    @Test
    void testActionNodeKeepsParametersInOrder() {
        WorkflowNode node = WorkflowNode.builder("fetch", NodeKind.ACTION)
                .actionName("fetch_places")
                .parameter("query", "{{place}}")
                .parameter("radius", "500")
                .build();

        assertEquals("fetch_places", node.getActionName().orElseThrow());
        assertEquals(List.of("query", "radius"), List.copyOf(node.getActionParameters().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> node.getActionParameters().put("x", "y"));
    }

    @Test
    void testChoiceNode() {
        WorkflowNode node = WorkflowNode.choice("ask", "Explore?",
                List.of(new ChoiceOption("Yes", "yes"), new ChoiceOption("No", "no")));

        assertEquals(NodeKind.CHOICE, node.getKind());
        assertEquals(2, node.getChoices().size());
        assertTrue(node.getActionName().isEmpty());
        assertFalse(node.isTerminal());
    }

    @Test
    void testNodeKindFromString() {
        assertEquals(NodeKind.ACTION, NodeKind.fromString(" action "));
        assertEquals(NodeKind.TERMINAL, NodeKind.fromString("Terminal"));
        assertThrows(IllegalArgumentException.class, () -> NodeKind.fromString("fork"));
        assertThrows(IllegalArgumentException.class, () -> NodeKind.fromString(""));
    }

    @Test
    void testDefinitionLookups() {
        WorkflowDefinition definition = WorkflowDefinition.builder("tour")
                .name("Tour")
                .node(WorkflowNode.prompt("a", "A"))
                .node(WorkflowNode.prompt("b", "B"))
                .node(WorkflowNode.terminal("c", "C"))
                .transition("a", "b")
                .transition("a", "c", "skip")
                .transition("b", "c")
                .startPoint("a")
                .build();

        assertEquals("a", definition.getStartNodeId().orElseThrow());
        assertEquals(2, definition.getOutgoingTransitions("a").size());
        assertTrue(definition.getOutgoingTransitions("c").isEmpty());

        WorkflowDefinition copy = definition.withIdentity("location:abc", "Tour copy");
        assertEquals("location:abc", copy.getId());
        assertEquals("Tour copy", copy.getName());
        assertEquals(definition.getNodes(), copy.getNodes());
        assertEquals(definition.getTransitions(), copy.getTransitions());
    }

    @Test
    void testDuplicateNodeIdsRejected() {
        WorkflowDefinition.Builder builder = WorkflowDefinition.builder("dup").node(WorkflowNode.prompt("a", "A"));
        assertThrows(IllegalArgumentException.class, () -> builder.node(WorkflowNode.terminal("a", "again")));
    }
}
