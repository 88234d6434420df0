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

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariableResolverTest {

    @Test
    void testResolvesCaseInsensitively() {
        VariableResolver resolver = new VariableResolver(Map.of("Place", "Harbour", "radius", "500"));

        assertEquals("places near Harbour within 500m", resolver.resolve("places near {{ place }} within {{RADIUS}}m"));
    }

    @Test
    void testMissingVariableResolvesToEmpty() {
        VariableResolver resolver = new VariableResolver(Map.of());

        assertEquals("near ", resolver.resolve("near {{place}}"));
        assertNull(resolver.resolve(null));
    }

    @Test
    void testReplacementIsLiteral() {
        VariableResolver resolver = new VariableResolver(Map.of("price", "$5 \\ each"));

        assertEquals("costs $5 \\ each", resolver.resolve("costs {{price}}"));
    }

    @Test
    void testResolveAll() {
        Map<String, String> templates = new LinkedHashMap<>();
        templates.put("query", "{{context}}");
        templates.put("limit", "10");

        Map<String, String> resolved = new VariableResolver(Map.of("context", "Old Town")).resolveAll(templates);

        assertEquals(Map.of("query", "Old Town", "limit", "10"), resolved);
        assertTrue(VariableResolver.containsVariables("{{x}}"));
        assertFalse(VariableResolver.containsVariables("plain"));
    }
}
