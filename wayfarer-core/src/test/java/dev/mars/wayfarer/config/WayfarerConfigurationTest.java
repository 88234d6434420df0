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


package dev.mars.wayfarer.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class WayfarerConfigurationTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(WayfarerConfiguration.ACTION_TIMEOUT_MS);
    }

    @Test
    void testDefaults() {
        WayfarerConfiguration config = new WayfarerConfiguration(new Properties());

        assertEquals(24, config.getResumptionWindowHours());
        assertEquals("location", config.getResumptionDomain());
        assertEquals(16, config.getResumptionKeyLength());
        assertEquals(0, config.getActionTimeoutMs());
        assertTrue(config.isActionExecutionTimeLogged());
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void testExplicitProperties() {
        Properties props = new Properties();
        props.setProperty(WayfarerConfiguration.RESUMPTION_WINDOW_HOURS, "12");
        props.setProperty(WayfarerConfiguration.RESUMPTION_DOMAIN, "venue");
        props.setProperty(WayfarerConfiguration.METRICS_ENABLED, "false");

        WayfarerConfiguration config = new WayfarerConfiguration(props);

        assertEquals(12, config.getResumptionWindowHours());
        assertEquals("venue", config.getResumptionDomain());
        assertFalse(config.isMetricsEnabled());
    }

    @Test
    void testInvalidNumberFallsBackToDefault() {
        Properties props = new Properties();
        props.setProperty(WayfarerConfiguration.RESUMPTION_KEY_LENGTH, "sixteen");

        WayfarerConfiguration config = new WayfarerConfiguration(props);

        assertEquals(16, config.getResumptionKeyLength());
    }

    @Test
    void testClasspathFileAndSystemPropertyOverride() {
        System.setProperty(WayfarerConfiguration.ACTION_TIMEOUT_MS, "750");

        WayfarerConfiguration config = new WayfarerConfiguration();

        // wayfarer.properties on the test classpath sets the window to 48
        assertEquals(48, config.getResumptionWindowHours());
        assertEquals(750, config.getActionTimeoutMs());
    }

    @Test
    void testSetProperty() {
        WayfarerConfiguration config = new WayfarerConfiguration(new Properties());
        config.setProperty(WayfarerConfiguration.ACTION_LOG_EXECUTION_TIME, "false");

        assertFalse(config.isActionExecutionTimeLogged());
        assertEquals("false", config.getProperty(WayfarerConfiguration.ACTION_LOG_EXECUTION_TIME));
        assertEquals("fallback", config.getProperty("wayfarer.unknown", "fallback"));
    }
}
