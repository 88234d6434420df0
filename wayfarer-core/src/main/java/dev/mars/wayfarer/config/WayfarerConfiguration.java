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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for the Wayfarer engine.
 * <p>
 * Values are layered: built-in defaults, then the first readable {@code wayfarer.properties}
 * found in the working directory, {@code config/}, {@code ~/.wayfarer/} or the classpath,
 * then any {@code wayfarer.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WayfarerConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(WayfarerConfiguration.class);

    public static final String RESUMPTION_WINDOW_HOURS = "wayfarer.resumption.window.hours";
    public static final String RESUMPTION_DOMAIN = "wayfarer.resumption.domain";
    public static final String RESUMPTION_KEY_LENGTH = "wayfarer.resumption.key.length";
    public static final String ACTION_TIMEOUT_MS = "wayfarer.action.timeout.ms";
    public static final String ACTION_LOG_EXECUTION_TIME = "wayfarer.action.log.execution.time";
    public static final String METRICS_ENABLED = "wayfarer.metrics.enabled";

    private static final long DEFAULT_RESUMPTION_WINDOW_HOURS = 24;
    private static final String DEFAULT_RESUMPTION_DOMAIN = "location";
    private static final int DEFAULT_RESUMPTION_KEY_LENGTH = 16;
    private static final long DEFAULT_ACTION_TIMEOUT_MS = 0;

    private static final String CONFIG_FILE = "wayfarer.properties";

    private final Properties properties;

    public WayfarerConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public WayfarerConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Resumption
    public long getResumptionWindowHours() {
        return getLongProperty(RESUMPTION_WINDOW_HOURS, DEFAULT_RESUMPTION_WINDOW_HOURS);
    }

    public String getResumptionDomain() {
        return getStringProperty(RESUMPTION_DOMAIN, DEFAULT_RESUMPTION_DOMAIN);
    }

    public int getResumptionKeyLength() {
        return getIntProperty(RESUMPTION_KEY_LENGTH, DEFAULT_RESUMPTION_KEY_LENGTH);
    }

    // Actions
    public long getActionTimeoutMs() {
        return getLongProperty(ACTION_TIMEOUT_MS, DEFAULT_ACTION_TIMEOUT_MS);
    }

    public boolean isActionExecutionTimeLogged() {
        return getBooleanProperty(ACTION_LOG_EXECUTION_TIME, true);
    }

    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    private String getStringProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null || value.trim().isEmpty() ? defaultValue : value.trim();
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}",
                        key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(RESUMPTION_WINDOW_HOURS, String.valueOf(DEFAULT_RESUMPTION_WINDOW_HOURS));
        properties.setProperty(RESUMPTION_DOMAIN, DEFAULT_RESUMPTION_DOMAIN);
        properties.setProperty(RESUMPTION_KEY_LENGTH, String.valueOf(DEFAULT_RESUMPTION_KEY_LENGTH));
        properties.setProperty(ACTION_TIMEOUT_MS, String.valueOf(DEFAULT_ACTION_TIMEOUT_MS));
        properties.setProperty(ACTION_LOG_EXECUTION_TIME, "true");
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE,
                "config/" + CONFIG_FILE,
                System.getProperty("user.home") + "/.wayfarer/" + CONFIG_FILE
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("wayfarer."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "WayfarerConfiguration{" +
                "resumptionWindowHours=" + getResumptionWindowHours() +
                ", resumptionDomain='" + getResumptionDomain() + '\'' +
                ", actionTimeoutMs=" + getActionTimeoutMs() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
