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


package dev.mars.flowdraw.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for Flowdraw.
 * Resolves layout geometry and output options from defaults, an optional
 * {@code flowdraw.properties} file and {@code flowdraw.*} system properties, in that order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class FlowdrawConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FlowdrawConfiguration.class);

    public static final String NODE_WIDTH = "flowdraw.layout.node.width";
    public static final String NODE_HEIGHT = "flowdraw.layout.node.height";
    public static final String START_X = "flowdraw.layout.start.x";
    public static final String START_Y = "flowdraw.layout.start.y";
    public static final String SPACING_X = "flowdraw.layout.spacing.x";
    public static final String OUTPUT_INDENT = "flowdraw.output.indent";

    private static final String PROPERTIES_FILE = "flowdraw.properties";

    private final Properties properties;

    public FlowdrawConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public FlowdrawConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Layout
    public int getNodeWidth() {
        return getIntProperty(NODE_WIDTH, LayoutSettings.DEFAULT_NODE_WIDTH);
    }

    public int getNodeHeight() {
        return getIntProperty(NODE_HEIGHT, LayoutSettings.DEFAULT_NODE_HEIGHT);
    }

    public int getStartX() {
        return getIntProperty(START_X, LayoutSettings.DEFAULT_START_X);
    }

    public int getStartY() {
        return getIntProperty(START_Y, LayoutSettings.DEFAULT_START_Y);
    }

    public int getSpacingX() {
        return getIntProperty(SPACING_X, LayoutSettings.DEFAULT_SPACING_X);
    }

    /**
     * Builds layout settings from the resolved properties. Values the layout rejects
     * (non-positive sizes, negative spacing) fall back to the defaults as a whole.
     */
    public LayoutSettings getLayoutSettings() {
        try {
            return new LayoutSettings(getNodeWidth(), getNodeHeight(), getStartX(), getStartY(), getSpacingX());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid layout configuration ({}). Using default layout.", e.getMessage());
            return LayoutSettings.defaults();
        }
    }

    // Output
    public boolean isIndentOutput() {
        return getBooleanProperty(OUTPUT_INDENT, false);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
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

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(NODE_WIDTH, String.valueOf(LayoutSettings.DEFAULT_NODE_WIDTH));
        properties.setProperty(NODE_HEIGHT, String.valueOf(LayoutSettings.DEFAULT_NODE_HEIGHT));
        properties.setProperty(START_X, String.valueOf(LayoutSettings.DEFAULT_START_X));
        properties.setProperty(START_Y, String.valueOf(LayoutSettings.DEFAULT_START_Y));
        properties.setProperty(SPACING_X, String.valueOf(LayoutSettings.DEFAULT_SPACING_X));
        properties.setProperty(OUTPUT_INDENT, "false");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                PROPERTIES_FILE,
                "config/" + PROPERTIES_FILE,
                System.getProperty("user.home") + "/.flowdraw/" + PROPERTIES_FILE
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
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
                .filter(entry -> entry.getKey().toString().startsWith("flowdraw."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "FlowdrawConfiguration{" +
                "layout=" + getLayoutSettings() +
                ", indentOutput=" + isIndentOutput() +
                '}';
    }
}
