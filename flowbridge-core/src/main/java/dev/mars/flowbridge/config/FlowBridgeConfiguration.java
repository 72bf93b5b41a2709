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

package dev.mars.flowbridge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for FlowBridge.
 * Handles loading and providing access to conversion and layout parameters.
 * <p>
 * Resolution order: built-in defaults, then the first readable {@code flowbridge.properties}
 * file (or the classpath resource of that name), then {@code flowbridge.*} system properties.
 * 
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class FlowBridgeConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(FlowBridgeConfiguration.class);
    
    // Flowchart layout geometry
    private static final int DEFAULT_STEP_X = 300;
    private static final int DEFAULT_STEP_WIDTH = 110;
    private static final int DEFAULT_STEP_HEIGHT = 70;
    private static final int DEFAULT_DECISION_X = 325;
    private static final int DEFAULT_DECISION_WIDTH = 60;
    private static final int DEFAULT_DECISION_HEIGHT = 60;
    private static final int DEFAULT_ROW_ORIGIN_Y = 200;
    private static final int DEFAULT_ROW_SPACING = 100;
    private static final int DEFAULT_TRUE_LANE_X = 150;
    private static final int DEFAULT_FALSE_LANE_X = 560;
    private static final int DEFAULT_ANCHOR_X = 330;
    private static final int DEFAULT_ANCHOR_Y = 10;
    private static final int DEFAULT_ANCHOR_SIZE = 50;
    
    private final Properties properties;
    
    public FlowBridgeConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }
    
    public FlowBridgeConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }
    
    /**
     * Configuration holding only the built-in defaults, ignoring files and system properties.
     */
    public static FlowBridgeConfiguration defaults() {
        return new FlowBridgeConfiguration(null);
    }
    
    // Layout Configuration
    public int getStepX() {
        return getIntProperty("flowbridge.layout.step.x", DEFAULT_STEP_X);
    }
    
    public int getStepWidth() {
        return getIntProperty("flowbridge.layout.step.width", DEFAULT_STEP_WIDTH);
    }
    
    public int getStepHeight() {
        return getIntProperty("flowbridge.layout.step.height", DEFAULT_STEP_HEIGHT);
    }
    
    public int getDecisionX() {
        return getIntProperty("flowbridge.layout.decision.x", DEFAULT_DECISION_X);
    }
    
    public int getDecisionWidth() {
        return getIntProperty("flowbridge.layout.decision.width", DEFAULT_DECISION_WIDTH);
    }
    
    public int getDecisionHeight() {
        return getIntProperty("flowbridge.layout.decision.height", DEFAULT_DECISION_HEIGHT);
    }
    
    public int getRowOriginY() {
        return getIntProperty("flowbridge.layout.row.origin.y", DEFAULT_ROW_ORIGIN_Y);
    }
    
    public int getRowSpacing() {
        return getIntProperty("flowbridge.layout.row.spacing", DEFAULT_ROW_SPACING);
    }
    
    public int getTrueLaneX() {
        return getIntProperty("flowbridge.layout.lane.true.x", DEFAULT_TRUE_LANE_X);
    }
    
    public int getFalseLaneX() {
        return getIntProperty("flowbridge.layout.lane.false.x", DEFAULT_FALSE_LANE_X);
    }
    
    public int getAnchorX() {
        return getIntProperty("flowbridge.layout.anchor.x", DEFAULT_ANCHOR_X);
    }
    
    public int getAnchorY() {
        return getIntProperty("flowbridge.layout.anchor.y", DEFAULT_ANCHOR_Y);
    }
    
    public int getAnchorSize() {
        return getIntProperty("flowbridge.layout.anchor.size", DEFAULT_ANCHOR_SIZE);
    }
    
    // Writer Configuration
    public boolean isAutoCorrectionEnabled() {
        return getBooleanProperty("flowbridge.correction.enabled", true);
    }
    
    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }
    
    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
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
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
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
        properties.setProperty("flowbridge.layout.step.x", String.valueOf(DEFAULT_STEP_X));
        properties.setProperty("flowbridge.layout.step.width", String.valueOf(DEFAULT_STEP_WIDTH));
        properties.setProperty("flowbridge.layout.step.height", String.valueOf(DEFAULT_STEP_HEIGHT));
        properties.setProperty("flowbridge.layout.decision.x", String.valueOf(DEFAULT_DECISION_X));
        properties.setProperty("flowbridge.layout.decision.width", String.valueOf(DEFAULT_DECISION_WIDTH));
        properties.setProperty("flowbridge.layout.decision.height", String.valueOf(DEFAULT_DECISION_HEIGHT));
        properties.setProperty("flowbridge.layout.row.origin.y", String.valueOf(DEFAULT_ROW_ORIGIN_Y));
        properties.setProperty("flowbridge.layout.row.spacing", String.valueOf(DEFAULT_ROW_SPACING));
        properties.setProperty("flowbridge.layout.lane.true.x", String.valueOf(DEFAULT_TRUE_LANE_X));
        properties.setProperty("flowbridge.layout.lane.false.x", String.valueOf(DEFAULT_FALSE_LANE_X));
        properties.setProperty("flowbridge.layout.anchor.x", String.valueOf(DEFAULT_ANCHOR_X));
        properties.setProperty("flowbridge.layout.anchor.y", String.valueOf(DEFAULT_ANCHOR_Y));
        properties.setProperty("flowbridge.layout.anchor.size", String.valueOf(DEFAULT_ANCHOR_SIZE));
        properties.setProperty("flowbridge.correction.enabled", "true");
    }
    
    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "flowbridge.properties",
                "config/flowbridge.properties",
                System.getProperty("user.home") + "/.flowbridge/flowbridge.properties"
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
        
        try (InputStream input = getClass().getClassLoader().getResourceAsStream("flowbridge.properties")) {
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
                .filter(entry -> entry.getKey().toString().startsWith("flowbridge."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }
    
    @Override
    public String toString() {
        return "FlowBridgeConfiguration{" +
                "step=" + getStepWidth() + "x" + getStepHeight() + "@" + getStepX() +
                ", decision=" + getDecisionWidth() + "x" + getDecisionHeight() + "@" + getDecisionX() +
                ", rowSpacing=" + getRowSpacing() +
                ", autoCorrection=" + isAutoCorrectionEnabled() +
                '}';
    }
}
