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

package dev.mars.agentflow.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration management for the Agentflow engine.
 * Values are resolved from built-in defaults, then the first readable
 * {@code agentflow.properties} file, then {@code agentflow.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class AgentflowConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(AgentflowConfiguration.class);

    public static final String ENGINE_WORKER_THREADS = "agentflow.engine.worker.threads";
    public static final String CONCURRENT_BRANCH_THREADS = "agentflow.concurrent.branch.threads";
    public static final String MAGENTIC_MAX_ITERATIONS = "agentflow.magentic.max.iterations";
    public static final String GROUPCHAT_MAX_ROUNDS = "agentflow.groupchat.max.rounds";
    public static final String CUSTOM_WAIT_TIMEOUT_MS = "agentflow.custom.wait.timeout.ms";
    public static final String CUSTOM_WAIT_POLL_INTERVAL_MS = "agentflow.custom.wait.poll.interval.ms";
    public static final String CUSTOM_LOOP_MAX_ITERATIONS = "agentflow.custom.loop.max.iterations";
    public static final String METRICS_ENABLED = "agentflow.monitoring.metrics.enabled";

    // Default configuration values
    private static final int DEFAULT_ENGINE_WORKER_THREADS = 4;
    private static final int DEFAULT_CONCURRENT_BRANCH_THREADS = 8;
    private static final int DEFAULT_MAGENTIC_MAX_ITERATIONS = 10;
    private static final int DEFAULT_GROUPCHAT_MAX_ROUNDS = 3;
    private static final long DEFAULT_CUSTOM_WAIT_TIMEOUT_MS = 30000;
    private static final long DEFAULT_CUSTOM_WAIT_POLL_INTERVAL_MS = 100;
    private static final int DEFAULT_CUSTOM_LOOP_MAX_ITERATIONS = 10;

    private static final String CONFIG_FILE_NAME = "agentflow.properties";

    private final Properties properties;

    public AgentflowConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public AgentflowConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Engine Configuration
    public int getEngineWorkerThreads() {
        return getPositiveIntProperty(ENGINE_WORKER_THREADS, DEFAULT_ENGINE_WORKER_THREADS);
    }

    public int getConcurrentBranchThreads() {
        return getPositiveIntProperty(CONCURRENT_BRANCH_THREADS, DEFAULT_CONCURRENT_BRANCH_THREADS);
    }

    // Orchestration Configuration
    public int getMagenticMaxIterations() {
        return getPositiveIntProperty(MAGENTIC_MAX_ITERATIONS, DEFAULT_MAGENTIC_MAX_ITERATIONS);
    }

    public int getGroupChatMaxRounds() {
        return getPositiveIntProperty(GROUPCHAT_MAX_ROUNDS, DEFAULT_GROUPCHAT_MAX_ROUNDS);
    }

    public long getCustomWaitTimeoutMs() {
        return getLongProperty(CUSTOM_WAIT_TIMEOUT_MS, DEFAULT_CUSTOM_WAIT_TIMEOUT_MS);
    }

    public long getCustomWaitPollIntervalMs() {
        return getLongProperty(CUSTOM_WAIT_POLL_INTERVAL_MS, DEFAULT_CUSTOM_WAIT_POLL_INTERVAL_MS);
    }

    public int getCustomLoopMaxIterations() {
        return getPositiveIntProperty(CUSTOM_LOOP_MAX_ITERATIONS, DEFAULT_CUSTOM_LOOP_MAX_ITERATIONS);
    }

    // Monitoring Configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
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

    private int getPositiveIntProperty(String key, int defaultValue) {
        int value = getIntProperty(key, defaultValue);
        if (value <= 0) {
            logger.warn("Non-positive value for property {}: {}. Using default: {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
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

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
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
        properties.setProperty(ENGINE_WORKER_THREADS, String.valueOf(DEFAULT_ENGINE_WORKER_THREADS));
        properties.setProperty(CONCURRENT_BRANCH_THREADS, String.valueOf(DEFAULT_CONCURRENT_BRANCH_THREADS));
        properties.setProperty(MAGENTIC_MAX_ITERATIONS, String.valueOf(DEFAULT_MAGENTIC_MAX_ITERATIONS));
        properties.setProperty(GROUPCHAT_MAX_ROUNDS, String.valueOf(DEFAULT_GROUPCHAT_MAX_ROUNDS));
        properties.setProperty(CUSTOM_WAIT_TIMEOUT_MS, String.valueOf(DEFAULT_CUSTOM_WAIT_TIMEOUT_MS));
        properties.setProperty(CUSTOM_WAIT_POLL_INTERVAL_MS, String.valueOf(DEFAULT_CUSTOM_WAIT_POLL_INTERVAL_MS));
        properties.setProperty(CUSTOM_LOOP_MAX_ITERATIONS, String.valueOf(DEFAULT_CUSTOM_LOOP_MAX_ITERATIONS));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                CONFIG_FILE_NAME,
                "config/" + CONFIG_FILE_NAME,
                System.getProperty("user.home") + "/.agentflow/" + CONFIG_FILE_NAME,
                "/etc/agentflow/" + CONFIG_FILE_NAME
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
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
                .filter(entry -> entry.getKey().toString().startsWith("agentflow."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "AgentflowConfiguration{" +
                "engineWorkerThreads=" + getEngineWorkerThreads() +
                ", concurrentBranchThreads=" + getConcurrentBranchThreads() +
                ", magenticMaxIterations=" + getMagenticMaxIterations() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
