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

package dev.mars.quill.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration for the Quill orchestration core.
 * Values are layered: built-in defaults, then {@code quill.properties},
 * then {@code quill.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class QuillConfiguration {
    private static final Logger logger = Logger.getLogger(QuillConfiguration.class.getName());

    public static final String MAX_CONCURRENCY = "quill.executor.max.concurrency";
    public static final String STEP_DEFAULT_TIMEOUT_MS = "quill.step.default.timeout.ms";
    public static final String STEP_RETRY_DELAY_MS = "quill.step.retry.delay.ms";
    public static final String CHECKPOINT_STORAGE_DIR = "quill.checkpoint.storage.dir";
    public static final String CHECKPOINT_STORAGE_TYPE = "quill.checkpoint.storage.type";
    public static final String CHECKPOINT_KEEP_LAST = "quill.checkpoint.keep.last";
    public static final String CHECKPOINT_AUTO_CLEANUP = "quill.checkpoint.auto.cleanup";
    public static final String CHECKPOINT_KEEP_AFTER_COMPLETION = "quill.checkpoint.keep.after.completion";
    public static final String CHECKPOINT_SAVE_MAX_ATTEMPTS = "quill.checkpoint.save.max.attempts";
    public static final String CHECKPOINT_SAVE_RETRY_DELAY_MS = "quill.checkpoint.save.retry.delay.ms";
    public static final String EVENTS_HISTORY_SIZE = "quill.events.history.size";
    public static final String METRICS_ENABLED = "quill.metrics.enabled";

    // Default configuration values
    private static final int DEFAULT_MAX_CONCURRENCY = 4;
    private static final long DEFAULT_STEP_TIMEOUT_MS = 300_000; // 5 minutes
    private static final long DEFAULT_STEP_RETRY_DELAY_MS = 1000;
    private static final String DEFAULT_CHECKPOINT_DIR = ".checkpoints";
    private static final String DEFAULT_CHECKPOINT_STORAGE_TYPE = "file";
    private static final int DEFAULT_KEEP_LAST = 10;
    private static final int DEFAULT_KEEP_AFTER_COMPLETION = 5;
    private static final int DEFAULT_SAVE_MAX_ATTEMPTS = 3;
    private static final long DEFAULT_SAVE_RETRY_DELAY_MS = 200;
    private static final int DEFAULT_EVENT_HISTORY_SIZE = 1000;

    private final Properties properties;

    public QuillConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public QuillConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Executor
    public int getMaxConcurrency() {
        return Math.max(1, getIntProperty(MAX_CONCURRENCY, DEFAULT_MAX_CONCURRENCY));
    }

    public Duration getDefaultStepTimeout() {
        return Duration.ofMillis(getLongProperty(STEP_DEFAULT_TIMEOUT_MS, DEFAULT_STEP_TIMEOUT_MS));
    }

    public long getStepRetryDelayMs() {
        return getLongProperty(STEP_RETRY_DELAY_MS, DEFAULT_STEP_RETRY_DELAY_MS);
    }

    // Checkpoints
    public Path getCheckpointStorageDir() {
        return Paths.get(getStringProperty(CHECKPOINT_STORAGE_DIR, DEFAULT_CHECKPOINT_DIR));
    }

    public String getCheckpointStorageType() {
        return getStringProperty(CHECKPOINT_STORAGE_TYPE, DEFAULT_CHECKPOINT_STORAGE_TYPE).trim().toLowerCase();
    }

    public int getCheckpointKeepLast() {
        return Math.max(0, getIntProperty(CHECKPOINT_KEEP_LAST, DEFAULT_KEEP_LAST));
    }

    public boolean isCheckpointAutoCleanup() {
        return getBooleanProperty(CHECKPOINT_AUTO_CLEANUP, true);
    }

    public int getCheckpointKeepAfterCompletion() {
        return Math.max(0, getIntProperty(CHECKPOINT_KEEP_AFTER_COMPLETION, DEFAULT_KEEP_AFTER_COMPLETION));
    }

    public int getCheckpointSaveMaxAttempts() {
        return Math.max(1, getIntProperty(CHECKPOINT_SAVE_MAX_ATTEMPTS, DEFAULT_SAVE_MAX_ATTEMPTS));
    }

    public long getCheckpointSaveRetryDelayMs() {
        return getLongProperty(CHECKPOINT_SAVE_RETRY_DELAY_MS, DEFAULT_SAVE_RETRY_DELAY_MS);
    }

    // Events and monitoring
    public int getEventHistorySize() {
        return getIntProperty(EVENTS_HISTORY_SIZE, DEFAULT_EVENT_HISTORY_SIZE);
    }

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

    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid integer value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
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
                logger.warning("Invalid long value for property " + key + ": " + value +
                             ". Using default: " + defaultValue);
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
        properties.setProperty(MAX_CONCURRENCY, String.valueOf(DEFAULT_MAX_CONCURRENCY));
        properties.setProperty(STEP_DEFAULT_TIMEOUT_MS, String.valueOf(DEFAULT_STEP_TIMEOUT_MS));
        properties.setProperty(STEP_RETRY_DELAY_MS, String.valueOf(DEFAULT_STEP_RETRY_DELAY_MS));
        properties.setProperty(CHECKPOINT_STORAGE_DIR, DEFAULT_CHECKPOINT_DIR);
        properties.setProperty(CHECKPOINT_STORAGE_TYPE, DEFAULT_CHECKPOINT_STORAGE_TYPE);
        properties.setProperty(CHECKPOINT_KEEP_LAST, String.valueOf(DEFAULT_KEEP_LAST));
        properties.setProperty(CHECKPOINT_AUTO_CLEANUP, "true");
        properties.setProperty(CHECKPOINT_KEEP_AFTER_COMPLETION, String.valueOf(DEFAULT_KEEP_AFTER_COMPLETION));
        properties.setProperty(CHECKPOINT_SAVE_MAX_ATTEMPTS, String.valueOf(DEFAULT_SAVE_MAX_ATTEMPTS));
        properties.setProperty(CHECKPOINT_SAVE_RETRY_DELAY_MS, String.valueOf(DEFAULT_SAVE_RETRY_DELAY_MS));
        properties.setProperty(EVENTS_HISTORY_SIZE, String.valueOf(DEFAULT_EVENT_HISTORY_SIZE));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "quill.properties",
                "config/quill.properties",
                System.getProperty("user.home") + "/.quill/quill.properties",
                "/etc/quill/quill.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: " + configPath);
                    return;
                } catch (IOException e) {
                    logger.warning("Failed to load configuration from " + configPath + ": " + e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("quill.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warning("Failed to load configuration from classpath: " + e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("quill."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "QuillConfiguration{" +
                "maxConcurrency=" + getMaxConcurrency() +
                ", checkpointStorage=" + getCheckpointStorageType() +
                ", checkpointDir='" + getCheckpointStorageDir() + '\'' +
                ", keepLast=" + getCheckpointKeepLast() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
