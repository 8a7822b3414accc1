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

package dev.mars.gorgon.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration management for the Gorgon engine.
 * Values are layered as built-in defaults, then the first readable
 * {@code gorgon.properties} file, then {@code gorgon.*} system properties.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class GorgonConfiguration {
    private static final Logger logger = Logger.getLogger(GorgonConfiguration.class.getName());

    public static final String MAX_CONCURRENT_STEPS = "gorgon.scheduler.max.concurrent";
    public static final String DEFAULT_STEP_TIMEOUT_MS = "gorgon.step.default.timeout.ms";
    public static final String RETRY_BASE_DELAY_MS = "gorgon.retry.base.delay.ms";
    public static final String RETRY_MAX_DELAY_MS = "gorgon.retry.max.delay.ms";
    public static final String RATELIMIT_PREFIX = "gorgon.ratelimit.";
    public static final String RATELIMIT_DECREASE_FACTOR = "gorgon.ratelimit.decrease.factor";
    public static final String RATELIMIT_RECOVERY_WINDOW_MS = "gorgon.ratelimit.recovery.window.ms";
    public static final String CHECKPOINT_DIR = "gorgon.checkpoint.dir";
    public static final String CHECKPOINT_DELETE_ON_COMPLETION = "gorgon.checkpoint.delete.on.completion";
    public static final String METRICS_ENABLED = "gorgon.metrics.enabled";

    private static final int DEFAULT_MAX_CONCURRENT_STEPS = 8;
    private static final long DEFAULT_STEP_TIMEOUT = 300_000L;
    private static final long DEFAULT_RETRY_BASE_DELAY = 1000L;
    private static final long DEFAULT_RETRY_MAX_DELAY = 30_000L;
    private static final int DEFAULT_PROVIDER_MAX_CONCURRENT = 4;
    private static final int DEFAULT_PROVIDER_REQUESTS_PER_PERIOD = 60;
    private static final long DEFAULT_PROVIDER_PERIOD_MS = 60_000L;
    private static final double DEFAULT_DECREASE_FACTOR = 0.5;
    private static final long DEFAULT_RECOVERY_WINDOW = 30_000L;
    private static final String DEFAULT_CHECKPOINT_DIR =
            Paths.get(System.getProperty("java.io.tmpdir"), "gorgon", "checkpoints").toString();

    private final Properties properties;

    public GorgonConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public GorgonConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Scheduler
    public int getMaxConcurrentSteps() {
        return getIntProperty(MAX_CONCURRENT_STEPS, DEFAULT_MAX_CONCURRENT_STEPS);
    }

    public long getDefaultStepTimeoutMs() {
        return getLongProperty(DEFAULT_STEP_TIMEOUT_MS, DEFAULT_STEP_TIMEOUT);
    }

    public long getRetryBaseDelayMs() {
        return getLongProperty(RETRY_BASE_DELAY_MS, DEFAULT_RETRY_BASE_DELAY);
    }

    public long getRetryMaxDelayMs() {
        return getLongProperty(RETRY_MAX_DELAY_MS, DEFAULT_RETRY_MAX_DELAY);
    }

    // Rate limiting. Per-provider keys fall back to the "default" provider entry.
    public int getProviderMaxConcurrent(String provider) {
        return getIntProperty(providerKey(provider, "max.concurrent"),
                getIntProperty(providerKey("default", "max.concurrent"), DEFAULT_PROVIDER_MAX_CONCURRENT));
    }

    public int getProviderRequestsPerPeriod(String provider) {
        return getIntProperty(providerKey(provider, "requests.per.period"),
                getIntProperty(providerKey("default", "requests.per.period"), DEFAULT_PROVIDER_REQUESTS_PER_PERIOD));
    }

    public long getProviderPeriodMs(String provider) {
        return getLongProperty(providerKey(provider, "period.ms"),
                getLongProperty(providerKey("default", "period.ms"), DEFAULT_PROVIDER_PERIOD_MS));
    }

    public double getRateLimitDecreaseFactor() {
        return getDoubleProperty(RATELIMIT_DECREASE_FACTOR, DEFAULT_DECREASE_FACTOR);
    }

    public long getRateLimitRecoveryWindowMs() {
        return getLongProperty(RATELIMIT_RECOVERY_WINDOW_MS, DEFAULT_RECOVERY_WINDOW);
    }

    // Checkpoints
    public String getCheckpointDirectory() {
        return getStringProperty(CHECKPOINT_DIR, DEFAULT_CHECKPOINT_DIR);
    }

    public boolean isDeleteCheckpointOnCompletion() {
        return getBooleanProperty(CHECKPOINT_DELETE_ON_COMPLETION, true);
    }

    // Monitoring
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

    private static String providerKey(String provider, String suffix) {
        return RATELIMIT_PREFIX + provider + "." + suffix;
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

    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warning("Invalid decimal value for property " + key + ": " + value +
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
        properties.setProperty(MAX_CONCURRENT_STEPS, String.valueOf(DEFAULT_MAX_CONCURRENT_STEPS));
        properties.setProperty(DEFAULT_STEP_TIMEOUT_MS, String.valueOf(DEFAULT_STEP_TIMEOUT));
        properties.setProperty(RETRY_BASE_DELAY_MS, String.valueOf(DEFAULT_RETRY_BASE_DELAY));
        properties.setProperty(RETRY_MAX_DELAY_MS, String.valueOf(DEFAULT_RETRY_MAX_DELAY));
        properties.setProperty(providerKey("default", "max.concurrent"), String.valueOf(DEFAULT_PROVIDER_MAX_CONCURRENT));
        properties.setProperty(providerKey("default", "requests.per.period"), String.valueOf(DEFAULT_PROVIDER_REQUESTS_PER_PERIOD));
        properties.setProperty(providerKey("default", "period.ms"), String.valueOf(DEFAULT_PROVIDER_PERIOD_MS));
        properties.setProperty(RATELIMIT_DECREASE_FACTOR, String.valueOf(DEFAULT_DECREASE_FACTOR));
        properties.setProperty(RATELIMIT_RECOVERY_WINDOW_MS, String.valueOf(DEFAULT_RECOVERY_WINDOW));
        properties.setProperty(CHECKPOINT_DIR, DEFAULT_CHECKPOINT_DIR);
        properties.setProperty(CHECKPOINT_DELETE_ON_COMPLETION, "true");
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "gorgon.properties",
                "config/gorgon.properties",
                System.getProperty("user.home") + "/.gorgon/gorgon.properties",
                "/etc/gorgon/gorgon.properties"
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

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("gorgon.properties")) {
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
                .filter(entry -> entry.getKey().toString().startsWith("gorgon."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.fine("Override from system property: " + entry.getKey() + "=" + entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "GorgonConfiguration{" +
                "maxConcurrentSteps=" + getMaxConcurrentSteps() +
                ", defaultStepTimeoutMs=" + getDefaultStepTimeoutMs() +
                ", retryBaseDelayMs=" + getRetryBaseDelayMs() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
