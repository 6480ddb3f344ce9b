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


package dev.mars.shardwarden.agent.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Bootstrap configuration for a Shardwarden agent.
 *
 * <p>Loads {@code shardwarden-agent.properties} from the classpath. Environment
 * variables take precedence (shardwarden.agent.project-root becomes
 * SHARDWARDEN_AGENT_PROJECT_ROOT), then system properties. Heartbeat timing and
 * the child command line are not configured here; the master sends them with
 * every assignment.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-11
 */
public final class AgentConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentConfig.class);
    private static final String CONFIG_FILE = "shardwarden-agent.properties";
    private static volatile AgentConfig instance;

    private final Properties properties;

    private AgentConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Gets the shared configuration instance, loading it on first use.
     */
    public static AgentConfig get() {
        if (instance == null) {
            synchronized (AgentConfig.class) {
                if (instance == null) {
                    Properties properties = new Properties();
                    loadProperties(properties);
                    instance = new AgentConfig(properties);
                    instance.logConfiguration();
                }
            }
        }
        return instance;
    }

    /**
     * Creates a configuration backed by the given properties instead of the
     * classpath file. Environment and system property overrides still apply.
     */
    public static AgentConfig of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new AgentConfig(copy);
    }

    // ==================== Identity ====================

    /**
     * Directory searched for a {@code shard_<id>_config.json} artifact.
     */
    public Path getIdentityDir() {
        return Paths.get(getString("shardwarden.agent.identity-dir", "./config"));
    }

    /**
     * Explicit identity artifact; empty means search {@link #getIdentityDir()}.
     */
    public String getIdentityFile() {
        return getString("shardwarden.agent.identity-file", "");
    }

    // ==================== Child Process ====================

    /**
     * Working directory of the child and root of every relayed file path.
     */
    public Path getProjectRoot() {
        return Paths.get(getString("shardwarden.agent.project-root", ".")).toAbsolutePath().normalize();
    }

    public long getChildGraceMs() {
        return getLong("shardwarden.agent.child.grace-ms", 5000);
    }

    /**
     * How long a heartbeat waits for the child's stats before reporting
     * without them.
     */
    public long getStatsTimeoutMs() {
        return getLong("shardwarden.agent.child.stats-timeout-ms", 5000);
    }

    // ==================== Master Connection ====================

    public long getReconnectDelayMs() {
        return getLong("shardwarden.agent.reconnect-delay-ms", 3000);
    }

    public long getConnectBackoffInitialMs() {
        return getLong("shardwarden.agent.connect.backoff-initial-ms", 1000);
    }

    public long getConnectBackoffMaxMs() {
        return getLong("shardwarden.agent.connect.backoff-max-ms", 30000);
    }

    public int getConnectTimeoutMs() {
        return getInt("shardwarden.agent.connect.timeout-ms", 10000);
    }

    /**
     * Deadline for replies to requests the agent sends. Zero waits until the
     * master answers or the connection drops.
     */
    public long getReplyTimeoutMs() {
        return getLong("shardwarden.agent.reply-timeout-ms", 0);
    }

    /**
     * Accept any certificate on {@code wss} connections. For test fleets only.
     */
    public boolean isTrustAll() {
        return getBoolean("shardwarden.agent.tls.trust-all", false);
    }

    // ==================== Telemetry ====================

    public boolean isTelemetryEnabled() {
        return getBoolean("shardwarden.telemetry.enabled", false);
    }

    public int getPrometheusPort() {
        return getInt("shardwarden.telemetry.prometheus.port", 9465);
    }

    public String getServiceName() {
        return getString("shardwarden.telemetry.service.name", "shardwarden-agent");
    }

    /**
     * Validates that values are sensible. Called during startup to fail fast
     * on misconfiguration.
     *
     * @throws IllegalStateException if a value is out of range
     */
    public void validate() {
        if (getReconnectDelayMs() < 0) {
            throw new IllegalStateException(
                    "Reconnect delay must not be negative, got: " + getReconnectDelayMs());
        }
        if (getConnectBackoffInitialMs() <= 0) {
            throw new IllegalStateException(
                    "Connect backoff must be positive, got: " + getConnectBackoffInitialMs());
        }
        if (getConnectBackoffMaxMs() < getConnectBackoffInitialMs()) {
            throw new IllegalStateException("Connect backoff cap " + getConnectBackoffMaxMs()
                    + "ms is below the initial backoff " + getConnectBackoffInitialMs() + "ms");
        }
        if (getChildGraceMs() <= 0) {
            throw new IllegalStateException(
                    "Child grace period must be positive, got: " + getChildGraceMs());
        }
        if (getStatsTimeoutMs() <= 0) {
            throw new IllegalStateException(
                    "Stats timeout must be positive, got: " + getStatsTimeoutMs());
        }
        if (getReplyTimeoutMs() < 0) {
            throw new IllegalStateException(
                    "Reply timeout must not be negative, got: " + getReplyTimeoutMs());
        }
        logger.info("Agent configuration validated successfully");
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution: environment variable,
     * system property, properties file, default value.
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysProp = System.getProperty(key);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // ==================== Private Helpers ====================

    private static void loadProperties(Properties properties) {
        try (InputStream input = AgentConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
    }

    private void logConfiguration() {
        logger.info("=== Shardwarden Agent Configuration ===");
        logger.info("  Identity Dir:         {}", getIdentityDir());
        logger.info("  Identity File:        {}", getIdentityFile().isEmpty() ? "(search)" : getIdentityFile());
        logger.info("  Project Root:         {}", getProjectRoot());
        logger.info("  Child Grace:          {}ms", getChildGraceMs());
        logger.info("  --- Master Connection ---");
        logger.info("  Reconnect Delay:      {}ms", getReconnectDelayMs());
        logger.info("  Backoff:              {}ms..{}ms", getConnectBackoffInitialMs(), getConnectBackoffMaxMs());
        logger.info("  Connect Timeout:      {}ms", getConnectTimeoutMs());
        logger.info("  --- Telemetry ---");
        logger.info("  Enabled:              {}", isTelemetryEnabled());
        logger.info("  Prometheus Port:      {}", getPrometheusPort());
        logger.info("=======================================");
    }
}
