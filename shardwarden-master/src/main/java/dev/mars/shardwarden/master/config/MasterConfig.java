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

package dev.mars.shardwarden.master.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Bootstrap configuration for the Shardwarden master.
 *
 * <p>Loads {@code shardwarden-master.properties} from the classpath with
 * environment variable and system property overrides. Environment variables use
 * uppercase with underscores (e.g., shardwarden.master.port -> SHARDWARDEN_MASTER_PORT).
 * Fleet behaviour (partition count, heartbeat timing, launch settings) is not
 * configured here but in the hot-reloaded fleet settings file.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public final class MasterConfig {

    private static final Logger logger = LoggerFactory.getLogger(MasterConfig.class);
    private static final String CONFIG_FILE = "shardwarden-master.properties";
    private static volatile MasterConfig instance;

    private final Properties properties;

    private MasterConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * Gets the shared configuration instance, loading it on first use.
     */
    public static MasterConfig get() {
        if (instance == null) {
            synchronized (MasterConfig.class) {
                if (instance == null) {
                    Properties properties = new Properties();
                    loadProperties(properties);
                    instance = new MasterConfig(properties);
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
    public static MasterConfig of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new MasterConfig(copy);
    }

    // ==================== Listener ====================

    public String getHost() {
        return getString("shardwarden.master.host", "0.0.0.0");
    }

    public int getPort() {
        return getInt("shardwarden.master.port", 8090);
    }

    public String getSocketPath() {
        return getString("shardwarden.master.socket-path", "/shardwarden");
    }

    // ==================== Storage ====================

    public Path getDataDir() {
        return Paths.get(getString("shardwarden.master.data-dir", "./data"));
    }

    public Path getRegistryFile() {
        return Paths.get(getString("shardwarden.master.registry-file",
                getDataDir().resolve("knownShards.json").toString()));
    }

    public Path getKeysDir() {
        return Paths.get(getString("shardwarden.master.keys-dir",
                getDataDir().resolve("keys").toString()));
    }

    public Path getIdentitiesDir() {
        return Paths.get(getString("shardwarden.master.identities-dir",
                getDataDir().resolve("shards").toString()));
    }

    public Path getFleetSettingsFile() {
        return Paths.get(getString("shardwarden.master.fleet-settings", "./config/fleet.json"));
    }

    /**
     * How often the fleet settings and registry files are checked for external
     * modification.
     */
    public long getWatchIntervalMs() {
        return getLong("shardwarden.master.watch-interval-ms", 1000);
    }

    // ==================== Database Proxy ====================

    /**
     * JDBC URL of the database behind the query proxy. Empty disables the proxy.
     */
    public String getDatabaseUrl() {
        return getString("shardwarden.master.database.url", "");
    }

    public String getDatabaseUser() {
        return getString("shardwarden.master.database.user", "");
    }

    public String getDatabasePassword() {
        return getString("shardwarden.master.database.password", "");
    }

    // ==================== Lifecycle ====================

    public long getDrainTimeoutMs() {
        return getLong("shardwarden.master.shutdown.drain-timeout-ms", 5000);
    }

    public long getShutdownTimeoutMs() {
        return getLong("shardwarden.master.shutdown.timeout-ms", 15000);
    }

    // ==================== Telemetry ====================

    public boolean isTelemetryEnabled() {
        return getBoolean("shardwarden.telemetry.enabled", false);
    }

    public int getPrometheusPort() {
        return getInt("shardwarden.telemetry.prometheus.port", 9464);
    }

    public String getServiceName() {
        return getString("shardwarden.telemetry.service.name", "shardwarden-master");
    }

    /**
     * Checks the settings that have no sensible fallback.
     *
     * @throws IllegalStateException if a value is out of range
     */
    public void validate() {
        int port = getPort();
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("shardwarden.master.port must be between 0 and 65535, got " + port);
        }
        if (!getSocketPath().startsWith("/")) {
            throw new IllegalStateException("shardwarden.master.socket-path must start with '/'");
        }
        if (getWatchIntervalMs() <= 0) {
            throw new IllegalStateException("shardwarden.master.watch-interval-ms must be positive");
        }
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with environment variable and system property override.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., SHARDWARDEN_MASTER_PORT)</li>
     *   <li>System property (e.g., -Dshardwarden.master.port=8090)</li>
     *   <li>Properties file (shardwarden-master.properties)</li>
     *   <li>Default value</li>
     * </ol>
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysValue = System.getProperty(key);
        if (sysValue != null && !sysValue.isEmpty()) {
            return sysValue;
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
        try (InputStream input = MasterConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.trace("Stack trace for configuration load error", e);
        }
    }

    private void logConfiguration() {
        logger.info("=== Shardwarden Master Configuration ===");
        logger.info("  Listen:               {}:{}{}", getHost(), getPort(), getSocketPath());
        logger.info("  Data Dir:             {}", getDataDir());
        logger.info("  Registry File:        {}", getRegistryFile());
        logger.info("  Keys Dir:             {}", getKeysDir());
        logger.info("  Identities Dir:       {}", getIdentitiesDir());
        logger.info("  Fleet Settings:       {}", getFleetSettingsFile());
        logger.info("  Watch Interval:       {}ms", getWatchIntervalMs());
        logger.info("  --- Database Proxy ---");
        logger.info("  URL:                  {}", getDatabaseUrl().isEmpty() ? "(disabled)" : getDatabaseUrl());
        logger.info("  --- Telemetry ---");
        logger.info("  Enabled:              {}", isTelemetryEnabled());
        logger.info("  Prometheus Port:      {}", getPrometheusPort());
        logger.info("========================================");
    }
}
