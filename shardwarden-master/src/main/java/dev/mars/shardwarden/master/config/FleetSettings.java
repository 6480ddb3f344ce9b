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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.mars.shardwarden.core.HeartbeatSettings;
import dev.mars.shardwarden.core.HostAddress;
import dev.mars.shardwarden.core.LaunchSettings;
import dev.mars.shardwarden.core.RegistryEntry;
import dev.mars.shardwarden.core.ShardSettings;
import dev.mars.shardwarden.security.KeyPairs;

import java.util.ArrayList;
import java.util.List;

/**
 * Fleet-wide settings, read from a JSON file and reloaded whenever it changes.
 *
 * @param numShards            partition count when auto detection is off
 * @param autoDetectNumShards  fetch the partition count from {@code recommendationUrl}
 * @param autoDetectIntervalMs minimum time between two fetches
 * @param masterShard          keep one privileged master-role identity running
 * @param connTimeMs           connection rate limit window
 * @param connCount            connection attempts allowed per source within the window
 * @param tsPrecisionMs        accepted clock skew of a handshake timestamp
 * @param respawnDelayMs       stagger between shards on a fleet-wide respawn
 * @param replyTimeoutMs       deadline for replies to relayed requests, 0 for none
 * @param keySize              RSA modulus length of minted identities
 * @param remoteHost           master address written into worker identities
 * @param masterHost           master address written into the master-role identity
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FleetSettings(
        int numShards,
        boolean autoDetectNumShards,
        long autoDetectIntervalMs,
        String recommendationUrl,
        String recommendationToken,
        String applicationName,
        boolean masterShard,
        HeartbeatSettings heartbeat,
        long connTimeMs,
        int connCount,
        long tsPrecisionMs,
        long respawnDelayMs,
        long replyTimeoutMs,
        int keySize,
        HostAddress remoteHost,
        HostAddress masterHost,
        LaunchSettings launch,
        MailSettings mail) {

    public static FleetSettings defaults() {
        return new FleetSettings(
                1,
                false,
                24 * 60 * 60 * 1000L,
                null,
                null,
                "shardwarden-app",
                true,
                HeartbeatSettings.defaults(),
                60_000,
                5,
                30_000,
                5_000,
                0,
                KeyPairs.DEFAULT_KEY_SIZE,
                new HostAddress("ws", "localhost", 8090, "/shardwarden"),
                new HostAddress("ws", "localhost", 8090, "/shardwarden"),
                LaunchSettings.empty(),
                MailSettings.disabled());
    }

    /**
     * Lists every rule the settings break. An empty list means the settings
     * are usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!autoDetectNumShards && numShards < 0) {
            errors.add("numShards must not be negative");
        }
        if (autoDetectNumShards && (recommendationUrl == null || recommendationUrl.isBlank())) {
            errors.add("recommendationUrl is required when autoDetectNumShards is set");
        }
        if (autoDetectNumShards && autoDetectIntervalMs <= 0) {
            errors.add("autoDetectIntervalMs must be positive");
        }
        if (heartbeat == null) {
            errors.add("heartbeat is required");
        } else {
            if (heartbeat.updateStyle() == null) {
                errors.add("heartbeat.updateStyle is required");
            }
            if (heartbeat.intervalMs() <= 0) {
                errors.add("heartbeat.intervalMs must be positive");
            }
            if (heartbeat.requestRebootAfterMs() >= heartbeat.expectRebootAfterMs()) {
                errors.add("heartbeat.requestRebootAfterMs must be below expectRebootAfterMs");
            }
            if (heartbeat.requestRebootAfterMs() >= heartbeat.assumeDeadAfterMs()) {
                errors.add("heartbeat.requestRebootAfterMs must be below assumeDeadAfterMs");
            }
        }
        if (connCount < 1) {
            errors.add("connCount must be at least 1");
        }
        if (connTimeMs <= 0) {
            errors.add("connTimeMs must be positive");
        }
        if (tsPrecisionMs <= 0) {
            errors.add("tsPrecisionMs must be positive");
        }
        if (respawnDelayMs < 0 || replyTimeoutMs < 0) {
            errors.add("respawnDelayMs and replyTimeoutMs must not be negative");
        }
        if (keySize < 1024) {
            errors.add("keySize must be at least 1024");
        }
        if (remoteHost == null || remoteHost.host() == null) {
            errors.add("remoteHost.host is required");
        }
        return errors;
    }

    /**
     * The {@code update} payload for an entry under these settings.
     */
    public ShardSettings settingsFor(RegistryEntry entry) {
        return entry.toSettings(applicationName, heartbeat, launch);
    }

    public HostAddress hostFor(boolean master) {
        return master && masterHost != null ? masterHost : remoteHost;
    }
}
