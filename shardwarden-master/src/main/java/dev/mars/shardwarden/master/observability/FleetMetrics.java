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

package dev.mars.shardwarden.master.observability;

import dev.mars.shardwarden.core.exceptions.AuthenticationException;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the master.
 *
 * <ul>
 *   <li>shardwarden.master.shards.known (gauge) - registry entries</li>
 *   <li>shardwarden.master.shards.connected (gauge) - verified sessions</li>
 *   <li>shardwarden.master.shards.configured (gauge) - entries running their goal</li>
 *   <li>shardwarden.master.shards.goal (gauge) - target partition count</li>
 *   <li>shardwarden.master.auth.rejections (counter) - refused handshakes, by reason</li>
 *   <li>shardwarden.master.identities.minted (counter) - identities created, by role</li>
 *   <li>shardwarden.master.identities.failed (counter) - failed mints</li>
 *   <li>shardwarden.master.reconcile.passes (counter) - reconciliation passes</li>
 *   <li>shardwarden.master.directives.sent (counter) - frames sent to shards, by type</li>
 * </ul>
 *
 * <p>Without an installed SDK the global meter is a no-op.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public class FleetMetrics {

    private static final Logger logger = LoggerFactory.getLogger(FleetMetrics.class);
    private static final String METER_NAME = "shardwarden-master";

    private static final AttributeKey<String> REASON_KEY = AttributeKey.stringKey("reason");
    private static final AttributeKey<String> ROLE_KEY = AttributeKey.stringKey("role");
    private static final AttributeKey<String> TYPE_KEY = AttributeKey.stringKey("type");

    private final LongCounter authRejections;
    private final LongCounter identitiesMinted;
    private final LongCounter identitiesFailed;
    private final LongCounter reconcilePasses;
    private final LongCounter directivesSent;

    private final AtomicLong knownShards = new AtomicLong();
    private final AtomicLong connectedShards = new AtomicLong();
    private final AtomicLong configuredShards = new AtomicLong();
    private final AtomicLong goal = new AtomicLong(-1);

    public FleetMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        authRejections = meter.counterBuilder("shardwarden.master.auth.rejections")
                .setDescription("Refused WebSocket handshakes")
                .setUnit("1")
                .build();

        identitiesMinted = meter.counterBuilder("shardwarden.master.identities.minted")
                .setDescription("Shard identities created")
                .setUnit("1")
                .build();

        identitiesFailed = meter.counterBuilder("shardwarden.master.identities.failed")
                .setDescription("Shard identities that could not be created")
                .setUnit("1")
                .build();

        reconcilePasses = meter.counterBuilder("shardwarden.master.reconcile.passes")
                .setDescription("Reconciliation passes run")
                .setUnit("1")
                .build();

        directivesSent = meter.counterBuilder("shardwarden.master.directives.sent")
                .setDescription("Frames sent to shards")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("shardwarden.master.shards.known")
                .setDescription("Shards in the registry")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(knownShards.get()));

        meter.gaugeBuilder("shardwarden.master.shards.connected")
                .setDescription("Shards with a verified connection")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(connectedShards.get()));

        meter.gaugeBuilder("shardwarden.master.shards.configured")
                .setDescription("Shards running their assigned partition")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(configuredShards.get()));

        meter.gaugeBuilder("shardwarden.master.shards.goal")
                .setDescription("Target partition count")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(goal.get()));

        logger.debug("FleetMetrics initialized");
    }

    public void recordRejection(AuthenticationException.Reason reason) {
        authRejections.add(1, Attributes.of(REASON_KEY, reason.name()));
    }

    public void recordMint(boolean master, boolean success) {
        Attributes attrs = Attributes.of(ROLE_KEY, master ? "master" : "worker");
        if (success) {
            identitiesMinted.add(1, attrs);
        } else {
            identitiesFailed.add(1, attrs);
        }
    }

    public void recordPass() {
        reconcilePasses.add(1);
    }

    public void recordDirective(String type) {
        directivesSent.add(1, Attributes.of(TYPE_KEY, type));
    }

    public void updateFleet(int known, int connected, int configured, int goalCount) {
        knownShards.set(known);
        connectedShards.set(connected);
        configuredShards.set(configured);
        goal.set(goalCount);
    }
}
