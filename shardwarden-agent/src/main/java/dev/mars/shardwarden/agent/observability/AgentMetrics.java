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


package dev.mars.shardwarden.agent.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for a Shardwarden agent.
 *
 * <ul>
 *   <li>shardwarden.agent.child.spawns (counter) - child processes started</li>
 *   <li>shardwarden.agent.child.exits (counter) - child processes that ended, by outcome</li>
 *   <li>shardwarden.agent.child.running (gauge) - 1 while a child is alive</li>
 *   <li>shardwarden.agent.heartbeats.sent (counter) - status frames sent</li>
 *   <li>shardwarden.agent.reconnects (counter) - reconnections to the master</li>
 *   <li>shardwarden.agent.evals (counter) - evaluation requests from the master, by outcome</li>
 *   <li>shardwarden.agent.uptime.seconds (gauge) - agent uptime</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-11
 * @version 1.0 (OpenTelemetry)
 */
public class AgentMetrics {

    private static final Logger logger = LoggerFactory.getLogger(AgentMetrics.class);
    private static final String METER_NAME = "shardwarden-agent";

    private static final AttributeKey<String> SHARD_ID_KEY = AttributeKey.stringKey("shard.id");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");

    private final LongCounter childSpawns;
    private final LongCounter childExits;
    private final LongCounter heartbeatsSent;
    private final LongCounter reconnects;
    private final LongCounter evals;

    private final AtomicLong childRunning = new AtomicLong(0);
    private final Attributes shardAttributes;

    /**
     * @param shardId         identity of the agent
     * @param startTimeMillis agent start time in milliseconds
     */
    public AgentMetrics(String shardId, long startTimeMillis) {
        this.shardAttributes = Attributes.of(SHARD_ID_KEY, shardId);

        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        childSpawns = meter.counterBuilder("shardwarden.agent.child.spawns")
                .setDescription("Child processes started")
                .setUnit("1")
                .build();

        childExits = meter.counterBuilder("shardwarden.agent.child.exits")
                .setDescription("Child processes that ended")
                .setUnit("1")
                .build();

        heartbeatsSent = meter.counterBuilder("shardwarden.agent.heartbeats.sent")
                .setDescription("Status frames sent to the master")
                .setUnit("1")
                .build();

        reconnects = meter.counterBuilder("shardwarden.agent.reconnects")
                .setDescription("Reconnections to the master")
                .setUnit("1")
                .build();

        evals = meter.counterBuilder("shardwarden.agent.evals")
                .setDescription("Evaluation requests received from the master")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("shardwarden.agent.child.running")
                .setDescription("1 while a child process is alive")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(childRunning.get(), shardAttributes));

        meter.gaugeBuilder("shardwarden.agent.uptime.seconds")
                .setDescription("Agent uptime in seconds")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(
                        (System.currentTimeMillis() - startTimeMillis) / 1000, shardAttributes));

        logger.info("AgentMetrics initialized for shard: {}", shardId);
    }

    public void recordSpawn() {
        childSpawns.add(1, shardAttributes);
        childRunning.set(1);
    }

    public void recordExit(int exitCode) {
        childExits.add(1, shardAttributes.toBuilder()
                .put(OUTCOME_KEY, exitCode == 0 ? "clean" : "error")
                .build());
        childRunning.set(0);
    }

    public void recordHeartbeat() {
        heartbeatsSent.add(1, shardAttributes);
    }

    public void recordReconnect() {
        reconnects.add(1, shardAttributes);
    }

    public void recordEval(boolean success) {
        evals.add(1, shardAttributes.toBuilder()
                .put(OUTCOME_KEY, success ? "success" : "failure")
                .build());
    }
}
