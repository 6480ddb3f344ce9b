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


package dev.mars.shardwarden.agent.service;

import dev.mars.shardwarden.child.ChildMessage;
import dev.mars.shardwarden.child.ChildStats;
import dev.mars.shardwarden.child.CpuTimes;
import dev.mars.shardwarden.core.HealthSnapshot;
import dev.mars.shardwarden.core.HeartbeatSettings;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the health snapshot an agent reports to the master.
 *
 * <p>Each sample asks the child for its stats and probes the disk. CPU load is
 * the busy fraction of each core since the previous sample and the message
 * delta the growth of the child's activity counter. When the child cannot
 * answer, the previous measurements are reported unchanged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-12
 * @version 1.0
 */
public class HeartbeatService {

    private static final Logger logger = LoggerFactory.getLogger(HeartbeatService.class);

    static final int IDLE_HEARTBEATS_BEFORE_RESPAWN = 2;

    private final Vertx vertx;
    private final HealthSnapshot status;
    private final ChildChannel child;
    private final DiskUsageProbe disk;
    private final long statsTimeoutMs;

    private Promise<ChildStats> statsRequest;
    private long statsTimerId = -1;
    private List<CpuTimes> previousCpu = List.of();
    private int idleHeartbeats;

    public HeartbeatService(Vertx vertx, HealthSnapshot status, ChildChannel child, DiskUsageProbe disk,
                            long statsTimeoutMs) {
        this.vertx = vertx;
        this.status = status;
        this.child = child;
        this.disk = disk;
        this.statsTimeoutMs = statsTimeoutMs;
    }

    /**
     * Refreshes the agent status and returns a copy for sending.
     */
    public Future<HealthSnapshot> sample() {
        Future<ChildStats> stats = requestStats();
        Future<DiskUsageProbe.DiskUsage> usage = vertx.executeBlocking(disk::probe);
        return Future.join(stats, usage).transform(ar -> {
            if (stats.succeeded()) {
                apply(stats.result(), System.currentTimeMillis());
            } else {
                logger.error("Failed to fetch stats for heartbeat: {}", stats.cause().getMessage());
            }
            if (usage.succeeded()) {
                status.setDiskUsedBytes(usage.result().usedBytes());
                status.setDiskTotalBytes(usage.result().totalBytes());
                status.setProjectDirBytes(usage.result().projectBytes());
            } else {
                logger.warn("Failed to fetch disk usage: {}", usage.cause().getMessage());
            }
            return Future.succeededFuture(status.copy());
        });
    }

    public void onStats(ChildStats stats) {
        settleStats(stats, null);
    }

    /**
     * Starts a new baseline for a freshly started child.
     */
    public void onChildStarted() {
        previousCpu = List.of();
        idleHeartbeats = 0;
        status.setMessageCountTotal(0);
        status.setMessageCountDelta(0);
        status.setCpuLoad(new ArrayList<>());
    }

    public void onChildExit() {
        settleStats(null, "Child process exited");
    }

    /**
     * Whether the child reported no activity for the last two samples and
     * should be restarted. Only applies to worker partitions when message
     * stats are enabled. A positive answer starts a new count.
     */
    public boolean needsRespawn(HeartbeatSettings settings) {
        if (!settings.useMessageStats() || status.isMaster()
                || idleHeartbeats < IDLE_HEARTBEATS_BEFORE_RESPAWN) {
            return false;
        }
        idleHeartbeats = 0;
        return true;
    }

    static List<Double> cpuLoad(List<CpuTimes> previous, List<CpuTimes> current) {
        List<Double> load = new ArrayList<>(current.size());
        for (int i = 0; i < current.size(); i++) {
            CpuTimes now = current.get(i);
            CpuTimes before = i < previous.size() ? previous.get(i) : null;
            if (before == null) {
                load.add(0.0);
                continue;
            }
            long total = now.total() - before.total();
            long idle = now.idle() - before.idle();
            load.add(total <= 0 ? 0.0 : (double) (total - idle) / total);
        }
        return load;
    }

    /**
     * Growth of a cumulative counter. A counter that went backwards belongs
     * to a restarted child and counts from zero.
     */
    static long messageDelta(long previousTotal, long total) {
        return total >= previousTotal ? total - previousTotal : total;
    }

    private void apply(ChildStats stats, long now) {
        long delta = status.getTimestamp() > status.getStartTime() ? now - status.getTimestamp() : 0;
        status.setTimestamp(now);
        status.setTimeDelta(delta);
        status.setHeapUsed(stats.heapUsed());
        status.setHeapCommitted(stats.heapCommitted());
        status.setHeapMax(stats.heapMax());
        status.setNonHeapUsed(stats.nonHeapUsed());

        status.setCpuLoad(cpuLoad(previousCpu, stats.cpuTimes()));
        previousCpu = stats.cpuTimes();

        long messages = messageDelta(status.getMessageCountTotal(), stats.messageCount());
        status.setMessageCountDelta(messages);
        status.setMessageCountTotal(stats.messageCount());
        idleHeartbeats = messages == 0 ? idleHeartbeats + 1 : 0;
    }

    private Future<ChildStats> requestStats() {
        if (!child.isRunning()) {
            return Future.failedFuture(ChildSupervisor.NOT_RUNNING);
        }
        if (statsRequest != null) {
            return statsRequest.future();
        }
        Promise<ChildStats> promise = Promise.promise();
        statsRequest = promise;
        statsTimerId = vertx.setTimer(statsTimeoutMs, id -> {
            statsTimerId = -1;
            settleStats(null, "No stats from child within " + statsTimeoutMs + "ms");
        });
        child.send(new ChildMessage.StatsRequest()).onFailure(err -> settleStats(null, err.getMessage()));
        return promise.future();
    }

    private void settleStats(ChildStats stats, String error) {
        Promise<ChildStats> promise = statsRequest;
        statsRequest = null;
        if (statsTimerId >= 0) {
            vertx.cancelTimer(statsTimerId);
            statsTimerId = -1;
        }
        if (promise == null) {
            return;
        }
        if (error != null) {
            promise.tryFail(error);
        } else {
            promise.tryComplete(stats);
        }
    }
}
