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

package dev.mars.shardwarden.master.reconcile;

import dev.mars.shardwarden.core.HealthSnapshot;
import dev.mars.shardwarden.core.HeartbeatStyle;
import dev.mars.shardwarden.core.RegistryEntry;
import dev.mars.shardwarden.core.ShardState;
import dev.mars.shardwarden.master.config.FleetSettings;
import dev.mars.shardwarden.master.observability.FleetMetrics;
import dev.mars.shardwarden.master.partition.PartitionCountSource;
import dev.mars.shardwarden.master.provision.ShardProvisioner;
import dev.mars.shardwarden.master.registry.ShardRegistry;
import dev.mars.shardwarden.master.server.SessionRegistry;
import dev.mars.shardwarden.master.server.ShardSession;
import dev.mars.shardwarden.protocol.WireMessage;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Drives the fleet towards its goal layout.
 *
 * <p>A pass runs on a timer whose delay follows the heartbeat schedule, and
 * immediately whenever {@link #requestPass()} is called; requests made while
 * one is already queued are coalesced. Each pass consults the partition count
 * source, applies a {@link ReconciliationPlanner} plan, sends the resulting
 * {@code update} frames, starts mints, and persists the registry when it
 * changed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class FleetReconciler {

    private static final Logger logger = LoggerFactory.getLogger(FleetReconciler.class);

    static final long GOAL_UNKNOWN_RETRY_MS = 5_000;

    private final Vertx vertx;
    private final ShardRegistry registry;
    private final SessionRegistry sessions;
    private final Supplier<FleetSettings> settings;
    private final PartitionCountSource partitions;
    private final ReconciliationPlanner planner;
    private final ShardProvisioner provisioner;
    private final FleetMetrics metrics;

    private HeartbeatScheduler scheduler;
    private long passTimer = -1;
    private long registryTimer = -1;
    private boolean passQueued;
    private boolean running;

    public FleetReconciler(Vertx vertx, ShardRegistry registry, SessionRegistry sessions,
                           Supplier<FleetSettings> settings, PartitionCountSource partitions,
                           ReconciliationPlanner planner, ShardProvisioner provisioner, FleetMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.registry = registry;
        this.sessions = sessions;
        this.settings = settings;
        this.partitions = partitions;
        this.planner = planner;
        this.provisioner = provisioner;
        this.metrics = metrics;
    }

    /**
     * Starts the pass loop and polls the registry file for external edits.
     */
    public void start(long registryPollMs) {
        if (running) {
            return;
        }
        running = true;
        scheduler = new HeartbeatScheduler(System.currentTimeMillis());
        partitions.onChange(count -> requestPass());
        if (registryPollMs > 0) {
            registryTimer = vertx.setPeriodic(registryPollMs, id -> checkRegistryFile());
        }
        requestPass();
        logger.info("Fleet reconciler started");
    }

    public void stop() {
        running = false;
        if (passTimer >= 0) {
            vertx.cancelTimer(passTimer);
            passTimer = -1;
        }
        if (registryTimer >= 0) {
            vertx.cancelTimer(registryTimer);
            registryTimer = -1;
        }
        passQueued = false;
    }

    /**
     * Queues a pass to run as soon as possible.
     */
    public void requestPass() {
        if (!running || passQueued) {
            return;
        }
        passQueued = true;
        schedule(1);
    }

    // ── session events ─────────────────────────────────────────────────

    public void onVerified(ShardSession session) {
        RegistryEntry entry = registry.get(session.getShardId());
        if (entry != null && entry.getGoalShardId() != RegistryEntry.RETIRED) {
            sendUpdate(session, entry, settings.get());
        }
        requestPass();
    }

    /**
     * Records a status report. Liveness is refreshed from it, except with
     * message statistics enabled where only a report showing new messages
     * counts as a heartbeat.
     */
    public void onStatus(ShardSession session, HealthSnapshot snapshot) {
        RegistryEntry entry = registry.get(session.getShardId());
        if (entry == null || snapshot == null) {
            return;
        }
        FleetSettings current = settings.get();
        long now = System.currentTimeMillis();
        entry.setLastSeen(now);

        if (snapshot.getId() != null && !snapshot.getId().equals(entry.getId())) {
            logger.warn("Shard changed id after handshake, ignoring: {} --> {}", entry.getId(), snapshot.getId());
        }
        entry.getStats().update(snapshot);
        if (entry.getStats().getGoalShardId() != entry.getGoalShardId()) {
            logger.warn("Shard goal state is incorrect! {} received: {}, expected: {}", entry.getId(),
                    entry.getStats().getGoalShardId(), entry.getGoalShardId());
        }
        if (!current.heartbeat().useMessageStats() || entry.getStats().getMessageCountDelta() > 0) {
            entry.setLastHeartbeat(now);
        }
        entry.setCurrentShardId(entry.getStats().getCurrentShardId());
        entry.setCurrentShardCount(entry.getStats().getCurrentShardCount());

        if (current.heartbeat().updateStyle() == HeartbeatStyle.PUSH) {
            sendUpdate(session, entry, current);
        }
    }

    public void onClosed(ShardSession session) {
        requestPass();
    }

    // ── pass ───────────────────────────────────────────────────────────

    private void schedule(long delayMs) {
        if (passTimer >= 0) {
            vertx.cancelTimer(passTimer);
        }
        passTimer = vertx.setTimer(Math.max(1, delayMs), id -> {
            passTimer = -1;
            runPass();
        });
    }

    void runPass() {
        passQueued = false;
        if (!running) {
            return;
        }
        long now = System.currentTimeMillis();
        FleetSettings current = settings.get();
        partitions.poll(now);
        int goal = partitions.current();
        if (goal < 0) {
            logger.debug("Shard count unknown, retrying in {}ms", GOAL_UNKNOWN_RETRY_MS);
            schedule(GOAL_UNKNOWN_RETRY_MS);
            return;
        }
        if (!registry.isLoaded()) {
            schedule(GOAL_UNKNOWN_RETRY_MS);
            return;
        }

        ReconciliationPlan plan = planner.plan(registry.entries(), goal, current, now, sessions::isConnected,
                provisioner.getWorkerMintsInFlight(), provisioner.isMasterMintInFlight());
        metrics.recordPass();

        for (ReconciliationPlan.Retirement retirement : plan.retired()) {
            sendUpdate(retirement.entry(), current);
        }
        for (RegistryEntry entry : plan.assigned()) {
            sendUpdate(entry, current);
        }
        for (int i = 0; i < plan.workersToMint(); i++) {
            provisioner.mint(false);
        }
        if (plan.mintMaster()) {
            provisioner.mint(true);
        }

        if (scheduler.isDue(now)) {
            sendTick(scheduler.advance(now, current.heartbeat(), goal), current, goal);
        }

        if (plan.changed() || registry.isDirty()) {
            registry.save();
        }
        updateMetrics(now, current, goal);
        if (!passQueued) {
            schedule(scheduler.delayUntilNext(System.currentTimeMillis()));
        }
    }

    private void sendTick(HeartbeatScheduler.Tick tick, FleetSettings current, int goal) {
        switch (tick.target()) {
            case ALL -> {
                for (RegistryEntry entry : new ArrayList<>(registry.entries())) {
                    if (entry.getGoalShardId() >= 0) {
                        sendUpdate(entry, current);
                    }
                }
            }
            case SHARD -> {
                RegistryEntry holder = findHolder(tick.shardId(), goal);
                if (holder == null) {
                    logger.debug("No shard holds id {} for heartbeat", tick.shardId());
                } else {
                    sendUpdate(holder, current);
                }
            }
            case MASTER -> {
                for (RegistryEntry entry : registry.entries()) {
                    if (entry.isMaster() && entry.getGoalShardId() >= 0) {
                        sendUpdate(entry, current);
                    }
                }
            }
            default -> throw new IllegalStateException("Unknown tick target " + tick.target());
        }
    }

    private RegistryEntry findHolder(int shardId, int goal) {
        for (RegistryEntry entry : registry.entries()) {
            if (!entry.isMaster() && entry.getGoalShardId() == shardId && entry.getGoalShardCount() == goal) {
                return entry;
            }
        }
        return null;
    }

    private void sendUpdate(RegistryEntry entry, FleetSettings current) {
        ShardSession session = sessions.get(entry.getId());
        if (session == null) {
            logger.debug("Unable to send update to shard {}: not connected", entry.getId());
            return;
        }
        sendUpdate(session, entry, current);
    }

    private void sendUpdate(ShardSession session, RegistryEntry entry, FleetSettings current) {
        session.send(new WireMessage.Update(current.settingsFor(entry)));
        metrics.recordDirective("update");
    }

    private void updateMetrics(long now, FleetSettings current, int goal) {
        int configured = 0;
        for (RegistryEntry entry : registry.entries()) {
            if (entry.state(now, current.heartbeat()) == ShardState.CONFIGURED) {
                configured++;
            }
        }
        metrics.updateFleet(registry.size(), sessions.size(), configured, goal);
    }

    private void checkRegistryFile() {
        registry.reloadIfModified()
                .onSuccess(reloaded -> {
                    if (!reloaded) {
                        return;
                    }
                    for (ShardSession session : new ArrayList<>(sessions.all())) {
                        if (!registry.contains(session.getShardId())) {
                            logger.info("Shard {} was removed from the registry, disconnecting", session.getShardId());
                            session.close();
                        }
                    }
                    requestPass();
                })
                .onFailure(err -> logger.error("Failed to reload shard registry: {}", err.getMessage()));
    }
}
