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

import dev.mars.shardwarden.core.HeartbeatSettings;
import dev.mars.shardwarden.core.RegistryEntry;
import dev.mars.shardwarden.master.config.FleetSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Computes the next fleet layout from the registry.
 *
 * <p>The planner has no I/O: it mutates goal fields of the given entries and
 * returns a {@link ReconciliationPlan} describing what changed. Rules, in
 * order:</p>
 * <ol>
 *   <li>Exactly one master-role entry is kept at goal {@code (1000, goal)};
 *       extra ones are demoted, a missing one is minted.</li>
 *   <li>Worker entries holding a valid id of the current layout are visited
 *       most recently booted first. Dead ones release their id, stale ones are
 *       retired, later duplicates of an id are retired.</li>
 *   <li>Free ids are handed, lowest first, to connected workers seen within
 *       {@code assumeDeadAfter}, most recently seen first.</li>
 *   <li>Workers left holding an assignment of another layout are retired.</li>
 *   <li>Ids still free after that are minted, less the idle identities that
 *       may still take them (never connected yet, or seen within
 *       {@code assumeDeadAfter}) and the mints in flight.</li>
 * </ol>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class ReconciliationPlanner {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationPlanner.class);

    private static final Comparator<RegistryEntry> MOST_RECENTLY_BOOTED = Comparator
            .comparingLong(RegistryEntry::getBootTime).reversed()
            .thenComparing(Comparator.comparingLong(RegistryEntry::getLastHeartbeat).reversed())
            .thenComparing(RegistryEntry::getId);

    private static final Comparator<RegistryEntry> MOST_RECENTLY_SEEN = Comparator
            .comparingLong(RegistryEntry::getLastSeen).reversed()
            .thenComparing(RegistryEntry::getId);

    /**
     * Runs one pass.
     *
     * @param entries             every registry entry
     * @param goal                target partition count, not negative
     * @param settings            fleet settings in effect
     * @param now                 current time in millis
     * @param connected           whether an entry has a verified connection
     * @param workerMintsInFlight worker identities currently being minted
     * @param masterMintInFlight  whether a master-role identity is being minted
     * @return what changed
     */
    public ReconciliationPlan plan(Collection<RegistryEntry> entries, int goal, FleetSettings settings, long now,
                                   Predicate<String> connected, int workerMintsInFlight, boolean masterMintInFlight) {
        HeartbeatSettings heartbeat = settings.heartbeat();
        List<RegistryEntry> assigned = new ArrayList<>();
        List<ReconciliationPlan.Retirement> retired = new ArrayList<>();
        Set<String> touched = new HashSet<>();

        List<RegistryEntry> masters = new ArrayList<>();
        List<RegistryEntry> workers = new ArrayList<>();
        for (RegistryEntry entry : entries) {
            if (entry.isTerminated()) {
                continue;
            }
            (entry.isMaster() ? masters : workers).add(entry);
        }

        // ── master role ────────────────────────────────────────────────
        boolean mintMaster = false;
        if (settings.masterShard()) {
            masters.sort(MOST_RECENTLY_SEEN);
            for (int i = 1; i < masters.size(); i++) {
                RegistryEntry extra = masters.get(i);
                logger.warn("Multiple master-role shards found, demoting {}", extra.getId());
                extra.setMaster(false);
                extra.retire(now);
                retired.add(new ReconciliationPlan.Retirement(extra, ReconciliationPlan.Reason.DEMOTED));
                touched.add(extra.getId());
                workers.add(extra);
            }
            RegistryEntry master = masters.isEmpty() ? null : masters.get(0);
            if (master == null) {
                mintMaster = !masterMintInFlight;
            } else if (master.getGoalShardId() != RegistryEntry.MASTER_SHARD_ID
                    || master.getGoalShardCount() != goal) {
                master.assign(RegistryEntry.MASTER_SHARD_ID, goal, now);
                assigned.add(master);
            }
        } else {
            for (RegistryEntry master : masters) {
                if (master.getGoalShardId() >= 0) {
                    master.retire(now);
                    retired.add(new ReconciliationPlan.Retirement(master, ReconciliationPlan.Reason.SURPLUS));
                }
            }
        }

        // ── holders of the current layout ──────────────────────────────
        Map<Integer, RegistryEntry> bound = new HashMap<>();
        List<RegistryEntry> configuring = new ArrayList<>();
        List<RegistryEntry> holders = new ArrayList<>();
        for (RegistryEntry worker : workers) {
            if (!touched.contains(worker.getId()) && worker.getGoalShardCount() == goal
                    && worker.getGoalShardId() >= 0 && worker.getGoalShardId() < goal) {
                holders.add(worker);
            }
        }
        holders.sort(MOST_RECENTLY_BOOTED);
        for (RegistryEntry holder : holders) {
            long age = holder.livenessAge(now);
            ReconciliationPlan.Reason reason = null;
            if (age >= heartbeat.expectRebootAfterMs()) {
                reason = ReconciliationPlan.Reason.DEAD;
                logger.warn("Shard {} presumed dead after {}ms, releasing id {}", holder.getId(), age,
                        holder.getGoalShardId());
            } else if (bound.containsKey(holder.getGoalShardId())) {
                reason = ReconciliationPlan.Reason.DUPLICATE;
                logger.warn("Shards {} and {} both hold id {}, retiring {}",
                        bound.get(holder.getGoalShardId()).getId(), holder.getId(),
                        holder.getGoalShardId(), holder.getId());
            } else if (age >= heartbeat.requestRebootAfterMs()) {
                reason = ReconciliationPlan.Reason.STALE;
                logger.warn("Shard {} has not responded for {}ms, requesting shutdown of id {}",
                        holder.getId(), age, holder.getGoalShardId());
            }
            if (reason != null) {
                holder.retire(now);
                retired.add(new ReconciliationPlan.Retirement(holder, reason));
                touched.add(holder.getId());
                continue;
            }
            bound.put(holder.getGoalShardId(), holder);
            if (!holder.isConverged()) {
                configuring.add(holder);
            }
        }

        // ── hand free ids to spare workers ─────────────────────────────
        List<RegistryEntry> spare = new ArrayList<>();
        for (RegistryEntry worker : workers) {
            if (!touched.contains(worker.getId()) && !bound.containsValue(worker)
                    && connected.test(worker.getId())
                    && now - worker.getLastSeen() < heartbeat.assumeDeadAfterMs()) {
                spare.add(worker);
            }
        }
        spare.sort(MOST_RECENTLY_SEEN);

        List<Integer> unbound = new ArrayList<>();
        Iterator<RegistryEntry> spareIterator = spare.iterator();
        for (int id = 0; id < goal; id++) {
            if (bound.containsKey(id)) {
                continue;
            }
            if (spareIterator.hasNext()) {
                RegistryEntry worker = spareIterator.next();
                worker.assign(id, goal, now);
                assigned.add(worker);
                touched.add(worker.getId());
                bound.put(id, worker);
                configuring.add(worker);
                logger.info("Assigning shard {} to {}/{}", worker.getId(), id, goal);
            } else {
                unbound.add(id);
            }
        }

        // ── withdraw assignments of other layouts ──────────────────────
        for (RegistryEntry worker : workers) {
            if (!touched.contains(worker.getId()) && !bound.containsValue(worker)
                    && worker.getGoalShardId() >= 0) {
                worker.retire(now);
                retired.add(new ReconciliationPlan.Retirement(worker, ReconciliationPlan.Reason.SURPLUS));
            }
        }

        // ── mint what is still missing ─────────────────────────────────
        int pending = 0;
        for (RegistryEntry worker : workers) {
            if (bound.containsValue(worker)) {
                continue;
            }
            if (!worker.hasBeenSeen() || now - worker.getLastSeen() < heartbeat.assumeDeadAfterMs()) {
                pending++;
            }
        }
        int workersToMint = Math.max(0, unbound.size() - pending - workerMintsInFlight);
        if (!unbound.isEmpty()) {
            logger.warn("{} shards are queued to start but only {} are available", goal, bound.size());
        }
        if (workersToMint > 0) {
            logger.info("{} ids unbound with {} idle identities pending, minting {}", unbound.size(), pending,
                    workersToMint);
        }

        return new ReconciliationPlan(goal, assigned, retired, configuring, unbound, workersToMint, mintMaster);
    }
}
