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

import dev.mars.shardwarden.core.RegistryEntry;
import dev.mars.shardwarden.master.config.FleetSettings;
import dev.mars.shardwarden.master.config.FleetSettingsLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the layout decisions of {@link ReconciliationPlanner}. Heartbeat
 * timings are the defaults: stale after 60s, dead after 90s, gone after 120s.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
class ReconciliationPlannerTest {

    private static final long NOW = 1_000_000_000L;

    private final ReconciliationPlanner planner = new ReconciliationPlanner();
    private List<RegistryEntry> entries;
    private Set<String> connected;
    private FleetSettings workersOnly;

    @BeforeEach
    void setUp() throws Exception {
        entries = new ArrayList<>();
        connected = new HashSet<>();
        workersOnly = settings("{\"masterShard\": false}");
    }

    private static FleetSettings settings(String json) throws Exception {
        return FleetSettingsLoader.parse(Path.of("fleet.json"), json.getBytes(StandardCharsets.UTF_8));
    }

    private RegistryEntry worker(String id) {
        RegistryEntry entry = new RegistryEntry(id, "pem", false);
        entries.add(entry);
        return entry;
    }

    private RegistryEntry connectedWorker(String id, long lastSeen) {
        RegistryEntry entry = worker(id);
        entry.setLastSeen(lastSeen);
        connected.add(id);
        return entry;
    }

    private RegistryEntry holder(String id, int shardId, int count, long bootTime, long lastHeartbeat) {
        RegistryEntry entry = connectedWorker(id, lastHeartbeat);
        entry.assign(shardId, count, bootTime);
        entry.setLastHeartbeat(lastHeartbeat);
        entry.setCurrentShardId(shardId);
        entry.setCurrentShardCount(count);
        return entry;
    }

    private ReconciliationPlan plan(int goal, FleetSettings settings) {
        return planner.plan(entries, goal, settings, NOW, connected::contains, 0, false);
    }

    private static ReconciliationPlan.Reason reasonFor(ReconciliationPlan plan, RegistryEntry entry) {
        return plan.retired().stream()
                .filter(r -> r.entry() == entry)
                .map(ReconciliationPlan.Retirement::reason)
                .findFirst()
                .orElse(null);
    }

    @Nested
    class Assignment {

        @Test
        void emptyRegistryMintsOneIdentityPerId() {
            ReconciliationPlan plan = plan(2, workersOnly);

            assertEquals(2, plan.workersToMint());
            assertEquals(List.of(0, 1), plan.unbound());
            assertFalse(plan.mintMaster());
            assertFalse(plan.changed());
        }

        @Test
        void connectedSparesReceiveFreeIdsMostRecentlySeenFirst() {
            RegistryEntry older = connectedWorker("aaa", NOW - 10_000);
            RegistryEntry newer = connectedWorker("bbb", NOW - 1_000);

            ReconciliationPlan plan = plan(2, workersOnly);

            assertEquals(0, newer.getGoalShardId());
            assertEquals(1, older.getGoalShardId());
            assertEquals(2, older.getGoalShardCount());
            assertEquals(NOW, older.getBootTime());
            assertEquals(2, plan.assigned().size());
            assertEquals(2, plan.configuring().size());
            assertTrue(plan.unbound().isEmpty());
            assertEquals(0, plan.workersToMint());
            assertTrue(plan.changed());
        }

        @Test
        void convergedHoldersAreLeftAlone() {
            holder("aaa", 0, 2, NOW - 30_000, NOW - 1_000);
            holder("bbb", 1, 2, NOW - 30_000, NOW - 1_000);

            ReconciliationPlan plan = plan(2, workersOnly);

            assertFalse(plan.changed());
            assertTrue(plan.configuring().isEmpty());
            assertEquals(0, plan.workersToMint());
        }

        @Test
        void disconnectedOrLongSilentWorkersAreNotAssigned() {
            RegistryEntry offline = worker("aaa");
            offline.setLastSeen(NOW - 1_000);
            connectedWorker("bbb", NOW - 200_000);

            ReconciliationPlan plan = plan(1, workersOnly);

            assertTrue(plan.assigned().isEmpty());
            assertEquals(List.of(0), plan.unbound());
        }

        @Test
        void spareHoldsNoIdAfterPass() {
            holder("aaa", 0, 1, NOW - 30_000, NOW - 1_000);
            RegistryEntry spare = connectedWorker("bbb", NOW - 1_000);

            ReconciliationPlan plan = plan(1, workersOnly);

            assertEquals(RegistryEntry.RETIRED, spare.getGoalShardId());
            assertFalse(plan.changed());
        }
    }

    @Nested
    class Liveness {

        @Test
        void duplicateHolderBootedEarlierIsRetired() {
            RegistryEntry recent = holder("aaa", 0, 1, NOW - 1_000, NOW - 500);
            RegistryEntry earlier = holder("bbb", 0, 1, NOW - 2_000, NOW - 500);

            ReconciliationPlan plan = plan(1, workersOnly);

            assertEquals(0, recent.getGoalShardId());
            assertEquals(RegistryEntry.RETIRED, earlier.getGoalShardId());
            assertEquals(ReconciliationPlan.Reason.DUPLICATE, reasonFor(plan, earlier));
        }

        @Test
        void staleHolderIsRetiredAndItsIdReassigned() {
            RegistryEntry stale = holder("aaa", 0, 1, NOW - 200_000, NOW - 70_000);
            stale.setLastSeen(NOW - 1_000);
            RegistryEntry spare = connectedWorker("bbb", NOW - 2_000);

            ReconciliationPlan plan = plan(1, workersOnly);

            assertEquals(ReconciliationPlan.Reason.STALE, reasonFor(plan, stale));
            assertEquals(RegistryEntry.RETIRED, stale.getGoalShardId());
            assertEquals(NOW, stale.getStopTime());
            assertEquals(0, spare.getGoalShardId());
        }

        @Test
        void deadHolderReleasesItsId() {
            RegistryEntry dead = holder("aaa", 0, 1, NOW - 200_000, NOW - 95_000);

            ReconciliationPlan plan = plan(1, workersOnly);

            assertEquals(ReconciliationPlan.Reason.DEAD, reasonFor(plan, dead));
            assertEquals(List.of(0), plan.unbound());
        }

        @Test
        void recentBootProtectsHolderThatNeverHeartbeated() {
            RegistryEntry booting = holder("aaa", 0, 1, NOW - 5_000, 0);

            ReconciliationPlan plan = plan(1, workersOnly);

            assertEquals(0, booting.getGoalShardId());
            assertTrue(plan.retired().isEmpty());
        }
    }

    @Nested
    class Resizing {

        @Test
        void shrinkReassignsSurvivorsAndRetiresSurplus() {
            RegistryEntry a = holder("aaa", 0, 3, NOW - 30_000, NOW - 1_000);
            RegistryEntry b = holder("bbb", 1, 3, NOW - 30_000, NOW - 2_000);
            RegistryEntry c = holder("ccc", 2, 3, NOW - 30_000, NOW - 3_000);

            ReconciliationPlan plan = plan(2, workersOnly);

            assertEquals(0, a.getGoalShardId());
            assertEquals(2, a.getGoalShardCount());
            assertEquals(1, b.getGoalShardId());
            assertEquals(RegistryEntry.RETIRED, c.getGoalShardId());
            assertEquals(ReconciliationPlan.Reason.SURPLUS, reasonFor(plan, c));
        }

        @Test
        void goalZeroRetiresEveryWorker() {
            RegistryEntry a = holder("aaa", 0, 1, NOW - 30_000, NOW - 1_000);

            ReconciliationPlan plan = plan(0, workersOnly);

            assertEquals(ReconciliationPlan.Reason.SURPLUS, reasonFor(plan, a));
            assertEquals(0, plan.workersToMint());
        }

        @Test
        void terminatedEntriesAreIgnored() {
            RegistryEntry gone = connectedWorker("aaa", NOW - 1_000);
            gone.terminate(NOW - 10);

            ReconciliationPlan plan = plan(1, workersOnly);

            assertEquals(RegistryEntry.TERMINATED, gone.getGoalShardId());
            assertEquals(1, plan.workersToMint());
        }
    }

    @Nested
    class Minting {

        @Test
        void neverSeenIdentitiesCountAsPending() {
            worker("aaa");

            assertEquals(1, plan(2, workersOnly).workersToMint());
        }

        @Test
        void recentlyDisconnectedIdentitiesCountAsPending() {
            worker("aaa").setLastSeen(NOW - 30_000);

            assertEquals(0, plan(1, workersOnly).workersToMint());
        }

        @Test
        void longSilentIdentitiesDoNotBlockMinting() {
            worker("aaa").setLastSeen(NOW - 200_000);

            assertEquals(1, plan(1, workersOnly).workersToMint());
        }

        @Test
        void mintsInFlightAreSubtracted() {
            ReconciliationPlan plan = planner.plan(entries, 3, workersOnly, NOW, connected::contains, 2, false);

            assertEquals(1, plan.workersToMint());
        }
    }

    @Nested
    class MasterRole {

        private FleetSettings withMaster;

        @BeforeEach
        void setUp() throws Exception {
            withMaster = settings("{\"masterShard\": true}");
        }

        @Test
        void missingMasterIsMintedOnce() {
            assertTrue(plan(1, withMaster).mintMaster());
            assertFalse(planner.plan(entries, 1, withMaster, NOW, connected::contains, 0, true).mintMaster());
        }

        @Test
        void masterFollowsTheGoalCount() {
            RegistryEntry master = new RegistryEntry("mmm", "pem", true);
            entries.add(master);

            ReconciliationPlan plan = plan(3, withMaster);

            assertEquals(RegistryEntry.MASTER_SHARD_ID, master.getGoalShardId());
            assertEquals(3, master.getGoalShardCount());
            assertTrue(plan.assigned().contains(master));
            assertFalse(plan.mintMaster());
            assertEquals(3, plan.workersToMint());
        }

        @Test
        void extraMastersAreDemotedKeepingMostRecentlySeen() {
            RegistryEntry seen = new RegistryEntry("mma", "pem", true);
            seen.setLastSeen(NOW - 1_000);
            RegistryEntry older = new RegistryEntry("mmb", "pem", true);
            older.setLastSeen(NOW - 50_000);
            entries.add(older);
            entries.add(seen);

            ReconciliationPlan plan = plan(0, withMaster);

            assertTrue(seen.isMaster());
            assertFalse(older.isMaster());
            assertEquals(ReconciliationPlan.Reason.DEMOTED, reasonFor(plan, older));
        }

        @Test
        void mastersAreRetiredWhenRoleIsDisabled() {
            RegistryEntry master = new RegistryEntry("mmm", "pem", true);
            master.assign(RegistryEntry.MASTER_SHARD_ID, 1, NOW - 1_000);
            entries.add(master);

            ReconciliationPlan plan = plan(1, workersOnly);

            assertEquals(ReconciliationPlan.Reason.SURPLUS, reasonFor(plan, master));
        }
    }
}
