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

package dev.mars.shardwarden.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegistryEntryTest {

    private static final HeartbeatSettings HEARTBEAT =
            new HeartbeatSettings(HeartbeatStyle.PULL, false, 1_000, 10_000, 20_000, 30_000, false);

    @Test
    @DisplayName("A never-assigned entry is unassigned, a withdrawn one retired")
    void idleStates() {
        RegistryEntry entry = new RegistryEntry("abc", "pem", false);
        assertEquals(ShardState.UNASSIGNED, entry.state(5_000, HEARTBEAT));

        entry.assign(0, 2, 1_000);
        entry.retire(2_000);
        assertEquals(ShardState.RETIRED, entry.state(5_000, HEARTBEAT));

        entry.terminate(3_000);
        assertEquals(ShardState.TERMINATED, entry.state(5_000, HEARTBEAT));
        assertTrue(entry.isTerminated());
    }

    @Test
    @DisplayName("Assignment restarts the liveness clock")
    void assignmentCountsAsLiveness() {
        RegistryEntry entry = new RegistryEntry("abc", "pem", false);
        entry.assign(1, 2, 100_000);

        assertEquals(0, entry.livenessAge(100_000));
        assertEquals(ShardState.CONFIGURING, entry.state(105_000, HEARTBEAT));
        assertEquals(ShardState.STALE, entry.state(110_000, HEARTBEAT));
        assertEquals(ShardState.DEAD, entry.state(120_000, HEARTBEAT));
    }

    @Test
    @DisplayName("Reported current assignment equal to goal means configured")
    void converged() {
        RegistryEntry entry = new RegistryEntry("abc", "pem", false);
        entry.assign(1, 2, 100_000);
        entry.setCurrentShardId(1);
        entry.setCurrentShardCount(2);
        entry.setLastHeartbeat(104_000);

        assertTrue(entry.isConverged());
        assertEquals(ShardState.CONFIGURED, entry.state(105_000, HEARTBEAT));
    }

    @Test
    @DisplayName("Only identity and goal survive the round trip through the persisted record")
    void recordKeepsPersistedSubset() {
        RegistryEntry entry = new RegistryEntry("abc", "pem", true);
        entry.assign(RegistryEntry.MASTER_SHARD_ID, 4, 100);
        entry.setLastSeen(500);
        entry.setCurrentShardId(3);

        RegistryEntry restored = RegistryEntry.fromRecord(entry.toRecord());

        assertEquals("abc", restored.getId());
        assertEquals("pem", restored.getPublicKey());
        assertTrue(restored.isMaster());
        assertEquals(RegistryEntry.MASTER_SHARD_ID, restored.getGoalShardId());
        assertEquals(4, restored.getGoalShardCount());
        assertEquals(0, restored.getLastSeen());
        assertEquals(RegistryEntry.RETIRED, restored.getCurrentShardId());
    }

    @Test
    void settingsCarryGoal() {
        RegistryEntry entry = new RegistryEntry("abc", "pem", false);
        entry.assign(2, 5, 1);

        ShardSettings settings = entry.toSettings("app", HEARTBEAT, LaunchSettings.empty());

        assertEquals(2, settings.shardId());
        assertEquals(5, settings.shardCount());
        assertFalse(settings.master());
        assertSame(HEARTBEAT, settings.heartbeat());
    }
}
