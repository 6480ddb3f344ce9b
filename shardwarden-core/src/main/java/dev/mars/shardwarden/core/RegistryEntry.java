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

import java.util.Objects;

/**
 * One known identity in the orchestrator's registry.
 *
 * <p>Goal fields are what the master wants the agent to run; current fields are
 * what the agent last reported. A goal id of {@link #RETIRED} means "run
 * nothing", {@link #TERMINATED} means "exit and never come back". The
 * master-role entry is assigned goal id {@link #MASTER_SHARD_ID}.</p>
 *
 * <p>Instances are mutated only on the orchestrator's event loop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class RegistryEntry {

    public static final int RETIRED = -1;
    public static final int TERMINATED = -2;
    public static final int MASTER_SHARD_ID = 1000;

    private final String id;
    private String publicKey;
    private boolean master;
    private int goalShardId = RETIRED;
    private int goalShardCount;
    private int currentShardId = RETIRED;
    private int currentShardCount;
    private long lastSeen;
    private long lastHeartbeat;
    private long bootTime;
    private long stopTime;
    private final HealthSnapshot stats;

    public RegistryEntry(String id, String publicKey, boolean master) {
        this.id = Objects.requireNonNull(id, "id");
        this.publicKey = publicKey;
        this.master = master;
        this.stats = new HealthSnapshot(id);
    }

    public static RegistryEntry fromRecord(RegistryRecord record) {
        RegistryEntry entry = new RegistryEntry(record.id(), record.publicKey(), record.master());
        entry.goalShardId = record.goalShardId();
        entry.goalShardCount = record.goalShardCount();
        return entry;
    }

    public RegistryRecord toRecord() {
        return new RegistryRecord(id, publicKey, master, goalShardId, goalShardCount);
    }

    /**
     * Builds the {@code update} payload carrying this entry's goal.
     */
    public ShardSettings toSettings(String applicationName, HeartbeatSettings heartbeat, LaunchSettings launch) {
        return new ShardSettings(goalShardId, goalShardCount, master, applicationName, heartbeat, launch);
    }

    /**
     * Milliseconds since the entry last proved it was alive. An assignment
     * ({@link #bootTime}) counts as proof so a freshly assigned entry gets a
     * full grace period to report its first heartbeat.
     */
    public long livenessAge(long now) {
        return now - Math.max(lastHeartbeat, bootTime);
    }

    public ShardState state(long now, HeartbeatSettings heartbeat) {
        if (goalShardId == TERMINATED) {
            return ShardState.TERMINATED;
        }
        if (goalShardId < 0) {
            return bootTime == 0 && stopTime == 0 ? ShardState.UNASSIGNED : ShardState.RETIRED;
        }
        long age = livenessAge(now);
        if (age >= heartbeat.expectRebootAfterMs()) {
            return ShardState.DEAD;
        }
        if (age >= heartbeat.requestRebootAfterMs()) {
            return ShardState.STALE;
        }
        return isConverged() ? ShardState.CONFIGURED : ShardState.CONFIGURING;
    }

    public boolean isConverged() {
        return goalShardId == currentShardId && goalShardCount == currentShardCount;
    }

    public boolean isTerminated() {
        return goalShardId == TERMINATED;
    }

    public boolean hasBeenSeen() {
        return lastSeen > 0;
    }

    /**
     * Gives the entry a partition and restarts its liveness clock.
     */
    public void assign(int shardId, int shardCount, long now) {
        this.goalShardId = shardId;
        this.goalShardCount = shardCount;
        this.bootTime = now;
    }

    /**
     * Withdraws the partition; the agent stops its child but stays connected.
     */
    public void retire(long now) {
        this.goalShardId = RETIRED;
        this.goalShardCount = RETIRED;
        this.stopTime = now;
    }

    public void terminate(long now) {
        this.goalShardId = TERMINATED;
        this.stopTime = now;
    }

    public String getId() {
        return id;
    }

    public String getPublicKey() {
        return publicKey;
    }

    public void setPublicKey(String publicKey) {
        this.publicKey = publicKey;
    }

    public boolean isMaster() {
        return master;
    }

    public void setMaster(boolean master) {
        this.master = master;
    }

    public int getGoalShardId() {
        return goalShardId;
    }

    public void setGoalShardId(int goalShardId) {
        this.goalShardId = goalShardId;
    }

    public int getGoalShardCount() {
        return goalShardCount;
    }

    public void setGoalShardCount(int goalShardCount) {
        this.goalShardCount = goalShardCount;
    }

    public int getCurrentShardId() {
        return currentShardId;
    }

    public void setCurrentShardId(int currentShardId) {
        this.currentShardId = currentShardId;
    }

    public int getCurrentShardCount() {
        return currentShardCount;
    }

    public void setCurrentShardCount(int currentShardCount) {
        this.currentShardCount = currentShardCount;
    }

    public long getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(long lastSeen) {
        this.lastSeen = lastSeen;
    }

    public long getLastHeartbeat() {
        return lastHeartbeat;
    }

    public void setLastHeartbeat(long lastHeartbeat) {
        this.lastHeartbeat = lastHeartbeat;
    }

    public long getBootTime() {
        return bootTime;
    }

    public void setBootTime(long bootTime) {
        this.bootTime = bootTime;
    }

    public long getStopTime() {
        return stopTime;
    }

    public void setStopTime(long stopTime) {
        this.stopTime = stopTime;
    }

    public HealthSnapshot getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return "RegistryEntry{" +
                "id='" + id + '\'' +
                ", master=" + master +
                ", goal=" + goalShardId + "/" + goalShardCount +
                ", current=" + currentShardId + "/" + currentShardCount +
                ", lastSeen=" + lastSeen +
                ", lastHeartbeat=" + lastHeartbeat +
                '}';
    }
}
