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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Latest health report of one shard. Agents build it every heartbeat and the
 * master keeps only the most recent one per registry entry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthSnapshot {

    @JsonProperty("id")
    private String id;

    @JsonProperty("goalShardId")
    private int goalShardId = RegistryEntry.RETIRED;

    @JsonProperty("goalShardCount")
    private int goalShardCount;

    @JsonProperty("currentShardId")
    private int currentShardId = RegistryEntry.RETIRED;

    @JsonProperty("currentShardCount")
    private int currentShardCount;

    @JsonProperty("master")
    private boolean master;

    @JsonProperty("heapUsed")
    private long heapUsed;

    @JsonProperty("heapCommitted")
    private long heapCommitted;

    @JsonProperty("heapMax")
    private long heapMax;

    @JsonProperty("nonHeapUsed")
    private long nonHeapUsed;

    // fraction of busy time per core since the previous heartbeat
    @JsonProperty("cpuLoad")
    private List<Double> cpuLoad = new ArrayList<>();

    @JsonProperty("messageCountTotal")
    private long messageCountTotal;

    @JsonProperty("messageCountDelta")
    private long messageCountDelta;

    @JsonProperty("diskUsedBytes")
    private long diskUsedBytes;

    @JsonProperty("diskTotalBytes")
    private long diskTotalBytes;

    @JsonProperty("projectDirBytes")
    private long projectDirBytes;

    @JsonProperty("timestamp")
    private long timestamp;

    @JsonProperty("timeDelta")
    private long timeDelta;

    @JsonProperty("startTime")
    private long startTime;

    @JsonProperty("stopTime")
    private long stopTime;

    public HealthSnapshot() {
    }

    public HealthSnapshot(String id) {
        this.id = id;
    }

    /**
     * Copies every field of a freshly received snapshot over this one. The id
     * is only taken when this snapshot has none yet.
     *
     * @param other the received snapshot
     */
    public void update(HealthSnapshot other) {
        if (id == null) {
            id = other.id;
        }
        goalShardId = other.goalShardId;
        goalShardCount = other.goalShardCount;
        currentShardId = other.currentShardId;
        currentShardCount = other.currentShardCount;
        master = other.master;
        heapUsed = other.heapUsed;
        heapCommitted = other.heapCommitted;
        heapMax = other.heapMax;
        nonHeapUsed = other.nonHeapUsed;
        cpuLoad = other.cpuLoad == null ? new ArrayList<>() : new ArrayList<>(other.cpuLoad);
        messageCountTotal = other.messageCountTotal;
        messageCountDelta = other.messageCountDelta;
        diskUsedBytes = other.diskUsedBytes;
        diskTotalBytes = other.diskTotalBytes;
        projectDirBytes = other.projectDirBytes;
        timestamp = other.timestamp;
        timeDelta = other.timeDelta;
        startTime = other.startTime;
        stopTime = other.stopTime;
    }

    public HealthSnapshot copy() {
        HealthSnapshot copy = new HealthSnapshot(id);
        copy.update(this);
        return copy;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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

    public boolean isMaster() {
        return master;
    }

    public void setMaster(boolean master) {
        this.master = master;
    }

    public long getHeapUsed() {
        return heapUsed;
    }

    public void setHeapUsed(long heapUsed) {
        this.heapUsed = heapUsed;
    }

    public long getHeapCommitted() {
        return heapCommitted;
    }

    public void setHeapCommitted(long heapCommitted) {
        this.heapCommitted = heapCommitted;
    }

    public long getHeapMax() {
        return heapMax;
    }

    public void setHeapMax(long heapMax) {
        this.heapMax = heapMax;
    }

    public long getNonHeapUsed() {
        return nonHeapUsed;
    }

    public void setNonHeapUsed(long nonHeapUsed) {
        this.nonHeapUsed = nonHeapUsed;
    }

    public List<Double> getCpuLoad() {
        return cpuLoad;
    }

    public void setCpuLoad(List<Double> cpuLoad) {
        this.cpuLoad = cpuLoad;
    }

    public long getMessageCountTotal() {
        return messageCountTotal;
    }

    public void setMessageCountTotal(long messageCountTotal) {
        this.messageCountTotal = messageCountTotal;
    }

    public long getMessageCountDelta() {
        return messageCountDelta;
    }

    public void setMessageCountDelta(long messageCountDelta) {
        this.messageCountDelta = messageCountDelta;
    }

    public long getDiskUsedBytes() {
        return diskUsedBytes;
    }

    public void setDiskUsedBytes(long diskUsedBytes) {
        this.diskUsedBytes = diskUsedBytes;
    }

    public long getDiskTotalBytes() {
        return diskTotalBytes;
    }

    public void setDiskTotalBytes(long diskTotalBytes) {
        this.diskTotalBytes = diskTotalBytes;
    }

    public long getProjectDirBytes() {
        return projectDirBytes;
    }

    public void setProjectDirBytes(long projectDirBytes) {
        this.projectDirBytes = projectDirBytes;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public long getTimeDelta() {
        return timeDelta;
    }

    public void setTimeDelta(long timeDelta) {
        this.timeDelta = timeDelta;
    }

    public long getStartTime() {
        return startTime;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public long getStopTime() {
        return stopTime;
    }

    public void setStopTime(long stopTime) {
        this.stopTime = stopTime;
    }

    @Override
    public String toString() {
        return "HealthSnapshot{" +
                "id='" + id + '\'' +
                ", goal=" + goalShardId + "/" + goalShardCount +
                ", current=" + currentShardId + "/" + currentShardCount +
                ", heapUsed=" + heapUsed +
                ", messageCountDelta=" + messageCountDelta +
                ", timestamp=" + timestamp +
                '}';
    }
}
