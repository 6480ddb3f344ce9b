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

/**
 * Decides when the master sends heartbeat updates and to whom.
 *
 * <p>Without dispersion every tick addresses the whole fleet once per
 * interval. With pull-style dispersion the interval is cut into
 * {@code goal + 1} slots; slot {@code i < goal} addresses the holder of id
 * {@code i} and the last slot addresses the master-role shard.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class HeartbeatScheduler {

    /** Upper bound on the time between two reconciliation passes. */
    public static final long MAX_IDLE_MS = 5_000;

    public enum Target {
        ALL,
        SHARD,
        MASTER
    }

    /**
     * Addressees of one tick.
     *
     * @param target  whole fleet, one shard id, or the master-role shard
     * @param shardId the id addressed when {@code target == SHARD}, else -1
     */
    public record Tick(Target target, int shardId) {

        static Tick all() {
            return new Tick(Target.ALL, -1);
        }
    }

    private long loopStart;
    private long nextTick;

    public HeartbeatScheduler(long now) {
        this.loopStart = now;
        this.nextTick = now;
    }

    public boolean isDue(long now) {
        return now >= nextTick;
    }

    /**
     * Consumes the due tick and schedules the next one.
     */
    public Tick advance(long now, HeartbeatSettings heartbeat, int goal) {
        long interval = heartbeat.intervalMs();
        if (now - loopStart >= interval) {
            loopStart += ((now - loopStart) / interval) * interval;
        }
        if (heartbeat.isPull() && heartbeat.disperse()) {
            int slots = Math.max(1, goal + 1);
            long delta = Math.max(1, interval / slots);
            int slot = (int) Math.min(slots - 1, ((now - loopStart) * slots) / interval);
            nextTick = Math.max(nextTick + delta, now + 1);
            return slot >= goal ? new Tick(Target.MASTER, -1) : new Tick(Target.SHARD, slot);
        }
        nextTick = nextTick + interval > now ? nextTick + interval : now + interval;
        return Tick.all();
    }

    /**
     * Milliseconds until the next pass should run.
     */
    public long delayUntilNext(long now) {
        return Math.max(1, Math.min(MAX_IDLE_MS, nextTick - now));
    }

    long getNextTick() {
        return nextTick;
    }
}
