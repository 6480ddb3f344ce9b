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
import dev.mars.shardwarden.core.HeartbeatStyle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HeartbeatSchedulerTest {

    private static final HeartbeatSettings PULL = new HeartbeatSettings(
            HeartbeatStyle.PULL, false, 5_000, 60_000, 90_000, 120_000, false);
    private static final HeartbeatSettings DISPERSED = new HeartbeatSettings(
            HeartbeatStyle.PULL, true, 5_000, 60_000, 90_000, 120_000, false);
    private static final HeartbeatSettings PUSH_DISPERSED = new HeartbeatSettings(
            HeartbeatStyle.PUSH, true, 5_000, 60_000, 90_000, 120_000, false);

    @Test
    void wholeFleetTickOncePerInterval() {
        HeartbeatScheduler scheduler = new HeartbeatScheduler(0);

        assertTrue(scheduler.isDue(0));
        assertEquals(HeartbeatScheduler.Target.ALL, scheduler.advance(0, PULL, 3).target());
        assertFalse(scheduler.isDue(4_999));
        assertEquals(4_000, scheduler.delayUntilNext(1_000));
        assertTrue(scheduler.isDue(5_000));

        scheduler.advance(5_000, PULL, 3);
        assertEquals(10_000, scheduler.getNextTick());
    }

    @Test
    void lateTickDoesNotBurstToCatchUp() {
        HeartbeatScheduler scheduler = new HeartbeatScheduler(0);
        scheduler.advance(0, PULL, 1);

        scheduler.advance(30_000, PULL, 1);

        assertEquals(35_000, scheduler.getNextTick());
    }

    @Test
    void dispersedTicksWalkShardsThenMaster() {
        HeartbeatScheduler scheduler = new HeartbeatScheduler(0);

        for (int slot = 0; slot < 4; slot++) {
            long now = slot * 1_000L;
            assertTrue(scheduler.isDue(now));
            HeartbeatScheduler.Tick tick = scheduler.advance(now, DISPERSED, 4);
            assertEquals(HeartbeatScheduler.Target.SHARD, tick.target());
            assertEquals(slot, tick.shardId());
        }
        assertEquals(HeartbeatScheduler.Target.MASTER, scheduler.advance(4_000, DISPERSED, 4).target());

        HeartbeatScheduler.Tick wrapped = scheduler.advance(5_000, DISPERSED, 4);
        assertEquals(HeartbeatScheduler.Target.SHARD, wrapped.target());
        assertEquals(0, wrapped.shardId());
    }

    @Test
    void dispersionOnlyAppliesToPullStyle() {
        HeartbeatScheduler scheduler = new HeartbeatScheduler(0);

        assertEquals(HeartbeatScheduler.Target.ALL, scheduler.advance(0, PUSH_DISPERSED, 4).target());
    }

    @Test
    void delayIsClampedToMaximumIdle() {
        HeartbeatSettings slow = new HeartbeatSettings(
                HeartbeatStyle.PULL, false, 60_000, 120_000, 180_000, 240_000, false);
        HeartbeatScheduler scheduler = new HeartbeatScheduler(0);
        scheduler.advance(0, slow, 1);

        assertEquals(HeartbeatScheduler.MAX_IDLE_MS, scheduler.delayUntilNext(0));
        assertEquals(1, scheduler.delayUntilNext(120_000));
    }
}
