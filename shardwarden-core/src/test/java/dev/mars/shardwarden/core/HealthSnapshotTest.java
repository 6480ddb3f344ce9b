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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthSnapshotTest {

    @Test
    void updateReplacesFieldsButKeepsOwnId() {
        HealthSnapshot stored = new HealthSnapshot("abc");
        HealthSnapshot received = new HealthSnapshot("xyz");
        received.setGoalShardId(1);
        received.setGoalShardCount(3);
        received.setCurrentShardId(1);
        received.setCurrentShardCount(3);
        received.setCpuLoad(List.of(0.25, 0.5));
        received.setMessageCountDelta(12);
        received.setTimestamp(42);

        stored.update(received);

        assertEquals("abc", stored.getId());
        assertEquals(1, stored.getCurrentShardId());
        assertEquals(3, stored.getGoalShardCount());
        assertEquals(List.of(0.25, 0.5), stored.getCpuLoad());
        assertEquals(12, stored.getMessageCountDelta());
        assertEquals(42, stored.getTimestamp());
    }

    @Test
    void updateAdoptsIdWhenMissing() {
        HealthSnapshot stored = new HealthSnapshot();
        stored.update(new HealthSnapshot("abc"));
        assertEquals("abc", stored.getId());
    }

    @Test
    void copyIsIndependent() {
        HealthSnapshot original = new HealthSnapshot("abc");
        original.setCpuLoad(new java.util.ArrayList<>(List.of(0.1)));
        HealthSnapshot copy = original.copy();
        original.getCpuLoad().add(0.9);

        assertEquals(List.of(0.1), copy.getCpuLoad());
    }
}
