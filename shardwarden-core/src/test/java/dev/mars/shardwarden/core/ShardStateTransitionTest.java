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

import dev.mars.shardwarden.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Covers every (source, target) pair of the shard lifecycle.
 */
class ShardStateTransitionTest {

    private static EnumSet<ShardState> validTargets(ShardState from) {
        return switch (from) {
            case UNASSIGNED -> EnumSet.of(ShardState.CONFIGURING, ShardState.RETIRED, ShardState.TERMINATED);
            case CONFIGURING -> EnumSet.of(ShardState.CONFIGURED, ShardState.STALE, ShardState.DEAD,
                    ShardState.RETIRED, ShardState.TERMINATED);
            case CONFIGURED -> EnumSet.of(ShardState.CONFIGURING, ShardState.STALE,
                    ShardState.RETIRED, ShardState.TERMINATED);
            case STALE -> EnumSet.of(ShardState.CONFIGURED, ShardState.DEAD,
                    ShardState.RETIRED, ShardState.TERMINATED);
            case DEAD -> EnumSet.of(ShardState.CONFIGURING, ShardState.RETIRED, ShardState.TERMINATED);
            case RETIRED -> EnumSet.of(ShardState.CONFIGURING, ShardState.TERMINATED);
            case TERMINATED -> EnumSet.noneOf(ShardState.class);
        };
    }

    static Stream<Arguments> allPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (ShardState from : ShardState.values()) {
            Set<ShardState> valid = validTargets(from);
            for (ShardState to : ShardState.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    @ParameterizedTest(name = "{0} → {1} should be {2}")
    @MethodSource("allPairs")
    void canTransitionTo_coversAllPairs(ShardState from, ShardState to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to));
    }

    @Test
    void terminatedIsTheOnlyTerminalState() {
        for (ShardState state : ShardState.values()) {
            assertEquals(state == ShardState.TERMINATED, state.isTerminal(), state.name());
            assertEquals(state.isTerminal(), state.getValidTransitions().isEmpty(), state.name());
        }
    }

    @Test
    void checkTransition_rejectsInvalidTargetWithContext() {
        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> ShardState.TERMINATED.checkTransition("abc", ShardState.CONFIGURING));
        assertEquals("abc", e.getShardId());
        assertEquals(ShardState.TERMINATED, e.getCurrentState());
        assertEquals(ShardState.CONFIGURING, e.getRequestedState());
        assertTrue(e.getMessage().contains("abc"));
    }

    @Test
    void checkTransition_acceptsValidTarget() {
        assertDoesNotThrow(() -> ShardState.CONFIGURED.checkTransition("abc", ShardState.STALE));
    }

    @Test
    void fromValue_isCaseInsensitive() {
        assertEquals(ShardState.STALE, ShardState.fromValue("Stale"));
        assertThrows(IllegalArgumentException.class, () -> ShardState.fromValue("sleeping"));
        assertThrows(IllegalArgumentException.class, () -> ShardState.fromValue(null));
    }
}
