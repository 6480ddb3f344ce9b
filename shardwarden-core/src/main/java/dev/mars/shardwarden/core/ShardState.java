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

import com.fasterxml.jackson.annotation.JsonValue;
import dev.mars.shardwarden.core.exceptions.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a registry entry as seen by the orchestrator.
 *
 * <p>
 * <strong>State categories:</strong>
 * </p>
 * <ul>
 * <li><strong>Working</strong> ({@code CONFIGURING}, {@code CONFIGURED}):
 * the entry holds a partition and reports heartbeats.</li>
 * <li><strong>Lapsing</strong> ({@code STALE}, {@code DEAD}):
 * heartbeats stopped; a stale entry is asked to reboot, a dead one loses its
 * partition.</li>
 * <li><strong>Idle</strong> ({@code UNASSIGNED}, {@code RETIRED}):
 * no partition; the entry may be reassigned.</li>
 * <li><strong>Terminal</strong> ({@code TERMINATED}):
 * told to exit; never reassigned.</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum ShardState {

    /** Known identity that has never been given a partition. */
    UNASSIGNED("unassigned", "Known identity without a partition", false),

    /** Assignment sent, the agent has not yet reported it as current. */
    CONFIGURING("configuring", "Assignment sent, waiting for the agent to apply it", true),

    /** The agent reports the goal assignment as current and heartbeats are fresh. */
    CONFIGURED("configured", "Running its assigned partition", true),

    /** Heartbeat age passed the reboot-request threshold. */
    STALE("stale", "Heartbeats overdue, reboot requested", true),

    /** Heartbeat age passed the expected-reboot threshold; the partition is released. */
    DEAD("dead", "Presumed dead, partition released", false),

    /** Goal cleared to -1; the child is stopped but the agent stays connected. */
    RETIRED("retired", "Partition withdrawn", false),

    /** Goal set to -2; the agent exits and the entry is never reassigned. */
    TERMINATED("terminated", "Told to exit permanently", false);

    // ── Transition table ───────────────────────────────────────────────

    private static final Map<ShardState, Set<ShardState>> TRANSITIONS;

    static {
        var map = new EnumMap<ShardState, Set<ShardState>>(ShardState.class);
        map.put(UNASSIGNED, EnumSet.of(CONFIGURING, RETIRED, TERMINATED));
        map.put(CONFIGURING, EnumSet.of(CONFIGURED, STALE, DEAD, RETIRED, TERMINATED));
        map.put(CONFIGURED, EnumSet.of(CONFIGURING, STALE, RETIRED, TERMINATED));
        map.put(STALE, EnumSet.of(CONFIGURED, DEAD, RETIRED, TERMINATED));
        map.put(DEAD, EnumSet.of(CONFIGURING, RETIRED, TERMINATED));
        map.put(RETIRED, EnumSet.of(CONFIGURING, TERMINATED));
        map.put(TERMINATED, EnumSet.noneOf(ShardState.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;
    private final String description;
    private final boolean holdsPartition;

    ShardState(String value, String description, boolean holdsPartition) {
        this.value = value;
        this.description = description;
        this.holdsPartition = holdsPartition;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether an entry in this state still counts as the holder of its goal
     * partition.
     *
     * @return true for working and stale entries
     */
    public boolean holdsPartition() {
        return holdsPartition;
    }

    public boolean isTerminal() {
        return this == TERMINATED;
    }

    /**
     * Checks whether a transition from this state to the target is valid.
     *
     * <pre>
     *   UNASSIGNED  → CONFIGURING, RETIRED, TERMINATED
     *   CONFIGURING → CONFIGURED, STALE, DEAD, RETIRED, TERMINATED
     *   CONFIGURED  → CONFIGURING, STALE, RETIRED, TERMINATED
     *   STALE       → CONFIGURED, DEAD, RETIRED, TERMINATED
     *   DEAD        → CONFIGURING, RETIRED, TERMINATED
     *   RETIRED     → CONFIGURING, TERMINATED
     *   TERMINATED  → (none)
     * </pre>
     *
     * @param target the requested state
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(ShardState target) {
        return TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
    }

    public Set<ShardState> getValidTransitions() {
        return TRANSITIONS.get(this);
    }

    /**
     * Validates a transition, throwing when it is not allowed.
     *
     * @param shardId the entry being moved, for the error message
     * @param target  the requested state
     * @throws InvalidTransitionException if {@link #canTransitionTo} is false
     */
    public void checkTransition(String shardId, ShardState target) throws InvalidTransitionException {
        if (!canTransitionTo(target)) {
            throw new InvalidTransitionException(shardId, this, target, getValidTransitions());
        }
    }

    public static ShardState fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Shard state value must not be null");
        }
        for (ShardState state : values()) {
            if (state.value.equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown shard state: " + value);
    }
}
