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

package dev.mars.shardwarden.core.exceptions;

/**
 * Thrown when a shard is asked to move to a state its current state does
 * not lead to.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class InvalidTransitionException extends ShardwardenException {

    private final String shardId;
    private final Enum<?> currentState;
    private final Enum<?> requestedState;

    public InvalidTransitionException(String shardId, Enum<?> currentState, Enum<?> requestedState,
                                      Iterable<? extends Enum<?>> validTargets) {
        super(String.format("Invalid transition for shard '%s': %s -> %s. Valid targets: %s",
                shardId, currentState, requestedState, join(validTargets)));
        this.shardId = shardId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }

    public String getShardId() {
        return shardId;
    }

    public Enum<?> getCurrentState() {
        return currentState;
    }

    public Enum<?> getRequestedState() {
        return requestedState;
    }

    private static String join(Iterable<? extends Enum<?>> targets) {
        StringBuilder sb = new StringBuilder("[");
        for (Enum<?> target : targets) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(target.name());
        }
        return sb.append(']').toString();
    }
}
