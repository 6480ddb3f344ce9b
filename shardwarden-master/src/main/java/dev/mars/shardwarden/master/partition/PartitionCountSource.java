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

package dev.mars.shardwarden.master.partition;

import io.vertx.core.Handler;

/**
 * Supplies the number of partitions the fleet should run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public interface PartitionCountSource {

    /**
     * The current goal, or a negative value while it is not known yet.
     */
    int current();

    /**
     * Gives the source a chance to refresh itself. Called once per
     * reconciliation pass; implementations throttle themselves.
     */
    default void poll(long now) {
    }

    /**
     * Registers a handler invoked with the new value whenever it changes
     * outside of {@link #current()}.
     */
    default void onChange(Handler<Integer> handler) {
    }
}
