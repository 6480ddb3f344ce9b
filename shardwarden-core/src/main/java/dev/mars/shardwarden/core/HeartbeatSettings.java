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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Heartbeat timing shared by master and agents. All durations are in
 * milliseconds.
 *
 * @param updateStyle         push or pull
 * @param disperse            in pull mode, spread updates over the interval one target at a time
 * @param intervalMs          heartbeat interval
 * @param requestRebootAfterMs heartbeat age after which a reboot is requested
 * @param expectRebootAfterMs heartbeat age after which the partition is released
 * @param assumeDeadAfterMs   silence after which an agent is ignored or exits on its own
 * @param useMessageStats     only count a heartbeat as alive when the child processed messages
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HeartbeatSettings(
        HeartbeatStyle updateStyle,
        boolean disperse,
        long intervalMs,
        long requestRebootAfterMs,
        long expectRebootAfterMs,
        long assumeDeadAfterMs,
        boolean useMessageStats) {

    public static HeartbeatSettings defaults() {
        return new HeartbeatSettings(HeartbeatStyle.PULL, false, 5_000, 60_000, 90_000, 120_000, false);
    }

    @JsonIgnore
    public boolean isPull() {
        return updateStyle == HeartbeatStyle.PULL;
    }
}
