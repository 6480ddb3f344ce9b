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

package dev.mars.shardwarden.child;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * What a child reports when asked for stats.
 *
 * @param messageCount cumulative count of units of work the application
 *                     reported through {@link ChildRuntime#recordMessage()}
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChildStats(
        long heapUsed,
        long heapCommitted,
        long heapMax,
        long nonHeapUsed,
        List<CpuTimes> cpuTimes,
        long messageCount,
        long uptimeMs) {

    public ChildStats {
        cpuTimes = cpuTimes == null ? List.of() : List.copyOf(cpuTimes);
    }
}
