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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcStatTest {

    @Test
    void parsesPerCoreLinesAndSkipsAggregate() {
        List<CpuTimes> cores = ProcStat.parse(List.of(
                "cpu  200 10 100 1000 5 3 2 0 0 0",
                "cpu0 120 4 60 500 2 1 1 0 0 0",
                "cpu1 80 6 40 500 3 2 1 0 0 0",
                "intr 12345",
                "ctxt 999"));

        assertEquals(2, cores.size());
        assertEquals(new CpuTimes(120, 4, 60, 502, 2), cores.get(0));
        assertEquals(80 + 6 + 40 + 503 + 3, cores.get(1).total());
    }

    @Test
    void noCpuLinesMeansNoCores() {
        assertTrue(ProcStat.parse(List.of("intr 1")).isEmpty());
    }
}
