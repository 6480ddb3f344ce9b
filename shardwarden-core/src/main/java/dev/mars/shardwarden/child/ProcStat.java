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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-core CPU times from {@code /proc/stat}. On systems without it the list
 * is empty and the agent reports no CPU load.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public final class ProcStat {

    private static final Path PROC_STAT = Paths.get("/proc/stat");

    private ProcStat() {
    }

    public static List<CpuTimes> readCpuTimes() {
        if (!Files.isReadable(PROC_STAT)) {
            return List.of();
        }
        try {
            return parse(Files.readAllLines(PROC_STAT));
        } catch (IOException e) {
            return List.of();
        }
    }

    /**
     * Parses {@code cpuN user nice system idle iowait irq softirq ...} lines.
     * The aggregate {@code cpu} line is skipped; iowait is counted as idle and
     * softirq as irq.
     */
    static List<CpuTimes> parse(List<String> lines) {
        List<CpuTimes> cores = new ArrayList<>();
        for (String line : lines) {
            if (!line.startsWith("cpu") || line.length() < 4 || !Character.isDigit(line.charAt(3))) {
                continue;
            }
            String[] f = line.trim().split("\\s+");
            if (f.length < 5) {
                continue;
            }
            long user = Long.parseLong(f[1]);
            long nice = Long.parseLong(f[2]);
            long system = Long.parseLong(f[3]);
            long idle = Long.parseLong(f[4]) + (f.length > 5 ? Long.parseLong(f[5]) : 0);
            long irq = (f.length > 6 ? Long.parseLong(f[6]) : 0) + (f.length > 7 ? Long.parseLong(f[7]) : 0);
            cores.add(new CpuTimes(user, nice, system, idle, irq));
        }
        return cores;
    }
}
