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


package dev.mars.shardwarden.agent.service;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Disk figures for the heartbeat: the file store holding the project and the
 * size of the project directory. Blocking.
 */
public class DiskUsageProbe {

    public record DiskUsage(long usedBytes, long totalBytes, long projectBytes) {
    }

    private final Path root;

    public DiskUsageProbe(Path root) {
        this.root = root;
    }

    public DiskUsage probe() throws IOException {
        FileStore store = Files.getFileStore(root);
        long total = store.getTotalSpace();
        long used = total - store.getUnallocatedSpace();
        return new DiskUsage(used, total, directorySize(root));
    }

    static long directorySize(Path dir) throws IOException {
        long[] size = new long[1];
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                size[0] += attrs.size();
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                // files can vanish while the child runs
                return FileVisitResult.CONTINUE;
            }
        });
        return size[0];
    }
}
