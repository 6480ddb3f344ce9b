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

package dev.mars.shardwarden.master.config;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;

/**
 * Polls a file's modification time and calls back when it changes. The
 * callback runs on the event loop that started the watcher.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class FileWatcher {

    private static final Logger logger = LoggerFactory.getLogger(FileWatcher.class);

    private final Vertx vertx;
    private final Path file;
    private final long intervalMs;
    private final Handler<Void> onChange;

    private FileTime lastModified;
    private long timerId = -1;
    private boolean polling;

    public FileWatcher(Vertx vertx, Path file, long intervalMs, Handler<Void> onChange) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.file = Objects.requireNonNull(file, "file");
        this.intervalMs = intervalMs;
        this.onChange = Objects.requireNonNull(onChange, "onChange");
    }

    /**
     * Records the current modification time as the baseline and starts polling.
     */
    public Future<Void> start() {
        return rebaseline().onSuccess(v -> {
            timerId = vertx.setPeriodic(intervalMs, id -> poll());
            logger.debug("Watching {} every {}ms", file, intervalMs);
        });
    }

    /**
     * Takes the file's current state as seen, so a write made by this process
     * does not trigger the callback.
     */
    public Future<Void> rebaseline() {
        return vertx.executeBlocking(() -> modifiedTime(file))
                .onSuccess(time -> lastModified = time)
                .mapEmpty();
    }

    public void stop() {
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
            timerId = -1;
        }
    }

    public Path getFile() {
        return file;
    }

    private void poll() {
        if (polling) {
            return;
        }
        polling = true;
        vertx.executeBlocking(() -> modifiedTime(file))
                .onComplete(ar -> {
                    polling = false;
                    if (ar.failed()) {
                        logger.warn("Failed to stat {}: {}", file, ar.cause().getMessage());
                        return;
                    }
                    FileTime current = ar.result();
                    if (!Objects.equals(current, lastModified)) {
                        lastModified = current;
                        logger.debug("{} changed", file);
                        onChange.handle(null);
                    }
                });
    }

    private static FileTime modifiedTime(Path file) throws IOException {
        try {
            return Files.getLastModifiedTime(file);
        } catch (NoSuchFileException e) {
            return null;
        }
    }
}
