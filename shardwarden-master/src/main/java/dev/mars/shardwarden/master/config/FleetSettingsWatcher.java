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

import dev.mars.shardwarden.core.exceptions.ConfigParseException;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Holds the fleet settings in effect and reloads them when the file changes.
 * A file that fails to parse is logged and ignored; the previous settings stay
 * in effect.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class FleetSettingsWatcher implements Supplier<FleetSettings> {

    private static final Logger logger = LoggerFactory.getLogger(FleetSettingsWatcher.class);

    private final Vertx vertx;
    private final Path file;
    private final FileWatcher watcher;
    private final List<Handler<FleetSettingsChange>> listeners = new ArrayList<>();

    private volatile FleetSettings current;

    public FleetSettingsWatcher(Vertx vertx, Path file, long pollIntervalMs) {
        this.vertx = vertx;
        this.file = file;
        this.watcher = new FileWatcher(vertx, file, pollIntervalMs, v -> reload());
    }

    /**
     * Loads the file once and starts watching it. Fails if the initial load
     * fails, since there is no previous good state to fall back on.
     */
    public Future<FleetSettings> start() {
        return vertx.executeBlocking(() -> FleetSettingsLoader.load(file))
                .onSuccess(settings -> {
                    current = settings;
                    logger.info("Fleet settings loaded from {} (numShards={}, autoDetect={}, style={})",
                            file, settings.numShards(), settings.autoDetectNumShards(),
                            settings.heartbeat().updateStyle().getValue());
                })
                .compose(settings -> watcher.start().map(settings));
    }

    public void stop() {
        watcher.stop();
    }

    public void onChange(Handler<FleetSettingsChange> listener) {
        listeners.add(listener);
    }

    @Override
    public FleetSettings get() {
        return current;
    }

    /**
     * Re-reads the file now. Completes with the change, or with null when the
     * content is unchanged or invalid.
     */
    public Future<FleetSettingsChange> reload() {
        return vertx.executeBlocking(() -> FleetSettingsLoader.load(file))
                .map(this::apply)
                .recover(err -> {
                    if (err instanceof ConfigParseException) {
                        logger.error("Keeping previous fleet settings: {}", err.getMessage());
                    } else {
                        logger.error("Failed to reload fleet settings from {}", file, err);
                    }
                    return Future.succeededFuture();
                });
    }

    private FleetSettingsChange apply(FleetSettings loaded) {
        FleetSettings previous = current;
        List<String> changed = FleetSettingsLoader.diff(previous, loaded);
        if (changed.isEmpty()) {
            return null;
        }
        current = loaded;
        FleetSettingsChange change = new FleetSettingsChange(previous, loaded, changed);
        logger.info("Fleet settings changed: {}", changed);
        for (Handler<FleetSettingsChange> listener : listeners) {
            listener.handle(change);
        }
        return change;
    }
}
