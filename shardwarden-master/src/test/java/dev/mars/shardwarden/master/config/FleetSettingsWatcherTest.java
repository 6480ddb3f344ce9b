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

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class FleetSettingsWatcherTest {

    @TempDir
    Path tempDir;

    private FleetSettingsWatcher watcher(Vertx vertx, Path file) {
        return new FleetSettingsWatcher(vertx, file, 60_000);
    }

    @Test
    void changeIsPublishedToListeners(Vertx vertx, VertxTestContext testContext) throws Exception {
        Path file = tempDir.resolve("fleet.json");
        Files.writeString(file, "{\"numShards\": 2}");
        FleetSettingsWatcher watcher = watcher(vertx, file);
        List<FleetSettingsChange> changes = new ArrayList<>();
        watcher.onChange(changes::add);

        watcher.start()
                .compose(initial -> {
                    assertEquals(2, initial.numShards());
                    return vertx.executeBlocking(() -> {
                        Files.writeString(file, "{\"numShards\": 5}");
                        return null;
                    });
                })
                .compose(v -> watcher.reload())
                .onComplete(testContext.succeeding(change -> testContext.verify(() -> {
                    assertNotNull(change);
                    assertTrue(change.touches("numShards"));
                    assertEquals(2, change.previous().numShards());
                    assertEquals(5, watcher.get().numShards());
                    assertEquals(1, changes.size());
                    watcher.stop();
                    testContext.completeNow();
                })));
    }

    @Test
    void invalidEditKeepsPreviousSettings(Vertx vertx, VertxTestContext testContext) throws Exception {
        Path file = tempDir.resolve("fleet.json");
        Files.writeString(file, "{\"numShards\": 3}");
        FleetSettingsWatcher watcher = watcher(vertx, file);

        watcher.start()
                .compose(initial -> vertx.executeBlocking(() -> {
                    Files.writeString(file, "{\"numShards\": ");
                    return null;
                }))
                .compose(v -> watcher.reload())
                .onComplete(testContext.succeeding(change -> testContext.verify(() -> {
                    assertNull(change);
                    assertEquals(3, watcher.get().numShards());
                    watcher.stop();
                    testContext.completeNow();
                })));
    }

    @Test
    void unchangedContentPublishesNothing(Vertx vertx, VertxTestContext testContext) throws Exception {
        Path file = tempDir.resolve("fleet.json");
        Files.writeString(file, "{\"numShards\": 3}");
        FleetSettingsWatcher watcher = watcher(vertx, file);

        watcher.start()
                .compose(initial -> watcher.reload())
                .onComplete(testContext.succeeding(change -> testContext.verify(() -> {
                    assertNull(change);
                    watcher.stop();
                    testContext.completeNow();
                })));
    }

    @Test
    void invalidInitialFileFailsStart(Vertx vertx, VertxTestContext testContext) throws Exception {
        Path file = tempDir.resolve("fleet.json");
        Files.writeString(file, "{\"keySize\": 16}");

        watcher(vertx, file).start().onComplete(testContext.failingThenComplete());
    }
}
