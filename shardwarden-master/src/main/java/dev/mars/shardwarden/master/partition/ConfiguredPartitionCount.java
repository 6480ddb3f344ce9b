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

import dev.mars.shardwarden.master.config.FleetSettings;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Picks the fixed or the recommended source according to the settings in
 * effect, rebuilding the recommended source when its endpoint changes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public class ConfiguredPartitionCount implements PartitionCountSource {

    private final Vertx vertx;
    private final Supplier<FleetSettings> settings;
    private final FixedPartitionCount fixed;
    private final List<Handler<Integer>> listeners = new ArrayList<>();

    private RecommendedPartitionCount recommended;
    private String recommendedKey;

    public ConfiguredPartitionCount(Vertx vertx, Supplier<FleetSettings> settings) {
        this.vertx = vertx;
        this.settings = settings;
        this.fixed = new FixedPartitionCount(() -> settings.get().numShards());
    }

    @Override
    public int current() {
        return active().current();
    }

    @Override
    public void poll(long now) {
        active().poll(now);
    }

    @Override
    public void onChange(Handler<Integer> handler) {
        listeners.add(handler);
    }

    private PartitionCountSource active() {
        FleetSettings current = settings.get();
        if (!current.autoDetectNumShards()) {
            return fixed;
        }
        String key = current.recommendationUrl() + "|" + current.recommendationToken()
                + "|" + current.autoDetectIntervalMs();
        if (recommended == null || !Objects.equals(key, recommendedKey)) {
            if (recommended != null) {
                recommended.close();
            }
            recommended = new RecommendedPartitionCount(vertx, current.recommendationUrl(),
                    current.recommendationToken(), current.autoDetectIntervalMs());
            recommended.onChange(value -> listeners.forEach(listener -> listener.handle(value)));
            recommendedKey = key;
        }
        return recommended;
    }

    public void close() {
        if (recommended != null) {
            recommended.close();
            recommended = null;
        }
    }
}
