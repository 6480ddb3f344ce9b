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

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Partition count fetched from an HTTP endpoint answering {@code {"shards": n}}.
 *
 * <p>The value is {@code -1} until the first successful fetch. Failed fetches
 * are logged and the cached value is kept. Fetches are throttled to one per
 * {@code intervalMs}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public class RecommendedPartitionCount implements PartitionCountSource {

    private static final Logger logger = LoggerFactory.getLogger(RecommendedPartitionCount.class);

    private final WebClient client;
    private final String url;
    private final String token;
    private final long intervalMs;
    private final List<Handler<Integer>> listeners = new ArrayList<>();

    private int value = -1;
    private long lastFetch;
    private boolean fetching;

    public RecommendedPartitionCount(Vertx vertx, String url, String token, long intervalMs) {
        this.client = WebClient.create(vertx, new WebClientOptions().setConnectTimeout(10_000));
        this.url = Objects.requireNonNull(url, "url");
        this.token = token;
        this.intervalMs = intervalMs;
    }

    @Override
    public int current() {
        return value;
    }

    @Override
    public void poll(long now) {
        if (fetching || (lastFetch > 0 && now - lastFetch < intervalMs)) {
            return;
        }
        lastFetch = now;
        fetch();
    }

    @Override
    public void onChange(Handler<Integer> handler) {
        listeners.add(handler);
    }

    /**
     * Fetches the recommendation now, regardless of throttling.
     */
    public Future<Integer> fetch() {
        fetching = true;
        HttpRequest<Buffer> request = client.getAbs(url);
        if (token != null && !token.isBlank()) {
            request.putHeader("Authorization", token);
        }
        return request.send()
                .map(this::parse)
                .onComplete(ar -> fetching = false)
                .onSuccess(this::apply)
                .onFailure(err -> logger.error("Failed to fetch recommended shard count from {}: {}",
                        url, err.getMessage()));
    }

    private int parse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            throw new IllegalStateException("HTTP " + response.statusCode());
        }
        JsonObject body = response.bodyAsJsonObject();
        Integer shards = body == null ? null : body.getInteger("shards");
        if (shards == null || shards < 0) {
            throw new IllegalStateException("Response carries no usable 'shards' value");
        }
        return shards;
    }

    private void apply(int shards) {
        if (shards == value) {
            return;
        }
        logger.info("Recommended shard count changed from {} to {}", value, shards);
        value = shards;
        for (Handler<Integer> listener : listeners) {
            listener.handle(shards);
        }
    }

    public void close() {
        client.close();
    }
}
