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

package dev.mars.shardwarden.master.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.mars.shardwarden.core.RegistryEntry;
import dev.mars.shardwarden.core.ShardState;
import dev.mars.shardwarden.core.exceptions.FileRelayException;
import dev.mars.shardwarden.core.exceptions.InvalidTransitionException;
import dev.mars.shardwarden.master.config.FleetSettings;
import dev.mars.shardwarden.master.observability.FleetMetrics;
import dev.mars.shardwarden.master.registry.ShardRegistry;
import dev.mars.shardwarden.master.server.SessionRegistry;
import dev.mars.shardwarden.master.server.ShardSession;
import dev.mars.shardwarden.protocol.WireMessage;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Operator and shard-initiated commands that fan out over the fleet.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class FleetCommandService {

    private static final Logger logger = LoggerFactory.getLogger(FleetCommandService.class);

    private final ShardRegistry registry;
    private final SessionRegistry sessions;
    private final Supplier<FleetSettings> settings;
    private final SqlProxyService sql;
    private final FleetMetrics metrics;

    public FleetCommandService(ShardRegistry registry, SessionRegistry sessions, Supplier<FleetSettings> settings,
                               SqlProxyService sql, FleetMetrics metrics) {
        this.registry = registry;
        this.sessions = sessions;
        this.settings = settings;
        this.sql = sql;
        this.metrics = metrics;
    }

    /**
     * Evaluates a script on every connected shard that runs a partition.
     *
     * <p>The result array is indexed by the shard's current partition id.
     * Shards not running a partition of the current layout are skipped. The
     * first failure fails the whole call.</p>
     */
    public Future<ArrayNode> broadcastEval(String script) {
        Promise<ArrayNode> promise = Promise.promise();
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        List<Future<JsonNode>> replies = new ArrayList<>();

        for (ShardSession session : sessions.all()) {
            RegistryEntry entry = registry.get(session.getShardId());
            if (entry == null || entry.getCurrentShardId() < 0
                    || entry.getCurrentShardId() >= entry.getCurrentShardCount()) {
                continue;
            }
            int index = entry.getCurrentShardId();
            metrics.recordDirective("evalRequest");
            Future<JsonNode> reply = session.request(requestId -> new WireMessage.EvalRequest(requestId, script))
                    .onSuccess(result -> {
                        while (out.size() <= index) {
                            out.addNull();
                        }
                        out.set(index, result == null ? NullNode.getInstance() : result);
                    })
                    .onFailure(promise::tryFail);
            replies.add(reply);
        }

        Future.all(replies).onSuccess(v -> promise.tryComplete(out));
        return promise.future();
    }

    /**
     * Restarts the child of every shard that runs its goal, staggered by
     * {@code respawnDelayMs}.
     *
     * @return the number of shards that were asked to respawn or skipped for
     *         being disconnected
     */
    public int respawnAll() {
        long delay = settings.get().respawnDelayMs();
        List<RegistryEntry> running = new ArrayList<>();
        for (RegistryEntry entry : registry.entries()) {
            if (entry.getGoalShardId() >= 0 && entry.getGoalShardId() == entry.getCurrentShardId()) {
                running.add(entry);
            }
        }
        running.sort(Comparator.comparingInt(RegistryEntry::getGoalShardId));

        int i = 0;
        for (RegistryEntry entry : running) {
            ShardSession session = sessions.get(entry.getId());
            if (session != null) {
                session.send(new WireMessage.Respawn(i * delay));
                metrics.recordDirective("respawn");
            } else {
                logger.warn("Unable to respawn shard #{} {}: not connected", entry.getGoalShardId(), entry.getId());
            }
            i++;
        }
        logger.info("Requested respawn of {} shards", i);
        return i;
    }

    public Future<JsonNode> sendSql(String query) {
        return sql.query(query);
    }

    public Future<JsonNode> evalOn(String shardId, String script) {
        ShardSession session = sessions.get(shardId);
        if (session == null) {
            return Future.failedFuture("Shard " + shardId + " is not connected");
        }
        metrics.recordDirective("evalRequest");
        return session.request(requestId -> new WireMessage.EvalRequest(requestId, script));
    }

    /**
     * Sends a file to a shard. Delivery is fire-and-forget.
     */
    public Future<Void> pushFile(String shardId, String path, byte[] data) {
        ShardSession session = sessions.get(shardId);
        if (session == null) {
            return Future.failedFuture(new FileRelayException(path, "shard " + shardId + " is not connected"));
        }
        metrics.recordDirective("writeFile");
        return session.send(new WireMessage.WriteFile(path, Base64.getEncoder().encodeToString(data)));
    }

    /**
     * Fetches a file from a shard's project directory.
     */
    public Future<byte[]> pullFile(String shardId, String path) {
        ShardSession session = sessions.get(shardId);
        if (session == null) {
            return Future.failedFuture(new FileRelayException(path, "shard " + shardId + " is not connected"));
        }
        metrics.recordDirective("getFile");
        return session.request(requestId -> new WireMessage.GetFile(requestId, path))
                .compose(result -> {
                    if (result == null || !result.isTextual()) {
                        return Future.failedFuture(new FileRelayException(path, "not readable on shard " + shardId));
                    }
                    return Future.succeededFuture(Base64.getDecoder().decode(result.asText()));
                });
    }

    /**
     * Takes an identity out of service for good: its goal becomes
     * {@link RegistryEntry#TERMINATED}, the shard exits and the id is never
     * reassigned.
     */
    public Future<Void> terminate(String shardId) {
        RegistryEntry entry = registry.get(shardId);
        if (entry == null) {
            return Future.failedFuture(new IllegalArgumentException("Unknown shard " + shardId));
        }
        long now = System.currentTimeMillis();
        FleetSettings current = settings.get();
        try {
            entry.state(now, current.heartbeat()).checkTransition(shardId, ShardState.TERMINATED);
        } catch (InvalidTransitionException e) {
            return Future.failedFuture(e);
        }
        entry.terminate(now);
        registry.markDirty();
        logger.info("Terminating shard {}", shardId);

        ShardSession session = sessions.get(shardId);
        if (session != null) {
            session.send(new WireMessage.Update(current.settingsFor(entry)));
            metrics.recordDirective("update");
        }
        return registry.save();
    }

    /**
     * Serves a request a shard relayed from its child.
     */
    public Future<JsonNode> handleRequest(ShardSession session, WireMessage.Request request) {
        logger.debug("Shard {} requested {}", session.getShardId(), request.getClass().getSimpleName());
        if (request instanceof WireMessage.BroadcastEval eval) {
            return broadcastEval(eval.script()).map(array -> (JsonNode) array);
        }
        if (request instanceof WireMessage.RespawnAll) {
            return Future.succeededFuture(IntNode.valueOf(respawnAll()));
        }
        if (request instanceof WireMessage.SendSql query) {
            return sendSql(query.query());
        }
        return Future.failedFuture("Unsupported request " + request.getClass().getSimpleName());
    }
}
