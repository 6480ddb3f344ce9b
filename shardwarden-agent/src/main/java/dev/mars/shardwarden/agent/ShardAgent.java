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


package dev.mars.shardwarden.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.shardwarden.agent.config.AgentConfig;
import dev.mars.shardwarden.agent.connection.MasterConnection;
import dev.mars.shardwarden.agent.connection.MasterListener;
import dev.mars.shardwarden.agent.observability.AgentMetrics;
import dev.mars.shardwarden.agent.service.ChildSupervisor;
import dev.mars.shardwarden.agent.service.DiskUsageProbe;
import dev.mars.shardwarden.agent.service.EvalDispatcher;
import dev.mars.shardwarden.agent.service.HeartbeatService;
import dev.mars.shardwarden.agent.service.ProjectFiles;
import dev.mars.shardwarden.agent.service.Watchdog;
import dev.mars.shardwarden.child.ChildMessage;
import dev.mars.shardwarden.core.HealthSnapshot;
import dev.mars.shardwarden.core.RegistryEntry;
import dev.mars.shardwarden.core.ShardSettings;
import dev.mars.shardwarden.protocol.WireMessage;
import dev.mars.shardwarden.security.ShardIdentity;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Objects;

/**
 * The worker agent. Authenticates to the master, runs the child process the
 * master assigns, proxies evaluations and files, and reports health.
 *
 * <p>All agent state lives on this verticle's event loop. Stopping the
 * verticle closes the connection and terminates the child; {@link #exit()}
 * does the same and then runs the exit handler, by default ending the JVM
 * so an external supervisor can start a fresh agent.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-12
 * @version 1.0
 */
public class ShardAgent extends AbstractVerticle implements MasterListener, ChildSupervisor.Listener {

    private static final Logger logger = LoggerFactory.getLogger(ShardAgent.class);

    private final AgentConfig config;
    private final ShardIdentity identity;
    private final Runnable exitHandler;
    private final HealthSnapshot status;

    private AgentMetrics metrics;
    private MasterConnection connection;
    private ChildSupervisor supervisor;
    private EvalDispatcher evals;
    private HeartbeatService heartbeat;
    private ProjectFiles files;
    private Watchdog watchdog;
    private ShardSettings settings;
    private Future<Void> shutdown;

    public ShardAgent(AgentConfig config, ShardIdentity identity) {
        this(config, identity, ShardAgent::exitProcess);
    }

    /**
     * @param exitHandler runs after {@link #exit()} has stopped the child
     */
    public ShardAgent(AgentConfig config, ShardIdentity identity, Runnable exitHandler) {
        this.config = Objects.requireNonNull(config, "AgentConfig cannot be null");
        this.identity = Objects.requireNonNull(identity, "ShardIdentity cannot be null");
        this.exitHandler = Objects.requireNonNull(exitHandler, "exitHandler");
        this.status = new HealthSnapshot(identity.id());
    }

    @Override
    public void start(Promise<Void> startPromise) {
        logger.info("Shard {} booting up...", identity.id());
        metrics = new AgentMetrics(identity.id(), System.currentTimeMillis());
        files = new ProjectFiles(vertx, config.getProjectRoot());
        supervisor = new ChildSupervisor(vertx, context, identity.id(), files.getRoot(),
                config.getChildGraceMs(), status, this, metrics);
        evals = new EvalDispatcher(supervisor);
        heartbeat = new HeartbeatService(vertx, status, supervisor, new DiskUsageProbe(files.getRoot()),
                config.getStatsTimeoutMs());

        MasterConnection.Settings connectionSettings = new MasterConnection.Settings(
                config.getReconnectDelayMs(),
                config.getConnectBackoffInitialMs(),
                config.getConnectBackoffMaxMs(),
                config.getConnectTimeoutMs(),
                config.getReplyTimeoutMs(),
                config.isTrustAll());
        try {
            connection = new MasterConnection(vertx, identity, connectionSettings, this, metrics);
        } catch (GeneralSecurityException e) {
            startPromise.fail(new IllegalStateException("Unable to read the keys of shard " + identity.id(), e));
            return;
        }
        watchdog = new Watchdog(vertx, connection::getLastSeen, status::getGoalShardId,
                connection::isVerified, this::onWatchdog);

        // connect failures are retried by the connection itself
        connection.connect();
        startPromise.complete();
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        shutdown().onComplete(ar -> stopPromise.complete());
    }

    /**
     * Stops the agent and then runs the exit handler.
     */
    public void exit() {
        shutdown().onComplete(ar -> exitHandler.run());
    }

    /**
     * Closes the master connection, marks a running goal as terminated and
     * stops the child. Idempotent.
     */
    Future<Void> shutdown() {
        if (shutdown != null) {
            return shutdown;
        }
        logger.info("Shutting down shard {}", identity.id());
        if (watchdog != null) {
            watchdog.stop();
        }
        Future<Void> closed = connection != null ? connection.close() : Future.succeededFuture();
        if (status.getGoalShardId() >= 0) {
            status.setGoalShardId(RegistryEntry.TERMINATED);
            status.setGoalShardCount(RegistryEntry.TERMINATED);
        }
        Future<Void> stopped = supervisor != null ? supervisor.terminate() : Future.succeededFuture();
        if (evals != null) {
            evals.failAll("Agent shutting down");
        }
        shutdown = Future.join(closed, stopped).transform(ar -> {
            logger.info("Shard {} stopped", identity.id());
            return Future.succeededFuture();
        });
        return shutdown;
    }

    // ==================== Master Connection ====================

    @Override
    public void onVerified() {
        logger.info("Shard {} authenticated with master", identity.id());
    }

    @Override
    public void onDirective(WireMessage directive) {
        if (directive instanceof WireMessage.Update update) {
            applyUpdate(update.settings());
        } else if (directive instanceof WireMessage.Respawn respawn) {
            logger.info("Master requested respawn (delay {}ms)", respawn.delayMs());
            supervisor.respawn(respawn.delayMs());
        } else if (directive instanceof WireMessage.WriteFile write) {
            files.write(write.path(), write.data())
                    .onSuccess(v -> logger.debug("Wrote file from master to disk: {}", write.path()))
                    .onFailure(err -> logger.error("Failed to write file from master to disk: {}",
                            err.getMessage()));
        } else {
            logger.warn("Unexpected {} from master", directive.getClass().getSimpleName());
        }
    }

    @Override
    public Future<JsonNode> onRequest(WireMessage.Request request) {
        if (request instanceof WireMessage.EvalRequest eval) {
            return evals.eval(eval.script())
                    .onComplete(ar -> metrics.recordEval(ar.succeeded()));
        }
        if (request instanceof WireMessage.GetFile get) {
            return files.read(get.path())
                    .map(data -> (JsonNode) TextNode.valueOf(Base64.getEncoder().encodeToString(data)))
                    .otherwise(err -> {
                        logger.error("Failed to read file that master requested: {}", err.getMessage());
                        return NullNode.getInstance();
                    });
        }
        return Future.failedFuture("Unsupported request " + request.getClass().getSimpleName());
    }

    @Override
    public void onDisconnected(boolean wasVerified) {
        logger.debug("Shard {} disconnected (verified: {})", identity.id(), wasVerified);
    }

    // ==================== Child Process ====================

    @Override
    public void onChildStarted() {
        heartbeat.onChildStarted();
    }

    @Override
    public void onChildExit(int exitCode) {
        evals.failAll("Child process exited with code " + exitCode);
        heartbeat.onChildExit();
    }

    @Override
    public void onChildMessage(ChildMessage message) {
        if (message instanceof ChildMessage.EvalResult result) {
            if (!evals.onResult(result)) {
                logger.debug("Evaluation result for a script nobody waits for");
            }
        } else if (message instanceof ChildMessage.Stats stats) {
            heartbeat.onStats(stats.stats());
        } else if (message instanceof ChildMessage.Lifecycle lifecycle) {
            logger.info("Child reported {}", lifecycle.state());
        } else if (message instanceof ChildMessage.Reboot reboot) {
            logger.info("Reboot requested by child: {}", reboot.reason());
            supervisor.respawn(0);
        } else if (message instanceof ChildMessage.BroadcastEval eval) {
            warnIfDisconnected("eval broadcast");
            connection.request(id -> new WireMessage.BroadcastEval(id, eval.script()))
                    .onComplete(ar -> supervisor.send(new ChildMessage.BroadcastEvalResult(eval.script(),
                            ar.succeeded() ? ar.result() : null,
                            ar.failed() ? ar.cause().getMessage() : null)));
        } else if (message instanceof ChildMessage.RespawnAll) {
            warnIfDisconnected("respawn all");
            connection.request(WireMessage.RespawnAll::new)
                    .onComplete(ar -> supervisor.send(new ChildMessage.RespawnAllResult(
                            ar.failed() ? ar.cause().getMessage() : null)));
        } else if (message instanceof ChildMessage.Sql sql) {
            warnIfDisconnected("SQL query");
            connection.request(id -> new WireMessage.SendSql(id, sql.query()))
                    .onComplete(ar -> supervisor.send(new ChildMessage.SqlResult(sql.query(),
                            ar.succeeded() ? ar.result() : null,
                            ar.failed() ? ar.cause().getMessage() : null)));
        } else {
            logger.debug("Unexpected {} from child", message.getClass().getSimpleName());
        }
    }

    // ==================== Assignment and Heartbeat ====================

    private void applyUpdate(ShardSettings update) {
        logger.debug("New settings received from master: {}", update);
        settings = update;
        supervisor.apply(update);
        status.setGoalShardId(update.shardId());
        status.setGoalShardCount(update.shardCount());
        status.setMaster(update.master());

        if (status.getCurrentShardId() != status.getGoalShardId()
                || status.getCurrentShardCount() != status.getGoalShardCount()) {
            if (status.getGoalShardId() < RegistryEntry.RETIRED) {
                logger.info("Master terminated shard {}, exiting", identity.id());
                exit();
                return;
            } else if (status.getCurrentShardId() >= 0) {
                supervisor.respawn(0);
            } else {
                supervisor.spawn();
            }
        }
        if (update.heartbeat().isPull()) {
            sendHeartbeat();
        }
        watchdog.reset(update.heartbeat());
    }

    void sendHeartbeat() {
        if (!connection.isConnected()) {
            logger.warn("Heartbeat generation requested, but not connected to master");
            return;
        }
        heartbeat.sample()
                .compose(snapshot -> connection.send(new WireMessage.Status(snapshot)))
                .onSuccess(v -> {
                    metrics.recordHeartbeat();
                    if (settings != null && heartbeat.needsRespawn(settings.heartbeat())) {
                        logger.error("No messages received for last two heartbeats, respawning child");
                        supervisor.respawn(0);
                    }
                })
                .onFailure(err -> logger.warn("Failed to send heartbeat: {}", err.getMessage()));
    }

    private void onWatchdog(Watchdog.Action action) {
        switch (action) {
            case HEARTBEAT -> sendHeartbeat();
            case RECONNECT -> {
                logger.warn("No message from master for {}ms, reconnecting",
                        System.currentTimeMillis() - connection.getLastSeen());
                connection.reconnect();
            }
            case EXIT -> {
                logger.warn("No message has been received from master for too long, exiting");
                exit();
            }
            default -> {
            }
        }
    }

    private void warnIfDisconnected(String what) {
        if (!connection.isConnected()) {
            logger.warn("Requested {} while disconnected from master!", what);
        }
    }

    // ==================== Accessors ====================

    public String getShardId() {
        return identity.id();
    }

    /**
     * A copy of the agent's current health snapshot.
     */
    public HealthSnapshot getStatus() {
        return status.copy();
    }

    public MasterConnection.State getConnectionState() {
        return connection != null ? connection.getState() : MasterConnection.State.DISCONNECTED;
    }

    public long getChildPid() {
        return supervisor != null ? supervisor.pid() : -1;
    }

    Context getAgentContext() {
        return context;
    }

    private static void exitProcess() {
        // leave the event loop before the shutdown hooks run
        new Thread(() -> System.exit(0), "shardwarden-exit").start();
    }
}
