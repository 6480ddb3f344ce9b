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

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.shardwarden.agent.observability.AgentMetrics;
import dev.mars.shardwarden.child.ChildCodec;
import dev.mars.shardwarden.child.ChildEnvironment;
import dev.mars.shardwarden.child.ChildMessage;
import dev.mars.shardwarden.core.HealthSnapshot;
import dev.mars.shardwarden.core.RegistryEntry;
import dev.mars.shardwarden.core.ShardSettings;
import dev.mars.shardwarden.core.exceptions.ChildProcessException;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the one child process of an agent.
 *
 * <p>The child is started from the launch settings of the latest assignment,
 * in the project root, with the role and partition in its environment. It is
 * restarted whenever it exits while the goal partition id is non-negative.
 * Stopping sends a soft terminate and, if the child is still alive after the
 * grace period, kills it.</p>
 *
 * <p>Messages from the child arrive on a reader thread and are handed to the
 * listener on the agent's context. All other methods must be called on that
 * context.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-12
 * @version 1.0
 */
public class ChildSupervisor implements ChildChannel {

    private static final Logger logger = LoggerFactory.getLogger(ChildSupervisor.class);

    public static final String NOT_RUNNING = "Not Running";

    /**
     * Child lifecycle callbacks, invoked on the agent's context.
     */
    public interface Listener {

        void onChildStarted();

        void onChildMessage(ChildMessage message);

        void onChildExit(int exitCode);
    }

    private final Vertx vertx;
    private final Context context;
    private final String shardId;
    private final Path workingDir;
    private final long graceMs;
    private final HealthSnapshot status;
    private final Listener listener;
    private final AgentMetrics metrics;
    private final List<Promise<Void>> exitWaiters = new ArrayList<>();

    private ShardSettings settings;
    private Process child;
    private long respawnTimerId = -1;
    private long killTimerId = -1;

    public ChildSupervisor(Vertx vertx, Context context, String shardId, Path workingDir, long graceMs,
                           HealthSnapshot status, Listener listener, AgentMetrics metrics) {
        this.vertx = vertx;
        this.context = context;
        this.shardId = shardId;
        this.workingDir = workingDir;
        this.graceMs = graceMs;
        this.status = status;
        this.listener = listener;
        this.metrics = metrics;
    }

    /**
     * Stores the settings the next spawn uses. A running child keeps the
     * settings it was started with.
     */
    public void apply(ShardSettings settings) {
        this.settings = settings;
    }

    @Override
    public boolean isRunning() {
        return child != null;
    }

    public long pid() {
        return child != null ? child.pid() : -1;
    }

    /**
     * Starts the child for the current goal. Does nothing when a child is
     * running or the goal is negative. A failed start clears the goal.
     *
     * @return whether a child was started
     */
    public boolean spawn() {
        int goalId = status.getGoalShardId();
        int goalCount = status.getGoalShardCount();
        if (goalId < 0 || child != null) {
            return false;
        }
        if (settings == null) {
            logger.warn("Cannot spawn child shard #{} before receiving settings", goalId);
            return false;
        }

        List<String> command = settings.launch().commandLine(settings.master());
        if (command.isEmpty()) {
            spawnFailed(new ChildProcessException("No launch command configured"));
            return false;
        }

        logger.info("Spawning child shard #{} of {} for {}: {}", goalId, goalCount, shardId, command);
        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(workingDir.toFile())
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        ChildEnvironment environment = new ChildEnvironment(
                true, settings.master(), shardId, goalId, goalCount, settings.applicationName());
        builder.environment().putAll(environment.toEnvironment());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            spawnFailed(new ChildProcessException("Failed to start child process " + command.get(0), e));
            return false;
        }

        child = process;
        status.setCurrentShardId(goalId);
        status.setCurrentShardCount(goalCount);
        status.setStartTime(System.currentTimeMillis());
        metrics.recordSpawn();

        Thread reader = new Thread(() -> pump(process), "shardwarden-child-" + process.pid());
        reader.setDaemon(true);
        reader.start();
        process.onExit().thenAccept(p -> context.runOnContext(v -> handleExit(p)));

        listener.onChildStarted();
        return true;
    }

    /**
     * Restarts the child. With a positive delay the restart is scheduled, and
     * further delayed requests are folded into the pending one until it fires.
     * A running child is stopped and started again by the exit handler; with
     * no child one is started if the goal allows it.
     */
    public void respawn(long delayMs) {
        if (delayMs > 0) {
            if (respawnTimerId >= 0) {
                logger.debug("Respawn already scheduled, ignoring delay {}ms", delayMs);
                return;
            }
            logger.info("Respawning child in {}ms", delayMs);
            respawnTimerId = vertx.setTimer(delayMs, id -> {
                respawnTimerId = -1;
                respawn(0);
            });
            return;
        }
        cancelRespawn();
        if (child != null) {
            stopChild();
        } else if (status.getGoalShardId() >= 0) {
            spawn();
        }
    }

    /**
     * Stops the child without restarting it, provided the goal has been set
     * negative beforehand.
     *
     * @return completes once no child is running
     */
    public Future<Void> terminate() {
        cancelRespawn();
        if (child == null) {
            return Future.succeededFuture();
        }
        Promise<Void> exited = Promise.promise();
        exitWaiters.add(exited);
        stopChild();
        return exited.future();
    }

    @Override
    public Future<Void> send(ChildMessage message) {
        Process target = child;
        if (target == null) {
            return Future.failedFuture(NOT_RUNNING);
        }
        byte[] line = (ChildCodec.encode(message) + "\n").getBytes(StandardCharsets.UTF_8);
        return context.executeBlocking(() -> {
            OutputStream out = target.getOutputStream();
            out.write(line);
            out.flush();
            return null;
        });
    }

    private void stopChild() {
        Process target = child;
        if (killTimerId >= 0) {
            logger.debug("Child {} is already stopping", target.pid());
            return;
        }
        logger.info("Stopping child (pid {})", target.pid());
        status.setStopTime(System.currentTimeMillis());
        target.destroy();
        killTimerId = vertx.setTimer(graceMs, id -> {
            killTimerId = -1;
            if (target.isAlive()) {
                logger.warn("Child failed to shut down within {}ms! Forcefully killing...", graceMs);
                target.destroyForcibly();
            }
        });
    }

    private void spawnFailed(ChildProcessException e) {
        logger.error("Failed to spawn child process for {}, clearing goal", shardId, e);
        status.setGoalShardId(RegistryEntry.RETIRED);
        status.setGoalShardCount(RegistryEntry.RETIRED);
        status.setCurrentShardId(RegistryEntry.RETIRED);
        status.setCurrentShardCount(RegistryEntry.RETIRED);
    }

    private void handleExit(Process process) {
        if (process != child) {
            return;
        }
        int exitCode = process.exitValue();
        child = null;
        if (killTimerId >= 0) {
            vertx.cancelTimer(killTimerId);
            killTimerId = -1;
        }
        long now = System.currentTimeMillis();
        if (status.getStopTime() < status.getStartTime()) {
            status.setStopTime(now);
        }
        status.setCurrentShardId(RegistryEntry.RETIRED);
        status.setCurrentShardCount(RegistryEntry.RETIRED);
        metrics.recordExit(exitCode);
        logger.info("Child exited with code {}", exitCode);

        listener.onChildExit(exitCode);
        List<Promise<Void>> waiters = new ArrayList<>(exitWaiters);
        exitWaiters.clear();
        waiters.forEach(Promise::tryComplete);

        if (status.getGoalShardId() >= 0) {
            spawn();
        }
    }

    private void pump(Process process) {
        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                String text = line;
                context.runOnContext(v -> deliver(process, text));
            }
        } catch (IOException e) {
            logger.debug("Child output closed: {}", e.getMessage());
        }
    }

    private void deliver(Process process, String line) {
        if (line.isBlank()) {
            return;
        }
        if (!line.startsWith("{")) {
            logger.info("[child] {}", line);
            return;
        }
        ChildMessage message;
        try {
            message = ChildCodec.decode(line);
        } catch (JsonProcessingException e) {
            logger.info("[child] {}", line);
            return;
        }
        if (process != child) {
            logger.debug("Dropping {} from a child that already exited", message.getClass().getSimpleName());
            return;
        }
        listener.onChildMessage(message);
    }

    private void cancelRespawn() {
        if (respawnTimerId >= 0) {
            vertx.cancelTimer(respawnTimerId);
            respawnTimerId = -1;
        }
    }
}
