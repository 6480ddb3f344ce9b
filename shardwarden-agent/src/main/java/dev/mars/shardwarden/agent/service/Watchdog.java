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

import dev.mars.shardwarden.core.HeartbeatSettings;
import io.vertx.core.Vertx;

import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;

/**
 * Local timer that keeps an agent honest when the master goes quiet.
 *
 * <p>With {@code push} heartbeats it fires every interval and asks for a
 * heartbeat. With {@code pull} heartbeats it checks every 1.5 intervals how
 * long ago the master was last heard from: past {@code requestRebootAfter} a
 * verified agent with a goal reconnects, past {@code assumeDeadAfter} an agent
 * with a goal exits and leaves the restart to its process supervisor.</p>
 *
 * <p>Every assignment restarts the timer.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-12
 * @version 1.0
 */
public class Watchdog {

    public enum Action {
        NONE,
        HEARTBEAT,
        RECONNECT,
        EXIT
    }

    private final Vertx vertx;
    private final LongSupplier lastSeen;
    private final IntSupplier goalShardId;
    private final BooleanSupplier verified;
    private final Consumer<Action> handler;

    private HeartbeatSettings settings;
    private long timerId = -1;

    public Watchdog(Vertx vertx, LongSupplier lastSeen, IntSupplier goalShardId, BooleanSupplier verified,
                    Consumer<Action> handler) {
        this.vertx = vertx;
        this.lastSeen = lastSeen;
        this.goalShardId = goalShardId;
        this.verified = verified;
        this.handler = handler;
    }

    public void reset(HeartbeatSettings settings) {
        this.settings = settings;
        stop();
        schedule();
    }

    public void stop() {
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
            timerId = -1;
        }
    }

    public boolean isRunning() {
        return timerId >= 0;
    }

    static long period(HeartbeatSettings settings) {
        return settings.isPull() ? settings.intervalMs() * 3 / 2 : settings.intervalMs();
    }

    static Action decide(HeartbeatSettings settings, long now, long lastSeen, int goalShardId, boolean verified) {
        if (!settings.isPull()) {
            return Action.HEARTBEAT;
        }
        long silence = now - lastSeen;
        if (silence > settings.requestRebootAfterMs() && goalShardId >= 0 && verified) {
            return Action.RECONNECT;
        }
        if (silence > settings.assumeDeadAfterMs() && goalShardId >= 0) {
            return Action.EXIT;
        }
        return Action.NONE;
    }

    private void schedule() {
        timerId = vertx.setTimer(Math.max(1, period(settings)), id -> {
            timerId = -1;
            schedule();
            Action action = decide(settings, System.currentTimeMillis(),
                    lastSeen.getAsLong(), goalShardId.getAsInt(), verified.getAsBoolean());
            if (action != Action.NONE) {
                handler.accept(action);
            }
        });
    }
}
