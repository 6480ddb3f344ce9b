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

package dev.mars.shardwarden.master.lifecycle;

import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs the master's shutdown hooks phase by phase.
 *
 * <p>Phases run in declaration order of {@link Phase}; hooks within a phase run
 * one after another in registration order. A hook that fails or exceeds its
 * timeout is logged and skipped, the sequence carries on.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class ShutdownCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

    public enum Phase {
        /** Refuse new shard connections. */
        DRAIN,
        /** Stop timers, watchers and live sessions. */
        STOP_SERVICES,
        /** Flush the registry and release external resources. */
        CLOSE_RESOURCES
    }

    public enum State {
        RUNNING,
        DRAINING,
        SHUTTING_DOWN,
        STOPPED
    }

    private final long drainTimeoutMs;
    private final long shutdownTimeoutMs;
    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final Map<Phase, List<Hook>> hooks = new EnumMap<>(Phase.class);
    private Future<Void> completion;

    public ShutdownCoordinator(long drainTimeoutMs, long shutdownTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        for (Phase phase : Phase.values()) {
            hooks.put(phase, new ArrayList<>());
        }
    }

    public State getState() {
        return state.get();
    }

    public boolean isAcceptingWork() {
        return state.get() == State.RUNNING;
    }

    public ShutdownCoordinator on(Phase phase, String name, Supplier<Future<Void>> hook) {
        hooks.get(phase).add(new Hook(name, hook));
        return this;
    }

    /**
     * Starts the shutdown sequence, or returns the one already under way.
     */
    public synchronized Future<Void> shutdown() {
        if (completion != null) {
            return completion;
        }
        logger.info("Initiating graceful shutdown (drain={}ms, timeout={}ms)", drainTimeoutMs, shutdownTimeoutMs);
        state.set(State.DRAINING);
        completion = runPhase(Phase.DRAIN, drainTimeoutMs)
                .compose(v -> {
                    state.set(State.SHUTTING_DOWN);
                    return runPhase(Phase.STOP_SERVICES, shutdownTimeoutMs);
                })
                .compose(v -> runPhase(Phase.CLOSE_RESOURCES, shutdownTimeoutMs))
                .onComplete(ar -> {
                    state.set(State.STOPPED);
                    logger.info("Shutdown completed");
                });
        return completion;
    }

    private Future<Void> runPhase(Phase phase, long timeoutMs) {
        List<Hook> phaseHooks = hooks.get(phase);
        logger.info("Shutdown phase {} ({} hooks)", phase, phaseHooks.size());
        Future<Void> chain = Future.succeededFuture();
        for (Hook hook : phaseHooks) {
            chain = chain.compose(v -> runHook(hook, timeoutMs));
        }
        return chain;
    }

    private Future<Void> runHook(Hook hook, long timeoutMs) {
        logger.debug("Running shutdown hook {}", hook.name());
        Future<Void> result;
        try {
            result = hook.action().get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result
                .timeout(timeoutMs, TimeUnit.MILLISECONDS)
                .recover(err -> {
                    logger.warn("Shutdown hook {} failed: {}", hook.name(), err.getMessage());
                    return Future.succeededFuture();
                });
    }

    private record Hook(String name, Supplier<Future<Void>> action) {
    }
}
