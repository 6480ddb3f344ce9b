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

package dev.mars.shardwarden.master;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.shardwarden.core.HealthSnapshot;
import dev.mars.shardwarden.master.command.FleetCommandService;
import dev.mars.shardwarden.master.reconcile.FleetReconciler;
import dev.mars.shardwarden.master.server.SessionListener;
import dev.mars.shardwarden.master.server.ShardSession;
import dev.mars.shardwarden.protocol.WireMessage;
import io.vertx.core.Future;

/**
 * Routes session events: liveness and membership go to the reconciler,
 * shard-initiated requests to the command service.
 */
class FleetSessionListener implements SessionListener {

    private final FleetReconciler reconciler;
    private final FleetCommandService commands;

    FleetSessionListener(FleetReconciler reconciler, FleetCommandService commands) {
        this.reconciler = reconciler;
        this.commands = commands;
    }

    @Override
    public void onVerified(ShardSession session) {
        reconciler.onVerified(session);
    }

    @Override
    public void onStatus(ShardSession session, HealthSnapshot snapshot) {
        reconciler.onStatus(session, snapshot);
    }

    @Override
    public Future<JsonNode> onRequest(ShardSession session, WireMessage.Request request) {
        return commands.handleRequest(session, request);
    }

    @Override
    public void onClosed(ShardSession session) {
        reconciler.onClosed(session);
    }
}
