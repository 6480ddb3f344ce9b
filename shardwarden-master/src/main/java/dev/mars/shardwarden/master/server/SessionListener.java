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

package dev.mars.shardwarden.master.server;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.shardwarden.core.HealthSnapshot;
import dev.mars.shardwarden.protocol.WireMessage;
import io.vertx.core.Future;

/**
 * Receives the typed events of verified shard sessions. Every callback runs on
 * the master's event loop.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public interface SessionListener {

    /** The session passed the handshake and the master challenge was sent. */
    void onVerified(ShardSession session);

    void onStatus(ShardSession session, HealthSnapshot snapshot);

    /**
     * A shard-initiated request. The returned future's outcome is sent back as
     * a {@code reply} frame.
     */
    Future<JsonNode> onRequest(ShardSession session, WireMessage.Request request);

    void onClosed(ShardSession session);
}
