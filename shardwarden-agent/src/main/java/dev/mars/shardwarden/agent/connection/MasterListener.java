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


package dev.mars.shardwarden.agent.connection;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.shardwarden.protocol.WireMessage;
import io.vertx.core.Future;

/**
 * Callbacks of a {@link MasterConnection}. Invoked on the connection's event
 * loop; directives and requests are only delivered once the master proved its
 * identity.
 */
public interface MasterListener {

    void onVerified();

    /**
     * An {@code update}, {@code respawn} or {@code writeFile} frame.
     */
    void onDirective(WireMessage directive);

    /**
     * An {@code evalRequest} or {@code getFile} frame. The outcome is sent back
     * as a reply.
     */
    Future<JsonNode> onRequest(WireMessage.Request request);

    void onDisconnected(boolean wasVerified);
}
