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

package dev.mars.shardwarden.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.shardwarden.core.HealthSnapshot;
import dev.mars.shardwarden.core.ShardSettings;

/**
 * Frames exchanged between master and agent over the WebSocket. Each frame is a
 * JSON object whose {@code type} property selects the record.
 *
 * <p>Frames that expect an answer implement {@link Request} and carry a
 * request id; the answer is a {@link Reply} with the same id.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WireMessage.MasterVerification.class, name = "masterVerification"),
        @JsonSubTypes.Type(value = WireMessage.EvalRequest.class, name = "evalRequest"),
        @JsonSubTypes.Type(value = WireMessage.Update.class, name = "update"),
        @JsonSubTypes.Type(value = WireMessage.Respawn.class, name = "respawn"),
        @JsonSubTypes.Type(value = WireMessage.WriteFile.class, name = "writeFile"),
        @JsonSubTypes.Type(value = WireMessage.GetFile.class, name = "getFile"),
        @JsonSubTypes.Type(value = WireMessage.Status.class, name = "status"),
        @JsonSubTypes.Type(value = WireMessage.BroadcastEval.class, name = "broadcastEval"),
        @JsonSubTypes.Type(value = WireMessage.RespawnAll.class, name = "respawnAll"),
        @JsonSubTypes.Type(value = WireMessage.SendSql.class, name = "sendSql"),
        @JsonSubTypes.Type(value = WireMessage.Reply.class, name = "reply")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface WireMessage {

    /**
     * A frame the receiver must answer with a {@link Reply}.
     */
    sealed interface Request extends WireMessage {
        String requestId();
    }

    // ── master → agent ─────────────────────────────────────────────────

    /** Sent once after the handshake so the agent can authenticate the master. */
    record MasterVerification(String challenge, String signature) implements WireMessage {
    }

    record EvalRequest(String requestId, String script) implements Request {
    }

    /** Assignment plus heartbeat and launch settings. */
    record Update(ShardSettings settings) implements WireMessage {
    }

    record Respawn(long delayMs) implements WireMessage {
    }

    /** File push; {@code data} is base64. */
    record WriteFile(String path, String data) implements WireMessage {
    }

    record GetFile(String requestId, String path) implements Request {
    }

    // ── agent → master ─────────────────────────────────────────────────

    record Status(HealthSnapshot snapshot) implements WireMessage {
    }

    record BroadcastEval(String requestId, String script) implements Request {
    }

    record RespawnAll(String requestId) implements Request {
    }

    record SendSql(String requestId, String query) implements Request {
    }

    // ── both directions ────────────────────────────────────────────────

    record Reply(String requestId, String error, JsonNode result) implements WireMessage {

        public static Reply success(String requestId, JsonNode result) {
            return new Reply(requestId, null, result);
        }

        public static Reply failure(String requestId, String error) {
            return new Reply(requestId, error == null ? "Unknown error" : error, null);
        }

        public boolean failed() {
            return error != null;
        }
    }
}
