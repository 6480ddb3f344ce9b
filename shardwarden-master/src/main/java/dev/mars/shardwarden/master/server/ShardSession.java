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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.shardwarden.protocol.PendingReplies;
import dev.mars.shardwarden.protocol.WireCodec;
import dev.mars.shardwarden.protocol.WireMessage;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.ServerWebSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * One verified shard connection: the socket, its outstanding requests and the
 * dispatch of incoming frames.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public class ShardSession {

    private static final Logger logger = LoggerFactory.getLogger(ShardSession.class);

    private final String shardId;
    private final ServerWebSocket socket;
    private final PendingReplies pending;
    private final SessionListener listener;
    private final long connectedAt;
    private boolean closed;

    ShardSession(Vertx vertx, String shardId, ServerWebSocket socket, long replyTimeoutMs,
                 SessionListener listener, long connectedAt) {
        this.shardId = shardId;
        this.socket = socket;
        this.pending = new PendingReplies(vertx, replyTimeoutMs);
        this.listener = listener;
        this.connectedAt = connectedAt;
    }

    void attach() {
        socket.textMessageHandler(this::handleText);
        socket.exceptionHandler(err -> logger.warn("Socket error on shard {}: {}", shardId, err.getMessage()));
        socket.closeHandler(v -> {
            closed = true;
            pending.failAll("Disconnected");
            listener.onClosed(this);
        });
    }

    public String getShardId() {
        return shardId;
    }

    public long getConnectedAt() {
        return connectedAt;
    }

    public boolean isClosed() {
        return closed;
    }

    public Future<Void> send(WireMessage message) {
        if (closed) {
            return Future.failedFuture("Disconnected");
        }
        String text = WireCodec.encode(message);
        logger.debug("-> {} {}", shardId, text);
        return socket.writeTextMessage(text)
                .onFailure(err -> logger.warn("Failed to send {} to shard {}: {}",
                        message.getClass().getSimpleName(), shardId, err.getMessage()));
    }

    /**
     * Sends a request built around a fresh request id and returns its reply.
     */
    public Future<JsonNode> request(Function<String, ? extends WireMessage.Request> factory) {
        if (closed) {
            return Future.failedFuture("Disconnected");
        }
        WireMessage.Request request = factory.apply(pending.nextRequestId());
        Future<JsonNode> reply = pending.register(request.requestId());
        send(request).onFailure(err -> pending.complete(
                WireMessage.Reply.failure(request.requestId(), err.getMessage())));
        return reply;
    }

    public Future<Void> close() {
        if (closed) {
            return Future.succeededFuture();
        }
        return socket.close();
    }

    public Future<Void> close(short code, String reason) {
        if (closed) {
            return Future.succeededFuture();
        }
        return socket.close(code, reason);
    }

    private void handleText(String text) {
        logger.debug("<- {} {}", shardId, text);
        WireMessage message;
        try {
            message = WireCodec.decode(text);
        } catch (JsonProcessingException e) {
            logger.warn("Dropping undecodable frame from shard {}: {}", shardId, e.getOriginalMessage());
            return;
        }

        if (message instanceof WireMessage.Reply reply) {
            if (!pending.complete(reply)) {
                logger.debug("Reply {} from shard {} matches no pending request", reply.requestId(), shardId);
            }
        } else if (message instanceof WireMessage.Status status) {
            listener.onStatus(this, status.snapshot());
        } else if (message instanceof WireMessage.BroadcastEval
                || message instanceof WireMessage.RespawnAll
                || message instanceof WireMessage.SendSql) {
            WireMessage.Request request = (WireMessage.Request) message;
            Future<JsonNode> outcome;
            try {
                outcome = listener.onRequest(this, request);
            } catch (RuntimeException e) {
                outcome = Future.failedFuture(e);
            }
            outcome.onComplete(ar -> send(ar.succeeded()
                    ? WireMessage.Reply.success(request.requestId(), ar.result())
                    : WireMessage.Reply.failure(request.requestId(), ar.cause().getMessage())));
        } else {
            logger.warn("Unexpected {} frame from shard {}", message.getClass().getSimpleName(), shardId);
        }
    }

    @Override
    public String toString() {
        return "ShardSession{" + shardId + ", pending=" + pending.size() + "}";
    }
}
