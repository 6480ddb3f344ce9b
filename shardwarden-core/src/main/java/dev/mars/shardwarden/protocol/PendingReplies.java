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

import com.fasterxml.jackson.databind.JsonNode;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Requests sent over one connection that still wait for a {@link WireMessage.Reply}.
 *
 * <p>Not thread-safe: owned by the event loop of the connection. A reply
 * timeout of zero means requests wait until a reply arrives or the connection
 * drops, at which point {@link #failAll(String)} settles them.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public class PendingReplies {

    private record Pending(Promise<JsonNode> promise, long timerId) {
    }

    private final Vertx vertx;
    private final long timeoutMs;
    private final Map<String, Pending> pending = new HashMap<>();

    public PendingReplies(Vertx vertx, long timeoutMs) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.timeoutMs = timeoutMs;
    }

    public String nextRequestId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Registers a request id and returns the future its reply completes.
     */
    public Future<JsonNode> register(String requestId) {
        Promise<JsonNode> promise = Promise.promise();
        long timerId = -1;
        if (timeoutMs > 0) {
            timerId = vertx.setTimer(timeoutMs, id -> {
                Pending expired = pending.remove(requestId);
                if (expired != null) {
                    expired.promise().tryFail(new TimeoutException(
                            "No reply to " + requestId + " within " + timeoutMs + "ms"));
                }
            });
        }
        pending.put(requestId, new Pending(promise, timerId));
        return promise.future();
    }

    /**
     * Settles the request the reply belongs to.
     *
     * @return false if no request with that id is waiting
     */
    public boolean complete(WireMessage.Reply reply) {
        Pending waiting = pending.remove(reply.requestId());
        if (waiting == null) {
            return false;
        }
        if (waiting.timerId() >= 0) {
            vertx.cancelTimer(waiting.timerId());
        }
        if (reply.failed()) {
            waiting.promise().tryFail(reply.error());
        } else {
            waiting.promise().tryComplete(reply.result());
        }
        return true;
    }

    /**
     * Fails every outstanding request, typically because the socket closed.
     */
    public void failAll(String reason) {
        List<Pending> all = new ArrayList<>(pending.values());
        pending.clear();
        for (Pending waiting : all) {
            if (waiting.timerId() >= 0) {
                vertx.cancelTimer(waiting.timerId());
            }
            waiting.promise().tryFail(reason);
        }
    }

    public int size() {
        return pending.size();
    }
}
