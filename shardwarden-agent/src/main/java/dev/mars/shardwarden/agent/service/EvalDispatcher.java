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

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.shardwarden.child.ChildMessage;
import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Forwards evaluation requests to the child. Requests are keyed by script
 * text: while a script is being evaluated, further requests for the same text
 * share its result instead of reaching the child again.
 *
 * <p>Event loop confined.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-12
 * @version 1.0
 */
public class EvalDispatcher {

    private final ChildChannel child;
    private final Map<String, Promise<JsonNode>> inFlight = new HashMap<>();

    public EvalDispatcher(ChildChannel child) {
        this.child = child;
    }

    public Future<JsonNode> eval(String script) {
        if (!child.isRunning()) {
            return Future.failedFuture(ChildSupervisor.NOT_RUNNING);
        }
        Promise<JsonNode> existing = inFlight.get(script);
        if (existing != null) {
            return existing.future();
        }
        Promise<JsonNode> promise = Promise.promise();
        inFlight.put(script, promise);
        child.send(new ChildMessage.Eval(script)).onFailure(err -> {
            if (inFlight.remove(script, promise)) {
                promise.tryFail(err);
            }
        });
        return promise.future();
    }

    /**
     * Settles the evaluation a result belongs to.
     *
     * @return false if no evaluation of that script is pending
     */
    public boolean onResult(ChildMessage.EvalResult result) {
        Promise<JsonNode> promise = inFlight.remove(result.script());
        if (promise == null) {
            return false;
        }
        if (result.error() != null) {
            promise.tryFail(result.error());
        } else {
            promise.tryComplete(result.result());
        }
        return true;
    }

    public void failAll(String reason) {
        List<Promise<JsonNode>> all = new ArrayList<>(inFlight.values());
        inFlight.clear();
        all.forEach(promise -> promise.tryFail(reason));
    }

    public int pending() {
        return inFlight.size();
    }
}
