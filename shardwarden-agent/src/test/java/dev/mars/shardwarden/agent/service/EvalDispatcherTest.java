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
import com.fasterxml.jackson.databind.node.IntNode;
import dev.mars.shardwarden.child.ChildMessage;
import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EvalDispatcher against an in-memory child channel.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-13
 */
class EvalDispatcherTest {

    private final List<ChildMessage> sent = new ArrayList<>();
    private boolean running;
    private boolean failSends;
    private EvalDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        running = true;
        failSends = false;
        dispatcher = new EvalDispatcher(new ChildChannel() {
            @Override
            public boolean isRunning() {
                return running;
            }

            @Override
            public Future<Void> send(ChildMessage message) {
                if (failSends) {
                    return Future.failedFuture("pipe closed");
                }
                sent.add(message);
                return Future.succeededFuture();
            }
        });
    }

    @Test
    void failsWhenNoChildIsRunning() {
        running = false;

        Future<JsonNode> result = dispatcher.eval("1 + 1");

        assertTrue(result.failed());
        assertEquals(ChildSupervisor.NOT_RUNNING, result.cause().getMessage());
        assertTrue(sent.isEmpty());
    }

    @Test
    void identicalScriptsShareOneEvaluation() {
        Future<JsonNode> first = dispatcher.eval("shardId");
        Future<JsonNode> second = dispatcher.eval("shardId");

        assertEquals(1, sent.size());
        assertEquals(new ChildMessage.Eval("shardId"), sent.get(0));
        assertEquals(1, dispatcher.pending());

        assertTrue(dispatcher.onResult(new ChildMessage.EvalResult("shardId", IntNode.valueOf(4), null)));

        assertEquals(IntNode.valueOf(4), first.result());
        assertEquals(IntNode.valueOf(4), second.result());
        assertEquals(0, dispatcher.pending());
    }

    @Test
    void errorResultFailsEveryCaller() {
        Future<JsonNode> first = dispatcher.eval("fail");
        Future<JsonNode> second = dispatcher.eval("fail");

        dispatcher.onResult(new ChildMessage.EvalResult("fail", null, "boom"));

        assertEquals("boom", first.cause().getMessage());
        assertEquals("boom", second.cause().getMessage());
    }

    @Test
    void unknownResultIsReported() {
        assertFalse(dispatcher.onResult(new ChildMessage.EvalResult("nobody asked", null, null)));
    }

    @Test
    void failAllSettlesPendingEvaluations() {
        Future<JsonNode> a = dispatcher.eval("a");
        Future<JsonNode> b = dispatcher.eval("b");

        dispatcher.failAll("Child process exited with code 1");

        assertEquals("Child process exited with code 1", a.cause().getMessage());
        assertEquals("Child process exited with code 1", b.cause().getMessage());
        assertEquals(0, dispatcher.pending());
    }

    @Test
    void sendFailureDoesNotLeaveAnEntryBehind() {
        failSends = true;

        Future<JsonNode> result = dispatcher.eval("x");

        assertEquals("pipe closed", result.cause().getMessage());
        assertEquals(0, dispatcher.pending());
    }
}
