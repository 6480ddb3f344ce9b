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

package dev.mars.shardwarden.child;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ChildRuntimeTest {

    private static final ChildEnvironment ENV = ChildEnvironment.fromEnvironment(Map.of(
            ChildEnvironment.MANAGED, "true",
            ChildEnvironment.SHARD_ID, "1",
            ChildEnvironment.SHARD_COUNT, "2"));

    private ChildRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.close();
        }
    }

    @Test
    @DisplayName("Evaluation requests are answered with results keyed by script")
    void answersEvalAndStatsRequests() throws Exception {
        String input = ChildCodec.encode(new ChildMessage.Eval("1+1")) + "\n"
                + ChildCodec.encode(new ChildMessage.Eval("boom")) + "\n"
                + ChildCodec.encode(new ChildMessage.StatsRequest()) + "\n";
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        runtime = new ChildRuntime(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out,
                script -> {
                    if (script.equals("boom")) {
                        throw new IllegalArgumentException("bad script");
                    }
                    return IntNode.valueOf(2);
                }, ENV);
        runtime.recordMessage();
        runtime.recordMessage();
        runtime.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> lines(out).size() >= 3);
        List<ChildMessage> messages = decode(lines(out));

        ChildMessage.EvalResult ok = assertInstanceOf(ChildMessage.EvalResult.class, messages.get(0));
        assertEquals("1+1", ok.script());
        assertEquals(2, ok.result().asInt());
        assertNull(ok.error());

        ChildMessage.EvalResult failed = assertInstanceOf(ChildMessage.EvalResult.class, messages.get(1));
        assertEquals("boom", failed.script());
        assertEquals("bad script", failed.error());

        ChildMessage.Stats stats = assertInstanceOf(ChildMessage.Stats.class, messages.get(2));
        assertEquals(2, stats.stats().messageCount());
        assertTrue(stats.stats().heapUsed() > 0);
    }

    @Test
    @DisplayName("Concurrent broadcasts of the same script share one request")
    void broadcastEvalIsDeduplicatedByScript() throws Exception {
        PipedOutputStream toChild = new PipedOutputStream();
        PipedInputStream childIn = new PipedInputStream(toChild);
        PipedInputStream fromChild = new PipedInputStream();
        PipedOutputStream childOut = new PipedOutputStream(fromChild);
        BufferedReader reader = new BufferedReader(new InputStreamReader(fromChild, StandardCharsets.UTF_8));

        runtime = new ChildRuntime(childIn, childOut, script -> TextNode.valueOf(script), ENV);
        runtime.start();

        CompletableFuture<JsonNode> first = runtime.broadcastEval("count");
        CompletableFuture<JsonNode> second = runtime.broadcastEval("count");
        assertSame(first, second);

        ChildMessage sent = ChildCodec.decode(reader.readLine());
        assertEquals(new ChildMessage.BroadcastEval("count"), sent);

        toChild.write((ChildCodec.encode(new ChildMessage.BroadcastEvalResult("count",
                ChildCodec.mapper().readTree("[3,4]"), null)) + "\n").getBytes(StandardCharsets.UTF_8));
        toChild.flush();

        JsonNode result = first.get(5, TimeUnit.SECONDS);
        assertEquals(2, result.size());
        assertEquals(7, result.get(0).asInt() + result.get(1).asInt());
    }

    @Test
    void closingFailsOutstandingCalls() {
        runtime = new ChildRuntime(new PipedInputStream(), new ByteArrayOutputStream(), script -> null, ENV);

        CompletableFuture<JsonNode> query = runtime.sendSql("select 1");
        CompletableFuture<Void> respawn = runtime.respawnAll();
        runtime.close();

        assertThrows(ExecutionException.class, () -> query.get(1, TimeUnit.SECONDS));
        assertThrows(ExecutionException.class, () -> respawn.get(1, TimeUnit.SECONDS));
    }

    @Test
    void lifecycleAndRebootAreWrittenToTheAgent() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        runtime = new ChildRuntime(new PipedInputStream(), out, script -> null, ENV);

        runtime.lifecycle("ready");
        runtime.requestReboot("cache corrupted");

        List<ChildMessage> messages = decode(lines(out));
        assertEquals(List.of(new ChildMessage.Lifecycle("ready"), new ChildMessage.Reboot("cache corrupted")),
                messages);
    }

    @Test
    void environmentIsExposed() {
        runtime = new ChildRuntime(new PipedInputStream(), new ByteArrayOutputStream(), script -> null, ENV);
        assertTrue(runtime.environment().managed());
        assertEquals(1, runtime.environment().shardId());
    }

    private static List<String> lines(ByteArrayOutputStream out) {
        String text = out.toString(StandardCharsets.UTF_8);
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static List<ChildMessage> decode(List<String> lines) throws IOException {
        List<ChildMessage> messages = new ArrayList<>();
        for (String line : lines) {
            messages.add(ChildCodec.decode(line));
        }
        return messages;
    }
}
