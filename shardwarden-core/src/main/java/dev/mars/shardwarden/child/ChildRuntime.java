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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Child-side end of the agent pipe. A supervised application creates one at
 * startup and gets evaluation, stats reporting and fleet-wide calls for free.
 *
 * <p>The pipe is the process's stdout, so the application must log to stderr
 * (the default Logback console appender target can be switched with
 * {@code <target>System.err</target>}).</p>
 *
 * <pre>{@code
 * ChildRuntime runtime = ChildRuntime.attach(script -> myApp.evaluate(script));
 * runtime.lifecycle("READY");
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class ChildRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ChildRuntime.class);

    private final BufferedReader in;
    private final PrintStream out;
    private final ScriptEvaluator evaluator;
    private final ChildEnvironment environment;
    private final long startTime = System.currentTimeMillis();
    private final AtomicLong messageCount = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Map<String, CompletableFuture<JsonNode>> broadcasts = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<JsonNode>> queries = new ConcurrentHashMap<>();
    private volatile CompletableFuture<Void> respawnAll;

    private Thread readerThread;

    public ChildRuntime(InputStream in, OutputStream out, ScriptEvaluator evaluator, ChildEnvironment environment) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = new PrintStream(out, true, StandardCharsets.UTF_8);
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.environment = environment;
    }

    /**
     * Attaches to the process's own stdin and stdout and starts reading.
     */
    public static ChildRuntime attach(ScriptEvaluator evaluator) {
        ChildRuntime runtime = new ChildRuntime(System.in, System.out, evaluator, ChildEnvironment.current());
        runtime.start();
        return runtime;
    }

    public synchronized void start() {
        if (readerThread != null) {
            return;
        }
        readerThread = new Thread(this::readLoop, "shardwarden-child-pipe");
        readerThread.setDaemon(true);
        readerThread.start();
    }

    public ChildEnvironment environment() {
        return environment;
    }

    /**
     * Counts one unit of application work. The agent uses the rate to decide
     * whether the child is still doing anything.
     */
    public void recordMessage() {
        messageCount.incrementAndGet();
    }

    public void lifecycle(String state) {
        send(new ChildMessage.Lifecycle(state));
    }

    public void requestReboot(String reason) {
        send(new ChildMessage.Reboot(reason));
    }

    /**
     * Evaluates a script on every shard. Concurrent calls with the same script
     * share one request.
     */
    public CompletableFuture<JsonNode> broadcastEval(String script) {
        CompletableFuture<JsonNode> created = new CompletableFuture<>();
        CompletableFuture<JsonNode> existing = broadcasts.putIfAbsent(script, created);
        if (existing != null) {
            return existing;
        }
        send(new ChildMessage.BroadcastEval(script));
        return created;
    }

    public synchronized CompletableFuture<Void> respawnAll() {
        if (respawnAll == null) {
            respawnAll = new CompletableFuture<>();
            send(new ChildMessage.RespawnAll());
        }
        return respawnAll;
    }

    public CompletableFuture<JsonNode> sendSql(String query) {
        CompletableFuture<JsonNode> created = new CompletableFuture<>();
        CompletableFuture<JsonNode> existing = queries.putIfAbsent(query, created);
        if (existing != null) {
            return existing;
        }
        send(new ChildMessage.Sql(query));
        return created;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            IllegalStateException closedError = new IllegalStateException("Child runtime closed");
            broadcasts.values().forEach(f -> f.completeExceptionally(closedError));
            queries.values().forEach(f -> f.completeExceptionally(closedError));
            broadcasts.clear();
            queries.clear();
            synchronized (this) {
                if (respawnAll != null) {
                    respawnAll.completeExceptionally(closedError);
                    respawnAll = null;
                }
            }
        }
    }

    ChildStats collectStats() {
        MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = memory.getHeapMemoryUsage();
        MemoryUsage nonHeap = memory.getNonHeapMemoryUsage();
        return new ChildStats(
                heap.getUsed(),
                heap.getCommitted(),
                heap.getMax(),
                nonHeap.getUsed(),
                ProcStat.readCpuTimes(),
                messageCount.get(),
                System.currentTimeMillis() - startTime);
    }

    private void readLoop() {
        try {
            String line;
            while (!closed.get() && (line = in.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    handle(ChildCodec.decode(line));
                } catch (JsonProcessingException e) {
                    logger.warn("Ignoring malformed message from agent: {}", e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            if (!closed.get()) {
                logger.warn("Agent pipe closed: {}", e.getMessage());
            }
        } finally {
            close();
        }
    }

    private void handle(ChildMessage message) {
        if (message instanceof ChildMessage.Eval eval) {
            evaluate(eval.script());
        } else if (message instanceof ChildMessage.StatsRequest) {
            send(new ChildMessage.Stats(collectStats()));
        } else if (message instanceof ChildMessage.BroadcastEvalResult result) {
            settle(broadcasts.remove(result.script()), result.result(), result.error());
        } else if (message instanceof ChildMessage.SqlResult result) {
            settle(queries.remove(result.query()), result.result(), result.error());
        } else if (message instanceof ChildMessage.RespawnAllResult result) {
            CompletableFuture<Void> pending;
            synchronized (this) {
                pending = respawnAll;
                respawnAll = null;
            }
            if (pending != null) {
                if (result.error() != null) {
                    pending.completeExceptionally(new IllegalStateException(result.error()));
                } else {
                    pending.complete(null);
                }
            }
        } else {
            logger.debug("Unexpected message from agent: {}", message);
        }
    }

    private void evaluate(String script) {
        try {
            send(new ChildMessage.EvalResult(script, evaluator.evaluate(script), null));
        } catch (Exception e) {
            send(new ChildMessage.EvalResult(script, null,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getName()));
        }
    }

    private static void settle(CompletableFuture<JsonNode> pending, JsonNode result, String error) {
        if (pending == null) {
            return;
        }
        if (error != null) {
            pending.completeExceptionally(new IllegalStateException(error));
        } else {
            pending.complete(result);
        }
    }

    private void send(ChildMessage message) {
        String line = ChildCodec.encode(message);
        synchronized (out) {
            out.println(line);
        }
    }
}
