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
import com.fasterxml.jackson.databind.node.TextNode;
import dev.mars.shardwarden.agent.observability.AgentMetrics;
import dev.mars.shardwarden.agent.support.Contexts;
import dev.mars.shardwarden.agent.support.FakeMaster;
import dev.mars.shardwarden.agent.support.TestIdentities;
import dev.mars.shardwarden.core.ShardSettings;
import dev.mars.shardwarden.protocol.WireMessage;
import dev.mars.shardwarden.security.AuthHeader;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.net.ServerSocket;
import java.security.PublicKey;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MasterConnection against an in-process master endpoint.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-14
 */
@ExtendWith(VertxExtension.class)
class MasterConnectionTest {

    private Vertx vertx;
    private Context context;
    private FakeMaster master;
    private MasterConnection connection;

    private final AtomicInteger verified = new AtomicInteger();
    private final List<Boolean> disconnects = new CopyOnWriteArrayList<>();
    private final List<WireMessage> directives = new CopyOnWriteArrayList<>();
    private final List<WireMessage.Request> requests = new CopyOnWriteArrayList<>();

    private final MasterListener listener = new MasterListener() {
        @Override
        public void onVerified() {
            verified.incrementAndGet();
        }

        @Override
        public void onDirective(WireMessage message) {
            directives.add(message);
        }

        @Override
        public Future<JsonNode> onRequest(WireMessage.Request request) {
            requests.add(request);
            if (request instanceof WireMessage.EvalRequest eval && eval.script().equals("fail")) {
                return Future.failedFuture("boom");
            }
            return Future.succeededFuture(TextNode.valueOf("answer"));
        }

        @Override
        public void onDisconnected(boolean wasVerified) {
            disconnects.add(wasVerified);
        }
    };

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
        this.context = vertx.getOrCreateContext();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (connection != null) {
            result(Contexts.call(context, connection::close));
        }
        if (master != null) {
            result(master.close());
        }
    }

    private static <T> T result(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    private void startMaster(PublicKey acceptedShardKey) throws Exception {
        master = result(FakeMaster.start(vertx, acceptedShardKey, TestIdentities.MASTER_KEYS.getPrivate()));
    }

    private void open(int port, long reconnectDelayMs, long backoffMs) throws Exception {
        MasterConnection.Settings settings =
                new MasterConnection.Settings(reconnectDelayMs, backoffMs, backoffMs * 2, 2000, 0, false);
        connection = Contexts.call(context, () -> {
            MasterConnection created = new MasterConnection(vertx, TestIdentities.identity("abc", port),
                    settings, listener, new AgentMetrics("abc", System.currentTimeMillis()));
            created.connect();
            return created;
        });
    }

    private MasterConnection.State state() throws Exception {
        return Contexts.call(context, connection::getState);
    }

    private int attempts() throws Exception {
        return Contexts.call(context, connection::getAttempts);
    }

    @Test
    @DisplayName("Connection is verified once the master answers the challenge")
    void verifiesTheMaster() throws Exception {
        startMaster(TestIdentities.SHARD_KEYS.getPublic());
        open(master.port(), 100, 100);

        await().atMost(Duration.ofSeconds(10)).until(() -> verified.get() == 1);
        assertEquals(MasterConnection.State.VERIFIED, state());
        assertTrue(Contexts.call(context, connection::isConnected));
        assertTrue(AuthHeader.parse(master.headers.get(0)).verify(TestIdentities.SHARD_KEYS.getPublic()));
    }

    @Test
    @DisplayName("Challenge signed with the wrong key closes the socket for good")
    void wrongChallengeKeyIsNotRetried() throws Exception {
        startMaster(TestIdentities.SHARD_KEYS.getPublic());
        master.challengeKey = TestIdentities.OTHER_KEYS.getPrivate();
        open(master.port(), 50, 50);

        await().atMost(Duration.ofSeconds(10)).until(() -> disconnects.size() == 1);
        Thread.sleep(500);
        assertEquals(0, verified.get());
        assertEquals(List.of(false), disconnects);
        assertEquals(1, master.connections());
        assertEquals(MasterConnection.State.DISCONNECTED, state());
    }

    @Test
    void rejectedHeaderIsNotRetried() throws Exception {
        startMaster(TestIdentities.OTHER_KEYS.getPublic());
        open(master.port(), 50, 50);

        await().atMost(Duration.ofSeconds(10)).until(() -> disconnects.size() == 1);
        Thread.sleep(500);
        assertEquals(1, master.headers.size());
        assertEquals(1, attempts());
        assertEquals(0, verified.get());
    }

    @Test
    @DisplayName("Verified connection dropped by the master reconnects with a new header")
    void droppedConnectionReconnects() throws Exception {
        startMaster(TestIdentities.SHARD_KEYS.getPublic());
        open(master.port(), 100, 100);
        await().atMost(Duration.ofSeconds(10)).until(() -> verified.get() == 1);

        result(master.dropConnection());

        await().atMost(Duration.ofSeconds(10)).until(() -> verified.get() == 2);
        assertEquals(List.of(true), disconnects);
        assertEquals(2, master.headers.size());
        assertNotEquals(master.headers.get(0), master.headers.get(1));
    }

    @Test
    void unreachableMasterIsRetriedWithBackoff() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }
        open(port, 50, 50);

        await().atMost(Duration.ofSeconds(10)).until(() -> attempts() >= 3);
        assertEquals(MasterConnection.State.DISCONNECTED, state());
        assertTrue(disconnects.isEmpty());
    }

    @Test
    void requestWithoutSocketFailsAtOnce() throws Exception {
        int port;
        try (ServerSocket probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }
        open(port, 50, 60_000);

        Future<JsonNode> reply = Contexts.call(context,
                () -> connection.request(id -> new WireMessage.BroadcastEval(id, "1")));
        ExecutionException e = assertThrows(ExecutionException.class, () -> result(reply));
        assertEquals(MasterConnection.DISCONNECTED_ERROR, e.getCause().getMessage());
    }

    @Test
    @DisplayName("Directives sent before verification are ignored")
    void framesBeforeVerificationAreIgnored() throws Exception {
        startMaster(TestIdentities.SHARD_KEYS.getPublic());
        master.beforeChallenge = new WireMessage.Update(
                new ShardSettings(0, 1, false, "bot", null, null));
        open(master.port(), 100, 100);
        await().atMost(Duration.ofSeconds(10)).until(() -> verified.get() == 1);

        result(master.send(new WireMessage.Respawn(5)));

        await().atMost(Duration.ofSeconds(10)).until(() -> !directives.isEmpty());
        assertEquals(List.of(new WireMessage.Respawn(5)), directives);
    }

    @Test
    void masterRequestsAreAnswered() throws Exception {
        startMaster(TestIdentities.SHARD_KEYS.getPublic());
        open(master.port(), 100, 100);
        await().atMost(Duration.ofSeconds(10)).until(() -> verified.get() == 1);

        assertEquals(TextNode.valueOf("answer"),
                result(master.request(id -> new WireMessage.EvalRequest(id, "shardId"))));
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> result(master.request(id -> new WireMessage.EvalRequest(id, "fail"))));
        assertEquals("boom", e.getCause().getMessage());
        assertEquals(2, requests.size());
    }

    @Test
    void agentRequestsGetTheMastersReply() throws Exception {
        startMaster(TestIdentities.SHARD_KEYS.getPublic());
        open(master.port(), 100, 100);
        await().atMost(Duration.ofSeconds(10)).until(() -> verified.get() == 1);

        Future<JsonNode> reply = Contexts.call(context,
                () -> connection.request(id -> new WireMessage.SendSql(id, "select 1")));

        assertEquals(TextNode.valueOf("ok:SendSql"), result(reply));
        assertEquals(1, master.received(WireMessage.SendSql.class).size());
    }

    @Test
    void reconnectOpensAFreshSocket() throws Exception {
        startMaster(TestIdentities.SHARD_KEYS.getPublic());
        open(master.port(), 60_000, 100);
        await().atMost(Duration.ofSeconds(10)).until(() -> verified.get() == 1);

        Contexts.run(context, connection::reconnect);

        await().atMost(Duration.ofSeconds(10)).until(() -> verified.get() == 2);
        assertEquals(2, master.connections());
        assertEquals(2, attempts());
    }

    @Test
    void closedConnectionStaysClosed() throws Exception {
        startMaster(TestIdentities.SHARD_KEYS.getPublic());
        open(master.port(), 50, 50);
        await().atMost(Duration.ofSeconds(10)).until(() -> verified.get() == 1);

        result(Contexts.call(context, connection::close));

        await().atMost(Duration.ofSeconds(10)).until(() -> !master.isConnected());
        Thread.sleep(300);
        assertEquals(1, master.connections());
        assertTrue(Contexts.call(context, connection::connect).failed());
        connection = null;
    }
}
