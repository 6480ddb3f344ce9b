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
import dev.mars.shardwarden.core.RegistryEntry;
import dev.mars.shardwarden.core.exceptions.AuthenticationException;
import dev.mars.shardwarden.master.auth.ConnectionRateLimiter;
import dev.mars.shardwarden.master.auth.HandshakeAuthenticator;
import dev.mars.shardwarden.master.auth.MasterKeyStore;
import dev.mars.shardwarden.master.config.FleetSettings;
import dev.mars.shardwarden.master.observability.FleetMetrics;
import dev.mars.shardwarden.protocol.WireMessage;
import dev.mars.shardwarden.security.AuthHeader;
import dev.mars.shardwarden.security.MasterChallenge;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.net.SocketAddress;
import io.vertx.ext.web.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.util.function.Supplier;

/**
 * The master's listener. Plain HTTP requests are answered with
 * {@code 501 Not Implemented}; WebSocket upgrades on the configured path go
 * through the rate limit and the handshake before a {@link ShardSession} is
 * created.
 *
 * <p>Refused upgrades are closed with status 1008 (policy violation) and the
 * reason as close text.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-08
 * @version 1.0
 */
public class MasterServer {

    private static final Logger logger = LoggerFactory.getLogger(MasterServer.class);

    static final short POLICY_VIOLATION = 1008;
    static final short GOING_AWAY = 1001;
    static final short INTERNAL_ERROR = 1011;
    static final String FORWARDED_FOR = "x-forwarded-for";

    private final Vertx vertx;
    private final String host;
    private final int port;
    private final String socketPath;
    private final Supplier<FleetSettings> settings;
    private final ConnectionRateLimiter rateLimiter;
    private final HandshakeAuthenticator authenticator;
    private final MasterKeyStore masterKeys;
    private final SessionRegistry sessions;
    private final SessionListener listener;
    private final FleetMetrics metrics;

    private HttpServer httpServer;
    private long pruneTimer = -1;
    private volatile boolean draining;

    public MasterServer(Vertx vertx, String host, int port, String socketPath,
                        Supplier<FleetSettings> settings, ConnectionRateLimiter rateLimiter,
                        HandshakeAuthenticator authenticator, MasterKeyStore masterKeys,
                        SessionRegistry sessions, SessionListener listener, FleetMetrics metrics) {
        this.vertx = vertx;
        this.host = host;
        this.port = port;
        this.socketPath = socketPath;
        this.settings = settings;
        this.rateLimiter = rateLimiter;
        this.authenticator = authenticator;
        this.masterKeys = masterKeys;
        this.sessions = sessions;
        this.listener = listener;
        this.metrics = metrics;
    }

    /**
     * Binds the listener.
     *
     * @return the bound port, useful when {@code port} is 0
     */
    public Future<Integer> start() {
        Router router = Router.router(vertx);
        router.route().handler(ctx -> {
            ctx.response().setStatusCode(501);
            if (ctx.request().method() == HttpMethod.GET) {
                ctx.response().end("Not Implemented");
            } else {
                ctx.response().end();
            }
        });

        httpServer = vertx.createHttpServer()
                .webSocketHandler(this::handleUpgrade)
                .requestHandler(router);

        return httpServer.listen(port, host)
                .onSuccess(server -> {
                    logger.info("Master listening on {}:{}{}", host, server.actualPort(), socketPath);
                    pruneTimer = vertx.setPeriodic(60_000, id ->
                            rateLimiter.prune(System.currentTimeMillis(), settings.get().connTimeMs()));
                })
                .onFailure(err -> logger.error("Failed to bind master listener on {}:{}", host, port, err))
                .map(HttpServer::actualPort);
    }

    /**
     * Refuses new connections from now on; live sessions are untouched.
     */
    public Future<Void> enterDrainMode() {
        draining = true;
        logger.info("Master listener draining, new connections are refused");
        return Future.succeededFuture();
    }

    public Future<Void> stop() {
        if (pruneTimer >= 0) {
            vertx.cancelTimer(pruneTimer);
            pruneTimer = -1;
        }
        if (httpServer == null) {
            return Future.succeededFuture();
        }
        return httpServer.close().onSuccess(v -> logger.info("Master listener stopped"));
    }

    public int actualPort() {
        return httpServer == null ? -1 : httpServer.actualPort();
    }

    private void handleUpgrade(ServerWebSocket socket) {
        if (draining) {
            socket.close(GOING_AWAY, "Shutting down");
            return;
        }
        if (!socketPath.equals(socket.path())) {
            logger.debug("Refusing WebSocket on unknown path {}", socket.path());
            socket.close(POLICY_VIOLATION, "Unknown path");
            return;
        }

        long now = System.currentTimeMillis();
        FleetSettings current = settings.get();
        String source = sourceAddress(socket);

        RegistryEntry entry;
        try {
            if (!rateLimiter.tryAcquire(source, now, current.connTimeMs(), current.connCount())) {
                throw new AuthenticationException(AuthenticationException.Reason.RATE_LIMITED, null);
            }
            entry = authenticator.authenticate(socket.headers().get(AuthHeader.HEADER_NAME),
                    now, current.tsPrecisionMs());
        } catch (AuthenticationException e) {
            metrics.recordRejection(e.getReason());
            logger.warn("Refused connection from {}: {}", source, e.getMessage());
            socket.close(POLICY_VIOLATION, e.getReason().getDescription());
            return;
        }

        MasterChallenge challenge;
        try {
            challenge = MasterChallenge.create(masterKeys.getPrivateKey(), now);
        } catch (GeneralSecurityException e) {
            logger.error("Unable to sign master challenge for shard {}", entry.getId(), e);
            socket.close(INTERNAL_ERROR, "Master challenge failed");
            return;
        }

        RegisteredListener registered = new RegisteredListener();
        ShardSession session = new ShardSession(vertx, entry.getId(), socket, current.replyTimeoutMs(),
                registered, now);
        sessions.add(session);
        session.attach();
        logger.info("Shard {} connected from {}", entry.getId(), source);
        session.send(new WireMessage.MasterVerification(challenge.challenge(), challenge.signature()));
        registered.onVerified(session);
    }

    static String sourceAddress(ServerWebSocket socket) {
        String forwarded = socket.headers().get(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            int comma = forwarded.indexOf(',');
            return (comma >= 0 ? forwarded.substring(0, comma) : forwarded).trim();
        }
        SocketAddress remote = socket.remoteAddress();
        return remote == null ? "unknown" : remote.host();
    }

    /**
     * Keeps the session table in step before handing events on.
     */
    private class RegisteredListener implements SessionListener {

        @Override
        public void onVerified(ShardSession session) {
            if (sessions.get(session.getShardId()) == session) {
                listener.onVerified(session);
            }
        }

        @Override
        public void onStatus(ShardSession session, HealthSnapshot snapshot) {
            listener.onStatus(session, snapshot);
        }

        @Override
        public Future<JsonNode> onRequest(ShardSession session, WireMessage.Request request) {
            return listener.onRequest(session, request);
        }

        @Override
        public void onClosed(ShardSession session) {
            if (sessions.remove(session)) {
                logger.info("Shard {} disconnected after {}s", session.getShardId(),
                        (System.currentTimeMillis() - session.getConnectedAt()) / 1000);
                listener.onClosed(session);
            }
        }
    }
}
