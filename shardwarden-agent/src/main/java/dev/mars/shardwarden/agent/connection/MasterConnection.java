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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.shardwarden.agent.observability.AgentMetrics;
import dev.mars.shardwarden.core.HostAddress;
import dev.mars.shardwarden.protocol.PendingReplies;
import dev.mars.shardwarden.protocol.WireCodec;
import dev.mars.shardwarden.protocol.WireMessage;
import dev.mars.shardwarden.security.AuthHeader;
import dev.mars.shardwarden.security.MasterChallenge;
import dev.mars.shardwarden.security.ShardIdentity;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.http.WebSocketConnectOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.function.Function;

/**
 * The agent's WebSocket to the master.
 *
 * <p>State machine {@code DISCONNECTED -> CONNECTING -> CONNECTED -> VERIFIED}.
 * Every attempt presents a freshly signed authorization header. The
 * connection becomes VERIFIED once the master's challenge verifies against
 * the master public key from the identity artifact; frames other than the
 * challenge are ignored until then.</p>
 *
 * <p>Reconnection rules:</p>
 * <ul>
 *   <li>a VERIFIED connection closed by the master is reopened after the
 *       reconnect delay</li>
 *   <li>an attempt that never opened a socket is retried with capped
 *       exponential backoff</li>
 *   <li>an unverified connection that is closed, by either side, is not
 *       retried</li>
 *   <li>{@link #reconnect()} closes the current socket and opens a new one
 *       right away</li>
 * </ul>
 *
 * <p>Not thread-safe: every method must be called on the event loop that
 * owns the connection.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-11
 * @version 1.0
 */
public class MasterConnection {

    private static final Logger logger = LoggerFactory.getLogger(MasterConnection.class);

    public static final String DISCONNECTED_ERROR = "Disconnected from master!";

    public enum State {
        DISCONNECTED,
        CONNECTING,
        CONNECTED,
        VERIFIED
    }

    private final Vertx vertx;
    private final String shardId;
    private final HostAddress host;
    private final PrivateKey privateKey;
    private final PublicKey masterPublicKey;
    private final MasterListener listener;
    private final AgentMetrics metrics;
    private final WebSocketClient client;
    private final PendingReplies pending;
    private final long reconnectDelayMs;
    private final long backoffInitialMs;
    private final long backoffMaxMs;

    private State state = State.DISCONNECTED;
    private WebSocket socket;
    private boolean closingLocally;
    private boolean reopenAfterClose;
    private boolean stopped;
    private long retryTimerId = -1;
    private long backoffMs;
    private long lastSeen;
    private int attempts;

    public MasterConnection(Vertx vertx, ShardIdentity identity, Settings settings,
                            MasterListener listener, AgentMetrics metrics) throws GeneralSecurityException {
        this.vertx = vertx;
        this.shardId = identity.id();
        this.host = identity.host();
        this.privateKey = identity.privateKey();
        this.masterPublicKey = identity.masterPublicKey();
        this.listener = listener;
        this.metrics = metrics;
        this.pending = new PendingReplies(vertx, settings.replyTimeoutMs());
        this.reconnectDelayMs = settings.reconnectDelayMs();
        this.backoffInitialMs = settings.backoffInitialMs();
        this.backoffMaxMs = settings.backoffMaxMs();
        this.backoffMs = backoffInitialMs;

        WebSocketClientOptions options = new WebSocketClientOptions()
                .setConnectTimeout(settings.connectTimeoutMs());
        if (host.isSecure() && settings.trustAll()) {
            options.setTrustAll(true).setVerifyHost(false);
        }
        this.client = vertx.createWebSocketClient(options);
    }

    /**
     * Timing and transport options of the connection.
     */
    public record Settings(long reconnectDelayMs, long backoffInitialMs, long backoffMaxMs,
                           int connectTimeoutMs, long replyTimeoutMs, boolean trustAll) {
    }

    /**
     * Opens the socket unless one is open or opening.
     *
     * @return completes when the socket is open, before verification
     */
    public Future<Void> connect() {
        if (stopped) {
            return Future.failedFuture("Connection closed");
        }
        if (state != State.DISCONNECTED) {
            return Future.succeededFuture();
        }
        cancelRetry();

        AuthHeader header;
        try {
            header = AuthHeader.create(shardId, privateKey, System.currentTimeMillis());
        } catch (GeneralSecurityException e) {
            logger.error("Unable to sign authorization header for shard {}", shardId, e);
            return Future.failedFuture(e);
        }

        state = State.CONNECTING;
        attempts++;
        logger.info("Connecting to master at {} (attempt #{})", host, attempts);

        WebSocketConnectOptions options = new WebSocketConnectOptions()
                .setHost(host.host())
                .setPort(host.port())
                .setURI(host.path())
                .setSsl(host.isSecure())
                .addHeader(AuthHeader.HEADER_NAME, header.encode());

        return client.connect(options)
                .onSuccess(this::attach)
                .onFailure(err -> {
                    state = State.DISCONNECTED;
                    long delay = backoffMs;
                    backoffMs = Math.min(backoffMs * 2, backoffMaxMs);
                    logger.warn("Failed to connect to master at {}: {} (retrying in {}ms)",
                            host, err.getMessage(), delay);
                    scheduleRetry(delay);
                })
                .mapEmpty();
    }

    /**
     * Drops the current socket, if any, and connects again with a new header.
     */
    public void reconnect() {
        if (stopped) {
            return;
        }
        metrics.recordReconnect();
        if (socket != null) {
            logger.info("Reconnecting to master");
            reopenAfterClose = true;
            closeSocket();
        } else if (state == State.DISCONNECTED) {
            connect();
        }
    }

    /**
     * Closes the connection for good. Outstanding requests fail.
     */
    public Future<Void> close() {
        stopped = true;
        cancelRetry();
        Future<Void> closed = socket != null ? closeSocket() : Future.succeededFuture();
        pending.failAll(DISCONNECTED_ERROR);
        return closed.transform(ar -> client.close());
    }

    public Future<Void> send(WireMessage message) {
        if (!isConnected()) {
            return Future.failedFuture(DISCONNECTED_ERROR);
        }
        String text = WireCodec.encode(message);
        logger.debug("-> master {}", text);
        return socket.writeTextMessage(text)
                .onFailure(err -> logger.warn("Failed to send {} to master: {}",
                        message.getClass().getSimpleName(), err.getMessage()));
    }

    /**
     * Sends a request built around a fresh request id and returns the master's
     * reply. Fails at once with {@value #DISCONNECTED_ERROR} when there is no
     * open socket.
     */
    public Future<JsonNode> request(Function<String, ? extends WireMessage.Request> factory) {
        if (!isConnected()) {
            return Future.failedFuture(DISCONNECTED_ERROR);
        }
        WireMessage.Request request = factory.apply(pending.nextRequestId());
        Future<JsonNode> reply = pending.register(request.requestId());
        send(request).onFailure(err -> pending.complete(
                WireMessage.Reply.failure(request.requestId(), err.getMessage())));
        return reply;
    }

    public State getState() {
        return state;
    }

    public boolean isConnected() {
        return state == State.CONNECTED || state == State.VERIFIED;
    }

    public boolean isVerified() {
        return state == State.VERIFIED;
    }

    /**
     * Time of the last frame received from the master, zero before the first.
     */
    public long getLastSeen() {
        return lastSeen;
    }

    public int getAttempts() {
        return attempts;
    }

    private void attach(WebSocket ws) {
        if (stopped) {
            ws.close();
            return;
        }
        socket = ws;
        state = State.CONNECTED;
        closingLocally = false;
        backoffMs = backoffInitialMs;
        logger.info("Socket connected to master");

        ws.textMessageHandler(this::handleText);
        ws.exceptionHandler(err -> logger.warn("Master socket error: {}", err.getMessage()));
        ws.closeHandler(v -> handleClosed(ws));
    }

    private void handleClosed(WebSocket ws) {
        if (ws != socket) {
            return;
        }
        boolean wasVerified = state == State.VERIFIED;
        boolean local = closingLocally;
        boolean reopen = reopenAfterClose;
        socket = null;
        state = State.DISCONNECTED;
        closingLocally = false;
        reopenAfterClose = false;
        pending.failAll(DISCONNECTED_ERROR);

        logger.info("Socket disconnected from master ({} {})", ws.closeStatusCode(), ws.closeReason());
        listener.onDisconnected(wasVerified);

        if (stopped) {
            return;
        }
        if (reopen) {
            connect();
        } else if (!local && wasVerified) {
            metrics.recordReconnect();
            scheduleRetry(reconnectDelayMs);
        } else if (!wasVerified) {
            logger.warn("Connection closed before the master was verified, not reconnecting");
        }
    }

    private void handleText(String text) {
        logger.debug("<- master {}", text);
        WireMessage message;
        try {
            message = WireCodec.decode(text);
        } catch (JsonProcessingException e) {
            logger.warn("Dropping undecodable frame from master: {}", e.getOriginalMessage());
            return;
        }
        lastSeen = System.currentTimeMillis();

        if (message instanceof WireMessage.Reply reply) {
            if (!pending.complete(reply)) {
                logger.debug("Reply {} from master matches no pending request", reply.requestId());
            }
        } else if (message instanceof WireMessage.MasterVerification verification) {
            verify(verification);
        } else if (state != State.VERIFIED) {
            logger.warn("Ignoring {} from unverified master", message.getClass().getSimpleName());
        } else if (message instanceof WireMessage.EvalRequest || message instanceof WireMessage.GetFile) {
            answer((WireMessage.Request) message);
        } else {
            listener.onDirective(message);
        }
    }

    private void verify(WireMessage.MasterVerification verification) {
        if (state == State.VERIFIED) {
            logger.debug("Master already verified on this connection");
            return;
        }
        if (new MasterChallenge(verification.challenge(), verification.signature()).verify(masterPublicKey)) {
            state = State.VERIFIED;
            logger.info("Verified signature from master successfully");
            listener.onVerified();
        } else {
            logger.error("Failed to verify signature from master, closing connection");
            closeSocket();
        }
    }

    private void answer(WireMessage.Request request) {
        Future<JsonNode> outcome;
        try {
            outcome = listener.onRequest(request);
        } catch (RuntimeException e) {
            outcome = Future.failedFuture(e);
        }
        outcome.onComplete(ar -> send(ar.succeeded()
                ? WireMessage.Reply.success(request.requestId(), ar.result())
                : WireMessage.Reply.failure(request.requestId(), ar.cause().getMessage())));
    }

    private Future<Void> closeSocket() {
        closingLocally = true;
        return socket.close();
    }

    private void scheduleRetry(long delayMs) {
        if (stopped) {
            return;
        }
        cancelRetry();
        retryTimerId = vertx.setTimer(Math.max(1, delayMs), id -> {
            retryTimerId = -1;
            connect();
        });
    }

    private void cancelRetry() {
        if (retryTimerId >= 0) {
            vertx.cancelTimer(retryTimerId);
            retryTimerId = -1;
        }
    }
}
