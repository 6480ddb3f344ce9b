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


package dev.mars.shardwarden.agent;

import dev.mars.shardwarden.agent.config.AgentConfig;
import dev.mars.shardwarden.agent.config.IdentityFiles;
import dev.mars.shardwarden.agent.observability.AgentTelemetryConfig;
import dev.mars.shardwarden.security.ShardIdentity;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of the agent process. Exits with status 1 when no identity can
 * be loaded or the configuration is invalid.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-12
 * @version 1.0
 */
public class ShardAgentApplication {

    private static final Logger logger = LoggerFactory.getLogger(ShardAgentApplication.class);

    public static void main(String[] args) {
        logger.info("Starting Shardwarden agent...");
        AgentConfig config = AgentConfig.get();

        ShardIdentity identity;
        try {
            config.validate();
            identity = IdentityFiles.load(config);
        } catch (Exception e) {
            logger.error("Failed to start Shardwarden agent", e);
            System.exit(1);
            return;
        }
        AgentTelemetryConfig.install(config, identity.id());

        Vertx vertx = Vertx.vertx();
        CountDownLatch stopped = new CountDownLatch(1);
        long shutdownTimeoutMs = config.getChildGraceMs() + 5000;

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            // undeploying the agent terminates the child before Vert.x goes away
            vertx.close().onComplete(ar -> {
                if (ar.failed()) {
                    logger.error("Error closing Vert.x instance", ar.cause());
                }
                stopped.countDown();
            });
            try {
                if (!stopped.await(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                    logger.warn("Agent did not stop within {}ms", shutdownTimeoutMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shardwarden-shutdown"));

        vertx.deployVerticle(new ShardAgent(config, identity))
                .onSuccess(id -> logger.info("Shardwarden agent {} deployed ({})", identity.id(), id))
                .onFailure(err -> {
                    logger.error("Failed to start Shardwarden agent", err);
                    vertx.close().onComplete(ar -> System.exit(1));
                });
    }
}
