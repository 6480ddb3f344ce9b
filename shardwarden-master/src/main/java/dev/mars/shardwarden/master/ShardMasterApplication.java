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

package dev.mars.shardwarden.master;

import dev.mars.shardwarden.master.config.MasterConfig;
import dev.mars.shardwarden.master.observability.MasterTelemetryConfig;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point of the master process. Exits with status 1 when the master
 * cannot start, for example because its port is taken.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class ShardMasterApplication {

    private static final Logger logger = LoggerFactory.getLogger(ShardMasterApplication.class);

    public static void main(String[] args) {
        logger.info("Starting Shardwarden master...");
        MasterConfig config = MasterConfig.get();
        MasterTelemetryConfig.install(config);

        Vertx vertx = Vertx.vertx();
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            vertx.close().onComplete(ar -> {
                if (ar.failed()) {
                    logger.error("Error closing Vert.x instance", ar.cause());
                }
                stopped.countDown();
            });
            try {
                stopped.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shardwarden-shutdown"));

        vertx.deployVerticle(new ShardMasterVerticle(config, null))
                .onSuccess(id -> logger.info("Shardwarden master deployed ({})", id))
                .onFailure(err -> {
                    logger.error("Failed to start Shardwarden master", err);
                    vertx.close().onComplete(ar -> System.exit(1));
                });
    }
}
