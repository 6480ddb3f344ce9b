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

import dev.mars.shardwarden.master.auth.ConnectionRateLimiter;
import dev.mars.shardwarden.master.auth.HandshakeAuthenticator;
import dev.mars.shardwarden.master.auth.MasterKeyStore;
import dev.mars.shardwarden.master.command.FleetCommandService;
import dev.mars.shardwarden.master.command.SqlProxyService;
import dev.mars.shardwarden.master.config.FleetSettings;
import dev.mars.shardwarden.master.config.FleetSettingsWatcher;
import dev.mars.shardwarden.master.config.MasterConfig;
import dev.mars.shardwarden.master.lifecycle.ShutdownCoordinator;
import dev.mars.shardwarden.master.lifecycle.ShutdownCoordinator.Phase;
import dev.mars.shardwarden.master.observability.FleetMetrics;
import dev.mars.shardwarden.master.partition.ConfiguredPartitionCount;
import dev.mars.shardwarden.master.provision.MailCommandNotifier;
import dev.mars.shardwarden.master.provision.OperatorNotifier;
import dev.mars.shardwarden.master.provision.ShardProvisioner;
import dev.mars.shardwarden.master.reconcile.FleetReconciler;
import dev.mars.shardwarden.master.reconcile.ReconciliationPlanner;
import dev.mars.shardwarden.master.registry.ShardRegistry;
import dev.mars.shardwarden.master.server.MasterServer;
import dev.mars.shardwarden.master.server.SessionRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires and starts the master.
 *
 * <p>Startup order: fleet settings, shard registry, master key pair, then the
 * listener. A listener that cannot bind fails the deployment. Once listening,
 * the reconciler starts and follows settings changes.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
public class ShardMasterVerticle extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(ShardMasterVerticle.class);

    private final MasterConfig config;
    private final OperatorNotifier notifierOverride;

    private FleetSettingsWatcher settingsWatcher;
    private ShardRegistry registry;
    private MasterKeyStore masterKeys;
    private SessionRegistry sessions;
    private SqlProxyService sql;
    private FleetCommandService commands;
    private ConfiguredPartitionCount partitions;
    private ShardProvisioner provisioner;
    private FleetReconciler reconciler;
    private MasterServer server;
    private ShutdownCoordinator shutdownCoordinator;
    private MailCommandNotifier mailNotifier;

    public ShardMasterVerticle() {
        this(MasterConfig.get(), null);
    }

    /**
     * @param notifier replaces the mail notifier when not null
     */
    public ShardMasterVerticle(MasterConfig config, OperatorNotifier notifier) {
        this.config = config;
        this.notifierOverride = notifier;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        logger.info("Starting ShardMasterVerticle...");
        try {
            config.validate();
        } catch (IllegalStateException e) {
            startPromise.fail(e);
            return;
        }

        settingsWatcher = new FleetSettingsWatcher(vertx, config.getFleetSettingsFile(), config.getWatchIntervalMs());
        registry = new ShardRegistry(vertx, config.getRegistryFile());

        settingsWatcher.start()
                .compose(settings -> registry.load().map(settings))
                .compose(settings -> {
                    masterKeys = new MasterKeyStore(vertx, config.getKeysDir(), settings.keySize());
                    return masterKeys.load();
                })
                .compose(v -> startServices())
                .onSuccess(port -> {
                    setupShutdownCoordinator();
                    logger.info("ShardMasterVerticle started on port {}", port);
                    startPromise.complete();
                })
                .onFailure(err -> {
                    logger.error("ShardMasterVerticle failed to start", err);
                    if (settingsWatcher != null) {
                        settingsWatcher.stop();
                    }
                    startPromise.fail(err);
                });
    }

    private Future<Integer> startServices() {
        FleetMetrics metrics = new FleetMetrics();
        sessions = new SessionRegistry();
        sql = new SqlProxyService(vertx, config.getDatabaseUrl(), config.getDatabaseUser(),
                config.getDatabasePassword());
        commands = new FleetCommandService(registry, sessions, settingsWatcher, sql, metrics);

        OperatorNotifier notifier = notifierOverride;
        if (notifier == null) {
            mailNotifier = new MailCommandNotifier(vertx, () -> settingsWatcher.get().mail());
            notifier = mailNotifier;
        }
        provisioner = new ShardProvisioner(vertx, registry, masterKeys, config.getIdentitiesDir(),
                settingsWatcher, notifier, metrics);
        partitions = new ConfiguredPartitionCount(vertx, settingsWatcher);
        reconciler = new FleetReconciler(vertx, registry, sessions, settingsWatcher, partitions,
                new ReconciliationPlanner(), provisioner, metrics);

        HandshakeAuthenticator authenticator = new HandshakeAuthenticator(registry, masterKeys, sessions::isConnected);
        server = new MasterServer(vertx, config.getHost(), config.getPort(), config.getSocketPath(),
                settingsWatcher, new ConnectionRateLimiter(), authenticator, masterKeys, sessions,
                new FleetSessionListener(reconciler, commands), metrics);

        return server.start().onSuccess(port -> {
            reconciler.start(config.getWatchIntervalMs());
            settingsWatcher.onChange(change -> reconciler.requestPass());
        });
    }

    private void setupShutdownCoordinator() {
        shutdownCoordinator = new ShutdownCoordinator(config.getDrainTimeoutMs(), config.getShutdownTimeoutMs());

        shutdownCoordinator.on(Phase.DRAIN, "listener-drain", () -> server.enterDrainMode());

        shutdownCoordinator.on(Phase.STOP_SERVICES, "reconciler-stop", () -> {
            reconciler.stop();
            settingsWatcher.stop();
            partitions.close();
            return Future.succeededFuture();
        });
        shutdownCoordinator.on(Phase.STOP_SERVICES, "sessions-close", () -> sessions.closeAll());
        shutdownCoordinator.on(Phase.STOP_SERVICES, "listener-stop", () -> server.stop());

        shutdownCoordinator.on(Phase.CLOSE_RESOURCES, "registry-flush",
                () -> registry.isDirty() ? registry.save() : Future.succeededFuture());
        shutdownCoordinator.on(Phase.CLOSE_RESOURCES, "database-close", () -> sql.close());
        shutdownCoordinator.on(Phase.CLOSE_RESOURCES, "mail-close",
                () -> mailNotifier != null ? mailNotifier.close() : Future.succeededFuture());

        logger.info("Shutdown coordinator configured (drain={}ms, timeout={}ms)",
                config.getDrainTimeoutMs(), config.getShutdownTimeoutMs());
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        logger.info("Stopping ShardMasterVerticle...");
        if (shutdownCoordinator == null) {
            stopPromise.complete();
            return;
        }
        shutdownCoordinator.shutdown().onComplete(ar -> stopPromise.complete());
    }

    public ShardRegistry getRegistry() {
        return registry;
    }

    public FleetCommandService getCommands() {
        return commands;
    }

    public SessionRegistry getSessions() {
        return sessions;
    }

    public FleetSettings getSettings() {
        return settingsWatcher.get();
    }

    Context getMasterContext() {
        return context;
    }

    public int getActualPort() {
        return server == null ? -1 : server.actualPort();
    }
}
