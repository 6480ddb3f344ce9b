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

package dev.mars.shardwarden.master.provision;

import dev.mars.shardwarden.core.RegistryEntry;
import dev.mars.shardwarden.core.exceptions.KeyGenerationException;
import dev.mars.shardwarden.master.auth.MasterKeyStore;
import dev.mars.shardwarden.master.config.FleetSettings;
import dev.mars.shardwarden.master.observability.FleetMetrics;
import dev.mars.shardwarden.master.registry.ShardRegistry;
import dev.mars.shardwarden.security.KeyPairs;
import dev.mars.shardwarden.security.ShardIdentity;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.security.KeyPair;
import java.util.function.Supplier;

/**
 * Creates new shard identities.
 *
 * <p>Minting reserves an id, generates a key pair and writes the identity
 * artifact on a worker thread, then inserts the entry into the registry,
 * persists it and notifies operators. On any failure the id is released, no
 * entry is kept and operators receive a failure notification; the next
 * reconciliation pass asks again.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class ShardProvisioner {

    private static final Logger logger = LoggerFactory.getLogger(ShardProvisioner.class);

    private final Vertx vertx;
    private final ShardRegistry registry;
    private final MasterKeyStore masterKeys;
    private final Path identitiesDir;
    private final Supplier<FleetSettings> settings;
    private final OperatorNotifier notifier;
    private final FleetMetrics metrics;

    private int workerMintsInFlight;
    private boolean masterMintInFlight;

    public ShardProvisioner(Vertx vertx, ShardRegistry registry, MasterKeyStore masterKeys, Path identitiesDir,
                            Supplier<FleetSettings> settings, OperatorNotifier notifier, FleetMetrics metrics) {
        this.vertx = vertx;
        this.registry = registry;
        this.masterKeys = masterKeys;
        this.identitiesDir = identitiesDir;
        this.settings = settings;
        this.notifier = notifier;
        this.metrics = metrics;
    }

    /**
     * Mints one identity.
     *
     * @param master whether the identity takes the master role
     * @return the new registry entry
     */
    public Future<RegistryEntry> mint(boolean master) {
        if (!masterKeys.isLoaded()) {
            return Future.failedFuture("Master key not loaded");
        }
        FleetSettings current = settings.get();
        String id = registry.reserveId();
        Path artifact = identitiesDir.resolve(ShardIdentity.fileName(id));
        String masterPubKey = masterKeys.getPublicKeyPem();
        int keySize = current.keySize();
        trackStart(master);
        logger.info("Minting {} identity {}", master ? "master" : "worker", id);

        return vertx.<ShardIdentity>executeBlocking(() -> {
                    KeyPair pair;
                    try {
                        pair = KeyPairs.generate(keySize);
                    } catch (KeyGenerationException e) {
                        throw new MintFailure("Failed to generate key-pair!", e);
                    }
                    ShardIdentity identity = new ShardIdentity(id,
                            KeyPairs.toPem(pair.getPublic()),
                            KeyPairs.toPem(pair.getPrivate()),
                            masterPubKey,
                            current.hostFor(master),
                            KeyPairs.SIGN_ALGORITHM);
                    try {
                        identity.write(artifact);
                    } catch (IOException e) {
                        throw new MintFailure("Failed to save new shard config to disk: " + artifact, e);
                    }
                    return identity;
                })
                .map(identity -> {
                    RegistryEntry entry = new RegistryEntry(id, identity.pubKey(), master);
                    registry.put(entry);
                    registry.save();
                    metrics.recordMint(master, true);
                    notifier.identityCreated(identity, artifact);
                    return entry;
                })
                .onFailure(err -> {
                    registry.release(id);
                    metrics.recordMint(master, false);
                    String summary = err instanceof MintFailure ? err.getMessage() : "Failed to mint " + id;
                    notifier.identityFailed(summary, err.getCause() != null ? err.getCause() : err);
                })
                .onComplete(ar -> trackEnd(master));
    }

    public int getWorkerMintsInFlight() {
        return workerMintsInFlight;
    }

    public boolean isMasterMintInFlight() {
        return masterMintInFlight;
    }

    private void trackStart(boolean master) {
        if (master) {
            masterMintInFlight = true;
        } else {
            workerMintsInFlight++;
        }
    }

    private void trackEnd(boolean master) {
        if (master) {
            masterMintInFlight = false;
        } else {
            workerMintsInFlight--;
        }
    }

    /**
     * A failed minting step, carrying the operator-facing summary.
     */
    static final class MintFailure extends Exception {

        MintFailure(String summary, Throwable cause) {
            super(summary, cause);
        }
    }
}
