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

package dev.mars.shardwarden.master.auth;

import dev.mars.shardwarden.core.io.AtomicFiles;
import dev.mars.shardwarden.security.KeyPairs;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * The master's own key pair, kept as {@code master.priv} and
 * {@code master.pub} in the keys directory and generated on first start.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public class MasterKeyStore {

    private static final Logger logger = LoggerFactory.getLogger(MasterKeyStore.class);

    static final String PRIVATE_KEY_FILE = "master.priv";
    static final String PUBLIC_KEY_FILE = "master.pub";

    private final Vertx vertx;
    private final Path keysDir;
    private final int keySize;

    private volatile PrivateKey privateKey;
    private volatile PublicKey publicKey;
    private volatile String publicKeyPem;

    public MasterKeyStore(Vertx vertx, Path keysDir, int keySize) {
        this.vertx = vertx;
        this.keysDir = keysDir;
        this.keySize = keySize;
    }

    /**
     * Reads the key pair, generating and storing a new one when none exists.
     */
    public Future<Void> load() {
        return vertx.<Void>executeBlocking(() -> {
            Path privFile = keysDir.resolve(PRIVATE_KEY_FILE);
            Path pubFile = keysDir.resolve(PUBLIC_KEY_FILE);
            if (Files.exists(privFile) && Files.exists(pubFile)) {
                String privPem = Files.readString(privFile, StandardCharsets.US_ASCII);
                String pubPem = Files.readString(pubFile, StandardCharsets.US_ASCII);
                install(KeyPairs.parsePrivateKey(privPem), KeyPairs.parsePublicKey(pubPem), pubPem);
                logger.info("Loaded master key pair from {}", keysDir);
                return null;
            }
            logger.info("No master key pair in {}, generating a {}-bit pair", keysDir, keySize);
            KeyPair pair = KeyPairs.generate(keySize);
            String privPem = KeyPairs.toPem(pair.getPrivate());
            String pubPem = KeyPairs.toPem(pair.getPublic());
            AtomicFiles.writeOwnerOnly(privFile, privPem.getBytes(StandardCharsets.US_ASCII));
            AtomicFiles.write(pubFile, pubPem.getBytes(StandardCharsets.US_ASCII));
            install(pair.getPrivate(), pair.getPublic(), pubPem);
            return null;
        }).onFailure(err -> logger.error("Failed to load master key pair from {}", keysDir, err));
    }

    private void install(PrivateKey priv, PublicKey pub, String pubPem) {
        this.privateKey = priv;
        this.publicKey = pub;
        this.publicKeyPem = pubPem;
    }

    public boolean isLoaded() {
        return privateKey != null;
    }

    public PrivateKey getPrivateKey() {
        return privateKey;
    }

    public PublicKey getPublicKey() {
        return publicKey;
    }

    public String getPublicKeyPem() {
        return publicKeyPem;
    }
}
