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

package dev.mars.shardwarden.security;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.shardwarden.core.HostAddress;
import dev.mars.shardwarden.core.io.AtomicFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.regex.Pattern;

/**
 * The artifact handed to an operator when a new identity is minted. It is
 * everything an agent needs to authenticate: its own key pair, the master's
 * public key and where the master listens.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ShardIdentity(
        String id,
        String pubKey,
        String privKey,
        String masterPubKey,
        HostAddress host,
        String signAlgorithm) {

    public static final Pattern FILE_NAME_PATTERN = Pattern.compile("shard_([a-z]+)_config\\.json");

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static String fileName(String id) {
        return "shard_" + id + "_config.json";
    }

    public static ShardIdentity read(Path file) throws IOException {
        return objectMapper.readValue(Files.readAllBytes(file), ShardIdentity.class);
    }

    /**
     * Writes the artifact atomically, readable by its owner only, since it
     * carries a private key.
     */
    public void write(Path file) throws IOException {
        AtomicFiles.writeOwnerOnly(file, objectMapper.writeValueAsBytes(this));
    }

    public PrivateKey privateKey() throws GeneralSecurityException {
        return KeyPairs.parsePrivateKey(privKey);
    }

    public PublicKey masterPublicKey() throws GeneralSecurityException {
        return KeyPairs.parsePublicKey(masterPubKey);
    }
}
