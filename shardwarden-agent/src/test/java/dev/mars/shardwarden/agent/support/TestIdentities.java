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


package dev.mars.shardwarden.agent.support;

import dev.mars.shardwarden.core.HostAddress;
import dev.mars.shardwarden.security.KeyPairs;
import dev.mars.shardwarden.security.ShardIdentity;

import java.security.KeyPair;

/**
 * Key pairs shared by the agent tests. 2048-bit keys keep generation fast.
 */
public final class TestIdentities {

    public static final KeyPair SHARD_KEYS = generate();
    public static final KeyPair MASTER_KEYS = generate();
    public static final KeyPair OTHER_KEYS = generate();

    private TestIdentities() {
    }

    public static ShardIdentity identity(String id, int port) {
        return new ShardIdentity(
                id,
                KeyPairs.toPem(SHARD_KEYS.getPublic()),
                KeyPairs.toPem(SHARD_KEYS.getPrivate()),
                KeyPairs.toPem(MASTER_KEYS.getPublic()),
                new HostAddress("ws", "127.0.0.1", port, "/shardwarden"),
                KeyPairs.SIGN_ALGORITHM);
    }

    private static KeyPair generate() {
        try {
            return KeyPairs.generate(2048);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
