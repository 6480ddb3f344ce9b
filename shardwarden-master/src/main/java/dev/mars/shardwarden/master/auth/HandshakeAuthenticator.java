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

import dev.mars.shardwarden.core.RegistryEntry;
import dev.mars.shardwarden.core.exceptions.AuthenticationException;
import dev.mars.shardwarden.core.exceptions.AuthenticationException.Reason;
import dev.mars.shardwarden.master.registry.ShardRegistry;
import dev.mars.shardwarden.security.AuthHeader;
import dev.mars.shardwarden.security.KeyPairs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.function.Predicate;

/**
 * Checks the {@code authorization} header of a WebSocket upgrade.
 *
 * <p>Checks run in a fixed order and the first failure wins: header syntax,
 * registry loaded, known id, no live connection for the id, timestamp within
 * {@code tsPrecisionMs} of the master clock, master key loaded, public key on
 * record, signature over {@code id + timestamp}. The rate limit is applied by
 * the server before this class is consulted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-07
 * @version 1.0
 */
public class HandshakeAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(HandshakeAuthenticator.class);

    private final ShardRegistry registry;
    private final MasterKeyStore masterKeys;
    private final Predicate<String> connected;

    public HandshakeAuthenticator(ShardRegistry registry, MasterKeyStore masterKeys, Predicate<String> connected) {
        this.registry = registry;
        this.masterKeys = masterKeys;
        this.connected = connected;
    }

    /**
     * Authenticates a handshake and stamps {@code lastSeen} on success.
     *
     * @param headerValue   raw header value, may be null
     * @param now           master clock in millis
     * @param tsPrecisionMs accepted distance between header timestamp and {@code now}
     * @return the authenticated registry entry
     * @throws AuthenticationException naming the first check that failed
     */
    public RegistryEntry authenticate(String headerValue, long now, long tsPrecisionMs)
            throws AuthenticationException {
        AuthHeader header = AuthHeader.parse(headerValue);
        String id = header.id();

        if (!registry.isLoaded()) {
            throw new AuthenticationException(Reason.REGISTRY_NOT_LOADED, id);
        }
        RegistryEntry entry = registry.get(id);
        if (entry == null) {
            throw new AuthenticationException(Reason.UNKNOWN_ID, id);
        }
        if (connected.test(id)) {
            throw new AuthenticationException(Reason.DUPLICATE_CONNECTION, id);
        }
        if (Math.abs(now - header.timestamp()) > tsPrecisionMs) {
            throw new AuthenticationException(Reason.TIMESTAMP_OUT_OF_RANGE, id);
        }
        if (!masterKeys.isLoaded()) {
            throw new AuthenticationException(Reason.MASTER_KEY_UNAVAILABLE, id);
        }
        String pem = entry.getPublicKey();
        if (pem == null || pem.isBlank()) {
            throw new AuthenticationException(Reason.MISSING_PUBLIC_KEY, id);
        }
        PublicKey key;
        try {
            key = KeyPairs.parsePublicKey(pem);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new AuthenticationException(Reason.BAD_SIGNATURE, id, e);
        }
        if (!header.verify(key)) {
            throw new AuthenticationException(Reason.BAD_SIGNATURE, id);
        }

        entry.setLastSeen(now);
        logger.debug("Shard {} authenticated", id);
        return entry;
    }
}
