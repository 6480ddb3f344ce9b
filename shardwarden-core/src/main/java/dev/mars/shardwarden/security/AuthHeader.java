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

import dev.mars.shardwarden.core.exceptions.AuthenticationException;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * The {@code authorization} header an agent presents when it opens its
 * WebSocket: {@code "<id>,<base64 signature>,<unix millis>"}. The signed text
 * is the id immediately followed by the decimal timestamp.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public record AuthHeader(String id, String signature, long timestamp) {

    public static final String HEADER_NAME = "authorization";

    /**
     * Creates a freshly signed header for the given identity.
     */
    public static AuthHeader create(String id, PrivateKey key, long now) throws GeneralSecurityException {
        return new AuthHeader(id, KeyPairs.sign(key, signedText(id, now)), now);
    }

    /**
     * Parses a raw header value.
     *
     * @param value the header, may be null
     * @return the parsed header
     * @throws AuthenticationException with reason MALFORMED_HEADER if the value
     *                                 is absent or not three comma separated parts
     */
    public static AuthHeader parse(String value) throws AuthenticationException {
        if (value == null || value.isBlank()) {
            throw new AuthenticationException(AuthenticationException.Reason.MALFORMED_HEADER, null);
        }
        String[] parts = value.split(",", -1);
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new AuthenticationException(AuthenticationException.Reason.MALFORMED_HEADER, null);
        }
        try {
            return new AuthHeader(parts[0].trim(), parts[1].trim(), Long.parseLong(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new AuthenticationException(AuthenticationException.Reason.MALFORMED_HEADER, parts[0], e);
        }
    }

    public String encode() {
        return id + "," + signature + "," + timestamp;
    }

    public boolean verify(PublicKey key) {
        return KeyPairs.verify(key, signedText(id, timestamp), signature);
    }

    static String signedText(String id, long timestamp) {
        return id + timestamp;
    }
}
