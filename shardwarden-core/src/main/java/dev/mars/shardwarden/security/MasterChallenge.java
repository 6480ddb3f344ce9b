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

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Proof the master sends back after accepting an agent, so the agent can tell
 * it is talking to the real master before trusting any directive.
 *
 * @param challenge the signed text
 * @param signature base64 signature of {@code challenge} with the master key
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public record MasterChallenge(String challenge, String signature) {

    static final String PREFIX = "shardwarden-master-challenge ";

    public static MasterChallenge create(PrivateKey masterKey, long now) throws GeneralSecurityException {
        String challenge = PREFIX + now;
        return new MasterChallenge(challenge, KeyPairs.sign(masterKey, challenge));
    }

    public boolean verify(PublicKey masterPublicKey) {
        return challenge != null && signature != null
                && KeyPairs.verify(masterPublicKey, challenge, signature);
    }
}
