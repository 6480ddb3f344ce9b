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

package dev.mars.shardwarden.core.exceptions;

/**
 * Thrown when a connection attempt fails the handshake. The {@link Reason}
 * identifies which check rejected it; the message is safe to log.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class AuthenticationException extends ShardwardenException {

    /**
     * Handshake checks, in the order the master applies them.
     */
    public enum Reason {
        RATE_LIMITED("Too many connection attempts"),
        MALFORMED_HEADER("Malformed authorization header"),
        REGISTRY_NOT_LOADED("Shard registry not loaded"),
        UNKNOWN_ID("Unknown shard id"),
        DUPLICATE_CONNECTION("Shard is already connected"),
        TIMESTAMP_OUT_OF_RANGE("Timestamp outside allowed precision"),
        MASTER_KEY_UNAVAILABLE("Master key not loaded"),
        MISSING_PUBLIC_KEY("No public key on record"),
        BAD_SIGNATURE("Signature verification failed");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Reason reason;
    private final String shardId;

    public AuthenticationException(Reason reason, String shardId) {
        super(reason.getDescription() + (shardId != null ? " (" + shardId + ")" : ""));
        this.reason = reason;
        this.shardId = shardId;
    }

    public AuthenticationException(Reason reason, String shardId, Throwable cause) {
        super(reason.getDescription() + (shardId != null ? " (" + shardId + ")" : ""), cause);
        this.reason = reason;
        this.shardId = shardId;
    }

    public Reason getReason() {
        return reason;
    }

    public String getShardId() {
        return shardId;
    }
}
