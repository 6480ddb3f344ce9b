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

package dev.mars.shardwarden.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Where an agent reaches the master.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HostAddress(String protocol, String host, int port, String path) {

    public HostAddress {
        protocol = protocol == null ? "ws" : protocol;
        path = path == null || path.isEmpty() ? "/" : path;
    }

    @JsonIgnore
    public boolean isSecure() {
        return "wss".equalsIgnoreCase(protocol);
    }

    @Override
    public String toString() {
        return protocol + "://" + host + ":" + port + path;
    }
}
