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

package dev.mars.shardwarden.child;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Environment variables an agent sets for its child, and their parsed view
 * inside the child.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public record ChildEnvironment(
        boolean managed,
        boolean master,
        String name,
        int shardId,
        int shardCount,
        String application) {

    public static final String MANAGED = "SHARDWARDEN_MANAGED";
    public static final String ROLE = "SHARDWARDEN_ROLE";
    public static final String NAME = "SHARDWARDEN_NAME";
    public static final String SHARD_ID = "SHARDWARDEN_SHARD_ID";
    public static final String SHARD_COUNT = "SHARDWARDEN_SHARD_COUNT";
    public static final String APPLICATION = "SHARDWARDEN_APPLICATION";

    public static final String ROLE_MASTER = "master";
    public static final String ROLE_WORKER = "worker";

    public Map<String, String> toEnvironment() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put(MANAGED, Boolean.toString(managed));
        env.put(ROLE, master ? ROLE_MASTER : ROLE_WORKER);
        env.put(NAME, name);
        env.put(SHARD_ID, Integer.toString(shardId));
        env.put(SHARD_COUNT, Integer.toString(shardCount));
        if (application != null) {
            env.put(APPLICATION, application);
        }
        return env;
    }

    public static ChildEnvironment fromEnvironment(Map<String, String> env) {
        return new ChildEnvironment(
                Boolean.parseBoolean(env.get(MANAGED)),
                ROLE_MASTER.equals(env.get(ROLE)),
                env.get(NAME),
                parseInt(env.get(SHARD_ID), -1),
                parseInt(env.get(SHARD_COUNT), 0),
                env.get(APPLICATION));
    }

    public static ChildEnvironment current() {
        return fromEnvironment(System.getenv());
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
