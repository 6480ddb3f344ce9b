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

package dev.mars.shardwarden.master.server;

import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live sessions by shard id. At most one per id.
 */
public class SessionRegistry {

    private final Map<String, ShardSession> sessions = new LinkedHashMap<>();

    void add(ShardSession session) {
        sessions.put(session.getShardId(), session);
    }

    /**
     * Removes the session unless the id has meanwhile been taken by another one.
     */
    boolean remove(ShardSession session) {
        return sessions.remove(session.getShardId(), session);
    }

    public ShardSession get(String shardId) {
        return sessions.get(shardId);
    }

    public boolean isConnected(String shardId) {
        return sessions.containsKey(shardId);
    }

    public Collection<ShardSession> all() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    public Future<Void> closeAll() {
        List<Future<Void>> closing = new ArrayList<>();
        for (ShardSession session : new ArrayList<>(sessions.values())) {
            closing.add(session.close((short) 1001, "Master shutting down"));
        }
        return Future.join(closing).mapEmpty();
    }
}
