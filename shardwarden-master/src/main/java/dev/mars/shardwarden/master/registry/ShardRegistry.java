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

package dev.mars.shardwarden.master.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.shardwarden.core.RegistryEntry;
import dev.mars.shardwarden.core.RegistryRecord;
import dev.mars.shardwarden.core.io.AtomicFiles;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The orchestrator's set of known identities, keyed by id.
 *
 * <p>The map is owned by the event loop. Loading and saving read or write the
 * registry file on a worker thread; saving writes a temporary file and renames
 * it over the old one. Only the persisted subset of each entry
 * ({@link RegistryRecord}) goes to disk.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class ShardRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ShardRegistry.class);

    private static final int ID_LENGTH = 3;
    private static final int MAX_ID_ATTEMPTS = 10_000;
    private static final TypeReference<LinkedHashMap<String, RegistryRecord>> RECORDS_TYPE = new TypeReference<>() {
    };

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Vertx vertx;
    private final Path file;
    private final SecureRandom random = new SecureRandom();

    private final Map<String, RegistryEntry> entries = new LinkedHashMap<>();
    private final Set<String> reservedIds = new HashSet<>();
    private boolean loaded;
    private boolean dirty;
    private Future<Void> lastSave = Future.succeededFuture();
    private volatile long knownModified = -1;

    public ShardRegistry(Vertx vertx, Path file) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.file = Objects.requireNonNull(file, "file");
    }

    /**
     * Loads the registry file. A missing file yields an empty registry; an
     * unreadable one fails the future and leaves the registry unloaded.
     */
    public Future<Void> load() {
        return vertx.executeBlocking(this::readRecords)
                .onSuccess(records -> {
                    long now = System.currentTimeMillis();
                    entries.clear();
                    records.forEach((id, record) -> entries.put(id, restored(id, record, now)));
                    loaded = true;
                    logger.info("Loaded {} known shards from {}", entries.size(), file);
                })
                .onFailure(err -> logger.error("Failed to load shard registry from {}", file, err))
                .mapEmpty();
    }

    /**
     * Re-reads the file after an external edit. Entries that still exist keep
     * their runtime state (last seen, heartbeat, stats); identity and goal come
     * from the file.
     *
     * @return ids that were removed from the file
     */
    public Future<List<String>> reload() {
        return vertx.executeBlocking(this::readRecords)
                .map(records -> {
                    List<String> removed = new ArrayList<>();
                    for (String id : new ArrayList<>(entries.keySet())) {
                        if (!records.containsKey(id)) {
                            entries.remove(id);
                            removed.add(id);
                        }
                    }
                    records.forEach((id, record) -> {
                        RegistryEntry existing = entries.get(id);
                        if (existing == null) {
                            entries.put(id, restored(id, record, System.currentTimeMillis()));
                        } else {
                            existing.setPublicKey(record.publicKey());
                            existing.setMaster(record.master());
                            existing.setGoalShardId(record.goalShardId());
                            existing.setGoalShardCount(record.goalShardCount());
                        }
                    });
                    loaded = true;
                    logger.info("Reloaded shard registry: {} known, {} removed", entries.size(), removed.size());
                    return removed;
                });
    }

    /**
     * Reloads the file if it was modified by anyone but this registry since the
     * last load or save.
     *
     * @return whether a reload happened
     */
    public Future<Boolean> reloadIfModified() {
        return lastSave
                .transform(ignored -> vertx.executeBlocking(() -> lastModified() != knownModified))
                .compose(modified -> modified ? reload().map(true) : Future.succeededFuture(false));
    }

    /**
     * Writes the persisted subset of every entry. Saves are chained so two
     * writes never race on the temporary file. The dirty flag is cleared only
     * when the write succeeds.
     */
    public Future<Void> save() {
        Map<String, RegistryRecord> snapshot = new LinkedHashMap<>();
        entries.forEach((id, entry) -> snapshot.put(id, entry.toRecord()));
        dirty = false;
        Future<Void> next = lastSave
                .transform(ignored -> vertx.executeBlocking(() -> {
                    AtomicFiles.write(file, objectMapper.writeValueAsBytes(snapshot));
                    knownModified = lastModified();
                    return null;
                }));
        lastSave = next.<Void>mapEmpty()
                .onSuccess(v -> logger.debug("Saved {} shards to {}", snapshot.size(), file))
                .onFailure(err -> {
                    dirty = true;
                    logger.error("Failed to save shard registry to {}: {}", file, err.getMessage());
                });
        return lastSave;
    }

    public boolean isLoaded() {
        return loaded;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markDirty() {
        dirty = true;
    }

    public RegistryEntry get(String id) {
        return entries.get(id);
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    public Collection<RegistryEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public void put(RegistryEntry entry) {
        entries.put(entry.getId(), entry);
        reservedIds.remove(entry.getId());
        dirty = true;
    }

    public RegistryEntry remove(String id) {
        RegistryEntry removed = entries.remove(id);
        if (removed != null) {
            dirty = true;
        }
        return removed;
    }

    /**
     * Picks an unused id of three random lowercase letters and reserves it
     * until {@link #put} or {@link #release} is called.
     *
     * @throws IllegalStateException if no free id could be found
     */
    public String reserveId() {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            StringBuilder sb = new StringBuilder(ID_LENGTH);
            for (int i = 0; i < ID_LENGTH; i++) {
                sb.append((char) ('a' + random.nextInt(26)));
            }
            String id = sb.toString();
            if (!entries.containsKey(id) && reservedIds.add(id)) {
                return id;
            }
        }
        throw new IllegalStateException("No free shard id left");
    }

    public void release(String id) {
        reservedIds.remove(id);
    }

    public Path getFile() {
        return file;
    }

    /**
     * Entries read from disk get a fresh boot time so that assigned shards have
     * a full grace period to reconnect before they are declared dead.
     */
    private static RegistryEntry restored(String id, RegistryRecord record, long now) {
        RegistryEntry entry = RegistryEntry.fromRecord(withId(id, record));
        if (entry.getGoalShardId() >= 0) {
            entry.setBootTime(now);
        }
        return entry;
    }

    private long lastModified() throws IOException {
        try {
            return Files.getLastModifiedTime(file).toMillis();
        } catch (NoSuchFileException e) {
            return -1;
        }
    }

    private Map<String, RegistryRecord> readRecords() throws IOException {
        knownModified = lastModified();
        try {
            byte[] raw = Files.readAllBytes(file);
            if (raw.length == 0) {
                return new LinkedHashMap<>();
            }
            Map<String, RegistryRecord> records = objectMapper.readValue(raw, RECORDS_TYPE);
            return records == null ? new LinkedHashMap<>() : records;
        } catch (NoSuchFileException e) {
            return new LinkedHashMap<>();
        }
    }

    private static RegistryRecord withId(String id, RegistryRecord record) {
        if (id.equals(record.id())) {
            return record;
        }
        return new RegistryRecord(id, record.publicKey(), record.master(),
                record.goalShardId(), record.goalShardCount());
    }
}
