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


package dev.mars.shardwarden.agent.config;

import dev.mars.shardwarden.security.ShardIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds and reads the identity artifact an agent boots with.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-11
 * @version 1.0
 */
public final class IdentityFiles {

    private static final Logger logger = LoggerFactory.getLogger(IdentityFiles.class);

    private IdentityFiles() {
    }

    /**
     * Loads the configured artifact, or the single {@code shard_<id>_config.json}
     * found in the identity directory.
     *
     * @throws IOException if no artifact exists, several candidates exist or the
     *                     file cannot be parsed
     */
    public static ShardIdentity load(AgentConfig config) throws IOException {
        Path file = config.getIdentityFile().isEmpty()
                ? locate(config.getIdentityDir())
                : Paths.get(config.getIdentityFile());
        ShardIdentity identity = ShardIdentity.read(file);
        if (identity.id() == null || identity.privKey() == null || identity.host() == null) {
            throw new IOException("Shard config " + file + " is missing id, privKey or host");
        }
        logger.info("Loaded identity {} from {}", identity.id(), file);
        return identity;
    }

    static Path locate(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new NoSuchFileException(dir.toString(), null, "Identity directory does not exist");
        }
        List<Path> candidates;
        try (Stream<Path> files = Files.list(dir)) {
            candidates = files
                    .filter(p -> ShardIdentity.FILE_NAME_PATTERN.matcher(p.getFileName().toString()).matches())
                    .sorted()
                    .collect(Collectors.toList());
        }
        if (candidates.isEmpty()) {
            throw new NoSuchFileException(dir.toString(), null,
                    "Failed to find shard config file required for boot");
        }
        if (candidates.size() > 1) {
            throw new IOException("Found " + candidates.size() + " shard config files in " + dir
                    + ", set shardwarden.agent.identity-file to pick one: " + candidates);
        }
        return candidates.get(0);
    }
}
