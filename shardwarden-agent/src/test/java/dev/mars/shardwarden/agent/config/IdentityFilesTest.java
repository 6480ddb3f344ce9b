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

import dev.mars.shardwarden.agent.support.TestIdentities;
import dev.mars.shardwarden.security.ShardIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class IdentityFilesTest {

    @TempDir
    Path dir;

    private AgentConfig configFor(String key, String value) {
        Properties props = new Properties();
        props.setProperty(key, value);
        return AgentConfig.of(props);
    }

    @Test
    void loadsTheOnlyArtifactInTheDirectory() throws Exception {
        TestIdentities.identity("abc", 8090).write(dir.resolve(ShardIdentity.fileName("abc")));
        Files.writeString(dir.resolve("notes.txt"), "not an identity");

        ShardIdentity loaded = IdentityFiles.load(configFor("shardwarden.agent.identity-dir", dir.toString()));

        assertEquals("abc", loaded.id());
        assertEquals(8090, loaded.host().port());
    }

    @Test
    void explicitFileWins() throws Exception {
        Path file = dir.resolve("custom.json");
        TestIdentities.identity("xyz", 9000).write(file);

        ShardIdentity loaded = IdentityFiles.load(configFor("shardwarden.agent.identity-file", file.toString()));

        assertEquals("xyz", loaded.id());
    }

    @Test
    void emptyDirectoryFailsBoot() {
        NoSuchFileException e = assertThrows(NoSuchFileException.class, () -> IdentityFiles.locate(dir));
        assertTrue(e.getMessage().contains("Failed to find shard config file"));
    }

    @Test
    void severalArtifactsAreAmbiguous() throws Exception {
        TestIdentities.identity("abc", 8090).write(dir.resolve(ShardIdentity.fileName("abc")));
        TestIdentities.identity("def", 8090).write(dir.resolve(ShardIdentity.fileName("def")));

        IOException e = assertThrows(IOException.class, () -> IdentityFiles.locate(dir));
        assertTrue(e.getMessage().contains("identity-file"));
    }

    @Test
    void artifactWithoutKeysIsRejected() throws Exception {
        Path file = dir.resolve(ShardIdentity.fileName("abc"));
        Files.writeString(file, "{\"id\": \"abc\"}");

        assertThrows(IOException.class,
                () -> IdentityFiles.load(configFor("shardwarden.agent.identity-file", file.toString())));
    }
}
