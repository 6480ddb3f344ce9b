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

import dev.mars.shardwarden.core.HostAddress;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.KeyPair;

import static org.junit.jupiter.api.Assertions.*;

class ShardIdentityTest {

    @TempDir
    Path tempDir;

    @Test
    void writtenArtifactReadsBackAndYieldsUsableKeys() throws Exception {
        KeyPair shard = KeyPairs.generate(2048);
        KeyPair master = KeyPairs.generate(2048);
        ShardIdentity identity = new ShardIdentity("abc",
                KeyPairs.toPem(shard.getPublic()),
                KeyPairs.toPem(shard.getPrivate()),
                KeyPairs.toPem(master.getPublic()),
                new HostAddress("ws", "localhost", 8090, "/shardwarden"),
                KeyPairs.SIGN_ALGORITHM);

        Path file = tempDir.resolve(ShardIdentity.fileName("abc"));
        identity.write(file);

        assertTrue(Files.exists(file));
        assertFalse(Files.exists(tempDir.resolve(ShardIdentity.fileName("abc") + ".tmp")));
        ShardIdentity read = ShardIdentity.read(file);
        assertEquals(identity, read);
        assertTrue(AuthHeader.create("abc", read.privateKey(), 5L).verify(shard.getPublic()));
        assertArrayEquals(master.getPublic().getEncoded(), read.masterPublicKey().getEncoded());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void artifactIsOwnerOnlyEvenOverAStaleTempFile() throws Exception {
        KeyPair shard = KeyPairs.generate(2048);
        ShardIdentity identity = new ShardIdentity("abc",
                KeyPairs.toPem(shard.getPublic()),
                KeyPairs.toPem(shard.getPrivate()),
                KeyPairs.toPem(shard.getPublic()),
                new HostAddress("ws", "localhost", 8090, "/shardwarden"),
                KeyPairs.SIGN_ALGORITHM);
        Path file = tempDir.resolve(ShardIdentity.fileName("abc"));
        Path stale = tempDir.resolve(ShardIdentity.fileName("abc") + ".tmp");
        Files.writeString(stale, "left over");
        Files.setPosixFilePermissions(stale, PosixFilePermissions.fromString("rw-r--r--"));

        identity.write(file);

        assertEquals(PosixFilePermissions.fromString("rw-------"), Files.getPosixFilePermissions(file));
        assertFalse(Files.exists(stale));
    }

    @Test
    void fileNamePatternMatchesGeneratedNames() {
        assertTrue(ShardIdentity.FILE_NAME_PATTERN.matcher(ShardIdentity.fileName("qwe")).matches());
        assertFalse(ShardIdentity.FILE_NAME_PATTERN.matcher("shard_QWE_config.json").matches());
    }
}
