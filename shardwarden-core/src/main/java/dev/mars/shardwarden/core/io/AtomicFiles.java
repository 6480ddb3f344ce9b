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

package dev.mars.shardwarden.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.EnumSet;
import java.util.Set;

/**
 * Write-temp-then-rename helpers. Readers of the target never observe a
 * partially written file.
 *
 * <p>All methods block and must be called off the event loop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public final class AtomicFiles {

    private static final Logger logger = LoggerFactory.getLogger(AtomicFiles.class);

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private AtomicFiles() {
    }

    /**
     * Atomically replaces {@code target} with {@code data}.
     *
     * @param target the file to replace
     * @param data   the full new content
     * @throws IOException if the temporary file cannot be written or moved
     */
    public static void write(Path target, byte[] data) throws IOException {
        write(target, data, new FileAttribute<?>[0]);
    }

    /**
     * Like {@link #write(Path, byte[])}, but the temporary file is created
     * readable and writable by its owner only, where the file system supports
     * POSIX permissions. The content is never visible to other users, not
     * even before the rename.
     */
    public static void writeOwnerOnly(Path target, byte[] data) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            write(target, data, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
        } else {
            write(target, data);
        }
    }

    private static void write(Path target, byte[] data, FileAttribute<?>... attributes) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");

        // Step 1: write and fsync a fresh temp file; attributes only apply on creation
        Files.deleteIfExists(tmp);
        try (FileChannel ch = FileChannel.open(tmp,
                EnumSet.of(StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE), attributes)) {
            ByteBuffer buf = ByteBuffer.wrap(data);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
        }

        // Step 2: rename over the target
        try {
            Files.move(tmp, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
