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


package dev.mars.shardwarden.agent.service;

import dev.mars.shardwarden.core.exceptions.FileRelayException;
import dev.mars.shardwarden.core.io.AtomicFiles;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Base64;

/**
 * Files the master pushes to or pulls from the project directory. Paths are
 * relative to the project root and may not leave it, neither lexically nor
 * through a symbolic link.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-12
 * @version 1.0
 */
public class ProjectFiles {

    private final Vertx vertx;
    private final Path root;

    public ProjectFiles(Vertx vertx, Path root) {
        this.vertx = vertx;
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Resolves a relayed path against the project root.
     *
     * @throws FileRelayException if the path is empty, malformed or outside
     *                            the project directory
     */
    public Path resolve(String path) throws FileRelayException {
        if (path == null || path.isBlank()) {
            throw new FileRelayException(path, "path is empty");
        }
        Path resolved;
        try {
            resolved = root.resolve(path).normalize();
        } catch (InvalidPathException e) {
            throw new FileRelayException(path, "invalid path", e);
        }
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new FileRelayException(path, "outside of project directory");
        }
        return resolved;
    }

    /**
     * Resolves a relayed path and checks that its deepest existing ancestor,
     * with symbolic links followed, is still inside the project directory.
     * Blocks on file system access.
     */
    Path resolveReal(String path) throws FileRelayException {
        Path resolved = resolve(path);
        Path existing = resolved;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null || !Files.exists(root)) {
            return resolved;
        }
        try {
            if (!existing.toRealPath().startsWith(root.toRealPath())) {
                throw new FileRelayException(path, "outside of project directory");
            }
        } catch (IOException e) {
            throw new FileRelayException(path, "unable to resolve: " + e.getMessage(), e);
        }
        return resolved;
    }

    /**
     * Replaces a file with base64 encoded content, creating missing
     * directories. The file is written to a temporary sibling and renamed.
     */
    public Future<Void> write(String path, String base64) {
        return vertx.executeBlocking(() -> {
            Path target = resolveReal(path);
            byte[] data;
            try {
                data = Base64.getDecoder().decode(base64 == null ? "" : base64);
            } catch (IllegalArgumentException e) {
                throw new FileRelayException(path, "data is not base64", e);
            }
            try {
                AtomicFiles.write(target, data);
            } catch (IOException e) {
                throw new FileRelayException(path, e.getMessage(), e);
            }
            return null;
        });
    }

    public Future<byte[]> read(String path) {
        return vertx.executeBlocking(() -> {
            Path source = resolveReal(path);
            try {
                return Files.readAllBytes(source);
            } catch (IOException e) {
                throw new FileRelayException(path, "unable to read: " + e.getMessage(), e);
            }
        });
    }
}
