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

import java.nio.file.Path;

/**
 * Raised when a configuration document cannot be read, parsed or validated.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ConfigParseException extends ShardwardenException {

    private final Path source;

    public ConfigParseException(Path source, String message) {
        super(message);
        this.source = source;
    }

    public ConfigParseException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }

    @Override
    public String getMessage() {
        return source == null ? super.getMessage()
                : String.format("Invalid configuration in %s: %s", source, super.getMessage());
    }
}
