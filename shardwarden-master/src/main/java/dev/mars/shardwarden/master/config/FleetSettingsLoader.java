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

package dev.mars.shardwarden.master.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.shardwarden.core.exceptions.ConfigParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads fleet settings. Anything the file leaves out keeps its default, so a
 * file holding only {@code {"numShards": 4}} is complete.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public final class FleetSettingsLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private FleetSettingsLoader() {
    }

    /**
     * Loads and validates the file. Blocking.
     *
     * @param file the settings file; a missing file yields the defaults
     * @return the merged settings
     * @throws ConfigParseException if the file cannot be parsed or fails validation
     */
    public static FleetSettings load(Path file) throws ConfigParseException {
        byte[] raw;
        try {
            raw = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return FleetSettings.defaults();
        } catch (IOException e) {
            throw new ConfigParseException(file, "cannot read file", e);
        }
        return parse(file, raw);
    }

    public static FleetSettings parse(Path source, byte[] raw) throws ConfigParseException {
        FleetSettings settings;
        try {
            JsonNode overrides = objectMapper.readTree(raw);
            if (overrides == null || !overrides.isObject()) {
                throw new ConfigParseException(source, "root must be a JSON object");
            }
            ObjectNode merged = objectMapper.valueToTree(FleetSettings.defaults());
            merge(merged, (ObjectNode) overrides);
            settings = objectMapper.treeToValue(merged, FleetSettings.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigParseException(source, e.getMessage(), e);
        }
        List<String> errors = settings.validate();
        if (!errors.isEmpty()) {
            throw new ConfigParseException(source, String.join("; ", errors));
        }
        return settings;
    }

    /**
     * Names the top-level fields whose values differ.
     */
    public static List<String> diff(FleetSettings previous, FleetSettings current) {
        JsonNode before = objectMapper.valueToTree(previous);
        JsonNode after = objectMapper.valueToTree(current);
        List<String> changed = new ArrayList<>();
        Iterator<String> names = after.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!after.get(name).equals(before.get(name))) {
                changed.add(name);
            }
        }
        return changed;
    }

    private static void merge(ObjectNode target, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                merge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
