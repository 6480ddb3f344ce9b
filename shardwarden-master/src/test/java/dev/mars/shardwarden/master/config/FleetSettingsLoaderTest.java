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

import dev.mars.shardwarden.core.HeartbeatSettings;
import dev.mars.shardwarden.core.HeartbeatStyle;
import dev.mars.shardwarden.core.exceptions.ConfigParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FleetSettingsLoader}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
class FleetSettingsLoaderTest {

    @TempDir
    Path tempDir;

    private static FleetSettings parse(String json) throws ConfigParseException {
        return FleetSettingsLoader.parse(Path.of("fleet.json"), json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void missingFileYieldsDefaults() throws Exception {
        assertEquals(FleetSettings.defaults(), FleetSettingsLoader.load(tempDir.resolve("absent.json")));
    }

    @Test
    void emptyObjectYieldsDefaults() throws Exception {
        assertEquals(FleetSettings.defaults(), parse("{}"));
    }

    @Test
    void nestedOverridesKeepSiblingDefaults() throws Exception {
        FleetSettings settings = parse("""
                {
                  "numShards": 4,
                  "heartbeat": {"updateStyle": "push", "intervalMs": 2000},
                  "mail": {"enabled": true, "args": ["-s", "New shard", "%ATTACHMENT%"]}
                }
                """);

        assertEquals(4, settings.numShards());
        HeartbeatSettings heartbeat = settings.heartbeat();
        assertEquals(HeartbeatStyle.PUSH, heartbeat.updateStyle());
        assertEquals(2000, heartbeat.intervalMs());
        assertEquals(HeartbeatSettings.defaults().assumeDeadAfterMs(), heartbeat.assumeDeadAfterMs());
        assertTrue(settings.mail().enabled());
        assertEquals(List.of("-s", "New shard", "%ATTACHMENT%"), settings.mail().args());
        assertEquals(MailSettings.disabled().createMessage(), settings.mail().createMessage());
        assertEquals(FleetSettings.defaults().remoteHost(), settings.remoteHost());
    }

    @Test
    void loadReadsFile() throws Exception {
        Path file = tempDir.resolve("fleet.json");
        Files.writeString(file, "{\"numShards\": 7, \"keySize\": 2048}");

        FleetSettings settings = FleetSettingsLoader.load(file);

        assertEquals(7, settings.numShards());
        assertEquals(2048, settings.keySize());
    }

    @Test
    void malformedJsonIsRejectedNamingTheFile() {
        ConfigParseException e = assertThrows(ConfigParseException.class, () -> parse("{\"numShards\": "));
        assertTrue(e.getMessage().contains("fleet.json"), e.getMessage());
    }

    @Test
    void nonObjectRootIsRejected() {
        assertThrows(ConfigParseException.class, () -> parse("[1, 2]"));
    }

    @Test
    void unknownHeartbeatStyleIsRejected() {
        assertThrows(ConfigParseException.class, () -> parse("{\"heartbeat\": {\"updateStyle\": \"carrier-pigeon\"}}"));
    }

    @Test
    void validationErrorsAreReportedTogether() {
        ConfigParseException e = assertThrows(ConfigParseException.class,
                () -> parse("{\"numShards\": -1, \"connCount\": 0}"));

        assertTrue(e.getMessage().contains("numShards"), e.getMessage());
        assertTrue(e.getMessage().contains("connCount"), e.getMessage());
    }

    @Test
    void rebootThresholdsMustBeOrdered() {
        assertThrows(ConfigParseException.class,
                () -> parse("{\"heartbeat\": {\"requestRebootAfterMs\": 100000, \"expectRebootAfterMs\": 90000}}"));
    }

    @Test
    void autoDetectNeedsRecommendationUrl() {
        assertThrows(ConfigParseException.class, () -> parse("{\"autoDetectNumShards\": true}"));
    }

    @Test
    void diffNamesChangedTopLevelFields() throws Exception {
        FleetSettings before = parse("{}");
        FleetSettings after = parse("{\"numShards\": 3, \"heartbeat\": {\"intervalMs\": 1000}}");

        assertEquals(List.of("numShards", "heartbeat"), FleetSettingsLoader.diff(before, after));
        assertTrue(FleetSettingsLoader.diff(before, parse("{}")).isEmpty());
    }
}
