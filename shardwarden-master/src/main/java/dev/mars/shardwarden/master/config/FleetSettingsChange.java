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

import java.util.List;

/**
 * Published when the fleet settings file was reloaded with new content.
 *
 * @param previous the settings in effect before
 * @param current  the newly loaded settings
 * @param changed  names of the top-level fields that differ
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public record FleetSettingsChange(FleetSettings previous, FleetSettings current, List<String> changed) {

    public boolean touches(String field) {
        return changed.contains(field);
    }
}
