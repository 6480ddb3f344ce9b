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

package dev.mars.shardwarden.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * How an agent starts its child: the executable, arguments inserted right after
 * it (runtime flags), application arguments, and extra arguments for the
 * master-role child.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LaunchSettings(
        List<String> command,
        List<String> runtimeArgs,
        List<String> appArgs,
        List<String> masterArgs) {

    public LaunchSettings {
        command = command == null ? List.of() : List.copyOf(command);
        runtimeArgs = runtimeArgs == null ? List.of() : List.copyOf(runtimeArgs);
        appArgs = appArgs == null ? List.of() : List.copyOf(appArgs);
        masterArgs = masterArgs == null ? List.of() : List.copyOf(masterArgs);
    }

    public static LaunchSettings empty() {
        return new LaunchSettings(List.of(), List.of(), List.of(), List.of());
    }

    /**
     * Builds the full command line.
     *
     * @param master whether the child runs the master role
     * @return executable followed by runtime, application and role arguments
     */
    public List<String> commandLine(boolean master) {
        if (command.isEmpty()) {
            return List.of();
        }
        List<String> line = new ArrayList<>();
        line.add(command.get(0));
        line.addAll(runtimeArgs);
        line.addAll(command.subList(1, command.size()));
        line.addAll(appArgs);
        if (master) {
            line.addAll(masterArgs);
        }
        return line;
    }
}
