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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * How operators are told about new identities. The message is written to the
 * command's stdin; {@code %ATTACHMENT%} in the arguments is replaced by the
 * artifact path.
 *
 * <p>Templates understand {@code {date}}, {@code {id}}, {@code {pubkey}} and
 * {@code {errors}}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MailSettings(
        boolean enabled,
        String command,
        List<String> args,
        List<String> failArgs,
        String createMessage,
        String createFailMessage) {

    public static final String ATTACHMENT_PLACEHOLDER = "%ATTACHMENT%";

    public MailSettings {
        args = args == null ? List.of() : List.copyOf(args);
        failArgs = failArgs == null ? List.of() : List.copyOf(failArgs);
    }

    public static MailSettings disabled() {
        return new MailSettings(false, "mail", List.of(), List.of(),
                "Shard {id} was created at {date}.\n\nPublic key:\n{pubkey}\n",
                "Creating shard {id} failed at {date}.\n\n{errors}\n");
    }
}
