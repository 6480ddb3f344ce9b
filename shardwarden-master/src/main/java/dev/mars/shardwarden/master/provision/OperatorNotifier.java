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

package dev.mars.shardwarden.master.provision;

import dev.mars.shardwarden.security.ShardIdentity;

import java.nio.file.Path;

/**
 * Tells operators that an identity artifact needs to be deployed, or that
 * creating one failed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public interface OperatorNotifier {

    void identityCreated(ShardIdentity identity, Path artifact);

    void identityFailed(String summary, Throwable cause);
}
