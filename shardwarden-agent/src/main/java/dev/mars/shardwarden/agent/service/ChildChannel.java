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

import dev.mars.shardwarden.child.ChildMessage;
import io.vertx.core.Future;

/**
 * Write side of the pipe to the supervised child.
 */
public interface ChildChannel {

    boolean isRunning();

    /**
     * Writes one message to the child's stdin.
     *
     * @return fails with "Not Running" when there is no child
     */
    Future<Void> send(ChildMessage message);
}
