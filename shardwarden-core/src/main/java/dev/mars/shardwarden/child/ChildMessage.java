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

package dev.mars.shardwarden.child;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Messages between an agent and its child process, one JSON object per line
 * on the child's stdin (agent to child) and stdout (child to agent).
 *
 * <p>Requests are correlated by their text: an evaluation result names the
 * script it answers and a query result the query.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ChildMessage.Eval.class, name = "eval"),
        @JsonSubTypes.Type(value = ChildMessage.EvalResult.class, name = "evalResult"),
        @JsonSubTypes.Type(value = ChildMessage.StatsRequest.class, name = "statsRequest"),
        @JsonSubTypes.Type(value = ChildMessage.Stats.class, name = "stats"),
        @JsonSubTypes.Type(value = ChildMessage.Lifecycle.class, name = "lifecycle"),
        @JsonSubTypes.Type(value = ChildMessage.Reboot.class, name = "reboot"),
        @JsonSubTypes.Type(value = ChildMessage.BroadcastEval.class, name = "broadcastEval"),
        @JsonSubTypes.Type(value = ChildMessage.BroadcastEvalResult.class, name = "broadcastEvalResult"),
        @JsonSubTypes.Type(value = ChildMessage.RespawnAll.class, name = "respawnAll"),
        @JsonSubTypes.Type(value = ChildMessage.RespawnAllResult.class, name = "respawnAllResult"),
        @JsonSubTypes.Type(value = ChildMessage.Sql.class, name = "sql"),
        @JsonSubTypes.Type(value = ChildMessage.SqlResult.class, name = "sqlResult")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface ChildMessage {

    // agent → child

    record Eval(String script) implements ChildMessage {
    }

    record StatsRequest() implements ChildMessage {
    }

    record BroadcastEvalResult(String script, JsonNode result, String error) implements ChildMessage {
    }

    record RespawnAllResult(String error) implements ChildMessage {
    }

    record SqlResult(String query, JsonNode result, String error) implements ChildMessage {
    }

    // child → agent

    record EvalResult(String script, JsonNode result, String error) implements ChildMessage {
    }

    record Stats(ChildStats stats) implements ChildMessage {
    }

    /** Informational state change of the application, e.g. READY. */
    record Lifecycle(String state) implements ChildMessage {
    }

    /** The application asks to be restarted. */
    record Reboot(String reason) implements ChildMessage {
    }

    record BroadcastEval(String script) implements ChildMessage {
    }

    record RespawnAll() implements ChildMessage {
    }

    record Sql(String query) implements ChildMessage {
    }
}
