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

package dev.mars.shardwarden.master.command;

import com.fasterxml.jackson.databind.JsonNode;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SqlProxyService} against a SQLite file.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
class SqlProxyServiceTest {

    @TempDir
    Path tempDir;

    private SqlProxyService sqlite(Vertx vertx) {
        return new SqlProxyService(vertx, "jdbc:sqlite:" + tempDir.resolve("fleet.db"), "", "");
    }

    @Test
    void rowsComeBackKeyedByColumnLabel(Vertx vertx, VertxTestContext testContext) {
        SqlProxyService sql = sqlite(vertx);

        sql.query("CREATE TABLE guilds (id INTEGER PRIMARY KEY, name TEXT)")
                .compose(v -> sql.query("INSERT INTO guilds (id, name) VALUES (1, 'alpha'), (2, 'beta')"))
                .compose(inserted -> {
                    assertEquals(2, inserted.get("updateCount").asInt());
                    return sql.query("SELECT id, name AS label FROM guilds ORDER BY id");
                })
                .onComplete(testContext.succeeding(rows -> testContext.verify(() -> {
                    assertTrue(rows.isArray());
                    assertEquals(2, rows.size());
                    JsonNode first = rows.get(0);
                    assertEquals(1, first.get("id").asInt());
                    assertEquals("alpha", first.get("label").asText());
                    sql.close().onComplete(testContext.succeedingThenComplete());
                })));
    }

    @Test
    void badStatementFailsWithoutBreakingLaterQueries(Vertx vertx, VertxTestContext testContext) {
        SqlProxyService sql = sqlite(vertx);

        sql.query("SELEKT nonsense")
                .transform(ar -> {
                    assertTrue(ar.failed());
                    return sql.query("SELECT 1 AS one");
                })
                .onComplete(testContext.succeeding(rows -> testContext.verify(() -> {
                    assertEquals(1, rows.get(0).get("one").asInt());
                    testContext.completeNow();
                })));
    }

    @Test
    void disabledProxyReportsNoConnection(Vertx vertx, VertxTestContext testContext) {
        SqlProxyService sql = new SqlProxyService(vertx, "", "", "");
        assertFalse(sql.isEnabled());

        sql.query("SELECT 1").onComplete(testContext.failing(err -> testContext.verify(() -> {
            assertEquals(SqlProxyService.NO_CONNECTION, err.getMessage());
            testContext.completeNow();
        })));
    }
}
