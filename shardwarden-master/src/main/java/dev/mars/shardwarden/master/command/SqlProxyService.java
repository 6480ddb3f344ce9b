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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Runs queries on behalf of shards against the master's database.
 *
 * <p>A single JDBC connection is opened lazily and used from one dedicated
 * worker thread, so queries execute one at a time in arrival order. Row
 * results come back as an array of objects keyed by column label; other
 * statements as {@code {"updateCount": n}}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-09
 * @version 1.0
 */
public class SqlProxyService {

    private static final Logger logger = LoggerFactory.getLogger(SqlProxyService.class);

    static final String NO_CONNECTION = "No Database Connection";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String url;
    private final String user;
    private final String password;
    private final WorkerExecutor executor;
    private Connection connection;

    /**
     * @param url JDBC url; null or blank disables the proxy
     */
    public SqlProxyService(Vertx vertx, String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
        this.executor = isEnabled() ? vertx.createSharedWorkerExecutor("shardwarden-sql", 1) : null;
    }

    public boolean isEnabled() {
        return url != null && !url.isBlank();
    }

    public Future<JsonNode> query(String sql) {
        if (!isEnabled()) {
            return Future.failedFuture(NO_CONNECTION);
        }
        return executor.executeBlocking(() -> execute(sql));
    }

    private JsonNode execute(String sql) throws SQLException {
        Connection con = connection();
        try (Statement statement = con.createStatement()) {
            if (statement.execute(sql)) {
                try (ResultSet rs = statement.getResultSet()) {
                    return rows(rs);
                }
            }
            ObjectNode result = objectMapper.createObjectNode();
            result.put("updateCount", statement.getUpdateCount());
            return result;
        } catch (SQLException e) {
            logger.warn("Query failed: {}", e.getMessage());
            if (!con.isValid(1)) {
                closeQuietly();
            }
            throw e;
        }
    }

    private static ArrayNode rows(ResultSet rs) throws SQLException {
        ArrayNode rows = objectMapper.createArrayNode();
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        while (rs.next()) {
            ObjectNode row = rows.addObject();
            for (int i = 1; i <= columns; i++) {
                row.set(meta.getColumnLabel(i), objectMapper.valueToTree(rs.getObject(i)));
            }
        }
        return rows;
    }

    private Connection connection() throws SQLException {
        if (connection == null || connection.isClosed()) {
            logger.info("Opening database connection to {}", url);
            connection = DriverManager.getConnection(url, user, password);
        }
        return connection;
    }

    private void closeQuietly() {
        try {
            if (connection != null) {
                connection.close();
            }
        } catch (SQLException e) {
            logger.debug("Error closing database connection: {}", e.getMessage());
        } finally {
            connection = null;
        }
    }

    public Future<Void> close() {
        if (!isEnabled()) {
            return Future.succeededFuture();
        }
        return executor.<Void>executeBlocking(() -> {
            closeQuietly();
            return null;
        }).eventually(() -> executor.close());
    }
}
