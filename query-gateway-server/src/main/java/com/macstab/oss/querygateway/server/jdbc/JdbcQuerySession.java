/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import com.macstab.oss.querygateway.engine.QueryExecutionException;
import com.macstab.oss.querygateway.engine.QueryRows;
import com.macstab.oss.querygateway.engine.QuerySession;

import lombok.extern.slf4j.Slf4j;

/** One JDBC connection. Rows are counted by iterating the result set. */
@Slf4j
final class JdbcQuerySession implements QuerySession {

  private final Connection connection;
  private final int validationTimeoutSeconds;

  JdbcQuerySession(final Connection connection, final Duration validationTimeout) {
    this.connection = connection;
    this.validationTimeoutSeconds = (int) Math.max(1L, validationTimeout.toSeconds());
  }

  @Override
  public QueryRows execute(final String sql) {
    try (var statement = connection.createStatement();
        var resultSet = statement.executeQuery(sql)) {
      long rows = 0L;
      while (resultSet.next()) {
        rows++;
      }
      return new QueryRows(rows);
    } catch (final SQLException e) {
      throw new QueryExecutionException(e.getMessage(), e);
    }
  }

  @Override
  public boolean isValid() {
    try {
      return connection.isValid(validationTimeoutSeconds);
    } catch (final SQLException e) {
      log.debug("Validity probe failed: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (final SQLException e) {
      log.warn("Error closing JDBC session: {}", e.getMessage());
    }
  }
}
