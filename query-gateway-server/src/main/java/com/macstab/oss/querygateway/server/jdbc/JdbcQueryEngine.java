/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.jdbc;

import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;

import com.macstab.oss.querygateway.engine.QueryEngine;
import com.macstab.oss.querygateway.engine.QueryExecutionException;
import com.macstab.oss.querygateway.engine.QuerySession;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens JDBC sessions through {@link DriverManager}.
 *
 * <p>The driver is picked by URL; the ClickHouse driver registers itself from the runtime
 * classpath. No connection is opened until the pool asks for one.
 */
@Slf4j
public final class JdbcQueryEngine implements QueryEngine {

  private final String url;
  private final String username;
  private final String password;
  private final Duration validationTimeout;

  public JdbcQueryEngine(
      @NonNull final String url,
      @NonNull final String username,
      @NonNull final String password,
      @NonNull final Duration validationTimeout) {
    this.url = url;
    this.username = username;
    this.password = password;
    this.validationTimeout = validationTimeout;
  }

  @Override
  public QuerySession openSession() {
    try {
      final var connection = DriverManager.getConnection(url, username, password);
      log.debug("Opened JDBC session to {}", url);
      return new JdbcQuerySession(connection, validationTimeout);
    } catch (final SQLException e) {
      throw new QueryExecutionException(
          "Cannot open session to " + url + ": " + e.getMessage(), e);
    }
  }
}
