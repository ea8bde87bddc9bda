/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.server.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.macstab.oss.querygateway.engine.QueryExecutionException;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcQuerySession")
class JdbcQuerySessionTest {

  @Mock private Connection connection;
  @Mock private Statement statement;
  @Mock private ResultSet resultSet;

  private JdbcQuerySession session;

  @BeforeEach
  void setUp() {
    session = new JdbcQuerySession(connection, Duration.ofMillis(200));
  }

  @Test
  @DisplayName("counts result rows and closes statement and result set")
  void execute_CountsRows() throws SQLException {
    // Arrange
    when(connection.createStatement()).thenReturn(statement);
    when(statement.executeQuery("SELECT number FROM numbers(3)")).thenReturn(resultSet);
    when(resultSet.next()).thenReturn(true, true, true, false);

    // Act
    final var rows = session.execute("SELECT number FROM numbers(3)");

    // Assert
    assertThat(rows.rowCount()).isEqualTo(3);
    verify(resultSet).close();
    verify(statement).close();
  }

  @Test
  @DisplayName("wraps SQL errors in QueryExecutionException")
  void execute_WrapsSqlException() throws SQLException {
    // Arrange
    when(connection.createStatement()).thenReturn(statement);
    when(statement.executeQuery("SELEC 1")).thenThrow(new SQLException("Syntax error"));

    // Act & Assert
    assertThatThrownBy(() -> session.execute("SELEC 1"))
        .isInstanceOf(QueryExecutionException.class)
        .hasMessage("Syntax error")
        .hasCauseInstanceOf(SQLException.class);
  }

  @Test
  @DisplayName("probes validity with at least a one-second timeout")
  void isValid_UsesMinimumTimeout() throws SQLException {
    // Arrange
    when(connection.isValid(1)).thenReturn(true);

    // Act & Assert
    assertThat(session.isValid()).isTrue();
  }

  @Test
  @DisplayName("reports a failing probe as invalid")
  void isValid_ProbeFailure() throws SQLException {
    // Arrange
    when(connection.isValid(anyInt())).thenThrow(new SQLException("closed"));

    // Act & Assert
    assertThat(session.isValid()).isFalse();
  }
}
