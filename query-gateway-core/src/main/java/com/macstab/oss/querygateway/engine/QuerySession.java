/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.engine;

/**
 * One live session to the backing database.
 *
 * <p>Not required to be thread-safe: the connection pool guarantees a session is used by at most
 * one dispatcher worker at a time.
 */
public interface QuerySession extends AutoCloseable {

  /**
   * Executes an opaque SQL string.
   *
   * @param sql query text, passed through unchanged
   * @return result shape
   * @throws QueryExecutionException on any engine failure
   */
  QueryRows execute(String sql);

  /**
   * Probes whether the session is still usable. Used after a failed execution to decide whether
   * the pool must replace it.
   *
   * @return {@code true} if the session can serve further queries
   */
  boolean isValid();

  /** Closes the session. Idempotent, never throws. */
  @Override
  void close();
}
