/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.engine;

/** Opens sessions to the backing database. Called at pool construction and on replacement. */
@FunctionalInterface
public interface QueryEngine {

  /**
   * Opens a new session.
   *
   * @return a live session owned by the caller
   * @throws QueryExecutionException if the database cannot be reached
   */
  QuerySession openSession();
}
